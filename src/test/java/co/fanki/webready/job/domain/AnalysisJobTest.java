package co.fanki.webready.job.domain;

import co.fanki.webready.analysis.domain.AnalysisOrchestrator;
import co.fanki.webready.analysis.domain.AnalysisRequest;
import co.fanki.webready.analysis.domain.AnalysisStatus;
import co.fanki.webready.analysis.domain.AnalysisThresholds;
import co.fanki.webready.analysis.domain.ProgressEvent;
import co.fanki.webready.analysis.domain.ProjectAnalysisResult;
import co.fanki.webready.analysis.domain.SourceFile;
import co.fanki.webready.analysis.domain.ToolkitRegistry;
import co.fanki.webready.shared.DomainException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link AnalysisJob}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AnalysisJobTest {

    private static final AnalysisRequest REQUEST = new AnalysisRequest("demo",
            List.of(SourceFile.ofText("calc.py",
                    "def add(a, b):\n    total = a + b\n    return total\n")));

    @Test
    void whenCreating_givenRequest_shouldBePendingAndQueued() {
        final AnalysisJob job = AnalysisJob.create(REQUEST);

        assertNotNull(job.id());
        assertEquals("demo", job.projectName());
        assertEquals(AnalysisStatus.PENDING, job.status());
        assertEquals(0, job.progress());
        assertEquals("Queued", job.message());
        assertFalse(job.isFinished());
        assertTrue(job.result().isEmpty());
        assertEquals(1, job.sources().size());
        assertEquals(ProgressEvent.running(0, "Queued"), job.currentProgress());
    }

    @Test
    void whenCompleting_givenRunningJob_shouldKeepResult() {
        final AnalysisJob job = AnalysisJob.create(REQUEST);
        job.start();

        job.complete(analyze());

        assertEquals(AnalysisStatus.COMPLETED, job.status());
        assertEquals(100, job.progress());
        assertTrue(job.isFinished());
        assertTrue(job.result().isPresent());
        assertNull(job.errorCode());
        assertNotNull(job.finishedAt());
        assertEquals(ProgressEvent.completed("Analysis completed"),
                job.currentProgress());
    }

    @Test
    void whenCompleting_givenPendingJob_shouldThrowDomainException() {
        final AnalysisJob job = AnalysisJob.create(REQUEST);

        assertThrows(DomainException.class, () -> job.complete(analyze()));
    }

    @Test
    void whenStarting_givenRunningJob_shouldThrowDomainException() {
        final AnalysisJob job = AnalysisJob.create(REQUEST);
        job.start();

        assertThrows(DomainException.class, job::start);
    }

    @Test
    void whenRecording_givenLowerPercent_shouldNotGoBack() {
        final AnalysisJob job = AnalysisJob.create(REQUEST);
        job.start();

        assertTrue(job.record(ProgressEvent.running(50, "Analyzed calc.py")));
        assertTrue(job.record(ProgressEvent.running(30, "late")));

        assertEquals(50, job.progress());
        assertEquals("late", job.message());
    }

    @Test
    void whenRecording_givenFinishedJob_shouldIgnoreEvent() {
        final AnalysisJob job = AnalysisJob.create(REQUEST);
        job.start();
        job.fail("ANALYSIS_TIMEOUT", "Analysis timed out after 1s", null);

        assertFalse(job.record(ProgressEvent.running(90, "Saving results")));
        assertEquals("Analysis timed out after 1s", job.message());
    }

    @Test
    void whenFailing_givenFinishedJob_shouldKeepFirstFailure() {
        final AnalysisJob job = AnalysisJob.create(REQUEST);
        job.start();

        assertTrue(job.fail("ANALYSIS_TIMEOUT", "timed out", null));
        assertFalse(job.fail("ANALYSIS_CANCELLED", "cancelled", analyze()));

        assertEquals(AnalysisStatus.FAILED, job.status());
        assertEquals("ANALYSIS_TIMEOUT", job.errorCode());
        assertTrue(job.result().isEmpty());
        assertEquals(ProgressEvent.failed(0, "timed out"),
                job.currentProgress());
    }

    @Test
    void whenFailing_givenPartialResult_shouldKeepIt() {
        final AnalysisJob job = AnalysisJob.create(REQUEST);
        job.start();

        job.fail("ANALYSIS_CANCELLED", "cancelled", analyze());

        assertTrue(job.result().isPresent());
        assertEquals("ANALYSIS_CANCELLED", job.errorCode());
    }

    @Test
    void whenFailing_givenNullMessage_shouldFallBackToCode() {
        final AnalysisJob job = AnalysisJob.create(REQUEST);

        job.fail("ANALYSIS_FAILED", null, null);

        assertEquals("ANALYSIS_FAILED", job.message());
        assertEquals(ProgressEvent.FAILED, job.currentProgress().status());
    }

    @Test
    void whenCancelling_givenRunningJob_shouldCancelTokenOnce() {
        final AnalysisJob job = AnalysisJob.create(REQUEST);
        job.start();

        assertTrue(job.requestCancellation());
        assertFalse(job.requestCancellation());
        assertTrue(job.cancellation().isCancelled());
    }

    @Test
    void whenCancelling_givenFinishedJob_shouldThrowDomainException() {
        final AnalysisJob job = AnalysisJob.create(REQUEST);
        job.start();
        job.complete(analyze());

        final DomainException ex = assertThrows(DomainException.class,
                job::requestCancellation);
        assertEquals("JOB_ALREADY_FINISHED", ex.getErrorCode());
    }

    private static ProjectAnalysisResult analyze() {
        return new AnalysisOrchestrator(ToolkitRegistry.standard(),
                AnalysisThresholds.STANDARD, 1).analyze(REQUEST);
    }

}
