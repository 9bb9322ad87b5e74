package co.fanki.webready.job.application;

import co.fanki.webready.analysis.domain.AnalysisCancelledException;
import co.fanki.webready.analysis.domain.AnalysisOrchestrator;
import co.fanki.webready.analysis.domain.AnalysisRequest;
import co.fanki.webready.analysis.domain.AnalysisStatus;
import co.fanki.webready.analysis.domain.AnalysisThresholds;
import co.fanki.webready.analysis.domain.CancellationToken;
import co.fanki.webready.analysis.domain.EmptyInputException;
import co.fanki.webready.analysis.domain.ProgressEvent;
import co.fanki.webready.analysis.domain.ProgressListener;
import co.fanki.webready.analysis.domain.ProjectAnalysisResult;
import co.fanki.webready.analysis.domain.SourceFile;
import co.fanki.webready.analysis.domain.ToolkitRegistry;
import co.fanki.webready.job.domain.AnalysisJob;
import co.fanki.webready.job.domain.AnalysisJobRepository;
import co.fanki.webready.shared.DomainException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.anyString;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link AnalysisJobService}.
 *
 * <p>Runs jobs on the calling thread so each submission has finished by
 * the time {@code submit} returns, except for the timeout tests which use
 * an executor that never runs the analysis.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AnalysisJobServiceTest {

    private static final Executor DIRECT = Runnable::run;

    private static final Executor NEVER = task -> { };

    private static final List<SourceFile> FILES = List.of(
            SourceFile.ofText("calc.py",
                    "def add(a, b):\n    total = a + b\n    return total\n"),
            SourceFile.ofText("view.py",
                    "import tkinter as tk\n\n"
                    + "def build():\n    root = tk.Tk()\n    root.mainloop()\n"));

    private AnalysisOrchestrator orchestrator;
    private AnalysisJobRepository repository;
    private ProgressBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        orchestrator = new AnalysisOrchestrator(ToolkitRegistry.standard(),
                AnalysisThresholds.STANDARD, 1);
        repository = new AnalysisJobRepository(10);
        broadcaster = new ProgressBroadcaster(60_000L);
    }

    @Test
    void whenSubmitting_givenValidProject_shouldCompleteJob() {
        final AnalysisJobService service = service(DIRECT, 600);

        final AnalysisJob job = service.submit("demo", FILES);

        assertEquals(AnalysisStatus.COMPLETED, job.status());
        assertEquals(100, job.progress());
        final ProjectAnalysisResult result = service.getResult(job.id());
        assertEquals(2, result.totalFiles());
        assertEquals(List.of(job), service.list());
    }

    @Test
    void whenSubmitting_givenNoFiles_shouldThrowEmptyInput() {
        final AnalysisJobService service = service(DIRECT, 600);

        assertThrows(EmptyInputException.class,
                () -> service.submit("demo", List.of()));
        assertTrue(service.list().isEmpty());
    }

    @Test
    void whenSubmitting_givenDuplicatePaths_shouldThrowDomainException() {
        final AnalysisJobService service = service(DIRECT, 600);
        final List<SourceFile> files = List.of(
                SourceFile.ofText("a.py", "x = 1"),
                SourceFile.ofText("a.py", "y = 1"));

        final DomainException ex = assertThrows(DomainException.class,
                () -> service.submit("demo", files));
        assertEquals("DUPLICATE_PATH", ex.getErrorCode());
    }

    @Test
    void whenSubmitting_givenRun_shouldBroadcastProgressAndClose() {
        broadcaster = createMock(ProgressBroadcaster.class);
        broadcaster.broadcast(anyString(), anyObject(ProgressEvent.class));
        expectLastCall().atLeastOnce();
        broadcaster.complete(anyString());
        expectLastCall().once();
        replay(broadcaster);

        service(DIRECT, 600).submit("demo", FILES);

        verify(broadcaster);
    }

    @Test
    void whenSubmitting_givenCompletedEvent_shouldHaveResultAvailable() {
        final AtomicReference<AnalysisJobService> service =
                new AtomicReference<>();
        final List<ProgressEvent> terminal = new ArrayList<>();
        final List<Integer> filesSeen = new ArrayList<>();
        broadcaster = new ProgressBroadcaster(60_000L) {
            @Override
            public void broadcast(final String jobId,
                    final ProgressEvent event) {
                if (event.isTerminal()) {
                    terminal.add(event);
                    filesSeen.add(service.get().getResult(jobId)
                            .totalFiles());
                }
                super.broadcast(jobId, event);
            }
        };
        service.set(service(DIRECT, 600));

        service.get().submit("demo", FILES);

        assertEquals(1, terminal.size());
        assertEquals(ProgressEvent.COMPLETED, terminal.get(0).status());
        assertEquals(100, terminal.get(0).percent());
        assertEquals(List.of(2), filesSeen);
    }

    @Test
    void whenSubmitting_givenCancelledRun_shouldBroadcastFailedAfterSettling() {
        orchestrator = createMock(AnalysisOrchestrator.class);
        expect(orchestrator.analyze(anyObject(AnalysisRequest.class),
                anyObject(ProgressListener.class),
                anyObject(CancellationToken.class)))
                .andThrow(new AnalysisCancelledException("stopped", null));
        replay(orchestrator);
        final List<AnalysisStatus> statusAtEvent = new ArrayList<>();
        final AtomicReference<AnalysisJobService> service =
                new AtomicReference<>();
        broadcaster = new ProgressBroadcaster(60_000L) {
            @Override
            public void broadcast(final String jobId,
                    final ProgressEvent event) {
                if (ProgressEvent.FAILED.equals(event.status())) {
                    statusAtEvent.add(service.get().getById(jobId).status());
                }
                super.broadcast(jobId, event);
            }
        };
        service.set(service(DIRECT, 600));

        service.get().submit("demo", FILES);

        assertEquals(List.of(AnalysisStatus.FAILED), statusAtEvent);
        verify(orchestrator);
    }

    @Test
    void whenSubmitting_givenEngineFailure_shouldFailJobWithItsCode() {
        orchestrator = createMock(AnalysisOrchestrator.class);
        expect(orchestrator.analyze(anyObject(AnalysisRequest.class),
                anyObject(ProgressListener.class),
                anyObject(CancellationToken.class)))
                .andThrow(new DomainException("Disk on fire", "ANALYSIS_FAILED"));
        replay(orchestrator);

        final AnalysisJobService service = service(DIRECT, 600);
        final AnalysisJob job = service.submit("demo", FILES);

        assertEquals(AnalysisStatus.FAILED, job.status());
        assertEquals("ANALYSIS_FAILED", job.errorCode());
        assertEquals("Disk on fire", job.errorMessage());
        final DomainException ex = assertThrows(DomainException.class,
                () -> service.getResult(job.id()));
        assertEquals("JOB_NOT_COMPLETED", ex.getErrorCode());
        verify(orchestrator);
    }

    @Test
    void whenSubmitting_givenUnexpectedError_shouldFailJobAsAnalysisFailed() {
        orchestrator = createMock(AnalysisOrchestrator.class);
        expect(orchestrator.analyze(anyObject(AnalysisRequest.class),
                anyObject(ProgressListener.class),
                anyObject(CancellationToken.class)))
                .andThrow(new IllegalStateException("unexpected"));
        replay(orchestrator);

        final AnalysisJob job = service(DIRECT, 600).submit("demo", FILES);

        assertEquals("ANALYSIS_FAILED", job.errorCode());
        assertEquals("unexpected", job.errorMessage());
        verify(orchestrator);
    }

    @Test
    void whenSubmitting_givenCancelledRun_shouldKeepPartialResult() {
        final ProjectAnalysisResult partial = new AnalysisOrchestrator(
                ToolkitRegistry.standard(), AnalysisThresholds.STANDARD, 1)
                .analyze(new AnalysisRequest("demo", FILES.subList(0, 1)));
        orchestrator = createMock(AnalysisOrchestrator.class);
        expect(orchestrator.analyze(anyObject(AnalysisRequest.class),
                anyObject(ProgressListener.class),
                anyObject(CancellationToken.class)))
                .andThrow(new AnalysisCancelledException("stopped", partial));
        replay(orchestrator);

        final AnalysisJob job = service(DIRECT, 600).submit("demo", FILES);

        assertEquals(AnalysisStatus.FAILED, job.status());
        assertEquals(AnalysisCancelledException.CODE, job.errorCode());
        assertEquals(partial, job.result().orElseThrow());
        verify(orchestrator);
    }

    @Test
    void whenSubmitting_givenRunExceedingTimeout_shouldFailWithTimeout()
            throws Exception {
        final AnalysisJobService service = service(NEVER, 1);

        final AnalysisJob job = service.submit("demo", FILES);

        final long deadline = System.currentTimeMillis() + 10_000;
        while (!job.isFinished() && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertEquals(AnalysisStatus.FAILED, job.status());
        assertEquals("ANALYSIS_TIMEOUT", job.errorCode());
        assertEquals("Analysis timed out after 1s", job.errorMessage());
        assertTrue(job.cancellation().isCancelled());
    }

    @Test
    void whenCancelling_givenQueuedJob_shouldRequestCancellation() {
        final AnalysisJobService service = service(NEVER, 600);
        final AnalysisJob job = service.submit("demo", FILES);

        final AnalysisJob cancelled = service.cancel(job.id());

        assertTrue(cancelled.cancellation().isCancelled());
        assertEquals(job, service.cancel(job.id()));
    }

    @Test
    void whenCancelling_givenCompletedJob_shouldThrowDomainException() {
        final AnalysisJobService service = service(DIRECT, 600);
        final AnalysisJob job = service.submit("demo", FILES);

        final DomainException ex = assertThrows(DomainException.class,
                () -> service.cancel(job.id()));
        assertEquals("JOB_ALREADY_FINISHED", ex.getErrorCode());
    }

    @Test
    void whenGettingJob_givenUnknownId_shouldThrowNotFound() {
        final AnalysisJobService service = service(DIRECT, 600);

        final DomainException ex = assertThrows(DomainException.class,
                () -> service.getById("nope"));
        assertEquals("JOB_NOT_FOUND", ex.getErrorCode());
        assertTrue(service.find("nope").isEmpty());
    }

    @Test
    void whenGettingResult_givenQueuedJob_shouldThrowNotCompleted() {
        final AnalysisJobService service = service(NEVER, 600);
        final AnalysisJob job = service.submit("demo", FILES);

        final DomainException ex = assertThrows(DomainException.class,
                () -> service.getResult(job.id()));
        assertEquals("JOB_NOT_COMPLETED", ex.getErrorCode());
    }

    @Test
    void whenSubscribing_givenFinishedJob_shouldNotKeepSubscriber() {
        final AnalysisJobService service = service(DIRECT, 600);
        final AnalysisJob job = service.submit("demo", FILES);

        assertNotNull(service.subscribe(job.id()));
        assertEquals(0, broadcaster.subscriberCount(job.id()));
    }

    @Test
    void whenSubscribing_givenQueuedJob_shouldKeepSubscriber() {
        final AnalysisJobService service = service(NEVER, 600);
        final AnalysisJob job = service.submit("demo", FILES);

        service.subscribe(job.id());

        assertEquals(1, broadcaster.subscriberCount(job.id()));
    }

    @Test
    void whenCreating_givenZeroTimeout_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> service(DIRECT, 0));
    }

    private AnalysisJobService service(final Executor executor,
            final long timeoutSeconds) {
        return new AnalysisJobService(orchestrator, repository, broadcaster,
                executor, timeoutSeconds);
    }

}
