package co.fanki.webready.config;

import co.fanki.webready.analysis.domain.AnalysisRequest;
import co.fanki.webready.analysis.domain.SourceFile;
import co.fanki.webready.analysis.domain.ToolkitRegistry;
import co.fanki.webready.config.HealthController.HealthResponse;
import co.fanki.webready.job.application.AnalysisJobService;
import co.fanki.webready.job.domain.AnalysisJob;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link HealthController}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class HealthControllerTest {

    @Test
    void whenCheckingHealth_givenRunningAndFinishedJobs_shouldCountActive() {
        final AnalysisRequest request = new AnalysisRequest("demo",
                List.of(SourceFile.ofText("a.py", "x = 1\n")));
        final AnalysisJob running = AnalysisJob.create(request);
        running.start();
        final AnalysisJob failed = AnalysisJob.create(request);
        failed.fail("ANALYSIS_FAILED", "boom", null);

        final AnalysisJobService jobService = mock(AnalysisJobService.class);
        when(jobService.list()).thenReturn(List.of(running, failed));

        final HealthResponse response = new HealthController(jobService,
                ToolkitRegistry.standard()).health();

        assertEquals("up", response.status());
        assertEquals(1, response.activeJobs());
        assertEquals(List.of("PyQt5", "PyQt6", "PySide2", "PySide6",
                "tkinter", "wx"), response.toolkits());
    }

}
