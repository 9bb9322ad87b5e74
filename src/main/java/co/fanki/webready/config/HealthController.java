package co.fanki.webready.config;

import co.fanki.webready.analysis.domain.ToolkitRegistry;
import co.fanki.webready.job.application.AnalysisJobService;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Health check endpoint.
 *
 * <p>Besides the status, reports how many jobs are still in flight and the
 * GUI toolkits the analyzer recognizes.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthController {

    private final AnalysisJobService jobService;

    private final ToolkitRegistry toolkitRegistry;

    /**
     * Creates a new HealthController.
     *
     * @param theJobService the job service
     * @param theToolkitRegistry the toolkit registry
     */
    public HealthController(final AnalysisJobService theJobService,
            final ToolkitRegistry theToolkitRegistry) {
        this.jobService = theJobService;
        this.toolkitRegistry = theToolkitRegistry;
    }

    /**
     * Returns health status.
     *
     * @return "up" with the active job count and supported toolkits
     */
    @GetMapping("/health")
    public HealthResponse health() {
        final long active = jobService.list().stream()
                .filter(job -> !job.isFinished())
                .count();
        return new HealthResponse("up", active,
                List.copyOf(toolkitRegistry.toolkitNames()));
    }

    /**
     * Health status body.
     */
    public record HealthResponse(
            String status,
            long activeJobs,
            List<String> toolkits
    ) {}

}
