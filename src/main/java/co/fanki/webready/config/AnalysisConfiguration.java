package co.fanki.webready.config;

import co.fanki.webready.analysis.domain.AnalysisOrchestrator;
import co.fanki.webready.analysis.domain.AnalysisThresholds;
import co.fanki.webready.analysis.domain.ToolkitRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the analysis engine.
 *
 * <p>The toolkit registry and the thresholds are immutable and shared by
 * every run. Jobs run on a fixed pool of {@code jobs.workers} threads; each
 * run analyzes up to {@code analysis.parallelism} files at once.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class AnalysisConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalysisConfiguration.class);

    /**
     * Provides the registry of known GUI toolkits.
     *
     * @return the standard toolkit registry
     */
    @Bean
    public ToolkitRegistry toolkitRegistry() {
        return ToolkitRegistry.standard();
    }

    /**
     * Provides the classification and suggestion thresholds.
     *
     * @return the standard thresholds
     */
    @Bean
    public AnalysisThresholds analysisThresholds() {
        return AnalysisThresholds.STANDARD;
    }

    /**
     * Creates the analysis orchestrator.
     *
     * @param registry the toolkit registry
     * @param thresholds the thresholds
     * @param parallelism how many files one run analyzes at once
     * @return the orchestrator
     */
    @Bean
    public AnalysisOrchestrator analysisOrchestrator(
            final ToolkitRegistry registry,
            final AnalysisThresholds thresholds,
            @Value("${analysis.parallelism:4}") final int parallelism) {
        LOG.info("Analysis engine ready: toolkits {}, parallelism {}",
                registry.toolkitNames(), parallelism);
        return new AnalysisOrchestrator(registry, thresholds, parallelism);
    }

    /**
     * Creates the executor running analysis jobs.
     *
     * @param workers the number of jobs running at once
     * @return the executor, shut down with the context
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService analysisExecutor(
            @Value("${jobs.workers:2}") final int workers) {
        final AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(workers, runnable -> {
            final Thread thread = new Thread(runnable,
                    "analysis-job-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

}
