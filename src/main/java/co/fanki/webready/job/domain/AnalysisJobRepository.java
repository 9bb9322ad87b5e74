package co.fanki.webready.job.domain;

import co.fanki.webready.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of analysis jobs.
 *
 * <p>Jobs are kept in the process only. Once more than {@code retention}
 * finished jobs are stored, the oldest finished ones are evicted on the
 * next save; jobs still pending or running are never evicted.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class AnalysisJobRepository {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalysisJobRepository.class);

    private final Map<String, AnalysisJob> jobs = new ConcurrentHashMap<>();

    private final int retention;

    /**
     * Creates a new AnalysisJobRepository.
     *
     * @param theRetention how many finished jobs are kept, at least 1
     */
    public AnalysisJobRepository(
            @Value("${jobs.retention:100}") final int theRetention) {
        Preconditions.require(theRetention >= 1,
                "Job retention must be at least 1");
        this.retention = theRetention;
    }

    /**
     * Saves a new job.
     *
     * @param job the job to save, never null
     */
    public void save(final AnalysisJob job) {
        Preconditions.requireNonNull(job, "Job is required");
        jobs.put(job.id(), job);
        evictFinished();
    }

    /**
     * Finds a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    public Optional<AnalysisJob> findById(final String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobs.get(jobId));
    }

    /**
     * Finds all jobs, newest first.
     *
     * @return the jobs
     */
    public List<AnalysisJob> findAll() {
        final List<AnalysisJob> result = new ArrayList<>(jobs.values());
        result.sort(Comparator.comparing(AnalysisJob::createdAt).reversed());
        return result;
    }

    private void evictFinished() {
        final List<AnalysisJob> finished = new ArrayList<>();
        for (final AnalysisJob job : jobs.values()) {
            if (job.isFinished()) {
                finished.add(job);
            }
        }
        if (finished.size() <= retention) {
            return;
        }
        finished.sort(Comparator.comparing(AnalysisJob::finishedAt));
        for (int i = 0; i < finished.size() - retention; i++) {
            final AnalysisJob evicted = finished.get(i);
            jobs.remove(evicted.id());
            LOG.debug("Evicted finished job {} ({})", evicted.id(),
                    evicted.projectName());
        }
    }

}
