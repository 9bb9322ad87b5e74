package co.fanki.webready.job.application;

import co.fanki.webready.analysis.domain.AnalysisCancelledException;
import co.fanki.webready.analysis.domain.AnalysisOrchestrator;
import co.fanki.webready.analysis.domain.AnalysisRequest;
import co.fanki.webready.analysis.domain.EmptyInputException;
import co.fanki.webready.analysis.domain.ProgressListener;
import co.fanki.webready.analysis.domain.ProjectAnalysisResult;
import co.fanki.webready.analysis.domain.SourceFile;
import co.fanki.webready.job.domain.AnalysisJob;
import co.fanki.webready.job.domain.AnalysisJobRepository;
import co.fanki.webready.shared.DomainException;
import co.fanki.webready.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Application service for analysis jobs.
 *
 * <p>A submitted job runs asynchronously on the analysis executor. Its
 * progress checkpoints are recorded on the job and fanned out to SSE
 * subscribers. A run exceeding the configured timeout is cancelled and the
 * job fails with {@code ANALYSIS_TIMEOUT}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class AnalysisJobService {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalysisJobService.class);

    private final AnalysisOrchestrator orchestrator;

    private final AnalysisJobRepository jobRepository;

    private final ProgressBroadcaster broadcaster;

    private final Executor executor;

    private final long timeoutSeconds;

    /**
     * Creates a new AnalysisJobService.
     *
     * @param theOrchestrator the analysis engine
     * @param theJobRepository the job registry
     * @param theBroadcaster the progress fan-out
     * @param theExecutor runs the analyses
     * @param theTimeoutSeconds the maximum duration of one analysis
     */
    public AnalysisJobService(final AnalysisOrchestrator theOrchestrator,
            final AnalysisJobRepository theJobRepository,
            final ProgressBroadcaster theBroadcaster,
            @Qualifier("analysisExecutor") final Executor theExecutor,
            @Value("${analysis.timeout-seconds:600}")
            final long theTimeoutSeconds) {
        Preconditions.require(theTimeoutSeconds >= 1,
                "Analysis timeout must be at least one second");
        this.orchestrator = theOrchestrator;
        this.jobRepository = theJobRepository;
        this.broadcaster = theBroadcaster;
        this.executor = theExecutor;
        this.timeoutSeconds = theTimeoutSeconds;
    }

    /**
     * Submits a project for analysis.
     *
     * @param projectName the project name
     * @param files the source files of the project
     * @return the pending job
     * @throws EmptyInputException if there are no files
     * @throws DomainException if two files share a path
     */
    public AnalysisJob submit(final String projectName,
            final List<SourceFile> files) {
        final AnalysisRequest request = new AnalysisRequest(projectName, files);
        if (request.isEmpty()) {
            throw new EmptyInputException(projectName);
        }

        final AnalysisJob job = AnalysisJob.create(request);
        jobRepository.save(job);
        LOG.info("Submitted job {} for project {} with {} files", job.id(),
                projectName, files.size());

        CompletableFuture.supplyAsync(() -> run(job), executor)
                .orTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .whenComplete((result, error) -> finish(job, result, error));
        return job;
    }

    /**
     * Finds a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    public Optional<AnalysisJob> find(final String jobId) {
        return jobRepository.findById(jobId);
    }

    /**
     * Finds a job by ID, throwing if not found.
     *
     * @param jobId the job ID
     * @return the job
     * @throws DomainException if the job is not found
     */
    public AnalysisJob getById(final String jobId) {
        return find(jobId)
                .orElseThrow(() -> new DomainException(
                        "Job not found: " + jobId, "JOB_NOT_FOUND"));
    }

    /**
     * Returns the result of a completed job.
     *
     * @param jobId the job ID
     * @return the project result
     * @throws DomainException if the job is not found or not completed
     */
    public ProjectAnalysisResult getResult(final String jobId) {
        final AnalysisJob job = getById(jobId);
        if (!job.isFinished() || job.errorCode() != null) {
            throw new DomainException("Job " + jobId + " has no result, it is "
                    + job.status(), "JOB_NOT_COMPLETED");
        }
        return job.result().orElseThrow();
    }

    /**
     * Lists all jobs, newest first.
     *
     * @return the jobs
     */
    public List<AnalysisJob> list() {
        return jobRepository.findAll();
    }

    /**
     * Requests cancellation of a job.
     *
     * <p>The analysis stops before its next file and the job fails with
     * {@code ANALYSIS_CANCELLED}.</p>
     *
     * @param jobId the job ID
     * @return the job
     * @throws DomainException if the job is not found or already finished
     */
    public AnalysisJob cancel(final String jobId) {
        final AnalysisJob job = getById(jobId);
        if (job.requestCancellation()) {
            LOG.info("Cancellation requested for job {}", jobId);
        }
        return job;
    }

    /**
     * Opens a progress stream for a job.
     *
     * @param jobId the job ID
     * @return the SSE emitter
     * @throws DomainException if the job is not found
     */
    public SseEmitter subscribe(final String jobId) {
        final AnalysisJob job = getById(jobId);
        final SseEmitter emitter = broadcaster.subscribe(jobId,
                job.currentProgress());
        if (job.isFinished()) {
            broadcaster.complete(jobId);
        }
        return emitter;
    }

    private ProjectAnalysisResult run(final AnalysisJob job) {
        job.start();
        final ProgressListener listener = event -> {
            if (!event.isTerminal() && job.record(event)) {
                broadcaster.broadcast(job.id(), event);
            }
        };
        return orchestrator.analyze(job.request(), listener,
                job.cancellation());
    }

    /**
     * Settles the job, then publishes its terminal event.
     *
     * <p>The terminal event of the run is held back until here, so a
     * subscriber that sees {@code completed} can always fetch the
     * result.</p>
     */
    private void finish(final AnalysisJob job,
            final ProjectAnalysisResult result, final Throwable error) {
        if (error == null) {
            job.complete(result);
            broadcaster.broadcast(job.id(), job.currentProgress());
            broadcaster.complete(job.id());
            LOG.info("Job {} completed", job.id());
            return;
        }

        final Throwable cause = error instanceof CompletionException
                && error.getCause() != null ? error.getCause() : error;

        final boolean failed;
        if (cause instanceof TimeoutException) {
            job.cancellation().cancel();
            failed = job.fail("ANALYSIS_TIMEOUT", "Analysis timed out after "
                    + timeoutSeconds + "s", null);
            LOG.warn("Job {} timed out after {}s", job.id(), timeoutSeconds);
        } else if (cause instanceof AnalysisCancelledException cancelled) {
            failed = job.fail(cancelled.getErrorCode(), cancelled.getMessage(),
                    cancelled.partialResult());
            LOG.info("Job {} cancelled", job.id());
        } else if (cause instanceof DomainException domain) {
            failed = job.fail(domain.getErrorCode(), domain.getMessage(), null);
            LOG.warn("Job {} failed: {}", job.id(), domain.getMessage());
        } else {
            failed = job.fail("ANALYSIS_FAILED",
                    String.valueOf(cause.getMessage()), null);
            LOG.error("Job {} failed", job.id(), cause);
        }
        if (failed) {
            broadcaster.broadcast(job.id(), job.currentProgress());
        }
        broadcaster.complete(job.id());
    }

}
