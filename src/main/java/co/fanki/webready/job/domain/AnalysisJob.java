package co.fanki.webready.job.domain;

import co.fanki.webready.analysis.domain.AnalysisRequest;
import co.fanki.webready.analysis.domain.AnalysisStateMachine;
import co.fanki.webready.analysis.domain.AnalysisStatus;
import co.fanki.webready.analysis.domain.CancellationToken;
import co.fanki.webready.analysis.domain.ProgressEvent;
import co.fanki.webready.analysis.domain.ProjectAnalysisResult;
import co.fanki.webready.analysis.domain.SourceFile;
import co.fanki.webready.shared.DomainException;
import co.fanki.webready.shared.Preconditions;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Aggregate root representing one submitted analysis.
 *
 * <p>A job is written by the worker running its analysis and read by the
 * REST layer, so every accessor and mutator is synchronized. Status changes
 * go through {@link AnalysisStateMachine}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class AnalysisJob {

    private final String id;
    private final AnalysisRequest request;
    private final CancellationToken cancellation;
    private AnalysisStatus status;
    private int progress;
    private String message;
    private ProjectAnalysisResult result;
    private String errorCode;
    private String errorMessage;
    private final Instant createdAt;
    private Instant updatedAt;
    private Instant finishedAt;

    private AnalysisJob(final String theId, final AnalysisRequest theRequest) {
        this.id = Preconditions.requireNonBlank(theId, "Job ID is required");
        this.request = Preconditions.requireNonNull(theRequest,
                "Analysis request is required");
        this.cancellation = CancellationToken.create();
        this.status = AnalysisStatus.PENDING;
        this.progress = 0;
        this.message = "Queued";
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }

    /**
     * Creates a new pending job.
     *
     * @param request the analysis to run, never null
     * @return a new AnalysisJob instance
     */
    public static AnalysisJob create(final AnalysisRequest request) {
        return new AnalysisJob(UUID.randomUUID().toString(), request);
    }

    /**
     * Marks the job as running.
     *
     * @throws DomainException if the job is not pending
     */
    public synchronized void start() {
        status = AnalysisStateMachine.transition(status,
                AnalysisStatus.RUNNING);
        message = "Started";
        updatedAt = Instant.now();
    }

    /**
     * Records a progress checkpoint.
     *
     * <p>Checkpoints reaching a finished job are ignored. The terminal
     * checkpoints of a run only update the progress; the status changes
     * through {@link #complete} or {@link #fail}.</p>
     *
     * @param event the checkpoint, never null
     * @return true if the checkpoint was recorded
     */
    public synchronized boolean record(final ProgressEvent event) {
        Preconditions.requireNonNull(event, "Progress event is required");
        if (status.isTerminal()) {
            return false;
        }
        progress = Math.max(progress, event.percent());
        message = event.message();
        updatedAt = Instant.now();
        return true;
    }

    /**
     * Marks the job as completed with its result.
     *
     * @param theResult the project result, never null
     * @throws DomainException if the job is not running
     */
    public synchronized void complete(final ProjectAnalysisResult theResult) {
        Preconditions.requireNonNull(theResult, "Result is required");
        status = AnalysisStateMachine.transition(status,
                AnalysisStatus.COMPLETED);
        result = theResult;
        progress = 100;
        message = "Analysis completed";
        finish();
    }

    /**
     * Marks the job as failed.
     *
     * <p>Failing an already finished job does nothing: a timed out job may
     * still see its worker fail later.</p>
     *
     * @param theErrorCode the error code, never blank
     * @param theErrorMessage the reason, never null
     * @param partialResult what was analyzed before the failure, may be null
     * @return true if this call failed the job
     */
    public synchronized boolean fail(final String theErrorCode,
            final String theErrorMessage,
            final ProjectAnalysisResult partialResult) {
        Preconditions.requireNonBlank(theErrorCode, "Error code is required");
        if (status.isTerminal()) {
            return false;
        }
        status = AnalysisStateMachine.transition(status,
                AnalysisStatus.FAILED);
        errorCode = theErrorCode;
        errorMessage = theErrorMessage;
        message = theErrorMessage == null ? theErrorCode : theErrorMessage;
        result = partialResult;
        finish();
        return true;
    }

    /**
     * Requests cancellation of the running analysis.
     *
     * @return true if this call requested it, false if it was already
     *     requested
     * @throws DomainException if the job already finished
     */
    public synchronized boolean requestCancellation() {
        if (status.isTerminal()) {
            throw new DomainException("Job " + id + " already finished as "
                    + status, "JOB_ALREADY_FINISHED");
        }
        updatedAt = Instant.now();
        return cancellation.cancel();
    }

    private void finish() {
        updatedAt = Instant.now();
        finishedAt = updatedAt;
    }

    /**
     * Returns the current checkpoint of the job.
     *
     * @return the checkpoint matching the job status
     */
    public synchronized ProgressEvent currentProgress() {
        return switch (status) {
            case COMPLETED -> ProgressEvent.completed(message);
            case FAILED -> ProgressEvent.failed(progress, message);
            default -> ProgressEvent.running(progress, message);
        };
    }

    public String id() {
        return id;
    }

    public String projectName() {
        return request.projectName();
    }

    public AnalysisRequest request() {
        return request;
    }

    /**
     * Returns the submitted sources, used by exports that need the code.
     *
     * @return the source files, never null
     */
    public List<SourceFile> sources() {
        return request.files();
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    public synchronized AnalysisStatus status() {
        return status;
    }

    public synchronized int progress() {
        return progress;
    }

    public synchronized String message() {
        return message;
    }

    /**
     * Returns the result, partial when the job failed after analyzing some
     * files.
     *
     * @return the result if any
     */
    public synchronized Optional<ProjectAnalysisResult> result() {
        return Optional.ofNullable(result);
    }

    public synchronized String errorCode() {
        return errorCode;
    }

    public synchronized String errorMessage() {
        return errorMessage;
    }

    public synchronized boolean isFinished() {
        return status.isTerminal();
    }

    public Instant createdAt() {
        return createdAt;
    }

    public synchronized Instant updatedAt() {
        return updatedAt;
    }

    public synchronized Instant finishedAt() {
        return finishedAt;
    }

}
