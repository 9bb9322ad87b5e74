package co.fanki.webready.analysis.domain;

import co.fanki.webready.shared.Preconditions;

/**
 * A progress checkpoint of one analysis run.
 *
 * @param percent the progress, in [0, 100]
 * @param status the status token: running, completed or failed
 * @param message a human readable message
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ProgressEvent(
        int percent,
        String status,
        String message
) {

    /** Status token of an in-flight checkpoint. */
    public static final String RUNNING = "running";

    /** Status token of the final successful checkpoint. */
    public static final String COMPLETED = "completed";

    /** Status token of the final failed checkpoint. */
    public static final String FAILED = "failed";

    /**
     * Compact constructor, validates the percent and the status token.
     */
    public ProgressEvent {
        Preconditions.require(percent >= 0 && percent <= 100,
                "Percent must be in [0, 100]");
        Preconditions.require(RUNNING.equals(status)
                || COMPLETED.equals(status) || FAILED.equals(status),
                "Unknown progress status: " + status);
        Preconditions.requireNonNull(message, "Message is required");
    }

    /**
     * Creates a running checkpoint.
     *
     * @param percent the progress
     * @param message the message
     * @return the event
     */
    public static ProgressEvent running(final int percent, final String message) {
        return new ProgressEvent(percent, RUNNING, message);
    }

    /**
     * Creates the completed checkpoint at 100%.
     *
     * @param message the message
     * @return the event
     */
    public static ProgressEvent completed(final String message) {
        return new ProgressEvent(100, COMPLETED, message);
    }

    /**
     * Creates a failed checkpoint.
     *
     * @param percent the progress reached when the run failed
     * @param message the failure reason
     * @return the event
     */
    public static ProgressEvent failed(final int percent, final String message) {
        return new ProgressEvent(percent, FAILED, message);
    }

    /**
     * Checks whether this is the last event of a run.
     *
     * @return true for completed or failed events
     */
    public boolean isTerminal() {
        return !RUNNING.equals(status);
    }

}
