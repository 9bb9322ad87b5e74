package co.fanki.webready.analysis.domain;

/**
 * Sink for the progress checkpoints of one analysis run.
 *
 * <p>Called synchronously from the orchestrator thread, in emission order.
 * Implementations must not block for long.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@FunctionalInterface
public interface ProgressListener {

    /** Listener that drops every event, for headless runs. */
    ProgressListener NONE = event -> { };

    /**
     * Receives one checkpoint.
     *
     * @param event the checkpoint
     */
    void emit(ProgressEvent event);

}
