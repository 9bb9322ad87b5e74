package co.fanki.webready.analysis.domain;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a run and its caller.
 *
 * <p>The orchestrator checks it before each file; a file already being
 * analyzed is finished first.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Creates a fresh token.
     *
     * @return a token not yet cancelled
     */
    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Requests cancellation.
     *
     * @return true if this call cancelled the token, false if it already was
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    /**
     * Checks whether cancellation was requested.
     *
     * @return true once {@link #cancel()} was called
     */
    public boolean isCancelled() {
        return cancelled.get();
    }

}
