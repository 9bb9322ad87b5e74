package co.fanki.webready.analysis.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a listener so one run emits a well formed event sequence.
 *
 * <p>Percentages never go down: a lower value is raised to the last one
 * emitted. Exactly one terminal event goes through; anything after it is
 * dropped. A listener that throws is logged and does not break the
 * run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class ProgressTracker {

    private static final Logger LOG = LoggerFactory.getLogger(
            ProgressTracker.class);

    private final ProgressListener listener;

    private int lastPercent;

    private boolean finished;

    ProgressTracker(final ProgressListener theListener) {
        this.listener = theListener == null ? ProgressListener.NONE
                : theListener;
    }

    synchronized void running(final int percent, final String message) {
        emit(ProgressEvent.running(Math.max(percent, lastPercent), message));
    }

    synchronized void completed(final String message) {
        emit(ProgressEvent.completed(message));
    }

    synchronized void failed(final String message) {
        emit(ProgressEvent.failed(lastPercent, message));
    }

    synchronized int lastPercent() {
        return lastPercent;
    }

    private void emit(final ProgressEvent event) {
        if (finished) {
            LOG.debug("Dropping progress event after terminal: {}", event);
            return;
        }
        lastPercent = event.percent();
        finished = event.isTerminal();
        try {
            listener.emit(event);
        } catch (final RuntimeException e) {
            LOG.warn("Progress listener failed on {}: {}", event,
                    e.getMessage());
        }
    }

}
