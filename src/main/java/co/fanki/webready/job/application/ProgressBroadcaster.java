package co.fanki.webready.job.application;

import co.fanki.webready.analysis.domain.ProgressEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans the progress events of a job out to its SSE subscribers.
 *
 * <p>Each subscriber gets the job's current checkpoint on subscription and
 * every later checkpoint as a {@code progress} event with the JSON of a
 * {@link ProgressEvent}. A terminal checkpoint completes every emitter of
 * the job.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ProgressBroadcaster {

    private static final Logger LOG = LoggerFactory.getLogger(
            ProgressBroadcaster.class);

    /** Name of the SSE event carrying a checkpoint. */
    static final String EVENT_NAME = "progress";

    private final Map<String, List<SseEmitter>> emitters =
            new ConcurrentHashMap<>();

    private final long timeoutMs;

    /**
     * Creates a new ProgressBroadcaster.
     *
     * @param theTimeoutMs how long an emitter stays open, in milliseconds
     */
    public ProgressBroadcaster(
            @Value("${jobs.sse-timeout-ms:1800000}") final long theTimeoutMs) {
        this.timeoutMs = theTimeoutMs;
    }

    /**
     * Opens an SSE stream for a job.
     *
     * @param jobId the job to follow
     * @param current the job's current checkpoint, sent right away
     * @return the emitter, already completed when the job has finished
     */
    public SseEmitter subscribe(final String jobId,
            final ProgressEvent current) {
        final SseEmitter emitter = new SseEmitter(timeoutMs);

        if (!send(jobId, emitter, current)) {
            return emitter;
        }
        if (current.isTerminal()) {
            emitter.complete();
            return emitter;
        }

        final List<SseEmitter> subscribers = emitters.computeIfAbsent(jobId,
                id -> new CopyOnWriteArrayList<>());
        subscribers.add(emitter);

        emitter.onCompletion(() -> remove(jobId, emitter));
        emitter.onTimeout(() -> {
            LOG.debug("SSE emitter timed out for job {}", jobId);
            remove(jobId, emitter);
        });
        emitter.onError(ex -> {
            LOG.debug("SSE emitter error for job {}: {}", jobId,
                    ex.getMessage());
            remove(jobId, emitter);
        });

        LOG.info("SSE subscriber added for job {} (timeout={}ms)", jobId,
                timeoutMs);
        return emitter;
    }

    /**
     * Sends a checkpoint to every subscriber of a job.
     *
     * @param jobId the job
     * @param event the checkpoint
     */
    public void broadcast(final String jobId, final ProgressEvent event) {
        final List<SseEmitter> subscribers = emitters.get(jobId);
        if (subscribers == null) {
            return;
        }
        for (final SseEmitter emitter : subscribers) {
            send(jobId, emitter, event);
        }
        if (event.isTerminal()) {
            complete(jobId);
        }
    }

    /**
     * Closes every stream of a job.
     *
     * @param jobId the job
     */
    public void complete(final String jobId) {
        final List<SseEmitter> subscribers = emitters.remove(jobId);
        if (subscribers == null) {
            return;
        }
        for (final SseEmitter emitter : subscribers) {
            emitter.complete();
        }
        LOG.debug("Closed {} SSE subscribers of job {}", subscribers.size(),
                jobId);
    }

    /**
     * Returns the number of open streams of a job.
     *
     * @param jobId the job
     * @return the subscriber count
     */
    public int subscriberCount(final String jobId) {
        final List<SseEmitter> subscribers = emitters.get(jobId);
        return subscribers == null ? 0 : subscribers.size();
    }

    private boolean send(final String jobId, final SseEmitter emitter,
            final ProgressEvent event) {
        try {
            emitter.send(SseEmitter.event()
                    .name(EVENT_NAME)
                    .data(event, MediaType.APPLICATION_JSON));
            return true;
        } catch (final IOException | IllegalStateException e) {
            LOG.debug("Failed to send progress of job {}: {}", jobId,
                    e.getMessage());
            remove(jobId, emitter);
            return false;
        }
    }

    private void remove(final String jobId, final SseEmitter emitter) {
        emitters.computeIfPresent(jobId, (id, subscribers) -> {
            subscribers.remove(emitter);
            return subscribers.isEmpty() ? null : subscribers;
        });
    }

}
