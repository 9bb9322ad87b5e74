package co.fanki.webready.analysis.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link ProgressTracker}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ProgressTrackerTest {

    @Test
    void whenEmitting_givenLowerPercent_shouldKeepTheHighest() {
        final List<ProgressEvent> events = new ArrayList<>();
        final ProgressTracker tracker = new ProgressTracker(events::add);

        tracker.running(40, "a");
        tracker.running(20, "b");

        assertEquals(40, events.get(1).percent());
        assertEquals("b", events.get(1).message());
        assertEquals(40, tracker.lastPercent());
    }

    @Test
    void whenEmitting_givenEventsAfterTerminal_shouldDropThem() {
        final List<ProgressEvent> events = new ArrayList<>();
        final ProgressTracker tracker = new ProgressTracker(events::add);

        tracker.running(10, "start");
        tracker.completed("done");
        tracker.failed("late");
        tracker.running(50, "later");

        assertEquals(2, events.size());
        assertEquals(ProgressEvent.completed("done"), events.get(1));
    }

    @Test
    void whenFailing_givenProgressSoFar_shouldKeepLastPercent() {
        final List<ProgressEvent> events = new ArrayList<>();
        final ProgressTracker tracker = new ProgressTracker(events::add);

        tracker.running(42, "halfway");
        tracker.failed("boom");

        assertEquals(ProgressEvent.failed(42, "boom"), events.get(1));
    }

    @Test
    void whenEmitting_givenThrowingListener_shouldNotPropagate() {
        final ProgressTracker tracker = new ProgressTracker(event -> {
            throw new IllegalStateException("listener down");
        });

        tracker.running(10, "start");
        tracker.completed("done");

        assertEquals(100, tracker.lastPercent());
    }

    @Test
    void whenCreating_givenNullListener_shouldUseNoop() {
        final ProgressTracker tracker = new ProgressTracker(null);

        tracker.running(5, "start");

        assertEquals(5, tracker.lastPercent());
    }

}
