package co.fanki.webready.analysis.domain;

import co.fanki.webready.shared.DomainException;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Centralizes all valid analysis status transitions.
 *
 * <p>Valid transitions:</p>
 * <pre>
 *   PENDING → RUNNING, FAILED
 *   RUNNING → COMPLETED, FAILED
 * </pre>
 *
 * <p>{@code PENDING → FAILED} covers input errors detected before any file
 * is processed. Terminal statuses have no outgoing edge: a new analysis
 * is always a new run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class AnalysisStateMachine {

    private static final Map<AnalysisStatus, Set<AnalysisStatus>> TRANSITIONS;

    static {
        TRANSITIONS = new EnumMap<>(AnalysisStatus.class);
        TRANSITIONS.put(AnalysisStatus.PENDING,   EnumSet.of(AnalysisStatus.RUNNING, AnalysisStatus.FAILED));
        TRANSITIONS.put(AnalysisStatus.RUNNING,   EnumSet.of(AnalysisStatus.COMPLETED, AnalysisStatus.FAILED));
        TRANSITIONS.put(AnalysisStatus.COMPLETED, EnumSet.noneOf(AnalysisStatus.class));
        TRANSITIONS.put(AnalysisStatus.FAILED,    EnumSet.noneOf(AnalysisStatus.class));
    }

    private AnalysisStateMachine() {
    }

    /**
     * Validates a status transition and returns the target status if it is
     * permitted.
     *
     * @param from the current status
     * @param to   the desired target status
     * @return {@code to} when the transition is valid
     * @throws DomainException      with code {@code ANALYSIS_INVALID_TRANSITION}
     *                              when the transition is not permitted
     * @throws NullPointerException if {@code from} or {@code to} is null
     */
    public static AnalysisStatus transition(final AnalysisStatus from,
            final AnalysisStatus to) {
        if (from == null || to == null) {
            throw new NullPointerException("from and to must not be null");
        }
        final Set<AnalysisStatus> allowed = TRANSITIONS.getOrDefault(from,
                EnumSet.noneOf(AnalysisStatus.class));
        if (!allowed.contains(to)) {
            throw new DomainException(
                    "Invalid transition: " + from + " → " + to,
                    "ANALYSIS_INVALID_TRANSITION"
            );
        }
        return to;
    }

}
