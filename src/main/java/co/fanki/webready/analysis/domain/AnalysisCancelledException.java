package co.fanki.webready.analysis.domain;

import co.fanki.webready.shared.DomainException;

/**
 * Raised when a running analysis stops because cancellation was requested.
 *
 * <p>The run ends {@link AnalysisStatus#FAILED}. Files fully analyzed before
 * the stop are available through {@link #partialResult()}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class AnalysisCancelledException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code of this exception. */
    public static final String CODE = "ANALYSIS_CANCELLED";

    private final transient ProjectAnalysisResult partialResult;

    /**
     * Creates a new cancellation exception.
     *
     * @param message the human readable reason
     * @param thePartialResult the result built from completed files
     */
    public AnalysisCancelledException(final String message,
            final ProjectAnalysisResult thePartialResult) {
        super(message, CODE);
        this.partialResult = thePartialResult;
    }

    /**
     * Returns the result built from the files analyzed before the stop.
     *
     * @return the partial result, never null
     */
    public ProjectAnalysisResult partialResult() {
        return partialResult;
    }

}
