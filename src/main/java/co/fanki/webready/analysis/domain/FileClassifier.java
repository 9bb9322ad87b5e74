package co.fanki.webready.analysis.domain;

import co.fanki.webready.shared.Preconditions;

/**
 * Labels a file as UI, Logic or Mixed.
 *
 * <p>The label depends only on the ui percentage, on whether the file has
 * a pure function and on whether it has code at all. Boundaries are
 * inclusive: exactly 80 is UI, exactly 20 with a pure function is
 * Logic.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FileClassifier {

    private final AnalysisThresholds thresholds;

    /**
     * Creates a classifier.
     *
     * @param theThresholds the decision table, never null
     */
    public FileClassifier(final AnalysisThresholds theThresholds) {
        this.thresholds = Preconditions.requireNonNull(theThresholds,
                "Thresholds are required");
    }

    /**
     * Computes the share of UI-related code lines.
     *
     * @param uiLines code lines in UI classes or UI-bound functions
     * @param totalLoc code lines of the file
     * @return the percentage in [0, 100], 0 for an empty file
     */
    public double uiPercentage(final int uiLines, final int totalLoc) {
        Preconditions.requireNonNegative(uiLines, "UI lines must not be negative");
        Preconditions.requireNonNegative(totalLoc, "LOC must not be negative");
        if (totalLoc == 0) {
            return 0.0;
        }
        // Multiply first so exact boundaries such as 4/5 stay exact.
        return Math.min(100.0, uiLines * 100.0 / totalLoc);
    }

    /**
     * Classifies a file.
     *
     * @param uiPercentage the file ui percentage
     * @param hasPureFunctions whether the file has at least one pure function
     * @param totalLoc code lines of the file
     * @return UI, LOGIC or MIXED
     */
    public FileClassification classify(final double uiPercentage,
            final boolean hasPureFunctions, final int totalLoc) {
        Preconditions.requirePercentage(uiPercentage,
                "UI percentage must be in [0, 100]");
        if (totalLoc == 0) {
            return FileClassification.MIXED;
        }
        if (uiPercentage >= thresholds.uiFilePercentage()) {
            return FileClassification.UI;
        }
        if (uiPercentage <= thresholds.logicFilePercentage()
                && hasPureFunctions) {
            return FileClassification.LOGIC;
        }
        return FileClassification.MIXED;
    }

}
