package co.fanki.webready.analysis.domain;

import co.fanki.webready.shared.Preconditions;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Computes how much of a project can be reused behind a web API.
 *
 * <p>Logic files count whole. In UI and Mixed files only the lines of pure
 * functions count; lines of near-pure functions do not, even when a
 * refactoring suggestion exists for them. Files that failed to parse are
 * left out of both sides of the ratio.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class WebReadinessScorer {

    private final AnalysisThresholds thresholds;

    /**
     * Creates a scorer.
     *
     * @param theThresholds the decision table, never null
     */
    public WebReadinessScorer(final AnalysisThresholds theThresholds) {
        this.thresholds = Preconditions.requireNonNull(theThresholds,
                "Thresholds are required");
    }

    /**
     * Computes the project web-readiness.
     *
     * @param files the analyzed files
     * @return the percentage in [0, 100], rounded to one decimal; 0 when
     *     there is no code
     */
    public double webReadyPercentage(final List<FileAnalysis> files) {
        Preconditions.requireNonNull(files, "Files are required");
        long total = 0;
        long ready = 0;
        for (final FileAnalysis file : files) {
            if (!file.isAnalyzed()) {
                continue;
            }
            total += file.loc();
            ready += readyLoc(file);
        }
        if (total == 0) {
            return 0.0;
        }
        return round(ready * 100.0 / total);
    }

    /**
     * Computes the readiness of a single file.
     *
     * @param file the analyzed file
     * @return 100 for Logic files, the pure line share otherwise, rounded
     *     to one decimal
     */
    public double fileReadiness(final FileAnalysis file) {
        Preconditions.requireNonNull(file, "File is required");
        if (!file.isAnalyzed() || file.loc() == 0) {
            return 0.0;
        }
        return round(readyLoc(file) * 100.0 / file.loc());
    }

    /**
     * Checks whether a file can be reused unchanged.
     *
     * @param file the analyzed file
     * @return true if its readiness reaches the reusable module threshold
     */
    public boolean isReusable(final FileAnalysis file) {
        return fileReadiness(file) >= thresholds.reusableModuleReadiness();
    }

    /**
     * Buckets the project readiness into a conversion complexity.
     *
     * @param webReadyPercentage the project readiness
     * @return LOW, MEDIUM or HIGH
     */
    public Complexity complexity(final double webReadyPercentage) {
        Preconditions.requirePercentage(webReadyPercentage,
                "Web-ready percentage must be in [0, 100]");
        if (webReadyPercentage >= thresholds.lowComplexityReadiness()) {
            return Complexity.LOW;
        }
        if (webReadyPercentage >= thresholds.mediumComplexityReadiness()) {
            return Complexity.MEDIUM;
        }
        return Complexity.HIGH;
    }

    private static int readyLoc(final FileAnalysis file) {
        if (file.classification() == FileClassification.LOGIC) {
            return file.loc();
        }
        return Math.min(file.pureLoc(), file.loc());
    }

    private static double round(final double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP)
                .doubleValue();
    }

}
