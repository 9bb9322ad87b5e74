package co.fanki.webready.analysis.domain;

import co.fanki.webready.shared.Preconditions;

/**
 * The fixed decision table of the engine.
 *
 * <p>Every threshold used by the file classifier, the suggestion generator
 * and the readiness scorer lives here, so the rules can be read in one
 * place and tested in isolation. Runs always use {@link #STANDARD}.</p>
 *
 * @param uiFilePercentage ui percentage at or above which a file is UI
 * @param logicFilePercentage ui percentage at or below which a file with a
 *     pure function is Logic
 * @param extractionMinLines minimum span of an extraction suggestion
 * @param refactoringMinLines minimum span of a refactoring suggestion
 * @param refactoringMaxUiCalls maximum UI calls of a refactoring suggestion
 * @param lowComplexityReadiness readiness at or above which conversion
 *     complexity is low
 * @param mediumComplexityReadiness readiness at or above which conversion
 *     complexity is medium
 * @param reusableModuleReadiness file readiness at or above which a file is
 *     a reusable module
 * @param largeUiClassLoc class size above which a UI class should be split
 * @param maxDependencies how many callees are kept per function
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalysisThresholds(
        double uiFilePercentage,
        double logicFilePercentage,
        int extractionMinLines,
        int refactoringMinLines,
        int refactoringMaxUiCalls,
        double lowComplexityReadiness,
        double mediumComplexityReadiness,
        double reusableModuleReadiness,
        int largeUiClassLoc,
        int maxDependencies
) {

    /** The thresholds every analysis run uses. */
    public static final AnalysisThresholds STANDARD = new AnalysisThresholds(
            80.0, 20.0, 3, 5, 2, 80.0, 50.0, 100.0, 200, 10);

    /**
     * Compact constructor, validates the ranges.
     */
    public AnalysisThresholds {
        Preconditions.requirePercentage(uiFilePercentage,
                "UI file percentage must be in [0, 100]");
        Preconditions.requirePercentage(logicFilePercentage,
                "Logic file percentage must be in [0, 100]");
        Preconditions.require(logicFilePercentage < uiFilePercentage,
                "Logic threshold must be below the UI threshold");
        Preconditions.requireLine(extractionMinLines,
                "Extraction minimum lines must be positive");
        Preconditions.requireLine(refactoringMinLines,
                "Refactoring minimum lines must be positive");
        Preconditions.requireNonNegative(refactoringMaxUiCalls,
                "Refactoring maximum UI calls must not be negative");
        Preconditions.requirePercentage(lowComplexityReadiness,
                "Low complexity readiness must be in [0, 100]");
        Preconditions.requirePercentage(mediumComplexityReadiness,
                "Medium complexity readiness must be in [0, 100]");
        Preconditions.require(
                mediumComplexityReadiness <= lowComplexityReadiness,
                "Medium complexity readiness must not exceed the low one");
        Preconditions.requirePercentage(reusableModuleReadiness,
                "Reusable module readiness must be in [0, 100]");
        Preconditions.requireNonNegative(largeUiClassLoc,
                "Large UI class size must not be negative");
        Preconditions.requireNonNegative(maxDependencies,
                "Maximum dependencies must not be negative");
    }

}
