package co.fanki.webready.analysis.domain;

import co.fanki.webready.shared.Preconditions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Derives extraction and refactoring suggestions from analyzed files.
 *
 * <p>Both passes visit every function of every analyzed file, methods and
 * nested functions included, in path order then line order. A function
 * lands in at most one list: pure functions are extraction candidates and
 * are never proposed for refactoring.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SuggestionGenerator {

    private final AnalysisThresholds thresholds;

    /**
     * Creates a suggestion generator.
     *
     * @param theThresholds the decision table, never null
     */
    public SuggestionGenerator(final AnalysisThresholds theThresholds) {
        this.thresholds = Preconditions.requireNonNull(theThresholds,
                "Thresholds are required");
    }

    /**
     * Lists the pure functions worth lifting as-is.
     *
     * @param files the analyzed files
     * @return one suggestion per pure function spanning at least the
     *     extraction minimum of lines
     */
    public List<ExtractionSuggestion> extractionSuggestions(
            final List<FileAnalysis> files) {
        final List<ExtractionSuggestion> result = new ArrayList<>();
        for (final FileAnalysis file : ordered(files)) {
            for (final FunctionInfo function : file.allFunctions()) {
                if (isExtractable(function)) {
                    result.add(new ExtractionSuggestion(file.path(),
                            function.name(), function.startLine(),
                            function.endLine(),
                            "Pure function with no UI dependencies",
                            Effort.LOW, true, function.dependencies()));
                }
            }
        }
        return result;
    }

    /**
     * Lists the near-pure functions worth lifting after small changes.
     *
     * @param files the analyzed files
     * @return one suggestion per impure function with few UI calls spanning
     *     at least the refactoring minimum of lines
     */
    public List<RefactoringSuggestion> refactoringSuggestions(
            final List<FileAnalysis> files) {
        final List<RefactoringSuggestion> result = new ArrayList<>();
        for (final FileAnalysis file : ordered(files)) {
            for (final FunctionInfo function : file.allFunctions()) {
                if (isRefactorable(function)) {
                    result.add(new RefactoringSuggestion(file.path(),
                            function.name(), function.startLine(),
                            function.endLine(), rationale(function),
                            Effort.MEDIUM, false, function.uiUsage()));
                }
            }
        }
        return result;
    }

    boolean isExtractable(final FunctionInfo function) {
        return PurityClassifier.isPure(function)
                && function.lineSpan() >= thresholds.extractionMinLines();
    }

    boolean isRefactorable(final FunctionInfo function) {
        return !PurityClassifier.isPure(function)
                && function.uiCallCount() <= thresholds.refactoringMaxUiCalls()
                && function.lineSpan() >= thresholds.refactoringMinLines();
    }

    private static String rationale(final FunctionInfo function) {
        if (function.callsUiApi()) {
            return "Minimal UI usage: " + String.join(", ",
                    function.uiUsage());
        }
        if (function.usesDynamicImport()) {
            return "Loads modules dynamically; resolve the imports first";
        }
        return "Accesses shared state; pass it in as parameters";
    }

    private static List<FileAnalysis> ordered(final List<FileAnalysis> files) {
        Preconditions.requireNonNull(files, "Files are required");
        return files.stream()
                .filter(FileAnalysis::isAnalyzed)
                .sorted(Comparator.comparing(FileAnalysis::path))
                .toList();
    }

}
