package co.fanki.webready.analysis.domain;

import co.fanki.webready.shared.Preconditions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Assembles the web conversion guide of a project.
 *
 * <p>Recommendations come from fixed templates filled with counts, always
 * in the same order:</p>
 * <ol>
 *   <li>reusable pure functions in Logic files</li>
 *   <li>Mixed files that need refactoring</li>
 *   <li>one split advice per Mixed file holding both pure and UI-bound
 *       functions</li>
 *   <li>near-pure functions that need small changes</li>
 *   <li>one advice per oversized UI class</li>
 *   <li>the most used UI base class, ties broken alphabetically</li>
 *   <li>files left out because they could not be analyzed</li>
 * </ol>
 * <p>A template is skipped when its count is zero.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ConversionGuideBuilder {

    /** The architecture every guide recommends. */
    public static final String RECOMMENDED_APPROACH = "API-based separation:"
            + " keep the business logic behind a web service API and reuse"
            + " it as-is, replace the desktop UI with a web frontend";

    private final AnalysisThresholds thresholds;

    private final WebReadinessScorer scorer;

    /**
     * Creates a guide builder.
     *
     * @param theThresholds the decision table, never null
     * @param theScorer the readiness scorer, never null
     */
    public ConversionGuideBuilder(final AnalysisThresholds theThresholds,
            final WebReadinessScorer theScorer) {
        this.thresholds = Preconditions.requireNonNull(theThresholds,
                "Thresholds are required");
        this.scorer = Preconditions.requireNonNull(theScorer,
                "Scorer is required");
    }

    /**
     * Builds the guide.
     *
     * @param files all file results, failed ones included
     * @param refactorings the refactoring suggestions of the run
     * @param webReadyPercentage the project readiness
     * @return the guide
     */
    public WebConversionGuide build(final List<FileAnalysis> files,
            final List<RefactoringSuggestion> refactorings,
            final double webReadyPercentage) {
        Preconditions.requireNonNull(files, "Files are required");
        Preconditions.requireNonNull(refactorings, "Suggestions are required");

        final List<FileAnalysis> analyzed = files.stream()
                .filter(FileAnalysis::isAnalyzed)
                .sorted(Comparator.comparing(FileAnalysis::path))
                .toList();
        final List<FileAnalysis> logic = only(analyzed,
                FileClassification.LOGIC);
        final List<FileAnalysis> mixed = only(analyzed,
                FileClassification.MIXED);
        final List<FileAnalysis> ui = only(analyzed, FileClassification.UI);

        final List<String> reusable = analyzed.stream()
                .filter(scorer::isReusable)
                .map(FileAnalysis::path)
                .toList();
        final List<String> toReplace = ui.stream()
                .map(FileAnalysis::path)
                .toList();

        final List<String> recommendations = new ArrayList<>();

        final long reusableFunctions = logic.stream()
                .flatMap(f -> f.allFunctions().stream())
                .filter(FunctionInfo::pure)
                .count();
        if (reusableFunctions > 0) {
            recommendations.add(reusableFunctions + " pure functions in "
                    + logic.size() + " files are web-ready and can be reused"
                    + " as-is");
        }

        if (!mixed.isEmpty()) {
            recommendations.add(mixed.size() + " mixed files need refactoring"
                    + " to separate UI from logic");
        }

        for (final FileAnalysis file : mixed) {
            final List<FunctionInfo> functions = file.allFunctions();
            final long pure = functions.stream()
                    .filter(FunctionInfo::pure).count();
            final long uiBound = functions.stream()
                    .filter(PurityClassifier::isUiBound).count();
            if (pure > 0 && uiBound > 0) {
                recommendations.add("Split " + file.path() + ": " + pure
                        + " pure functions can move to a logic module, "
                        + uiBound + " UI-bound functions stay in the view"
                        + " layer");
            }
        }

        if (!refactorings.isEmpty()) {
            recommendations.add(refactorings.size() + " functions become"
                    + " reusable after removing a few UI calls or shared"
                    + " state accesses");
        }

        for (final FileAnalysis file : analyzed) {
            for (final ClassInfo classInfo : file.classes()) {
                if (classInfo.uiClass()
                        && classInfo.loc() > thresholds.largeUiClassLoc()) {
                    recommendations.add("Large UI class " + classInfo.name()
                            + " in " + file.path() + " (" + classInfo.loc()
                            + " LOC): break it down into smaller components"
                            + " and extract its business logic");
                }
            }
        }

        final String mainBase = mainUiBaseClass(analyzed);
        if (mainBase != null) {
            recommendations.add("Main UI framework: " + mainBase
                    + " - plan an equivalent web frontend component model");
        }

        final long failed = files.stream().filter(f -> !f.isAnalyzed())
                .count();
        if (failed > 0) {
            recommendations.add(failed + " files could not be analyzed and"
                    + " were left out of the results");
        }

        final String summary = String.format(Locale.ROOT,
                "Project has %d web-ready files and %d files requiring UI"
                + " conversion; %.1f%% of the code is web-ready",
                logic.size(), ui.size() + mixed.size(), webReadyPercentage);

        return new WebConversionGuide(summary, reusable, toReplace,
                RECOMMENDED_APPROACH, scorer.complexity(webReadyPercentage),
                recommendations);
    }

    /**
     * Finds the base class most UI classes extend.
     *
     * @return the base class name, last dotted segment only, or null
     */
    static String mainUiBaseClass(final List<FileAnalysis> files) {
        final Map<String, Integer> counts = new TreeMap<>();
        for (final FileAnalysis file : files) {
            for (final ClassInfo classInfo : file.classes()) {
                if (!classInfo.uiClass()) {
                    continue;
                }
                for (final String base : classInfo.bases()) {
                    final String simple = base.substring(
                            base.lastIndexOf('.') + 1);
                    counts.merge(simple, 1, Integer::sum);
                }
            }
        }
        String best = null;
        int bestCount = 0;
        for (final Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    private static List<FileAnalysis> only(final List<FileAnalysis> files,
            final FileClassification classification) {
        return files.stream()
                .filter(f -> f.classification() == classification)
                .toList();
    }

}
