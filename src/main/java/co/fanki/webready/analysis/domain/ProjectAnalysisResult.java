package co.fanki.webready.analysis.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * The engine's only externally visible output: an immutable snapshot of
 * one analysis run.
 *
 * <p>References between parts are by file path, never by object, so the
 * whole result serializes as a single acyclic JSON document.</p>
 *
 * @param projectName the analyzed project
 * @param totalFiles the number of files in the result, failed ones included
 * @param files the per-file results, ordered by path
 * @param summary the aggregate counts
 * @param extractionSuggestions pure functions worth lifting as-is
 * @param refactoringSuggestions near-pure functions worth lifting
 * @param webConversionGuide the conversion guide
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ProjectAnalysisResult(
        String projectName,
        int totalFiles,
        List<FileAnalysis> files,
        ProjectSummary summary,
        List<ExtractionSuggestion> extractionSuggestions,
        List<RefactoringSuggestion> refactoringSuggestions,
        WebConversionGuide webConversionGuide
) {

    /**
     * Compact constructor, defensively copies the lists.
     */
    public ProjectAnalysisResult {
        files = List.copyOf(files);
        extractionSuggestions = List.copyOf(extractionSuggestions);
        refactoringSuggestions = List.copyOf(refactoringSuggestions);
    }

    /**
     * Returns the project web-readiness percentage.
     *
     * @return the percentage, rounded to one decimal
     */
    @JsonIgnore
    public double webReadyPercentage() {
        return summary.webReadyPercentage();
    }

}
