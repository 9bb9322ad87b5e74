package co.fanki.webready.analysis.domain;

import java.util.List;

/**
 * Recommendation to lift a pure function as-is into a reusable module.
 *
 * @param file the logical path of the file holding the function
 * @param function the function name
 * @param startLine the first line of the function
 * @param endLine the last line of the function
 * @param rationale why the function qualifies
 * @param effort always {@link Effort#LOW}
 * @param webReady always true
 * @param dependencies the callees the function needs alongside it
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ExtractionSuggestion(
        String file,
        String function,
        int startLine,
        int endLine,
        String rationale,
        Effort effort,
        boolean webReady,
        List<String> dependencies
) {

    public ExtractionSuggestion {
        dependencies = List.copyOf(dependencies);
    }

}
