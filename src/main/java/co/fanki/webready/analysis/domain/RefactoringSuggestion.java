package co.fanki.webready.analysis.domain;

import java.util.List;

/**
 * Recommendation to lift a near-pure function after removing its few UI
 * calls or shared-state accesses.
 *
 * @param file the logical path of the file holding the function
 * @param function the function name
 * @param startLine the first line of the function
 * @param endLine the last line of the function
 * @param rationale what has to be removed
 * @param effort always {@link Effort#MEDIUM}
 * @param webReady always false, the function needs changes first
 * @param uiUsage the UI callees to remove
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RefactoringSuggestion(
        String file,
        String function,
        int startLine,
        int endLine,
        String rationale,
        Effort effort,
        boolean webReady,
        List<String> uiUsage
) {

    public RefactoringSuggestion {
        uiUsage = List.copyOf(uiUsage);
    }

}
