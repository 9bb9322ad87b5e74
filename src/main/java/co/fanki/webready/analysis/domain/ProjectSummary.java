package co.fanki.webready.analysis.domain;

import java.util.List;

/**
 * Aggregate counts of a project analysis.
 *
 * <p>Every count is computed over the successfully analyzed files only;
 * {@link #failedFiles()} tells how many were left out.</p>
 *
 * @param totalLoc code lines across analyzed files
 * @param uiFiles files classified UI
 * @param logicFiles files classified Logic
 * @param mixedFiles files classified Mixed
 * @param failedFiles files that could not be decoded or parsed
 * @param totalClasses class definitions, nested ones included
 * @param totalFunctions function definitions, methods and nested included
 * @param pureFunctions pure function definitions
 * @param toolkits distinct GUI toolkits detected across files, sorted
 * @param webReadyPercentage the project web-readiness, in [0, 100]
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ProjectSummary(
        int totalLoc,
        int uiFiles,
        int logicFiles,
        int mixedFiles,
        int failedFiles,
        int totalClasses,
        int totalFunctions,
        int pureFunctions,
        List<String> toolkits,
        double webReadyPercentage
) {

    /**
     * Copies the toolkits.
     */
    public ProjectSummary {
        toolkits = List.copyOf(toolkits);
    }

}
