package co.fanki.webready.analysis.domain;

import co.fanki.webready.shared.DomainException;
import co.fanki.webready.shared.Preconditions;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Input of one analysis run: a project name plus its source files.
 *
 * <p>An empty file list is a valid request; the orchestrator rejects it
 * with {@link EmptyInputException} so the run is observed as Failed.</p>
 *
 * @param projectName the project name, never blank
 * @param files the source files, logical paths unique
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalysisRequest(
        String projectName,
        List<SourceFile> files
) {

    /**
     * Compact constructor, validates the name and rejects duplicate paths.
     */
    public AnalysisRequest {
        Preconditions.requireNonBlank(projectName,
                "Project name is required");
        files = List.copyOf(Preconditions.requireNonNull(files,
                "Files are required"));
        final Set<String> seen = new HashSet<>();
        for (final SourceFile file : files) {
            if (!seen.add(file.path())) {
                throw new DomainException("Duplicate source path: "
                        + file.path(), "DUPLICATE_PATH");
            }
        }
    }

    /**
     * Checks whether the request carries no files.
     *
     * @return true when there is nothing to analyze
     */
    public boolean isEmpty() {
        return files.isEmpty();
    }

}
