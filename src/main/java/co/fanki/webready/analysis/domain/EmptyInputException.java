package co.fanki.webready.analysis.domain;

import co.fanki.webready.shared.DomainException;

/**
 * Raised when an analysis is requested without any source file.
 *
 * <p>This is fatal for the run: it fails before the run ever reaches
 * {@link AnalysisStatus#RUNNING}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class EmptyInputException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code of this exception. */
    public static final String CODE = "EMPTY_INPUT";

    /**
     * Creates a new exception for the given project.
     *
     * @param projectName the project that had no files, may be null
     */
    public EmptyInputException(final String projectName) {
        super("No source files to analyze for project: " + projectName, CODE);
    }

}
