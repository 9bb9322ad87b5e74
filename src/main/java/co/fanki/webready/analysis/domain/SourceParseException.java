package co.fanki.webready.analysis.domain;

import co.fanki.webready.shared.DomainException;

/**
 * Raised when a source file is not syntactically valid Python.
 *
 * <p>Never fatal for a run: the structural analyzer records it as a
 * {@link FileError} on the file and the orchestrator moves on.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SourceParseException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code of this exception. */
    public static final String CODE = "PARSE_ERROR";

    private final int line;
    private final int column;

    /**
     * Creates a new parse exception.
     *
     * @param message what the parser expected or found
     * @param theLine the 1-based line of the offending token
     * @param theColumn the 1-based column of the offending token
     */
    public SourceParseException(final String message, final int theLine,
            final int theColumn) {
        super(message + " (line " + theLine + ", column " + theColumn + ")",
                CODE);
        this.line = theLine;
        this.column = theColumn;
    }

    /**
     * Returns the 1-based line where parsing failed.
     *
     * @return the line number
     */
    public int line() {
        return line;
    }

    /**
     * Returns the 1-based column where parsing failed.
     *
     * @return the column
     */
    public int column() {
        return column;
    }

}
