package co.fanki.webready.analysis.domain;

/**
 * Marker recorded on a file that could not be analyzed.
 *
 * @param code the error code, {@code PARSE_ERROR} or {@code UNSUPPORTED_ENCODING}
 * @param message the human readable reason
 * @param line the offending line, or 0 when unknown
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileError(
        String code,
        String message,
        int line
) {

    /**
     * Creates the marker for a syntax error.
     *
     * @param e the parse failure
     * @return the marker
     */
    public static FileError of(final SourceParseException e) {
        return new FileError(e.getErrorCode(), e.getMessage(), e.line());
    }

    /**
     * Creates the marker for a decoding failure.
     *
     * @param e the decoding failure
     * @return the marker
     */
    public static FileError of(final SourceDecodingException e) {
        return new FileError(e.getErrorCode(), e.getMessage(), 0);
    }

}
