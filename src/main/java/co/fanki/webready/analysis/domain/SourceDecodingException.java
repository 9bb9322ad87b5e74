package co.fanki.webready.analysis.domain;

import co.fanki.webready.shared.DomainException;

/**
 * Raised when the bytes of a source file cannot be decoded as text.
 *
 * <p>Handled exactly like a parse error: the file is marked and excluded,
 * the run continues.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SourceDecodingException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code of this exception. */
    public static final String CODE = "UNSUPPORTED_ENCODING";

    /**
     * Creates a new decoding exception.
     *
     * @param path the logical path of the file
     * @param charset the charset that was tried
     * @param cause the decoder failure, may be null
     */
    public SourceDecodingException(final String path, final String charset,
            final Throwable cause) {
        super("Cannot decode " + path + " as " + charset, CODE, cause);
    }

}
