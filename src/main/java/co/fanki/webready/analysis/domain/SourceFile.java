package co.fanki.webready.analysis.domain;

import co.fanki.webready.shared.Preconditions;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One input file of an analysis: a logical relative path plus its content.
 *
 * <p>Content is either already-decoded text or raw bytes. Raw bytes are
 * decoded lazily by {@link #text()} honouring a PEP 263 coding declaration
 * in the first two lines and falling back to strict UTF-8. The engine never
 * writes content back.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SourceFile {

    /** Matches a PEP 263 coding declaration, e.g. {@code # -*- coding: latin-1 -*-}. */
    private static final Pattern CODING_COOKIE = Pattern.compile(
            "^[ \\t\\f]*#.*?coding[:=][ \\t]*([-\\w.]+)");

    /** Codec names Python accepts that the JDK does not know. */
    private static final Map<String, String> PYTHON_ALIASES = Map.of(
            "latin-1", "ISO-8859-1",
            "iso-latin-1", "ISO-8859-1",
            "utf-8-sig", "UTF-8",
            "utf8-sig", "UTF-8");

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB,
            (byte) 0xBF};

    private final String path;
    private final String text;
    private final byte[] bytes;

    private SourceFile(final String thePath, final String theText,
            final byte[] theBytes) {
        this.path = normalize(Preconditions.requireNonBlank(thePath,
                "Source path is required"));
        this.text = theText;
        this.bytes = theBytes;
    }

    /**
     * Creates a source file from decoded text.
     *
     * @param path the logical relative path
     * @param text the source text
     * @return the source file
     */
    public static SourceFile ofText(final String path, final String text) {
        return new SourceFile(path,
                Preconditions.requireNonNull(text, "Source text is required"),
                null);
    }

    /**
     * Creates a source file from raw bytes that are decoded on demand.
     *
     * @param path the logical relative path
     * @param bytes the raw file content
     * @return the source file
     */
    public static SourceFile ofBytes(final String path, final byte[] bytes) {
        return new SourceFile(path, null, Arrays.copyOf(
                Preconditions.requireNonNull(bytes, "Source bytes are required"),
                bytes.length));
    }

    /**
     * Returns the logical path, always with forward slashes.
     *
     * @return the path
     */
    public String path() {
        return path;
    }

    /**
     * Returns the decoded source text.
     *
     * @return the source text
     * @throws SourceDecodingException if the bytes are not valid in the
     *     declared or default charset
     */
    public String text() {
        if (text != null) {
            return text;
        }
        return decode();
    }

    /**
     * Returns the file name without directories and extension.
     *
     * @return the stem, e.g. "main_window" for "ui/main_window.py"
     */
    public String stem() {
        final String name = path.substring(path.lastIndexOf('/') + 1);
        final int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private String decode() {
        int offset = 0;
        if (startsWithBom()) {
            offset = UTF8_BOM.length;
        }
        final Charset charset = declaredCharset(offset);
        final CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes, offset,
                    bytes.length - offset)).toString();
        } catch (final CharacterCodingException e) {
            throw new SourceDecodingException(path, charset.name(), e);
        }
    }

    private boolean startsWithBom() {
        return bytes.length >= UTF8_BOM.length
                && bytes[0] == UTF8_BOM[0]
                && bytes[1] == UTF8_BOM[1]
                && bytes[2] == UTF8_BOM[2];
    }

    private Charset declaredCharset(final int offset) {
        // The cookie is pure ASCII, so ISO-8859-1 is safe for the lookup.
        final String head = new String(bytes, offset,
                Math.min(bytes.length - offset, 512),
                StandardCharsets.ISO_8859_1);
        final String[] lines = head.split("\r\n|\r|\n", 3);
        for (int i = 0; i < Math.min(lines.length, 2); i++) {
            final Matcher matcher = CODING_COOKIE.matcher(lines[i]);
            if (matcher.find()) {
                return lookup(matcher.group(1));
            }
            if (!lines[i].isBlank() && !lines[i].trim().startsWith("#")) {
                break;
            }
        }
        return StandardCharsets.UTF_8;
    }

    private Charset lookup(final String name) {
        final String normalized = name.toLowerCase(Locale.ROOT)
                .replace('_', '-');
        try {
            return Charset.forName(PYTHON_ALIASES.getOrDefault(normalized,
                    normalized));
        } catch (final IllegalCharsetNameException
                | UnsupportedCharsetException e) {
            throw new SourceDecodingException(path, name, e);
        }
    }

    private static String normalize(final String thePath) {
        String result = thePath.replace('\\', '/');
        while (result.startsWith("./")) {
            result = result.substring(2);
        }
        return result;
    }

    @Override
    public String toString() {
        return "SourceFile[" + path + "]";
    }

}
