package co.fanki.webready.analysis.domain;

/**
 * Category of an analyzed file.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum FileClassification {

    /** Predominantly GUI code. */
    UI,

    /** Business logic with little or no GUI coupling. */
    LOGIC,

    /** Neither clearly UI nor clearly logic. */
    MIXED,

    /** The file could not be parsed or decoded. */
    UNAVAILABLE

}
