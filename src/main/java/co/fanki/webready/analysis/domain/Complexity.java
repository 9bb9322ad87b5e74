package co.fanki.webready.analysis.domain;

/**
 * Estimated complexity of converting a project to a web architecture.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum Complexity {

    /** Most of the code is already web-ready. */
    LOW,

    /** About half of the code needs work. */
    MEDIUM,

    /** Most of the code is bound to the desktop UI. */
    HIGH

}
