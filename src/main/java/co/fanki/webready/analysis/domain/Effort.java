package co.fanki.webready.analysis.domain;

/**
 * Effort needed to lift a function into a web-ready module.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum Effort {

    /** Can be moved as-is. */
    LOW,

    /** Needs a few UI or state couplings removed. */
    MEDIUM,

    /** Needs a redesign. */
    HIGH

}
