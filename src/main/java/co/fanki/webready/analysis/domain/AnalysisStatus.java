package co.fanki.webready.analysis.domain;

/**
 * Lifecycle of a single analysis run.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum AnalysisStatus {

    /**
     * Run was created but no file has been looked at yet.
     */
    PENDING,

    /**
     * Files are being analyzed.
     */
    RUNNING,

    /**
     * A {@link ProjectAnalysisResult} was produced.
     */
    COMPLETED,

    /**
     * The run was aborted: empty input, cancellation, timeout or an
     * orchestration failure.
     */
    FAILED;

    /**
     * Checks whether the run reached a final status.
     *
     * @return true for {@link #COMPLETED} and {@link #FAILED}
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Returns the lowercase token used in progress events.
     *
     * @return the status token, e.g. "running"
     */
    public String token() {
        return name().toLowerCase();
    }

}
