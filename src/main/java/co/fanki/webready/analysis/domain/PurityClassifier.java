package co.fanki.webready.analysis.domain;

/**
 * Stateless predicates over function usage facts.
 *
 * <p>A function is pure when it makes no UI call, touches no state
 * outside its own local scope and loads no module dynamically. A dynamic
 * import is an unresolved dependency, so it never counts as pure.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PurityClassifier {

    private PurityClassifier() {
    }

    /**
     * Decides purity from the raw usage facts.
     *
     * @param callsUiApi whether the body makes a UI call
     * @param accessesExternalState whether the body touches non-local state
     * @param usesDynamicImport whether the body loads modules dynamically
     * @return true if the function is pure
     */
    public static boolean isPure(final boolean callsUiApi,
            final boolean accessesExternalState,
            final boolean usesDynamicImport) {
        return !callsUiApi && !accessesExternalState && !usesDynamicImport;
    }

    /**
     * Decides purity of an extracted function.
     *
     * @param function the function facts
     * @return true if the function is pure
     */
    public static boolean isPure(final FunctionInfo function) {
        return isPure(function.callsUiApi(), function.accessesExternalState(),
                function.usesDynamicImport());
    }

    /**
     * Decides whether a function is bound to the UI toolkit.
     *
     * @param function the function facts
     * @return true if the function makes at least one UI call
     */
    public static boolean isUiBound(final FunctionInfo function) {
        return function.callsUiApi();
    }

}
