package co.fanki.webready.analysis.domain;

import java.util.List;

/**
 * Structural facts about one function definition.
 *
 * <p>One instance exists per syntactic {@code def}: top-level functions,
 * methods and nested functions each get their own. Nested definitions are
 * owned by their enclosing function through {@link #nested()}.</p>
 *
 * @param name the function name
 * @param file the logical path of the owning file
 * @param startLine the line of the {@code def} keyword
 * @param endLine the last line of the body
 * @param loc the code lines in the span (blank and comment lines excluded)
 * @param parameters the parameter names, in declaration order
 * @param method whether the function is defined directly in a class body
 * @param callsUiApi whether any call resolves to a GUI toolkit name
 * @param uiCallCount the number of UI call sites in the body
 * @param uiUsage the distinct UI callees, in first-use order
 * @param accessesExternalState whether the body touches state outside its
 *     own local scope
 * @param declaresGlobal whether the body holds a {@code global} or
 *     {@code nonlocal} statement
 * @param usesDynamicImport whether the body loads modules dynamically
 * @param dependencies up to ten distinct non-private callees
 * @param pure whether the function is pure, see {@link PurityClassifier}
 * @param nested the functions defined directly inside this one
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FunctionInfo(
        String name,
        String file,
        int startLine,
        int endLine,
        int loc,
        List<String> parameters,
        boolean method,
        boolean callsUiApi,
        int uiCallCount,
        List<String> uiUsage,
        boolean accessesExternalState,
        boolean declaresGlobal,
        boolean usesDynamicImport,
        List<String> dependencies,
        boolean pure,
        List<FunctionInfo> nested
) {

    /**
     * Compact constructor, defensively copies the lists.
     */
    public FunctionInfo {
        parameters = List.copyOf(parameters);
        uiUsage = List.copyOf(uiUsage);
        dependencies = List.copyOf(dependencies);
        nested = List.copyOf(nested);
    }

    /**
     * Returns the number of source lines from {@code def} to the end of
     * the body, blank lines included.
     *
     * @return the line span
     */
    public int lineSpan() {
        return endLine - startLine + 1;
    }

    /**
     * Returns the line range formatted as {@code start-end}.
     *
     * @return the line range
     */
    public String lineRange() {
        return startLine + "-" + endLine;
    }

}
