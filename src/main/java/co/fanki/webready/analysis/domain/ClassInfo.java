package co.fanki.webready.analysis.domain;

import java.util.List;

/**
 * Structural facts about one class definition.
 *
 * @param name the class name
 * @param file the logical path of the owning file
 * @param bases the base class expressions as written, e.g. "QtWidgets.QMainWindow"
 * @param uiClass whether a base matches a known GUI base type
 * @param methods the functions defined directly in the class body
 * @param startLine the line of the {@code class} keyword
 * @param endLine the last line of the body
 * @param loc the code lines in the span
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ClassInfo(
        String name,
        String file,
        List<String> bases,
        boolean uiClass,
        List<FunctionInfo> methods,
        int startLine,
        int endLine,
        int loc
) {

    public ClassInfo {
        bases = List.copyOf(bases);
        methods = List.copyOf(methods);
    }

}
