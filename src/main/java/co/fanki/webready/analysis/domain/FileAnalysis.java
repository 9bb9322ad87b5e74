package co.fanki.webready.analysis.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Analysis result for a single source file.
 *
 * <p>Immutable once the structural analyzer and file classifier produced
 * it. A file that failed to decode or parse carries an {@link #error()},
 * the {@link FileClassification#UNAVAILABLE} classification and no
 * classes or functions.</p>
 *
 * @param path the logical relative path
 * @param imports all import statements, in source order
 * @param classes all class definitions, nested ones included
 * @param functions the module-level functions
 * @param loc code lines, blank and comment-only lines excluded
 * @param uiLoc code lines inside UI classes or UI-bound functions
 * @param pureLoc code lines inside pure functions
 * @param uiCallCount the UI call sites across all functions
 * @param uiPercentage {@code uiLoc / loc * 100}, in [0, 100]
 * @param classification the file category
 * @param toolkits the GUI toolkits imported by this file, sorted
 * @param error the failure marker, null for analyzed files
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileAnalysis(
        String path,
        List<Import> imports,
        List<ClassInfo> classes,
        List<FunctionInfo> functions,
        int loc,
        int uiLoc,
        int pureLoc,
        int uiCallCount,
        double uiPercentage,
        FileClassification classification,
        List<String> toolkits,
        FileError error
) {

    /**
     * Compact constructor, defensively copies the lists.
     */
    public FileAnalysis {
        imports = List.copyOf(imports);
        classes = List.copyOf(classes);
        functions = List.copyOf(functions);
        toolkits = List.copyOf(toolkits);
    }

    /**
     * Creates the result for a file that could not be analyzed.
     *
     * @param path the logical path
     * @param loc the code lines, 0 when the text is unavailable
     * @param error the failure marker
     * @return the error-marked analysis
     */
    public static FileAnalysis failed(final String path, final int loc,
            final FileError error) {
        return new FileAnalysis(path, List.of(), List.of(), List.of(), loc,
                0, 0, 0, 0.0, FileClassification.UNAVAILABLE, List.of(),
                error);
    }

    /**
     * Checks whether this file was analyzed successfully.
     *
     * @return true when there is no error marker
     */
    @JsonIgnore
    public boolean isAnalyzed() {
        return error == null;
    }

    /**
     * Returns every function of the file: module-level functions, methods
     * and nested functions, ordered by start line.
     *
     * @return all functions, flattened
     */
    @JsonIgnore
    public List<FunctionInfo> allFunctions() {
        final List<FunctionInfo> all = new ArrayList<>();
        for (final FunctionInfo function : functions) {
            collect(function, all);
        }
        for (final ClassInfo classInfo : classes) {
            for (final FunctionInfo method : classInfo.methods()) {
                collect(method, all);
            }
        }
        all.sort(Comparator.comparingInt(FunctionInfo::startLine)
                .thenComparing(FunctionInfo::name));
        return all;
    }

    /**
     * Checks whether at least one function of the file is pure.
     *
     * @return true if a pure function exists
     */
    @JsonIgnore
    public boolean hasPureFunctions() {
        return allFunctions().stream().anyMatch(FunctionInfo::pure);
    }

    private static void collect(final FunctionInfo function,
            final List<FunctionInfo> target) {
        target.add(function);
        for (final FunctionInfo inner : function.nested()) {
            collect(inner, target);
        }
    }

}
