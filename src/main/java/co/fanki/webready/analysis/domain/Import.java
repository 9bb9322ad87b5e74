package co.fanki.webready.analysis.domain;

import java.util.List;

/**
 * A single import statement of an analyzed file.
 *
 * <p>For {@code import a.b as c} the module is {@code a.b} and the names
 * hold the bound name {@code c}. For {@code from a.b import x, y} the module
 * is {@code a.b} and the names are {@code x, y}. Relative imports keep their
 * leading dots in the module.</p>
 *
 * @param module the imported module path
 * @param names the imported (or bound) names
 * @param line the 1-based source line of the statement
 * @param fromImport whether this is a {@code from ... import} statement
 * @param ui whether the import belongs to a known GUI toolkit
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Import(
        String module,
        List<String> names,
        int line,
        boolean fromImport,
        boolean ui
) {

    public Import {
        names = List.copyOf(names);
    }

    /**
     * Returns the first segment of the module path.
     *
     * @return the root module, e.g. "PyQt5" for "PyQt5.QtWidgets"
     */
    public String rootModule() {
        final int dot = module.indexOf('.');
        return dot < 0 ? module : module.substring(0, dot);
    }

    /**
     * Returns the module path below the root.
     *
     * @return the submodule, e.g. "QtWidgets", or empty for a root import
     */
    public String submodule() {
        final int dot = module.indexOf('.');
        return dot < 0 ? "" : module.substring(dot + 1);
    }

}
