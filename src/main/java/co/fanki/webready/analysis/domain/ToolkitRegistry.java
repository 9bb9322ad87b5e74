package co.fanki.webready.analysis.domain;

import co.fanki.webready.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable lookup table of the GUI toolkits the engine knows about.
 *
 * <p>Maps each toolkit root module to the submodules that count as GUI
 * code. The {@link #WILDCARD} entry means any submodule of the root
 * counts. The registry also knows the toolkit base class names used to
 * spot UI classes, and the widget method names that mark a call as a UI
 * call.</p>
 *
 * <p>A single instance is built at startup and shared by every run; it
 * holds no mutable state, so it is safe under parallel file analysis.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ToolkitRegistry {

    /** Submodule entry meaning every submodule of the root is GUI code. */
    public static final String WILDCARD = "*";

    private static final List<String> QT_MODULES = List.of(
            "QtWidgets", "QtGui", "QtCore", "QtWebEngineWidgets");

    private final Map<String, Set<String>> toolkits;
    private final Set<String> uiBaseClasses;
    private final Set<String> uiMethods;

    /**
     * Creates a registry.
     *
     * @param theToolkits toolkit root module to GUI submodules
     * @param theUiBaseClasses class names that make a subclass a UI class
     * @param theUiMethods widget method names that mark a UI call
     */
    public ToolkitRegistry(final Map<String, ? extends Collection<String>> theToolkits,
            final Collection<String> theUiBaseClasses,
            final Collection<String> theUiMethods) {
        Preconditions.requireNonNull(theToolkits, "Toolkits are required");
        final Map<String, Set<String>> copy = new LinkedHashMap<>();
        theToolkits.forEach((root, modules) -> copy.put(root,
                Set.copyOf(modules)));
        this.toolkits = Map.copyOf(copy);
        this.uiBaseClasses = Set.copyOf(Preconditions.requireNonNull(
                theUiBaseClasses, "UI base classes are required"));
        this.uiMethods = Set.copyOf(Preconditions.requireNonNull(
                theUiMethods, "UI methods are required"));
    }

    /**
     * Builds the registry of the supported desktop toolkits: the Qt
     * bindings, tkinter and wxPython.
     *
     * @return the standard registry
     */
    public static ToolkitRegistry standard() {
        final Map<String, List<String>> toolkits = new LinkedHashMap<>();
        toolkits.put("PyQt5", withUic(QT_MODULES));
        toolkits.put("PyQt6", withUic(QT_MODULES));
        toolkits.put("PySide2", QT_MODULES);
        toolkits.put("PySide6", QT_MODULES);
        toolkits.put("tkinter", List.of(WILDCARD));
        toolkits.put("wx", List.of(WILDCARD));

        final List<String> baseClasses = List.of(
                "QWidget", "QMainWindow", "QDialog", "QFrame", "QScrollArea",
                "QPushButton", "QLabel", "QLineEdit", "QTextEdit",
                "QComboBox", "QCheckBox", "QRadioButton", "QSlider",
                "QProgressBar", "QTableWidget", "QListWidget", "QTreeWidget",
                "QGraphicsView", "QGraphicsScene", "QGraphicsItem",
                "QApplication",
                "Tk", "Toplevel", "Frame", "Canvas", "Button", "Label");

        final List<String> methods = List.of(
                "show", "hide", "close", "exec", "exec_",
                "setText", "setEnabled", "setVisible",
                "addWidget", "setLayout", "setCentralWidget",
                "mainloop", "pack", "grid", "place");

        return new ToolkitRegistry(toolkits, baseClasses, methods);
    }

    private static List<String> withUic(final List<String> modules) {
        final List<String> result = new ArrayList<>(modules);
        result.add("uic");
        return result;
    }

    /**
     * Returns the toolkits imported by a file.
     *
     * @param imports the imports of one file
     * @return the toolkit names, sorted
     */
    public Set<String> detectToolkits(final Collection<Import> imports) {
        final Set<String> detected = new TreeSet<>();
        for (final Import anImport : imports) {
            toolkitOf(anImport.module()).ifPresent(detected::add);
        }
        return detected;
    }

    /**
     * Resolves the toolkit a module belongs to.
     *
     * <p>The root module must match a toolkit exactly. A bare root import
     * counts; a submodule counts when it is registered for the toolkit or
     * the toolkit is a wildcard entry. Only the first segment below the
     * root is checked, so {@code PyQt5.QtCore.Qt} is a QtCore import.
     * Relative modules such as {@code .} or {@code ..views} belong to the
     * project itself and never resolve.</p>
     *
     * @param module the dotted module path
     * @return the toolkit name, empty when the module is not GUI code
     */
    public Optional<String> toolkitOf(final String module) {
        if (module == null || module.isEmpty() || module.startsWith(".")) {
            return Optional.empty();
        }
        final String[] parts = module.split("\\.");
        final Set<String> submodules = toolkits.get(parts[0]);
        if (submodules == null) {
            return Optional.empty();
        }
        if (parts.length == 1 || submodules.contains(WILDCARD)
                || submodules.contains(parts[1])) {
            return Optional.of(parts[0]);
        }
        return Optional.empty();
    }

    /**
     * Decides whether an import statement brings GUI code in.
     *
     * <p>True for any toolkit module, and also for a {@code from} import
     * that pulls a known UI base class by name from any module.</p>
     *
     * @param module the dotted module path
     * @param names the imported names
     * @param fromImport whether it is a {@code from ... import} statement
     * @return true if the import is a UI import
     */
    public boolean isUiImport(final String module, final Collection<String> names,
            final boolean fromImport) {
        if (toolkitOf(module).isPresent()) {
            return true;
        }
        return fromImport && names.stream().anyMatch(uiBaseClasses::contains);
    }

    /**
     * Checks whether a base class name is a known UI base type.
     *
     * <p>Case sensitive. Dotted names are matched on their last segment,
     * so {@code QtWidgets.QMainWindow} and {@code tk.Frame} match.</p>
     *
     * @param name the base class expression as written
     * @return true if it names a UI base type
     */
    public boolean isUiBaseClass(final String name) {
        if (name == null) {
            return false;
        }
        return uiBaseClasses.contains(name.substring(name.lastIndexOf('.') + 1));
    }

    /**
     * Checks whether a method name is a known widget method.
     *
     * @param name the method name
     * @return true if calling it is a UI call
     */
    public boolean isUiMethod(final String name) {
        return uiMethods.contains(name);
    }

    /**
     * Returns the registered toolkit names.
     *
     * @return the toolkit names, sorted
     */
    public Set<String> toolkitNames() {
        return new TreeSet<>(toolkits.keySet());
    }

}
