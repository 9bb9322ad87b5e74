package co.fanki.webready.analysis.domain.python;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Names bound by one scope: the module, a function or a lambda.
 *
 * <p>Variables are names bound by assignment-like statements and by
 * parameters; definitions are names bound by {@code def}, {@code class}
 * and {@code import}. Only variables are state: referring to another
 * scope's function or imported module is not a state access.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class Scope {

    /** Module level names treated as constants, e.g. MAX_SIZE or _LIMIT. */
    private static final Pattern CONSTANT = Pattern.compile(
            "_*[A-Z][A-Z0-9_]*");

    /** Dunder names such as __all__ or __version__. */
    private static final Pattern DUNDER = Pattern.compile("__\\w+__");

    private final boolean module;

    private final Set<String> variables = new HashSet<>();

    private final Set<String> definitions = new HashSet<>();

    private final Set<String> globals = new HashSet<>();

    private final Set<String> nonlocals = new HashSet<>();

    private String selfName;

    private Scope(final boolean isModule) {
        this.module = isModule;
    }

    static Scope module() {
        return new Scope(true);
    }

    static Scope function() {
        return new Scope(false);
    }

    void variable(final String name) {
        variables.add(name);
    }

    void definition(final String name) {
        definitions.add(name);
    }

    void global(final String name) {
        globals.add(name);
    }

    void nonlocal(final String name) {
        nonlocals.add(name);
    }

    void selfName(final String name) {
        selfName = name;
    }

    /** Removes declared names, which belong to an outer scope. */
    void seal() {
        variables.removeAll(globals);
        variables.removeAll(nonlocals);
        definitions.removeAll(globals);
        definitions.removeAll(nonlocals);
    }

    boolean binds(final String name) {
        return variables.contains(name) || definitions.contains(name);
    }

    boolean isVariable(final String name) {
        return variables.contains(name);
    }

    boolean declaresGlobal(final String name) {
        return globals.contains(name);
    }

    boolean declaresNonlocal(final String name) {
        return nonlocals.contains(name);
    }

    boolean hasDeclarations() {
        return !globals.isEmpty() || !nonlocals.isEmpty();
    }

    boolean isSelf(final String name) {
        return name.equals(selfName);
    }

    /**
     * Checks whether referring to the name from an inner function reads or
     * writes mutable state.
     *
     * @param name the bound name
     * @return true for variables, excluding module level constants
     */
    boolean isState(final String name) {
        if (!variables.contains(name)) {
            return false;
        }
        if (!module) {
            return true;
        }
        return !definitions.contains(name)
                && !CONSTANT.matcher(name).matches()
                && !DUNDER.matcher(name).matches();
    }

}
