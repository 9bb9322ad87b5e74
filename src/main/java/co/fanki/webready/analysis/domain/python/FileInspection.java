package co.fanki.webready.analysis.domain.python;

import co.fanki.webready.analysis.domain.ClassInfo;
import co.fanki.webready.analysis.domain.FunctionInfo;
import co.fanki.webready.analysis.domain.PurityClassifier;
import co.fanki.webready.analysis.domain.ToolkitRegistry;

import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import static co.fanki.webready.analysis.domain.python.SyntaxTree.field;
import static co.fanki.webready.analysis.domain.python.SyntaxTree.line;
import static co.fanki.webready.analysis.domain.python.SyntaxTree.namedChildren;

/**
 * Walks the syntax tree of one file and extracts its functions and
 * classes together with their usage facts.
 *
 * <p>Names are resolved through a chain of scopes: the module, then each
 * enclosing function, innermost last. Class bodies do not take part in the
 * chain, as in the language itself. A reference counts as external state
 * when it resolves to a variable of an outer scope, to a name declared
 * {@code global}, or to an attribute of the instance ({@code self.x}).</p>
 *
 * <p>Facts of nested functions flow into their enclosing function: UI
 * calls and dynamic imports always, state accesses only when they reach
 * past the enclosing function.</p>
 *
 * <p>Not thread safe. One instance per file.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class FileInspection {

    private static final Set<String> DYNAMIC_IMPORTS = Set.of(
            "__import__", "importlib.import_module", "import_module",
            "importlib.__import__");

    /** Class naming convention of the Qt bindings, e.g. QMessageBox. */
    private static final Pattern QT_CLASS = Pattern.compile("Q[A-Z]\\w*");

    /** Statements that bind names without evaluating anything. */
    private static final Set<String> DECLARATIONS = Set.of(
            "import_statement", "import_from_statement",
            "future_import_statement", "global_statement",
            "nonlocal_statement");

    private final SyntaxTree tree;

    private final ScopeBindings bindings;

    private final String path;

    private final BitSet codeLines;

    private final ToolkitRegistry registry;

    private final Set<String> uiNames;

    private final boolean uiStarImport;

    private final boolean toolkitImported;

    private final int maxDependencies;

    private final List<ClassInfo> classes = new ArrayList<>();

    private final List<FunctionInfo> functions = new ArrayList<>();

    FileInspection(final SyntaxTree theTree, final String thePath,
            final BitSet theCodeLines, final ToolkitRegistry theRegistry,
            final Set<String> theUiNames, final boolean theUiStarImport,
            final boolean theToolkitImported, final int theMaxDependencies) {
        this.tree = theTree;
        this.bindings = new ScopeBindings(theTree);
        this.path = thePath;
        this.codeLines = theCodeLines;
        this.registry = theRegistry;
        this.uiNames = theUiNames;
        this.uiStarImport = theUiStarImport;
        this.toolkitImported = theToolkitImported;
        this.maxDependencies = theMaxDependencies;
    }

    /** Inspects the module. */
    void inspect() {
        final Scope scope = Scope.module();
        final List<TSNode> body = namedChildren(tree.root());
        bindings.collect(body, scope);
        moduleStatements(body, List.of(scope));
        classes.sort(Comparator.comparingInt(ClassInfo::startLine));
    }

    /** Returns every class of the file, nested ones included. */
    List<ClassInfo> classes() {
        return List.copyOf(classes);
    }

    /** Returns the module level functions. */
    List<FunctionInfo> functions() {
        return List.copyOf(functions);
    }

    /**
     * Counts the code lines between two lines, both inclusive.
     *
     * @param from the first line
     * @param to the last line
     * @return the non-blank, non-comment lines in the range
     */
    int codeLinesBetween(final int from, final int to) {
        if (to < from) {
            return 0;
        }
        return codeLines.get(from, to + 1).cardinality();
    }

    private void moduleStatements(final List<TSNode> body,
            final List<Scope> chain) {
        for (final TSNode statement : body) {
            final Definition definition = Definition.of(statement);
            if (definition != null && definition.isFunction()) {
                functions.add(function(definition, chain, false).info());
            } else if (definition != null) {
                classDefinition(definition, chain, null);
            } else if (ScopeBindings.COMPOUND.contains(statement.getType())) {
                moduleStatements(clauses(statement), chain);
            }
        }
    }

    /** Returns the statements and clauses directly inside a compound. */
    private static List<TSNode> clauses(final TSNode compound) {
        final List<TSNode> result = new ArrayList<>();
        for (final TSNode child : namedChildren(compound)) {
            if ("block".equals(child.getType())) {
                result.addAll(namedChildren(child));
            } else if (ScopeBindings.COMPOUND.contains(child.getType())) {
                result.add(child);
            }
        }
        return result;
    }

    private Inspection function(final Definition definition,
            final List<Scope> enclosing, final boolean method) {
        final TSNode node = definition.node();
        final Signature signature = signature(field(node, "parameters"),
                field(node, "return_type"));
        final List<TSNode> body = namedChildren(field(node, "body"));

        final Scope scope = Scope.function();
        for (final String parameter : signature.names()) {
            scope.variable(parameter);
        }
        bindings.collect(body, scope);
        if (method && !isDecoratedWith(definition, "staticmethod")
                && !signature.names().isEmpty()) {
            scope.selfName(signature.names().get(0));
        }

        final List<Scope> chain = new ArrayList<>(enclosing);
        chain.add(scope);
        final Walker walker = new Walker(chain);
        walker.walkAll(body);

        final boolean declaresGlobal = scope.hasDeclarations();
        final boolean external = declaresGlobal
                || walker.stateLevel < chain.size() - 1;
        final boolean callsUi = walker.uiCalls > 0;
        final boolean pure = PurityClassifier.isPure(callsUi, external,
                walker.dynamicImport);

        final int startLine = line(node);
        final int endLine = SyntaxTree.endLine(node);
        final FunctionInfo info = new FunctionInfo(
                tree.text(field(node, "name")), path, startLine, endLine,
                codeLinesBetween(startLine, endLine), signature.names(),
                method, callsUi, walker.uiCalls,
                List.copyOf(walker.uiUsage), external, declaresGlobal,
                walker.dynamicImport, walker.dependencies(), pure,
                walker.nested);
        return new Inspection(info, walker.stateLevel, walker.uiCalls,
                walker.uiUsage, walker.dynamicImport);
    }

    private void classDefinition(final Definition definition,
            final List<Scope> enclosing, final Walker bodyWalker) {
        final TSNode node = definition.node();
        final List<FunctionInfo> methods = new ArrayList<>();
        classBody(namedChildren(field(node, "body")), enclosing, bodyWalker,
                methods);

        final List<String> bases = new ArrayList<>();
        boolean uiClass = false;
        for (final TSNode base : bases(node)) {
            final String name = baseName(base);
            bases.add(name);
            uiClass = uiClass || registry.isUiBaseClass(name);
        }
        final int startLine = line(node);
        final int endLine = SyntaxTree.endLine(node);
        classes.add(new ClassInfo(tree.text(field(node, "name")), path,
                bases, uiClass, methods, startLine, endLine,
                codeLinesBetween(startLine, endLine)));
    }

    private void classBody(final List<TSNode> body,
            final List<Scope> enclosing, final Walker bodyWalker,
            final List<FunctionInfo> methods) {
        for (final TSNode statement : body) {
            final Definition definition = Definition.of(statement);
            if (definition != null) {
                if (bodyWalker != null) {
                    bodyWalker.header(definition);
                }
                if (definition.isFunction()) {
                    methods.add(function(definition, enclosing, true).info());
                } else {
                    classDefinition(definition, enclosing, bodyWalker);
                }
            } else if (ScopeBindings.COMPOUND.contains(statement.getType())) {
                if (bodyWalker != null) {
                    for (final TSNode child : namedChildren(statement)) {
                        if (!"block".equals(child.getType())
                                && !ScopeBindings.COMPOUND.contains(
                                        child.getType())) {
                            bodyWalker.walk(child);
                        }
                    }
                }
                classBody(clauses(statement), enclosing, bodyWalker, methods);
            } else if (bodyWalker != null) {
                bodyWalker.walk(statement);
            }
        }
    }

    /** Returns the positional base class expressions of a class. */
    private static List<TSNode> bases(final TSNode classNode) {
        final TSNode superclasses = field(classNode, "superclasses");
        if (superclasses == null) {
            return List.of();
        }
        final List<TSNode> result = new ArrayList<>();
        for (final TSNode argument : namedChildren(superclasses)) {
            if (!"keyword_argument".equals(argument.getType())
                    && !"dictionary_splat".equals(argument.getType())) {
                result.add(argument);
            }
        }
        return result;
    }

    private String baseName(final TSNode base) {
        final String dotted = tree.dotted(base);
        if (dotted != null) {
            return dotted;
        }
        if ("subscript".equals(base.getType())) {
            final String generic = tree.dotted(field(base, "value"));
            if (generic != null) {
                return generic;
            }
        }
        return "<expression>";
    }

    private boolean isDecoratedWith(final Definition definition,
            final String decorator) {
        for (final TSNode expression : definition.decorators()) {
            if ("identifier".equals(expression.getType())
                    && decorator.equals(tree.text(expression))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reads the parameter list of a function or lambda.
     *
     * @param parameters the parameters node, null when there are none
     * @param returnType the return annotation, null when absent
     * @return the parameter names, star parameters included, and the
     *     defaults and annotations evaluated in the enclosing scope
     */
    private Signature signature(final TSNode parameters,
            final TSNode returnType) {
        final List<String> names = new ArrayList<>();
        final List<TSNode> header = new ArrayList<>();
        if (parameters != null) {
            for (final TSNode parameter : namedChildren(parameters)) {
                switch (parameter.getType()) {
                    case "identifier":
                    case "list_splat_pattern":
                    case "dictionary_splat_pattern":
                        parameterName(parameter, names);
                        break;
                    case "typed_parameter":
                        parameterName(parameter.getNamedChild(0), names);
                        addIfPresent(field(parameter, "type"), header);
                        break;
                    case "default_parameter":
                    case "typed_default_parameter":
                        parameterName(field(parameter, "name"), names);
                        addIfPresent(field(parameter, "type"), header);
                        addIfPresent(field(parameter, "value"), header);
                        break;
                    default:
                        break;
                }
            }
        }
        addIfPresent(returnType, header);
        return new Signature(names, header);
    }

    private void parameterName(final TSNode parameter,
            final List<String> names) {
        if (parameter == null) {
            return;
        }
        if ("identifier".equals(parameter.getType())) {
            names.add(tree.text(parameter));
        } else if (parameter.getNamedChildCount() > 0) {
            parameterName(parameter.getNamedChild(0), names);
        }
    }

    private static void addIfPresent(final TSNode node,
            final List<TSNode> nodes) {
        if (node != null) {
            nodes.add(node);
        }
    }

    /**
     * A function or class statement with its decorators.
     *
     * @param node the {@code function_definition} or
     *     {@code class_definition}
     * @param decorators the decorator expressions, outermost first
     */
    private record Definition(TSNode node, List<TSNode> decorators) {

        /** Returns the definition a statement holds, or null. */
        static Definition of(final TSNode statement) {
            switch (statement.getType()) {
                case "function_definition":
                case "class_definition":
                    return new Definition(statement, List.of());
                case "decorated_definition":
                    final List<TSNode> decorators = new ArrayList<>();
                    for (final TSNode child : namedChildren(statement)) {
                        if ("decorator".equals(child.getType())
                                && child.getNamedChildCount() > 0) {
                            decorators.add(child.getNamedChild(0));
                        }
                    }
                    return new Definition(field(statement, "definition"),
                            decorators);
                default:
                    return null;
            }
        }

        boolean isFunction() {
            return "function_definition".equals(node.getType());
        }
    }

    /** Parameter names, then the expressions of the header. */
    private record Signature(List<String> names, List<TSNode> header) {
    }

    /** The outcome of inspecting one function, as seen by its parent. */
    private record Inspection(FunctionInfo info, int stateLevel,
            int uiCalls, Set<String> uiUsage, boolean dynamicImport) {
    }

    /** Gathers the facts of one function body. */
    private final class Walker {

        private final List<Scope> chain;

        private final int level;

        /** Outermost scope level holding state the body touches. */
        private int stateLevel = Integer.MAX_VALUE;

        private int uiCalls;

        private final Set<String> uiUsage = new LinkedHashSet<>();

        private final Set<String> calls = new LinkedHashSet<>();

        private boolean dynamicImport;

        private final List<FunctionInfo> nested = new ArrayList<>();

        private Walker(final List<Scope> theChain) {
            this.chain = new ArrayList<>(theChain);
            this.level = theChain.size() - 1;
        }

        private List<String> dependencies() {
            return calls.stream().limit(maxDependencies).toList();
        }

        private void walkAll(final List<TSNode> nodes) {
            for (final TSNode node : nodes) {
                walk(node);
            }
        }

        private void walk(final TSNode node) {
            final String type = node.getType();
            if (DECLARATIONS.contains(type)) {
                return;
            }
            switch (type) {
                case "identifier":
                    reference(tree.text(node));
                    break;
                case "attribute":
                    final TSNode owner = field(node, "object");
                    if ("identifier".equals(owner.getType())) {
                        instanceAttribute(tree.text(owner));
                    }
                    walk(owner);
                    break;
                case "call":
                    call(node);
                    break;
                case "lambda":
                    lambda(node);
                    break;
                case "keyword_argument":
                    final TSNode value = field(node, "value");
                    if (value != null) {
                        walk(value);
                    }
                    break;
                case "keyword_pattern":
                    final List<TSNode> parts = namedChildren(node);
                    walkAll(parts.subList(Math.min(1, parts.size()),
                            parts.size()));
                    break;
                case "function_definition":
                case "class_definition":
                case "decorated_definition":
                    definition(Definition.of(node));
                    break;
                default:
                    walkAll(namedChildren(node));
            }
        }

        /** Walks what a definition evaluates in the enclosing scope. */
        private void header(final Definition definition) {
            walkAll(definition.decorators());
            final TSNode node = definition.node();
            if (definition.isFunction()) {
                walkAll(signature(field(node, "parameters"),
                        field(node, "return_type")).header());
            } else {
                final TSNode superclasses = field(node, "superclasses");
                if (superclasses != null) {
                    walk(superclasses);
                }
            }
        }

        private void definition(final Definition definition) {
            header(definition);
            if (!definition.isFunction()) {
                classDefinition(definition, chain, this);
                return;
            }
            final Inspection inner = function(definition, chain, false);
            nested.add(inner.info());
            uiCalls += inner.uiCalls();
            uiUsage.addAll(inner.uiUsage());
            dynamicImport = dynamicImport || inner.dynamicImport();
            stateLevel = Math.min(stateLevel, inner.stateLevel());
        }

        private void lambda(final TSNode lambda) {
            final Signature signature = signature(
                    field(lambda, "parameters"), null);
            walkAll(signature.header());
            final Scope scope = Scope.function();
            for (final String parameter : signature.names()) {
                scope.variable(parameter);
            }
            final TSNode body = field(lambda, "body");
            bindings.expression(body, scope);
            chain.add(scope);
            try {
                walk(body);
            } finally {
                chain.remove(chain.size() - 1);
            }
        }

        private void call(final TSNode call) {
            final TSNode function = field(call, "function");
            final String callee = tree.dotted(function);
            if (callee != null) {
                final String last = callee.substring(
                        callee.lastIndexOf('.') + 1);
                if (!last.startsWith("_")) {
                    calls.add(callee);
                }
                if (DYNAMIC_IMPORTS.contains(callee)) {
                    dynamicImport = true;
                }
                final String usage = describeUiCall(callee, last,
                        "attribute".equals(function.getType()));
                if (usage != null) {
                    uiCalls++;
                    uiUsage.add(usage);
                }
            }
            walk(function);
            final TSNode arguments = field(call, "arguments");
            if (arguments != null) {
                walk(arguments);
            }
        }
        /**
         * Describes the UI call, or returns null when the callee is not
         * GUI code.
         */
        private String describeUiCall(final String callee, final String last,
                final boolean attribute) {
            final int dot = callee.indexOf('.');
            final String root = dot < 0 ? callee : callee.substring(0, dot);
            if (!shadowed(root)) {
                if (uiNames.contains(root)) {
                    return callee;
                }
                if (uiStarImport && (registry.isUiBaseClass(root)
                        || QT_CLASS.matcher(root).matches())) {
                    return callee;
                }
            }
            if (toolkitImported && attribute && registry.isUiMethod(last)) {
                return "." + last + "()";
            }
            return null;
        }

        /** A UI name rebound by a local variable or parameter. */
        private boolean shadowed(final String name) {
            final int resolved = resolve(name);
            return resolved >= 1 && chain.get(resolved).isVariable(name);
        }

        private void reference(final String name) {
            final int resolved = resolve(name);
            if (resolved < 0 || resolved >= level) {
                return;
            }
            final Scope scope = chain.get(resolved);
            if (resolved == 0 && declaredGlobal(name)) {
                state(0);
            } else if (scope.isState(name)) {
                state(resolved);
            }
        }

        private void instanceAttribute(final String owner) {
            final int resolved = resolve(owner);
            if (resolved >= 1 && chain.get(resolved).isSelf(owner)) {
                state(0);
            }
        }

        private boolean declaredGlobal(final String name) {
            for (int i = chain.size() - 1; i >= 1; i--) {
                if (chain.get(i).declaresGlobal(name)) {
                    return true;
                }
            }
            return false;
        }

        /**
         * Finds the scope level a name resolves to.
         *
         * @return the level, 0 for the module, -1 for builtins and unknown
         *     names
         */
        private int resolve(final String name) {
            for (int i = chain.size() - 1; i >= 1; i--) {
                final Scope scope = chain.get(i);
                if (scope.declaresGlobal(name)) {
                    return 0;
                }
                if (scope.declaresNonlocal(name)) {
                    continue;
                }
                if (scope.binds(name)) {
                    return i;
                }
            }
            return chain.get(0).binds(name) || declaredGlobal(name) ? 0 : -1;
        }

        private void state(final int scopeLevel) {
            stateLevel = Math.min(stateLevel, scopeLevel);
        }
    }

}
