package co.fanki.webready.analysis.domain.python;

import org.treesitter.TSNode;

import java.util.List;
import java.util.Set;

import static co.fanki.webready.analysis.domain.python.SyntaxTree.field;
import static co.fanki.webready.analysis.domain.python.SyntaxTree.fields;
import static co.fanki.webready.analysis.domain.python.SyntaxTree.namedChildren;

/**
 * Collects the names a block of statements binds in its own scope.
 *
 * <p>Nested function and class bodies are not entered, only their names
 * are bound. Comprehension targets are bound in the enclosing scope, which
 * is close enough for deciding whether a reference is local.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class ScopeBindings {

    /** Statements made of clauses and blocks, e.g. if, try or match. */
    static final Set<String> COMPOUND = Set.of("if_statement", "elif_clause",
            "else_clause", "for_statement", "while_statement", "try_statement",
            "except_clause", "except_group_clause", "finally_clause",
            "with_statement", "match_statement", "case_clause");

    /** Nodes grouping several assignment targets. */
    private static final Set<String> TARGET_GROUPS = Set.of("pattern_list",
            "tuple_pattern", "list_pattern", "tuple", "list",
            "expression_list", "parenthesized_expression",
            "list_splat_pattern", "list_splat", "as_pattern_target");

    private final SyntaxTree tree;

    ScopeBindings(final SyntaxTree theTree) {
        this.tree = theTree;
    }

    /**
     * Binds every name of the block into the scope, then seals it.
     *
     * @param body the statements
     * @param scope the scope receiving the names
     */
    void collect(final List<TSNode> body, final Scope scope) {
        for (final TSNode statement : body) {
            statement(statement, scope);
        }
        scope.seal();
    }

    /**
     * Binds the names introduced inside an expression, i.e. comprehension
     * targets and assignment expressions.
     *
     * @param expression the expression
     * @param scope the scope receiving the names
     */
    void expression(final TSNode expression, final Scope scope) {
        switch (expression.getType()) {
            case "lambda":
                return;
            case "named_expression":
                target(field(expression, "name"), scope);
                expression(field(expression, "value"), scope);
                return;
            case "for_in_clause":
                for (final TSNode target : fields(expression, "left")) {
                    target(target, scope);
                }
                for (final TSNode source : fields(expression, "right")) {
                    expression(source, scope);
                }
                return;
            case "as_pattern":
                for (int i = 0; i < expression.getChildCount(); i++) {
                    final TSNode child = expression.getChild(i);
                    if ("alias".equals(expression.getFieldNameForChild(i))) {
                        target(child, scope);
                    } else if (child.isNamed()) {
                        expression(child, scope);
                    }
                }
                return;
            default:
                for (final TSNode child : namedChildren(expression)) {
                    expression(child, scope);
                }
        }
    }

    private void statement(final TSNode statement, final Scope scope) {
        final String type = statement.getType();
        switch (type) {
            case "expression_statement":
                for (final TSNode child : namedChildren(statement)) {
                    assignment(child, scope);
                }
                break;
            case "import_statement":
                for (final TSNode name : fields(statement, "name")) {
                    scope.definition(boundName(name, false));
                }
                break;
            case "import_from_statement":
                for (final TSNode name : fields(statement, "name")) {
                    scope.definition(boundName(name, true));
                }
                break;
            case "function_definition":
            case "class_definition":
                scope.definition(tree.text(field(statement, "name")));
                break;
            case "decorated_definition":
                statement(field(statement, "definition"), scope);
                break;
            case "global_statement":
                for (final TSNode name : namedChildren(statement)) {
                    scope.global(tree.text(name));
                }
                break;
            case "nonlocal_statement":
                for (final TSNode name : namedChildren(statement)) {
                    scope.nonlocal(tree.text(name));
                }
                break;
            case "delete_statement":
                for (final TSNode target : namedChildren(statement)) {
                    target(target, scope);
                }
                break;
            case "future_import_statement":
                break;
            default:
                if (COMPOUND.contains(type)) {
                    compound(statement, scope);
                } else {
                    expression(statement, scope);
                }
        }
    }

    private void compound(final TSNode statement, final Scope scope) {
        for (int i = 0; i < statement.getChildCount(); i++) {
            final TSNode child = statement.getChild(i);
            final String type = child.getType();
            if (!child.isNamed() || "comment".equals(type)) {
                continue;
            }
            if ("left".equals(statement.getFieldNameForChild(i))) {
                target(child, scope);
            } else if ("block".equals(type)) {
                for (final TSNode inner : namedChildren(child)) {
                    statement(inner, scope);
                }
            } else if (COMPOUND.contains(type)) {
                compound(child, scope);
            } else if ("case_pattern".equals(type)) {
                pattern(child, scope);
            } else {
                expression(child, scope);
            }
        }
    }

    private void assignment(final TSNode node, final Scope scope) {
        if ("assignment".equals(node.getType())) {
            target(field(node, "left"), scope);
            final TSNode right = field(node, "right");
            if (right != null) {
                assignment(right, scope);
            }
        } else if ("augmented_assignment".equals(node.getType())) {
            target(field(node, "left"), scope);
            expression(field(node, "right"), scope);
        } else {
            expression(node, scope);
        }
    }

    private void target(final TSNode target, final Scope scope) {
        if (target == null) {
            return;
        }
        if ("identifier".equals(target.getType())) {
            scope.variable(tree.text(target));
        } else if (TARGET_GROUPS.contains(target.getType())) {
            for (final TSNode child : namedChildren(target)) {
                target(child, scope);
            }
        } else {
            expression(target, scope);
        }
    }

    /** Binds the capture names of a match case pattern. */
    private void pattern(final TSNode pattern, final Scope scope) {
        final List<TSNode> children = namedChildren(pattern);
        switch (pattern.getType()) {
            case "dotted_name":
                if (children.size() == 1) {
                    final String name = tree.text(children.get(0));
                    if (!"_".equals(name)) {
                        scope.variable(name);
                    }
                }
                return;
            case "identifier":
                scope.variable(tree.text(pattern));
                return;
            case "class_pattern":
            case "keyword_pattern":
                for (final TSNode child : children.subList(
                        Math.min(1, children.size()), children.size())) {
                    pattern(child, scope);
                }
                return;
            default:
                for (final TSNode child : children) {
                    pattern(child, scope);
                }
        }
    }

    /**
     * Returns the name an import binds.
     *
     * @param name a {@code dotted_name} or an {@code aliased_import}
     * @param fromImport whether it comes from a {@code from} import
     * @return the alias, the imported name, or the root package of a plain
     *     import
     */
    String boundName(final TSNode name, final boolean fromImport) {
        if ("aliased_import".equals(name.getType())) {
            return tree.text(field(name, "alias"));
        }
        if (fromImport) {
            return tree.dotted(name);
        }
        return tree.text(namedChildren(name).get(0));
    }

}
