package co.fanki.webready.analysis.domain.python;

import co.fanki.webready.analysis.domain.SourceParseException;

import org.treesitter.TSException;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSPoint;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * A Python file parsed with the tree-sitter Python grammar.
 *
 * <p>tree-sitter positions are byte offsets into the UTF-8 form of the
 * text, so node text is sliced from those bytes. Lines are 1-based.</p>
 *
 * <p>The grammar recovers from syntax errors instead of failing. A tree
 * holding an {@code ERROR} or a missing node is rejected with a
 * {@link SourceParseException} pointing at the first one.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class SyntaxTree {

    private static final TSLanguage PYTHON = new TreeSitterPython();

    /** TSParser is not thread safe, one per analysis thread. */
    private static final ThreadLocal<TSParser> PARSER = ThreadLocal
            .withInitial(() -> {
                final TSParser parser = new TSParser();
                if (!parser.setLanguage(PYTHON)) {
                    throw new IllegalStateException(
                            "Incompatible tree-sitter Python grammar");
                }
                return parser;
            });

    private final TSTree tree;

    private final byte[] utf8;

    private SyntaxTree(final TSTree theTree, final byte[] theUtf8) {
        this.tree = theTree;
        this.utf8 = theUtf8;
    }

    /**
     * Parses a Python source text.
     *
     * @param text the source text, never null
     * @return the syntax tree
     * @throws SourceParseException if the text is not valid Python
     */
    static SyntaxTree parse(final String text) {
        final TSTree tree;
        try {
            tree = PARSER.get().parseString(null, text);
        } catch (final TSException e) {
            throw new SourceParseException("unreadable source: "
                    + e.getMessage(), 1, 1);
        }
        final SyntaxTree syntaxTree = new SyntaxTree(tree,
                text.getBytes(StandardCharsets.UTF_8));
        syntaxTree.rejectErrors(tree.getRootNode());
        return syntaxTree;
    }

    /** Returns the {@code module} node. */
    TSNode root() {
        return tree.getRootNode();
    }

    /**
     * Returns the source text of a node.
     *
     * @param node the node
     * @return the text it spans
     */
    String text(final TSNode node) {
        final int start = node.getStartByte();
        return new String(utf8, start, node.getEndByte() - start,
                StandardCharsets.UTF_8);
    }

    /**
     * Returns the dotted name of a name or attribute chain.
     *
     * @param node the expression
     * @return e.g. "QtWidgets.QMessageBox.warning", or null for anything
     *     that is not a plain chain of names
     */
    String dotted(final TSNode node) {
        switch (node.getType()) {
            case "identifier":
                return text(node);
            case "attribute":
                final TSNode object = field(node, "object");
                final TSNode attribute = field(node, "attribute");
                if (object == null || attribute == null) {
                    return null;
                }
                final String value = dotted(object);
                return value == null ? null : value + "." + text(attribute);
            case "dotted_name":
                final List<String> parts = new ArrayList<>();
                for (final TSNode part : namedChildren(node)) {
                    parts.add(text(part));
                }
                return String.join(".", parts);
            default:
                return null;
        }
    }

    /**
     * Returns a field of a node.
     *
     * @param node the node
     * @param name the grammar field name
     * @return the child, null when the field is absent
     */
    static TSNode field(final TSNode node, final String name) {
        final TSNode child = node.getChildByFieldName(name);
        return child == null || child.isNull() ? null : child;
    }

    /**
     * Returns every child of a node bound to a field.
     *
     * @param node the node
     * @param name the grammar field name, e.g. "name" in an import
     * @return the children in source order
     */
    static List<TSNode> fields(final TSNode node, final String name) {
        final List<TSNode> result = new ArrayList<>();
        for (int i = 0; i < node.getChildCount(); i++) {
            if (name.equals(node.getFieldNameForChild(i))) {
                result.add(node.getChild(i));
            }
        }
        return result;
    }

    /** Returns the named children of a node, comments excluded. */
    static List<TSNode> namedChildren(final TSNode node) {
        final List<TSNode> result = new ArrayList<>();
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            final TSNode child = node.getNamedChild(i);
            if (!"comment".equals(child.getType())) {
                result.add(child);
            }
        }
        return result;
    }

    /** Returns the 1-based line a node starts on. */
    static int line(final TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /**
     * Returns the last line holding code of a node.
     *
     * <p>Trailing comments and the line break ending a block are not part
     * of it.</p>
     *
     * @param node the node
     * @return the 1-based line
     */
    static int endLine(final TSNode node) {
        TSNode last = node;
        while (last.getChildCount() > 0) {
            TSNode candidate = null;
            for (int i = last.getChildCount() - 1; i >= 0; i--) {
                final TSNode child = last.getChild(i);
                if (!"comment".equals(child.getType())
                        && child.getEndByte() > child.getStartByte()) {
                    candidate = child;
                    break;
                }
            }
            if (candidate == null) {
                break;
            }
            last = candidate;
        }
        final TSPoint end = last.getEndPoint();
        if (end.getColumn() == 0 && end.getRow() > last.getStartPoint()
                .getRow()) {
            return end.getRow();
        }
        return end.getRow() + 1;
    }

    private void rejectErrors(final TSNode node) {
        if (node.isMissing()) {
            throw failure("expected " + node.getType(), node);
        }
        if (node.isError()) {
            throw failure("invalid syntax", node);
        }
        if (!node.hasError()) {
            return;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            rejectErrors(node.getChild(i));
        }
        throw failure("invalid syntax", node);
    }

    private SourceParseException failure(final String message,
            final TSNode node) {
        final TSPoint start = node.getStartPoint();
        final int lineStart = node.getStartByte() - start.getColumn();
        final int column = new String(utf8, lineStart, start.getColumn(),
                StandardCharsets.UTF_8).length() + 1;
        return new SourceParseException(message, start.getRow() + 1, column);
    }

}
