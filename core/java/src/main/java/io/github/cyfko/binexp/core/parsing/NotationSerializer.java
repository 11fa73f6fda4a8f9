package io.github.cyfko.binexp.core.parsing;

import io.github.cyfko.binexp.core.api.Node;
import io.github.cyfko.binexp.core.api.NumberNode;
import io.github.cyfko.binexp.core.api.OperatorNode;
import io.github.cyfko.binexp.core.api.VariableNode;

import java.util.Objects;

/**
 * Renders expression trees as text.
 * <p>
 * Numbers render as their decimal text, negative values with a leading minus; variables render as
 * their name. Rendering never modifies the tree and never fails on a well-formed tree.
 * </p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * Node tree = parser.parse("* + 1 2 x");
 * NotationSerializer.toPrefix(tree);   // "* + 1 2 x"
 * NotationSerializer.toInfix(tree);    // "((1 + 2) * x)"
 * NotationSerializer.toPostfix(tree);  // "1 2 + x *"
 * }</pre>
 *
 * <p>This class is designed to be used statically and cannot be instantiated.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class NotationSerializer {

    private static final String INDENT = "  ";

    private NotationSerializer() {}

    /**
     * Renders the tree in the requested notation.
     *
     * @param node     the root of the tree
     * @param notation the target notation
     * @return the rendered text
     */
    public static String render(Node node, Notation notation) {
        Objects.requireNonNull(notation, "Notation cannot be null");
        return switch (notation) {
            case PREFIX -> toPrefix(node);
            case INFIX -> toInfix(node);
            case POSTFIX -> toPostfix(node);
        };
    }

    /**
     * @param node the root of the tree
     * @return {@code symbol left right}, space separated
     */
    public static String toPrefix(Node node) {
        Objects.requireNonNull(node, "Node cannot be null");
        StringBuilder out = new StringBuilder();
        appendPrefix(node, out);
        return out.toString();
    }

    /**
     * @param node the root of the tree
     * @return {@code (left symbol right)}, every operation parenthesized
     */
    public static String toInfix(Node node) {
        Objects.requireNonNull(node, "Node cannot be null");
        StringBuilder out = new StringBuilder();
        appendInfix(node, out);
        return out.toString();
    }

    /**
     * @param node the root of the tree
     * @return {@code left right symbol}, space separated
     */
    public static String toPostfix(Node node) {
        Objects.requireNonNull(node, "Node cannot be null");
        StringBuilder out = new StringBuilder();
        appendPostfix(node, out);
        return out.toString();
    }

    /**
     * Renders one node per line, children indented two spaces deeper than their parent.
     * <pre>
     * +
     *   x
     *   *
     *     1
     *     y
     * </pre>
     *
     * @param node the root of the tree
     * @return the multi-line rendering, lines separated by {@code '\n'}, without a trailing newline
     */
    public static String toTree(Node node) {
        Objects.requireNonNull(node, "Node cannot be null");
        StringBuilder out = new StringBuilder();
        appendTree(node, 0, out);
        return out.toString();
    }

    private static void appendPrefix(Node node, StringBuilder out) {
        if (node instanceof OperatorNode operator) {
            out.append(operator.op().getSymbol()).append(' ');
            appendPrefix(operator.left(), out);
            out.append(' ');
            appendPrefix(operator.right(), out);
        } else {
            out.append(leafText(node));
        }
    }

    private static void appendInfix(Node node, StringBuilder out) {
        if (node instanceof OperatorNode operator) {
            out.append('(');
            appendInfix(operator.left(), out);
            out.append(' ').append(operator.op().getSymbol()).append(' ');
            appendInfix(operator.right(), out);
            out.append(')');
        } else {
            out.append(leafText(node));
        }
    }

    private static void appendPostfix(Node node, StringBuilder out) {
        if (node instanceof OperatorNode operator) {
            appendPostfix(operator.left(), out);
            out.append(' ');
            appendPostfix(operator.right(), out);
            out.append(' ').append(operator.op().getSymbol());
        } else {
            out.append(leafText(node));
        }
    }

    private static void appendTree(Node node, int level, StringBuilder out) {
        if (level > 0) {
            out.append('\n');
        }
        out.append(INDENT.repeat(level));
        if (node instanceof OperatorNode operator) {
            out.append(operator.op().getSymbol());
            appendTree(operator.left(), level + 1, out);
            appendTree(operator.right(), level + 1, out);
        } else {
            out.append(leafText(node));
        }
    }

    private static String leafText(Node node) {
        if (node instanceof NumberNode number) {
            return number.value().toString();
        }
        return ((VariableNode) node).name();
    }
}
