package io.github.cyfko.binexp.core.api;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * A node of a binary arithmetic expression tree.
 * <p>
 * Exactly three variants exist:
 * </p>
 * <ul>
 *   <li>{@link NumberNode} - integer leaf</li>
 *   <li>{@link VariableNode} - opaque identifier leaf, never evaluated</li>
 *   <li>{@link OperatorNode} - one of {@code + - * / %} with two owned children</li>
 * </ul>
 *
 * <p>
 * Nodes are immutable values with structural equality. Rewriting a tree produces new node values;
 * a parent that is replaced discards its old children. Trees are finite and acyclic, and no subtree is
 * shared between two parents of the same tree.
 * </p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * Node tree = new OperatorNode(Op.ADD, new VariableNode("x"), new NumberNode(0));
 * // prefix: "+ x 0", infix: "(x + 0)", postfix: "x 0 +"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface Node permits NumberNode, VariableNode, OperatorNode {

    /**
     * @return {@code true} for {@link NumberNode} and {@link VariableNode}
     */
    boolean isLeaf();

    /**
     * Counts the nodes of this tree, this node included.
     * <p>
     * Uses an explicit stack so that arbitrarily deep trees are measured without recursion.
     * Every successful rewrite strictly decreases this count.
     * </p>
     *
     * @return the number of nodes in the tree rooted at this node
     */
    default int size() {
        int count = 0;
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Node current = pending.pop();
            count++;
            if (current instanceof OperatorNode operator) {
                pending.push(operator.right());
                pending.push(operator.left());
            }
        }
        return count;
    }
}
