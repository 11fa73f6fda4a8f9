package io.github.cyfko.binexp.core.api;

import java.util.Objects;

/**
 * Binary operator node of an expression tree.
 * <p>
 * Both children are always present; a partially constructed operator node cannot exist.
 * </p>
 *
 * @param op    the operator
 * @param left  the left operand
 * @param right the right operand
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record OperatorNode(Op op, Node left, Node right) implements Node {

    public OperatorNode {
        Objects.requireNonNull(op, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    /**
     * Returns this node with its children replaced, or this very instance when both children are unchanged.
     *
     * @param newLeft  the left operand to use
     * @param newRight the right operand to use
     * @return an operator node with the same operator and the given children
     */
    public OperatorNode withChildren(Node newLeft, Node newRight) {
        if (newLeft == left && newRight == right) {
            return this;
        }
        return new OperatorNode(op, newLeft, newRight);
    }

    @Override
    public boolean isLeaf() {
        return false;
    }

    @Override
    public String toString() {
        return op.getSymbol() + " " + left + " " + right;
    }
}
