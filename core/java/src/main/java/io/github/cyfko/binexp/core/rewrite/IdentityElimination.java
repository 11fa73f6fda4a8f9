package io.github.cyfko.binexp.core.rewrite;

import io.github.cyfko.binexp.core.api.Node;
import io.github.cyfko.binexp.core.api.NumberNode;
import io.github.cyfko.binexp.core.api.Op;
import io.github.cyfko.binexp.core.api.OperatorNode;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Removes an operation whose one operand is the identity element of the operator.
 * <p>
 * When the left operand is the identity the node becomes its right operand, and vice versa.
 * If both operands are the identity, the left one is matched first so the right operand is kept.
 * </p>
 * <ul>
 *   <li>{@link #ADDITIVE}: {@code x + 0 → x}, {@code 0 + x → x}</li>
 *   <li>{@link #MULTIPLICATIVE}: {@code x * 1 → x}, {@code 1 * x → x}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class IdentityElimination extends BottomUpRule {

    public static final IdentityElimination ADDITIVE = new IdentityElimination(Op.ADD, BigInteger.ZERO);

    public static final IdentityElimination MULTIPLICATIVE = new IdentityElimination(Op.MULTIPLY, BigInteger.ONE);

    private final Op op;
    private final BigInteger identity;

    /**
     * @param op       the operator whose identity is eliminated
     * @param identity the identity element of {@code op}
     */
    public IdentityElimination(Op op, BigInteger identity) {
        this.op = Objects.requireNonNull(op, "Operator cannot be null");
        this.identity = Objects.requireNonNull(identity, "Identity value cannot be null");
    }

    @Override
    public String name() {
        return "identity(" + op.getSymbol() + ", " + identity + ")";
    }

    @Override
    protected RewriteResult rewriteOperator(OperatorNode node) {
        if (node.op() != op) {
            return RewriteResult.unchanged(node);
        }
        if (isIdentity(node.left())) {
            return RewriteResult.changed(node.right());
        }
        if (isIdentity(node.right())) {
            return RewriteResult.changed(node.left());
        }
        return RewriteResult.unchanged(node);
    }

    private boolean isIdentity(Node operand) {
        return operand instanceof NumberNode number && number.hasValue(identity);
    }
}
