package io.github.cyfko.binexp.core.rewrite;

import io.github.cyfko.binexp.core.api.Node;
import io.github.cyfko.binexp.core.api.NumberNode;
import io.github.cyfko.binexp.core.api.Op;
import io.github.cyfko.binexp.core.api.OperatorNode;

import java.math.BigInteger;

/**
 * Replaces {@code x * 0} and {@code 0 * x} with {@code 0}, discarding {@code x} whatever it contains.
 * <p>
 * Discarded operands are never evaluated, so {@code * 0 / 1 0} simplifies to {@code 0}
 * without reporting the division by zero it contained.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class MultiplicationByZero extends BottomUpRule {

    public static final MultiplicationByZero INSTANCE = new MultiplicationByZero();

    private MultiplicationByZero() {}

    @Override
    public String name() {
        return "multiplication-by-zero";
    }

    @Override
    protected RewriteResult rewriteOperator(OperatorNode node) {
        if (node.op() == Op.MULTIPLY && (isZero(node.left()) || isZero(node.right()))) {
            return RewriteResult.changed(new NumberNode(BigInteger.ZERO));
        }
        return RewriteResult.unchanged(node);
    }

    private static boolean isZero(Node operand) {
        return operand instanceof NumberNode number && number.value().signum() == 0;
    }
}
