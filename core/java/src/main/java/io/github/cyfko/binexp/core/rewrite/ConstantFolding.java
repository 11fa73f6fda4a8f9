package io.github.cyfko.binexp.core.rewrite;

import io.github.cyfko.binexp.core.api.NumberNode;
import io.github.cyfko.binexp.core.api.OperatorNode;
import io.github.cyfko.binexp.core.config.DivisionByZeroPolicy;
import io.github.cyfko.binexp.core.exception.DivisionByZeroException;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Evaluates operations whose two operands are integer literals.
 * <p>
 * {@code + - *} are ordinary integer operations; {@code /} and {@code %} round toward negative infinity
 * (see {@link io.github.cyfko.binexp.core.api.Op#apply}). Operations involving a variable are kept.
 * </p>
 *
 * <p><strong>Zero divisors:</strong></p>
 * <ul>
 *   <li>{@link DivisionByZeroPolicy#FAIL}: the {@link DivisionByZeroException} propagates to the caller</li>
 *   <li>{@link DivisionByZeroPolicy#LEAVE_UNFOLDED}: the node is kept as is and does not count as a change</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ConstantFolding extends BottomUpRule {

    private static final Logger log = Logger.getLogger(ConstantFolding.class.getName());

    private final DivisionByZeroPolicy divisionByZero;

    public ConstantFolding() {
        this(DivisionByZeroPolicy.FAIL);
    }

    public ConstantFolding(DivisionByZeroPolicy divisionByZero) {
        this.divisionByZero = Objects.requireNonNull(divisionByZero, "Division by zero policy is required");
    }

    @Override
    public String name() {
        return "constant-folding";
    }

    @Override
    protected RewriteResult rewriteOperator(OperatorNode node) {
        if (!(node.left() instanceof NumberNode left) || !(node.right() instanceof NumberNode right)) {
            return RewriteResult.unchanged(node);
        }

        try {
            return RewriteResult.changed(new NumberNode(node.op().apply(left.value(), right.value())));
        } catch (DivisionByZeroException e) {
            if (divisionByZero == DivisionByZeroPolicy.FAIL) {
                throw e;
            }
            log.fine(() -> String.format("Leaving '%s' unfolded: %s", node, e.getMessage()));
            return RewriteResult.unchanged(node);
        }
    }
}
