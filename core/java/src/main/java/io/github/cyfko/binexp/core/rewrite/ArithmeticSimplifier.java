package io.github.cyfko.binexp.core.rewrite;

import io.github.cyfko.binexp.core.api.Node;
import io.github.cyfko.binexp.core.config.ConvergenceMode;
import io.github.cyfko.binexp.core.config.SimplifierPolicy;
import io.github.cyfko.binexp.core.exception.DivisionByZeroException;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Applies the arithmetic rewrite rules to an expression tree until it reaches a fixpoint.
 * <p>
 * One pass runs, in this order:
 * </p>
 * <ol>
 *   <li>Additive identity: {@code x + 0 → x}</li>
 *   <li>Multiplicative identity: {@code x * 1 → x}</li>
 *   <li>Multiplication by zero: {@code x * 0 → 0}</li>
 *   <li>Constant folding: {@code 1 + 2 → 3}</li>
 * </ol>
 * <p>
 * Passes are repeated according to {@link SimplifierPolicy#convergence()}. Every rule that changes the tree
 * strictly reduces its node count, so the loop always terminates.
 * </p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * ArithmeticSimplifier simplifier = new ArithmeticSimplifier();
 * Node simplified = simplifier.simplify(parser.parse("+ 0 * 1 x"));
 * // simplified: VariableNode x
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ArithmeticSimplifier {

    private static final Logger log = Logger.getLogger(ArithmeticSimplifier.class.getName());

    private final SimplifierPolicy policy;
    private final List<RewriteRule> rules;

    /**
     * Default constructor using {@link SimplifierPolicy#defaults()}.
     */
    public ArithmeticSimplifier() {
        this(SimplifierPolicy.defaults());
    }

    public ArithmeticSimplifier(SimplifierPolicy policy) {
        this(policy, defaultRules(policy));
    }

    ArithmeticSimplifier(SimplifierPolicy policy, List<RewriteRule> rules) {
        this.policy = Objects.requireNonNull(policy, "Simplifier policy is required");
        Objects.requireNonNull(rules, "Rules cannot be null");
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("At least one rewrite rule is required");
        }
        this.rules = List.copyOf(rules);
    }

    /**
     * Builds the fixed rule sequence of one simplification pass.
     *
     * @param policy supplies the division by zero handling of constant folding
     * @return additive identity, multiplicative identity, multiplication by zero, constant folding
     */
    public static List<RewriteRule> defaultRules(SimplifierPolicy policy) {
        Objects.requireNonNull(policy, "Simplifier policy is required");
        return List.of(
                IdentityElimination.ADDITIVE,
                IdentityElimination.MULTIPLICATIVE,
                MultiplicationByZero.INSTANCE,
                new ConstantFolding(policy.divisionByZero())
        );
    }

    public SimplifierPolicy getPolicy() {
        return policy;
    }

    /**
     * Simplifies the tree to a fixpoint.
     *
     * @param node the root of the tree; it is not modified
     * @return the simplified tree
     * @throws DivisionByZeroException if folding meets a zero divisor under {@code DivisionByZeroPolicy.FAIL}
     */
    public Node simplify(Node node) {
        Objects.requireNonNull(node, "Node cannot be null");

        Node current = node;
        int passes = 0;
        boolean repeat;

        do {
            passes++;
            boolean anyChanged = false;
            boolean lastChanged = false;

            for (RewriteRule rule : rules) {
                RewriteResult result = rule.rewrite(current);
                if (result.changed()) {
                    Node before = current;
                    Node after = result.node();
                    log.finer(() -> String.format(
                            "Rule %s rewrote tree: %d -> %d nodes", rule.name(), before.size(), after.size()
                    ));
                }
                current = result.node();
                anyChanged |= result.changed();
                lastChanged = result.changed();
            }

            // In folding-driven mode only the final rule of the pass decides
            repeat = policy.convergence() == ConvergenceMode.ANY_RULE ? anyChanged : lastChanged;
        } while (repeat);

        Node simplified = current;
        int passCount = passes;
        log.fine(() -> String.format(
                "Simplified expression in %d pass(es): %d -> %d nodes. Policy applied: %s",
                passCount, node.size(), simplified.size(), policy.policyName()
        ));

        return simplified;
    }
}
