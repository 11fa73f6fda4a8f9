package io.github.cyfko.binexp.core.rewrite;

import io.github.cyfko.binexp.core.api.Node;
import io.github.cyfko.binexp.core.api.OperatorNode;

/**
 * Base class for rules that rewrite operator nodes after their children.
 * <p>
 * Leaves are returned as is. For an operator node, both children are rewritten first, the node is rebuilt
 * with the new children, and only then {@link #rewriteOperator(OperatorNode)} examines it.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class BottomUpRule implements RewriteRule {

    @Override
    public final RewriteResult rewrite(Node node) {
        if (!(node instanceof OperatorNode operator)) {
            return RewriteResult.unchanged(node);
        }

        RewriteResult left = rewrite(operator.left());
        RewriteResult right = rewrite(operator.right());
        OperatorNode rebuilt = operator.withChildren(left.node(), right.node());

        RewriteResult self = rewriteOperator(rebuilt);
        return RewriteResult.merge(self.node(), left, right, self);
    }

    /**
     * Examines one operator node whose children have already been rewritten.
     *
     * @param node the operator node
     * @return the replacement, or {@link RewriteResult#unchanged(Node)} with {@code node} itself
     */
    protected abstract RewriteResult rewriteOperator(OperatorNode node);
}
