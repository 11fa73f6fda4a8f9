package io.github.cyfko.binexp.core.rewrite;

import io.github.cyfko.binexp.core.api.Node;

import java.util.Objects;

/**
 * Outcome of applying a {@link RewriteRule}: the resulting tree and whether the rule changed anything.
 *
 * @param node    the resulting tree
 * @param changed {@code true} if at least one node was rewritten
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record RewriteResult(Node node, boolean changed) {

    public RewriteResult {
        Objects.requireNonNull(node, "Node cannot be null");
    }

    public static RewriteResult changed(Node node) {
        return new RewriteResult(node, true);
    }

    public static RewriteResult unchanged(Node node) {
        return new RewriteResult(node, false);
    }

    /**
     * Combines the outcomes of the steps that produced {@code node}.
     *
     * @param node  the final tree
     * @param steps the outcomes of the intermediate rewrites
     * @return a result that is changed if any step changed something
     */
    public static RewriteResult merge(Node node, RewriteResult... steps) {
        for (RewriteResult step : steps) {
            if (step.changed()) {
                return changed(node);
            }
        }
        return unchanged(node);
    }
}
