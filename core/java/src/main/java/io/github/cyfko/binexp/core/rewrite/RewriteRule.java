package io.github.cyfko.binexp.core.rewrite;

import io.github.cyfko.binexp.core.api.Node;

/**
 * A single-pass transformation of an expression tree.
 * <p>
 * Implementations never modify the tree they receive; they return the rewritten tree together
 * with a flag telling whether anything changed. A rule that changes a tree must return a tree
 * with strictly fewer nodes, which is what makes repeated application terminate.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface RewriteRule {

    /**
     * @return a short human readable name, used in log messages
     */
    String name();

    /**
     * Applies the rule once over the whole tree.
     *
     * @param node the root of the tree to rewrite
     * @return the rewritten root and whether it differs from {@code node}
     */
    RewriteResult rewrite(Node node);
}
