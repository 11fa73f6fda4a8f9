package io.github.cyfko.binexp.core.config;

/**
 * Policies for tokens left over once a complete expression has been parsed.
 */
public enum TrailingTokenPolicy {
    /** Silently ignore the remaining tokens, the first complete expression wins. */
    IGNORE,
    /** Throw a MalformedExpressionException naming the first unconsumed token. */
    REJECT;
}
