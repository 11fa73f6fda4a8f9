package io.github.cyfko.binexp.core.config;

/**
 * Decides when the simplifier runs another pass of its rule sequence.
 */
public enum ConvergenceMode {
    /** Repeat while any rule of the last pass changed the tree. */
    ANY_RULE,
    /** Repeat only while constant folding, the final rule of a pass, changed the tree. */
    FOLDING_DRIVEN;
}
