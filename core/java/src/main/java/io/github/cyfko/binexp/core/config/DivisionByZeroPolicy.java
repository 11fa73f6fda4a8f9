package io.github.cyfko.binexp.core.config;

/**
 * Policies for constant folding of a division or modulo by zero.
 */
public enum DivisionByZeroPolicy {
    /** Abort the whole simplification with a DivisionByZeroException. */
    FAIL,
    /** Keep the offending subtree unfolded and continue with the rest of the tree. */
    LEAVE_UNFOLDED;
}
