package io.github.cyfko.binexp.core.parsing;

/**
 * Position of an operator relative to its two operands in rendered text.
 */
public enum Notation {
    /** Operator before both operands: {@code + x 0} */
    PREFIX,
    /** Operator between operands, every operation parenthesized: {@code (x + 0)} */
    INFIX,
    /** Operator after both operands: {@code x 0 +} */
    POSTFIX;
}
