package io.github.cyfko.binexp.core.api;

import io.github.cyfko.binexp.core.exception.DivisionByZeroException;
import io.github.cyfko.binexp.core.exception.ModuloByZeroException;
import io.github.cyfko.binexp.core.utils.ArithmeticUtils;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Enumeration of the binary arithmetic operators understood by the expression grammar.
 * <p>
 * Each constant carries the single-character symbol used in prefix, infix and postfix text.
 * Evaluation follows integer semantics over {@link BigInteger}, with floor rounding for
 * division and modulo (the result of {@code %} takes the sign of the divisor).
 * </p>
 *
 * <table border="1">
 * <caption>Supported operators</caption>
 * <thead>
 * <tr><th>Constant</th><th>Symbol</th><th>Example</th><th>Result</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>ADD</td><td>+</td><td>+ 1 2</td><td>3</td></tr>
 * <tr><td>SUBTRACT</td><td>-</td><td>- 1 2</td><td>-1</td></tr>
 * <tr><td>MULTIPLY</td><td>*</td><td>* 3 4</td><td>12</td></tr>
 * <tr><td>DIVIDE</td><td>/</td><td>/ -7 2</td><td>-4</td></tr>
 * <tr><td>MODULO</td><td>%</td><td>% -7 2</td><td>1</td></tr>
 * </tbody>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Op {

    /** Addition operator: "+" */
    ADD("+"),

    /** Subtraction operator: "-" */
    SUBTRACT("-"),

    /** Multiplication operator: "*" */
    MULTIPLY("*"),

    /** Floor division operator: "/" */
    DIVIDE("/"),

    /** Floor modulo operator: "%" */
    MODULO("%");

    private final String symbol;

    Op(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the textual symbol of this operator.
     *
     * @return the symbol as it appears in expression text
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Resolves an operator from its textual symbol.
     *
     * @param symbol the token to resolve, may be null
     * @return the matching operator, or an empty optional if the token is not a supported symbol
     */
    public static Optional<Op> fromSymbol(String symbol) {
        if (symbol == null) return Optional.empty();
        for (Op op : values()) {
            if (op.symbol.equals(symbol)) return Optional.of(op);
        }
        return Optional.empty();
    }

    /**
     * Evaluates this operator over two integer operands.
     *
     * @param left  the left operand
     * @param right the right operand
     * @return the result of {@code left op right}
     * @throws DivisionByZeroException if this is {@link #DIVIDE} and {@code right} is zero
     * @throws ModuloByZeroException   if this is {@link #MODULO} and {@code right} is zero
     */
    public BigInteger apply(BigInteger left, BigInteger right) {
        return switch (this) {
            case ADD -> left.add(right);
            case SUBTRACT -> left.subtract(right);
            case MULTIPLY -> left.multiply(right);
            case DIVIDE -> {
                if (right.signum() == 0) {
                    throw new DivisionByZeroException(String.format("Division by zero: %s / %s", left, right), this);
                }
                yield ArithmeticUtils.floorDiv(left, right);
            }
            case MODULO -> {
                if (right.signum() == 0) {
                    throw new ModuloByZeroException(String.format("Modulo by zero: %s %% %s", left, right));
                }
                yield ArithmeticUtils.floorMod(left, right);
            }
        };
    }

    @Override
    public String toString() {
        return symbol;
    }
}
