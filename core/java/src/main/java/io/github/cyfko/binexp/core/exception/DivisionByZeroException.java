package io.github.cyfko.binexp.core.exception;

import io.github.cyfko.binexp.core.api.Op;
import io.github.cyfko.binexp.core.config.DivisionByZeroPolicy;

/**
 * Exception thrown when constant folding evaluates a {@code /} or {@code %} node whose divisor is zero.
 * <p>
 * Under {@link DivisionByZeroPolicy#FAIL} it aborts the whole simplification and reaches the caller
 * unchanged. The failing operator is available through {@link #operator()}; modulo failures use the
 * {@link ModuloByZeroException} subtype.
 * </p>
 *
 * <pre>{@code
 * try {
 *     simplifier.simplify(parser.parse("/ 5 0"));
 * } catch (DivisionByZeroException e) {
 *     log.warning("Cannot fold expression: " + e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DivisionByZeroException extends ArithmeticException {

    private final Op operator;

    /**
     * Constructor with an explanatory error message.
     *
     * @param message  the message describing the failed evaluation
     * @param operator the operator being folded, {@link Op#DIVIDE} or {@link Op#MODULO}
     */
    public DivisionByZeroException(String message, Op operator) {
        super(message);
        this.operator = operator;
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     *
     * @param message  the message describing the failed evaluation
     * @param operator the operator being folded
     * @param cause    the original cause of this exception
     */
    public DivisionByZeroException(String message, Op operator, Throwable cause) {
        super(message);
        this.operator = operator;
        initCause(cause);
    }

    /**
     * @return the operator whose divisor was zero
     */
    public Op operator() {
        return operator;
    }
}
