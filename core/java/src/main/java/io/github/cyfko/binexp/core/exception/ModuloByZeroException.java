package io.github.cyfko.binexp.core.exception;

import io.github.cyfko.binexp.core.api.Op;

/**
 * {@link DivisionByZeroException} raised for the {@code %} operator.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ModuloByZeroException extends DivisionByZeroException {

    /**
     * Constructor with an explanatory error message.
     *
     * @param message the message describing the failed evaluation
     */
    public ModuloByZeroException(String message) {
        super(message, Op.MODULO);
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     *
     * @param message the message describing the failed evaluation
     * @param cause   the original cause of this exception
     */
    public ModuloByZeroException(String message, Throwable cause) {
        super(message, Op.MODULO, cause);
    }
}
