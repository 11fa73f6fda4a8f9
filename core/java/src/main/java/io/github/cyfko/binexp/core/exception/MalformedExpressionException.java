package io.github.cyfko.binexp.core.exception;

import io.github.cyfko.binexp.core.api.ExpressionParser;
import io.github.cyfko.binexp.core.impl.PrefixExpressionParser;

/**
 * Exception thrown when a token sequence does not form a well-formed prefix expression.
 * <p>
 * The parse call that raises it returns no partial tree.
 * </p>
 *
 * <p><strong>Common Scenarios:</strong></p>
 * <ul>
 *   <li><strong>Empty input:</strong> no token at all</li>
 *   <li><strong>Missing operands:</strong> the sequence ends where an operand was required</li>
 *   <li><strong>Unknown operator:</strong> a token that is neither a number, a variable nor one of {@code + - * / %}</li>
 *   <li><strong>Trailing tokens:</strong> only when the parser policy rejects them</li>
 *   <li><strong>Complexity limits:</strong> too many tokens or too deep a nesting</li>
 * </ul>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.parse("");
 * // → "Expression cannot be null or empty"
 *
 * parser.parse("+ 1");
 * // → "Missing operand for '+' at position 2: token sequence exhausted"
 *
 * parser.parse("^ 1 2");
 * // → "Unknown operator '^' at position 0"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see ExpressionParser
 * @see PrefixExpressionParser
 */
public class MalformedExpressionException extends RuntimeException {

    /**
     * Constructor with an explanatory error message.
     *
     * @param message the message describing the cause of the exception, should include the position when known
     */
    public MalformedExpressionException(String message) {
        super(message);
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     *
     * @param message the message describing the cause of the exception
     * @param cause   the original cause of this exception
     */
    public MalformedExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
