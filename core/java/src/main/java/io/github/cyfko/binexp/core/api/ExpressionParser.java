package io.github.cyfko.binexp.core.api;

import io.github.cyfko.binexp.core.exception.MalformedExpressionException;

import java.util.Arrays;
import java.util.List;

/**
 * Parser transforming a sequence of prefix-notation tokens into an expression tree.
 *
 * <h2>Grammar</h2>
 * <pre>
 * expression := number | variable | operator expression expression
 * number     := '-'? [0-9]+
 * variable   := alphabetic+
 * operator   := '+' | '-' | '*' | '/' | '%'
 * </pre>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * ExpressionParser parser = new PrefixExpressionParser();
 *
 * Node leaf = parser.parse("x");                       // VariableNode x
 * Node sum = parser.parse("+ x 0");                    // (x + 0)
 * Node nested = parser.parse("* + 1 2 - y -3");        // ((1 + 2) * (y - -3))
 * Node fromTokens = parser.parse(List.of("+", "1", "2"));
 * }</pre>
 *
 * <h3>Invalid Expression Examples</h3>
 * <pre>{@code
 * parser.parse("");          // MalformedExpressionException: empty expression
 * parser.parse("+ 1");       // MalformedExpressionException: missing operand
 * parser.parse("^ 1 2");     // MalformedExpressionException: unknown operator
 * }</pre>
 *
 * @see Node
 * @see MalformedExpressionException
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ExpressionParser {

    /**
     * Parses an ordered token sequence in prefix order.
     * <p>
     * The list is read through a cursor and is never modified. What happens with tokens left over after the
     * first complete expression depends on the implementation's configuration.
     * </p>
     *
     * @param tokens the tokens, first token first
     * @return the root of the parsed tree
     * @throws MalformedExpressionException if the tokens do not form an expression
     * @throws NullPointerException         if tokens is null
     */
    Node parse(List<String> tokens) throws MalformedExpressionException;

    /**
     * Parses a single line of whitespace-separated prefix tokens, e.g. {@code "+ x 0"}.
     *
     * @param line the expression text
     * @return the root of the parsed tree
     * @throws MalformedExpressionException if the line is null, blank or malformed
     */
    default Node parse(String line) throws MalformedExpressionException {
        if (line == null || line.isBlank()) {
            throw new MalformedExpressionException("Expression cannot be null or empty");
        }
        return parse(Arrays.asList(line.trim().split("\\s+")));
    }
}
