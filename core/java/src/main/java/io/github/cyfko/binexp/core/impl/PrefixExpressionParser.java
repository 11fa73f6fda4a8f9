package io.github.cyfko.binexp.core.impl;

import io.github.cyfko.binexp.core.api.ExpressionParser;
import io.github.cyfko.binexp.core.api.Node;
import io.github.cyfko.binexp.core.api.NumberNode;
import io.github.cyfko.binexp.core.api.Op;
import io.github.cyfko.binexp.core.api.OperatorNode;
import io.github.cyfko.binexp.core.api.VariableNode;
import io.github.cyfko.binexp.core.config.ParserPolicy;
import io.github.cyfko.binexp.core.config.PatternConfig;
import io.github.cyfko.binexp.core.config.TrailingTokenPolicy;
import io.github.cyfko.binexp.core.exception.MalformedExpressionException;
import io.github.cyfko.binexp.core.parsing.TokenCursor;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Recursive descent parser for prefix arithmetic expressions.
 * <p>
 * Each token is classified in this order:
 * </p>
 * <ol>
 *   <li>optional minus followed by digits: {@link NumberNode}</li>
 *   <li>alphabetic characters only: {@link VariableNode}</li>
 *   <li>anything else must be one of the {@link Op} symbols; its left operand is parsed from the
 *       following tokens, then its right operand from what remains</li>
 * </ol>
 *
 * <h2>Trailing tokens</h2>
 * <p>
 * With {@link TrailingTokenPolicy#IGNORE} (the default) parsing stops after the first complete expression:
 * {@code "+ 1 2 3"} parses as {@code (1 + 2)}. {@link TrailingTokenPolicy#REJECT} turns leftovers into a
 * {@link MalformedExpressionException}.
 * </p>
 *
 * <h2>DoS Protection</h2>
 * <p>
 * The token count and the operator nesting depth can be bounded through {@link ParserPolicy}. The default
 * policy leaves both unbounded; {@link ParserPolicy#strict()} and {@link ParserPolicy#relaxed()} set limits
 * that also keep the recursive rewrite and rendering passes within a predictable stack size.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * ExpressionParser parser = new PrefixExpressionParser();
 * Node tree = parser.parse("+ 0 * 1 x");
 *
 * ExpressionParser strictParser = new PrefixExpressionParser(ParserPolicy.strict());
 * strictParser.parse("+ 1 2 3"); // MalformedExpressionException: trailing token
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class PrefixExpressionParser implements ExpressionParser {

    private static final Logger log = Logger.getLogger(PrefixExpressionParser.class.getName());

    private final ParserPolicy policy;

    /**
     * Default constructor using {@link ParserPolicy#defaults()}.
     */
    public PrefixExpressionParser() {
        this(ParserPolicy.defaults());
    }

    /**
     * @param policy the limits and strictness to apply
     */
    public PrefixExpressionParser(ParserPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "Parser policy is required");
    }

    public ParserPolicy getPolicy() {
        return policy;
    }

    @Override
    public Node parse(List<String> tokens) {
        Objects.requireNonNull(tokens, "Tokens cannot be null");

        if (tokens.isEmpty()) {
            throw new MalformedExpressionException("Expression cannot be empty: no token to parse");
        }
        if (tokens.size() > policy.maxTokens()) {
            throw new MalformedExpressionException(String.format(
                    "Expression too long (%d tokens, max: %d). Policy applied: %s",
                    tokens.size(), policy.maxTokens(), policy.policyName()
            ));
        }

        TokenCursor cursor = new TokenCursor(tokens);
        Node root = parseExpression(cursor, 0);

        if (cursor.hasNext()) {
            if (policy.trailingTokens() == TrailingTokenPolicy.REJECT) {
                throw new MalformedExpressionException(String.format(
                        "Unexpected trailing token '%s' at position %d (%d unconsumed). Policy applied: %s",
                        cursor.peek(), cursor.position(), cursor.remaining(), policy.policyName()
                ));
            }
            log.fine(() -> String.format(
                    "Ignoring %d trailing token(s) after complete expression", cursor.remaining()
            ));
        }

        return root;
    }

    private Node parseExpression(TokenCursor cursor, int depth) {
        int position = cursor.position();
        String token = cursor.next();
        if (token == null) {
            throw new MalformedExpressionException("Null token at position " + position);
        }

        if (PatternConfig.NUMBER_PATTERN.matcher(token).matches()) {
            return new NumberNode(new BigInteger(token));
        }
        if (PatternConfig.VARIABLE_PATTERN.matcher(token).matches()) {
            return new VariableNode(token);
        }

        Op op = Op.fromSymbol(token).orElseThrow(() -> new MalformedExpressionException(
                String.format("Unknown operator '%s' at position %d", token, position)
        ));

        if (depth + 1 > policy.maxDepth()) {
            throw new MalformedExpressionException(String.format(
                    "Expression too deeply nested (depth %d exceeds max: %d). Policy applied: %s",
                    depth + 1, policy.maxDepth(), policy.policyName()
            ));
        }

        Node left = parseOperand(cursor, op, depth + 1);
        Node right = parseOperand(cursor, op, depth + 1);
        return new OperatorNode(op, left, right);
    }

    private Node parseOperand(TokenCursor cursor, Op op, int depth) {
        if (!cursor.hasNext()) {
            throw new MalformedExpressionException(String.format(
                    "Missing operand for '%s' at position %d: token sequence exhausted",
                    op.getSymbol(), cursor.position()
            ));
        }
        return parseExpression(cursor, depth);
    }
}
