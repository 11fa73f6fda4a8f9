package io.github.cyfko.binexp.core;

import io.github.cyfko.binexp.core.api.ExpressionParser;
import io.github.cyfko.binexp.core.api.Node;
import io.github.cyfko.binexp.core.config.ParserPolicy;
import io.github.cyfko.binexp.core.config.SimplifierPolicy;
import io.github.cyfko.binexp.core.exception.DivisionByZeroException;
import io.github.cyfko.binexp.core.exception.MalformedExpressionException;
import io.github.cyfko.binexp.core.impl.PrefixExpressionParser;
import io.github.cyfko.binexp.core.parsing.Notation;
import io.github.cyfko.binexp.core.parsing.NotationSerializer;
import io.github.cyfko.binexp.core.rewrite.ArithmeticSimplifier;

import java.util.List;
import java.util.Objects;

/**
 * Entry point chaining the three stages of expression processing: parse, simplify, render.
 * <p>
 * Stages are always run sequentially on a tree owned by a single caller. Instances hold no mutable
 * state and may be shared.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * ExpressionPipeline pipeline = ExpressionPipeline.defaults();
 *
 * // One line in, one line out
 * String simplified = pipeline.simplifyToPrefix("+ 0 * 1 x");   // "x"
 *
 * // Stage by stage
 * Node tree = pipeline.parse("* + 1 2 y");
 * Node result = pipeline.simplify(tree);
 * String infix = pipeline.render(result, Notation.INFIX);        // "(3 * y)"
 *
 * // Custom policies
 * ExpressionPipeline strict = ExpressionPipeline.of(ParserPolicy.strict(), SimplifierPolicy.lenient());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ExpressionPipeline {

    private final ExpressionParser parser;
    private final ArithmeticSimplifier simplifier;

    private ExpressionPipeline(ExpressionParser parser, ArithmeticSimplifier simplifier) {
        this.parser = parser;
        this.simplifier = simplifier;
    }

    /**
     * @return a pipeline using {@link ParserPolicy#defaults()} and {@link SimplifierPolicy#defaults()}
     */
    public static ExpressionPipeline defaults() {
        return of(ParserPolicy.defaults(), SimplifierPolicy.defaults());
    }

    /**
     * @param parserPolicy     parser limits and strictness
     * @param simplifierPolicy convergence and division by zero handling
     * @return a new pipeline
     */
    public static ExpressionPipeline of(ParserPolicy parserPolicy, SimplifierPolicy simplifierPolicy) {
        Objects.requireNonNull(parserPolicy, "Parser policy is required");
        Objects.requireNonNull(simplifierPolicy, "Simplifier policy is required");
        return new ExpressionPipeline(new PrefixExpressionParser(parserPolicy), new ArithmeticSimplifier(simplifierPolicy));
    }

    public Node parse(String line) {
        return parser.parse(line);
    }

    public Node parse(List<String> tokens) {
        return parser.parse(tokens);
    }

    public Node simplify(Node node) {
        return simplifier.simplify(node);
    }

    public String render(Node node, Notation notation) {
        return NotationSerializer.render(node, notation);
    }

    /**
     * Parses a prefix line, simplifies it and renders the result back in prefix notation.
     *
     * @param line whitespace separated prefix tokens, e.g. {@code "+ x 0"}
     * @return the simplified expression in prefix notation, e.g. {@code "x"}
     * @throws MalformedExpressionException if the line is not a well-formed expression
     * @throws DivisionByZeroException      if folding divides by zero and the policy says to fail
     */
    public String simplifyToPrefix(String line) {
        return NotationSerializer.toPrefix(simplify(parse(line)));
    }
}
