package io.github.cyfko.binexp.core.config;

/**
 * Configuration for the prefix expression parser: complexity limits and strictness.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxTokens</strong>: maximum number of tokens in the input sequence</li>
 *   <li><strong>maxDepth</strong>: maximum operator nesting depth; it also bounds the recursion
 *       of every later traversal of the parsed tree</li>
 *   <li>{@link #UNBOUNDED} disables a limit</li>
 *   <li><strong>trailingTokens</strong>: what to do with tokens left after a complete expression</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (accepts every well-formed expression, ignores trailing tokens)
 * ParserPolicy policy = ParserPolicy.defaults();
 *
 * // Strict (for untrusted input)
 * ParserPolicy policy = ParserPolicy.strict();
 *
 * // Relaxed (for large generated expressions)
 * ParserPolicy policy = ParserPolicy.relaxed();
 *
 * // Custom
 * ParserPolicy policy = ParserPolicy.builder()
 *     .maxDepth(50)
 *     .trailingTokens(TrailingTokenPolicy.REJECT)
 *     .build();
 * }</pre>
 *
 * @param policyName     name reported in limit violation messages
 * @param maxTokens      maximum number of tokens accepted
 * @param maxDepth       maximum operator nesting depth accepted
 * @param trailingTokens handling of unconsumed tokens
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParserPolicy(
    String policyName,
    int maxTokens,
    int maxDepth,
    TrailingTokenPolicy trailingTokens
) {

    /**
     * Limit value meaning "no limit".
     */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public ParserPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive, got: " + maxTokens);
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        if (trailingTokens == null) {
            throw new IllegalArgumentException("trailingTokens is required");
        }
    }

    /**
     * Default configuration: every well-formed expression is accepted.
     * <ul>
     *   <li>Max Tokens: {@link #UNBOUNDED}</li>
     *   <li>Max Depth: {@link #UNBOUNDED}</li>
     *   <li>Trailing Tokens: IGNORE</li>
     * </ul>
     * <p>
     * Parsing, rewriting and rendering recurse once per nesting level, so an extremely deep expression
     * (tens of thousands of levels on a default thread stack) ends in a {@link StackOverflowError}.
     * Use {@link #strict()} or {@link #relaxed()} when the input is not trusted.
     * </p>
     *
     * @return default configuration
     */
    public static ParserPolicy defaults() {
        return new ParserPolicy(PolicyName.DEFAULT_POLICY.name(), UNBOUNDED, UNBOUNDED, TrailingTokenPolicy.IGNORE);
    }

    /**
     * Strict configuration for untrusted input.
     * <ul>
     *   <li>Max Tokens: 1000</li>
     *   <li>Max Depth: 100</li>
     *   <li>Trailing Tokens: REJECT</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static ParserPolicy strict() {
        return new ParserPolicy(PolicyName.STRICT_POLICY.name(), 1_000, 100, TrailingTokenPolicy.REJECT);
    }

    /**
     * Relaxed configuration for trusted, machine-generated expressions.
     * <ul>
     *   <li>Max Tokens: 100000</li>
     *   <li>Max Depth: 2000</li>
     *   <li>Trailing Tokens: IGNORE</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static ParserPolicy relaxed() {
        return new ParserPolicy(PolicyName.RELAXED_POLICY.name(), 100_000, 2_000, TrailingTokenPolicy.IGNORE);
    }

    /**
     * Creates a custom configuration. Builder fields start with the {@link #defaults()} values.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxTokens = UNBOUNDED;
        private int _maxDepth = UNBOUNDED;
        private TrailingTokenPolicy _trailingTokens = TrailingTokenPolicy.IGNORE;

        private Builder() {}

        public ParserPolicy build() {
            return new ParserPolicy(_policyName, _maxTokens, _maxDepth, _trailingTokens);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxTokens(int maxTokens) { this._maxTokens = maxTokens; return this; }
        public Builder maxDepth(int maxDepth) { this._maxDepth = maxDepth; return this; }
        public Builder trailingTokens(TrailingTokenPolicy trailingTokens) { this._trailingTokens = trailingTokens; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
