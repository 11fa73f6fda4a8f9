package io.github.cyfko.binexp.core.config;

/**
 * Configuration for the arithmetic simplifier.
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default: repeat while any rule changes the tree, fail on division by zero
 * SimplifierPolicy policy = SimplifierPolicy.defaults();
 *
 * // Reference: repeat only while constant folding changes the tree
 * SimplifierPolicy policy = SimplifierPolicy.reference();
 *
 * // Lenient: keep x / 0 and x % 0 unfolded instead of failing
 * SimplifierPolicy policy = SimplifierPolicy.lenient();
 * }</pre>
 *
 * @param policyName           name of the policy, for logging
 * @param convergence          when to run another pass
 * @param divisionByZero       what constant folding does with a zero divisor
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SimplifierPolicy(
    String policyName,
    ConvergenceMode convergence,
    DivisionByZeroPolicy divisionByZero
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any field is missing
     */
    public SimplifierPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (convergence == null) {
            throw new IllegalArgumentException("convergence is required");
        }
        if (divisionByZero == null) {
            throw new IllegalArgumentException("divisionByZero is required");
        }
    }

    /**
     * Default configuration: {@link ConvergenceMode#ANY_RULE}, {@link DivisionByZeroPolicy#FAIL}.
     * <p>
     * Simplifying the result of a simplification never changes it further.
     * </p>
     *
     * @return default configuration
     */
    public static SimplifierPolicy defaults() {
        return new SimplifierPolicy(PolicyName.DEFAULT_POLICY.name(), ConvergenceMode.ANY_RULE, DivisionByZeroPolicy.FAIL);
    }

    /**
     * Reference configuration: {@link ConvergenceMode#FOLDING_DRIVEN}, {@link DivisionByZeroPolicy#FAIL}.
     * <p>
     * An identity uncovered by the multiplicative pass of the last iteration, such as {@code + * 1 0 x},
     * is left in place ({@code + 0 x}).
     * </p>
     *
     * @return reference configuration
     */
    public static SimplifierPolicy reference() {
        return new SimplifierPolicy(PolicyName.REFERENCE_POLICY.name(), ConvergenceMode.FOLDING_DRIVEN, DivisionByZeroPolicy.FAIL);
    }

    /**
     * Lenient configuration: {@link ConvergenceMode#ANY_RULE}, {@link DivisionByZeroPolicy#LEAVE_UNFOLDED}.
     *
     * @return lenient configuration
     */
    public static SimplifierPolicy lenient() {
        return new SimplifierPolicy(PolicyName.LENIENT_POLICY.name(), ConvergenceMode.ANY_RULE, DivisionByZeroPolicy.LEAVE_UNFOLDED);
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
        private ConvergenceMode _convergence = ConvergenceMode.ANY_RULE;
        private DivisionByZeroPolicy _divisionByZero = DivisionByZeroPolicy.FAIL;

        private Builder() {}

        public SimplifierPolicy build() {
            return new SimplifierPolicy(_policyName, _convergence, _divisionByZero);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder convergence(ConvergenceMode convergence) { this._convergence = convergence; return this; }
        public Builder divisionByZero(DivisionByZeroPolicy divisionByZero) { this._divisionByZero = divisionByZero; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        REFERENCE_POLICY,
        LENIENT_POLICY,
        CUSTOM_POLICY
    }
}
