package io.github.varda.expressions.core.config;

/**
 * Limits applied by the expression parser to bound input size and recursion depth.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: maximum character length of the input (default: 5000)</li>
 *   <li><strong>maxNestingDepth</strong>: maximum recursion depth while parsing (default: 256). Every
 *       connective, grouping and negation opens one level, so a chain of {@code n} clauses joined
 *       by {@code and}/{@code or} needs {@code n} levels.</li>
 * </ul>
 * <p>
 * For flat connective chains the depth limit is the one that binds: under the defaults a chain
 * of 257 short clauses is rejected as too deep at roughly 2.3k characters, well below the length
 * limit. Raise {@code maxNestingDepth} together with {@code maxExpressionLength} when long
 * generated chains are expected, or wrap parts of the chain in groupings.
 * </p>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * ExpressionPolicy policy = ExpressionPolicy.defaults();
 *
 * // Strict (for public APIs with untrusted input)
 * ExpressionPolicy policy = ExpressionPolicy.strict();
 *
 * // Relaxed (for internal trusted systems)
 * ExpressionPolicy policy = ExpressionPolicy.relaxed();
 *
 * // Custom
 * ExpressionPolicy policy = ExpressionPolicy.builder()
 *     .maxExpressionLength(2000)
 *     .maxNestingDepth(100)
 *     .build();
 * }</pre>
 *
 * @param policyName          name reported in limit violations
 * @param maxExpressionLength maximum character length of the input
 * @param maxNestingDepth     maximum parser recursion depth
 * @author Varda Contributors
 * @since 1.0.0
 */
public record ExpressionPolicy(
    String policyName,
    int maxExpressionLength,
    int maxNestingDepth
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the name is blank or a limit is not positive
     */
    public ExpressionPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
    }

    /**
     * Balanced limits suitable for most production use cases.
     * <ul>
     *   <li>Max Expression Length: 5000 characters</li>
     *   <li>Max Nesting Depth: 256</li>
     * </ul>
     *
     * @return default configuration
     */
    public static ExpressionPolicy defaults() {
        return new ExpressionPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 256);
    }

    /**
     * Tight limits for APIs exposed to untrusted clients.
     * <ul>
     *   <li>Max Expression Length: 1000 characters</li>
     *   <li>Max Nesting Depth: 64</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static ExpressionPolicy strict() {
        return new ExpressionPolicy(PolicyName.STRICT_POLICY.name(), 1000, 64);
    }

    /**
     * Generous limits for internal trusted callers.
     * <ul>
     *   <li>Max Expression Length: 10000 characters</li>
     *   <li>Max Nesting Depth: 1024</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static ExpressionPolicy relaxed() {
        return new ExpressionPolicy(PolicyName.RELAXED_POLICY.name(), 10000, 1024);
    }

    /**
     * Creates a custom configuration. Builder parameters start out as in {@link #defaults()}.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 5000;
        private int _maxNestingDepth = 256;

        private Builder() {}

        public ExpressionPolicy build() {
            return new ExpressionPolicy(_policyName, _maxExpressionLength, _maxNestingDepth);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
