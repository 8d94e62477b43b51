package io.github.cyfko.compoundfilter.core.config;

/**
 * Configuration of the depth-bounded rewrite into the remote filter grammar.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxNestingDepth</strong>: number of compound levels the remote API accepts
 *       below the root compound (default: 2, the API's own ceiling). Must be at least 1:
 *       with no nesting at all, {@code a AND (b OR c)} has no equivalent.</li>
 *   <li><strong>maxExpandedTerms</strong>: ceiling on the number of terms produced when
 *       distributing AND over OR or OR over AND (default: 1000)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (API ceiling, generous expansion budget)
 * RewritePolicy policy = RewritePolicy.defaults();
 *
 * // Strict (small request bodies for public endpoints)
 * RewritePolicy policy = RewritePolicy.strict();
 *
 * // Relaxed (trusted batch exports)
 * RewritePolicy policy = RewritePolicy.relaxed();
 *
 * // Custom
 * RewritePolicy policy = RewritePolicy.builder()
 *     .maxNestingDepth(1)
 *     .maxExpandedTerms(50)
 *     .build();
 * }</pre>
 *
 * @param maxNestingDepth  compound levels allowed below the root compound
 * @param maxExpandedTerms maximum number of terms generated by distribution
 * @since 1.0.0
 */
public record RewritePolicy(
        int maxNestingDepth,
        int maxExpandedTerms
) {

    /** Nesting ceiling of the remote filter API. */
    public static final int API_MAX_NESTING_DEPTH = 2;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is out of range
     */
    public RewritePolicy {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be at least 1, got: " + maxNestingDepth);
        }
        if (maxExpandedTerms <= 0) {
            throw new IllegalArgumentException("maxExpandedTerms must be positive, got: " + maxExpandedTerms);
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Nesting Depth: 2</li>
     *   <li>Max Expanded Terms: 1000</li>
     * </ul>
     *
     * @return default configuration
     */
    public static RewritePolicy defaults() {
        return new RewritePolicy(API_MAX_NESTING_DEPTH, 1000);
    }

    /**
     * Strict configuration for untrusted input.
     * <ul>
     *   <li>Max Nesting Depth: 2</li>
     *   <li>Max Expanded Terms: 100</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static RewritePolicy strict() {
        return new RewritePolicy(API_MAX_NESTING_DEPTH, 100);
    }

    /**
     * Relaxed configuration for trusted callers.
     * <ul>
     *   <li>Max Nesting Depth: 2</li>
     *   <li>Max Expanded Terms: 10000</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static RewritePolicy relaxed() {
        return new RewritePolicy(API_MAX_NESTING_DEPTH, 10000);
    }

    /**
     * Builder initialized with the {@linkplain #defaults() default} values.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int _maxNestingDepth = API_MAX_NESTING_DEPTH;
        private int _maxExpandedTerms = 1000;

        private Builder() {}

        public RewritePolicy build() {
            return new RewritePolicy(_maxNestingDepth, _maxExpandedTerms);
        }

        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
        public Builder maxExpandedTerms(int maxExpandedTerms) { this._maxExpandedTerms = maxExpandedTerms; return this; }
    }
}
