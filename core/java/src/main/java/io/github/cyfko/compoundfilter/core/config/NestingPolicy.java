package io.github.cyfko.compoundfilter.core.config;

/**
 * Bounds of the user-configurable nesting depth of the filter editor.
 * <p>
 * The editing depth only limits how deep a user may nest groups while building a filter. It
 * is independent of the remote API ceiling ({@link RewritePolicy#maxNestingDepth()}): deeper
 * trees are rewritten on apply.
 * </p>
 *
 * <pre>{@code
 * NestingPolicy policy = NestingPolicy.defaults();   // default 2, range 1..5
 * int depth = policy.clamp(9);                      // 5
 * }</pre>
 *
 * @param defaultDepth depth offered to a new session
 * @param minDepth     smallest depth a user may select
 * @param maxDepth     largest depth a user may select
 * @since 1.0.0
 */
public record NestingPolicy(
        int defaultDepth,
        int minDepth,
        int maxDepth
) {

    public NestingPolicy {
        if (minDepth < 1) {
            throw new IllegalArgumentException("minDepth must be at least 1, got: " + minDepth);
        }
        if (maxDepth < minDepth) {
            throw new IllegalArgumentException("maxDepth (" + maxDepth + ") must not be below minDepth (" + minDepth + ")");
        }
        if (defaultDepth < minDepth || defaultDepth > maxDepth) {
            throw new IllegalArgumentException("defaultDepth must lie in [" + minDepth + ", " + maxDepth + "], got: " + defaultDepth);
        }
    }

    /**
     * @return default 2, range 1 to 5
     */
    public static NestingPolicy defaults() {
        return new NestingPolicy(2, 1, 5);
    }

    /**
     * @return a fixed-depth policy, useful for embedding the editor with a locked depth
     */
    public static NestingPolicy fixed(int depth) {
        return new NestingPolicy(depth, depth, depth);
    }

    /**
     * @return {@code requested} brought into {@code [minDepth, maxDepth]}
     */
    public int clamp(int requested) {
        return Math.max(minDepth, Math.min(maxDepth, requested));
    }
}
