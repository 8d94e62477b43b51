package io.github.cyfko.compoundfilter.core.exception;

/**
 * Exception thrown when fitting a filter into the remote nesting limit would generate more
 * terms than the configured ceiling.
 * <p>
 * Distributing an AND over several OR groups multiplies their sizes: three OR groups of ten
 * rules each expand into a thousand conjunctions. The rewriter stops as soon as the running
 * count passes {@code RewritePolicy.maxExpandedTerms()} instead of producing an unbounded
 * request body.
 * </p>
 *
 * @since 1.0.0
 */
public class FilterComplexityException extends RuntimeException {

    private final int limit;

    public FilterComplexityException(int limit, int attempted) {
        super(String.format(
                "Rewriting the filter would generate %d terms, above the maximum of %d. " +
                "Reduce the number of OR groups combined under the same AND group.",
                attempted, limit));
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
