package io.github.cyfko.compoundfilter.core.wire;

/**
 * Filter expressed in the remote API's grammar: a property predicate or an {@code and}/{@code or}
 * compound of such filters.
 * <p>
 * The remote API limits how deeply compounds may be nested. {@link #nestingDepth()} counts the
 * compound levels below the root compound, the quantity the API bounds:
 * </p>
 * <pre>
 * {"property": ...}                               nesting 0
 * {"and": [leaf, leaf]}                           nesting 0
 * {"or": [{"and": [leaf, leaf]}, leaf]}           nesting 1
 * {"and": [{"or": [{"and": [leaf]}, leaf]}]}      nesting 2
 * </pre>
 *
 * @since 1.0.0
 */
public sealed interface WireFilter permits WirePropertyFilter, WireCompoundFilter {

    /**
     * @return 0 for a property filter, {@code 1 + max(member height)} for a compound
     */
    int height();

    /**
     * @return the number of compound levels nested below the root compound
     */
    default int nestingDepth() {
        return Math.max(0, height() - 1);
    }
}
