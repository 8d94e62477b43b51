package io.github.cyfko.compoundfilter.core.exception;

import io.github.cyfko.compoundfilter.core.model.FilterOperator;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Exception thrown when a negated group contains rules whose operator has no complementary
 * operator in the remote API.
 * <p>
 * The remote grammar has no group negation, so a negated group can only be expressed by
 * negating every rule beneath it. Operators such as {@code starts_with}, {@code ends_with} or
 * the relative date windows ({@code past_week} ... {@code next_year}) have no complement, and
 * a negated group containing them cannot be converted. The exception is raised before any
 * rewriting takes place and carries the exact set of offending operators so that the editing
 * layer can point at them.
 * </p>
 *
 * <pre>{@code
 * try {
 *     CompoundFilter normalized = NegationNormalizer.normalize(draft);
 * } catch (UnsupportedNegationException e) {
 *     highlight(e.getOperators()); // e.g. [STARTS_WITH]
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class UnsupportedNegationException extends RuntimeException {

    private final Set<FilterOperator> operators;

    /**
     * @param operators the operators lacking a negation, at least one
     */
    public UnsupportedNegationException(Set<FilterOperator> operators) {
        super(buildMessage(operators));
        this.operators = Collections.unmodifiableSet(operators.isEmpty()
                ? EnumSet.noneOf(FilterOperator.class)
                : EnumSet.copyOf(operators));
    }

    /**
     * @return the operators that cannot be negated, in declaration order
     */
    public Set<FilterOperator> getOperators() {
        return operators;
    }

    private static String buildMessage(Set<FilterOperator> operators) {
        return "Unsupported conditions for NOT: " + operators.stream()
                .sorted()
                .map(FilterOperator::wireKey)
                .collect(Collectors.joining(", "));
    }
}
