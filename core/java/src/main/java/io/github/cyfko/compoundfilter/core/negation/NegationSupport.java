package io.github.cyfko.compoundfilter.core.negation;

import io.github.cyfko.compoundfilter.core.model.FilterOperator;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Outcome of {@link NegationNormalizer#validateForNegation}: whether every rule placed under a
 * negated group can be negated, and which operators cannot.
 *
 * @param unsupportedOperators the operators lacking a complement, empty when supported
 * @since 1.0.0
 */
public record NegationSupport(Set<FilterOperator> unsupportedOperators) {

    private static final NegationSupport SUPPORTED = new NegationSupport(Set.of());

    public NegationSupport {
        unsupportedOperators = unsupportedOperators == null || unsupportedOperators.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(unsupportedOperators));
    }

    public static NegationSupport supported() {
        return SUPPORTED;
    }

    public boolean isSupported() {
        return unsupportedOperators.isEmpty();
    }
}
