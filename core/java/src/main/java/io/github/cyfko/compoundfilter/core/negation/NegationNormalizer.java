package io.github.cyfko.compoundfilter.core.negation;

import io.github.cyfko.compoundfilter.core.exception.UnsupportedNegationException;
import io.github.cyfko.compoundfilter.core.model.CompoundFilter;
import io.github.cyfko.compoundfilter.core.model.FilterGroup;
import io.github.cyfko.compoundfilter.core.model.FilterNode;
import io.github.cyfko.compoundfilter.core.model.FilterOperator;
import io.github.cyfko.compoundfilter.core.model.FilterRule;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Removes group negation from a filter tree.
 * <p>
 * The remote grammar only knows AND and OR, so a negated group is rewritten with De Morgan's
 * laws before conversion: {@code NOT (A AND B)} becomes {@code (NOT A) OR (NOT B)} and
 * {@code NOT (A OR B)} becomes {@code (NOT A) AND (NOT B)}. Negation is pushed down to the
 * rules, where each operator is replaced by its complement from {@link OperatorNegation}.
 * A negated group nested in a negated group cancels out (double negation).
 * </p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * // NOT (Price < 10 AND Price > 5)
 * FilterGroup negated = new FilterGroup(GroupOperator.AND, true, List.of(lessThan10, greaterThan5));
 *
 * CompoundFilter normalized = NegationNormalizer.normalize(CompoundFilter.of(negated));
 * // Price >= 10 OR Price <= 5
 * }</pre>
 *
 * <p>
 * Validation runs first and the whole tree is rejected before anything is rewritten when a
 * rule under a negated group has no complement. Incomplete rules are neither validated nor
 * negated: conversion reports them.
 * </p>
 *
 * @since 1.0.0
 */
public final class NegationNormalizer {

    private NegationNormalizer() {}

    /**
     * Collects the operators lacking a complement among the complete rules found beneath any
     * negated group. A tree without negated groups is trivially supported.
     */
    public static NegationSupport validateForNegation(CompoundFilter filter) {
        Objects.requireNonNull(filter, "filter cannot be null");

        Set<FilterOperator> unsupported = EnumSet.noneOf(FilterOperator.class);
        filter.root().ifPresent(root -> collectUnsupported(root, false, unsupported));
        return unsupported.isEmpty() ? NegationSupport.supported() : new NegationSupport(unsupported);
    }

    /**
     * Returns an equivalent filter without any negated group.
     *
     * @throws UnsupportedNegationException if a rule under a negated group cannot be negated;
     *                                      nothing is rewritten in that case
     */
    public static CompoundFilter normalize(CompoundFilter filter) {
        NegationSupport support = validateForNegation(filter);
        if (!support.isSupported()) {
            throw new UnsupportedNegationException(support.unsupportedOperators());
        }
        if (filter.isEmpty() || !containsNegation(filter.root().get())) {
            return filter;
        }
        return CompoundFilter.of(rewrite(filter.root().get(), false));
    }

    /**
     * @return {@code true} if {@code node} or one of its descendants is a negated group
     */
    public static boolean containsNegation(FilterNode node) {
        if (!(node instanceof FilterGroup group)) {
            return false;
        }
        if (group.negated()) {
            return true;
        }
        for (FilterNode child : group.children()) {
            if (containsNegation(child)) {
                return true;
            }
        }
        return false;
    }

    private static void collectUnsupported(FilterNode node, boolean underNegation, Set<FilterOperator> unsupported) {
        if (node instanceof FilterRule rule) {
            if (underNegation && rule.isComplete()
                    && !OperatorNegation.isNegatable(rule.operator(), rule.category())) {
                unsupported.add(rule.operator());
            }
            return;
        }

        FilterGroup group = (FilterGroup) node;
        boolean negatedScope = underNegation || group.negated();
        for (FilterNode child : group.children()) {
            collectUnsupported(child, negatedScope, unsupported);
        }
    }

    // 'negate' is the pending negation inherited from the ancestors.
    private static FilterNode rewrite(FilterNode node, boolean negate) {
        if (node instanceof FilterRule rule) {
            if (!negate) {
                return rule;
            }
            return OperatorNegation.negate(rule).orElse(rule);
        }

        FilterGroup group = (FilterGroup) node;
        boolean negateHere = negate ^ group.negated();

        List<FilterNode> children = new ArrayList<>(group.size());
        for (FilterNode child : group.children()) {
            children.add(rewrite(child, negateHere));
        }
        return new FilterGroup(negateHere ? group.operator().flip() : group.operator(), false, children);
    }
}
