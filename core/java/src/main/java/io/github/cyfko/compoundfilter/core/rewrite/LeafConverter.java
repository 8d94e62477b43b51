package io.github.cyfko.compoundfilter.core.rewrite;

import io.github.cyfko.compoundfilter.core.exception.IncompleteRuleException;
import io.github.cyfko.compoundfilter.core.exception.InvalidStructureException;
import io.github.cyfko.compoundfilter.core.model.FilterOperator;
import io.github.cyfko.compoundfilter.core.model.FilterPath;
import io.github.cyfko.compoundfilter.core.model.FilterRule;
import io.github.cyfko.compoundfilter.core.model.PropertyCategory;
import io.github.cyfko.compoundfilter.core.wire.WirePropertyFilter;

/**
 * Converts a single rule into a property predicate of the remote grammar.
 * <p>
 * A rule is converted only when it is complete, uses an operator of its category, and carries
 * a value whenever its operator needs one. Nothing is guessed: every other case fails with the
 * path of the rule.
 * </p>
 *
 * @since 1.0.0
 */
public final class LeafConverter {

    private LeafConverter() {}

    /**
     * @param rule the rule to convert
     * @param path the rule's position, reported on failure
     * @return the equivalent property predicate
     * @throws IncompleteRuleException   if the rule has no property or no category
     * @throws InvalidStructureException if the operator does not belong to the category or the
     *                                   required value is missing
     */
    public static WirePropertyFilter convert(FilterRule rule, FilterPath path) {
        if (!rule.isComplete()) {
            throw new IncompleteRuleException(path);
        }

        PropertyCategory category = rule.category();
        FilterOperator operator = rule.operator();
        if (!category.supports(operator)) {
            throw new InvalidStructureException(String.format(
                    "Operator %s is not supported for property type %s",
                    operator.wireKey(), category.wireKey()), path);
        }
        if (operator.requiresValue() && rule.value().isNull()) {
            throw new InvalidStructureException("Value is required for operator " + operator.wireKey(), path);
        }

        return new WirePropertyFilter(rule.property(), category, operator, rule.value());
    }
}
