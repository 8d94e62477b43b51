package io.github.cyfko.compoundfilter.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Leaf predicate over one property: {@code <property> <operator> <value>}.
 * <p>
 * A rule whose property or category has not been selected yet is <em>incomplete</em>. This
 * is the placeholder state of a rule freshly added by an editing widget; the missing parts
 * are absent references (never empty strings), and such a rule is rejected by structural
 * validation and by conversion.
 * </p>
 *
 * <pre>{@code
 * FilterRule price = FilterRule.of("Price", PropertyCategory.NUMBER, FilterOperator.LESS_THAN, FilterValue.of(10));
 * FilterRule placeholder = FilterRule.incomplete();
 * placeholder.isComplete(); // false
 * }</pre>
 *
 * @param property the property name, {@code null} while unselected
 * @param category the property category, {@code null} while unselected
 * @param operator the operator, never null
 * @param value    the operand, never null ({@link FilterValue#none()} when absent)
 * @since 1.0.0
 */
public record FilterRule(
        String property,
        PropertyCategory category,
        FilterOperator operator,
        FilterValue value
) implements FilterNode {

    public FilterRule {
        if (property != null && property.isBlank()) {
            property = null;
        }
        Objects.requireNonNull(operator, "operator is required");
        value = value == null ? FilterValue.none() : value;
    }

    public static FilterRule of(String property, PropertyCategory category, FilterOperator operator, FilterValue value) {
        return new FilterRule(property, category, operator, value);
    }

    /**
     * Rule for a page timestamp. Timestamp rules are not bound to a user property; the
     * category name doubles as the property name.
     */
    public static FilterRule timestamp(PropertyCategory timestamp, FilterOperator operator, FilterValue value) {
        if (timestamp == null || !timestamp.isTimestamp()) {
            throw new IllegalArgumentException("not a timestamp category: " + timestamp);
        }
        return new FilterRule(timestamp.wireKey(), timestamp, operator, value);
    }

    /**
     * @return a placeholder rule with no property, no category, {@code equals} and no value
     */
    public static FilterRule incomplete() {
        return new FilterRule(null, null, FilterOperator.EQUALS, FilterValue.none());
    }

    public Optional<String> selectedProperty() {
        return Optional.ofNullable(property);
    }

    public Optional<PropertyCategory> selectedCategory() {
        return Optional.ofNullable(category);
    }

    /**
     * @return {@code true} once both property and category are selected
     */
    public boolean isComplete() {
        return property != null && category != null;
    }

    public FilterRule withOperator(FilterOperator newOperator) {
        return new FilterRule(property, category, newOperator, value);
    }

    /**
     * Merges the fields present in {@code update} into a copy of this rule.
     *
     * @param update the partial fields to apply
     * @return the merged rule, or this rule if {@code update} carries nothing
     */
    public FilterRule merge(RuleUpdate update) {
        if (update == null || update.isEmpty()) {
            return this;
        }
        return new FilterRule(
                update.property().orElse(property),
                update.category().orElse(category),
                update.operator().orElse(operator),
                update.value().orElse(value));
    }
}
