package io.github.cyfko.compoundfilter.core.negation;

import io.github.cyfko.compoundfilter.core.model.FilterOperator;
import io.github.cyfko.compoundfilter.core.model.FilterRule;
import io.github.cyfko.compoundfilter.core.model.PropertyCategory;

import java.util.Objects;
import java.util.Optional;

import static io.github.cyfko.compoundfilter.core.model.FilterOperator.*;

/**
 * Table of complementary operators exposed by the remote API.
 * <p>
 * {@code NOT (x < 10)} is {@code x >= 10}: when the API offers the complement of an operator
 * for a property category, a negated rule can be expressed without a NOT construct. Pure
 * text-matching operators ({@code starts_with}, {@code ends_with}), date equality and the
 * relative date windows have no complement.
 * </p>
 *
 * <table>
 *   <caption>Complements by category</caption>
 *   <tr><th>Category</th><th>Pairs</th></tr>
 *   <tr><td>checkbox</td><td>equals ↔ does_not_equal</td></tr>
 *   <tr><td>number</td><td>equals ↔ does_not_equal, greater_than ↔ less_than_or_equal_to,
 *       less_than ↔ greater_than_or_equal_to, is_empty ↔ is_not_empty</td></tr>
 *   <tr><td>multi_select</td><td>contains ↔ does_not_contain, is_empty ↔ is_not_empty</td></tr>
 *   <tr><td>select, status</td><td>equals ↔ does_not_equal, is_empty ↔ is_not_empty</td></tr>
 *   <tr><td>rich_text, title</td><td>equals ↔ does_not_equal, contains ↔ does_not_contain,
 *       is_empty ↔ is_not_empty</td></tr>
 *   <tr><td>date, created_time, last_edited_time</td><td>before ↔ on_or_after,
 *       after ↔ on_or_before, is_empty ↔ is_not_empty</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class OperatorNegation {

    private OperatorNegation() {}

    /**
     * Returns the complementary operator of {@code operator} for {@code category}.
     *
     * @return the complement, or empty when the API has none for this pair
     */
    public static Optional<FilterOperator> negatedOperator(FilterOperator operator, PropertyCategory category) {
        Objects.requireNonNull(operator, "operator cannot be null");
        Objects.requireNonNull(category, "category cannot be null");

        FilterOperator negated = switch (category) {
            case CHECKBOX -> equality(operator);
            case NUMBER -> switch (operator) {
                case GREATER_THAN -> LESS_THAN_OR_EQUAL_TO;
                case LESS_THAN_OR_EQUAL_TO -> GREATER_THAN;
                case LESS_THAN -> GREATER_THAN_OR_EQUAL_TO;
                case GREATER_THAN_OR_EQUAL_TO -> LESS_THAN;
                default -> firstNonNull(equality(operator), emptiness(operator));
            };
            case MULTI_SELECT -> firstNonNull(containment(operator), emptiness(operator));
            case SELECT, STATUS -> firstNonNull(equality(operator), emptiness(operator));
            case RICH_TEXT, TITLE -> firstNonNull(equality(operator),
                    firstNonNull(containment(operator), emptiness(operator)));
            case DATE, CREATED_TIME, LAST_EDITED_TIME -> switch (operator) {
                case BEFORE -> ON_OR_AFTER;
                case ON_OR_AFTER -> BEFORE;
                case AFTER -> ON_OR_BEFORE;
                case ON_OR_BEFORE -> AFTER;
                default -> emptiness(operator);
            };
        };
        return Optional.ofNullable(negated);
    }

    /**
     * @return {@code true} if {@code operator} has a complement for {@code category}
     */
    public static boolean isNegatable(FilterOperator operator, PropertyCategory category) {
        return negatedOperator(operator, category).isPresent();
    }

    /**
     * Negates a complete rule by swapping its operator for the complement.
     *
     * @return the negated rule, or empty when the rule is incomplete or has no complement
     */
    public static Optional<FilterRule> negate(FilterRule rule) {
        Objects.requireNonNull(rule, "rule cannot be null");
        return rule.selectedCategory()
                .flatMap(category -> negatedOperator(rule.operator(), category))
                .map(rule::withOperator);
    }

    private static FilterOperator equality(FilterOperator operator) {
        if (operator == EQUALS) return DOES_NOT_EQUAL;
        if (operator == DOES_NOT_EQUAL) return EQUALS;
        return null;
    }

    private static FilterOperator containment(FilterOperator operator) {
        if (operator == CONTAINS) return DOES_NOT_CONTAIN;
        if (operator == DOES_NOT_CONTAIN) return CONTAINS;
        return null;
    }

    private static FilterOperator emptiness(FilterOperator operator) {
        if (operator == IS_EMPTY) return IS_NOT_EMPTY;
        if (operator == IS_NOT_EMPTY) return IS_EMPTY;
        return null;
    }

    private static FilterOperator firstNonNull(FilterOperator first, FilterOperator second) {
        return first != null ? first : second;
    }
}
