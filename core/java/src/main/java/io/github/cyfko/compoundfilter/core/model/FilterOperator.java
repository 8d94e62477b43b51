package io.github.cyfko.compoundfilter.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Enumeration of the filter operators understood by the remote query API.
 * <p>
 * Each operator carries the key used in the API's filter grammar (for example
 * {@code "greater_than_or_equal_to"}) and a short display label used by editing
 * widgets. Which operators are legal for a given property is decided by
 * {@link PropertyCategory#supportedOperators()}.
 * </p>
 *
 * <p><strong>Operator families:</strong></p>
 * <ul>
 *   <li><em>Value comparisons</em>: equality, ordering, text and list matching. They require a value.</li>
 *   <li><em>Emptiness checks</em>: {@link #IS_EMPTY}, {@link #IS_NOT_EMPTY}. The wire payload is {@code true}.</li>
 *   <li><em>Relative date windows</em>: {@link #PAST_WEEK} to {@link #NEXT_YEAR}. The wire payload is an empty object.</li>
 * </ul>
 *
 * <pre>{@code
 * FilterOperator op = FilterOperator.fromWireKey("less_than").orElseThrow();
 * op.requiresValue();   // true
 * op.label();           // "<"
 * }</pre>
 *
 * @since 1.0.0
 */
public enum FilterOperator {

    EQUALS("equals", "="),
    DOES_NOT_EQUAL("does_not_equal", "≠"),
    GREATER_THAN("greater_than", ">"),
    LESS_THAN("less_than", "<"),
    GREATER_THAN_OR_EQUAL_TO("greater_than_or_equal_to", "≥"),
    LESS_THAN_OR_EQUAL_TO("less_than_or_equal_to", "≤"),
    CONTAINS("contains", "contains"),
    DOES_NOT_CONTAIN("does_not_contain", "does not contain"),
    STARTS_WITH("starts_with", "starts with"),
    ENDS_WITH("ends_with", "ends with"),
    BEFORE("before", "before"),
    AFTER("after", "after"),
    ON_OR_BEFORE("on_or_before", "on or before"),
    ON_OR_AFTER("on_or_after", "on or after"),
    IS_EMPTY("is_empty", "is empty"),
    IS_NOT_EMPTY("is_not_empty", "is not empty"),
    PAST_WEEK("past_week", "past week"),
    PAST_MONTH("past_month", "past month"),
    PAST_YEAR("past_year", "past year"),
    NEXT_WEEK("next_week", "next week"),
    NEXT_MONTH("next_month", "next month"),
    NEXT_YEAR("next_year", "next year");

    private final String wireKey;
    private final String label;

    FilterOperator(String wireKey, String label) {
        this.wireKey = wireKey;
        this.label = label;
    }

    /**
     * Returns the key used for this operator in the remote filter grammar.
     *
     * @return the wire key, e.g. {@code "does_not_contain"}
     */
    public String wireKey() {
        return wireKey;
    }

    /**
     * Returns the short label shown next to the operator in editing widgets.
     *
     * @return the display label, e.g. {@code "≥"} or {@code "past week"}
     */
    public String label() {
        return label;
    }

    /**
     * Whether this operator tests for the presence or absence of a value.
     *
     * @return {@code true} for {@link #IS_EMPTY} and {@link #IS_NOT_EMPTY}
     */
    public boolean isEmptinessCheck() {
        return this == IS_EMPTY || this == IS_NOT_EMPTY;
    }

    /**
     * Whether this operator is a date window relative to the current day.
     *
     * @return {@code true} for {@code past_*} and {@code next_*} operators
     */
    public boolean isRelativeDateWindow() {
        return switch (this) {
            case PAST_WEEK, PAST_MONTH, PAST_YEAR, NEXT_WEEK, NEXT_MONTH, NEXT_YEAR -> true;
            default -> false;
        };
    }

    /**
     * Whether a rule using this operator must carry a non-null value.
     *
     * @return {@code false} for emptiness checks and relative date windows
     */
    public boolean requiresValue() {
        return !isEmptinessCheck() && !isRelativeDateWindow();
    }

    /**
     * Resolves an operator from its wire key, case-insensitively.
     *
     * @param wireKey the key, e.g. {@code "on_or_after"}
     * @return the operator, or empty when the key is unknown or null
     */
    public static Optional<FilterOperator> fromWireKey(String wireKey) {
        if (wireKey == null) {
            return Optional.empty();
        }
        String normalized = wireKey.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(op -> op.wireKey.equals(normalized))
                .findFirst();
    }
}
