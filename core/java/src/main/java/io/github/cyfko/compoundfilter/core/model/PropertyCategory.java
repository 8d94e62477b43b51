package io.github.cyfko.compoundfilter.core.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import static io.github.cyfko.compoundfilter.core.model.FilterOperator.*;

/**
 * Property types that can be filtered, each with its fixed operator set.
 * <p>
 * The {@linkplain #wireKey() wire key} names the type-specific condition object in the
 * remote grammar ({@code {"property": "Price", "number": {"less_than": 10}}}). The two
 * timestamp categories are not bound to a user property: they are emitted under a
 * {@code "timestamp"} key instead of {@code "property"}.
 * </p>
 *
 * @since 1.0.0
 */
public enum PropertyCategory {

    CHECKBOX("checkbox", EnumSet.of(EQUALS, DOES_NOT_EQUAL)),
    DATE("date", dateOperators()),
    CREATED_TIME("created_time", dateOperators()),
    LAST_EDITED_TIME("last_edited_time", dateOperators()),
    MULTI_SELECT("multi_select", EnumSet.of(CONTAINS, DOES_NOT_CONTAIN, IS_EMPTY, IS_NOT_EMPTY)),
    NUMBER("number", EnumSet.of(EQUALS, DOES_NOT_EQUAL, GREATER_THAN, LESS_THAN,
            GREATER_THAN_OR_EQUAL_TO, LESS_THAN_OR_EQUAL_TO, IS_EMPTY, IS_NOT_EMPTY)),
    RICH_TEXT("rich_text", textOperators()),
    TITLE("title", textOperators()),
    SELECT("select", EnumSet.of(EQUALS, DOES_NOT_EQUAL, IS_EMPTY, IS_NOT_EMPTY)),
    STATUS("status", EnumSet.of(EQUALS, DOES_NOT_EQUAL, IS_EMPTY, IS_NOT_EMPTY));

    private final String wireKey;
    private final Set<FilterOperator> supportedOperators;

    PropertyCategory(String wireKey, EnumSet<FilterOperator> supportedOperators) {
        this.wireKey = wireKey;
        this.supportedOperators = Collections.unmodifiableSet(supportedOperators);
    }

    /**
     * @return the key of the type-specific condition object in the remote grammar
     */
    public String wireKey() {
        return wireKey;
    }

    /**
     * Returns the operators this category accepts, in declaration order.
     *
     * @return an unmodifiable set of operators
     */
    public Set<FilterOperator> supportedOperators() {
        return supportedOperators;
    }

    /**
     * @param operator the operator to test
     * @return {@code true} if rules of this category may use {@code operator}
     */
    public boolean supports(FilterOperator operator) {
        return supportedOperators.contains(operator);
    }

    /**
     * Whether this category is a page timestamp rather than a user property.
     *
     * @return {@code true} for {@link #CREATED_TIME} and {@link #LAST_EDITED_TIME}
     */
    public boolean isTimestamp() {
        return this == CREATED_TIME || this == LAST_EDITED_TIME;
    }

    /**
     * Resolves a category from its wire key, case-insensitively.
     *
     * @param wireKey the key, e.g. {@code "multi_select"}
     * @return the category, or empty when the key is unknown, blank or null
     */
    public static Optional<PropertyCategory> fromWireKey(String wireKey) {
        if (wireKey == null || wireKey.isBlank()) {
            return Optional.empty();
        }
        String normalized = wireKey.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(category -> category.wireKey.equals(normalized))
                .findFirst();
    }

    private static EnumSet<FilterOperator> dateOperators() {
        return EnumSet.of(EQUALS, BEFORE, AFTER, ON_OR_BEFORE, ON_OR_AFTER, IS_EMPTY, IS_NOT_EMPTY,
                PAST_WEEK, PAST_MONTH, PAST_YEAR, NEXT_WEEK, NEXT_MONTH, NEXT_YEAR);
    }

    private static EnumSet<FilterOperator> textOperators() {
        return EnumSet.of(EQUALS, DOES_NOT_EQUAL, CONTAINS, DOES_NOT_CONTAIN, STARTS_WITH, ENDS_WITH,
                IS_EMPTY, IS_NOT_EMPTY);
    }
}
