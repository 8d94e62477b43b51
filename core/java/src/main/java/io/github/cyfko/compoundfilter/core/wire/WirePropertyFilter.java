package io.github.cyfko.compoundfilter.core.wire;

import io.github.cyfko.compoundfilter.core.model.FilterOperator;
import io.github.cyfko.compoundfilter.core.model.FilterValue;
import io.github.cyfko.compoundfilter.core.model.PropertyCategory;

import java.util.Map;
import java.util.Objects;

/**
 * Leaf predicate of the remote grammar:
 * <pre>
 * {"property": "Price", "number": {"less_than": 10}}
 * {"timestamp": "created_time", "created_time": {"past_week": {}}}
 * </pre>
 *
 * @param property the property name (the category key for timestamps)
 * @param category the property category, naming the condition object
 * @param operator the operator, naming the single entry of the condition object
 * @param value    the operand; ignored for emptiness checks and relative date windows
 * @since 1.0.0
 */
public record WirePropertyFilter(
        String property,
        PropertyCategory category,
        FilterOperator operator,
        FilterValue value
) implements WireFilter {

    public WirePropertyFilter {
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(operator, "operator is required");
        value = value == null ? FilterValue.none() : value;
    }

    @Override
    public int height() {
        return 0;
    }

    public boolean isTimestamp() {
        return category.isTimestamp();
    }

    /**
     * Payload of the condition entry: {@code true} for emptiness checks, an empty object for
     * relative date windows, the raw value otherwise.
     */
    public Object payload() {
        if (operator.isEmptinessCheck()) {
            return Boolean.TRUE;
        }
        if (operator.isRelativeDateWindow()) {
            return Map.of();
        }
        return value.raw();
    }
}
