package io.github.cyfko.compoundfilter.core.model;

import java.util.Optional;

/**
 * Partial set of rule fields applied by {@code CompoundFilterEditor.updateRule}.
 * <p>
 * Absent fields leave the target rule unchanged. Selecting a new property usually comes with
 * its category and a reset value:
 * </p>
 * <pre>{@code
 * RuleUpdate update = RuleUpdate.builder()
 *     .property("Status")
 *     .category(PropertyCategory.STATUS)
 *     .operator(FilterOperator.EQUALS)
 *     .value(FilterValue.none())
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class RuleUpdate {

    private final String property;
    private final PropertyCategory category;
    private final FilterOperator operator;
    private final FilterValue value;

    private RuleUpdate(Builder builder) {
        this.property = builder.property;
        this.category = builder.category;
        this.operator = builder.operator;
        this.value = builder.value;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RuleUpdate ofValue(FilterValue value) {
        return builder().value(value).build();
    }

    public static RuleUpdate ofOperator(FilterOperator operator) {
        return builder().operator(operator).build();
    }

    public Optional<String> property() {
        return Optional.ofNullable(property);
    }

    public Optional<PropertyCategory> category() {
        return Optional.ofNullable(category);
    }

    public Optional<FilterOperator> operator() {
        return Optional.ofNullable(operator);
    }

    public Optional<FilterValue> value() {
        return Optional.ofNullable(value);
    }

    public boolean isEmpty() {
        return property == null && category == null && operator == null && value == null;
    }

    @Override
    public String toString() {
        return "RuleUpdate[property=" + property + ", category=" + category
                + ", operator=" + operator + ", value=" + value + "]";
    }

    public static final class Builder {
        private String property;
        private PropertyCategory category;
        private FilterOperator operator;
        private FilterValue value;

        private Builder() {}

        public Builder property(String property) { this.property = property; return this; }
        public Builder category(PropertyCategory category) { this.category = category; return this; }
        public Builder operator(FilterOperator operator) { this.operator = operator; return this; }
        public Builder value(FilterValue value) { this.value = value; return this; }

        public RuleUpdate build() {
            return new RuleUpdate(this);
        }
    }
}
