package io.github.cyfko.compoundfilter.core.model;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Operand of a {@link FilterRule}: a boolean, a text, a number, {@code null}, or a date range.
 * <p>
 * Values are immutable. {@link #raw()} exposes the plain Java form used when the value is
 * written into the remote filter grammar.
 * </p>
 *
 * <pre>{@code
 * FilterValue.of(true);                       // checkbox
 * FilterValue.of("In progress");              // select, status, text, ISO date
 * FilterValue.of(10);                         // number
 * FilterValue.dateRange("2024-01-01", null);  // date range with an open end
 * FilterValue.none();                         // no operand (emptiness checks, incomplete rules)
 * }</pre>
 *
 * @since 1.0.0
 */
public sealed interface FilterValue
        permits FilterValue.Bool, FilterValue.Text, FilterValue.Numeric, FilterValue.DateRange, FilterValue.None {

    /**
     * @return the Java representation of this value, {@code null} for {@link None}
     */
    Object raw();

    /**
     * @return {@code true} if this value carries no operand
     */
    default boolean isNull() {
        return this instanceof None;
    }

    static FilterValue of(boolean value) {
        return new Bool(value);
    }

    static FilterValue of(String value) {
        return value == null ? none() : new Text(value);
    }

    static FilterValue of(Number value) {
        if (value == null) {
            return none();
        }
        return new Numeric(value instanceof BigDecimal ? (BigDecimal) value : new BigDecimal(value.toString()));
    }

    static FilterValue dateRange(String start, String end) {
        return new DateRange(start, end);
    }

    static FilterValue none() {
        return None.INSTANCE;
    }

    record Bool(boolean value) implements FilterValue {
        @Override
        public Object raw() {
            return value;
        }
    }

    record Text(String value) implements FilterValue {
        public Text {
            Objects.requireNonNull(value, "text value cannot be null");
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record Numeric(BigDecimal value) implements FilterValue {
        public Numeric {
            Objects.requireNonNull(value, "numeric value cannot be null");
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    /**
     * Date range with a mandatory start and an optional end, both ISO 8601 strings.
     */
    record DateRange(String start, String end) implements FilterValue {
        public DateRange {
            if (start == null || start.isBlank()) {
                throw new IllegalArgumentException("date range start is required");
            }
        }

        @Override
        public Object raw() {
            Map<String, Object> range = new LinkedHashMap<>();
            range.put("start", start);
            if (end != null) {
                range.put("end", end);
            }
            return range;
        }
    }

    final class None implements FilterValue {
        private static final None INSTANCE = new None();

        private None() {}

        @Override
        public Object raw() {
            return null;
        }

        @Override
        public String toString() {
            return "None";
        }
    }
}
