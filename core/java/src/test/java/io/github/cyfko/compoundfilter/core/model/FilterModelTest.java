package io.github.cyfko.compoundfilter.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Filter model Tests")
class FilterModelTest {

    @Nested
    @DisplayName("FilterRule")
    class FilterRuleTests {

        @Test
        @DisplayName("Should treat blank property as unselected")
        void blankPropertyIsUnselected() {
            FilterRule rule = FilterRule.of("  ", PropertyCategory.NUMBER, FilterOperator.EQUALS, FilterValue.of(1));

            assertNull(rule.property());
            assertTrue(rule.selectedProperty().isEmpty());
            assertFalse(rule.isComplete());
        }

        @Test
        @DisplayName("Should default a null value to none")
        void nullValueBecomesNone() {
            FilterRule rule = FilterRule.of("Done", PropertyCategory.CHECKBOX, FilterOperator.EQUALS, null);

            assertTrue(rule.value().isNull());
        }

        @Test
        @DisplayName("Incomplete placeholder has no property, no category, equals and no value")
        void incompletePlaceholder() {
            FilterRule rule = FilterRule.incomplete();

            assertFalse(rule.isComplete());
            assertEquals(FilterOperator.EQUALS, rule.operator());
            assertTrue(rule.value().isNull());
        }

        @Test
        @DisplayName("Timestamp rule uses the category name as property")
        void timestampRule() {
            FilterRule rule = FilterRule.timestamp(PropertyCategory.CREATED_TIME, FilterOperator.PAST_WEEK, null);

            assertEquals("created_time", rule.property());
            assertTrue(rule.isComplete());
            assertThrows(IllegalArgumentException.class,
                    () -> FilterRule.timestamp(PropertyCategory.DATE, FilterOperator.PAST_WEEK, null));
        }

        @Test
        @DisplayName("Merge keeps the fields absent from the update")
        void mergePartialUpdate() {
            FilterRule rule = FilterRule.of("Price", PropertyCategory.NUMBER, FilterOperator.LESS_THAN, FilterValue.of(10));

            FilterRule merged = rule.merge(RuleUpdate.ofValue(FilterValue.of(20)));

            assertEquals("Price", merged.property());
            assertEquals(FilterOperator.LESS_THAN, merged.operator());
            assertEquals(FilterValue.of(20), merged.value());
            assertSame(rule, rule.merge(RuleUpdate.builder().build()));
        }
    }

    @Nested
    @DisplayName("FilterGroup")
    class FilterGroupTests {

        private final FilterRule a = FilterRule.of("A", PropertyCategory.CHECKBOX, FilterOperator.EQUALS, FilterValue.of(true));
        private final FilterRule b = FilterRule.of("B", PropertyCategory.CHECKBOX, FilterOperator.EQUALS, FilterValue.of(false));

        @Test
        @DisplayName("Should reject a group without children")
        void rejectsEmptyGroup() {
            assertThrows(IllegalArgumentException.class, () -> new FilterGroup(GroupOperator.AND, false, List.of()));
        }

        @Test
        @DisplayName("Seeded group holds one incomplete rule")
        void seededGroup() {
            FilterGroup group = FilterGroup.seeded(GroupOperator.OR);

            assertEquals(1, group.size());
            assertEquals(FilterRule.incomplete(), group.child(0));
            assertFalse(group.negated());
        }

        @Test
        @DisplayName("Copy methods leave the original untouched")
        void copiesAreIndependent() {
            FilterGroup group = FilterGroup.and(a);

            FilterGroup appended = group.append(b);
            FilterGroup inserted = appended.insert(0, b);

            assertEquals(List.of(a), group.children());
            assertEquals(List.of(a, b), appended.children());
            assertEquals(List.of(b, a, b), inserted.children());
            assertEquals(List.of(a), appended.childrenWithout(1));
        }
    }

    @Nested
    @DisplayName("FilterPath")
    class FilterPathTests {

        @Test
        @DisplayName("Root path has no parent")
        void rootHasNoParent() {
            assertTrue(FilterPath.root().isRoot());
            assertThrows(IllegalStateException.class, () -> FilterPath.root().parent());
        }

        @Test
        @DisplayName("Navigation helpers split the path")
        void navigation() {
            FilterPath path = FilterPath.of(1, 0, 2);

            assertEquals(1, path.head());
            assertEquals(FilterPath.of(0, 2), path.tail());
            assertEquals(FilterPath.of(1, 0), path.parent());
            assertEquals(2, path.last());
            assertEquals(FilterPath.of(1, 0, 2, 3), path.child(3));
        }
    }

    @Nested
    @DisplayName("Catalog")
    class CatalogTests {

        @ParameterizedTest
        @CsvSource({
                "checkbox, equals, true",
                "checkbox, is_empty, false",
                "number, greater_than_or_equal_to, true",
                "number, contains, false",
                "multi_select, contains, true",
                "multi_select, equals, false",
                "rich_text, starts_with, true",
                "date, past_week, true",
                "created_time, on_or_after, true",
                "status, is_not_empty, true",
                "select, before, false"
        })
        @DisplayName("Category operator sets follow the remote API")
        void categoryOperators(String category, String operator, boolean supported) {
            PropertyCategory c = PropertyCategory.fromWireKey(category).orElseThrow();
            FilterOperator o = FilterOperator.fromWireKey(operator).orElseThrow();

            assertEquals(supported, c.supports(o));
        }

        @Test
        @DisplayName("Operator flags drive value requirements")
        void operatorFlags() {
            assertTrue(FilterOperator.IS_EMPTY.isEmptinessCheck());
            assertFalse(FilterOperator.IS_EMPTY.requiresValue());
            assertTrue(FilterOperator.NEXT_MONTH.isRelativeDateWindow());
            assertFalse(FilterOperator.NEXT_MONTH.requiresValue());
            assertTrue(FilterOperator.BEFORE.requiresValue());
            assertTrue(FilterOperator.fromWireKey("bigger_than").isEmpty());
        }

        @Test
        @DisplayName("Only created_time and last_edited_time are timestamps")
        void timestamps() {
            assertTrue(PropertyCategory.CREATED_TIME.isTimestamp());
            assertTrue(PropertyCategory.LAST_EDITED_TIME.isTimestamp());
            assertFalse(PropertyCategory.DATE.isTimestamp());
        }
    }

    @Nested
    @DisplayName("FilterValue")
    class FilterValueTests {

        @Test
        @DisplayName("Raw forms match the JSON shapes")
        void rawForms() {
            assertEquals(Boolean.TRUE, FilterValue.of(true).raw());
            assertEquals("x", FilterValue.of("x").raw());
            assertEquals(new BigDecimal("10"), FilterValue.of(10).raw());
            assertNull(FilterValue.none().raw());
            assertEquals(Map.of("start", "2024-01-01"), FilterValue.dateRange("2024-01-01", null).raw());
            assertEquals(Map.of("start", "2024-01-01", "end", "2024-02-01"),
                    FilterValue.dateRange("2024-01-01", "2024-02-01").raw());
        }

        @Test
        @DisplayName("Null inputs map to none")
        void nullInputs() {
            assertTrue(FilterValue.of((String) null).isNull());
            assertTrue(FilterValue.of((Number) null).isNull());
            assertThrows(IllegalArgumentException.class, () -> FilterValue.dateRange(" ", null));
        }
    }

    @Test
    @DisplayName("Empty compound filter is a singleton without root")
    void emptyCompoundFilter() {
        assertSame(CompoundFilter.empty(), CompoundFilter.of(null));
        assertTrue(CompoundFilter.empty().isEmpty());
        assertTrue(CompoundFilter.empty().root().isEmpty());
    }
}
