package io.github.cyfko.compoundfilter.core.editor;

import io.github.cyfko.compoundfilter.core.model.CompoundFilter;
import io.github.cyfko.compoundfilter.core.model.FilterGroup;
import io.github.cyfko.compoundfilter.core.model.FilterOperator;
import io.github.cyfko.compoundfilter.core.model.FilterPath;
import io.github.cyfko.compoundfilter.core.model.FilterRule;
import io.github.cyfko.compoundfilter.core.model.FilterValue;
import io.github.cyfko.compoundfilter.core.model.GroupOperator;
import io.github.cyfko.compoundfilter.core.model.PropertyCategory;
import io.github.cyfko.compoundfilter.core.model.RuleUpdate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static io.github.cyfko.compoundfilter.core.editor.CompoundFilterEditor.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CompoundFilterEditor Tests")
class CompoundFilterEditorTest {

    private static final FilterRule STATUS = FilterRule.of("Status", PropertyCategory.STATUS, FilterOperator.EQUALS, FilterValue.of("Done"));
    private static final FilterRule PRICE = FilterRule.of("Price", PropertyCategory.NUMBER, FilterOperator.LESS_THAN, FilterValue.of(10));
    private static final FilterRule TAGS = FilterRule.of("Tags", PropertyCategory.MULTI_SELECT, FilterOperator.CONTAINS, FilterValue.of("urgent"));
    private static final FilterRule NAME = FilterRule.of("Name", PropertyCategory.TITLE, FilterOperator.STARTS_WITH, FilterValue.of("A"));

    @Nested
    @DisplayName("addRule / removeNode")
    class AddAndRemove {

        @Test
        @DisplayName("Should build a filter incrementally from empty")
        void incrementalBuild() {
            // Given
            CompoundFilter filter = CompoundFilter.empty();

            // When
            CompoundFilter one = addRule(filter, STATUS);
            CompoundFilter two = addRule(one, PRICE);
            CompoundFilter three = addRule(two, TAGS);

            // Then
            assertEquals(CompoundFilter.of(STATUS), one);
            assertEquals(CompoundFilter.of(FilterGroup.and(STATUS, PRICE)), two);
            assertEquals(CompoundFilter.of(FilterGroup.and(STATUS, PRICE, TAGS)), three);
            assertEquals(1, nestingDepth(three));
        }

        @Test
        @DisplayName("Removing the root clears the filter")
        void removeRoot() {
            CompoundFilter filter = CompoundFilter.of(FilterGroup.and(STATUS, PRICE));

            assertTrue(removeNode(filter, FilterPath.root()).isEmpty());
            assertTrue(removeNode(CompoundFilter.of(STATUS), FilterPath.root()).isEmpty());
        }

        @Test
        @DisplayName("A group left with one child collapses into it")
        void collapseOnRemoval() {
            CompoundFilter filter = CompoundFilter.of(FilterGroup.and(STATUS, PRICE));

            assertEquals(CompoundFilter.of(PRICE), removeNode(filter, FilterPath.of(0)));
        }

        @Test
        @DisplayName("Removing from a nested group keeps the rest of the tree")
        void nestedRemoval() {
            CompoundFilter filter = CompoundFilter.of(FilterGroup.and(STATUS, FilterGroup.or(PRICE, TAGS)));

            CompoundFilter result = removeNode(filter, FilterPath.of(1, 0));

            assertEquals(CompoundFilter.of(FilterGroup.and(STATUS, TAGS)), result);
        }

        @Test
        @DisplayName("A group emptied by a removal disappears, cascading the collapse")
        void emptiedGroupIsRemoved() {
            CompoundFilter filter = CompoundFilter.of(FilterGroup.and(STATUS, FilterGroup.or(PRICE)));

            CompoundFilter result = removeNode(filter, FilterPath.of(1, 0));

            assertEquals(CompoundFilter.of(STATUS), result);
        }

        @Test
        @DisplayName("Add then remove returns to the previous filter")
        void addThenRemove() {
            CompoundFilter filter = CompoundFilter.of(FilterGroup.and(STATUS, PRICE));

            CompoundFilter added = addRule(filter, TAGS);
            CompoundFilter removed = removeNode(added, FilterPath.of(2));

            assertEquals(filter, removed);
        }

        @ParameterizedTest
        @CsvSource({"5", "-1"})
        @DisplayName("Unresolved index is a no-op returning the same instance")
        void outOfRangeRemoval(int index) {
            CompoundFilter filter = CompoundFilter.of(FilterGroup.and(STATUS, PRICE));

            assertSame(filter, removeNode(filter, FilterPath.of(index)));
        }

        @Test
        @DisplayName("A path running through a rule is a no-op")
        void pathThroughRule() {
            CompoundFilter filter = CompoundFilter.of(FilterGroup.and(STATUS, PRICE));

            assertSame(filter, removeNode(filter, FilterPath.of(0, 1)));
            assertSame(filter, updateRule(filter, FilterPath.of(0, 1), RuleUpdate.ofValue(FilterValue.of("x"))));
        }
    }

    @Nested
    @DisplayName("Negated groups")
    class NegatedGroups {

        @Test
        @DisplayName("Toggling negation flips the flag on groups only")
        void toggleNegation() {
            CompoundFilter filter = CompoundFilter.of(FilterGroup.and(STATUS, PRICE));

            CompoundFilter negated = toggleGroupNegation(filter, FilterPath.root());

            assertTrue(((FilterGroup) negated.root().get()).negated());
            assertEquals(filter, toggleGroupNegation(negated, FilterPath.root()));
            assertSame(filter, toggleGroupNegation(filter, FilterPath.of(0)));
        }

        @Test
        @DisplayName("Collapsing a negated group onto a group moves the negation")
        void collapseMovesNegationToGroup() {
            FilterGroup inner = FilterGroup.or(PRICE, TAGS);
            CompoundFilter filter = CompoundFilter.of(FilterGroup.and(STATUS, inner).withNegated(true));

            CompoundFilter result = removeNode(filter, FilterPath.of(0));

            assertEquals(CompoundFilter.of(inner.withNegated(true)), result);
        }

        @Test
        @DisplayName("Collapsing a negated group onto a rule keeps a one-child negated group")
        void collapseKeepsNegatedGroupAroundRule() {
            CompoundFilter filter = CompoundFilter.of(FilterGroup.and(STATUS, PRICE).withNegated(true));

            CompoundFilter result = removeNode(filter, FilterPath.of(0));

            assertEquals(CompoundFilter.of(FilterGroup.and(PRICE).withNegated(true)), result);
        }
    }

    @Nested
    @DisplayName("Rule and group updates")
    class Updates {

        @Test
        @DisplayName("Should merge an update into the addressed rule")
        void updateRuleMerges() {
            CompoundFilter filter = CompoundFilter.of(FilterGroup.and(STATUS, PRICE));

            CompoundFilter result = updateRule(filter, FilterPath.of(1), RuleUpdate.builder()
                    .operator(FilterOperator.GREATER_THAN)
                    .value(FilterValue.of(5))
                    .build());

            FilterRule updated = (FilterRule) resolve(result, FilterPath.of(1)).orElseThrow();
            assertEquals(FilterOperator.GREATER_THAN, updated.operator());
            assertEquals(FilterValue.of(5), updated.value());
            assertEquals("Price", updated.property());
            assertSame(STATUS, resolve(result, FilterPath.of(0)).orElseThrow());
        }

        @Test
        @DisplayName("Updating a group path is a no-op")
        void updateGroupIsNoOp() {
            CompoundFilter filter = CompoundFilter.of(FilterGroup.and(STATUS, PRICE));

            assertSame(filter, updateRule(filter, FilterPath.root(), RuleUpdate.ofOperator(FilterOperator.IS_EMPTY)));
        }

        @Test
        @DisplayName("Toggling the operator flips AND and OR")
        void toggleOperator() {
            CompoundFilter filter = CompoundFilter.of(FilterGroup.and(STATUS, FilterGroup.or(PRICE, TAGS)));

            CompoundFilter result = toggleGroupOperator(filter, FilterPath.of(1));

            assertEquals(CompoundFilter.of(FilterGroup.and(STATUS, FilterGroup.and(PRICE, TAGS))), result);
            assertSame(filter, toggleGroupOperator(filter, FilterPath.of(0)));
            assertSame(CompoundFilter.empty(), toggleGroupOperator(CompoundFilter.empty(), FilterPath.root()));
        }
    }

    @Nested
    @DisplayName("Groups and depth")
    class GroupsAndDepth {

        @Test
        @DisplayName("addGroup seeds an incomplete rule")
        void addGroupSeeds() {
            CompoundFilter empty = addGroup(CompoundFilter.empty(), GroupOperator.OR);
            CompoundFilter wrapped = addGroup(CompoundFilter.of(STATUS), GroupOperator.OR);

            assertEquals(CompoundFilter.of(FilterGroup.seeded(GroupOperator.OR)), empty);
            assertEquals(CompoundFilter.of(FilterGroup.or(STATUS, FilterGroup.seeded(GroupOperator.OR))), wrapped);
        }

        @Test
        @DisplayName("Depth guard stops nesting beyond the maximum")
        void depthGuard() {
            // Given
            CompoundFilter filter = addGroupAtPath(CompoundFilter.empty(), FilterPath.root(), GroupOperator.AND, 2);
            filter = addGroupAtPath(filter, FilterPath.root(), GroupOperator.OR, 2);
            assertEquals(2, nestingDepth(filter));

            // When
            CompoundFilter attempt = addGroupAtPath(filter, FilterPath.of(1), GroupOperator.AND, 2);

            // Then
            assertSame(filter, attempt);
            assertEquals(2, nestingDepth(attempt));
            assertFalse(canAddGroupAtPath(filter, FilterPath.of(1), 2));
            assertTrue(canAddGroupAtPath(filter, FilterPath.of(1), 3));
        }

        @Test
        @DisplayName("An empty filter accepts a root group when the maximum is at least 1")
        void emptyFilterEligibility() {
            assertTrue(canAddGroupAtPath(CompoundFilter.empty(), FilterPath.root(), 1));
            assertFalse(canAddGroupAtPath(CompoundFilter.empty(), FilterPath.root(), 0));
        }

        @Test
        @DisplayName("Depth counts groups on the path")
        void depthAtPathCountsGroups() {
            CompoundFilter filter = CompoundFilter.of(FilterGroup.and(STATUS, FilterGroup.or(PRICE, TAGS)));

            assertEquals(1, depthAtPath(filter, FilterPath.root()));
            assertEquals(1, depthAtPath(filter, FilterPath.of(0)));
            assertEquals(2, depthAtPath(filter, FilterPath.of(1)));
            assertEquals(2, depthAtPath(filter, FilterPath.of(1, 1)));
            assertEquals(0, depthAtPath(CompoundFilter.of(STATUS), FilterPath.root()));
            assertEquals(0, nestingDepth(CompoundFilter.of(STATUS)));
            assertEquals(0, nestingDepth(CompoundFilter.empty()));
        }

        @Test
        @DisplayName("addNodeToGroup appends built nodes")
        void addNodeToGroup() {
            CompoundFilter filter = CompoundFilter.of(FilterGroup.and(STATUS, FilterGroup.or(PRICE)));

            CompoundFilter result = CompoundFilterEditor.addNodeToGroup(filter, FilterPath.of(1), TAGS);

            assertEquals(CompoundFilter.of(FilterGroup.and(STATUS, FilterGroup.or(PRICE, TAGS))), result);
            assertEquals(CompoundFilter.of(TAGS), CompoundFilterEditor.addNodeToGroup(CompoundFilter.empty(), FilterPath.root(), TAGS));
            assertSame(filter, CompoundFilterEditor.addNodeToGroup(filter, FilterPath.of(0), TAGS));
        }
    }

    @Nested
    @DisplayName("duplicateNode")
    class Duplicate {

        @Test
        @DisplayName("Copy is spliced right after the original")
        void duplicateChild() {
            CompoundFilter filter = CompoundFilter.of(FilterGroup.and(STATUS, PRICE));

            assertEquals(CompoundFilter.of(FilterGroup.and(STATUS, STATUS, PRICE)), duplicateNode(filter, FilterPath.of(0)));
        }

        @Test
        @DisplayName("Duplicating the root wraps both in an AND group")
        void duplicateRoot() {
            FilterGroup or = FilterGroup.or(STATUS, NAME);

            assertEquals(CompoundFilter.of(FilterGroup.and(STATUS, STATUS)), duplicateNode(CompoundFilter.of(STATUS), FilterPath.root()));
            assertEquals(CompoundFilter.of(FilterGroup.and(or, or)), duplicateNode(CompoundFilter.of(or), FilterPath.root()));
        }

        @Test
        @DisplayName("Editing the copy leaves the original unchanged")
        void copyIsIndependent() {
            CompoundFilter filter = duplicateNode(CompoundFilter.of(FilterGroup.and(STATUS, PRICE)), FilterPath.of(1));

            CompoundFilter edited = updateRule(filter, FilterPath.of(2), RuleUpdate.ofValue(FilterValue.of(99)));

            assertEquals(PRICE, resolve(edited, FilterPath.of(1)).orElseThrow());
            assertEquals(FilterValue.of(99), ((FilterRule) resolve(edited, FilterPath.of(2)).orElseThrow()).value());
        }
    }

    @Test
    @DisplayName("Unsaved changes and effective max depth")
    void editingHelpers() {
        CompoundFilter applied = CompoundFilter.of(STATUS);

        assertFalse(hasUnsavedChanges(applied, CompoundFilter.of(STATUS)));
        assertTrue(hasUnsavedChanges(addRule(applied, PRICE), applied));
        assertEquals(3, effectiveMaxDepth(1, 3));
        assertEquals(4, effectiveMaxDepth(4, 3));
        assertTrue(reset().isEmpty());
    }
}
