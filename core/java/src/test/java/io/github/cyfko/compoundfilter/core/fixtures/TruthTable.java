package io.github.cyfko.compoundfilter.core.fixtures;

import io.github.cyfko.compoundfilter.core.model.CompoundFilter;
import io.github.cyfko.compoundfilter.core.model.FilterGroup;
import io.github.cyfko.compoundfilter.core.model.FilterNode;
import io.github.cyfko.compoundfilter.core.model.FilterOperator;
import io.github.cyfko.compoundfilter.core.model.FilterRule;
import io.github.cyfko.compoundfilter.core.model.FilterValue;
import io.github.cyfko.compoundfilter.core.model.GroupOperator;
import io.github.cyfko.compoundfilter.core.model.PropertyCategory;
import io.github.cyfko.compoundfilter.core.wire.WireCompoundFilter;
import io.github.cyfko.compoundfilter.core.wire.WireFilter;
import io.github.cyfko.compoundfilter.core.wire.WirePropertyFilter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Evaluates client trees and remote filters against rows of number properties {@code P0..Pn}
 * holding 0 or 1, so that two filters can be compared over every row.
 */
public final class TruthTable {

    private static final FilterOperator[] OPERATORS = {
            FilterOperator.EQUALS, FilterOperator.DOES_NOT_EQUAL, FilterOperator.GREATER_THAN,
            FilterOperator.LESS_THAN, FilterOperator.GREATER_THAN_OR_EQUAL_TO, FilterOperator.LESS_THAN_OR_EQUAL_TO
    };

    private final int variables;

    public TruthTable(int variables) {
        this.variables = variables;
    }

    public static FilterRule rule(String property, FilterOperator operator, int value) {
        return FilterRule.of(property, PropertyCategory.NUMBER, operator, FilterValue.of(value));
    }

    /**
     * @return all 2^n rows
     */
    public List<Map<String, Integer>> rows() {
        List<Map<String, Integer>> rows = new ArrayList<>();
        for (int bits = 0; bits < (1 << variables); bits++) {
            Map<String, Integer> row = new HashMap<>();
            for (int v = 0; v < variables; v++) {
                row.put("P" + v, (bits >> v) & 1);
            }
            rows.add(row);
        }
        return rows;
    }

    public static boolean evaluate(CompoundFilter filter, Map<String, Integer> row) {
        return filter.root().map(root -> evaluate(root, row)).orElse(true);
    }

    public static boolean evaluate(FilterNode node, Map<String, Integer> row) {
        if (node instanceof FilterRule rule) {
            return compare(rule.property(), rule.operator(), rule.value(), row);
        }
        FilterGroup group = (FilterGroup) node;
        boolean result = group.operator() == GroupOperator.AND;
        for (FilterNode child : group.children()) {
            boolean value = evaluate(child, row);
            result = group.operator() == GroupOperator.AND ? result && value : result || value;
        }
        return group.negated() != result;
    }

    public static boolean evaluate(WireFilter filter, Map<String, Integer> row) {
        if (filter instanceof WirePropertyFilter leaf) {
            return compare(leaf.property(), leaf.operator(), leaf.value(), row);
        }
        WireCompoundFilter compound = (WireCompoundFilter) filter;
        boolean result = compound.operator() == GroupOperator.AND;
        for (WireFilter member : compound.members()) {
            boolean value = evaluate(member, row);
            result = compound.operator() == GroupOperator.AND ? result && value : result || value;
        }
        return result;
    }

    private static boolean compare(String property, FilterOperator operator, FilterValue value, Map<String, Integer> row) {
        int actual = row.get(property);
        int expected = ((BigDecimal) value.raw()).intValueExact();
        return switch (operator) {
            case EQUALS -> actual == expected;
            case DOES_NOT_EQUAL -> actual != expected;
            case GREATER_THAN -> actual > expected;
            case LESS_THAN -> actual < expected;
            case GREATER_THAN_OR_EQUAL_TO -> actual >= expected;
            case LESS_THAN_OR_EQUAL_TO -> actual <= expected;
            default -> throw new IllegalArgumentException("unsupported in truth tables: " + operator);
        };
    }

    /**
     * Random tree over {@code P0..Pn}, up to {@code maxHeight} group levels, 1 to {@code maxFanOut}
     * children per group, groups negated at random.
     */
    public FilterNode randomTree(Random random, int maxHeight, int maxFanOut) {
        if (maxHeight == 0 || random.nextInt(4) == 0) {
            return rule("P" + random.nextInt(variables), OPERATORS[random.nextInt(OPERATORS.length)], random.nextInt(2));
        }
        int size = 1 + random.nextInt(maxFanOut);
        List<FilterNode> children = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            children.add(randomTree(random, maxHeight - 1, maxFanOut));
        }
        GroupOperator operator = random.nextBoolean() ? GroupOperator.AND : GroupOperator.OR;
        return new FilterGroup(operator, random.nextInt(3) == 0, children);
    }
}
