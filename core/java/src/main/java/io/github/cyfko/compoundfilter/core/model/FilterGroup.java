package io.github.cyfko.compoundfilter.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * AND/OR combination of child nodes, optionally marked negated.
 * <p>
 * The {@code negated} flag is an editing-time extension: the remote grammar has no group
 * negation, so negated groups are rewritten away by the negation normalizer before any
 * conversion. A group always holds at least one child; the constructor rejects an empty
 * list so an empty group cannot exist.
 * </p>
 *
 * @param operator the connective
 * @param negated  whether the group's result is inverted
 * @param children the ordered children, at least one
 * @since 1.0.0
 */
public record FilterGroup(
        GroupOperator operator,
        boolean negated,
        List<FilterNode> children
) implements FilterNode {

    public FilterGroup {
        Objects.requireNonNull(operator, "group operator is required");
        Objects.requireNonNull(children, "group children are required");
        if (children.isEmpty()) {
            throw new IllegalArgumentException("a filter group needs at least one child");
        }
        children = List.copyOf(children);
    }

    public static FilterGroup of(GroupOperator operator, FilterNode... children) {
        return new FilterGroup(operator, false, List.of(children));
    }

    public static FilterGroup and(FilterNode... children) {
        return of(GroupOperator.AND, children);
    }

    public static FilterGroup or(FilterNode... children) {
        return of(GroupOperator.OR, children);
    }

    /**
     * @return a new group holding a single {@linkplain FilterRule#incomplete() incomplete} rule
     */
    public static FilterGroup seeded(GroupOperator operator) {
        return new FilterGroup(operator, false, List.of(FilterRule.incomplete()));
    }

    public int size() {
        return children.size();
    }

    public FilterNode child(int index) {
        return children.get(index);
    }

    public boolean hasChild(int index) {
        return index >= 0 && index < children.size();
    }

    public FilterGroup withOperator(GroupOperator newOperator) {
        return new FilterGroup(newOperator, negated, children);
    }

    public FilterGroup withNegated(boolean newNegated) {
        return new FilterGroup(operator, newNegated, children);
    }

    public FilterGroup withChildren(List<FilterNode> newChildren) {
        return new FilterGroup(operator, negated, newChildren);
    }

    public FilterGroup withChild(int index, FilterNode replacement) {
        List<FilterNode> copy = new ArrayList<>(children);
        copy.set(index, replacement);
        return withChildren(copy);
    }

    public FilterGroup append(FilterNode node) {
        List<FilterNode> copy = new ArrayList<>(children);
        copy.add(node);
        return withChildren(copy);
    }

    public FilterGroup insert(int index, FilterNode node) {
        List<FilterNode> copy = new ArrayList<>(children);
        copy.add(index, node);
        return withChildren(copy);
    }

    /**
     * Returns the children without the one at {@code index}. The result may be empty, which
     * is why it is a list and not a group.
     */
    public List<FilterNode> childrenWithout(int index) {
        List<FilterNode> copy = new ArrayList<>(children);
        copy.remove(index);
        return copy;
    }
}
