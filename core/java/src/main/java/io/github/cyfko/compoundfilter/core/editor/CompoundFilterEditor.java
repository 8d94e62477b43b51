package io.github.cyfko.compoundfilter.core.editor;

import io.github.cyfko.compoundfilter.core.model.CompoundFilter;
import io.github.cyfko.compoundfilter.core.model.FilterGroup;
import io.github.cyfko.compoundfilter.core.model.FilterNode;
import io.github.cyfko.compoundfilter.core.model.FilterPath;
import io.github.cyfko.compoundfilter.core.model.FilterRule;
import io.github.cyfko.compoundfilter.core.model.GroupOperator;
import io.github.cyfko.compoundfilter.core.model.RuleUpdate;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Path-addressed edit operations on a {@link CompoundFilter}.
 * <p>
 * Every operation is pure: it never mutates its input and returns a new filter in which only
 * the ancestors of the edited node are rebuilt. Operations are also total with respect to
 * addressing: a path that does not resolve to a suitable node (out-of-range index, path
 * running through a rule, group operation on a rule) leaves the filter unchanged and the
 * very same instance is returned, so editing widgets stay responsive while the tree changes
 * under them. Clearing the whole filter is an explicit command: {@link #reset()} or
 * {@link #removeNode(CompoundFilter, FilterPath)} on the root path.
 * </p>
 *
 * <h2>Structural invariants</h2>
 * <ul>
 *   <li>A group never ends up empty: removing its last child removes the group too.</li>
 *   <li>A group left with a single child by a removal collapses into that child. A negated
 *       group keeps its meaning when collapsing: its negation moves onto a remaining child
 *       group, and it stays a one-child negated group around a remaining rule, rules having
 *       no negation of their own.</li>
 *   <li>Removing the last remaining node yields the empty filter.</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * CompoundFilter filter = CompoundFilter.empty();
 * filter = CompoundFilterEditor.addRule(filter, status);     // root = status
 * filter = CompoundFilterEditor.addRule(filter, assignee);   // root = AND(status, assignee)
 * filter = CompoundFilterEditor.removeNode(filter, FilterPath.of(0)); // root = assignee
 * filter = CompoundFilterEditor.removeNode(filter, FilterPath.root()); // empty
 * }</pre>
 *
 * @since 1.0.0
 */
public final class CompoundFilterEditor {

    private CompoundFilterEditor() {}

    /**
     * @return the empty filter
     */
    public static CompoundFilter reset() {
        return CompoundFilter.empty();
    }

    /**
     * Adds a rule at the root level.
     * <ul>
     *   <li>empty filter: the rule becomes the root</li>
     *   <li>rule root: both rules are wrapped in a new AND group</li>
     *   <li>group root: the rule is appended to the root's children</li>
     * </ul>
     */
    public static CompoundFilter addRule(CompoundFilter filter, FilterRule rule) {
        Objects.requireNonNull(filter, "filter cannot be null");
        Objects.requireNonNull(rule, "rule cannot be null");

        FilterNode root = filter.root().orElse(null);
        if (root == null) {
            return CompoundFilter.of(rule);
        }
        if (root instanceof FilterGroup group) {
            return CompoundFilter.of(group.append(rule));
        }
        return CompoundFilter.of(FilterGroup.and(root, rule));
    }

    /**
     * Removes the node at {@code path}.
     * <p>
     * The root path clears the filter. Removing a child may empty its group, which is then
     * removed from its own parent, or leave it with one child, which then replaces the group.
     * </p>
     */
    public static CompoundFilter removeNode(CompoundFilter filter, FilterPath path) {
        Objects.requireNonNull(filter, "filter cannot be null");
        Objects.requireNonNull(path, "path cannot be null");

        if (filter.isEmpty()) {
            return filter;
        }
        if (path.isRoot()) {
            return CompoundFilter.empty();
        }
        if (!(filter.root().get() instanceof FilterGroup group)) {
            return filter;
        }

        Removal removal = removeAt(group, path);
        if (!removal.changed()) {
            return filter;
        }
        return CompoundFilter.of(removal.result());
    }

    /**
     * Merges {@code update} into the rule at {@code path}. No-op unless the path resolves to a rule.
     */
    public static CompoundFilter updateRule(CompoundFilter filter, FilterPath path, RuleUpdate update) {
        Objects.requireNonNull(update, "update cannot be null");
        return edit(filter, path, node -> node instanceof FilterRule rule ? rule.merge(update) : node);
    }

    /**
     * Flips AND/OR on the group at {@code path}. No-op on a rule or an unresolved path.
     */
    public static CompoundFilter toggleGroupOperator(CompoundFilter filter, FilterPath path) {
        return edit(filter, path, node -> node instanceof FilterGroup group
                ? group.withOperator(group.operator().flip())
                : node);
    }

    /**
     * Flips the negation flag of the group at {@code path}. No-op on a rule or an unresolved path.
     */
    public static CompoundFilter toggleGroupNegation(CompoundFilter filter, FilterPath path) {
        return edit(filter, path, node -> node instanceof FilterGroup group
                ? group.withNegated(!group.negated())
                : node);
    }

    /**
     * Adds a new group, seeded with one incomplete rule, at the root level.
     * A rule root is wrapped together with the new group in a group of the same {@code operator}.
     */
    public static CompoundFilter addGroup(CompoundFilter filter, GroupOperator operator) {
        Objects.requireNonNull(filter, "filter cannot be null");
        Objects.requireNonNull(operator, "operator cannot be null");

        FilterGroup seeded = FilterGroup.seeded(operator);
        FilterNode root = filter.root().orElse(null);
        if (root == null) {
            return CompoundFilter.of(seeded);
        }
        if (root instanceof FilterGroup group) {
            return CompoundFilter.of(group.append(seeded));
        }
        return CompoundFilter.of(FilterGroup.of(operator, root, seeded));
    }

    /**
     * Adds a new seeded group inside the group at {@code path}, unless
     * {@link #canAddGroupAtPath(CompoundFilter, FilterPath, int)} refuses it, in which case the
     * filter is returned unchanged. On an empty filter the root path creates a root group.
     */
    public static CompoundFilter addGroupAtPath(CompoundFilter filter, FilterPath path, GroupOperator operator, int maxDepth) {
        Objects.requireNonNull(filter, "filter cannot be null");
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(operator, "operator cannot be null");

        if (!canAddGroupAtPath(filter, path, maxDepth)) {
            return filter;
        }
        return addNodeToGroup(filter, path, FilterGroup.seeded(operator));
    }

    /**
     * Appends an already built node to the group at {@code path}.
     * On an empty filter the root path makes {@code node} the root; any other unresolved or
     * non-group target is a no-op.
     */
    public static CompoundFilter addNodeToGroup(CompoundFilter filter, FilterPath path, FilterNode node) {
        Objects.requireNonNull(filter, "filter cannot be null");
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(node, "node cannot be null");

        if (filter.isEmpty()) {
            return path.isRoot() ? CompoundFilter.of(node) : filter;
        }
        return edit(filter, path, target -> target instanceof FilterGroup group ? group.append(node) : target);
    }

    /**
     * Inserts a copy of the node at {@code path} right after it. Duplicating the root wraps the
     * root and its copy in a new AND group.
     * <p>
     * Nodes are immutable, so the copy shares the original's instance: later edits on either
     * position rebuild their own ancestor chain and never affect the other.
     * </p>
     */
    public static CompoundFilter duplicateNode(CompoundFilter filter, FilterPath path) {
        Objects.requireNonNull(filter, "filter cannot be null");
        Objects.requireNonNull(path, "path cannot be null");

        if (filter.isEmpty()) {
            return filter;
        }
        if (path.isRoot()) {
            FilterNode root = filter.root().get();
            return CompoundFilter.of(FilterGroup.and(root, root));
        }

        int index = path.last();
        return edit(filter, path.parent(), node -> node instanceof FilterGroup group && group.hasChild(index)
                ? group.insert(index + 1, group.child(index))
                : node);
    }

    /**
     * Number of group levels in the filter: 0 when empty or a single rule, otherwise
     * {@code 1 + max(child depth)} for a group, rules counting 0.
     */
    public static int nestingDepth(CompoundFilter filter) {
        Objects.requireNonNull(filter, "filter cannot be null");
        return filter.root().map(CompoundFilterEditor::depthOf).orElse(0);
    }

    /**
     * Nesting level of the node at {@code path}: the number of groups from the root down to the
     * node, the node itself included when it is a group. For an unresolved path, the groups on
     * the resolved prefix are counted.
     */
    public static int depthAtPath(CompoundFilter filter, FilterPath path) {
        Objects.requireNonNull(filter, "filter cannot be null");
        Objects.requireNonNull(path, "path cannot be null");

        FilterNode node = filter.root().orElse(null);
        if (node == null) {
            return 0;
        }

        int groups = 0;
        for (int index : path.indices()) {
            if (!(node instanceof FilterGroup group)) {
                return groups;
            }
            groups++;
            if (!group.hasChild(index)) {
                return groups;
            }
            node = group.child(index);
        }
        return node instanceof FilterGroup ? groups + 1 : groups;
    }

    /**
     * Whether a new group may be nested in the node at {@code path} without the filter exceeding
     * {@code maxDepth} group levels. An empty filter accepts a root group whenever
     * {@code maxDepth >= 1}.
     */
    public static boolean canAddGroupAtPath(CompoundFilter filter, FilterPath path, int maxDepth) {
        Objects.requireNonNull(filter, "filter cannot be null");
        Objects.requireNonNull(path, "path cannot be null");

        if (filter.isEmpty() && path.isRoot()) {
            return maxDepth >= 1;
        }
        return depthAtPath(filter, path) + 1 <= maxDepth;
    }

    /**
     * @return the node at {@code path}, or empty when the path does not resolve
     */
    public static Optional<FilterNode> resolve(CompoundFilter filter, FilterPath path) {
        Objects.requireNonNull(filter, "filter cannot be null");
        Objects.requireNonNull(path, "path cannot be null");

        FilterNode node = filter.root().orElse(null);
        for (int index : path.indices()) {
            if (!(node instanceof FilterGroup group) || !group.hasChild(index)) {
                return Optional.empty();
            }
            node = group.child(index);
        }
        return Optional.ofNullable(node);
    }

    /**
     * @return {@code true} when the draft differs from the applied filter
     */
    public static boolean hasUnsavedChanges(CompoundFilter draft, CompoundFilter applied) {
        return !Objects.equals(draft, applied);
    }

    /**
     * A requested max nesting depth may be raised freely but never lowered below the depth the
     * filter already has.
     */
    public static int effectiveMaxDepth(int requestedDepth, int currentDepth) {
        return Math.max(requestedDepth, currentDepth);
    }

    private static int depthOf(FilterNode node) {
        if (!(node instanceof FilterGroup group)) {
            return 0;
        }
        int deepest = 0;
        for (FilterNode child : group.children()) {
            deepest = Math.max(deepest, depthOf(child));
        }
        return 1 + deepest;
    }

    private static CompoundFilter edit(CompoundFilter filter, FilterPath path, UnaryOperator<FilterNode> change) {
        Objects.requireNonNull(filter, "filter cannot be null");
        Objects.requireNonNull(path, "path cannot be null");

        FilterNode root = filter.root().orElse(null);
        if (root == null) {
            return filter;
        }
        FilterNode updated = editAt(root, path, change);
        return updated == root ? filter : CompoundFilter.of(updated);
    }

    // Returns the same instance when nothing changed so callers can short-circuit on identity.
    private static FilterNode editAt(FilterNode node, FilterPath path, UnaryOperator<FilterNode> change) {
        if (path.isRoot()) {
            return change.apply(node);
        }
        if (!(node instanceof FilterGroup group) || !group.hasChild(path.head())) {
            return node;
        }

        int index = path.head();
        FilterNode child = group.child(index);
        FilterNode updated = editAt(child, path.tail(), change);
        return updated == child ? node : group.withChild(index, updated);
    }

    private static Removal removeAt(FilterGroup group, FilterPath path) {
        int index = path.head();
        if (!group.hasChild(index)) {
            return Removal.UNCHANGED;
        }
        if (path.length() == 1) {
            return Removal.of(collapse(group, group.childrenWithout(index)));
        }

        if (!(group.child(index) instanceof FilterGroup child)) {
            return Removal.UNCHANGED;
        }
        Removal nested = removeAt(child, path.tail());
        if (!nested.changed()) {
            return nested;
        }
        if (nested.result() == null) {
            return Removal.of(collapse(group, group.childrenWithout(index)));
        }
        return Removal.of(group.withChild(index, nested.result()));
    }

    private static FilterNode collapse(FilterGroup group, List<FilterNode> remaining) {
        if (remaining.isEmpty()) {
            return null;
        }
        if (remaining.size() > 1) {
            return group.withChildren(remaining);
        }

        FilterNode sole = remaining.get(0);
        if (!group.negated()) {
            return sole;
        }
        if (sole instanceof FilterGroup soleGroup) {
            return soleGroup.withNegated(!soleGroup.negated());
        }
        return group.withChildren(remaining);
    }

    /**
     * Outcome of a removal below some group. A {@code null} result means the group itself vanished.
     */
    private record Removal(boolean changed, FilterNode result) {
        static final Removal UNCHANGED = new Removal(false, null);

        static Removal of(FilterNode result) {
            return new Removal(true, result);
        }
    }
}
