package io.github.cyfko.compoundfilter.core.model;

/**
 * Node of a compound filter tree: either a {@link FilterRule} leaf or a {@link FilterGroup}.
 * <p>
 * Nodes are immutable values. Editing a tree rebuilds the ancestor chain of the edited
 * node and shares every untouched subtree, so a node instance may safely appear in
 * several trees (for instance after a duplication) or be read from several threads.
 * </p>
 *
 * @see CompoundFilter
 * @since 1.0.0
 */
public sealed interface FilterNode permits FilterRule, FilterGroup {

    /**
     * @return {@code true} if this node is a {@link FilterGroup}
     */
    default boolean isGroup() {
        return this instanceof FilterGroup;
    }
}
