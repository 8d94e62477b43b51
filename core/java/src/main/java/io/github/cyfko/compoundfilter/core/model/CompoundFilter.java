package io.github.cyfko.compoundfilter.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Root of a filter tree, possibly absent.
 * <p>
 * An empty compound filter means "no filter defined": every row matches. Instances are
 * immutable; the editor returns a new instance for every edit.
 * </p>
 *
 * <pre>{@code
 * CompoundFilter none = CompoundFilter.empty();
 * CompoundFilter single = CompoundFilter.of(rule);
 * single.root().ifPresent(node -> ...);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class CompoundFilter {

    private static final CompoundFilter EMPTY = new CompoundFilter(null);

    private final FilterNode root;

    private CompoundFilter(FilterNode root) {
        this.root = root;
    }

    public static CompoundFilter empty() {
        return EMPTY;
    }

    /**
     * @param root the root node, {@code null} for the empty filter
     */
    public static CompoundFilter of(FilterNode root) {
        return root == null ? EMPTY : new CompoundFilter(root);
    }

    public Optional<FilterNode> root() {
        return Optional.ofNullable(root);
    }

    public boolean isEmpty() {
        return root == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompoundFilter)) return false;
        return Objects.equals(root, ((CompoundFilter) o).root);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(root);
    }

    @Override
    public String toString() {
        return isEmpty() ? "CompoundFilter[empty]" : "CompoundFilter[" + root + "]";
    }
}
