package io.github.cyfko.compoundfilter.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Address of a node: the zero-based child indices from the root down to the node.
 * The empty path designates the root itself.
 *
 * <pre>{@code
 * FilterPath.root();        // []
 * FilterPath.of(1, 0);      // first child of the root's second child
 * }</pre>
 *
 * @param indices the child indices, unmodifiable
 * @since 1.0.0
 */
public record FilterPath(List<Integer> indices) {

    private static final FilterPath ROOT = new FilterPath(List.of());

    public FilterPath {
        Objects.requireNonNull(indices, "indices cannot be null");
        indices = List.copyOf(indices);
    }

    public static FilterPath root() {
        return ROOT;
    }

    public static FilterPath of(int... indices) {
        List<Integer> list = new ArrayList<>(indices.length);
        for (int index : indices) {
            list.add(index);
        }
        return new FilterPath(list);
    }

    public boolean isRoot() {
        return indices.isEmpty();
    }

    public int length() {
        return indices.size();
    }

    /**
     * @return the first index of this path
     * @throws IllegalStateException on the root path
     */
    public int head() {
        if (isRoot()) {
            throw new IllegalStateException("the root path has no head");
        }
        return indices.get(0);
    }

    /**
     * @return this path without its first index
     * @throws IllegalStateException on the root path
     */
    public FilterPath tail() {
        if (isRoot()) {
            throw new IllegalStateException("the root path has no tail");
        }
        return new FilterPath(indices.subList(1, indices.size()));
    }

    /**
     * @return the path of this path's parent
     * @throws IllegalStateException on the root path
     */
    public FilterPath parent() {
        if (isRoot()) {
            throw new IllegalStateException("the root path has no parent");
        }
        return new FilterPath(indices.subList(0, indices.size() - 1));
    }

    /**
     * @return the last index of this path
     * @throws IllegalStateException on the root path
     */
    public int last() {
        if (isRoot()) {
            throw new IllegalStateException("the root path has no last index");
        }
        return indices.get(indices.size() - 1);
    }

    public FilterPath child(int index) {
        List<Integer> list = new ArrayList<>(indices);
        list.add(index);
        return new FilterPath(list);
    }

    @Override
    public String toString() {
        return indices.stream().map(String::valueOf).collect(Collectors.joining(".", "[", "]"));
    }
}
