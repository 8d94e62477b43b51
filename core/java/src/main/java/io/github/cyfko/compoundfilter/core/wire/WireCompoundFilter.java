package io.github.cyfko.compoundfilter.core.wire;

import io.github.cyfko.compoundfilter.core.model.GroupOperator;

import java.util.List;
import java.util.Objects;

/**
 * Compound of the remote grammar: {@code {"and": [...]}} or {@code {"or": [...]}}.
 * <p>
 * The record accepts any member list so that {@code StructureValidator.validateWireOutput}
 * can inspect what a converter produced; the rewriter itself only emits compounds with two or
 * more members.
 * </p>
 *
 * @param operator the connective, naming the array key
 * @param members  the combined filters
 * @since 1.0.0
 */
public record WireCompoundFilter(
        GroupOperator operator,
        List<WireFilter> members
) implements WireFilter {

    public WireCompoundFilter {
        Objects.requireNonNull(operator, "operator is required");
        Objects.requireNonNull(members, "members are required");
        members = List.copyOf(members);
    }

    public static WireCompoundFilter and(WireFilter... members) {
        return new WireCompoundFilter(GroupOperator.AND, List.of(members));
    }

    public static WireCompoundFilter or(WireFilter... members) {
        return new WireCompoundFilter(GroupOperator.OR, List.of(members));
    }

    @Override
    public int height() {
        int deepest = 0;
        for (WireFilter member : members) {
            deepest = Math.max(deepest, member.height());
        }
        return 1 + deepest;
    }
}
