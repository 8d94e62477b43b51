package io.github.cyfko.compoundfilter.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Boolean connective of a {@link FilterGroup}.
 *
 * @since 1.0.0
 */
public enum GroupOperator {
    AND("and"),
    OR("or");

    private final String wireKey;

    GroupOperator(String wireKey) {
        this.wireKey = wireKey;
    }

    /**
     * @return the array key of a compound filter in the remote grammar
     */
    public String wireKey() {
        return wireKey;
    }

    /**
     * @return the dual connective (AND for OR, OR for AND)
     */
    public GroupOperator flip() {
        return this == AND ? OR : AND;
    }

    public static Optional<GroupOperator> fromWireKey(String wireKey) {
        if (wireKey == null) {
            return Optional.empty();
        }
        return switch (wireKey.trim().toLowerCase(Locale.ROOT)) {
            case "and" -> Optional.of(AND);
            case "or" -> Optional.of(OR);
            default -> Optional.empty();
        };
    }
}
