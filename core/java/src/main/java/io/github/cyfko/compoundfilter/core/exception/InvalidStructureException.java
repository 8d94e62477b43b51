package io.github.cyfko.compoundfilter.core.exception;

import io.github.cyfko.compoundfilter.core.model.FilterPath;

/**
 * Exception thrown when a filter tree is structurally unfit for conversion.
 * <p>
 * Typical reasons are a value missing on an operator that needs one, an operator that the
 * rule's property category does not offer, or a negated group handed to the rewriter without
 * prior normalization. These are user-correctable conditions: the reason and the path of the
 * offending node are exposed so the editing layer can highlight it.
 * </p>
 *
 * <pre>{@code
 * // Rule {Price, number, less_than, <no value>}
 * // -> "Value is required for operator less_than at [1]"
 * }</pre>
 *
 * @since 1.0.0
 */
public class InvalidStructureException extends RuntimeException {

    private final String reason;
    private final transient FilterPath path;

    public InvalidStructureException(String reason, FilterPath path) {
        super(path == null ? reason : reason + " at " + path);
        this.reason = reason;
        this.path = path;
    }

    public String getReason() {
        return reason;
    }

    /**
     * @return the path of the offending node, or {@code null} when not tied to a node
     */
    public FilterPath getPath() {
        return path;
    }
}
