package io.github.cyfko.compoundfilter.core.exception;

import io.github.cyfko.compoundfilter.core.model.FilterPath;

/**
 * Exception thrown when a rule without a selected property or category reaches conversion.
 * <p>
 * Incomplete rules are the placeholders added by "add rule" and "add group" commands. They
 * are legal in a draft but cannot be expressed in the remote grammar; conversion refuses them
 * rather than dropping or guessing a value. The path points at the offending rule in the
 * tree that was handed to the converter.
 * </p>
 *
 * @since 1.0.0
 */
public class IncompleteRuleException extends RuntimeException {

    private final transient FilterPath path;

    public IncompleteRuleException(FilterPath path) {
        super("Cannot convert incomplete filter condition at " + path);
        this.path = path;
    }

    public FilterPath getPath() {
        return path;
    }
}
