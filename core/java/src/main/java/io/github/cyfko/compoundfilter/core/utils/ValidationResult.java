package io.github.cyfko.compoundfilter.core.utils;

import io.github.cyfko.compoundfilter.core.model.FilterPath;

import java.util.Optional;

/**
 * Result of a structural check: either success, or a failure carrying a message and, when the
 * failure is tied to a node, that node's path.
 *
 * <p>Instances are immutable and created via {@link #success()} and the {@code failure} factories.</p>
 *
 * <pre>{@code
 * ValidationResult result = StructureValidator.validateStructure(filter);
 * if (!result.isValid()) {
 *     highlight(result.getPath().orElse(FilterPath.root()), result.getErrorMessage());
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(true, null, null);

    private final boolean valid;
    private final String errorMessage;
    private final FilterPath path;

    private ValidationResult(boolean valid, String errorMessage, FilterPath path) {
        this.valid = valid;
        this.errorMessage = errorMessage;
        this.path = path;
    }

    public static ValidationResult success() {
        return SUCCESS;
    }

    public static ValidationResult failure(String errorMessage) {
        return new ValidationResult(false, errorMessage, null);
    }

    /**
     * @param errorMessage message explaining the reason for failure
     * @param path         position of the offending node
     * @return an invalid result tied to {@code path}
     */
    public static ValidationResult failure(String errorMessage, FilterPath path) {
        return new ValidationResult(false, errorMessage, path);
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * @return error message if invalid, or null if valid
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    public Optional<FilterPath> getPath() {
        return Optional.ofNullable(path);
    }

    @Override
    public String toString() {
        if (valid) {
            return "ValidationResult[valid=true]";
        }
        return path == null
                ? "ValidationResult[valid=false, error=" + errorMessage + "]"
                : "ValidationResult[valid=false, error=" + errorMessage + ", path=" + path + "]";
    }
}
