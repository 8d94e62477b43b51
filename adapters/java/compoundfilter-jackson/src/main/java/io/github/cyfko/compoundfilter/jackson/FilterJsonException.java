package io.github.cyfko.compoundfilter.jackson;

/**
 * Exception thrown when JSON cannot be read as a filter tree, or a filter cannot be written.
 * <p>
 * Messages name the offending JSON location using a JSON pointer, for example
 * {@code "Unknown operator 'bigger_than' at /nodes/1"}.
 * </p>
 *
 * @since 1.0.0
 */
public class FilterJsonException extends RuntimeException {

    public FilterJsonException(String message) {
        super(message);
    }

    public FilterJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
