package io.jsonsift.core.error;

/**
 * Abstract base for all jsonsift exceptions. Path evaluation itself never throws; these types
 * surface only at the edges: registry lookups, failing host modifiers and document input.
 */
public abstract class JsonSiftException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected JsonSiftException(String message, String source) {
        super(message);
        this.source = source;
    }

    protected JsonSiftException(String message, Throwable cause, String source) {
        super(message, cause);
        this.source = source;
    }

    /** What the error is about: a modifier name, a file path, or {@code null} if unknown. */
    public String source() {
        return source;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
