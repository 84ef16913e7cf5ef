package io.jsonsift.core.error;

/**
 * Signals that a modifier could not transform its input. Host modifiers may throw it; the query
 * engine catches every exception raised by a modifier, logs it and continues with an empty
 * result for that stage.
 */
public final class ModifierFailureException extends JsonSiftException {

    private static final long serialVersionUID = 1L;

    public ModifierFailureException(String modifierName, String message) {
        super(message, modifierName);
    }

    public ModifierFailureException(String modifierName, String message, Throwable cause) {
        super(message, cause, modifierName);
    }

    /** Name of the failing modifier. */
    public String modifierName() {
        return source();
    }
}
