package io.jsonsift.core.error;

/** Thrown by {@code ModifierRegistry.requireModifier} when no modifier has the requested name. */
public final class UnknownModifierException extends JsonSiftException {

    private static final long serialVersionUID = 1L;

    public UnknownModifierException(String name) {
        super("No modifier registered for name: '" + name + "'", name);
    }

    /** The name that was looked up. */
    public String name() {
        return source();
    }
}
