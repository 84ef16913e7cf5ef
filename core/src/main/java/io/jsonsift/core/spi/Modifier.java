package io.jsonsift.core.spi;

/**
 * A named transformation applied by {@code @name} or {@code @name:arg} path segments. Modifiers
 * are registered with a {@code ModifierRegistry} under the name used in paths.
 *
 * <p>Implementations MUST be stateless and thread-safe; they run on the calling thread of every
 * query that references them.
 */
@FunctionalInterface
public interface Modifier {

    /**
     * Transforms a JSON value.
     *
     * @param json the raw JSON text of the current value (may be empty when nothing was found)
     * @param arg the argument text after {@code :}, or an empty string when none was given
     * @return the raw JSON text of the result; an empty string means "no result" and makes the
     *     rest of the path resolve to nothing
     * @throws io.jsonsift.core.error.ModifierFailureException if the input cannot be transformed
     */
    String apply(String json, String arg);
}
