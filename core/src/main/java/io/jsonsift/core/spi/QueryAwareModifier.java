package io.jsonsift.core.spi;

import io.jsonsift.core.engine.JsonQuery;

/**
 * A modifier that evaluates paths of its own, such as {@code @dig} or {@code @search}. When it runs
 * inside a path the engine calls {@link #apply(JsonQuery, String, String)} with the query doing
 * the evaluation, so nested lookups see that query's options and registry.
 */
public interface QueryAwareModifier extends Modifier {

    /**
     * Transforms a JSON value on behalf of {@code query}.
     *
     * @param query the query evaluating the path this modifier appears in
     * @param json the raw JSON text of the current value
     * @param arg the argument text after {@code :}, or an empty string
     * @return the raw JSON text of the result, or an empty string for no result
     */
    String apply(JsonQuery query, String json, String arg);
}
