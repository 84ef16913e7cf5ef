package io.jsonsift.core.engine;

/**
 * Engine options for a {@link JsonQuery}.
 *
 * <p>Immutable and thread-safe.
 *
 * @param disableModifiers when set, {@code @} has no special meaning in paths and
 *     {@code @name} addresses an ordinary key
 * @param wildcardComplexityLimit step limit for {@code *}/{@code ?} key patterns and
 *     {@code %} predicates (default 10 000); negative disables the limit
 */
public record QueryOptions(boolean disableModifiers, int wildcardComplexityLimit) {

    /** Modifiers enabled, wildcard limit 10 000. */
    public static final QueryOptions DEFAULT = new QueryOptions(false, WildcardMatcher.DEFAULT_LIMIT);

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private boolean disableModifiers;
        private int wildcardComplexityLimit = WildcardMatcher.DEFAULT_LIMIT;

        private Builder() {}

        public Builder disableModifiers(boolean disableModifiers) {
            this.disableModifiers = disableModifiers;
            return this;
        }

        public Builder wildcardComplexityLimit(int wildcardComplexityLimit) {
            this.wildcardComplexityLimit = wildcardComplexityLimit;
            return this;
        }

        public QueryOptions build() {
            return new QueryOptions(disableModifiers, wildcardComplexityLimit);
        }
    }
}
