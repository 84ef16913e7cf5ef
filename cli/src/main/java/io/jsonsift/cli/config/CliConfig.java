package io.jsonsift.cli.config;

import io.jsonsift.core.engine.QueryOptions;
import io.jsonsift.core.format.PrettyOptions;

/**
 * Configuration of the command-line front end. Use {@link #builder()} to construct instances;
 * every field has a default.
 *
 * @param disableModifiers treat {@code @} as an ordinary key character in paths
 * @param wildcardComplexityLimit step limit of {@code %} and key wildcard matching
 * @param prettyIndent indentation text used by {@code --pretty} and {@code @pretty}
 * @param prettyPrefix text placed before every pretty-printed line
 * @param prettyWidth arrays that fit in this many columns stay on one line
 * @param prettySortKeys sort object members when pretty-printing
 * @param loggingLevel root log level (TRACE, DEBUG, INFO, WARN, ERROR, OFF)
 */
public record CliConfig(
        boolean disableModifiers,
        int wildcardComplexityLimit,
        String prettyIndent,
        String prettyPrefix,
        int prettyWidth,
        boolean prettySortKeys,
        String loggingLevel) {

    public static Builder builder() {
        return new Builder();
    }

    /** Engine options for {@code JsonQuery.create}. */
    public QueryOptions queryOptions() {
        return QueryOptions.builder()
                .disableModifiers(disableModifiers)
                .wildcardComplexityLimit(wildcardComplexityLimit)
                .build();
    }

    /** Layout used by {@code --pretty} and by the registered {@code @pretty} modifier. */
    public PrettyOptions prettyOptions() {
        return PrettyOptions.builder()
                .indent(prettyIndent)
                .prefix(prettyPrefix)
                .width(prettyWidth)
                .sortKeys(prettySortKeys)
                .build();
    }

    /** Builder for {@link CliConfig}, pre-populated with the defaults. */
    public static final class Builder {

        private boolean disableModifiers;
        private int wildcardComplexityLimit = QueryOptions.DEFAULT.wildcardComplexityLimit();
        private String prettyIndent = PrettyOptions.DEFAULT.indent();
        private String prettyPrefix = PrettyOptions.DEFAULT.prefix();
        private int prettyWidth = PrettyOptions.DEFAULT.width();
        private boolean prettySortKeys = PrettyOptions.DEFAULT.sortKeys();
        private String loggingLevel = "WARN";

        private Builder() {}

        public Builder disableModifiers(boolean disableModifiers) {
            this.disableModifiers = disableModifiers;
            return this;
        }

        public Builder wildcardComplexityLimit(int wildcardComplexityLimit) {
            this.wildcardComplexityLimit = wildcardComplexityLimit;
            return this;
        }

        public Builder prettyIndent(String prettyIndent) {
            this.prettyIndent = prettyIndent;
            return this;
        }

        public Builder prettyPrefix(String prettyPrefix) {
            this.prettyPrefix = prettyPrefix;
            return this;
        }

        public Builder prettyWidth(int prettyWidth) {
            this.prettyWidth = prettyWidth;
            return this;
        }

        public Builder prettySortKeys(boolean prettySortKeys) {
            this.prettySortKeys = prettySortKeys;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public CliConfig build() {
            return new CliConfig(
                    disableModifiers,
                    wildcardComplexityLimit,
                    prettyIndent,
                    prettyPrefix,
                    prettyWidth,
                    prettySortKeys,
                    loggingLevel);
        }
    }
}
