package io.jsonsift.core.format;

/**
 * Layout options for {@link JsonFormatter#pretty(String, PrettyOptions)}.
 *
 * @param width arrays that fit in this many columns are kept on one line; 0 or less disables it
 * @param prefix text placed at the start of every output line
 * @param indent text repeated once per nesting level
 * @param sortKeys sort object members by key, then by value
 */
public record PrettyOptions(int width, String prefix, String indent, boolean sortKeys) {

    public static final PrettyOptions DEFAULT = new PrettyOptions(80, "", "  ", false);

    public PrettyOptions {
        if (prefix == null) {
            throw new NullPointerException("prefix must not be null");
        }
        if (indent == null) {
            throw new NullPointerException("indent must not be null");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().width(width).prefix(prefix).indent(indent).sortKeys(sortKeys);
    }

    public static final class Builder {

        private int width = DEFAULT.width;
        private String prefix = DEFAULT.prefix;
        private String indent = DEFAULT.indent;
        private boolean sortKeys = DEFAULT.sortKeys;

        private Builder() {}

        public Builder width(int width) {
            this.width = width;
            return this;
        }

        public Builder prefix(String prefix) {
            this.prefix = prefix;
            return this;
        }

        public Builder indent(String indent) {
            this.indent = indent;
            return this;
        }

        public Builder sortKeys(boolean sortKeys) {
            this.sortKeys = sortKeys;
            return this;
        }

        public PrettyOptions build() {
            return new PrettyOptions(width, prefix, indent, sortKeys);
        }
    }
}
