package io.jsonsift.core.modifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named options of a modifier argument such as {@code @flatten:{"deep":true}}. An argument that
 * is empty, not JSON or not an object has no options, so every lookup returns its fallback.
 */
public final class ModifierArgs {

    private static final Logger LOG = LoggerFactory.getLogger(ModifierArgs.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ModifierArgs EMPTY = new ModifierArgs(JsonNodeFactory.instance.objectNode());

    private final ObjectNode options;

    private ModifierArgs(ObjectNode options) {
        this.options = options;
    }

    public static ModifierArgs parse(String arg) {
        if (arg == null || arg.isBlank()) {
            return EMPTY;
        }
        try {
            JsonNode node = MAPPER.readTree(arg);
            if (node instanceof ObjectNode) {
                return new ModifierArgs((ObjectNode) node);
            }
            LOG.debug("Modifier argument is not an object, using defaults: {}", arg);
        } catch (JsonProcessingException e) {
            LOG.debug("Unparseable modifier argument, using defaults: {}", e.getOriginalMessage());
        }
        return EMPTY;
    }

    public boolean has(String name) {
        return options.has(name);
    }

    /**
     * Reads a flag. Booleans are taken as is, numbers are true when non-zero and strings when
     * they read {@code 1}, {@code t} or {@code true} in any case.
     */
    public boolean bool(String name, boolean fallback) {
        JsonNode node = options.get(name);
        if (node == null) {
            return fallback;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.doubleValue() != 0;
        }
        if (node.isTextual()) {
            switch (node.textValue().toLowerCase(Locale.ROOT)) {
                case "1":
                case "t":
                case "true":
                    return true;
                default:
                    return false;
            }
        }
        return false;
    }

    /** Reads a string option; non-string values give their JSON text. */
    public String text(String name, String fallback) {
        JsonNode node = options.get(name);
        if (node == null || node.isNull()) {
            return fallback;
        }
        return node.isTextual() ? node.textValue() : node.toString();
    }

    /** Reads an integer option; numeric strings are accepted, anything else gives the fallback. */
    public int integer(String name, int fallback) {
        JsonNode node = options.get(name);
        if (node == null) {
            return fallback;
        }
        if (node.isNumber()) {
            return node.intValue();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.textValue().trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }
}
