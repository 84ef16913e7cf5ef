package io.jsonsift.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link CliConfig} from a YAML file with an environment variable overlay.
 *
 * <p>YAML keys:
 *
 * <pre>
 * engine:
 *   disable-modifiers: false
 *   wildcard-complexity-limit: 10000
 * pretty:
 *   indent: "  "        # a string, or a number of spaces
 *   prefix: ""
 *   width: 80
 *   sort-keys: false
 * logging:
 *   level: WARN
 * </pre>
 *
 * <p>Environment variables take precedence over YAML values. A variable counts as set only when
 * it is defined and its trimmed value is non-empty. {@code JSONSIFT_PRETTY_INDENT} is a number of
 * spaces or the word {@code tab}.
 */
public final class ConfigLoader {

    /** Config file looked up in the working directory when {@code --config} is not given. */
    public static final String DEFAULT_CONFIG_FILE = "jsonsift.yaml";

    static final String ENV_DISABLE_MODIFIERS = "JSONSIFT_DISABLE_MODIFIERS";
    static final String ENV_PRETTY_INDENT = "JSONSIFT_PRETTY_INDENT";
    static final String ENV_PRETTY_WIDTH = "JSONSIFT_PRETTY_WIDTH";
    static final String ENV_PRETTY_SORT_KEYS = "JSONSIFT_PRETTY_SORT_KEYS";
    static final String ENV_LOG_LEVEL = "JSONSIFT_LOG_LEVEL";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final Set<String> LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link CliConfig} from the given YAML file, applying overrides from
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, unreadable or holds invalid values
     */
    public static CliConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link CliConfig} from the given YAML file, applying overrides from
     * {@code envLookup}. The lookup returns {@code null} for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing, unreadable or holds invalid values
     */
    public static CliConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        CliConfig.Builder builder = CliConfig.builder();
        if (root != null && !root.isMissingNode()) {
            if (!root.isObject()) {
                throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
            }
            mapYaml(root, builder);
        }
        return finish(builder, envLookup);
    }

    /** Defaults with the environment overlay applied; used when no config file exists. */
    public static CliConfig fromEnvironment(Function<String, String> envLookup) {
        return finish(CliConfig.builder(), envLookup);
    }

    /**
     * Loads the file named by {@code --config}, else {@link #DEFAULT_CONFIG_FILE} in
     * {@code workingDir} when it exists, else the defaults. The environment overlay applies in all
     * three cases.
     */
    public static CliConfig resolve(Path explicitConfig, Path workingDir, Function<String, String> envLookup) {
        if (explicitConfig != null) {
            return load(explicitConfig, envLookup);
        }
        Path fallback = workingDir.resolve(DEFAULT_CONFIG_FILE);
        if (Files.isRegularFile(fallback)) {
            return load(fallback, envLookup);
        }
        return fromEnvironment(envLookup);
    }

    private static void mapYaml(JsonNode root, CliConfig.Builder builder) {
        JsonNode engine = root.path("engine");
        if (engine.has("disable-modifiers"))
            builder.disableModifiers(engine.get("disable-modifiers").asBoolean());
        if (engine.has("wildcard-complexity-limit"))
            builder.wildcardComplexityLimit(intValue(engine, "wildcard-complexity-limit"));

        JsonNode pretty = root.path("pretty");
        if (pretty.has("indent")) {
            JsonNode indent = pretty.get("indent");
            builder.prettyIndent(indent.isNumber() ? spaces(indent.asInt(), "pretty.indent") : indent.asText());
        }
        if (pretty.has("prefix")) builder.prettyPrefix(pretty.get("prefix").asText());
        if (pretty.has("width")) builder.prettyWidth(intValue(pretty, "width"));
        if (pretty.has("sort-keys")) builder.prettySortKeys(pretty.get("sort-keys").asBoolean());

        JsonNode logging = root.path("logging");
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
    }

    private static CliConfig finish(CliConfig.Builder builder, Function<String, String> envLookup) {
        envBool(envLookup, ENV_DISABLE_MODIFIERS, builder::disableModifiers);
        envString(envLookup, ENV_PRETTY_INDENT, value -> builder.prettyIndent(indentFromEnv(value)));
        envInt(envLookup, ENV_PRETTY_WIDTH, builder::prettyWidth);
        envBool(envLookup, ENV_PRETTY_SORT_KEYS, builder::prettySortKeys);
        envString(envLookup, ENV_LOG_LEVEL, builder::loggingLevel);

        CliConfig config = builder.build();
        String level = config.loggingLevel().toUpperCase(Locale.ROOT);
        if (!LEVELS.contains(level)) {
            throw new ConfigLoadException("Unknown logging level '" + config.loggingLevel() + "', expected one of "
                    + "TRACE, DEBUG, INFO, WARN, ERROR, OFF");
        }
        return new CliConfig(
                config.disableModifiers(),
                config.wildcardComplexityLimit(),
                config.prettyIndent(),
                config.prettyPrefix(),
                config.prettyWidth(),
                config.prettySortKeys(),
                level);
    }

    private static String indentFromEnv(String value) {
        if (value.equalsIgnoreCase("tab")) {
            return "\t";
        }
        return spaces(parseInt(ENV_PRETTY_INDENT, value), ENV_PRETTY_INDENT);
    }

    private static String spaces(int count, String key) {
        if (count < 0) {
            throw new ConfigLoadException(key + " must not be negative: " + count);
        }
        return " ".repeat(count);
    }

    private static int intValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!value.canConvertToInt()) {
            throw new ConfigLoadException("Expected an integer for '" + field + "' but got: " + value.asText());
        }
        return value.asInt();
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Expected an integer in " + name + " but got: " + value, e);
        }
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(parseInt(envVar, envLookup.apply(envVar).trim()));
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
