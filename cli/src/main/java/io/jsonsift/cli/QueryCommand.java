package io.jsonsift.cli;

import io.jsonsift.cli.config.CliConfig;
import io.jsonsift.cli.config.ConfigLoadException;
import io.jsonsift.cli.config.ConfigLoader;
import io.jsonsift.cli.io.DocumentReadException;
import io.jsonsift.cli.io.DocumentReader;
import io.jsonsift.core.engine.JsonQuery;
import io.jsonsift.core.format.JsonFormatter;
import io.jsonsift.core.format.PrettyOptions;
import io.jsonsift.core.model.Kind;
import io.jsonsift.core.model.Value;
import io.jsonsift.core.modifier.BuiltinModifiers;
import io.jsonsift.core.modifier.ModifierRegistry;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * The {@code jsonsift} command: reads one document, evaluates each path against it and prints one
 * result per line.
 *
 * <p>A missing result prints an empty line and makes the exit status {@link #EXIT_NOT_FOUND};
 * usage, configuration and read errors exit with {@link #EXIT_ERROR}.
 */
@Command(
        name = "jsonsift",
        mixinStandardHelpOptions = true,
        version = "jsonsift 0.1.0",
        exitCodeOnInvalidInput = QueryCommand.EXIT_ERROR,
        description = "Evaluates path expressions against a JSON document read from a file or standard input.")
public final class QueryCommand implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_NOT_FOUND = 1;
    public static final int EXIT_ERROR = 2;

    private static final Logger LOG = LoggerFactory.getLogger(QueryCommand.class);

    @Option(names = "--config", paramLabel = "FILE", description = "YAML configuration (default: ./jsonsift.yaml)")
    private Path config;

    @Option(names = "--file", paramLabel = "FILE", description = "Document to query (default: standard input)")
    private Path file;

    @Option(names = "--lines", description = "Treat the input as JSON Lines; without paths, print each value")
    private boolean lines;

    @Option(names = "--raw", description = "Print string results as plain text")
    private boolean raw;

    @Option(names = "--pretty", description = "Pretty-print results")
    private boolean pretty;

    @Parameters(paramLabel = "PATH", arity = "0..*", description = "Path expressions to evaluate")
    private List<String> paths = new ArrayList<>();

    @Spec
    private CommandSpec spec;

    private final Function<String, String> envLookup;
    private final Path workingDir;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    QueryCommand(Function<String, String> envLookup, Path workingDir, InputStream in, PrintStream out, PrintStream err) {
        this.envLookup = envLookup;
        this.workingDir = workingDir;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    /**
     * Parses {@code args} and runs the command.
     *
     * @param envLookup environment variable lookup, {@code System::getenv} in production
     * @param workingDir directory searched for {@code jsonsift.yaml} when {@code --config} is absent
     * @return the exit status
     */
    public static int execute(
            String[] args,
            Function<String, String> envLookup,
            Path workingDir,
            InputStream in,
            PrintStream out,
            PrintStream err) {
        CommandLine commandLine = new CommandLine(new QueryCommand(envLookup, workingDir, in, out, err));
        // @ starts a modifier, not an argument file
        commandLine.setExpandAtFiles(false);
        commandLine.setOut(new PrintWriter(out, true, StandardCharsets.UTF_8));
        commandLine.setErr(new PrintWriter(err, true, StandardCharsets.UTF_8));
        commandLine.setExecutionExceptionHandler((e, cmd, parseResult) -> {
            LOG.error("Query failed: {}", e.getMessage(), e);
            return EXIT_ERROR;
        });
        return commandLine.execute(args);
    }

    @Override
    public Integer call() {
        if (!lines && paths.isEmpty()) {
            throw new ParameterException(spec.commandLine(), "At least one PATH is required unless --lines is given");
        }
        try {
            CliConfig cliConfig = ConfigLoader.resolve(config, workingDir, envLookup);
            LogbackConfigurator.configure(cliConfig.loggingLevel());
            JsonQuery query = createQuery(cliConfig);

            String document = file != null ? DocumentReader.read(file) : DocumentReader.read(in, "<stdin>");

            List<Value> results = lines ? queryLines(query, document) : query.getMany(document, paths);
            LOG.debug("Evaluated {} path(s), {} result(s)", paths.size(), results.size());

            int status = EXIT_OK;
            for (Value result : results) {
                if (!result.exists()) {
                    status = EXIT_NOT_FOUND;
                    out.println();
                } else {
                    out.println(render(result, cliConfig.prettyOptions()));
                }
            }
            out.flush();
            return status;
        } catch (ConfigLoadException | DocumentReadException e) {
            LOG.debug("Command failed", e);
            err.println("jsonsift: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    /** A query whose {@code @pretty} modifier defaults to the configured layout. */
    static JsonQuery createQuery(CliConfig config) {
        ModifierRegistry registry = ModifierRegistry.withBuiltins();
        registry.register("pretty", BuiltinModifiers.pretty(config.prettyOptions()));
        return JsonQuery.create(registry, config.queryOptions());
    }

    private List<Value> queryLines(JsonQuery query, String document) {
        List<Value> values = new ArrayList<>();
        query.forEachLine(document, values::add);
        if (paths.isEmpty()) {
            return values;
        }
        List<Value> results = new ArrayList<>(values.size() * paths.size());
        for (Value line : values) {
            for (String path : paths) {
                results.add(query.getIn(line, path));
            }
        }
        return results;
    }

    private String render(Value value, PrettyOptions prettyOptions) {
        if (raw && value.kind() == Kind.STRING) {
            return value.text();
        }
        // @pretty output ends with a newline
        String json = value.raw().stripTrailing();
        return pretty ? JsonFormatter.pretty(json, prettyOptions).stripTrailing() : json;
    }
}
