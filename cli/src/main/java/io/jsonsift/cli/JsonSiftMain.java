package io.jsonsift.cli;

import java.nio.file.Path;

/**
 * Entry point of the {@code jsonsift} command. Delegates to {@link QueryCommand} and exits with
 * its status.
 */
public final class JsonSiftMain {

    private JsonSiftMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --file doc.json name.first})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status = QueryCommand.execute(args, System::getenv, Path.of(""), System.in, System.out, System.err);
        System.exit(status);
    }
}
