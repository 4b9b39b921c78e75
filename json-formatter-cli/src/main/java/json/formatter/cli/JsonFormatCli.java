package json.formatter.cli;

import json.formatter.Json;
import json.formatter.JsonFormatException;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/// CLI entry point that pretty-prints a JSON file to standard output.
///
/// Usage:
/// `java -jar json-formatter-cli.jar input.json`
///
/// Exit status is 0 on success and 1 when no file is named, the file cannot be read,
/// or its content is not valid JSON. Diagnostics go to standard error.
public final class JsonFormatCli {

    private static final Logger LOG = Logger.getLogger(JsonFormatCli.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private JsonFormatCli() {}

    public static void main(String[] args) {
        final var out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
        final var err = new PrintWriter(System.err, true, StandardCharsets.UTF_8);
        System.exit(run(args, out, err));
    }

    /// Runs the command and returns its exit status instead of exiting.
    static int run(String[] args, PrintWriter out, PrintWriter err) {
        Objects.requireNonNull(out, "out must not be null");
        Objects.requireNonNull(err, "err must not be null");

        if (args == null || args.length == 0) {
            err.println("No filename provided");
            return EXIT_FAILURE;
        }

        final var filename = args[0];
        final String content;
        try {
            content = read(Path.of(filename));
        } catch (NoSuchFileException e) {
            err.println("No such file or directory: '" + filename + "'");
            return EXIT_FAILURE;
        } catch (AccessDeniedException e) {
            err.println("Permission denied: '" + filename + "'");
            return EXIT_FAILURE;
        } catch (IOException | InvalidPathException e) {
            err.println("Error reading file '" + filename + "': " + e.getMessage());
            return EXIT_FAILURE;
        }

        try {
            out.println(Json.format(content));
            return EXIT_OK;
        } catch (JsonFormatException e) {
            LOG.fine(() -> "Formatting " + filename + " failed: " + e.getMessage());
            err.println("Failed to format JSON: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    static String read(Path path) throws IOException {
        LOG.fine(() -> "Reading " + path.toAbsolutePath());
        return stripBom(Files.readString(path, StandardCharsets.UTF_8));
    }

    private static String stripBom(String s) {
        if (!s.isEmpty() && s.charAt(0) == '\uFEFF') {
            return s.substring(1);
        }
        return s;
    }
}
