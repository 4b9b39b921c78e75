package json.formatter;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Formats every `golden/<name>.input.json` and compares the result with either
/// `<name>.expected.json` or, for malformed inputs, the diagnostic in `<name>.error.txt`.
public final class JsonGoldenFilesTest extends JsonFormatterLoggingConfig {

    private static final Logger LOG = Logger.getLogger(JsonGoldenFilesTest.class.getName());

    private static final String INPUT_SUFFIX = ".input.json";

    @ParameterizedTest(name = "{0}")
    @MethodSource("inputs")
    void goldenFiles(String testName) throws IOException {
        LOG.info(() -> "TEST: goldenFiles testName=" + testName);

        final var dir = goldenDir();
        final var input = read(dir.resolve(testName + INPUT_SUFFIX));
        final var expectedPath = dir.resolve(testName + ".expected.json");
        final var errorPath = dir.resolve(testName + ".error.txt");

        if (Files.exists(expectedPath)) {
            assertThat(Json.format(input)).isEqualTo(read(expectedPath).stripTrailing());
        } else {
            assertThat(errorPath).exists();
            final var expectedMessage = read(errorPath).strip();
            assertThatThrownBy(() -> Json.format(input))
                .isInstanceOf(JsonFormatException.class)
                .hasMessage(expectedMessage);
        }
    }

    static Stream<Arguments> inputs() throws IOException {
        enableJulDebug();
        try (var stream = Files.list(goldenDir())) {
            return stream
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(INPUT_SUFFIX))
                    .map(name -> name.substring(0, name.length() - INPUT_SUFFIX.length()))
                    .sorted()
                    .map(Arguments::of)
                    .toList()
                    .stream();
        }
    }

    private static Path goldenDir() {
        return Path.of(System.getProperty(TEST_RESOURCES_PROPERTY)).resolve("golden");
    }

    private static String read(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }
}
