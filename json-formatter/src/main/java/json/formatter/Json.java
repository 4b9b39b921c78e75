package json.formatter;

import java.util.Objects;
import java.util.logging.Logger;

/// Entry point for reformatting JSON text.
///
/// ```
/// String pretty = Json.format("{\"a\":1,\"b\":[true]}");
/// ```
///
/// {@link #format(String)} runs the whole pipeline: {@link JsonTokenizer}, then
/// {@link JsonParser}, then {@link JsonFormatter}. Each stage finishes before the next
/// starts and nothing is shared between calls, so the methods are safe to call from
/// any thread.
public final class Json {

    private static final Logger LOG = Logger.getLogger(Json.class.getName());

    private Json() {
        throw new AssertionError("Json cannot be instantiated");
    }

    /// Reformats JSON text into its canonical indented form.
    /// @param content the JSON text
    /// @return the formatted text, without a trailing newline
    /// @throws NullPointerException if content is null
    /// @throws JsonTokenizeException if the text is lexically invalid
    /// @throws JsonParseException if the tokens do not form exactly one value
    public static String format(String content) {
        return toText(parse(content));
    }

    /// Parses JSON text into a value tree.
    /// @param content the JSON text
    /// @return the root value
    /// @throws NullPointerException if content is null
    /// @throws JsonFormatException on the first lexical or syntactic error
    public static JsonValue parse(String content) {
        Objects.requireNonNull(content, "content must not be null");
        LOG.fine(() -> "Parsing JSON text of " + content.length() + " characters");
        return JsonParser.parse(JsonTokenizer.tokenize(content));
    }

    /// Formats a value tree. Never fails.
    /// @param value the root value
    /// @return the formatted text
    public static String toText(JsonValue value) {
        return JsonFormatter.format(value);
    }
}
