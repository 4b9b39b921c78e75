package json.formatter;

import java.util.Objects;
import java.util.Optional;

/// Exception thrown when a token sequence does not form a single JSON value.
public final class JsonParseException extends JsonFormatException {

    private static final long serialVersionUID = 1L;

    /// The syntactic error categories
    public enum Kind {
        UNEXPECTED_TOKEN,
        UNEXPECTED_END_OF_INPUT,
        NESTING_TOO_DEEP
    }

    private final Kind kind;
    private final transient JsonToken token;
    private final int depthLimit;

    private JsonParseException(Kind kind, String message, JsonToken token, int depthLimit) {
        super(message);
        this.kind = kind;
        this.token = token;
        this.depthLimit = depthLimit;
    }

    static JsonParseException unexpectedToken(JsonToken token) {
        Objects.requireNonNull(token, "token must not be null");
        return new JsonParseException(Kind.UNEXPECTED_TOKEN,
                "Unexpected token: '" + token.render() + "'", token, -1);
    }

    static JsonParseException unexpectedEndOfInput() {
        return new JsonParseException(Kind.UNEXPECTED_END_OF_INPUT, "Unexpected end of input", null, -1);
    }

    static JsonParseException nestingTooDeep(int limit) {
        return new JsonParseException(Kind.NESTING_TOO_DEEP,
                "Maximum nesting depth exceeded: " + limit, null, limit);
    }

    /// Returns the category of this error.
    public Kind kind() {
        return kind;
    }

    /// Returns the offending token for {@link Kind#UNEXPECTED_TOKEN}, otherwise empty.
    public Optional<JsonToken> token() {
        return Optional.ofNullable(token);
    }

    /// Returns the nesting limit that was exceeded, or -1 for other kinds.
    public int depthLimit() {
        return depthLimit;
    }
}
