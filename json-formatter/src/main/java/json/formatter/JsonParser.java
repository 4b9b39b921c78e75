package json.formatter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import static json.formatter.JsonToken.Literal;
import static json.formatter.JsonToken.Punctuation;

/// Recursive descent parser from a token sequence to a {@link JsonValue} tree.
///
/// Grammar, one method per nonterminal:
/// - value  := null | true | false | Number | String | array | object
/// - array  := '[' (value (',' value)*)? ']'
/// - object := '{' (member (',' member)*)? '}'
/// - member := String ':' value
///
/// The whole token sequence must form exactly one value. Trailing commas, non-string
/// keys and leftover tokens after the root are rejected as unexpected tokens.
///
/// Container nesting is bounded by the `json.formatter.maxDepth` system property
/// (default 512) so deeply nested input fails with a diagnostic instead of exhausting
/// the thread stack.
public final class JsonParser {

    private static final Logger LOG = Logger.getLogger(JsonParser.class.getName());

    /// System property holding the maximum container nesting depth
    public static final String MAX_DEPTH_PROPERTY = "json.formatter.maxDepth";

    /// Nesting depth used when the system property is absent or invalid
    public static final int DEFAULT_MAX_DEPTH = 512;

    private static final int CONFIGURED_MAX_DEPTH = maxDepthFrom(System.getProperty(MAX_DEPTH_PROPERTY));

    private final TokenCursor cursor;
    private final int maxDepth;

    private JsonParser(List<JsonToken> tokens, int maxDepth) {
        this.cursor = new TokenCursor(tokens);
        this.maxDepth = maxDepth;
    }

    /// Parses a token sequence using the configured nesting limit.
    /// @param tokens the tokens produced by {@link JsonTokenizer#tokenize(String)}
    /// @return the root value
    /// @throws NullPointerException if tokens is null
    /// @throws JsonParseException on the first grammar violation
    public static JsonValue parse(List<JsonToken> tokens) {
        return parse(tokens, CONFIGURED_MAX_DEPTH);
    }

    /// Parses a token sequence with an explicit nesting limit.
    /// @param tokens the tokens to parse
    /// @param maxDepth the deepest container nesting accepted, at least 1
    /// @return the root value
    /// @throws IllegalArgumentException if maxDepth is less than 1
    /// @throws JsonParseException on the first grammar violation
    public static JsonValue parse(List<JsonToken> tokens, int maxDepth) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1: " + maxDepth);
        }
        LOG.fine(() -> "Parsing " + tokens.size() + " tokens with max depth " + maxDepth);
        return new JsonParser(List.copyOf(tokens), maxDepth).parseRoot();
    }

    /// {@return the nesting limit read from the `json.formatter.maxDepth` system property}
    public static int configuredMaxDepth() {
        return CONFIGURED_MAX_DEPTH;
    }

    static int maxDepthFrom(String propertyValue) {
        if (propertyValue == null) {
            LOG.fine(() -> "Max depth not specified, using default: " + DEFAULT_MAX_DEPTH);
            return DEFAULT_MAX_DEPTH;
        }
        int depth;
        try {
            depth = Integer.parseInt(propertyValue.trim());
        } catch (NumberFormatException e) {
            depth = 0;
        }
        if (depth < 1) {
            LOG.warning(() -> "Invalid " + MAX_DEPTH_PROPERTY + ": " + propertyValue
                    + ". Using default: " + DEFAULT_MAX_DEPTH);
            return DEFAULT_MAX_DEPTH;
        }
        final int configured = depth;
        LOG.fine(() -> "Max depth set to " + configured + " via system property");
        return configured;
    }

    private JsonValue parseRoot() {
        final var root = parseValue(0);
        if (cursor.hasNext()) {
            throw JsonParseException.unexpectedToken(cursor.advance());
        }
        return root;
    }

    private JsonValue parseValue(int depth) {
        final var token = cursor.peek().orElseThrow(JsonParseException::unexpectedEndOfInput);

        if (token == Punctuation.LEFT_BRACKET) {
            return parseArray(depth + 1);
        }
        if (token == Punctuation.LEFT_BRACE) {
            return parseObject(depth + 1);
        }
        if (token instanceof Punctuation) {
            throw JsonParseException.unexpectedToken(token);
        }

        cursor.advance();
        if (token instanceof JsonToken.StringToken string) {
            return new JsonValue.JsonString(string.value());
        }
        if (token instanceof JsonToken.NumberToken number) {
            return new JsonValue.JsonNumber(number.value());
        }
        final var literal = (Literal) token;
        return switch (literal) {
            case TRUE -> JsonValue.JsonBool.TRUE;
            case FALSE -> JsonValue.JsonBool.FALSE;
            case NULL -> JsonValue.JsonNull.INSTANCE;
        };
    }

    private JsonValue.JsonArray parseArray(int depth) {
        checkDepth(depth);
        cursor.advance(); // skip [

        final var elements = new ArrayList<JsonValue>();

        if (cursor.peek().orElse(null) == Punctuation.RIGHT_BRACKET) {
            cursor.advance();
            return new JsonValue.JsonArray(elements);
        }

        elements.add(parseValue(depth));

        while (true) {
            final var token = cursor.advance();
            if (token == Punctuation.COMMA) {
                elements.add(parseValue(depth));
            } else if (token == Punctuation.RIGHT_BRACKET) {
                LOG.finer(() -> "Parsed array of " + elements.size() + " elements");
                return new JsonValue.JsonArray(elements);
            } else {
                throw JsonParseException.unexpectedToken(token);
            }
        }
    }

    private JsonValue.JsonObject parseObject(int depth) {
        checkDepth(depth);
        cursor.advance(); // skip {

        final var members = new ArrayList<JsonValue.JsonObject.Member>();

        if (cursor.peek().orElse(null) == Punctuation.RIGHT_BRACE) {
            cursor.advance();
            return new JsonValue.JsonObject(members);
        }

        members.add(parseMember(depth));

        while (true) {
            final var token = cursor.advance();
            if (token == Punctuation.COMMA) {
                members.add(parseMember(depth));
            } else if (token == Punctuation.RIGHT_BRACE) {
                LOG.finer(() -> "Parsed object of " + members.size() + " members");
                return new JsonValue.JsonObject(members);
            } else {
                throw JsonParseException.unexpectedToken(token);
            }
        }
    }

    private JsonValue.JsonObject.Member parseMember(int depth) {
        final var key = cursor.advance();
        if (!(key instanceof JsonToken.StringToken string)) {
            throw JsonParseException.unexpectedToken(key);
        }
        cursor.expect(Punctuation.COLON);
        return new JsonValue.JsonObject.Member(string.value(), parseValue(depth));
    }

    private void checkDepth(int depth) {
        if (depth > maxDepth) {
            throw JsonParseException.nestingTooDeep(maxDepth);
        }
    }
}
