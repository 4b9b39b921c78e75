package json.formatter;

import java.util.List;
import java.util.Optional;

/// A position in an immutable token list with one token of lookahead.
final class TokenCursor {

    private final List<JsonToken> tokens;
    private int index;

    TokenCursor(List<JsonToken> tokens) {
        this.tokens = tokens;
        this.index = 0;
    }

    /// {@return the next token without consuming it, or empty at the end}
    Optional<JsonToken> peek() {
        return index < tokens.size() ? Optional.of(tokens.get(index)) : Optional.empty();
    }

    /// Consumes and returns the next token.
    /// @throws JsonParseException if no token remains
    JsonToken advance() {
        if (index >= tokens.size()) {
            throw JsonParseException.unexpectedEndOfInput();
        }
        return tokens.get(index++);
    }

    /// Consumes the next token, which must be `expected`.
    /// @throws JsonParseException if a different token follows or none remains
    void expect(JsonToken expected) {
        final var token = advance();
        if (token != expected) {
            throw JsonParseException.unexpectedToken(token);
        }
    }

    boolean hasNext() {
        return index < tokens.size();
    }
}
