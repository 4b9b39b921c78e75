package json.formatter;

import java.util.Objects;

/// A single lexical unit produced by {@link JsonTokenizer}.
///
/// Tokens are immutable and never reference one another. Each token can render the
/// textual form it was scanned from, which is what parse diagnostics quote back to the
/// caller.
public sealed interface JsonToken
        permits JsonToken.Punctuation, JsonToken.Literal, JsonToken.StringToken, JsonToken.NumberToken {

    /// {@return the JSON text this token stands for}
    String render();

    /// Structural characters: `[ ] { } : ,`
    enum Punctuation implements JsonToken {
        LEFT_BRACKET('['),
        RIGHT_BRACKET(']'),
        LEFT_BRACE('{'),
        RIGHT_BRACE('}'),
        COLON(':'),
        COMMA(',');

        private final char symbol;

        Punctuation(char symbol) {
            this.symbol = symbol;
        }

        /// {@return the punctuation for the given character, or `null` if it is not structural}
        static Punctuation of(char c) {
            return switch (c) {
                case '[' -> LEFT_BRACKET;
                case ']' -> RIGHT_BRACKET;
                case '{' -> LEFT_BRACE;
                case '}' -> RIGHT_BRACE;
                case ':' -> COLON;
                case ',' -> COMMA;
                default -> null;
            };
        }

        @Override
        public String render() {
            return String.valueOf(symbol);
        }
    }

    /// The barewords `true`, `false` and `null`
    enum Literal implements JsonToken {
        TRUE("true"),
        FALSE("false"),
        NULL("null");

        private final String text;

        Literal(String text) {
            this.text = text;
        }

        /// {@return the literal spelled exactly as `text`, or `null` for any other bareword}
        static Literal of(String text) {
            for (Literal literal : values()) {
                if (literal.text.equals(text)) {
                    return literal;
                }
            }
            return null;
        }

        @Override
        public String render() {
            return text;
        }
    }

    /// A string literal with its escapes already decoded
    record StringToken(String value) implements JsonToken {
        public StringToken {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String render() {
            return JsonText.quote(value);
        }
    }

    /// A numeric literal converted to a finite 64-bit float
    record NumberToken(double value) implements JsonToken {
        @Override
        public String render() {
            return JsonText.number(value);
        }
    }
}
