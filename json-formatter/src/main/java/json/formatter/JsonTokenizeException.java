package json.formatter;

import java.util.Objects;

/// Exception thrown when JSON text cannot be split into tokens.
public final class JsonTokenizeException extends JsonFormatException {

    private static final long serialVersionUID = 1L;

    /// The lexical error categories
    public enum Kind {
        UNEXPECTED_LITERAL("Unexpected literal: '%s'"),
        UNEXPECTED_CHARACTER("Unexpected character: '%s'"),
        UNEXPECTED_END_OF_INPUT("Unexpected end of input"),
        INVALID_ESCAPE_CHARACTER("Invalid escape character: '%s'"),
        INVALID_NUMBER_LITERAL("Invalid number literal: '%s'");

        private final String template;

        Kind(String template) {
            this.template = template;
        }

        String describe(String detail) {
            return detail == null ? template : template.formatted(detail);
        }
    }

    private final Kind kind;
    private final String detail;

    private JsonTokenizeException(Kind kind, String detail) {
        super(kind.describe(detail));
        this.kind = kind;
        this.detail = detail;
    }

    static JsonTokenizeException unexpectedLiteral(String literal) {
        return new JsonTokenizeException(Kind.UNEXPECTED_LITERAL, Objects.requireNonNull(literal));
    }

    static JsonTokenizeException unexpectedCharacter(char c) {
        return new JsonTokenizeException(Kind.UNEXPECTED_CHARACTER, String.valueOf(c));
    }

    static JsonTokenizeException unexpectedEndOfInput() {
        return new JsonTokenizeException(Kind.UNEXPECTED_END_OF_INPUT, null);
    }

    static JsonTokenizeException invalidEscapeCharacter(String text) {
        return new JsonTokenizeException(Kind.INVALID_ESCAPE_CHARACTER, Objects.requireNonNull(text));
    }

    static JsonTokenizeException invalidNumberLiteral(String text) {
        return new JsonTokenizeException(Kind.INVALID_NUMBER_LITERAL, Objects.requireNonNull(text));
    }

    /// Returns the category of this error.
    public Kind kind() {
        return kind;
    }

    /// Returns the offending literal, character, escape or number text, or null for
    /// {@link Kind#UNEXPECTED_END_OF_INPUT}.
    public String detail() {
        return detail;
    }
}
