package json.formatter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Splits JSON text into {@link JsonToken}s.
///
/// A single left-to-right scan with one character of lookahead. Whitespace is skipped,
/// structural characters become {@link JsonToken.Punctuation}, `"` starts a string,
/// `-` or a digit starts a number, and anything else is read as a bareword that must be
/// `true`, `false` or `null`.
///
/// Numbers are accumulated greedily from `0-9 - + e E .` and only validated when
/// converted, so `1.2.3` fails as an invalid number literal rather than as two tokens.
public final class JsonTokenizer {

    private static final Logger LOG = Logger.getLogger(JsonTokenizer.class.getName());

    private final String input;
    private int pos;

    private JsonTokenizer(String input) {
        this.input = input;
        this.pos = 0;
    }

    /// Tokenizes JSON text.
    /// @param input the text to scan
    /// @return the tokens in input order, possibly empty
    /// @throws NullPointerException if input is null
    /// @throws JsonTokenizeException on the first lexical error
    public static List<JsonToken> tokenize(String input) {
        Objects.requireNonNull(input, "input must not be null");
        LOG.fine(() -> "Tokenizing " + input.length() + " characters");
        final var tokens = new JsonTokenizer(input).scan();
        LOG.fine(() -> "Produced " + tokens.size() + " tokens");
        return tokens;
    }

    private List<JsonToken> scan() {
        final var tokens = new ArrayList<JsonToken>();

        while (pos < input.length()) {
            final char c = input.charAt(pos);

            if (isWhitespace(c)) {
                pos++;
                continue;
            }

            final JsonToken token;
            final var punctuation = JsonToken.Punctuation.of(c);
            if (punctuation != null) {
                pos++;
                token = punctuation;
            } else if (c == '"') {
                token = scanString();
            } else if (c == '-' || isDigit(c)) {
                token = scanNumber();
            } else {
                token = scanLiteral();
            }

            LOG.finer(() -> "Token: " + token.render());
            tokens.add(token);
        }

        return List.copyOf(tokens);
    }

    private JsonToken.StringToken scanString() {
        pos++; // skip opening quote

        final var sb = new StringBuilder();

        while (pos < input.length()) {
            final char c = input.charAt(pos++);
            if (c == '"') {
                return new JsonToken.StringToken(sb.toString());
            }
            if (c == '\\') {
                scanEscape(sb);
            } else {
                sb.append(c);
            }
        }

        throw JsonTokenizeException.unexpectedEndOfInput();
    }

    private void scanEscape(StringBuilder sb) {
        if (pos >= input.length()) {
            throw JsonTokenizeException.unexpectedEndOfInput();
        }

        final char c = input.charAt(pos++);
        switch (c) {
            case '"' -> sb.append('"');
            case '\\' -> sb.append('\\');
            case '/' -> sb.append('/');
            case 'b' -> sb.append('\b');
            case 'f' -> sb.append('\f');
            case 'n' -> sb.append('\n');
            case 'r' -> sb.append('\r');
            case 't' -> sb.append('\t');
            case 'u' -> scanUnicodeEscape(sb);
            default -> throw JsonTokenizeException.invalidEscapeCharacter(String.valueOf(c));
        }
    }

    /// Decodes the four hex digits of a unicode escape. A high surrogate must be followed directly
    /// by another unicode escape holding a low surrogate; the pair is appended as one code point.
    private void scanUnicodeEscape(StringBuilder sb) {
        final String digits = readHexDigits();
        final char unit = (char) Integer.parseInt(digits, 16);

        if (Character.isLowSurrogate(unit)) {
            throw JsonTokenizeException.invalidEscapeCharacter(digits);
        }
        if (!Character.isHighSurrogate(unit)) {
            sb.append(unit);
            return;
        }

        if (!input.startsWith("\\u", pos)) {
            throw JsonTokenizeException.invalidEscapeCharacter(digits);
        }
        pos += 2;
        final String lowDigits = readHexDigits();
        final char low = (char) Integer.parseInt(lowDigits, 16);
        if (!Character.isLowSurrogate(low)) {
            throw JsonTokenizeException.invalidEscapeCharacter(lowDigits);
        }
        sb.append(unit).append(low);
    }

    /// Collects up to four characters, stopping early at a quote or the end of input.
    private String readHexDigits() {
        final int start = pos;
        while (pos < input.length() && pos - start < 4 && input.charAt(pos) != '"') {
            pos++;
        }

        final var digits = input.substring(start, pos);
        if (digits.length() != 4) {
            throw JsonTokenizeException.invalidEscapeCharacter(digits);
        }
        for (int i = 0; i < digits.length(); i++) {
            if (!isHexDigit(digits.charAt(i))) {
                throw JsonTokenizeException.invalidEscapeCharacter(digits);
            }
        }
        return digits;
    }

    private JsonToken.NumberToken scanNumber() {
        final int start = pos;
        while (pos < input.length() && isNumberChar(input.charAt(pos))) {
            pos++;
        }

        final var text = input.substring(start, pos);
        final double value;
        try {
            value = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw JsonTokenizeException.invalidNumberLiteral(text);
        }
        if (Double.isInfinite(value)) {
            throw JsonTokenizeException.invalidNumberLiteral(text);
        }
        return new JsonToken.NumberToken(value);
    }

    private JsonToken.Literal scanLiteral() {
        final int start = pos;
        while (pos < input.length()) {
            final char c = input.charAt(pos);
            if (isWhitespace(c) || JsonToken.Punctuation.of(c) != null) {
                break;
            }
            pos++;
        }

        if (pos == start) {
            throw JsonTokenizeException.unexpectedCharacter(input.charAt(pos));
        }

        final var text = input.substring(start, pos);
        final var literal = JsonToken.Literal.of(text);
        if (literal == null) {
            throw JsonTokenizeException.unexpectedLiteral(text);
        }
        return literal;
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isNumberChar(char c) {
        return isDigit(c) || c == '-' || c == '+' || c == 'e' || c == 'E' || c == '.';
    }
}
