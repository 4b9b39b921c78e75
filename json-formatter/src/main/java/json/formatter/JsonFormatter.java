package json.formatter;

import java.util.Objects;
import java.util.logging.Logger;

/// Renders a {@link JsonValue} tree as canonical indented text.
///
/// Each nesting level indents by two spaces. Empty containers print as `[]` and `{}`
/// on one line; non-empty containers put every child on its own line, separated by
/// `,` and a newline, with the closing bracket back at the parent's indentation:
///
/// ```
/// {
///   "a": 1,
///   "b": [
///     true
///   ]
/// }
/// ```
///
/// Numbers print as their shortest decimal form without exponent, strings and keys are
/// escaped, and the output carries no trailing newline.
public final class JsonFormatter {

    private static final Logger LOG = Logger.getLogger(JsonFormatter.class.getName());

    private static final String INDENT = "  ";

    private JsonFormatter() {
        throw new AssertionError("JsonFormatter cannot be instantiated");
    }

    /// Formats a value tree.
    /// @param value the root value
    /// @return the canonical text
    /// @throws NullPointerException if value is null
    public static String format(JsonValue value) {
        Objects.requireNonNull(value, "value must not be null");
        final var sb = new StringBuilder();
        appendValue(sb, value, 1);
        LOG.fine(() -> "Formatted " + value.getClass().getSimpleName() + " into " + sb.length() + " characters");
        return sb.toString();
    }

    private static void appendValue(StringBuilder sb, JsonValue value, int indentLevel) {
        if (value instanceof JsonValue.JsonNull) {
            sb.append("null");
        } else if (value instanceof JsonValue.JsonBool bool) {
            sb.append(bool.value());
        } else if (value instanceof JsonValue.JsonNumber number) {
            sb.append(JsonText.number(number.value()));
        } else if (value instanceof JsonValue.JsonString string) {
            sb.append(JsonText.quote(string.value()));
        } else if (value instanceof JsonValue.JsonArray array) {
            appendArray(sb, array, indentLevel);
        } else if (value instanceof JsonValue.JsonObject object) {
            appendObject(sb, object, indentLevel);
        } else {
            throw new AssertionError("Unknown JsonValue: " + value.getClass());
        }
    }

    private static void appendArray(StringBuilder sb, JsonValue.JsonArray array, int indentLevel) {
        if (array.elements().isEmpty()) {
            sb.append("[]");
            return;
        }

        sb.append("[\n");
        final var elements = array.elements();
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                sb.append(",\n");
            }
            sb.append(INDENT.repeat(indentLevel));
            appendValue(sb, elements.get(i), indentLevel + 1);
        }
        sb.append('\n').append(INDENT.repeat(indentLevel - 1)).append(']');
    }

    private static void appendObject(StringBuilder sb, JsonValue.JsonObject object, int indentLevel) {
        if (object.members().isEmpty()) {
            sb.append("{}");
            return;
        }

        sb.append("{\n");
        final var members = object.members();
        for (int i = 0; i < members.size(); i++) {
            if (i > 0) {
                sb.append(",\n");
            }
            final var member = members.get(i);
            sb.append(INDENT.repeat(indentLevel)).append(JsonText.quote(member.key())).append(": ");
            appendValue(sb, member.value(), indentLevel + 1);
        }
        sb.append('\n').append(INDENT.repeat(indentLevel - 1)).append('}');
    }
}
