package json.formatter;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/// Text rendering shared by token diagnostics and the formatter.
final class JsonText {

    /// Seventeen significant digits always identify a double.
    private static final int MAX_SIGNIFICANT_DIGITS = 17;

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private JsonText() {
        throw new AssertionError("JsonText cannot be instantiated");
    }

    /// {@return `value` wrapped in double quotes with JSON escaping applied}
    ///
    /// Quotes, backslashes and control characters are escaped. `/` and all characters
    /// from U+0020 upwards are emitted as they are.
    static String quote(String value) {
        final var sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        appendEscaped(sb, value);
        sb.append('"');
        return sb.toString();
    }

    private static void appendEscaped(StringBuilder sb, String value) {
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append("\\u00").append(HEX[c >> 4]).append(HEX[c & 0xF]);
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
    }

    /// {@return the shortest decimal text that reads back as `value`, without exponent}
    ///
    /// Integral values drop the fractional part (`18.0` renders as `18`) and negative
    /// zero keeps its sign.
    static String number(double value) {
        if (value == 0.0d) {
            return Double.doubleToRawLongBits(value) < 0 ? "-0" : "0";
        }
        final var exact = new BigDecimal(value);
        for (int precision = 1; precision < MAX_SIGNIFICANT_DIGITS; precision++) {
            final var rounded = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (rounded.doubleValue() == value) {
                return rounded.stripTrailingZeros().toPlainString();
            }
        }
        return exact.round(new MathContext(MAX_SIGNIFICANT_DIGITS, RoundingMode.HALF_EVEN))
            .stripTrailingZeros().toPlainString();
    }
}
