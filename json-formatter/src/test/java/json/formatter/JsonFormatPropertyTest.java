package json.formatter;

import json.formatter.JsonValue.JsonArray;
import json.formatter.JsonValue.JsonBool;
import json.formatter.JsonValue.JsonNull;
import json.formatter.JsonValue.JsonNumber;
import json.formatter.JsonValue.JsonObject;
import json.formatter.JsonValue.JsonObject.Member;
import json.formatter.JsonValue.JsonString;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Property-based testing of the format pipeline.
/// Generates random value trees and checks that formatted text parses back to the same
/// tree and that formatting is idempotent.
class JsonFormatPropertyTest extends JsonFormatterLoggingConfig {

    private static final List<String> KEYS = List.of("alpha", "beta", "gamma", "", "a b", "qu\"ote", "back\\slash");

    @Provide
    Arbitrary<JsonValue> jsonValues() {
        return valueArbitrary(3);
    }

    private static Arbitrary<JsonValue> valueArbitrary(int depth) {
        final Arbitrary<JsonValue> scalars = Arbitraries.oneOf(
            Arbitraries.just((JsonValue) new JsonNull()),
            Arbitraries.of(true, false).map(b -> (JsonValue) new JsonBool(b)),
            Arbitraries.integers().map(i -> (JsonValue) new JsonNumber(i)),
            Arbitraries.doubles().between(-1.0e12, 1.0e12).map(d -> (JsonValue) new JsonNumber(d)),
            Arbitraries.strings().ofMaxLength(12).map(s -> (JsonValue) new JsonString(s))
        );

        if (depth == 0) {
            return scalars;
        }

        final Arbitrary<JsonValue> arrays = valueArbitrary(depth - 1).list().ofMaxSize(4)
            .map(elements -> (JsonValue) new JsonArray(elements));

        final Arbitrary<Member> members = Combinators.combine(
            Arbitraries.oneOf(Arbitraries.of(KEYS), Arbitraries.strings().ofMaxLength(6)),
            valueArbitrary(depth - 1)
        ).as(Member::new);

        final Arbitrary<JsonValue> objects = members.list().ofMaxSize(4)
            .map(list -> (JsonValue) new JsonObject(list));

        return Arbitraries.oneOf(scalars, arrays, objects);
    }

    @Property(tries = 300)
    void formattedTextParsesBackToTheSameTree(@ForAll("jsonValues") JsonValue value) {
        final var text = Json.toText(value);
        assertThat(Json.parse(text)).isEqualTo(value);
    }

    @Property(tries = 300)
    void formattingIsIdempotent(@ForAll("jsonValues") JsonValue value) {
        final var text = Json.toText(value);
        assertThat(Json.format(text)).isEqualTo(text);
    }

    @Property(tries = 200)
    void formattedTextHasNoTrailingWhitespaceOnAnyLine(@ForAll("jsonValues") JsonValue value) {
        for (final var line : Json.toText(value).split("\n", -1)) {
            assertThat(line).doesNotEndWith(" ");
        }
    }

    @Property(tries = 200)
    void truncatedArrayTextFailsWithUnexpectedEnd(@ForAll("jsonValues") JsonValue value) {
        final var text = Json.toText(JsonArray.of(value));
        final var truncated = text.substring(0, text.length() - 1);
        assertThatThrownBy(() -> Json.parse(truncated))
            .isInstanceOf(JsonParseException.class)
            .hasMessage("Unexpected end of input");
    }
}
