package json.formatter;

import java.util.List;
import java.util.Objects;

/// The value tree produced by {@link JsonParser}.
///
/// A closed set of variants: null, boolean, number, string, array and object. Instances
/// are immutable; containers hold unmodifiable copies of their children, so a tree is
/// always finite and acyclic.
///
/// Objects keep their members as an ordered list rather than a map. Duplicate keys are
/// preserved in the order they were parsed.
public sealed interface JsonValue
        permits JsonValue.JsonNull, JsonValue.JsonBool, JsonValue.JsonNumber,
        JsonValue.JsonString, JsonValue.JsonArray, JsonValue.JsonObject {

    /// JSON `null`
    record JsonNull() implements JsonValue {
        static final JsonNull INSTANCE = new JsonNull();
    }

    /// JSON `true` or `false`
    record JsonBool(boolean value) implements JsonValue {
        static final JsonBool TRUE = new JsonBool(true);
        static final JsonBool FALSE = new JsonBool(false);
    }

    /// A JSON number held as a finite 64-bit float
    record JsonNumber(double value) implements JsonValue {
        public JsonNumber {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("JSON numbers must be finite: " + value);
            }
        }
    }

    /// A JSON string with escapes decoded
    record JsonString(String value) implements JsonValue {
        public JsonString {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /// An ordered sequence of values, possibly empty
    record JsonArray(List<JsonValue> elements) implements JsonValue {
        public JsonArray {
            Objects.requireNonNull(elements, "elements must not be null");
            elements = List.copyOf(elements);
        }

        public static JsonArray of(JsonValue... elements) {
            return new JsonArray(List.of(elements));
        }
    }

    /// An ordered sequence of key/value members, possibly empty
    record JsonObject(List<Member> members) implements JsonValue {
        public JsonObject {
            Objects.requireNonNull(members, "members must not be null");
            members = List.copyOf(members);
        }

        public static JsonObject of(Member... members) {
            return new JsonObject(List.of(members));
        }

        /// One `"key": value` entry of an object
        public record Member(String key, JsonValue value) {
            public Member {
                Objects.requireNonNull(key, "key must not be null");
                Objects.requireNonNull(value, "value must not be null");
            }
        }
    }
}
