package json.ordered;

import java.util.Objects;

import json.ordered.internal.Escaper;

/// A JSON string.
public record JsonString(String value) implements JsonValue {

    public JsonString {
        Objects.requireNonNull(value, "value");
    }

    /// Returns a string value holding the given text.
    public static JsonString of(String value) {
        return new JsonString(value);
    }

    @Override
    public String asString() {
        return value;
    }

    @Override
    public String toString() {
        return Escaper.quote(value, true);
    }
}
