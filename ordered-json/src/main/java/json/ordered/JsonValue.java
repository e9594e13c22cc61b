package json.ordered;

/// A node of the ordered JSON value model.
///
/// Objects are sequences of {@link Member}s, not maps: member order is kept
/// exactly as inserted or parsed and duplicate keys are allowed. Equality is
/// structural and order sensitive for both objects and arrays.
///
/// `toString()` of every value is its compact, HTML-safe encoding.
///
/// ## Example Usage
/// ```java
/// JsonValue v = Json.decode("{\"b\":1,\"a\":2,\"b\":3}");
/// JsonObject o = v.asObject();
/// o.member(0).key();   // "b"
/// o.getAll("b");       // [1, 3]
/// Json.encodeToString(v); // {"b":1,"a":2,"b":3}
/// ```
public sealed interface JsonValue
        permits JsonNull, JsonBoolean, JsonNumber, JsonString, JsonArray, JsonObject {

    /// Returns this value as a {@link JsonObject}.
    /// @throws JsonAssertionException if this is not an object
    default JsonObject asObject() {
        throw JsonAssertionException.typeMismatch(this, "JsonObject");
    }

    /// Returns this value as a {@link JsonArray}.
    /// @throws JsonAssertionException if this is not an array
    default JsonArray asArray() {
        throw JsonAssertionException.typeMismatch(this, "JsonArray");
    }

    /// Returns the content of this string value.
    /// @throws JsonAssertionException if this is not a string
    default String asString() {
        throw JsonAssertionException.typeMismatch(this, "JsonString");
    }

    /// Returns this value as a {@link JsonNumber}.
    /// @throws JsonAssertionException if this is not a number
    default JsonNumber asNumber() {
        throw JsonAssertionException.typeMismatch(this, "JsonNumber");
    }

    /// Returns the content of this boolean value.
    /// @throws JsonAssertionException if this is not a boolean
    default boolean asBoolean() {
        throw JsonAssertionException.typeMismatch(this, "JsonBoolean");
    }

    /// Returns true if this is the `null` literal.
    default boolean isNull() {
        return false;
    }
}
