package json.ordered;

import java.io.ByteArrayOutputStream;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import json.ordered.internal.Formatter;
import json.ordered.internal.JsonParser;
import json.ordered.internal.Marshaller;
import json.ordered.internal.Types;
import json.ordered.internal.Unmarshaller;

/// Static entry points of the codec.
///
/// ## Encoding
/// ```java
/// record Tx(String hash, long fee) {}
/// Json.encodeToString(new Tx("ab", 10));   // {"hash":"ab","fee":10}
/// ```
/// Encoding is HTML safe and every non-ASCII character is escaped, so the
/// output is plain ASCII unless a {@link JsonMarshaler} returns otherwise.
///
/// ## Decoding
/// ```java
/// JsonValue v = Json.decode("{\"b\":1,\"a\":2}");        // member order kept
/// Tx tx = Json.decode(bytes, Tx.class);
/// List<Tx> txs = Json.decode(bytes, new TypeRef<List<Tx>>() {});
/// ```
/// Input is checked in full before any value is built; a malformed document
/// never reaches the target.
public final class Json {

    private Json() {
    }

    /// Returns the compact encoding of a value.
    /// @throws JsonUnsupportedValueException if any part of the value has no encoding
    /// @throws JsonMarshalerException if a hook fails
    public static byte[] encode(Object value) {
        return Marshaller.marshal(value, true);
    }

    /// Returns the compact encoding of a value as a string.
    public static String encodeToString(Object value) {
        return new String(encode(value), StandardCharsets.UTF_8);
    }

    /// Returns the encoding of a value with one member or element per line.
    /// @param prefix written at the start of every line after the first
    /// @param indent written once per nesting level
    public static byte[] encodeIndent(Object value, String prefix, String indent) {
        final byte[] compact = encode(value);
        final var out = new ByteArrayOutputStream(compact.length * 2);
        Formatter.indent(out, compact, prefix, indent);
        return out.toByteArray();
    }

    /// Parses a document into the value model.
    /// @throws JsonSyntaxException if the input is not a single JSON value
    public static JsonValue decode(byte[] json) {
        Objects.requireNonNull(json, "json");
        return JsonParser.parse(json);
    }

    /// Parses a document into the value model.
    public static JsonValue decode(String json) {
        return decode(json.getBytes(StandardCharsets.UTF_8));
    }

    /// Decodes a document into a new value of the given class.
    /// @throws JsonSyntaxException if the input is not a single JSON value
    /// @throws JsonUnmarshalTypeException if a value does not fit its target
    public static <T> T decode(byte[] json, Class<T> type) {
        return decodeType(json, type);
    }

    /// Decodes a document into a new value of a generic type.
    public static <T> T decode(byte[] json, TypeRef<T> type) {
        return decodeType(json, type.type());
    }

    /// Decodes a document into a new value of the given class.
    public static <T> T decode(String json, Class<T> type) {
        return decode(json.getBytes(StandardCharsets.UTF_8), type);
    }

    /// Decodes a document into an existing object, replacing the members present
    /// in the input and leaving the others untouched.
    ///
    /// If a value does not fit, the rest is still applied before the exception
    /// is thrown.
    /// @param target a mutable class instance (not a record) or a `Map`
    /// @throws IllegalArgumentException if the target cannot be filled in place
    public static <T> T decodeInto(byte[] json, T target) {
        checkTarget(target);
        JsonParser.validate(json, 0, json.length, 0);
        new Unmarshaller(new JsonParser(json), false, false).unmarshal(target.getClass(), target);
        return target;
    }

    /// Returns the value model form of a host value.
    public static JsonValue toValue(Object host) {
        return new JsonParser(encode(host)).readValue();
    }

    /// Converts a value model instance to a host value.
    public static <T> T fromValue(JsonValue value, Class<T> type) {
        return decode(encode(value), type);
    }

    /// Converts a value model instance to a host value of a generic type.
    public static <T> T fromValue(JsonValue value, TypeRef<T> type) {
        return decode(encode(value), type);
    }

    /// Returns true if the bytes hold exactly one JSON value.
    public static boolean valid(byte[] json) {
        return JsonParser.isValid(json);
    }

    /// Returns the input with insignificant whitespace removed.
    /// @throws JsonSyntaxException if the input is not a single JSON value
    public static byte[] compact(byte[] json) {
        JsonParser.validate(json, 0, json.length, 0);
        final var out = new ByteArrayOutputStream(json.length);
        Formatter.compact(out, json, false);
        return out.toByteArray();
    }

    /// Returns the input with one member or element per line. Trailing
    /// whitespace after the value is kept.
    /// @throws JsonSyntaxException if the input is not a single JSON value
    public static byte[] indent(byte[] json, String prefix, String indent) {
        JsonParser.validate(json, 0, json.length, 0);
        final var out = new ByteArrayOutputStream(json.length * 2);
        Formatter.indent(out, json, prefix, indent);
        return out.toByteArray();
    }

    /// Returns the input with `<`, `>`, `&`, U+2028 and U+2029 escaped so it
    /// can be embedded in HTML.
    public static byte[] htmlEscape(byte[] json) {
        final var out = new ByteArrayOutputStream(json.length + 16);
        Formatter.htmlEscape(out, json);
        return out.toByteArray();
    }

    @SuppressWarnings("unchecked")
    private static <T> T decodeType(byte[] json, Type type) {
        Objects.requireNonNull(json, "json");
        JsonParser.validate(json, 0, json.length, 0);
        return (T) new Unmarshaller(new JsonParser(json), false, false).unmarshal(type, null);
    }

    static void checkTarget(Object target) {
        Objects.requireNonNull(target, "target");
        final Class<?> type = target.getClass();
        if (type.isRecord() || !(target instanceof java.util.Map<?, ?> || target instanceof JsonUnmarshaler
                || Types.isAggregate(type))) {
            throw new IllegalArgumentException("json: cannot decode in place into " + type.getName());
        }
    }
}
