package json.ordered.internal;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import json.ordered.JsonArray;
import json.ordered.JsonBoolean;
import json.ordered.JsonException;
import json.ordered.JsonMarshalerException;
import json.ordered.JsonNull;
import json.ordered.JsonNumber;
import json.ordered.JsonObject;
import json.ordered.JsonString;
import json.ordered.JsonUnmarshalTypeException;
import json.ordered.JsonUnmarshaler;
import json.ordered.JsonValue;
import json.ordered.RawJson;
import json.ordered.TextUnmarshaler;

/// Decodes validated JSON into host values.
///
/// A value that does not fit its target is skipped and the mismatch recorded;
/// decoding carries on and the first recorded problem is thrown once the
/// whole value has been read. Whatever was decoded before that stays applied
/// to in-place targets.
public final class Unmarshaller {

    /// Result of decoding a value that must not be stored.
    private static final Object SKIP = new Object();

    /// Integer digits beyond which an exponent form is not expanded.
    private static final int MAX_INTEGER_DIGITS = 1000;

    private JsonParser p;
    private final boolean disallowUnknownFields;
    private final boolean allowIntegralExponents;
    private final List<String> fieldStack = new ArrayList<>();
    private String struct;
    private JsonException saved;
    private Object inPlaceTarget;

    public Unmarshaller(JsonParser parser, boolean disallowUnknownFields, boolean allowIntegralExponents) {
        this.p = parser;
        this.disallowUnknownFields = disallowUnknownFields;
        this.allowIntegralExponents = allowIntegralExponents;
    }

    /// Decodes the next value into the given type.
    ///
    /// @param existing an instance to fill in place, or null
    /// @throws JsonException the first mismatch recorded while decoding
    public Object unmarshal(Type type, Object existing) {
        inPlaceTarget = existing;
        final Object v = decode(type, existing);
        if (saved != null) {
            throw saved;
        }
        if (v == SKIP) {
            return existing != null ? existing : Types.zero(Types.raw(type));
        }
        return v;
    }

    Object decode(Type type, Object existing) {
        final Class<?> raw = Types.raw(type);
        final int c = p.peek();
        if (raw == RawJson.class) {
            final int start = p.position();
            final int end = p.skipValue();
            return new RawJson(Arrays.copyOfRange(p.buffer(), start, end));
        }
        if (JsonUnmarshaler.class.isAssignableFrom(raw)) {
            return decodeHook(raw, existing);
        }
        if (TextUnmarshaler.class.isAssignableFrom(raw) && c != 'n') {
            return decodeText(type, raw, existing);
        }
        if (c == 'n') {
            p.skipValue();
            return nullFor(raw);
        }
        if (raw == Object.class || JsonValue.class.isAssignableFrom(raw)) {
            final JsonValue v = p.readValue();
            if (raw.isInstance(v)) {
                return v;
            }
            return mismatch(kind(v), type);
        }
        if (raw == Optional.class) {
            final Object inner = decode(Types.typeArgument(type, 0),
                    existing instanceof Optional<?> o ? o.orElse(null) : null);
            return inner == SKIP ? SKIP : Optional.ofNullable(inner);
        }
        return switch (c) {
            case '"' -> decodeString(type, raw);
            case 't', 'f' -> {
                p.skipValue();
                if (raw == boolean.class || raw == Boolean.class) {
                    yield c == 't';
                }
                yield mismatch("bool", type);
            }
            case '[' -> decodeArray(type, raw);
            case '{' -> decodeObject(type, raw, existing);
            default -> decodeNumber(p.readNumber(), type, raw);
        };
    }

    private Object decodeHook(Class<?> raw, Object existing) {
        final JsonUnmarshaler target;
        if (existing instanceof JsonUnmarshaler u) {
            target = u;
        } else if (raw.isInterface() || java.lang.reflect.Modifier.isAbstract(raw.getModifiers())) {
            p.skipValue();
            return mismatch("value", raw);
        } else {
            target = (JsonUnmarshaler) Types.instantiate(raw);
        }
        p.peek();
        final int start = p.position();
        final int end = p.skipValue();
        try {
            target.unmarshalJson(Arrays.copyOfRange(p.buffer(), start, end));
        } catch (JsonException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new JsonMarshalerException(raw, "unmarshalJson", e);
        }
        return target;
    }

    private Object decodeText(Type type, Class<?> raw, Object existing) {
        if (p.peek() != '"') {
            final int c = p.peek();
            p.skipValue();
            return mismatch(kind(c), type);
        }
        final String text = p.readString();
        final TextUnmarshaler target;
        if (existing instanceof TextUnmarshaler u) {
            target = u;
        } else if (raw.isInterface() || java.lang.reflect.Modifier.isAbstract(raw.getModifiers())) {
            return mismatch("string", type);
        } else {
            target = (TextUnmarshaler) Types.instantiate(raw);
        }
        try {
            target.unmarshalText(text);
        } catch (JsonException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new JsonMarshalerException(raw, "unmarshalText", e);
        }
        return target;
    }

    private static Object nullFor(Class<?> raw) {
        if (raw.isPrimitive()) {
            return SKIP;
        }
        if (raw == Optional.class) {
            return Optional.empty();
        }
        if (raw == Object.class || raw == JsonValue.class || raw == JsonNull.class) {
            return JsonNull.of();
        }
        return null;
    }

    private Object decodeString(Type type, Class<?> raw) {
        final String s = p.readString();
        if (raw == String.class || raw == CharSequence.class) {
            return s;
        }
        if (raw == char.class || raw == Character.class) {
            return s.length() == 1 ? (Object) s.charAt(0) : mismatch("string", type);
        }
        if (raw == byte[].class) {
            try {
                return Base64.getDecoder().decode(s);
            } catch (IllegalArgumentException e) {
                save(new JsonException("json: illegal base64 data in string: " + e.getMessage(), e));
                return SKIP;
            }
        }
        if (raw.isEnum()) {
            for (Object constant : raw.getEnumConstants()) {
                if (((Enum<?>) constant).name().equals(s)) {
                    return constant;
                }
            }
            return mismatch("string " + Escaper.quote(s, false), type);
        }
        return mismatch("string", type);
    }

    private Object decodeNumber(String text, Type type, Class<?> raw) {
        if (raw == int.class || raw == Integer.class) {
            final BigInteger v = integral(text, 32);
            return v == null ? mismatch("number " + text, type) : (Object) v.intValue();
        }
        if (raw == long.class || raw == Long.class) {
            final BigInteger v = integral(text, 64);
            return v == null ? mismatch("number " + text, type) : (Object) v.longValue();
        }
        if (raw == short.class || raw == Short.class) {
            final BigInteger v = integral(text, 16);
            return v == null ? mismatch("number " + text, type) : (Object) v.shortValue();
        }
        if (raw == byte.class || raw == Byte.class) {
            final BigInteger v = integral(text, 8);
            return v == null ? mismatch("number " + text, type) : (Object) v.byteValue();
        }
        if (raw == BigInteger.class) {
            final BigInteger v = integral(text, Integer.MAX_VALUE);
            return v == null ? mismatch("number " + text, type) : v;
        }
        if (raw == double.class || raw == Double.class) {
            final double d = Double.parseDouble(text);
            return Double.isInfinite(d) ? mismatch("number " + text, type) : (Object) d;
        }
        if (raw == float.class || raw == Float.class) {
            final float f = Float.parseFloat(text);
            return Float.isInfinite(f) ? mismatch("number " + text, type) : (Object) f;
        }
        if (raw == BigDecimal.class || raw == Number.class) {
            return new BigDecimal(text);
        }
        return mismatch("number", type);
    }

    /// Parses an exact integer that fits in `bits` bits, or returns null.
    private BigInteger integral(String text, int bits) {
        BigInteger v;
        if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
            v = new BigInteger(text);
        } else {
            if (!allowIntegralExponents) {
                return null;
            }
            final BigDecimal d = new BigDecimal(text);
            if (d.precision() - d.scale() > MAX_INTEGER_DIGITS) {
                return null;
            }
            try {
                v = d.toBigIntegerExact();
            } catch (ArithmeticException e) {
                return null;
            }
        }
        return v.bitLength() < bits ? v : null;
    }

    private Object decodeArray(Type type, Class<?> raw) {
        final Type elementType = Types.elementType(type);
        final Class<?> elementRaw = Types.raw(elementType);
        final Collection<Object> target;
        if (raw.isArray()) {
            target = new ArrayList<>();
        } else if (Collection.class.isAssignableFrom(raw) || raw == Iterable.class) {
            target = newCollection(raw);
        } else {
            p.skipValue();
            return mismatch("array", type);
        }
        p.beginArray();
        while (p.nextElement()) {
            final Object element = decode(elementType, null);
            target.add(element == SKIP ? Types.zero(elementRaw) : element);
        }
        if (!raw.isArray()) {
            return target;
        }
        final Object array = Array.newInstance(elementRaw, target.size());
        int i = 0;
        for (Object element : target) {
            Array.set(array, i++, element);
        }
        return array;
    }

    @SuppressWarnings("unchecked")
    private static Collection<Object> newCollection(Class<?> raw) {
        if (raw.isAssignableFrom(ArrayList.class)) {
            return new ArrayList<>();
        }
        if (raw.isAssignableFrom(LinkedHashSet.class)) {
            return new LinkedHashSet<>();
        }
        if (raw.isAssignableFrom(TreeSet.class)) {
            return new TreeSet<>();
        }
        if (raw.isAssignableFrom(ArrayDeque.class)) {
            return new ArrayDeque<>();
        }
        return (Collection<Object>) Types.instantiate(raw);
    }

    private Object decodeObject(Type type, Class<?> raw, Object existing) {
        if (Map.class.isAssignableFrom(raw)) {
            return decodeMap(type, raw, existing);
        }
        if (Types.isAggregate(raw)) {
            return decodeAggregate(type, raw, raw.isInstance(existing) ? existing : null);
        }
        p.skipValue();
        return mismatch("object", type);
    }

    @SuppressWarnings("unchecked")
    private Object decodeMap(Type type, Class<?> raw, Object existing) {
        final Type keyType = Types.typeArgument(type, 0);
        final Class<?> keyRaw = Types.raw(keyType);
        final boolean textKey = TextUnmarshaler.class.isAssignableFrom(keyRaw) && !keyRaw.isInterface();
        if (!textKey && (!MapKeys.isSupported(keyRaw) || keyRaw.isInterface() && keyRaw != CharSequence.class)) {
            p.skipValue();
            return mismatch("object", type);
        }
        final Type valueType = Types.typeArgument(type, 1);
        Map<Object, Object> map = existing instanceof Map<?, ?> m ? (Map<Object, Object>) m : newMap(raw);
        final int depth = fieldStack.size();
        p.beginObject();
        while (p.nextMember()) {
            final String key = p.readKey();
            fieldStack.add(key);
            final Object value = decode(valueType, null);
            fieldStack.remove(depth);
            final Object k = mapKey(key, keyType, keyRaw);
            if (k != SKIP) {
                map = put(map, raw, k, value == SKIP ? Types.zero(Types.raw(valueType)) : value);
            }
        }
        return map;
    }

    /// Stores an entry, moving the entries of a map that refuses writes, such as
    /// `Map.of()` held by a field, into a fresh map first.
    private Map<Object, Object> put(Map<Object, Object> map, Class<?> raw, Object key, Object value) {
        try {
            map.put(key, value);
            return map;
        } catch (UnsupportedOperationException e) {
            if (map == inPlaceTarget) {
                throw new IllegalArgumentException("json: cannot decode in place into unmodifiable "
                        + map.getClass().getName(), e);
            }
            final Map<Object, Object> copy = newMap(raw);
            copy.putAll(map);
            copy.put(key, value);
            return copy;
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<Object, Object> newMap(Class<?> raw) {
        if (raw.isAssignableFrom(LinkedHashMap.class)) {
            return new LinkedHashMap<>();
        }
        if (raw.isAssignableFrom(TreeMap.class)) {
            return new TreeMap<>();
        }
        if (raw.isAssignableFrom(ConcurrentHashMap.class)) {
            return new ConcurrentHashMap<>();
        }
        return (Map<Object, Object>) Types.instantiate(raw);
    }

    private Object mapKey(String key, Type keyType, Class<?> keyRaw) {
        if (keyRaw == String.class || keyRaw == Object.class || keyRaw == CharSequence.class) {
            return key;
        }
        if (TextUnmarshaler.class.isAssignableFrom(keyRaw)) {
            final var k = (TextUnmarshaler) Types.instantiate(keyRaw);
            try {
                k.unmarshalText(key);
            } catch (JsonException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new JsonMarshalerException(keyRaw, "unmarshalText", e);
            }
            return k;
        }
        if (keyRaw.isEnum()) {
            for (Object constant : keyRaw.getEnumConstants()) {
                if (((Enum<?>) constant).name().equals(key)) {
                    return constant;
                }
            }
            return mismatch("string " + Escaper.quote(key, false), keyType);
        }
        final BigInteger n;
        try {
            n = new BigInteger(key);
        } catch (NumberFormatException e) {
            return mismatch("number " + key, keyType);
        }
        final int bits = keyRaw == Integer.class ? 32 : keyRaw == Long.class ? 64
                : keyRaw == Short.class ? 16 : keyRaw == Byte.class ? 8 : Integer.MAX_VALUE;
        if (n.bitLength() >= bits) {
            return mismatch("number " + key, keyType);
        }
        if (keyRaw == Integer.class) {
            return n.intValue();
        }
        if (keyRaw == Long.class) {
            return n.longValue();
        }
        if (keyRaw == Short.class) {
            return n.shortValue();
        }
        if (keyRaw == Byte.class) {
            return n.byteValue();
        }
        return n;
    }

    private Object decodeAggregate(Type type, Class<?> raw, Object existing) {
        final FieldPlan plan = FieldResolver.plan(raw);
        final Map<TypeVariable<?>, Type> bindings = new HashMap<>();
        Types.bind(type, bindings);
        final Assembly root = new Assembly(raw, existing);
        final String outerStruct = struct;
        final int depth = fieldStack.size();
        p.beginObject();
        while (p.nextMember()) {
            final String key = p.readKey();
            final PlannedField f = plan.lookup(key);
            if (f == null) {
                if (disallowUnknownFields) {
                    save(new JsonException("json: unknown field " + Escaper.quote(key, false)));
                }
                p.skipValue();
                continue;
            }
            final Assembly node = root.descend(f);
            struct = raw.getSimpleName();
            fieldStack.add(f.name());
            final Object current = node.current(f.leaf());
            final Type fieldType = fieldType(f, bindings);
            final Object v = f.quoted() ? decodeQuoted(fieldType, current) : decode(fieldType, current);
            if (v != SKIP) {
                node.put(f.leaf(), v);
            }
            fieldStack.remove(depth);
        }
        struct = outerStruct;
        return root.finish();
    }

    /// Returns the declared type of a field with the type parameters of the
    /// aggregate, and of the embedded aggregates on its path, filled in.
    private static Type fieldType(PlannedField f, Map<TypeVariable<?>, Type> bindings) {
        if (bindings.isEmpty() && f.path().length == 1) {
            return f.type();
        }
        Map<TypeVariable<?>, Type> local = bindings;
        final Field[] path = f.path();
        if (path.length > 1) {
            local = new HashMap<>(bindings);
            for (int i = 0; i < path.length - 1; i++) {
                Types.bind(path[i].getGenericType(), local);
            }
        }
        return Types.resolve(f.type(), local);
    }

    /// Reads a member written as a JSON string holding a literal.
    private Object decodeQuoted(Type type, Object current) {
        final Class<?> raw = Types.raw(type);
        final int c = p.peek();
        if (c == 'n') {
            p.skipValue();
            return raw.isPrimitive() ? SKIP : raw == Optional.class ? Optional.empty() : null;
        }
        if (c != '"') {
            p.skipValue();
            save(new JsonException("json: invalid use of ,string struct tag, trying to unmarshal unquoted value into "
                    + type.getTypeName()));
            return SKIP;
        }
        final long at = p.offset();
        final String literal = p.readString();
        final byte[] bytes = literal.getBytes(StandardCharsets.UTF_8);
        if (!isQuotedLiteral(bytes)) {
            save(new JsonException("json: invalid use of ,string struct tag, trying to unmarshal "
                    + Escaper.quote(literal, false) + " into " + type.getTypeName()));
            return SKIP;
        }
        final boolean optional = raw == Optional.class;
        final Type inner = optional ? Types.typeArgument(type, 0) : type;
        final Object innerCurrent = optional && current instanceof Optional<?> o ? o.orElse(null) : current;
        final JsonParser outer = p;
        p = new JsonParser(bytes, 0, bytes.length, at, false);
        final Object v;
        try {
            v = decode(inner, innerCurrent);
        } finally {
            p = outer;
        }
        if (optional && v != SKIP) {
            return Optional.ofNullable(v);
        }
        return v;
    }

    /// A quoted member holds exactly one string, number, boolean or null literal.
    private static boolean isQuotedLiteral(byte[] bytes) {
        if (bytes.length == 0 || JsonParser.isSpace(bytes[0]) || JsonParser.isSpace(bytes[bytes.length - 1])) {
            return false;
        }
        if (bytes[0] == '{' || bytes[0] == '[') {
            return false;
        }
        return JsonParser.isValid(bytes);
    }

    private Object mismatch(String value, Type type) {
        final boolean inField = !fieldStack.isEmpty();
        save(new JsonUnmarshalTypeException(value, type, p.offset(),
                inField ? struct : null, inField ? String.join(".", fieldStack) : null));
        return SKIP;
    }

    private void save(JsonException e) {
        if (saved == null) {
            saved = e;
        }
    }

    private static String kind(int c) {
        return switch (c) {
            case '"' -> "string";
            case '{' -> "object";
            case '[' -> "array";
            case 't', 'f' -> "bool";
            case 'n' -> "null";
            default -> "number";
        };
    }

    private static String kind(JsonValue v) {
        if (v instanceof JsonString) {
            return "string";
        }
        if (v instanceof JsonObject) {
            return "object";
        }
        if (v instanceof JsonArray) {
            return "array";
        }
        if (v instanceof JsonBoolean) {
            return "bool";
        }
        if (v instanceof JsonNumber) {
            return "number";
        }
        return "null";
    }
}
