package json.ordered.internal;

import java.math.BigInteger;

import json.ordered.JsonMarshalerException;
import json.ordered.JsonUnsupportedValueException;
import json.ordered.TextMarshaler;

/// Map keys as object member names.
///
/// A `String` key is used as is, a {@link TextMarshaler} key by its text, an
/// integral key in decimal and an enum key by name. Members are emitted in
/// code point order of the resulting names.
public final class MapKeys {

    private MapKeys() {
    }

    /// Returns true if keys declared with this type can be named. `Object` and
    /// interfaces are accepted here and checked per key.
    public static boolean isSupported(Class<?> keyType) {
        return keyType == String.class
                || keyType == Object.class
                || keyType.isInterface()
                || TextMarshaler.class.isAssignableFrom(keyType)
                || isIntegral(keyType)
                || keyType.isEnum();
    }

    /// Returns the member name for a key.
    /// @throws JsonUnsupportedValueException for keys that have no name
    public static String resolve(Object key) {
        if (key instanceof String s) {
            return s;
        }
        if (key instanceof TextMarshaler t) {
            try {
                return t.marshalText();
            } catch (RuntimeException e) {
                throw new JsonMarshalerException(key.getClass(), "marshalText", e);
            }
        }
        if (key != null && isIntegral(key.getClass())) {
            return key.toString();
        }
        if (key instanceof Enum<?> e) {
            return e.name();
        }
        throw new JsonUnsupportedValueException(
                "map key " + (key == null ? "null" : "of type " + key.getClass().getName()));
    }

    /// Compares names by code point, which matches the byte order of their UTF-8 form.
    public static int compare(String a, String b) {
        final int n = Math.min(a.length(), b.length());
        for (int i = 0; i < n; i++) {
            final char x = a.charAt(i);
            final char y = b.charAt(i);
            if (x != y) {
                if (Character.isSurrogate(x) || Character.isSurrogate(y)) {
                    return Integer.compare(a.codePointAt(i), b.codePointAt(i));
                }
                return Character.compare(x, y);
            }
        }
        return Integer.compare(a.length(), b.length());
    }

    static boolean isIntegral(Class<?> c) {
        return c == Integer.class || c == Long.class || c == Short.class || c == Byte.class
                || c == BigInteger.class;
    }
}
