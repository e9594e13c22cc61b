package json.ordered.internal;

import java.io.ByteArrayOutputStream;
import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

import json.ordered.JsonArray;
import json.ordered.JsonBoolean;
import json.ordered.JsonException;
import json.ordered.JsonMarshaler;
import json.ordered.JsonMarshalerException;
import json.ordered.JsonNull;
import json.ordered.JsonNumber;
import json.ordered.JsonObject;
import json.ordered.JsonString;
import json.ordered.JsonSyntaxException;
import json.ordered.JsonUnsupportedValueException;
import json.ordered.JsonValue;
import json.ordered.Member;
import json.ordered.TextMarshaler;

/// Encodes host values into compact JSON bytes.
///
/// Hooks are consulted first ({@link JsonMarshaler}, then
/// {@link TextMarshaler}), then the value model, then scalars, containers and
/// finally aggregates through their {@link FieldPlan}. A marshaller is used for
/// a single call.
public final class Marshaller {

    private static final Logger LOG = Logger.getLogger(Marshaller.class.getName());

    static final String NULL_HOOK = "marshalNullJson";

    private static final Map<Class<?>, Optional<Method>> NULL_HOOKS = new ConcurrentHashMap<>();

    private static final byte[] NULL = "null".getBytes(StandardCharsets.US_ASCII);

    private final ByteArrayOutputStream out = new ByteArrayOutputStream(128);
    private final boolean escapeHtml;
    private final Set<Object> visiting = java.util.Collections.newSetFromMap(new IdentityHashMap<>());

    public Marshaller(boolean escapeHtml) {
        this.escapeHtml = escapeHtml;
    }

    /// Encodes one value. Nothing is returned if any part of it fails.
    public static byte[] marshal(Object value, boolean escapeHtml) {
        final var m = new Marshaller(escapeHtml);
        m.write(value, value == null ? Object.class : value.getClass(), false);
        return m.out.toByteArray();
    }

    void write(Object v, Type declared, boolean quoted) {
        if (v == null) {
            writeNull(Types.raw(declared));
            return;
        }
        if (v instanceof JsonMarshaler hook) {
            writeHook(hook);
            return;
        }
        if (v instanceof TextMarshaler hook) {
            final String text;
            try {
                text = hook.marshalText();
            } catch (RuntimeException e) {
                throw new JsonMarshalerException(v.getClass(), "marshalText", e);
            }
            Escaper.appendString(out, text, escapeHtml);
            return;
        }
        if (v instanceof JsonValue value) {
            writeValue(value);
            return;
        }
        if (v instanceof String s) {
            writeString(s, quoted);
            return;
        }
        if (v instanceof Character c) {
            writeString(String.valueOf(c), quoted);
            return;
        }
        if (v instanceof Boolean b) {
            writeScalar(b ? "true" : "false", quoted);
            return;
        }
        if (v instanceof Double d) {
            writeScalar(NumberText.formatDouble(d), quoted);
            return;
        }
        if (v instanceof Float f) {
            writeScalar(NumberText.formatFloat(f), quoted);
            return;
        }
        if (v instanceof BigDecimal d) {
            writeScalar(d.scale() <= 0 ? d.toPlainString() : d.toString(), quoted);
            return;
        }
        if (v instanceof Byte || v instanceof Short || v instanceof Integer || v instanceof Long
                || v instanceof BigInteger) {
            writeScalar(v.toString(), quoted);
            return;
        }
        if (v instanceof Enum<?> e) {
            Escaper.appendString(out, e.name(), escapeHtml);
            return;
        }
        if (v instanceof byte[] bytes) {
            out.write('"');
            out.writeBytes(Base64.getEncoder().encode(bytes));
            out.write('"');
            return;
        }
        if (v instanceof Optional<?> o) {
            if (o.isPresent()) {
                write(o.get(), Types.typeArgument(declared, 0), quoted);
            } else {
                out.writeBytes(NULL);
            }
            return;
        }
        if (v instanceof Map<?, ?> map) {
            enter(v);
            writeMap(map, declared);
            visiting.remove(v);
            return;
        }
        if (v instanceof Collection<?> c) {
            enter(v);
            writeCollection(c, Types.elementType(declared));
            visiting.remove(v);
            return;
        }
        final Class<?> type = v.getClass();
        if (type.isArray()) {
            enter(v);
            writeArray(v, Types.elementType(Types.raw(declared).isArray() ? declared : type));
            visiting.remove(v);
            return;
        }
        if (Types.isAggregate(type)) {
            enter(v);
            writeAggregate(v, FieldResolver.plan(type));
            visiting.remove(v);
            return;
        }
        throw new JsonUnsupportedValueException("type " + type.getName());
    }

    private void writeNull(Class<?> declared) {
        if (JsonMarshaler.class.isAssignableFrom(declared)) {
            final Optional<Method> hook = NULL_HOOKS.computeIfAbsent(declared, Marshaller::findNullHook);
            if (hook.isPresent()) {
                final Object produced;
                try {
                    produced = hook.get().invoke(null);
                } catch (InvocationTargetException e) {
                    throw new JsonMarshalerException(declared, NULL_HOOK, e.getCause());
                } catch (IllegalAccessException e) {
                    throw new JsonMarshalerException(declared, NULL_HOOK, e);
                }
                writeHookOutput(declared, NULL_HOOK, (byte[]) produced);
                return;
            }
        }
        out.writeBytes(NULL);
    }

    private static Optional<Method> findNullHook(Class<?> type) {
        try {
            final Method m = type.getMethod(NULL_HOOK);
            if (Modifier.isStatic(m.getModifiers()) && m.getReturnType() == byte[].class) {
                LOG.fine(() -> "Using " + NULL_HOOK + " of " + type.getName());
                return Optional.of(m);
            }
        } catch (NoSuchMethodException e) {
            LOG.finer(() -> type.getName() + " declares no " + NULL_HOOK);
        }
        return Optional.empty();
    }

    private void writeHook(JsonMarshaler hook) {
        final byte[] produced;
        try {
            produced = hook.marshalJson();
        } catch (RuntimeException e) {
            throw new JsonMarshalerException(hook.getClass(), "marshalJson", e);
        }
        writeHookOutput(hook.getClass(), "marshalJson", produced);
    }

    /// Hook output must be one well-formed value; it is written compacted.
    private void writeHookOutput(Class<?> type, String method, byte[] produced) {
        if (produced == null) {
            throw new JsonMarshalerException(type, method, new JsonException("returned null"));
        }
        try {
            JsonParser.validate(produced, 0, produced.length, 0);
        } catch (JsonSyntaxException e) {
            throw new JsonMarshalerException(type, method, e);
        }
        Formatter.compact(out, produced, escapeHtml);
    }

    private void writeValue(JsonValue value) {
        if (value instanceof JsonNull) {
            out.writeBytes(NULL);
        } else if (value instanceof JsonBoolean b) {
            writeScalar(b.value() ? "true" : "false", false);
        } else if (value instanceof JsonNumber n) {
            writeNumber(n);
        } else if (value instanceof JsonString s) {
            Escaper.appendString(out, s.value(), escapeHtml);
        } else if (value instanceof JsonArray a) {
            out.write('[');
            final List<JsonValue> elements = a.elements();
            for (int i = 0; i < elements.size(); i++) {
                if (i > 0) {
                    out.write(',');
                }
                writeValue(elements.get(i));
            }
            out.write(']');
        } else if (value instanceof JsonObject o) {
            out.write('{');
            boolean first = true;
            for (Member m : o.members()) {
                if (!first) {
                    out.write(',');
                }
                first = false;
                Escaper.appendString(out, m.key(), escapeHtml);
                out.write(':');
                writeValue(m.value());
            }
            out.write('}');
        }
    }

    private void writeNumber(JsonNumber n) {
        final String text = n.text();
        if (text.isEmpty()) {
            out.write('0');
            return;
        }
        if (!n.isValid()) {
            throw new JsonUnsupportedValueException("invalid number literal " + Escaper.quote(text, false));
        }
        out.writeBytes(text.getBytes(StandardCharsets.US_ASCII));
    }

    private void writeString(String s, boolean quoted) {
        if (!quoted) {
            Escaper.appendString(out, s, escapeHtml);
            return;
        }
        final var inner = new ByteArrayOutputStream(s.length() + 2);
        Escaper.appendString(inner, s, escapeHtml);
        Escaper.appendBytes(out, inner.toByteArray(), false);
    }

    private void writeScalar(String text, boolean quoted) {
        if (quoted) {
            out.write('"');
        }
        out.writeBytes(text.getBytes(StandardCharsets.US_ASCII));
        if (quoted) {
            out.write('"');
        }
    }

    private void writeMap(Map<?, ?> map, Type declared) {
        final Class<?> keyType = Types.raw(Types.typeArgument(declared, 0));
        if (!MapKeys.isSupported(keyType)) {
            throw new JsonUnsupportedValueException("map key type " + keyType.getName());
        }
        final Type valueType = Types.typeArgument(declared, 1);
        final List<KeyedValue> entries = new ArrayList<>(map.size());
        for (Map.Entry<?, ?> e : map.entrySet()) {
            entries.add(new KeyedValue(MapKeys.resolve(e.getKey()), e.getValue()));
        }
        entries.sort((a, b) -> MapKeys.compare(a.key(), b.key()));
        out.write('{');
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) {
                out.write(',');
            }
            final KeyedValue e = entries.get(i);
            Escaper.appendString(out, e.key(), escapeHtml);
            out.write(':');
            write(e.value(), valueType, false);
        }
        out.write('}');
    }

    private record KeyedValue(String key, Object value) {
    }

    private void writeCollection(Collection<?> c, Type elementType) {
        out.write('[');
        boolean first = true;
        for (Object element : c) {
            if (!first) {
                out.write(',');
            }
            first = false;
            write(element, elementType, false);
        }
        out.write(']');
    }

    private void writeArray(Object array, Type elementType) {
        out.write('[');
        final int n = Array.getLength(array);
        for (int i = 0; i < n; i++) {
            if (i > 0) {
                out.write(',');
            }
            write(Array.get(array, i), elementType, false);
        }
        out.write(']');
    }

    private void writeAggregate(Object v, FieldPlan plan) {
        out.write('{');
        boolean first = true;
        next:
        for (PlannedField f : plan.fields()) {
            Object holder = v;
            final var path = f.path();
            for (int i = 0; i < path.length - 1; i++) {
                holder = Types.get(path[i], holder);
                if (holder == null) {
                    continue next;
                }
            }
            final Object value = Types.get(f.leaf(), holder);
            if (f.omitEmpty() && Types.isEmpty(value)) {
                continue;
            }
            if (!first) {
                out.write(',');
            }
            first = false;
            out.writeBytes(f.keyBytes(escapeHtml));
            write(value, f.type(), f.quoted());
        }
        out.write('}');
    }

    private void enter(Object v) {
        if (!visiting.add(v)) {
            throw new JsonUnsupportedValueException("encountered a cycle via " + v.getClass().getName());
        }
    }
}
