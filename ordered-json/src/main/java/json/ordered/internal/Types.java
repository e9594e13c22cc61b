package json.ordered.internal;

import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

import json.ordered.JsonArray;
import json.ordered.JsonException;
import json.ordered.JsonMarshaler;
import json.ordered.JsonNumber;
import json.ordered.JsonObject;
import json.ordered.JsonValue;
import json.ordered.RawJson;
import json.ordered.TextMarshaler;

/// Reflection helpers shared by the encoder and the decoder.
public final class Types {

    private Types() {
    }

    /// Returns the class a type erases to.
    public static Class<?> raw(Type type) {
        if (type instanceof Class<?> c) {
            return c;
        }
        if (type instanceof ParameterizedType p) {
            return (Class<?>) p.getRawType();
        }
        if (type instanceof GenericArrayType g) {
            return Array.newInstance(raw(g.getGenericComponentType()), 0).getClass();
        }
        if (type instanceof WildcardType w) {
            return raw(w.getUpperBounds()[0]);
        }
        if (type instanceof TypeVariable<?> v) {
            return raw(v.getBounds()[0]);
        }
        return Object.class;
    }

    /// Returns the `i`-th type argument, or `Object` when the type is not parameterized.
    public static Type typeArgument(Type type, int i) {
        if (type instanceof ParameterizedType p) {
            final Type arg = p.getActualTypeArguments()[i];
            if (arg instanceof WildcardType w) {
                return w.getUpperBounds()[0];
            }
            return arg;
        }
        return Object.class;
    }

    /// Returns the element type of an array or collection type.
    public static Type elementType(Type type) {
        if (type instanceof GenericArrayType g) {
            return g.getGenericComponentType();
        }
        if (type instanceof Class<?> c && c.isArray()) {
            return c.getComponentType();
        }
        return typeArgument(type, 0);
    }

    /// Records what each type parameter of `type`, and of its generic
    /// superclasses, stands for.
    public static void bind(Type type, Map<TypeVariable<?>, Type> bindings) {
        final Type resolved = resolve(type, bindings);
        final Class<?> c = raw(resolved);
        if (resolved instanceof ParameterizedType p) {
            final TypeVariable<?>[] params = c.getTypeParameters();
            final Type[] args = p.getActualTypeArguments();
            for (int i = 0; i < params.length && i < args.length; i++) {
                bindings.put(params[i], args[i]);
            }
        }
        final Type superclass = c.getGenericSuperclass();
        if (superclass != null && superclass != Object.class) {
            bind(superclass, bindings);
        }
    }

    /// Replaces the type variables in `type` by what they are bound to.
    /// Unbound variables are left in place and erase to their bound.
    public static Type resolve(Type type, Map<TypeVariable<?>, Type> bindings) {
        if (bindings.isEmpty() || type instanceof Class<?>) {
            return type;
        }
        if (type instanceof TypeVariable<?> v) {
            return bindings.getOrDefault(v, v);
        }
        if (type instanceof WildcardType w) {
            return resolve(w.getUpperBounds()[0], bindings);
        }
        if (type instanceof GenericArrayType g) {
            final Type component = resolve(g.getGenericComponentType(), bindings);
            if (component instanceof Class<?> c) {
                return Array.newInstance(c, 0).getClass();
            }
            return new ResolvedArrayType(component);
        }
        if (type instanceof ParameterizedType p) {
            final Type[] args = p.getActualTypeArguments();
            final Type[] resolved = new Type[args.length];
            boolean changed = false;
            for (int i = 0; i < args.length; i++) {
                resolved[i] = resolve(args[i], bindings);
                changed |= resolved[i] != args[i];
            }
            return changed ? new ResolvedParameterizedType((Class<?>) p.getRawType(), resolved, p.getOwnerType()) : p;
        }
        return type;
    }

    private static final class ResolvedParameterizedType implements ParameterizedType {
        private final Class<?> rawType;
        private final Type[] args;
        private final Type ownerType;

        ResolvedParameterizedType(Class<?> rawType, Type[] args, Type ownerType) {
            this.rawType = rawType;
            this.args = args;
            this.ownerType = ownerType;
        }

        @Override
        public Type[] getActualTypeArguments() {
            return args.clone();
        }

        @Override
        public Type getRawType() {
            return rawType;
        }

        @Override
        public Type getOwnerType() {
            return ownerType;
        }

        @Override
        public String getTypeName() {
            final var sb = new StringBuilder(rawType.getTypeName()).append('<');
            for (int i = 0; i < args.length; i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(args[i].getTypeName());
            }
            return sb.append('>').toString();
        }

        @Override
        public String toString() {
            return getTypeName();
        }
    }

    private static final class ResolvedArrayType implements GenericArrayType {
        private final Type component;

        ResolvedArrayType(Type component) {
            this.component = component;
        }

        @Override
        public Type getGenericComponentType() {
            return component;
        }

        @Override
        public String getTypeName() {
            return component.getTypeName() + "[]";
        }

        @Override
        public String toString() {
            return getTypeName();
        }
    }

    /// Returns true for types mapped to objects through their fields: records and
    /// concrete classes outside the JDK that are not containers, enums or part of
    /// the value model.
    public static boolean isAggregate(Class<?> c) {
        if (c.isRecord()) {
            return !JsonValue.class.isAssignableFrom(c) && c != RawJson.class;
        }
        return !c.isPrimitive() && !c.isArray() && !c.isEnum() && !c.isInterface()
                && !Modifier.isAbstract(c.getModifiers())
                && !isPlatform(c)
                && !JsonValue.class.isAssignableFrom(c)
                && !Collection.class.isAssignableFrom(c)
                && !Map.class.isAssignableFrom(c);
    }

    /// Returns true for aggregates whose fields are promoted when embedded.
    /// Types with an encoding hook are embedded as a single member instead.
    public static boolean isEmbeddable(Class<?> c) {
        return isAggregate(c)
                && !JsonMarshaler.class.isAssignableFrom(c)
                && !TextMarshaler.class.isAssignableFrom(c);
    }

    /// Returns true for classes that belong to the Java platform.
    public static boolean isPlatform(Class<?> c) {
        final String name = c.getName();
        return name.startsWith("java.") || name.startsWith("javax.") || name.startsWith("jdk.") || name.startsWith("sun.");
    }

    /// Returns true for boolean, numeric, character and string types, the only
    /// ones a string-quoted member applies to. `Optional` is looked through.
    public static boolean isQuotable(Type type) {
        Class<?> c = raw(type);
        if (c == Optional.class) {
            c = raw(typeArgument(type, 0));
        }
        return c.isPrimitive() && c != void.class
                || c == Boolean.class || c == String.class || c == Character.class
                || c == Byte.class || c == Short.class || c == Integer.class || c == Long.class
                || c == Float.class || c == Double.class
                || c == BigInteger.class || c == BigDecimal.class;
    }

    /// Returns true if a member holding this value is left out under omit-empty.
    /// Aggregates are never empty.
    public static boolean isEmpty(Object v) {
        if (v == null) {
            return true;
        }
        if (v instanceof Boolean b) {
            return !b;
        }
        if (v instanceof String s) {
            return s.isEmpty();
        }
        if (v instanceof Character ch) {
            return ch == 0;
        }
        if (v instanceof Double d) {
            return d == 0;
        }
        if (v instanceof Float f) {
            return f == 0;
        }
        if (v instanceof BigDecimal d) {
            return d.signum() == 0;
        }
        if (v instanceof BigInteger i) {
            return i.signum() == 0;
        }
        if (v instanceof Number n) {
            return n.longValue() == 0;
        }
        if (v instanceof Collection<?> c) {
            return c.isEmpty();
        }
        if (v instanceof Map<?, ?> m) {
            return m.isEmpty();
        }
        if (v instanceof Optional<?> o) {
            return o.isEmpty();
        }
        if (v.getClass().isArray()) {
            return Array.getLength(v) == 0;
        }
        if (v instanceof RawJson r) {
            return r.isEmpty();
        }
        if (v instanceof JsonValue j) {
            return j.isNull()
                    || j instanceof JsonArray a && a.isEmpty()
                    || j instanceof JsonObject o && o.isEmpty()
                    || j instanceof JsonNumber n && n.text().isEmpty();
        }
        return false;
    }

    /// Returns the default value of a type: zero for primitives, an empty
    /// `Optional`, or null for other reference types.
    public static Object zero(Class<?> c) {
        if (c == Optional.class) {
            return Optional.empty();
        }
        if (!c.isPrimitive()) {
            return null;
        }
        if (c == boolean.class) {
            return false;
        }
        if (c == char.class) {
            return (char) 0;
        }
        if (c == byte.class) {
            return (byte) 0;
        }
        if (c == short.class) {
            return (short) 0;
        }
        if (c == int.class) {
            return 0;
        }
        if (c == long.class) {
            return 0L;
        }
        if (c == float.class) {
            return 0f;
        }
        return 0d;
    }

    /// Creates an instance through the no-argument constructor, whatever its access.
    /// @throws IllegalArgumentException if the class has no such constructor
    public static <T> T instantiate(Class<T> c) {
        final Constructor<T> ctor;
        try {
            ctor = c.getDeclaredConstructor();
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("json: " + c.getName() + " has no no-argument constructor", e);
        }
        ctor.setAccessible(true);
        try {
            return ctor.newInstance();
        } catch (InvocationTargetException e) {
            throw new JsonException("json: constructor of " + c.getName() + " failed", e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("json: cannot instantiate " + c.getName(), e);
        }
    }

    /// Reads a field made accessible by the field resolver.
    public static Object get(Field f, Object target) {
        try {
            return f.get(target);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("field not accessible: " + f, e);
        }
    }

    /// Writes a field made accessible by the field resolver.
    public static void set(Field f, Object target, Object value) {
        try {
            f.set(target, value);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("field not writable: " + f, e);
        }
    }
}
