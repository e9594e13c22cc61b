package json.ordered.internal;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.LinkedHashMap;
import java.util.Map;

import json.ordered.JsonException;

/// An aggregate being decoded.
///
/// Classes are filled in place: the existing instance, or a fresh one from
/// the no-argument constructor. Records collect their component values and
/// are built through the canonical constructor when the object ends; a
/// component that was not present keeps the value of the existing record, or
/// the type's default. Embedded aggregates get a child assembly of their own.
final class Assembly {

    private final Class<?> type;
    private final Object target;
    private final Map<Field, Object> values = new LinkedHashMap<>();
    private final Map<Field, Assembly> children = new LinkedHashMap<>();

    Assembly(Class<?> type, Object existing) {
        this.type = type;
        this.target = type.isRecord() || existing != null ? existing : Types.instantiate(type);
    }

    /// Returns the assembly owning the leaf of `f`, creating embedded ones on the way.
    Assembly descend(PlannedField f) {
        Assembly node = this;
        final Field[] path = f.path();
        for (int i = 0; i < path.length - 1; i++) {
            final Assembly parent = node;
            node = node.children.computeIfAbsent(path[i],
                    step -> new Assembly(step.getType(), parent.current(step)));
        }
        return node;
    }

    /// Returns what the field currently holds, or null if nothing is known.
    Object current(Field field) {
        if (values.containsKey(field)) {
            return values.get(field);
        }
        return target == null ? null : Types.get(field, target);
    }

    void put(Field field, Object value) {
        if (type.isRecord()) {
            values.put(field, value);
        } else {
            Types.set(field, target, value);
        }
    }

    Object finish() {
        if (!type.isRecord()) {
            children.forEach((field, child) -> Types.set(field, target, child.finish()));
            return target;
        }
        final RecordComponent[] components = type.getRecordComponents();
        final Class<?>[] parameterTypes = new Class<?>[components.length];
        final Object[] args = new Object[components.length];
        for (int i = 0; i < components.length; i++) {
            final RecordComponent rc = components[i];
            parameterTypes[i] = rc.getType();
            final Field field = componentField(rc);
            if (values.containsKey(field)) {
                args[i] = values.get(field);
            } else if (children.containsKey(field)) {
                args[i] = children.get(field).finish();
            } else if (target != null) {
                args[i] = Types.get(field, target);
            } else {
                args[i] = Types.zero(rc.getType());
            }
        }
        try {
            final Constructor<?> canonical = type.getDeclaredConstructor(parameterTypes);
            canonical.setAccessible(true);
            return canonical.newInstance(args);
        } catch (InvocationTargetException e) {
            throw new JsonException("json: cannot construct " + type.getName() + ": " + e.getCause().getMessage(), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("json: cannot construct " + type.getName(), e);
        }
    }

    private Field componentField(RecordComponent rc) {
        try {
            final Field field = type.getDeclaredField(rc.getName());
            field.setAccessible(true);
            return field;
        } catch (NoSuchFieldException e) {
            throw new IllegalStateException("record component without field: " + rc, e);
        }
    }
}
