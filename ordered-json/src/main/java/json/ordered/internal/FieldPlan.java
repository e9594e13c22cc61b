package json.ordered.internal;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/// The members an aggregate type maps to, in output order.
///
/// Built once per type by {@link FieldResolver} and immutable afterwards.
public final class FieldPlan {

    private final Class<?> type;
    private final List<PlannedField> fields;
    private final Map<String, PlannedField> byName;

    FieldPlan(Class<?> type, List<PlannedField> fields) {
        this.type = type;
        this.fields = List.copyOf(fields);
        final var names = new HashMap<String, PlannedField>();
        for (PlannedField f : fields) {
            names.putIfAbsent(f.name(), f);
        }
        this.byName = Map.copyOf(names);
    }

    public Class<?> type() {
        return type;
    }

    public List<PlannedField> fields() {
        return fields;
    }

    /// Finds the field for an object key: an exact name match first, otherwise
    /// the first field whose name matches ignoring case.
    public PlannedField lookup(String key) {
        final PlannedField exact = byName.get(key);
        if (exact != null) {
            return exact;
        }
        for (PlannedField f : fields) {
            if (f.name().equalsIgnoreCase(key)) {
                return f;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "FieldPlan[" + type.getName() + " " + fields + "]";
    }
}
