package json.ordered.internal;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

import json.ordered.JsonEmbedded;
import json.ordered.JsonField;

/// Computes and caches the {@link FieldPlan} of aggregate types.
///
/// Fields are collected breadth first, one embedding level at a time. A field
/// is seen if it is public (record components always are); embedded
/// aggregates are entered whatever their own access. A superclass counts as
/// an aggregate embedded ahead of the class's own fields.
///
/// Among fields sharing a name, the shallowest wins. At equal depth a single
/// explicitly named field wins over the others; otherwise the name is dropped
/// altogether. An aggregate type embedded twice at the same level contributes
/// every field twice, so all of them cancel out.
///
/// Surviving fields keep declaration order, embedded fields taking the place
/// of the field that embeds them.
public final class FieldResolver {

    private static final Logger LOG = Logger.getLogger(FieldResolver.class.getName());

    private static final String TAG_PUNCTUATION = "!#$%&()*+-./:;<=>?@[]^_{|}~ ";

    private static final Map<Class<?>, FieldPlan> CACHE = new ConcurrentHashMap<>();

    private FieldResolver() {
    }

    /// Returns the plan for an aggregate type, building it on first use.
    ///
    /// Concurrent first uses may each build a plan; only the first one
    /// published is ever returned.
    public static FieldPlan plan(Class<?> type) {
        final FieldPlan cached = CACHE.get(type);
        if (cached != null) {
            return cached;
        }
        final FieldPlan built = build(type);
        final FieldPlan raced = CACHE.putIfAbsent(type, built);
        return raced != null ? raced : built;
    }

    /// Returns true if the name is usable as an explicit member name.
    public static boolean isValidName(String name) {
        if (name.isEmpty()) {
            return false;
        }
        return name.codePoints().allMatch(c ->
                TAG_PUNCTUATION.indexOf(c) >= 0 || Character.isLetter(c) || Character.isDigit(c));
    }

    private record Pending(Class<?> type, Field[] path, int[] index) {
    }

    /// A field of one aggregate as declared, before resolution.
    /// `field` is null for the superclass.
    private record Slot(Field field, Type type, boolean embedded, boolean visible, JsonField tag) {
    }

    static FieldPlan build(Class<?> root) {
        final List<PlannedField> fields = new ArrayList<>();
        final Set<Class<?>> visited = new HashSet<>();
        List<Pending> next = new ArrayList<>();
        next.add(new Pending(root, new Field[0], new int[0]));
        Map<Class<?>, Integer> nextCount = new HashMap<>();

        while (!next.isEmpty()) {
            final List<Pending> current = next;
            next = new ArrayList<>();
            final Map<Class<?>, Integer> count = nextCount;
            nextCount = new HashMap<>();

            for (Pending f : current) {
                if (!visited.add(f.type())) {
                    continue;
                }
                final List<Slot> slots = slots(f.type());
                for (int i = 0; i < slots.size(); i++) {
                    final Slot sf = slots.get(i);
                    final Class<?> ft = Types.raw(sf.type());
                    if (sf.embedded() && sf.field() != null) {
                        if (!Modifier.isPublic(ft.getModifiers()) && !Types.isEmbeddable(ft)) {
                            continue;
                        }
                    } else if (!sf.visible()) {
                        continue;
                    }
                    final JsonField tag = sf.tag();
                    if (tag != null && tag.exclude()) {
                        continue;
                    }
                    String name = tag != null ? tag.value() : "";
                    if (!isValidName(name)) {
                        name = "";
                    }
                    final int[] index = Arrays.copyOf(f.index(), f.index().length + 1);
                    index[index.length - 1] = i;
                    final Field[] path;
                    if (sf.field() != null) {
                        sf.field().setAccessible(true);
                        path = Arrays.copyOf(f.path(), f.path().length + 1);
                        path[path.length - 1] = sf.field();
                    } else {
                        path = f.path();
                    }

                    if (sf.field() != null && (!name.isEmpty() || !sf.embedded() || !Types.isEmbeddable(ft))) {
                        final boolean tagged = !name.isEmpty();
                        if (!tagged) {
                            name = sf.embedded() ? ft.getSimpleName() : sf.field().getName();
                        }
                        final boolean quoted = tag != null && tag.string() && Types.isQuotable(sf.type());
                        final var planned = new PlannedField(name, tagged, path, index, sf.type(),
                                tag != null && tag.omitEmpty(), quoted);
                        fields.add(planned);
                        if (count.getOrDefault(f.type(), 0) > 1) {
                            fields.add(planned);
                        }
                        continue;
                    }

                    if (nextCount.merge(ft, 1, Integer::sum) == 1) {
                        next.add(new Pending(ft, path, index));
                    }
                }
            }
        }

        fields.sort(FieldResolver::byNameDepthTag);

        final List<PlannedField> out = new ArrayList<>();
        int advance;
        for (int i = 0; i < fields.size(); i += advance) {
            final PlannedField fi = fields.get(i);
            advance = 1;
            while (i + advance < fields.size() && fields.get(i + advance).name().equals(fi.name())) {
                advance++;
            }
            if (advance == 1) {
                out.add(fi);
                continue;
            }
            final PlannedField dominant = dominant(fields.subList(i, i + advance));
            if (dominant != null) {
                out.add(dominant);
            }
        }
        out.sort(FieldResolver::byIndex);

        final var plan = new FieldPlan(root, out);
        LOG.fine(() -> "Built " + plan);
        return plan;
    }

    /// Orders by name, then shallowest first, then tagged first, then declaration order.
    private static int byNameDepthTag(PlannedField x, PlannedField y) {
        final int byName = MapKeys.compare(x.name(), y.name());
        if (byName != 0) {
            return byName;
        }
        if (x.depth() != y.depth()) {
            return Integer.compare(x.depth(), y.depth());
        }
        if (x.tagged() != y.tagged()) {
            return x.tagged() ? -1 : 1;
        }
        return byIndex(x, y);
    }

    private static int byIndex(PlannedField x, PlannedField y) {
        return Arrays.compare(x.index(), y.index());
    }

    /// Picks the field that owns a contested name, or null when the name is
    /// ambiguous. The candidates are sorted shallowest first, tagged first.
    private static PlannedField dominant(List<PlannedField> candidates) {
        final PlannedField first = candidates.get(0);
        final PlannedField second = candidates.get(1);
        if (first.depth() == second.depth() && first.tagged() == second.tagged()) {
            return null;
        }
        return first;
    }

    private static List<Slot> slots(Class<?> type) {
        final List<Slot> slots = new ArrayList<>();
        if (type.isRecord()) {
            for (RecordComponent rc : type.getRecordComponents()) {
                final Field field;
                try {
                    field = type.getDeclaredField(rc.getName());
                } catch (NoSuchFieldException e) {
                    throw new IllegalStateException("record component without field: " + rc, e);
                }
                slots.add(new Slot(field, rc.getGenericType(), rc.isAnnotationPresent(JsonEmbedded.class),
                        true, rc.getAnnotation(JsonField.class)));
            }
            return slots;
        }
        final Class<?> superclass = type.getSuperclass();
        if (superclass != null && superclass != Object.class && !Types.isPlatform(superclass)) {
            slots.add(new Slot(null, superclass, true, true, null));
        }
        for (Field field : type.getDeclaredFields()) {
            final int mods = field.getModifiers();
            if (Modifier.isStatic(mods) || Modifier.isTransient(mods) || field.isSynthetic()) {
                continue;
            }
            slots.add(new Slot(field, field.getGenericType(), field.isAnnotationPresent(JsonEmbedded.class),
                    Modifier.isPublic(mods), field.getAnnotation(JsonField.class)));
        }
        return slots;
    }
}
