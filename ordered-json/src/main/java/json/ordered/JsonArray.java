package json.ordered;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/// An ordered sequence of JSON values.
public record JsonArray(List<JsonValue> elements) implements JsonValue, Iterable<JsonValue> {

    public JsonArray {
        elements = List.copyOf(elements);
    }

    /// Returns an array of the given values.
    public static JsonArray of(JsonValue... values) {
        return new JsonArray(List.of(values));
    }

    /// Returns an array of the given values.
    public static JsonArray of(List<? extends JsonValue> values) {
        return new JsonArray(List.copyOf(values));
    }

    /// Returns a builder for a new array.
    public static Builder builder() {
        return new Builder();
    }

    /// Returns the element at the given position.
    public JsonValue get(int index) {
        return elements.get(index);
    }

    /// Returns the number of elements.
    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public Iterator<JsonValue> iterator() {
        return elements.iterator();
    }

    @Override
    public JsonArray asArray() {
        return this;
    }

    @Override
    public String toString() {
        return Json.encodeToString(this);
    }

    /// Appends values in order.
    public static final class Builder {
        private final List<JsonValue> elements = new ArrayList<>();

        private Builder() {
        }

        public Builder add(JsonValue value) {
            elements.add(java.util.Objects.requireNonNull(value, "value"));
            return this;
        }

        /// Appends the value model form of a host value.
        public Builder addValue(Object host) {
            return add(Json.toValue(host));
        }

        public JsonArray build() {
            return new JsonArray(elements);
        }
    }
}
