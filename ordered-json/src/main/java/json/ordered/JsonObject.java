package json.ordered;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/// An ordered sequence of {@link Member}s.
///
/// Keys are not required to be unique: duplicates stay where they were
/// inserted and are re-emitted verbatim. {@link #get(String)} returns the
/// first member with a key, {@link #getAll(String)} every one of them.
public record JsonObject(List<Member> members) implements JsonValue, Iterable<Member> {

    public JsonObject {
        members = List.copyOf(members);
    }

    /// Returns an object with the given members, in order.
    public static JsonObject of(Member... members) {
        return new JsonObject(List.of(members));
    }

    /// Returns an empty object.
    public static JsonObject empty() {
        return new JsonObject(List.of());
    }

    /// Returns a builder for a new object.
    public static Builder builder() {
        return new Builder();
    }

    /// Returns the value of the first member with the given key.
    public Optional<JsonValue> get(String key) {
        for (Member m : members) {
            if (m.key().equals(key)) {
                return Optional.of(m.value());
            }
        }
        return Optional.empty();
    }

    /// Returns the values of all members with the given key, in order.
    public List<JsonValue> getAll(String key) {
        final var out = new ArrayList<JsonValue>();
        for (Member m : members) {
            if (m.key().equals(key)) {
                out.add(m.value());
            }
        }
        return List.copyOf(out);
    }

    /// Returns the value of the first member with the given key.
    /// @throws JsonAssertionException if there is no such member
    public JsonValue require(String key) {
        return get(key).orElseThrow(() -> new JsonAssertionException("no member named \"" + key + "\""));
    }

    /// Returns the member at the given position.
    public Member member(int index) {
        return members.get(index);
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    @Override
    public Iterator<Member> iterator() {
        return members.iterator();
    }

    @Override
    public JsonObject asObject() {
        return this;
    }

    @Override
    public String toString() {
        return Json.encodeToString(this);
    }

    /// Appends members in order. Adding an existing key appends another member.
    public static final class Builder {
        private final List<Member> members = new ArrayList<>();

        private Builder() {
        }

        public Builder add(String key, JsonValue value) {
            members.add(new Member(key, value));
            return this;
        }

        public Builder add(Member member) {
            members.add(java.util.Objects.requireNonNull(member, "member"));
            return this;
        }

        /// Appends a member holding the value model form of a host value.
        public Builder put(String key, Object host) {
            return add(key, Json.toValue(host));
        }

        public JsonObject build() {
            return new JsonObject(members);
        }
    }
}
