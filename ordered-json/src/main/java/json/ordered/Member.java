package json.ordered;

import java.util.Objects;

/// One key/value pair of a {@link JsonObject}, kept in position.
public record Member(String key, JsonValue value) {

    public Member {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    /// Returns a member with the given key and value.
    public static Member of(String key, JsonValue value) {
        return new Member(key, value);
    }
}
