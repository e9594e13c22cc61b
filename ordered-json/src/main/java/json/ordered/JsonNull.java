package json.ordered;

/// The JSON `null` literal.
public final class JsonNull implements JsonValue {

    private static final JsonNull INSTANCE = new JsonNull();

    private JsonNull() {
    }

    /// Returns the shared `null` value.
    public static JsonNull of() {
        return INSTANCE;
    }

    @Override
    public boolean isNull() {
        return true;
    }

    @Override
    public String toString() {
        return "null";
    }
}
