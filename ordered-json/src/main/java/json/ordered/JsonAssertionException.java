package json.ordered;

/// Thrown when a {@link JsonValue} accessor is used on the wrong kind of
/// value, or a lookup finds nothing.
public class JsonAssertionException extends JsonException {

    private static final long serialVersionUID = 1L;

    /// Creates a new exception with the given message.
    public JsonAssertionException(String message) {
        super(message);
    }

    static JsonAssertionException typeMismatch(JsonValue actual, String expected) {
        return new JsonAssertionException(
                "%s is not a %s".formatted(actual.getClass().getSimpleName(), expected));
    }
}
