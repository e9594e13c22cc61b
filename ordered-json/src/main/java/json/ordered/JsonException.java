package json.ordered;

/// Base class of every failure reported by the codec.
///
/// All codec failures are unchecked: malformed input and values with no JSON
/// representation are reported to the caller, never swallowed.
public class JsonException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /// Creates a new exception with the given message.
    public JsonException(String message) {
        super(message);
    }

    /// Creates a new exception with the given message and cause.
    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
