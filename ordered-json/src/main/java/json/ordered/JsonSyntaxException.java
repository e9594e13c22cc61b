package json.ordered;

/// Thrown when the input bytes are not well-formed JSON.
///
/// The offset is the number of bytes read before the error was detected,
/// so an offending byte at index `i` reports offset `i + 1` and an input
/// that ends too early reports its length.
public class JsonSyntaxException extends JsonException {

    private static final long serialVersionUID = 1L;

    private final long offset;

    /// Creates a new syntax exception.
    /// @param message description of the problem
    /// @param offset number of bytes read before the error
    public JsonSyntaxException(String message, long offset) {
        super(message);
        this.offset = offset;
    }

    /// Returns the number of bytes read before the error occurred.
    public long offset() {
        return offset;
    }
}
