package json.ordered;

/// Thrown by a decoder configured with {@link JsonDecoder#strictUtf8()} when a
/// string literal contains a byte sequence that is not valid UTF-8. Without
/// that setting such bytes decode to U+FFFD.
public class JsonInvalidUtf8Exception extends JsonException {

    private static final long serialVersionUID = 1L;

    private final long offset;

    /// Creates a new report.
    /// @param offset number of bytes read before the invalid sequence
    public JsonInvalidUtf8Exception(long offset) {
        super("json: invalid UTF-8 in string literal at offset " + offset);
        this.offset = offset;
    }

    /// Returns the number of bytes read before the invalid sequence.
    public long offset() {
        return offset;
    }
}
