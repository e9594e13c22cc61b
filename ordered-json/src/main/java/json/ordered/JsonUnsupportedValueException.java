package json.ordered;

/// Thrown when a value has no JSON representation: `NaN` and the
/// infinities, a cyclic reference, a map key that is neither string-like
/// nor a {@link TextMarshaler}, or a {@link JsonNumber} whose text is not a
/// number.
public class JsonUnsupportedValueException extends JsonException {

    private static final long serialVersionUID = 1L;

    private final String value;

    /// Creates a report for the given rendering of the offending value.
    public JsonUnsupportedValueException(String value) {
        super("json: unsupported value: " + value);
        this.value = value;
    }

    /// Returns a short rendering of the offending value.
    public String value() {
        return value;
    }
}
