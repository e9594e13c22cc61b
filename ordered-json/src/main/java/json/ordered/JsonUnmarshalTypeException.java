package json.ordered;

import java.lang.reflect.Type;

/// Thrown when a JSON value cannot be stored into the requested Java type,
/// for example a JSON string into an `int` field, or a number that overflows
/// its target.
///
/// Decoding does not stop at the first mismatch: the offending value is
/// skipped, the remaining members are still applied and the first mismatch
/// is thrown once the whole document has been consumed.
public class JsonUnmarshalTypeException extends JsonException {

    private static final long serialVersionUID = 1L;

    private final String value;
    private final transient Type type;
    private final long offset;
    private final String struct;
    private final String field;

    /// Creates a mismatch report.
    /// @param value description of the JSON value, e.g. `string` or `number 300`
    /// @param type the Java type the value could not be stored into
    /// @param offset number of bytes read before the value
    /// @param struct simple name of the enclosing aggregate, or null at top level
    /// @param field dotted path of member names leading to the value, or null
    public JsonUnmarshalTypeException(String value, Type type, long offset, String struct, String field) {
        super(formatMessage(value, type, struct, field));
        this.value = value;
        this.type = type;
        this.offset = offset;
        this.struct = struct;
        this.field = field;
    }

    /// Returns the description of the JSON value.
    public String value() {
        return value;
    }

    /// Returns the Java type that could not hold the value.
    public Type type() {
        return type;
    }

    /// Returns the number of bytes read before the value.
    public long offset() {
        return offset;
    }

    /// Returns the enclosing aggregate's simple name, or null.
    public String struct() {
        return struct;
    }

    /// Returns the dotted member path of the value, or null.
    public String field() {
        return field;
    }

    private static String formatMessage(String value, Type type, String struct, String field) {
        final var sb = new StringBuilder("json: cannot unmarshal ").append(value);
        if (struct != null || field != null) {
            sb.append(" into field ").append(struct == null ? "" : struct).append('.').append(field == null ? "" : field);
        } else {
            sb.append(" into value");
        }
        return sb.append(" of type ").append(type.getTypeName()).toString();
    }
}
