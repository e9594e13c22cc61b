package json.ordered;

/// A type that encodes itself.
///
/// The returned bytes must be one well-formed JSON value; they are checked,
/// compacted and HTML-escaped before being written. A class may also declare
/// `public static byte[] marshalNullJson()`, which is called in place of
/// emitting `null` when a field or element declared with that class holds
/// `null`.
public interface JsonMarshaler {

    byte[] marshalJson();
}
