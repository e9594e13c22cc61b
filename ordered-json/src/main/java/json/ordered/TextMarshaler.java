package json.ordered;

/// A type that encodes itself as text. The text is emitted as a JSON string,
/// and also used as the key when the type is a map key.
public interface TextMarshaler {

    String marshalText();
}
