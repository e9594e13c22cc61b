package json.ordered;

/// A type that decodes itself from the exact bytes of a JSON value.
///
/// Called for every value including the `null` literal.
public interface JsonUnmarshaler {

    void unmarshalJson(byte[] json);
}
