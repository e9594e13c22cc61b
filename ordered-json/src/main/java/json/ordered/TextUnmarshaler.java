package json.ordered;

/// A type that decodes itself from the content of a JSON string.
public interface TextUnmarshaler {

    void unmarshalText(String text);
}
