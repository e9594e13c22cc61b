package json.ordered;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/// A span of bytes that already holds encoded JSON.
///
/// On encode the bytes are checked and compacted but otherwise emitted as
/// they are; a `null` span is emitted as `null`. On decode a `RawJson`
/// target receives the exact bytes of the matched value.
public record RawJson(byte[] bytes) implements JsonMarshaler {

    /// Wraps the UTF-8 encoding of the given text.
    public static RawJson of(String json) {
        return new RawJson(json.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] marshalJson() {
        if (bytes == null) {
            return "null".getBytes(StandardCharsets.US_ASCII);
        }
        return bytes;
    }

    public boolean isEmpty() {
        return bytes == null || bytes.length == 0;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RawJson other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return bytes == null ? "null" : new String(bytes, StandardCharsets.UTF_8);
    }
}
