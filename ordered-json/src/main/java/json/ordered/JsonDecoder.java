package json.ordered;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.Objects;
import java.util.logging.Logger;

import json.ordered.internal.JsonParser;
import json.ordered.internal.Unmarshaller;

/// Reads a sequence of JSON values from a stream, one per call.
///
/// Values may follow each other directly or be separated by whitespace. Each
/// value is read up to its end before anything is decoded, and checked in full,
/// so the stream is never consumed past the value being returned. Offsets in
/// exceptions count from the start of the stream.
///
/// ```java
/// var dec = new JsonDecoder(in).disallowUnknownFields();
/// while (dec.more()) {
///     Tx tx = dec.decode(Tx.class);
/// }
/// ```
/// Numbers decoded into `Object` or {@link JsonValue} targets are kept as
/// {@link JsonNumber} text.
public final class JsonDecoder {

    private static final Logger LOG = Logger.getLogger(JsonDecoder.class.getName());

    private static final int INITIAL_BUFFER = 4096;

    private final InputStream in;
    private byte[] buf = new byte[INITIAL_BUFFER];
    private int scanp;
    private int limit;
    private long scanned;
    private boolean eof;

    private boolean disallowUnknownFields;
    private boolean allowIntegralExponents;
    private boolean strictUtf8;

    public JsonDecoder(InputStream in) {
        this.in = Objects.requireNonNull(in, "in");
    }

    /// Reports object keys that match no field as an error instead of ignoring them.
    public JsonDecoder disallowUnknownFields() {
        this.disallowUnknownFields = true;
        return this;
    }

    /// Accepts numbers such as `1e3` or `2.0` for integer targets when their
    /// value is integral.
    public JsonDecoder allowIntegralExponents() {
        this.allowIntegralExponents = true;
        return this;
    }

    /// Rejects strings holding invalid UTF-8 with {@link JsonInvalidUtf8Exception}
    /// instead of replacing the bytes with U+FFFD.
    public JsonDecoder strictUtf8() {
        this.strictUtf8 = true;
        return this;
    }

    /// Reads the next value into the value model.
    /// @throws UncheckedIOException wrapping {@link EOFException} when no value is left
    /// @throws JsonSyntaxException if the next value is malformed or cut short
    public JsonValue decode() {
        final int end = nextValue();
        final var parser = new JsonParser(buf, scanp, end, scanned + scanp, strictUtf8);
        try {
            return parser.readValue();
        } finally {
            scanp = end;
        }
    }

    /// Reads the next value into a new value of the given class.
    @SuppressWarnings("unchecked")
    public <T> T decode(Class<T> type) {
        return (T) decodeType(type, null);
    }

    /// Reads the next value into a new value of a generic type.
    @SuppressWarnings("unchecked")
    public <T> T decode(TypeRef<T> type) {
        return (T) decodeType(type.type(), null);
    }

    /// Reads the next value into an existing object, see {@link Json#decodeInto}.
    public <T> T decodeInto(T target) {
        Json.checkTarget(target);
        decodeType(target.getClass(), target);
        return target;
    }

    /// Returns true if another value follows in the current array or object,
    /// or at top level, before the end of the stream.
    public boolean more() {
        skipSpace();
        return scanp < limit && buf[scanp] != ']' && buf[scanp] != '}';
    }

    /// Returns the number of bytes consumed so far, up to the end of the last
    /// value read.
    public long inputOffset() {
        return scanned + scanp;
    }

    private Object decodeType(Type type, Object existing) {
        final int end = nextValue();
        final var parser = new JsonParser(buf, scanp, end, scanned + scanp, strictUtf8);
        try {
            return new Unmarshaller(parser, disallowUnknownFields, allowIntegralExponents).unmarshal(type, existing);
        } finally {
            scanp = end;
        }
    }

    /// Buffers the next value and checks it. On return `buf[scanp]` is its first
    /// byte and the returned index is just past its last one.
    private int nextValue() {
        skipSpace();
        if (scanp == limit) {
            throw new UncheckedIOException(new EOFException("no more JSON values"));
        }
        final int first = buf[scanp];
        int n;
        if (first == '{' || first == '[') {
            n = scanContainer();
        } else if (first == '"') {
            n = scanString();
        } else {
            n = 0;
            while (available(n) && !isDelimiter(buf[scanp + n])) {
                n++;
            }
            n = Math.max(n, 1);
        }
        final int end = scanp + n;
        JsonParser.validate(buf, scanp, end, scanned + scanp);
        final long at = scanned + scanp;
        final int length = n;
        LOG.finer(() -> "Read value of " + length + " bytes at offset " + at);
        return end;
    }

    private int scanContainer() {
        int n = 0;
        int depth = 0;
        boolean inString = false;
        boolean escape = false;
        while (available(n)) {
            final int b = buf[scanp + n++];
            if (inString) {
                if (escape) {
                    escape = false;
                } else if (b == '\\') {
                    escape = true;
                } else if (b == '"') {
                    inString = false;
                }
            } else if (b == '"') {
                inString = true;
            } else if (b == '{' || b == '[') {
                depth++;
            } else if (b == '}' || b == ']') {
                if (--depth == 0) {
                    break;
                }
            }
        }
        return n;
    }

    private int scanString() {
        int n = 1;
        boolean escape = false;
        while (available(n)) {
            final int b = buf[scanp + n++];
            if (escape) {
                escape = false;
            } else if (b == '\\') {
                escape = true;
            } else if (b == '"') {
                break;
            }
        }
        return n;
    }

    private static boolean isDelimiter(int b) {
        return JsonParser.isSpace(b) || b == '{' || b == '}' || b == '[' || b == ']'
                || b == ',' || b == ':' || b == '"';
    }

    private void skipSpace() {
        while (available(0) && JsonParser.isSpace(buf[scanp])) {
            scanp++;
        }
    }

    /// Returns true if `buf[scanp + n]` holds data, reading more if needed.
    private boolean available(int n) {
        while (scanp + n >= limit) {
            if (!fill()) {
                return false;
            }
        }
        return true;
    }

    private boolean fill() {
        if (eof) {
            return false;
        }
        if (scanp > 0) {
            System.arraycopy(buf, scanp, buf, 0, limit - scanp);
            scanned += scanp;
            limit -= scanp;
            scanp = 0;
        }
        if (limit == buf.length) {
            buf = Arrays.copyOf(buf, buf.length * 2);
        }
        final int read;
        try {
            read = in.read(buf, limit, buf.length - limit);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (read < 0) {
            eof = true;
            return false;
        }
        limit += read;
        return true;
    }
}
