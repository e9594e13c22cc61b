package json.ordered.internal;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import json.ordered.JsonArray;
import json.ordered.JsonBoolean;
import json.ordered.JsonInvalidUtf8Exception;
import json.ordered.JsonNull;
import json.ordered.JsonNumber;
import json.ordered.JsonObject;
import json.ordered.JsonString;
import json.ordered.JsonSyntaxException;
import json.ordered.JsonValue;
import json.ordered.Member;

/// Reads JSON text held in a byte array.
///
/// The input is checked in full by {@link #validate} before anything is read,
/// so the reading methods assume well-formed input and never report syntax
/// errors themselves. Offsets reported to callers are relative to the start
/// of the stream the bytes came from, see `base`.
public final class JsonParser {

    /// Deepest nesting of arrays and objects accepted.
    public static final int MAX_DEPTH = 10000;

    private static final char REPLACEMENT = (char) 0xFFFD;
    private static final byte OBJECT = 1;
    private static final byte ARRAY = 2;

    private final byte[] buf;
    private final int from;
    private final int end;
    private final long base;
    private final boolean strictUtf8;
    private int pos;

    /// Creates a reader over `buf[from, end)`.
    /// @param base stream offset of `buf[from]`
    /// @param strictUtf8 reject invalid UTF-8 in strings instead of replacing it
    public JsonParser(byte[] buf, int from, int end, long base, boolean strictUtf8) {
        this.buf = buf;
        this.from = from;
        this.end = end;
        this.base = base;
        this.strictUtf8 = strictUtf8;
        this.pos = from;
    }

    /// Creates a reader over a whole array.
    public JsonParser(byte[] buf) {
        this(buf, 0, buf.length, 0, false);
    }

    /// Checks and parses a complete document into the value model.
    public static JsonValue parse(byte[] buf) {
        validate(buf, 0, buf.length, 0);
        return new JsonParser(buf).readValue();
    }

    /// Checks that `buf[from, end)` holds exactly one JSON value, optionally
    /// surrounded by whitespace.
    /// @throws JsonSyntaxException describing the first offending byte
    public static void validate(byte[] buf, int from, int end, long base) {
        new Validator(buf, from, end, base).run();
    }

    /// Returns true if the bytes hold exactly one JSON value.
    public static boolean isValid(byte[] buf) {
        try {
            validate(buf, 0, buf.length, 0);
            return true;
        } catch (JsonSyntaxException e) {
            return false;
        }
    }

    // ---- reading, input already validated ----

    /// Returns the first byte of the next value, skipping whitespace.
    public int peek() {
        skipWhitespace();
        return buf[pos];
    }

    /// Returns the stream offset of the current position.
    public long offset() {
        return base + (pos - from);
    }

    /// Returns the current index into the buffer.
    public int position() {
        return pos;
    }

    /// Returns the backing buffer.
    public byte[] buffer() {
        return buf;
    }

    /// Reads the next value into the value model.
    public JsonValue readValue() {
        final int c = peek();
        switch (c) {
            case '{' -> {
                final var members = new ArrayList<Member>();
                beginObject();
                while (nextMember()) {
                    final String key = readKey();
                    members.add(new Member(key, readValue()));
                }
                return new JsonObject(members);
            }
            case '[' -> {
                final List<JsonValue> elements = new ArrayList<>();
                beginArray();
                while (nextElement()) {
                    elements.add(readValue());
                }
                return new JsonArray(elements);
            }
            case '"' -> {
                return new JsonString(readString());
            }
            case 't' -> {
                pos += 4;
                return JsonBoolean.TRUE;
            }
            case 'f' -> {
                pos += 5;
                return JsonBoolean.FALSE;
            }
            case 'n' -> {
                pos += 4;
                return JsonNull.of();
            }
            default -> {
                return new JsonNumber(readNumber());
            }
        }
    }

    /// Skips the next value and returns the index just past it.
    public int skipValue() {
        final int c = peek();
        switch (c) {
            case '{', '[' -> {
                int depth = 0;
                do {
                    final int b = buf[pos];
                    if (b == '"') {
                        skipString();
                        continue;
                    }
                    if (b == '{' || b == '[') {
                        depth++;
                    } else if (b == '}' || b == ']') {
                        depth--;
                    }
                    pos++;
                } while (depth > 0);
            }
            case '"' -> skipString();
            case 't', 'n' -> pos += 4;
            case 'f' -> pos += 5;
            default -> readNumber();
        }
        return pos;
    }

    /// Consumes `{`.
    public void beginObject() {
        skipWhitespace();
        pos++;
    }

    /// Advances to the next member key, or consumes `}` and returns false.
    public boolean nextMember() {
        skipWhitespace();
        final int c = buf[pos];
        if (c == '}') {
            pos++;
            return false;
        }
        if (c == ',') {
            pos++;
            skipWhitespace();
        }
        return true;
    }

    /// Reads a member key and the following colon.
    public String readKey() {
        final String key = readString();
        skipWhitespace();
        pos++;
        return key;
    }

    /// Consumes `[`.
    public void beginArray() {
        skipWhitespace();
        pos++;
    }

    /// Advances to the next element, or consumes `]` and returns false.
    public boolean nextElement() {
        skipWhitespace();
        final int c = buf[pos];
        if (c == ']') {
            pos++;
            return false;
        }
        if (c == ',') {
            pos++;
        }
        return true;
    }

    /// Reads the text of a number.
    public String readNumber() {
        skipWhitespace();
        final int start = pos;
        while (pos < end && isNumberByte(buf[pos])) {
            pos++;
        }
        return new String(buf, start, pos - start, StandardCharsets.US_ASCII);
    }

    /// Reads a string literal and resolves its escapes.
    ///
    /// Escaped surrogates that do not form a pair and bytes that are not valid
    /// UTF-8 become U+FFFD, unless the reader is strict about UTF-8.
    public String readString() {
        skipWhitespace();
        pos++;
        final int start = pos;
        while (buf[pos] != '"' && buf[pos] != '\\' && buf[pos] > 0) {
            pos++;
        }
        if (buf[pos] == '"') {
            return new String(buf, start, pos++ - start, StandardCharsets.US_ASCII);
        }
        final var sb = new StringBuilder(pos - start + 16);
        for (int i = start; i < pos; i++) {
            sb.append((char) buf[i]);
        }
        while (true) {
            final int c = buf[pos] & 0xFF;
            if (c == '"') {
                pos++;
                return sb.toString();
            }
            if (c == '\\') {
                pos++;
                readEscape(sb);
            } else if (c < 0x80) {
                sb.append((char) c);
                pos++;
            } else {
                final int d = Utf8.decode(buf, pos, end);
                if (d == Utf8.INVALID) {
                    if (strictUtf8) {
                        throw new JsonInvalidUtf8Exception(offset());
                    }
                    sb.append(REPLACEMENT);
                    pos++;
                } else {
                    sb.appendCodePoint(Utf8.codePoint(d));
                    pos += Utf8.length(d);
                }
            }
        }
    }

    private void readEscape(StringBuilder sb) {
        final int c = buf[pos++];
        switch (c) {
            case 'b' -> sb.append('\b');
            case 'f' -> sb.append('\f');
            case 'n' -> sb.append('\n');
            case 'r' -> sb.append('\r');
            case 't' -> sb.append('\t');
            case 'u' -> {
                final int unit = hex4(pos);
                pos += 4;
                if (Character.isSurrogate((char) unit)) {
                    if (Character.isHighSurrogate((char) unit) && pos + 6 <= end
                            && buf[pos] == '\\' && buf[pos + 1] == 'u') {
                        final int low = hex4(pos + 2);
                        if (low >= 0 && Character.isLowSurrogate((char) low)) {
                            sb.append((char) unit).append((char) low);
                            pos += 6;
                            return;
                        }
                    }
                    sb.append(REPLACEMENT);
                } else {
                    sb.append((char) unit);
                }
            }
            default -> sb.append((char) c);
        }
    }

    private int hex4(int at) {
        int v = 0;
        for (int i = at; i < at + 4; i++) {
            final int h = Character.digit(buf[i], 16);
            if (h < 0) {
                return -1;
            }
            v = (v << 4) | h;
        }
        return v;
    }

    private void skipString() {
        pos++;
        while (true) {
            final int c = buf[pos];
            if (c == '"') {
                pos++;
                return;
            }
            pos += c == '\\' ? 2 : 1;
        }
    }

    private void skipWhitespace() {
        while (pos < end && isSpace(buf[pos])) {
            pos++;
        }
    }

    public static boolean isSpace(int c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    private static boolean isNumberByte(int c) {
        return (c >= '0' && c <= '9') || c == '-' || c == '+' || c == '.' || c == 'e' || c == 'E';
    }

    /// Renders a byte the way syntax error messages quote it.
    static String quoteChar(int c) {
        if (c == '\'') {
            return "'\\''";
        }
        if (c == '"') {
            return "'\"'";
        }
        final String s = switch (c) {
            case 7 -> "\\a";
            case '\b' -> "\\b";
            case '\f' -> "\\f";
            case '\n' -> "\\n";
            case '\r' -> "\\r";
            case '\t' -> "\\t";
            case 0x0B -> "\\v";
            case '\\' -> "\\\\";
            default -> {
                if (c < 0x20 || c == 0x7F) {
                    yield String.format("\\x%02x", c);
                }
                if (c >= 0x80 && c < 0xA0) {
                    yield String.format("\\u%04x", c);
                }
                yield String.valueOf((char) c);
            }
        };
        return "'" + s + "'";
    }

    /// Iterative syntax check, so that nesting depth is bounded by
    /// {@link #MAX_DEPTH} rather than the thread stack.
    private static final class Validator {
        private final byte[] buf;
        private final int from;
        private final int end;
        private final long base;
        private byte[] stack = new byte[32];
        private int depth;
        private int i;

        Validator(byte[] buf, int from, int end, long base) {
            this.buf = buf;
            this.from = from;
            this.end = end;
            this.base = base;
            this.i = from;
        }

        void run() {
            value();
            while (true) {
                if (depth == 0) {
                    skipSpace();
                    if (i < end) {
                        throw error("after top-level value");
                    }
                    return;
                }
                skipSpace();
                requireMore();
                final int c = buf[i];
                if (stack[depth - 1] == OBJECT) {
                    if (c == ',') {
                        i++;
                        key();
                        value();
                    } else if (c == '}') {
                        i++;
                        depth--;
                    } else {
                        throw error("after object key:value pair");
                    }
                } else {
                    if (c == ',') {
                        i++;
                        value();
                    } else if (c == ']') {
                        i++;
                        depth--;
                    } else {
                        throw error("after array element");
                    }
                }
            }
        }

        /// Scans one value; a container is left open on the stack.
        private void value() {
            skipSpace();
            requireMore();
            final int c = buf[i];
            switch (c) {
                case '{' -> {
                    push(OBJECT);
                    i++;
                    skipSpace();
                    requireMore();
                    if (buf[i] == '}') {
                        i++;
                        depth--;
                        return;
                    }
                    key();
                    value();
                }
                case '[' -> {
                    push(ARRAY);
                    i++;
                    skipSpace();
                    requireMore();
                    if (buf[i] == ']') {
                        i++;
                        depth--;
                        return;
                    }
                    value();
                }
                case '"' -> string();
                case 't' -> literal("true");
                case 'f' -> literal("false");
                case 'n' -> literal("null");
                default -> {
                    if (c == '-' || (c >= '0' && c <= '9')) {
                        number();
                    } else {
                        throw error("looking for beginning of value");
                    }
                }
            }
        }

        private void key() {
            skipSpace();
            requireMore();
            if (buf[i] != '"') {
                throw error("looking for beginning of object key string");
            }
            string();
            skipSpace();
            requireMore();
            if (buf[i] != ':') {
                throw error("after object key");
            }
            i++;
        }

        private void push(byte kind) {
            if (depth == MAX_DEPTH) {
                throw new JsonSyntaxException("exceeded max depth", base + (i - from) + 1);
            }
            if (depth == stack.length) {
                stack = java.util.Arrays.copyOf(stack, depth * 2);
            }
            stack[depth++] = kind;
        }

        private void string() {
            i++;
            while (true) {
                requireMore();
                final int c = buf[i] & 0xFF;
                if (c == '"') {
                    i++;
                    return;
                }
                if (c == '\\') {
                    i++;
                    requireMore();
                    final int e = buf[i];
                    if (e == 'u') {
                        i++;
                        for (int k = 0; k < 4; k++) {
                            requireMore();
                            if (Character.digit(buf[i], 16) < 0) {
                                throw error("in \\u hexadecimal character escape");
                            }
                            i++;
                        }
                        continue;
                    }
                    if ("\"\\/bfnrt".indexOf(e) < 0) {
                        throw error("in string escape code");
                    }
                    i++;
                    continue;
                }
                if (c < 0x20) {
                    throw error("in string literal");
                }
                i++;
            }
        }

        private void number() {
            if (buf[i] == '-') {
                i++;
                requireMore();
            }
            if (buf[i] == '0') {
                i++;
            } else if (buf[i] >= '1' && buf[i] <= '9') {
                i++;
                digits();
            } else {
                throw error("in numeric literal");
            }
            if (i < end && buf[i] == '.') {
                i++;
                requireMore();
                if (!isDigitAt()) {
                    throw error("after decimal point in numeric literal");
                }
                digits();
            }
            if (i < end && (buf[i] == 'e' || buf[i] == 'E')) {
                i++;
                requireMore();
                if (buf[i] == '+' || buf[i] == '-') {
                    i++;
                    requireMore();
                }
                if (!isDigitAt()) {
                    throw error("in exponent of numeric literal");
                }
                digits();
            }
        }

        private void digits() {
            while (i < end && isDigitAt()) {
                i++;
            }
        }

        private boolean isDigitAt() {
            return buf[i] >= '0' && buf[i] <= '9';
        }

        private void literal(String word) {
            i++;
            for (int k = 1; k < word.length(); k++) {
                requireMore();
                if (buf[i] != word.charAt(k)) {
                    throw error("in literal " + word + " (expecting " + quoteChar(word.charAt(k)) + ")");
                }
                i++;
            }
        }

        private void skipSpace() {
            while (i < end && isSpace(buf[i])) {
                i++;
            }
        }

        private void requireMore() {
            if (i >= end) {
                throw new JsonSyntaxException("unexpected end of JSON input", base + (end - from));
            }
        }

        private JsonSyntaxException error(String context) {
            return new JsonSyntaxException(
                    "invalid character " + quoteChar(buf[i] & 0xFF) + " " + context, base + (i - from) + 1);
        }
    }
}
