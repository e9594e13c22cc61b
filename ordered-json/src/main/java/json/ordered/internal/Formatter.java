package json.ordered.internal;

import java.io.ByteArrayOutputStream;

/// Byte level reformatting of JSON text: compaction, indentation and HTML
/// escaping. Callers validate the input first.
public final class Formatter {

    private Formatter() {
    }

    /// Appends `src` with insignificant whitespace removed.
    ///
    /// With `escapeHtml` set, `<`, `>`, `&`, U+2028 and U+2029 are replaced by
    /// their `\\u` escapes; they can only occur inside strings of valid input.
    public static void compact(ByteArrayOutputStream out, byte[] src, boolean escapeHtml) {
        boolean inString = false;
        for (int i = 0; i < src.length; i++) {
            final int c = src[i] & 0xFF;
            if (inString) {
                if (c == '\\') {
                    out.write(c);
                    out.write(src[++i]);
                    continue;
                }
                if (c == '"') {
                    inString = false;
                }
            } else if (JsonParser.isSpace(c)) {
                continue;
            } else if (c == '"') {
                inString = true;
            }
            if (escapeHtml && htmlSensitive(src, i)) {
                i += escapeHtmlAt(out, src, i);
                continue;
            }
            out.write(c);
        }
    }

    /// Appends `src` with one member or element per line.
    ///
    /// Each new line starts with `prefix` followed by one copy of `indent` per
    /// nesting level; the first line is not prefixed. Empty arrays and objects
    /// stay on one line and a space follows every colon. Whitespace after the
    /// value is copied as is.
    public static void indent(ByteArrayOutputStream out, byte[] src, String prefix, String indent) {
        final byte[] pre = prefix.getBytes(java.nio.charset.StandardCharsets.UTF_8);
        final byte[] ind = indent.getBytes(java.nio.charset.StandardCharsets.UTF_8);
        boolean inString = false;
        boolean needIndent = false;
        int depth = 0;
        int last = src.length - 1;
        while (last >= 0 && JsonParser.isSpace(src[last])) {
            last--;
        }
        for (int i = 0; i <= last; i++) {
            final int c = src[i] & 0xFF;
            if (!inString && JsonParser.isSpace(c)) {
                continue;
            }
            if (needIndent && c != '}' && c != ']') {
                needIndent = false;
                depth++;
                newline(out, pre, ind, depth);
            }
            if (inString) {
                out.write(c);
                if (c == '\\') {
                    out.write(src[++i]);
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> {
                    inString = true;
                    out.write(c);
                }
                case '{', '[' -> {
                    needIndent = true;
                    out.write(c);
                }
                case ',' -> {
                    out.write(c);
                    newline(out, pre, ind, depth);
                }
                case ':' -> {
                    out.write(c);
                    out.write(' ');
                }
                case '}', ']' -> {
                    if (needIndent) {
                        needIndent = false;
                    } else {
                        depth--;
                        newline(out, pre, ind, depth);
                    }
                    out.write(c);
                }
                default -> out.write(c);
            }
        }
        out.write(src, last + 1, src.length - last - 1);
    }

    /// Appends `src` with `<`, `>`, `&`, U+2028 and U+2029 escaped wherever
    /// they occur.
    public static void htmlEscape(ByteArrayOutputStream out, byte[] src) {
        for (int i = 0; i < src.length; i++) {
            if (htmlSensitive(src, i)) {
                i += escapeHtmlAt(out, src, i);
            } else {
                out.write(src[i]);
            }
        }
    }

    private static boolean htmlSensitive(byte[] src, int i) {
        final int c = src[i] & 0xFF;
        if (c == '<' || c == '>' || c == '&') {
            return true;
        }
        return c == 0xE2 && i + 2 < src.length && (src[i + 1] & 0xFF) == 0x80 && (src[i + 2] & 0xFE) == 0xA8;
    }

    /// Writes the escape for the sensitive character at `i` and returns the
    /// number of extra bytes it occupied.
    private static int escapeHtmlAt(ByteArrayOutputStream out, byte[] src, int i) {
        final int c = src[i] & 0xFF;
        if (c == 0xE2) {
            Escaper.unicode(out, 0x2028 | (src[i + 2] & 1));
            return 2;
        }
        Escaper.unicode(out, c);
        return 0;
    }

    private static void newline(ByteArrayOutputStream out, byte[] prefix, byte[] indent, int depth) {
        out.write('\n');
        out.writeBytes(prefix);
        for (int i = 0; i < depth; i++) {
            out.writeBytes(indent);
        }
    }
}
