package json.ordered.internal;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/// Writes JSON string literals in the canonical wire form.
///
/// Output is always pure ASCII:
///
/// - printable ASCII is literal except `"` (written `\\u0022`) and `\` (written `\\`);
///   in HTML mode `& ' + < >` and the backquote are escaped as well
/// - backspace, tab, newline, form feed and carriage return use their short escapes,
///   every other control character and DEL is `\\u00XX`
/// - every non-ASCII code point is `\\uXXXX`, supplementary ones as a surrogate pair
/// - each byte of an invalid UTF-8 sequence is `\\u00XX` carrying the byte value
/// - a lone surrogate in a `String` is `\\uFFFD`
///
/// Hex digits are upper case. The `String` and `byte[]` paths produce identical
/// output for the same text.
public final class Escaper {

    private static final byte[] HEX = "0123456789ABCDEF".getBytes(StandardCharsets.US_ASCII);

    private static final boolean[] SAFE = new boolean[128];
    private static final boolean[] HTML_SAFE = new boolean[128];

    static {
        for (int c = 0x20; c < 0x7F; c++) {
            SAFE[c] = c != '"' && c != '\\';
            HTML_SAFE[c] = SAFE[c] && "&'+<>`".indexOf(c) < 0;
        }
    }

    private Escaper() {
    }

    /// Returns the quoted literal for the given text.
    public static String quote(String s, boolean html) {
        final var out = new ByteArrayOutputStream(s.length() + 2);
        appendString(out, s, html);
        return out.toString(StandardCharsets.US_ASCII);
    }

    /// Returns the quoted literal for the given nominally UTF-8 bytes.
    public static String quote(byte[] b, boolean html) {
        final var out = new ByteArrayOutputStream(b.length + 2);
        appendBytes(out, b, html);
        return out.toString(StandardCharsets.US_ASCII);
    }

    /// Appends the quoted literal for the given text.
    public static void appendString(ByteArrayOutputStream out, String s, boolean html) {
        final boolean[] safe = html ? HTML_SAFE : SAFE;
        out.write('"');
        final int n = s.length();
        for (int i = 0; i < n; i++) {
            final char c = s.charAt(i);
            if (c < 0x80) {
                if (safe[c]) {
                    out.write(c);
                } else {
                    escapeAscii(out, c);
                }
            } else if (Character.isHighSurrogate(c) && i + 1 < n && Character.isLowSurrogate(s.charAt(i + 1))) {
                unicode(out, c);
                unicode(out, s.charAt(++i));
            } else if (Character.isSurrogate(c)) {
                unicode(out, 0xFFFD);
            } else {
                unicode(out, c);
            }
        }
        out.write('"');
    }

    /// Appends the quoted literal for the given nominally UTF-8 bytes.
    public static void appendBytes(ByteArrayOutputStream out, byte[] b, boolean html) {
        final boolean[] safe = html ? HTML_SAFE : SAFE;
        out.write('"');
        int i = 0;
        while (i < b.length) {
            final int c = b[i] & 0xFF;
            if (c < 0x80) {
                if (safe[c]) {
                    out.write(c);
                } else {
                    escapeAscii(out, c);
                }
                i++;
                continue;
            }
            final int d = Utf8.decode(b, i, b.length);
            if (d == Utf8.INVALID) {
                unicode(out, c);
                i++;
                continue;
            }
            final int cp = Utf8.codePoint(d);
            if (cp >= 0x10000) {
                unicode(out, Character.highSurrogate(cp));
                unicode(out, Character.lowSurrogate(cp));
            } else {
                unicode(out, cp);
            }
            i += Utf8.length(d);
        }
        out.write('"');
    }

    /// Writes `\\uXXXX` for a UTF-16 unit.
    static void unicode(ByteArrayOutputStream out, int unit) {
        out.write('\\');
        out.write('u');
        out.write(HEX[(unit >> 12) & 0xF]);
        out.write(HEX[(unit >> 8) & 0xF]);
        out.write(HEX[(unit >> 4) & 0xF]);
        out.write(HEX[unit & 0xF]);
    }

    private static void escapeAscii(ByteArrayOutputStream out, int c) {
        switch (c) {
            case '\\' -> {
                out.write('\\');
                out.write('\\');
            }
            case '\b' -> shortEscape(out, 'b');
            case '\t' -> shortEscape(out, 't');
            case '\n' -> shortEscape(out, 'n');
            case '\f' -> shortEscape(out, 'f');
            case '\r' -> shortEscape(out, 'r');
            default -> unicode(out, c);
        }
    }

    private static void shortEscape(ByteArrayOutputStream out, char c) {
        out.write('\\');
        out.write(c);
    }
}
