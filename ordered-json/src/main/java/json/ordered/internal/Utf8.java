package json.ordered.internal;

/// UTF-8 decoding with the strict acceptance rules of the wire format:
/// no overlong forms, no encoded surrogates and nothing above U+10FFFF.
public final class Utf8 {

    /// Result of {@link #decode} for a byte that does not start a valid sequence.
    public static final int INVALID = -1;

    private Utf8() {
    }

    /// Decodes the sequence starting at `i`.
    ///
    /// @return `codePoint | (length << 24)`, or {@link #INVALID} when the bytes at
    ///         `i` do not form a valid sequence (in which case exactly one byte
    ///         should be consumed)
    public static int decode(byte[] b, int i, int end) {
        final int b0 = b[i] & 0xFF;
        if (b0 < 0x80) {
            return b0 | (1 << 24);
        }
        final int n = b0 < 0xC2 ? 0 : b0 < 0xE0 ? 2 : b0 < 0xF0 ? 3 : b0 < 0xF5 ? 4 : 0;
        if (n == 0 || i + n > end) {
            return INVALID;
        }
        final int b1 = b[i + 1] & 0xFF;
        int lo = 0x80;
        int hi = 0xBF;
        if (b0 == 0xE0) {
            lo = 0xA0;
        } else if (b0 == 0xED) {
            hi = 0x9F;
        } else if (b0 == 0xF0) {
            lo = 0x90;
        } else if (b0 == 0xF4) {
            hi = 0x8F;
        }
        if (b1 < lo || b1 > hi) {
            return INVALID;
        }
        if (n == 2) {
            return (((b0 & 0x1F) << 6) | (b1 & 0x3F)) | (2 << 24);
        }
        final int b2 = b[i + 2] & 0xFF;
        if (!continuation(b2)) {
            return INVALID;
        }
        if (n == 3) {
            return (((b0 & 0x0F) << 12) | ((b1 & 0x3F) << 6) | (b2 & 0x3F)) | (3 << 24);
        }
        final int b3 = b[i + 3] & 0xFF;
        if (!continuation(b3)) {
            return INVALID;
        }
        return (((b0 & 0x07) << 18) | ((b1 & 0x3F) << 12) | ((b2 & 0x3F) << 6) | (b3 & 0x3F)) | (4 << 24);
    }

    /// Extracts the code point from a successful {@link #decode} result.
    public static int codePoint(int decoded) {
        return decoded & 0xFFFFFF;
    }

    /// Extracts the sequence length from a successful {@link #decode} result.
    public static int length(int decoded) {
        return decoded >>> 24;
    }

    private static boolean continuation(int b) {
        return b >= 0x80 && b <= 0xBF;
    }
}
