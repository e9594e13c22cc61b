package json.ordered;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.logging.Logger;

import json.ordered.internal.Formatter;
import json.ordered.internal.Marshaller;

/// Writes a sequence of values to a stream, each followed by a newline.
///
/// ```java
/// var enc = new JsonEncoder(out).setIndent("", "  ");
/// enc.encode(block);
/// enc.encode(tx);
/// ```
/// A value that fails to encode writes nothing.
public final class JsonEncoder {

    private static final Logger LOG = Logger.getLogger(JsonEncoder.class.getName());

    private final OutputStream out;
    private boolean escapeHtml = true;
    private String prefix = "";
    private String indent = "";

    public JsonEncoder(OutputStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    /// Writes one value and a newline.
    /// @throws UncheckedIOException if the stream fails
    public void encode(Object value) {
        byte[] bytes = Marshaller.marshal(value, escapeHtml);
        if (!prefix.isEmpty() || !indent.isEmpty()) {
            final var indented = new ByteArrayOutputStream(bytes.length * 2);
            Formatter.indent(indented, bytes, prefix, indent);
            bytes = indented.toByteArray();
        }
        try {
            out.write(bytes);
            out.write('\n');
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        final int written = bytes.length + 1;
        LOG.finer(() -> "Wrote " + written + " bytes");
    }

    /// Turns HTML-safe escaping of `& ' + < >` and the backquote on or off.
    public JsonEncoder setEscapeHtml(boolean escapeHtml) {
        this.escapeHtml = escapeHtml;
        return this;
    }

    /// Writes values over several lines, see {@link Json#encodeIndent}.
    public JsonEncoder setIndent(String prefix, String indent) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.indent = Objects.requireNonNull(indent, "indent");
        return this;
    }
}
