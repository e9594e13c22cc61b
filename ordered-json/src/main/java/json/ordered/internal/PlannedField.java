package json.ordered.internal;

import java.io.ByteArrayOutputStream;
import java.lang.reflect.Field;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/// One member of a {@link FieldPlan}.
///
/// `path` holds the fields to follow from the aggregate to the value; steps
/// through a superclass are not part of it since they stay on the same
/// instance. `index` orders fields by declaration, with a superclass counted
/// before the fields of its subclass.
public final class PlannedField {

    private final String name;
    private final boolean tagged;
    private final Field[] path;
    private final int[] index;
    private final Type type;
    private final boolean omitEmpty;
    private final boolean quoted;
    private final byte[] htmlKey;
    private final byte[] plainKey;

    PlannedField(String name, boolean tagged, Field[] path, int[] index, Type type, boolean omitEmpty, boolean quoted) {
        this.name = name;
        this.tagged = tagged;
        this.path = path;
        this.index = index;
        this.type = type;
        this.omitEmpty = omitEmpty;
        this.quoted = quoted;
        final byte[] raw = name.getBytes(StandardCharsets.UTF_8);
        final var html = new ByteArrayOutputStream(raw.length + 3);
        html.write('"');
        Formatter.htmlEscape(html, raw);
        html.write('"');
        html.write(':');
        this.htmlKey = html.toByteArray();
        final var plain = new ByteArrayOutputStream(raw.length + 3);
        plain.write('"');
        plain.writeBytes(raw);
        plain.write('"');
        plain.write(':');
        this.plainKey = plain.toByteArray();
    }

    public String name() {
        return name;
    }

    /// True if the name came from an explicit {@link json.ordered.JsonField} name.
    public boolean tagged() {
        return tagged;
    }

    public Field[] path() {
        return path;
    }

    int[] index() {
        return index;
    }

    /// Returns the declared type of the value.
    public Type type() {
        return type;
    }

    public boolean omitEmpty() {
        return omitEmpty;
    }

    /// True if the value is written as, and read from, a JSON string.
    public boolean quoted() {
        return quoted;
    }

    /// Returns the field holding the value.
    public Field leaf() {
        return path[path.length - 1];
    }

    /// Returns the nesting depth, used to rank same-named fields.
    public int depth() {
        return index.length;
    }

    /// Returns `"name":` ready to write. The name is written as is, apart from
    /// `<`, `>`, `&`, U+2028 and U+2029 which are escaped when `html` is set.
    public byte[] keyBytes(boolean html) {
        return html ? htmlKey : plainKey;
    }

    @Override
    public String toString() {
        return "PlannedField[" + name + (tagged ? ",tagged" : "") + ",index=" + Arrays.toString(index) + "]";
    }
}
