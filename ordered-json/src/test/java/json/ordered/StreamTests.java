package json.ordered;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StreamTests extends OrderedJsonTestBase {

    private static JsonDecoder decoder(String input) {
        return new JsonDecoder(new ByteArrayInputStream(bytes(input)));
    }

    /// Hands out at most a few bytes per read.
    private static final class Trickle extends FilterInputStream {
        private final int chunk;

        Trickle(InputStream in, int chunk) {
            super(in);
            this.chunk = chunk;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            return super.read(b, off, Math.min(len, chunk));
        }
    }

    @Test
    void readsConsecutiveValues() {
        final var dec = decoder("{\"a\":1} [2]\n\"three\"\t4 true null");
        final List<JsonValue> values = new ArrayList<>();
        while (dec.more()) {
            values.add(dec.decode());
        }
        assertThat(values).containsExactly(
                JsonObject.of(new Member("a", new JsonNumber("1"))),
                JsonArray.of(new JsonNumber("2")),
                new JsonString("three"),
                new JsonNumber("4"),
                JsonBoolean.TRUE,
                JsonNull.of());
        assertThatThrownBy(dec::decode)
                .isInstanceOf(UncheckedIOException.class)
                .hasCauseInstanceOf(EOFException.class);
    }

    @Test
    void valuesNeedNoSeparator() {
        final var dec = decoder("{}{}[]");
        assertThat(dec.decode()).isEqualTo(JsonObject.empty());
        assertThat(dec.decode()).isEqualTo(JsonObject.empty());
        assertThat(dec.decode()).isEqualTo(JsonArray.of());
        assertThat(dec.more()).isFalse();
    }

    @Test
    void emptyStreamHasNoValue() {
        final var dec = decoder("  \n ");
        assertThat(dec.more()).isFalse();
        assertThatThrownBy(dec::decode).hasCauseInstanceOf(EOFException.class);
    }

    @Test
    void truncatedValueIsASyntaxError() {
        final var dec = decoder("[1] {\"a\":[1,2");
        assertThat(dec.decode()).isEqualTo(JsonArray.of(new JsonNumber("1")));
        assertThatThrownBy(dec::decode)
                .isInstanceOf(JsonSyntaxException.class)
                .hasMessage("unexpected end of JSON input")
                .satisfies(e -> assertThat(((JsonSyntaxException) e).offset()).isEqualTo(13));
    }

    @Test
    void syntaxErrorOffsetsCountFromStreamStart() {
        final var dec = decoder("[1] [1,}");
        dec.decode();
        assertThatThrownBy(dec::decode)
                .isInstanceOf(JsonSyntaxException.class)
                .hasMessage("invalid character '}' looking for beginning of value")
                .satisfies(e -> assertThat(((JsonSyntaxException) e).offset()).isEqualTo(8));
    }

    @Test
    void inputOffsetStopsAtTheEndOfTheLastValue() {
        final var dec = decoder("{\"a\":1} [2]");
        assertThat(dec.inputOffset()).isZero();
        dec.decode();
        assertThat(dec.inputOffset()).isEqualTo(7);
        dec.decode();
        assertThat(dec.inputOffset()).isEqualTo(11);
    }

    public record Tx(String hash, long fee) {
    }

    public static class Account {
        public String name;
        public long balance;
    }

    @Test
    void typedValuesFromAStream() {
        final var dec = decoder("{\"hash\":\"a\",\"fee\":1}\n{\"hash\":\"b\",\"fee\":2}\n[{\"hash\":\"c\"}]");
        assertThat(dec.decode(Tx.class)).isEqualTo(new Tx("a", 1));
        assertThat(dec.decode(Tx.class)).isEqualTo(new Tx("b", 2));
        assertThat(dec.decode(new TypeRef<List<Tx>>() {})).containsExactly(new Tx("c", 0));
    }

    @Test
    void decodeIntoFromAStream() {
        final var account = new Account();
        account.balance = 9;
        decoder("{\"name\":\"n\"}").decodeInto(account);
        assertThat(account.name).isEqualTo("n");
        assertThat(account.balance).isEqualTo(9);
    }

    @Test
    void aMismatchDoesNotStopTheStream() {
        final var dec = decoder("{\"hash\":1} {\"hash\":\"ok\"}");
        assertThatThrownBy(() -> dec.decode(Tx.class))
                .isInstanceOf(JsonUnmarshalTypeException.class)
                .hasMessage("json: cannot unmarshal number into field Tx.hash of type java.lang.String");
        assertThat(dec.decode(Tx.class)).isEqualTo(new Tx("ok", 0));
    }

    @Test
    void unknownFieldsCanBeRejected() {
        assertThat(decoder("{\"name\":\"n\",\"extra\":1}").decode(Account.class).name).isEqualTo("n");
        assertThatThrownBy(() -> decoder("{\"name\":\"n\",\"extra\":1}").disallowUnknownFields().decode(Account.class))
                .isInstanceOf(JsonException.class)
                .hasMessage("json: unknown field \"extra\"");
    }

    @Test
    void integralExponentsAreOptIn() {
        assertThatThrownBy(() -> decoder("{\"fee\":1e2}").decode(Tx.class))
                .hasMessage("json: cannot unmarshal number 1e2 into field Tx.fee of type long");
        assertThat(decoder("{\"fee\":1e2}").allowIntegralExponents().decode(Tx.class)).isEqualTo(new Tx(null, 100));
        assertThat(decoder("{\"fee\":2.0}").allowIntegralExponents().decode(Tx.class)).isEqualTo(new Tx(null, 2));
        assertThatThrownBy(() -> decoder("{\"fee\":2.5}").allowIntegralExponents().decode(Tx.class))
                .hasMessage("json: cannot unmarshal number 2.5 into field Tx.fee of type long");
    }

    @Test
    void strictUtf8RejectsInvalidBytes() {
        final byte[] input = {'"', 'o', 'k', (byte) 0xFF, '"'};
        assertThat(new JsonDecoder(new ByteArrayInputStream(input)).decode())
                .isEqualTo(new JsonString("ok" + (char) 0xFFFD));
        assertThatThrownBy(() -> new JsonDecoder(new ByteArrayInputStream(input)).strictUtf8().decode())
                .isInstanceOf(JsonInvalidUtf8Exception.class);
    }

    @Test
    void slowStreamsAreReassembled() {
        final var sb = new StringBuilder();
        for (int i = 0; i < 500; i++) {
            sb.append("{\"hash\":\"h").append(i).append("\",\"fee\":").append(i).append("}\n");
        }
        final var dec = new JsonDecoder(new Trickle(new ByteArrayInputStream(bytes(sb.toString())), 7));
        int count = 0;
        while (dec.more()) {
            assertThat(dec.decode(Tx.class)).isEqualTo(new Tx("h" + count, count));
            count++;
        }
        assertThat(count).isEqualTo(500);
        assertThat(dec.inputOffset()).isEqualTo(sb.length());
    }

    @Test
    void largeStringSpanningManyReads() {
        final String big = "x".repeat(20_000);
        final var dec = new JsonDecoder(new Trickle(new ByteArrayInputStream(bytes("\"" + big + "\" 1")), 1000));
        assertThat(dec.decode(String.class)).isEqualTo(big);
        assertThat(dec.decode(Integer.class)).isEqualTo(1);
    }

    @Test
    void readFailuresAreUnchecked() {
        final InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("boom");
            }

            @Override
            public int read(byte[] b, int off, int len) throws IOException {
                throw new IOException("boom");
            }
        };
        assertThatThrownBy(() -> new JsonDecoder(broken).decode())
                .isInstanceOf(UncheckedIOException.class)
                .hasRootCauseMessage("boom");
    }

    @Test
    void encoderTerminatesEachValueWithANewline() {
        final var out = new ByteArrayOutputStream();
        final var enc = new JsonEncoder(out);
        enc.encode(Map.of("a", 1));
        enc.encode(List.of(1, 2));
        enc.encode("<b>");
        assertThat(text(out.toByteArray())).isEqualTo("{\"a\":1}\n[1,2]\n\"\\u003Cb\\u003E\"\n");
    }

    @Test
    void encoderCanLeaveHtmlAlone() {
        final var out = new ByteArrayOutputStream();
        new JsonEncoder(out).setEscapeHtml(false).encode("<a&b>");
        assertThat(text(out.toByteArray())).isEqualTo("\"<a&b>\"\n");
    }

    @Test
    void encoderIndents() {
        final var out = new ByteArrayOutputStream();
        new JsonEncoder(out).setIndent("", "  ").encode(JsonObject.builder()
                .add("a", JsonArray.of(new JsonNumber("1"), new JsonNumber("2")))
                .add("b", JsonObject.empty())
                .build());
        assertThat(text(out.toByteArray())).isEqualTo("""
                {
                  "a": [
                    1,
                    2
                  ],
                  "b": {}
                }
                """);
    }

    @Test
    void failedEncodeWritesNothing() {
        final var out = new ByteArrayOutputStream();
        final var enc = new JsonEncoder(out);
        assertThatThrownBy(() -> enc.encode(List.of(1.0, Double.NaN)))
                .isInstanceOf(JsonUnsupportedValueException.class)
                .hasMessage("json: unsupported value: NaN");
        assertThat(out.size()).isZero();
    }

    @Test
    void writeFailuresAreUnchecked() {
        final OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("disk full");
            }
        };
        assertThatThrownBy(() -> new JsonEncoder(broken).encode(1))
                .isInstanceOf(UncheckedIOException.class)
                .hasRootCauseMessage("disk full");
    }
}
