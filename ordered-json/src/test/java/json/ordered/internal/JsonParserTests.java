package json.ordered.internal;

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
import json.ordered.OrderedJsonTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class JsonParserTests extends OrderedJsonTestBase {

    private static JsonSyntaxException syntaxError(String input) {
        try {
            JsonParser.parse(bytes(input));
        } catch (JsonSyntaxException e) {
            return e;
        }
        throw new AssertionError("expected a syntax error for " + input);
    }

    @Test
    void parsesEveryKindOfValue() {
        final JsonValue v = JsonParser.parse(bytes("""
                {"s":"x","n":-1.5e3,"t":true,"f":false,"z":null,"a":[1,[]],"o":{}}
                """));
        assertThat(v).isEqualTo(JsonObject.of(
                new Member("s", new JsonString("x")),
                new Member("n", new JsonNumber("-1.5e3")),
                new Member("t", JsonBoolean.TRUE),
                new Member("f", JsonBoolean.FALSE),
                new Member("z", JsonNull.of()),
                new Member("a", JsonArray.of(new JsonNumber("1"), JsonArray.of())),
                new Member("o", JsonObject.empty())));
    }

    @Test
    void keepsMemberOrderAndDuplicates() {
        final JsonObject o = JsonParser.parse(bytes("{\"b\":1,\"a\":2,\"b\":3}")).asObject();
        assertThat(o.members()).extracting(Member::key).containsExactly("b", "a", "b");
        assertThat(o.getAll("b")).containsExactly(new JsonNumber("1"), new JsonNumber("3"));
    }

    @Test
    void resolvesEscapes() {
        final String s = JsonParser.parse(bytes("\"a\\n\\t\\\"\\\\\\/\\u0041\\u00e9\\uD83D\\uDE00\"")).asString();
        assertThat(s).isEqualTo("a\n\t\"\\/A" + (char) 0xE9 + new String(Character.toChars(0x1F600)));
    }

    @Test
    void unpairedEscapedSurrogatesBecomeReplacementCharacters() {
        final char replacement = (char) 0xFFFD;
        assertThat(JsonParser.parse(bytes("\"\\uD800\"")).asString()).isEqualTo(String.valueOf(replacement));
        assertThat(JsonParser.parse(bytes("\"\\uD800\\u0041\"")).asString()).isEqualTo(replacement + "A");
        assertThat(JsonParser.parse(bytes("\"\\uDC00x\"")).asString()).isEqualTo(replacement + "x");
    }

    @Test
    void invalidUtf8IsReplacedOrRejected() {
        final byte[] input = {'"', 'a', (byte) 0xFF, 'b', '"'};
        assertThat(JsonParser.parse(input).asString()).isEqualTo("a" + (char) 0xFFFD + "b");
        assertThatThrownBy(() -> new JsonParser(input, 0, input.length, 0, true).readString())
                .isInstanceOf(JsonInvalidUtf8Exception.class);
    }

    @Test
    void syntaxErrorsNameTheOffendingByte() {
        record Case(String input, String message, long offset) {
        }
        for (Case c : List.of(
                new Case("{\"X\": \"foo\", \"Y\"}", "invalid character '}' after object key", 17),
                new Case("[1, 2, 3+]", "invalid character '+' after array element", 9),
                new Case("{\"X\":12x}", "invalid character 'x' after object key:value pair", 8),
                new Case("{\"F3\": -}", "invalid character '}' in numeric literal", 9),
                new Case("nul", "unexpected end of JSON input", 3),
                new Case("[2, 3", "unexpected end of JSON input", 5),
                new Case("", "unexpected end of JSON input", 0),
                new Case(" x", "invalid character 'x' looking for beginning of value", 2),
                new Case("{1:2}", "invalid character '1' looking for beginning of object key string", 2),
                new Case("1 2", "invalid character '2' after top-level value", 3),
                new Case("01", "invalid character '1' after top-level value", 2),
                new Case("1.e3", "invalid character 'e' after decimal point in numeric literal", 3),
                new Case("1e+", "unexpected end of JSON input", 3),
                new Case("tru ", "invalid character ' ' in literal true (expecting 'e')", 4),
                new Case("\"a\tb\"", "invalid character '\\t' in string literal", 3),
                new Case("\"\\x\"", "invalid character 'x' in string escape code", 3),
                new Case("\"\\u12G4\"", "invalid character 'G' in \\u hexadecimal character escape", 6))) {
            final JsonSyntaxException e = syntaxError(c.input());
            assertThat(e.getMessage()).as(c.input()).isEqualTo(c.message());
            assertThat(e.offset()).as(c.input()).isEqualTo(c.offset());
        }
    }

    @Test
    void controlAndHighBytesAreQuotedInMessages() {
        assertThat(syntaxError(String.valueOf((char) 1)).getMessage())
                .isEqualTo("invalid character '\\x01' looking for beginning of value");
        assertThat(JsonParser.quoteChar('\'')).isEqualTo("'\\''");
        assertThat(JsonParser.quoteChar('"')).isEqualTo("'\"'");
        assertThat(JsonParser.quoteChar(0x85)).isEqualTo("'\\u0085'");
    }

    @Test
    void nestingIsBoundedWithoutExhaustingTheStack() {
        final String deep = "[".repeat(JsonParser.MAX_DEPTH + 1) + "]".repeat(JsonParser.MAX_DEPTH + 1);
        assertThatThrownBy(() -> JsonParser.parse(bytes(deep)))
                .isInstanceOf(JsonSyntaxException.class)
                .hasMessage("exceeded max depth");
        final String ok = "[".repeat(500) + "]".repeat(500);
        assertThat(JsonParser.isValid(bytes(ok))).isTrue();
    }

    @Test
    void validateHonoursTheStreamBase() {
        final byte[] buf = bytes("xx[1,}");
        assertThatThrownBy(() -> JsonParser.validate(buf, 2, buf.length, 100))
                .isInstanceOf(JsonSyntaxException.class)
                .satisfies(e -> assertThat(((JsonSyntaxException) e).offset()).isEqualTo(104));
    }

    @Test
    void skipValueReturnsTheEndOfEachValue() {
        final var p = new JsonParser(bytes(" {\"a\":\"}\"} [1] 7"));
        assertThat(p.skipValue()).isEqualTo(10);
        assertThat(p.skipValue()).isEqualTo(14);
        assertThat(p.skipValue()).isEqualTo(16);
    }
}
