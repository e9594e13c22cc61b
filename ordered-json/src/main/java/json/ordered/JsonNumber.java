package json.ordered;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

import json.ordered.internal.NumberText;

/// A JSON number, held as its decimal text.
///
/// Keeping the text defers the choice of precision to the consumer and lets a
/// decoded number be re-encoded byte for byte. The text is not checked on
/// construction; {@link #isValid()} reports whether it follows the JSON number
/// grammar, and encoding an invalid number fails with
/// {@link JsonUnsupportedValueException}. The empty text encodes as `0`.
public record JsonNumber(String text) implements JsonValue {

    public JsonNumber {
        Objects.requireNonNull(text, "text");
    }

    public static JsonNumber of(long value) {
        return new JsonNumber(Long.toString(value));
    }

    public static JsonNumber of(BigInteger value) {
        return new JsonNumber(value.toString());
    }

    public static JsonNumber of(BigDecimal value) {
        return new JsonNumber(value.toString());
    }

    /// Returns the shortest text that reads back as the given double.
    /// @throws JsonUnsupportedValueException for NaN and the infinities
    public static JsonNumber of(double value) {
        return new JsonNumber(NumberText.formatDouble(value));
    }

    /// Returns the shortest text that reads back as the given float.
    /// @throws JsonUnsupportedValueException for NaN and the infinities
    public static JsonNumber of(float value) {
        return new JsonNumber(NumberText.formatFloat(value));
    }

    /// Wraps the given text as is.
    public static JsonNumber of(String text) {
        return new JsonNumber(text);
    }

    /// Returns true if the text follows the JSON number grammar.
    public boolean isValid() {
        return NumberText.isValid(text);
    }

    /// Returns the value as a long.
    /// @throws NumberFormatException if the text is not an integer in range
    public long toLong() {
        return Long.parseLong(text);
    }

    /// Returns the nearest double to the value.
    public double toDouble() {
        return Double.parseDouble(text);
    }

    /// Returns the exact value.
    public BigDecimal toBigDecimal() {
        return new BigDecimal(text);
    }

    @Override
    public JsonNumber asNumber() {
        return this;
    }

    @Override
    public String toString() {
        return text;
    }
}
