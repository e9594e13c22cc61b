package json.ordered.internal;

import json.ordered.JsonUnsupportedValueException;
import json.ordered.OrderedJsonTestBase;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class NumberTextTest extends OrderedJsonTestBase {

    private static final List<Pattern> BAD_FLOAT = List.of(
            Pattern.compile("p"),
            Pattern.compile("^\\+"),
            Pattern.compile("^-?0[^.]"),
            Pattern.compile("^-?\\."),
            Pattern.compile("\\.(e|$)"),
            Pattern.compile("\\.[0-9]+0(e|$)"),
            Pattern.compile("^-?(0|[0-9]{2,})\\..*e"),
            Pattern.compile("e[0-9]"),
            Pattern.compile("e[+-]0"),
            Pattern.compile("e-[1-6]$"),
            Pattern.compile("e+(.|1.|20)$"),
            Pattern.compile("^-?0\\.0000000"),
            Pattern.compile("^-?[0-9]{22}"),
            Pattern.compile("[1-9][0-9]{16}[1-9]"),
            Pattern.compile("[1-9][0-9.]{17}[1-9]"));

    private static final List<Pattern> BAD_FLOAT32 = List.of(
            Pattern.compile("[1-9][0-9]{8}[1-9]"),
            Pattern.compile("[1-9][0-9.]{9}[1-9]"));

    @Test
    void doublesUseShortestPlainTextInTheMiddleRange() {
        assertThat(NumberText.formatDouble(1.0)).isEqualTo("1");
        assertThat(NumberText.formatDouble(0.1)).isEqualTo("0.1");
        assertThat(NumberText.formatDouble(-2.5)).isEqualTo("-2.5");
        assertThat(NumberText.formatDouble(0.000001)).isEqualTo("0.000001");
        assertThat(NumberText.formatDouble(1e20)).isEqualTo("100000000000000000000");
        assertThat(NumberText.formatDouble(123456789.125)).isEqualTo("123456789.125");
    }

    @Test
    void doublesSwitchToExponentFormAtTheThresholds() {
        assertThat(NumberText.formatDouble(1e-7)).isEqualTo("1e-7");
        assertThat(NumberText.formatDouble(1e21)).isEqualTo("1e+21");
        assertThat(NumberText.formatDouble(1.5e21)).isEqualTo("1.5e+21");
        assertThat(NumberText.formatDouble(-1.25e-10)).isEqualTo("-1.25e-10");
        assertThat(NumberText.formatDouble(Double.MAX_VALUE)).isEqualTo("1.7976931348623157e+308");
        assertThat(NumberText.formatDouble(Double.MIN_VALUE)).isEqualTo("5e-324");
    }

    @Test
    void zeroKeepsItsSign() {
        assertThat(NumberText.formatDouble(0.0)).isEqualTo("0");
        assertThat(NumberText.formatDouble(-0.0)).isEqualTo("-0");
        assertThat(NumberText.formatFloat(-0.0f)).isEqualTo("-0");
    }

    @Test
    void floatsUseTheirOwnPrecision() {
        assertThat(NumberText.formatFloat(0.1f)).isEqualTo("0.1");
        assertThat(NumberText.formatFloat(3.4028235e38f)).isEqualTo("3.4028235e+38");
        assertThat(NumberText.formatFloat(1e-7f)).isEqualTo("1e-7");
        assertThat(NumberText.formatFloat(16777216f)).isEqualTo("16777216");
    }

    @Test
    void nonFiniteValuesAreRejected() {
        assertThatThrownBy(() -> NumberText.formatDouble(Double.NaN))
                .isInstanceOf(JsonUnsupportedValueException.class)
                .hasMessage("json: unsupported value: NaN");
        assertThatThrownBy(() -> NumberText.formatDouble(Double.POSITIVE_INFINITY))
                .hasMessage("json: unsupported value: +Inf");
        assertThatThrownBy(() -> NumberText.formatFloat(Float.NEGATIVE_INFINITY))
                .hasMessage("json: unsupported value: -Inf");
    }

    @Test
    void numberGrammar() {
        assertThat(NumberText.isValid("0")).isTrue();
        assertThat(NumberText.isValid("-12.5e+3")).isTrue();
        assertThat(NumberText.isValid("1E9")).isTrue();
        assertThat(NumberText.isValid("")).isFalse();
        assertThat(NumberText.isValid("-")).isFalse();
        assertThat(NumberText.isValid("01")).isFalse();
        assertThat(NumberText.isValid("1.")).isFalse();
        assertThat(NumberText.isValid(".5")).isFalse();
        assertThat(NumberText.isValid("1e")).isFalse();
        assertThat(NumberText.isValid("1e+")).isFalse();
        assertThat(NumberText.isValid("+1")).isFalse();
        assertThat(NumberText.isValid("0x10")).isFalse();
    }

    @Property
    void doublesRoundTripAndStayWellFormed(@ForAll double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return;
        }
        final String text = NumberText.formatDouble(d);
        assertThat(Double.parseDouble(text)).isEqualTo(d);
        assertThat(NumberText.isValid(text)).isTrue();
        for (Pattern bad : BAD_FLOAT) {
            assertThat(bad.matcher(text).find()).as("%s must not match %s", text, bad).isFalse();
        }
    }

    @Property
    void floatsRoundTripAndStayWellFormed(@ForAll float f) {
        if (Float.isNaN(f) || Float.isInfinite(f)) {
            return;
        }
        final String text = NumberText.formatFloat(f);
        assertThat(Float.parseFloat(text)).isEqualTo(f);
        for (Pattern bad : BAD_FLOAT) {
            assertThat(bad.matcher(text).find()).as("%s must not match %s", text, bad).isFalse();
        }
        for (Pattern bad : BAD_FLOAT32) {
            assertThat(bad.matcher(text).find()).as("%s must not match %s", text, bad).isFalse();
        }
    }
}
