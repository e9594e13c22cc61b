package json.ordered.internal;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.function.Predicate;

import json.ordered.JsonUnsupportedValueException;

/// Number text rules: shortest round-trip float rendering and the JSON
/// number grammar check.
public final class NumberText {

    private NumberText() {
    }

    /// Renders a double with the fewest digits that parse back to the same value.
    ///
    /// Plain notation is used unless the magnitude is below `1e-6` or at least
    /// `1e21`, in which case the exponent form is used, e.g. `1e-7`, `1.5e+21`.
    /// @throws JsonUnsupportedValueException for NaN and the infinities
    public static String formatDouble(double d) {
        checkFinite(d);
        if (d == 0) {
            return Double.doubleToRawLongBits(d) < 0 ? "-0" : "0";
        }
        final BigDecimal exact = new BigDecimal(d);
        BigDecimal shortest = exact;
        for (int p = 1; p <= 17; p++) {
            final BigDecimal candidate = roundTrip(exact, p, s -> Double.parseDouble(s) == d);
            if (candidate != null) {
                shortest = candidate;
                break;
            }
        }
        final double abs = Math.abs(d);
        return render(shortest, abs < 1e-6 || abs >= 1e21);
    }

    /// Renders a float with the fewest digits that parse back to the same float.
    /// The notation threshold is evaluated at float precision.
    /// @throws JsonUnsupportedValueException for NaN and the infinities
    public static String formatFloat(float f) {
        checkFinite(f);
        if (f == 0) {
            return Float.floatToRawIntBits(f) < 0 ? "-0" : "0";
        }
        final BigDecimal exact = new BigDecimal((double) f);
        BigDecimal shortest = exact;
        for (int p = 1; p <= 9; p++) {
            final BigDecimal candidate = roundTrip(exact, p, s -> Float.parseFloat(s) == f);
            if (candidate != null) {
                shortest = candidate;
                break;
            }
        }
        final float abs = Math.abs(f);
        return render(shortest, abs < 1e-6f || abs >= 1e21f);
    }

    /// Returns true if the text follows the JSON number grammar.
    public static boolean isValid(String s) {
        int i = 0;
        final int n = s.length();
        if (n == 0) {
            return false;
        }
        if (s.charAt(i) == '-') {
            i++;
            if (i == n) {
                return false;
            }
        }
        final char first = s.charAt(i);
        if (first == '0') {
            i++;
        } else if (first >= '1' && first <= '9') {
            i++;
            while (i < n && isDigit(s.charAt(i))) {
                i++;
            }
        } else {
            return false;
        }
        if (i + 1 < n && s.charAt(i) == '.' && isDigit(s.charAt(i + 1))) {
            i += 2;
            while (i < n && isDigit(s.charAt(i))) {
                i++;
            }
        }
        if (i + 1 < n && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
            i++;
            if (s.charAt(i) == '+' || s.charAt(i) == '-') {
                i++;
                if (i == n) {
                    return false;
                }
            }
            while (i < n && isDigit(s.charAt(i))) {
                i++;
            }
        }
        return i == n;
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static BigDecimal roundTrip(BigDecimal exact, int precision, Predicate<String> check) {
        final BigDecimal nearest = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
        if (check.test(nearest.toString())) {
            return nearest;
        }
        final RoundingMode other = nearest.compareTo(exact) > 0 ? RoundingMode.FLOOR : RoundingMode.CEILING;
        final BigDecimal neighbour = exact.round(new MathContext(precision, other));
        if (check.test(neighbour.toString())) {
            return neighbour;
        }
        return null;
    }

    private static String render(BigDecimal value, boolean exponent) {
        final BigDecimal v = value.stripTrailingZeros();
        if (!exponent) {
            return v.toPlainString();
        }
        final String digits = v.unscaledValue().abs().toString();
        final int exp = digits.length() - 1 - v.scale();
        final var sb = new StringBuilder(digits.length() + 8);
        if (v.signum() < 0) {
            sb.append('-');
        }
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exp < 0 ? '-' : '+').append(Math.abs(exp));
        return sb.toString();
    }

    private static void checkFinite(double d) {
        if (Double.isNaN(d)) {
            throw new JsonUnsupportedValueException("NaN");
        }
        if (Double.isInfinite(d)) {
            throw new JsonUnsupportedValueException(d > 0 ? "+Inf" : "-Inf");
        }
    }
}
