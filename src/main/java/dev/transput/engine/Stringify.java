package dev.transput.engine;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Standard conversions {@code whole}, {@code fixed}, {@code float} and {@code real}.
 *
 * <p>Width conventions: a positive width always shows the sign, a negative width shows it for negative values only,
 * and zero asks for the shortest text. A conversion that cannot fit produces {@code |width|} error characters.</p>
 */
final class Stringify {
    private final TransputSettings settings;
    private final LongArithmetic arithmetic;

    Stringify(TransputSettings settings, LongArithmetic arithmetic) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.arithmetic = Objects.requireNonNull(arithmetic, "arithmetic");
    }

    String errorChars(int width) {
        return String.valueOf(settings.errorChar()).repeat(Math.max(1, Math.abs(width)));
    }

    boolean failed(String s) {
        return s.indexOf(settings.errorChar()) >= 0;
    }

    String whole(BigInteger x, int width) {
        boolean negative = x.signum() < 0;
        String digits = arithmetic.digitsOf(x, 10);
        if (width == 0) {
            return negative ? "-" + digits : digits;
        }
        int length = Math.abs(width) - (negative || width > 0 ? 1 : 0);
        if (digits.length() > length) {
            return errorChars(width);
        }
        String s = (negative ? "-" : width > 0 ? "+" : "") + digits;
        return leftPad(s, Math.abs(width));
    }

    /**
     * Fixed-point form with {@code after} fraction digits. When the value does not fit, fraction digits are given up
     * one at a time before error characters are produced.
     */
    String fixed(BigDecimal x, int width, int after, int precision) {
        if (after < 0) {
            return errorChars(width);
        }
        boolean negative = x.signum() < 0;
        BigDecimal y = x.abs();
        if (width == 0) {
            String s = subFixed(y, Integer.MAX_VALUE, after, precision);
            if (s.isEmpty() || s.charAt(0) == '.') {
                s = "0" + s;
            }
            return negative ? "-" + s : s;
        }
        int length = Math.abs(width) - (negative || width > 0 ? 1 : 0);
        String s = length > 0 ? subFixed(y, length, after, precision) : null;
        if (s == null) {
            return after > 0 ? fixed(x, width, after - 1, precision) : errorChars(width);
        }
        if (s.length() < length && (s.isEmpty() || s.charAt(0) == '.')) {
            s = "0" + s;
        }
        s = (negative ? "-" : width > 0 ? "+" : "") + s;
        return leftPad(s, Math.abs(width));
    }

    String floatForm(BigDecimal x, int width, int after, int expo, int precision) {
        return real(x, width, after, expo, 1, precision);
    }

    /**
     * Scientific form {@code mantissa e exponent}; with {@code mult > 1} the exponent is kept a multiple of
     * {@code mult}. On failure it retries with one fraction digit less and one exponent digit more.
     */
    String real(BigDecimal x, int width, int after, int expo, int mult, int precision) {
        if (after < 0) {
            return errorChars(width);
        }
        int before = Math.abs(width) - Math.abs(expo) - (after != 0 ? after + 1 : 0) - 2;
        if (Integer.signum(before) + Integer.signum(after) <= 0) {
            return errorChars(width);
        }
        LongArithmetic.Standardised st = arithmetic.standardise(x.abs(), before, after);
        BigDecimal y = st.value();
        int q = st.exponent();
        int frac = after;
        if (mult > 1) {
            while (q % mult != 0) {
                y = y.movePointRight(1);
                q--;
                if (frac > 0) {
                    frac--;
                }
            }
        }
        int mantissaWidth = Integer.signum(width) * (Math.abs(width) - Math.abs(expo) - 1);
        String mantissa = fixed(x.signum() < 0 ? y.negate() : y, mantissaWidth, frac, precision);
        String exponent = whole(BigInteger.valueOf(q), expo);
        if (expo == 0 || failed(mantissa) || failed(exponent)) {
            return real(x, width, after != 0 ? after - 1 : 0, expo > 0 ? expo + 1 : expo - 1, mult, precision);
        }
        return mantissa + 'e' + exponent;
    }

    /**
     * Unsigned fixed-point digits of {@code mag} rounded half-up to {@code after} places, without a leading zero
     * before the point. Digits past {@code precision} significant places are written as {@code 0}. Returns
     * {@code null} if the text is longer than {@code width}.
     */
    String subFixed(BigDecimal mag, int width, int after, int precision) {
        String plain = mag.abs().setScale(after, RoundingMode.HALF_UP).toPlainString();
        int dot = plain.indexOf('.');
        String intPart = dot < 0 ? plain : plain.substring(0, dot);
        String fracPart = dot < 0 ? "" : plain.substring(dot + 1);
        if (intPart.equals("0")) {
            intPart = "";
        }
        char[] digits = (intPart + fracPart).toCharArray();
        for (int k = Math.max(0, precision); k < digits.length; k++) {
            digits[k] = '0';
        }
        String all = new String(digits);
        String s = after > 0
                ? all.substring(0, intPart.length()) + "." + all.substring(intPart.length())
                : all;
        return s.length() > width ? null : s;
    }

    /** Exactly {@code width} digits of {@code value} in {@code radix}, or {@code null} if it does not fit. */
    String convertRadix(BigInteger value, int radix, int width) {
        String digits = arithmetic.digitsOf(value, radix);
        if (digits.length() > width) {
            return null;
        }
        return "0".repeat(width - digits.length()) + digits;
    }

    private static String leftPad(String s, int width) {
        return s.length() >= width ? s : " ".repeat(width - s.length()) + s;
    }
}
