package dev.transput.engine;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the text accumulated from input into a value of the requested mode.
 */
final class Denotations {
    private static final Pattern INTEGRAL = Pattern.compile("[+-]?[0-9]+");
    private static final Pattern REAL =
            Pattern.compile("[+-]?([0-9]+(\\.[0-9]*)?|\\.[0-9]+)([eE][+-]?[0-9]+)?");
    private static final Pattern RADIX = Pattern.compile("([0-9]+)r([0-9a-fA-F]+)");

    private final TransputSettings settings;
    private final LongArithmetic arithmetic;

    Denotations(TransputSettings settings, LongArithmetic arithmetic) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.arithmetic = Objects.requireNonNull(arithmetic, "arithmetic");
    }

    /** The value denoted by {@code text}, or {@code null} if it is not a denotation of {@code mode}. */
    Value parse(ValueMode mode, String text) {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(text, "text");
        return switch (mode) {
            case INT -> parseInt(numeric(text));
            case LONG_INT -> {
                String s = numeric(text);
                yield INTEGRAL.matcher(s).matches() ? new Value.LongInt(new BigInteger(s)) : null;
            }
            case REAL -> parseReal(numeric(text));
            case LONG_REAL -> {
                String s = numeric(text);
                yield REAL.matcher(s).matches() ? new Value.LongReal(new BigDecimal(s)) : null;
            }
            case COMPLEX, LONG_COMPLEX -> parseComplex(mode, text);
            case BOOL -> parseBool(text.strip());
            case CHAR -> text.length() == 1 ? new Value.Char(text.charAt(0)) : null;
            case STRING -> new Value.Str(text);
            case BITS, LONG_BITS -> parseBits(mode, text.strip());
        };
    }

    private static Value parseInt(String s) {
        if (!INTEGRAL.matcher(s).matches()) {
            return null;
        }
        try {
            return new Value.Int(Long.parseLong(s));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Value parseReal(String s) {
        if (!REAL.matcher(s).matches()) {
            return null;
        }
        double d = Double.parseDouble(s);
        return Double.isFinite(d) ? new Value.Real(d) : null;
    }

    private Value parseBool(String s) {
        if (s.length() != 1) {
            return null;
        }
        char c = s.charAt(0);
        if (c == settings.flipChar()) {
            return new Value.Bool(true);
        }
        return c == settings.flopChar() ? new Value.Bool(false) : null;
    }

    /** Value used in place of an unreadable item once the error was mended. */
    static Value zero(ValueMode mode) {
        return switch (mode) {
            case INT -> new Value.Int(0);
            case LONG_INT -> new Value.LongInt(BigInteger.ZERO);
            case REAL -> new Value.Real(0.0);
            case LONG_REAL -> new Value.LongReal(BigDecimal.ZERO);
            case COMPLEX -> new Value.Complex(0.0, 0.0);
            case LONG_COMPLEX -> new Value.LongComplex(BigDecimal.ZERO, BigDecimal.ZERO);
            case BOOL -> new Value.Bool(false);
            case CHAR -> new Value.Char(' ');
            case STRING -> new Value.Str("");
            case BITS -> new Value.Bits(0);
            case LONG_BITS -> new Value.LongBits(BigInteger.ZERO);
        };
    }

    private Value parseComplex(ValueMode mode, String text) {
        String s = text.strip();
        int sep = Math.max(s.indexOf('I'), s.indexOf('i'));
        if (sep < 0) {
            return null;
        }
        ValueMode part = mode.isLong() ? ValueMode.LONG_REAL : ValueMode.REAL;
        Value re = parse(part, s.substring(0, sep));
        Value im = parse(part, s.substring(sep + 1));
        if (re == null || im == null) {
            return null;
        }
        if (mode == ValueMode.COMPLEX) {
            return new Value.Complex(((Value.Real) re).value(), ((Value.Real) im).value());
        }
        return new Value.LongComplex(((Value.LongReal) re).value(), ((Value.LongReal) im).value());
    }

    private Value parseBits(ValueMode mode, String s) {
        BigInteger bits;
        Matcher m = RADIX.matcher(s);
        if (m.matches()) {
            int radix;
            try {
                radix = Integer.parseInt(m.group(1));
            } catch (NumberFormatException e) {
                return null;
            }
            if (radix < 2 || radix > 16) {
                return null;
            }
            try {
                bits = arithmetic.valueOf(m.group(2).toLowerCase(Locale.ROOT), radix);
            } catch (IllegalArgumentException e) {
                return null;
            }
        } else if (!s.isEmpty() && isFlipFlop(s)) {
            bits = BigInteger.ZERO;
            for (int k = 0; k < s.length(); k++) {
                bits = bits.shiftLeft(1);
                if (s.charAt(k) == settings.flipChar()) {
                    bits = bits.setBit(0);
                }
            }
        } else {
            return null;
        }
        boolean isLong = mode.isLong();
        if (bits.bitLength() > settings.bitsWidth(isLong)) {
            return null;
        }
        return isLong ? new Value.LongBits(bits) : new Value.Bits(bits.longValue());
    }

    private boolean isFlipFlop(String s) {
        for (int k = 0; k < s.length(); k++) {
            char c = s.charAt(k);
            if (c != settings.flipChar() && c != settings.flopChar()) {
                return false;
            }
        }
        return true;
    }

    /** Strips surrounding blanks and blanks between a sign and its digits. */
    private static String numeric(String text) {
        String s = text.strip();
        if (!s.isEmpty() && (s.charAt(0) == '+' || s.charAt(0) == '-')) {
            s = s.charAt(0) + s.substring(1).stripLeading();
        }
        return s;
    }
}
