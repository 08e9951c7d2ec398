package dev.transput.engine;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/** {@link LongArithmetic} over {@code java.math}. */
public final class DecimalArithmetic implements LongArithmetic {
    @Override
    public String digitsOf(BigInteger value, int radix) {
        Objects.requireNonNull(value, "value");
        checkRadix(radix);
        return value.abs().toString(radix);
    }

    @Override
    public BigInteger valueOf(String digits, int radix) {
        Objects.requireNonNull(digits, "digits");
        checkRadix(radix);
        try {
            return new BigInteger(digits, radix);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a radix " + radix + " number: `" + digits + "`", e);
        }
    }

    @Override
    public Standardised standardise(BigDecimal value, int before, int after) {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("standardise expects a non-negative value");
        }
        if (value.signum() == 0) {
            return new Standardised(BigDecimal.ZERO, 0);
        }
        // Number of digits before the point: 10^(p-1) <= value < 10^p.
        int p = value.precision() - value.scale();
        int shift = p - before;
        BigDecimal y = value.movePointLeft(shift);
        int exponent = shift;
        BigDecimal upper = BigDecimal.ONE.movePointRight(before);
        BigDecimal half = new BigDecimal("0.5").movePointLeft(after);
        if (y.add(half).compareTo(upper) >= 0) {
            y = BigDecimal.ONE.movePointRight(before - 1);
            exponent++;
        }
        return new Standardised(y, exponent);
    }

    private static void checkRadix(int radix) {
        if (radix < 2 || radix > 16) {
            throw new IllegalArgumentException("radix out of range: " + radix);
        }
    }
}
