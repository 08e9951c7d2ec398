package dev.transput.engine;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Arbitrary-precision arithmetic used for LONG modes and for decimal scaling.
 */
public interface LongArithmetic {
    /** Digits of {@code |value|} in {@code radix}, lower case, no sign. */
    String digitsOf(BigInteger value, int radix);

    BigInteger valueOf(String digits, int radix);

    /**
     * Scales a non-negative value so that {@code before} digits precede the point, rounding to {@code after}
     * fraction digits does not carry out of the window, and {@code value = scaled * 10^exponent}.
     */
    Standardised standardise(BigDecimal value, int before, int after);

    record Standardised(BigDecimal value, int exponent) {
        public Standardised {
            Objects.requireNonNull(value, "value");
        }
    }
}
