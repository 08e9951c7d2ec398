package dev.transput.engine;

import dev.transput.format.FormatText;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * Transputable values as the driver sees them. {@link Struct} and {@link Row} are written field by field.
 */
public sealed interface Value
        permits Value.Int,
                Value.LongInt,
                Value.Real,
                Value.LongReal,
                Value.Complex,
                Value.LongComplex,
                Value.Bool,
                Value.Char,
                Value.Str,
                Value.Bits,
                Value.LongBits,
                Value.Format,
                Value.Struct,
                Value.Row {
    /** Mode name for diagnostics. */
    String modeName();

    record Int(long value) implements Value {
        @Override
        public String modeName() {
            return ValueMode.INT.displayName();
        }
    }

    record LongInt(BigInteger value) implements Value {
        public LongInt {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String modeName() {
            return ValueMode.LONG_INT.displayName();
        }
    }

    record Real(double value) implements Value {
        public Real {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("REAL value must be finite: " + value);
            }
        }

        @Override
        public String modeName() {
            return ValueMode.REAL.displayName();
        }
    }

    record LongReal(BigDecimal value) implements Value {
        public LongReal {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String modeName() {
            return ValueMode.LONG_REAL.displayName();
        }
    }

    record Complex(double re, double im) implements Value {
        public Complex {
            if (!Double.isFinite(re) || !Double.isFinite(im)) {
                throw new IllegalArgumentException("COMPLEX parts must be finite");
            }
        }

        @Override
        public String modeName() {
            return ValueMode.COMPLEX.displayName();
        }
    }

    record LongComplex(BigDecimal re, BigDecimal im) implements Value {
        public LongComplex {
            Objects.requireNonNull(re, "re");
            Objects.requireNonNull(im, "im");
        }

        @Override
        public String modeName() {
            return ValueMode.LONG_COMPLEX.displayName();
        }
    }

    record Bool(boolean value) implements Value {
        @Override
        public String modeName() {
            return ValueMode.BOOL.displayName();
        }
    }

    record Char(char value) implements Value {
        @Override
        public String modeName() {
            return ValueMode.CHAR.displayName();
        }
    }

    record Str(String value) implements Value {
        public Str {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String modeName() {
            return ValueMode.STRING.displayName();
        }
    }

    /** 64 bit word, read as unsigned. */
    record Bits(long value) implements Value {
        @Override
        public String modeName() {
            return ValueMode.BITS.displayName();
        }
    }

    record LongBits(BigInteger value) implements Value {
        public LongBits {
            Objects.requireNonNull(value, "value");
            if (value.signum() < 0) {
                throw new IllegalArgumentException("LONG BITS value cannot be negative");
            }
        }

        @Override
        public String modeName() {
            return ValueMode.LONG_BITS.displayName();
        }
    }

    record Format(FormatText format) implements Value {
        public Format {
            Objects.requireNonNull(format, "format");
        }

        @Override
        public String modeName() {
            return "FORMAT";
        }
    }

    record Struct(List<Value> fields) implements Value {
        public Struct {
            Objects.requireNonNull(fields, "fields");
            fields = List.copyOf(fields);
        }

        @Override
        public String modeName() {
            return "STRUCT";
        }
    }

    record Row(List<Value> elements) implements Value {
        public Row {
            Objects.requireNonNull(elements, "elements");
            elements = List.copyOf(elements);
        }

        @Override
        public String modeName() {
            return "ROW";
        }
    }
}
