package dev.transput.format;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A value-bearing picture. Every pattern consumes exactly one value of a compatible mode, except
 * {@link Embedded}, which the picture selector replaces by the patterns of the sub-format it names.
 */
public sealed interface Pattern
        permits Pattern.Integral,
                Pattern.Real,
                Pattern.Complex,
                Pattern.Bits,
                Pattern.Choice,
                Pattern.Str,
                Pattern.General,
                Pattern.CStyle,
                Pattern.Embedded {
    /** Name used in diagnostics. */
    String describe();

    /**
     * 若 {@code sign == null} 表示无 sign mould（负值写出时报 value error）。
     */
    record Integral(Mould sign, Mould digits) implements Pattern {
        public Integral {
            Objects.requireNonNull(digits, "digits");
            Mould.requireSignMould(sign, "sign mould");
            Mould.requireDigitMould(digits, "integral mould");
        }

        @Override
        public String describe() {
            return "integral pattern";
        }
    }

    /**
     * {@code sign}、{@code integer}、{@code point}、{@code fraction}、{@code exponent} 均可为 {@code null}；
     * 有 fraction 时必须有 point。
     */
    record Real(Mould sign, Mould integer, SymbolFrame point, Mould fraction, Exponent exponent) implements Pattern {
        public Real {
            Mould.requireSignMould(sign, "sign mould");
            Mould.requireDigitMould(integer, "integer mould");
            Mould.requireDigitMould(fraction, "fraction mould");
            if (fraction != null && point == null) {
                throw new IllegalArgumentException("fraction mould without point frame");
            }
            if (sign == null && integer == null && fraction == null) {
                throw new IllegalArgumentException("real pattern has no digit frames");
            }
        }

        @Override
        public String describe() {
            return "real pattern";
        }

        /** {@code e} frame followed by an integral exponent. */
        public record Exponent(SymbolFrame frame, Mould sign, Mould digits) {
            public Exponent {
                Objects.requireNonNull(frame, "frame");
                Objects.requireNonNull(digits, "digits");
                Mould.requireSignMould(sign, "exponent sign mould");
                Mould.requireDigitMould(digits, "exponent mould");
            }
        }
    }

    record Complex(Real real, SymbolFrame connective, Real imaginary) implements Pattern {
        public Complex {
            Objects.requireNonNull(real, "real");
            Objects.requireNonNull(connective, "connective");
            Objects.requireNonNull(imaginary, "imaginary");
        }

        @Override
        public String describe() {
            return "complex pattern";
        }
    }

    record Bits(Count radix, Mould digits) implements Pattern {
        public Bits {
            Objects.requireNonNull(radix, "radix");
            Objects.requireNonNull(digits, "digits");
            Mould.requireDigitMould(digits, "bits mould");
        }

        @Override
        public String describe() {
            return "bits pattern";
        }
    }

    enum ChoiceKind {
        BOOLEAN,
        INTEGRAL
    }

    /**
     * 若 {@code kind == BOOLEAN} 且 alternatives 为空，表示写出 flip/flop 字符。
     */
    record Choice(ChoiceKind kind, List<Insertion> alternatives) implements Pattern {
        public Choice {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(alternatives, "alternatives");
            alternatives = List.copyOf(alternatives);
            if (kind == ChoiceKind.BOOLEAN && alternatives.size() != 0 && alternatives.size() != 2) {
                throw new IllegalArgumentException("boolean choice needs 0 or 2 alternatives, got " + alternatives.size());
            }
            if (kind == ChoiceKind.INTEGRAL && alternatives.isEmpty()) {
                throw new IllegalArgumentException("integral choice needs at least one alternative");
            }
        }

        @Override
        public String describe() {
            return kind == ChoiceKind.BOOLEAN ? "boolean choice pattern" : "integral choice pattern";
        }
    }

    record Str(List<StringItem> items) implements Pattern {
        public Str {
            Objects.requireNonNull(items, "items");
            items = List.copyOf(items);
        }

        @Override
        public String describe() {
            return "string pattern";
        }
    }

    enum GeneralKind {
        /** {@code g}: whole, fixed or float depending on the argument count. */
        G,
        /** {@code h}: real with an exponent multiple. */
        H
    }

    /**
     * 若 {@code args == null} 表示无显式参数（使用标准宽度）。
     */
    record General(GeneralKind kind, Expr args) implements Pattern {
        public General {
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public String describe() {
            return "general pattern";
        }
    }

    enum CKind {
        CHAR,
        STRING,
        INTEGRAL,
        FIXED,
        FLOAT,
        GENERAL,
        BITS
    }

    enum Align {
        LEFT,
        RIGHT
    }

    /**
     * {@code %[-][+][w][.p]letter}。{@code width}、{@code precision} 可为 {@code null}（使用缺省值）；
     * {@code letter} 对 BITS 决定基数：b/o/x/d。
     */
    record CStyle(CKind kind, Align align, boolean forcedSign, Count width, Count precision, char letter)
            implements Pattern {
        public CStyle {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(align, "align");
            if (kind == CKind.BITS && "bodx".indexOf(letter) < 0) {
                throw new IllegalArgumentException("bits conversion letter must be one of b, o, d, x: " + letter);
            }
        }

        @Override
        public String describe() {
            return "C-style " + kind.name().toLowerCase(Locale.ROOT) + " pattern";
        }
    }

    record Embedded(Expr format) implements Pattern {
        public Embedded {
            Objects.requireNonNull(format, "format");
        }

        @Override
        public String describe() {
            return "format pattern";
        }
    }
}
