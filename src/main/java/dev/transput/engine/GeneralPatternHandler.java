package dev.transput.engine;

import dev.transput.format.Environment;
import dev.transput.format.Pattern;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * General patterns {@code g} and {@code h}. Without arguments a value is written in its standard form; with
 * integer arguments numbers go through {@code whole}, {@code fixed}, {@code float} or {@code real}.
 */
public final class GeneralPatternHandler {
    private static final int DEFAULT_MULTIPLE = 3;

    private final TransputContext ctx;
    private final Stringify stringify;
    private final StandardReader reader;

    GeneralPatternHandler(TransputContext ctx, Stringify stringify, StandardReader reader) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.stringify = Objects.requireNonNull(stringify, "stringify");
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    void write(Pattern.General p, Value value, Environment env, TransputContext.Subject subject)
            throws TransputError {
        if (p.args() == null) {
            ctx.buffer.append(standard(value));
            return;
        }
        List<Long> args = ctx.evaluator.evalInts(p.args(), env);
        if (!isNumber(value)) {
            ctx.buffer.append(standard(value));
            return;
        }
        String text = p.kind() == Pattern.GeneralKind.G ? writeG(args, value) : writeH(args, value);
        if (text == null) {
            ctx.offerFormatError(new TransputError.PatternMismatch(
                    p.describe() + " cannot take " + args.size() + " integer argument(s)"));
            return;
        }
        if (stringify.failed(text)) {
            ctx.valueError(subject);
        }
        ctx.buffer.append(text);
    }

    Value read(Pattern.General p, ValueMode mode, Environment env, TransputContext.Subject subject)
            throws TransputError {
        if (p.args() != null) {
            // Arguments are evaluated for their side effects only.
            ctx.evaluator.evalInts(p.args(), env);
        }
        return reader.read(mode, subject);
    }

    /** Standard output form of a leaf value. */
    String standard(Value value) {
        TransputSettings s = ctx.settings;
        if (value instanceof Value.Int v) {
            return stringify.whole(BigInteger.valueOf(v.value()), s.intWidth(false) + 1);
        } else if (value instanceof Value.LongInt v) {
            return stringify.whole(v.value(), s.intWidth(true) + 1);
        } else if (value instanceof Value.Real v) {
            return standardReal(BigDecimal.valueOf(v.value()), false);
        } else if (value instanceof Value.LongReal v) {
            return standardReal(v.value(), true);
        } else if (value instanceof Value.Bool v) {
            return String.valueOf(v.value() ? s.flipChar() : s.flopChar());
        } else if (value instanceof Value.Char v) {
            return String.valueOf(v.value());
        } else if (value instanceof Value.Str v) {
            return v.value();
        } else if (value instanceof Value.Bits v) {
            return flipFlop(new BigInteger(Long.toUnsignedString(v.value())), s.bitsWidth(false));
        } else if (value instanceof Value.LongBits v) {
            return flipFlop(v.value(), s.bitsWidth(true));
        }
        throw new IllegalArgumentException("no standard form for " + value.modeName());
    }

    private String standardReal(BigDecimal x, boolean isLong) {
        TransputSettings s = ctx.settings;
        int realWidth = s.realWidth(isLong);
        int expWidth = s.expWidth(isLong);
        return stringify.floatForm(x, realWidth + expWidth + 4, realWidth - 1, expWidth + 1, realWidth);
    }

    private String flipFlop(BigInteger bits, int width) {
        StringBuilder sb = new StringBuilder(width);
        for (int k = width - 1; k >= 0; k--) {
            sb.append(bits.testBit(k) ? ctx.settings.flipChar() : ctx.settings.flopChar());
        }
        return sb.toString();
    }

    private String writeG(List<Long> args, Value value) {
        boolean isLong = isLong(value);
        int precision = ctx.settings.realWidth(isLong);
        return switch (args.size()) {
            case 1 -> {
                int width = args.get(0).intValue();
                if (value instanceof Value.Int v) {
                    yield stringify.whole(BigInteger.valueOf(v.value()), width);
                }
                if (value instanceof Value.LongInt v) {
                    yield stringify.whole(v.value(), width);
                }
                yield stringify.fixed(decimal(value), width, 0, precision);
            }
            case 2 -> stringify.fixed(decimal(value), args.get(0).intValue(), args.get(1).intValue(), precision);
            case 3 -> stringify.floatForm(
                    decimal(value), args.get(0).intValue(), args.get(1).intValue(), args.get(2).intValue(), precision);
            default -> null;
        };
    }

    private String writeH(List<Long> args, Value value) {
        boolean isLong = isLong(value);
        int precision = ctx.settings.realWidth(isLong);
        int expo = ctx.settings.expWidth(isLong) + 1;
        int width;
        int after;
        int mult = DEFAULT_MULTIPLE;
        switch (args.size()) {
            case 1 -> {
                after = args.get(0).intValue();
                width = after + expo + 4;
            }
            case 2 -> {
                after = args.get(0).intValue();
                mult = args.get(1).intValue();
                width = after + expo + 4;
            }
            case 3 -> {
                width = args.get(0).intValue();
                after = args.get(1).intValue();
                mult = args.get(2).intValue();
            }
            case 4 -> {
                width = args.get(0).intValue();
                after = args.get(1).intValue();
                expo = args.get(2).intValue();
                mult = args.get(3).intValue();
            }
            default -> {
                return null;
            }
        }
        return stringify.real(decimal(value), width, after, expo, mult, precision);
    }

    static boolean isNumber(Value value) {
        return value instanceof Value.Int
                || value instanceof Value.LongInt
                || value instanceof Value.Real
                || value instanceof Value.LongReal;
    }

    static boolean isLong(Value value) {
        return value instanceof Value.LongInt || value instanceof Value.LongReal;
    }

    static BigDecimal decimal(Value value) {
        if (value instanceof Value.Int v) {
            return BigDecimal.valueOf(v.value());
        } else if (value instanceof Value.LongInt v) {
            return new BigDecimal(v.value());
        } else if (value instanceof Value.Real v) {
            return BigDecimal.valueOf(v.value());
        } else if (value instanceof Value.LongReal v) {
            return v.value();
        }
        throw new IllegalArgumentException("not a number: " + value.modeName());
    }
}
