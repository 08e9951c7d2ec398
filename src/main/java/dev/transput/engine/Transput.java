package dev.transput.engine;

import dev.transput.format.Environment;
import dev.transput.format.FormatText;
import dev.transput.format.Pattern;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Formatted transput 的入口：把 format 应用于一串值（写）或一串目标（读）。
 *
 * <p>每次调用拥有自己的帧栈；evaluator 或事件处理器在同一文件上发起的嵌套调用会得到新的帧栈，返回时恢复外层状态。
 * 语句结束时（包括出错中止）剩余的 format 被排空，缓冲区写出，所有帧关闭。</p>
 */
public final class Transput {
    private static final Logger LOGGER = Logger.getLogger(Transput.class.getName());

    private final TransputContext ctx;
    private final InsertionExecutor insertions;
    private final PictureSelector selector;
    private final NumericPatternFormatter numeric;
    private final ChoicePatternHandler choice;
    private final StringPatternHandler strings;
    private final GeneralPatternHandler general;
    private final CStylePatternFormatter cstyle;

    /** 若 {@code pending == null} 表示下一次调用没有预设的 format。 */
    private FormatText pending;
    private int depth;

    public Transput(TransputFile file, Evaluator evaluator, TransputEvents events) {
        this(file, evaluator, events, TransputSettings.defaults(), new DecimalArithmetic());
    }

    public Transput(
            TransputFile file,
            Evaluator evaluator,
            TransputEvents events,
            TransputSettings settings,
            LongArithmetic arithmetic) {
        this.ctx = new TransputContext(
                this,
                Objects.requireNonNull(file, "file"),
                Objects.requireNonNull(evaluator, "evaluator"),
                Objects.requireNonNull(events, "events"),
                Objects.requireNonNull(settings, "settings"),
                Objects.requireNonNull(arithmetic, "arithmetic"));
        Stringify stringify = new Stringify(settings, arithmetic);
        Denotations denotations = new Denotations(settings, arithmetic);
        StandardReader reader = new StandardReader(ctx, denotations);
        this.insertions = new InsertionExecutor(ctx);
        this.selector = new PictureSelector(ctx, insertions);
        this.numeric = new NumericPatternFormatter(
                ctx, new MouldEngine(ctx, insertions), insertions, stringify, denotations);
        this.choice = new ChoicePatternHandler(ctx, insertions);
        this.strings = new StringPatternHandler(ctx, insertions);
        this.general = new GeneralPatternHandler(ctx, stringify, reader);
        this.cstyle = new CStylePatternFormatter(ctx, stringify, reader, denotations);
    }

    // ====== accessors ======

    public TransputFile file() {
        return ctx.file;
    }

    public TransputSettings settings() {
        return ctx.settings;
    }

    public TransputEvents events() {
        return ctx.events;
    }

    /** Frame stack of the innermost active call; empty outside a call. */
    public FrameStack frames() {
        return ctx.frames;
    }

    public PictureSelector selector() {
        return selector;
    }

    public InsertionExecutor insertions() {
        return insertions;
    }

    public boolean active() {
        return depth > 0;
    }

    /**
     * Installs {@code format}. Outside a call it becomes the format of the next call; inside a call, typically from
     * a format-end handler, it replaces every open frame.
     */
    public void setFormat(FormatText format) throws TransputError {
        Objects.requireNonNull(format, "format");
        if (depth == 0) {
            pending = format;
            return;
        }
        ctx.frames.closeAll();
        selector.openOutermost(format);
    }

    // ====== statements ======

    public void writeFormatted(List<Value> items) throws TransputError {
        Objects.requireNonNull(items, "items");
        statement(TransputContext.Direction.WRITE, () -> {
            for (Value item : items) {
                writeItem(item);
            }
            return null;
        });
    }

    public List<Value> readFormatted(List<ReadItem> items) throws TransputError {
        Objects.requireNonNull(items, "items");
        return statement(TransputContext.Direction.READ, () -> {
            ArrayList<Value> values = new ArrayList<>();
            for (ReadItem item : items) {
                if (item instanceof ReadItem.Format f) {
                    switchFormat(f.format());
                } else if (item instanceof ReadItem.Target t) {
                    values.add(readValue(t.mode()));
                }
            }
            return List.copyOf(values);
        });
    }

    @FunctionalInterface
    private interface Body<T> {
        T run() throws TransputError;
    }

    private <T> T statement(TransputContext.Direction direction, Body<T> body) throws TransputError {
        TransputContext.Direction savedDirection = ctx.direction;
        FrameStack savedFrames = ctx.frames;
        ctx.direction = direction;
        ctx.frames = new FrameStack();
        depth++;
        boolean completed = false;
        try {
            if (pending != null) {
                FormatText format = pending;
                pending = null;
                selector.openOutermost(format);
            }
            T result = body.run();
            selector.drain();
            completed = true;
            return result;
        } finally {
            if (!completed) {
                int open = ctx.frames.depth();
                LOGGER.log(Level.FINER, () -> direction + " statement aborted with " + open + " open frame(s)");
            }
            if (direction == TransputContext.Direction.WRITE) {
                ctx.buffer.flushTo(ctx.file);
            }
            ctx.frames.closeAll();
            ctx.frames = savedFrames;
            ctx.direction = savedDirection;
            depth--;
        }
    }

    private void switchFormat(FormatText format) throws TransputError {
        Objects.requireNonNull(format, "format");
        if (!ctx.frames.isEmpty()) {
            selector.drain();
            ctx.frames.closeAll();
        }
        selector.openOutermost(format);
    }

    private PictureSelector.ActivePattern required() throws TransputError {
        return selector.nextPattern(PictureSelector.Mood.REQUIRED).orElseThrow();
    }

    // ====== write dispatch ======

    private void writeItem(Value value) throws TransputError {
        if (value instanceof Value.Format f) {
            switchFormat(f.format());
        } else if (value instanceof Value.Struct s) {
            for (Value field : s.fields()) {
                writeItem(field);
            }
        } else if (value instanceof Value.Row r) {
            for (Value element : r.elements()) {
                writeItem(element);
            }
        } else {
            writeValue(value, required());
        }
    }

    private void writeValue(Value value, PictureSelector.ActivePattern active) throws TransputError {
        Pattern p = active.pattern();
        Environment env = active.environment();
        TransputContext.Subject subject = new TransputContext.Subject(value.modeName(), p);
        if (value instanceof Value.Complex c) {
            if (p instanceof Pattern.Complex cp) {
                numeric.writeComplex(cp, BigDecimal.valueOf(c.re()), BigDecimal.valueOf(c.im()), false, env, subject);
            } else {
                writeValue(new Value.Real(c.re()), active);
                writeValue(new Value.Real(c.im()), required());
            }
            return;
        }
        if (value instanceof Value.LongComplex c) {
            if (p instanceof Pattern.Complex cp) {
                numeric.writeComplex(cp, c.re(), c.im(), true, env, subject);
            } else {
                writeValue(new Value.LongReal(c.re()), active);
                writeValue(new Value.LongReal(c.im()), required());
            }
            return;
        }
        if (p instanceof Pattern.General g) {
            general.write(g, value, env, subject);
            return;
        }
        if (value instanceof Value.Int || value instanceof Value.LongInt) {
            BigInteger n = value instanceof Value.Int i ? BigInteger.valueOf(i.value()) : ((Value.LongInt) value).value();
            boolean isLong = value instanceof Value.LongInt;
            if (p instanceof Pattern.Integral ip) {
                numeric.writeIntegral(ip, n, env, subject);
            } else if (p instanceof Pattern.Real rp) {
                numeric.writeReal(rp, new BigDecimal(n), isLong, env, subject);
            } else if (p instanceof Pattern.Complex cp) {
                numeric.writeComplex(cp, new BigDecimal(n), BigDecimal.ZERO, isLong, env, subject);
            } else if (p instanceof Pattern.Choice ch && ch.kind() == Pattern.ChoiceKind.INTEGRAL) {
                choice.writeSelector(ch, selectorOf(n), env, subject);
            } else if (p instanceof Pattern.CStyle cs && numericC(cs, true)) {
                cstyle.write(cs, value, env, subject);
            } else {
                ctx.patternMismatch(subject);
            }
        } else if (value instanceof Value.Real || value instanceof Value.LongReal) {
            BigDecimal x = GeneralPatternHandler.decimal(value);
            boolean isLong = value instanceof Value.LongReal;
            if (p instanceof Pattern.Real rp) {
                numeric.writeReal(rp, x, isLong, env, subject);
            } else if (p instanceof Pattern.Complex cp) {
                numeric.writeComplex(cp, x, BigDecimal.ZERO, isLong, env, subject);
            } else if (p instanceof Pattern.CStyle cs && numericC(cs, false)) {
                cstyle.write(cs, value, env, subject);
            } else {
                ctx.patternMismatch(subject);
            }
        } else if (value instanceof Value.Bool b) {
            if (p instanceof Pattern.Choice ch && ch.kind() == Pattern.ChoiceKind.BOOLEAN) {
                choice.writeBool(ch, b.value(), env, subject);
            } else {
                ctx.patternMismatch(subject);
            }
        } else if (value instanceof Value.Bits || value instanceof Value.LongBits) {
            if (p instanceof Pattern.Bits bp) {
                numeric.writeBits(bp, CStylePatternFormatter.bits(value), env, subject);
            } else if (p instanceof Pattern.CStyle cs && cs.kind() == Pattern.CKind.BITS) {
                cstyle.write(cs, value, env, subject);
            } else {
                ctx.patternMismatch(subject);
            }
        } else if (value instanceof Value.Char c) {
            if (p instanceof Pattern.Str sp) {
                strings.write(sp, String.valueOf(c.value()), env, subject);
            } else if (p instanceof Pattern.CStyle cs
                    && (cs.kind() == Pattern.CKind.CHAR || cs.kind() == Pattern.CKind.STRING)) {
                cstyle.write(cs, value, env, subject);
            } else {
                ctx.patternMismatch(subject);
            }
        } else if (value instanceof Value.Str s) {
            if (p instanceof Pattern.Str sp) {
                strings.write(sp, s.value(), env, subject);
            } else if (p instanceof Pattern.CStyle cs && cs.kind() == Pattern.CKind.STRING) {
                cstyle.write(cs, value, env, subject);
            } else {
                ctx.patternMismatch(subject);
            }
        } else {
            ctx.patternMismatch(subject);
        }
    }

    /** Selectors beyond the range of {@code long} are out of range for every choice. */
    private static long selectorOf(BigInteger n) {
        return n.bitLength() < Long.SIZE ? n.longValueExact() : 0;
    }

    private static boolean numericC(Pattern.CStyle p, boolean integral) {
        return switch (p.kind()) {
            case FIXED, FLOAT, GENERAL -> true;
            case INTEGRAL -> integral;
            default -> false;
        };
    }

    // ====== read dispatch ======

    private Value readValue(ValueMode mode) throws TransputError {
        PictureSelector.ActivePattern active = required();
        if (mode == ValueMode.COMPLEX || mode == ValueMode.LONG_COMPLEX) {
            if (active.pattern() instanceof Pattern.Complex) {
                return readWith(active, mode);
            }
            ValueMode part = mode.isLong() ? ValueMode.LONG_REAL : ValueMode.REAL;
            Value re = readWith(active, part);
            Value im = readWith(required(), part);
            if (mode == ValueMode.COMPLEX) {
                return new Value.Complex(((Value.Real) re).value(), ((Value.Real) im).value());
            }
            return new Value.LongComplex(((Value.LongReal) re).value(), ((Value.LongReal) im).value());
        }
        return readWith(active, mode);
    }

    private Value readWith(PictureSelector.ActivePattern active, ValueMode mode) throws TransputError {
        Pattern p = active.pattern();
        Environment env = active.environment();
        TransputContext.Subject subject = new TransputContext.Subject(mode.displayName(), p);
        if (p instanceof Pattern.General g) {
            return general.read(g, mode, env, subject);
        }
        boolean accepted = switch (mode) {
            case INT, LONG_INT -> p instanceof Pattern.Integral
                    || (p instanceof Pattern.CStyle cs && cs.kind() == Pattern.CKind.INTEGRAL)
                    || (mode == ValueMode.INT
                            && p instanceof Pattern.Choice ch
                            && ch.kind() == Pattern.ChoiceKind.INTEGRAL);
            case REAL, LONG_REAL -> p instanceof Pattern.Real
                    || (p instanceof Pattern.CStyle cs && numericC(cs, false));
            case COMPLEX, LONG_COMPLEX -> p instanceof Pattern.Complex;
            case BOOL -> p instanceof Pattern.Choice ch && ch.kind() == Pattern.ChoiceKind.BOOLEAN;
            case BITS, LONG_BITS -> p instanceof Pattern.Bits
                    || (p instanceof Pattern.CStyle cs && cs.kind() == Pattern.CKind.BITS);
            case CHAR -> p instanceof Pattern.Str
                    || (p instanceof Pattern.CStyle cs && cs.kind() == Pattern.CKind.CHAR);
            case STRING -> p instanceof Pattern.Str
                    || (p instanceof Pattern.CStyle cs && cs.kind() == Pattern.CKind.STRING);
        };
        if (!accepted) {
            ctx.patternMismatch(subject);
            return Denotations.zero(mode);
        }
        if (p instanceof Pattern.CStyle cs) {
            return cstyle.read(cs, mode, env, subject);
        } else if (p instanceof Pattern.Integral ip) {
            return numeric.readIntegral(ip, mode, env, subject);
        } else if (p instanceof Pattern.Real rp) {
            return numeric.readReal(rp, mode, env, subject);
        } else if (p instanceof Pattern.Complex cp) {
            return numeric.readComplex(cp, mode, env, subject);
        } else if (p instanceof Pattern.Bits bp) {
            return numeric.readBits(bp, mode, env, subject);
        } else if (p instanceof Pattern.Choice ch) {
            return ch.kind() == Pattern.ChoiceKind.BOOLEAN
                    ? choice.readBool(ch, env, subject)
                    : choice.readInt(ch, env, subject);
        } else if (p instanceof Pattern.Str sp) {
            return strings.read(sp, mode, env, subject);
        }
        throw new IllegalStateException("unhandled pattern " + p.describe());
    }
}
