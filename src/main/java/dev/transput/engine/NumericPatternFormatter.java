package dev.transput.engine;

import dev.transput.format.Environment;
import dev.transput.format.Insertion;
import dev.transput.format.Mould;
import dev.transput.format.MouldItem;
import dev.transput.format.Pattern;
import dev.transput.format.SymbolFrame;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Integral, real, complex and bits patterns.
 *
 * <p>A numeric field is the sign mould and the digit mould rendered together: the sign floats across both. After a
 * mended value error the field is rendered with error characters in every digit position.</p>
 */
public final class NumericPatternFormatter {
    private static final char POINT = '.';
    private static final char EXPONENT = 'e';
    private static final char CONNECTIVE = 'I';

    private final TransputContext ctx;
    private final MouldEngine moulds;
    private final InsertionExecutor insertions;
    private final Stringify stringify;
    private final Denotations denotations;

    NumericPatternFormatter(
            TransputContext ctx,
            MouldEngine moulds,
            InsertionExecutor insertions,
            Stringify stringify,
            Denotations denotations) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.moulds = Objects.requireNonNull(moulds, "moulds");
        this.insertions = Objects.requireNonNull(insertions, "insertions");
        this.stringify = Objects.requireNonNull(stringify, "stringify");
        this.denotations = Objects.requireNonNull(denotations, "denotations");
    }

    // ====== write ======

    void writeIntegral(Pattern.Integral p, BigInteger value, Environment env, TransputContext.Subject subject)
            throws TransputError {
        writeSigned(p.sign(), p.digits(), value, env, subject);
    }

    void writeReal(Pattern.Real p, BigDecimal x, boolean isLong, Environment env, TransputContext.Subject subject)
            throws TransputError {
        List<MouldItem> signItems = moulds.flatten(p.sign(), env);
        List<MouldItem> intItems = moulds.flatten(p.integer(), env);
        List<MouldItem> fracItems = moulds.flatten(p.fraction(), env);
        int stag = MouldEngine.digitPositions(signItems, true) + MouldEngine.digitPositions(intItems, false);
        int frac = MouldEngine.digitPositions(fracItems, false);
        int mantissa = p.point() == null ? stag : 1 + stag + frac;

        int signum = x.signum();
        BigDecimal mag = x.abs();
        int exponent = 0;
        if (p.exponent() != null) {
            LongArithmetic.Standardised st = ctx.arithmetic.standardise(mag, stag, frac);
            mag = st.value();
            exponent = st.exponent();
        }

        String intDigits = null;
        String fracDigits = null;
        if (p.sign() == null && signum < 0) {
            ctx.signError(subject);
        } else {
            String fixed = stringify.subFixed(mag, mantissa, frac, ctx.settings.realWidth(isLong));
            if (fixed == null) {
                ctx.valueError(subject);
            } else {
                int dot = fixed.indexOf(POINT);
                intDigits = dot < 0 ? fixed : fixed.substring(0, dot);
                fracDigits = dot < 0 ? "" : fixed.substring(dot + 1);
            }
        }
        boolean failed = intDigits == null;

        renderSigned(p.sign(), signItems, intItems, signum, intDigits, env, subject);
        if (p.point() != null) {
            writeSymbol(p.point(), POINT, env);
        }
        if (p.fraction() != null) {
            MouldEngine.Edit edit = failed ? errorEdit(frac) : new MouldEngine.Edit(fracDigits);
            moulds.write(fracItems, edit, MouldEngine.Suppression.normal(), false, env);
        }
        if (p.exponent() != null) {
            Pattern.Real.Exponent e = p.exponent();
            writeSymbol(e.frame(), EXPONENT, env);
            if (failed) {
                List<MouldItem> expSign = moulds.flatten(e.sign(), env);
                List<MouldItem> expDigits = moulds.flatten(e.digits(), env);
                renderSigned(e.sign(), expSign, expDigits, 1, null, env, subject);
            } else {
                writeSigned(e.sign(), e.digits(), BigInteger.valueOf(exponent), env, subject);
            }
        }
    }

    void writeComplex(
            Pattern.Complex p,
            BigDecimal re,
            BigDecimal im,
            boolean isLong,
            Environment env,
            TransputContext.Subject subject)
            throws TransputError {
        writeReal(p.real(), re, isLong, env, subject);
        writeSymbol(p.connective(), CONNECTIVE, env);
        writeReal(p.imaginary(), im, isLong, env, subject);
    }

    void writeBits(Pattern.Bits p, BigInteger value, Environment env, TransputContext.Subject subject)
            throws TransputError {
        int radix = ctx.radix(p.radix(), env);
        List<MouldItem> items = moulds.flatten(p.digits(), env);
        int width = MouldEngine.digitPositions(items, false);
        String digits = null;
        if (radix > 0) {
            digits = stringify.convertRadix(value, radix, width);
            if (digits == null) {
                ctx.valueError(subject);
            }
        }
        MouldEngine.Edit edit = digits == null ? errorEdit(width) : new MouldEngine.Edit(digits);
        moulds.write(items, edit, MouldEngine.Suppression.blank(), false, env);
    }

    private void writeSigned(Mould sign, Mould digits, BigInteger value, Environment env, TransputContext.Subject subject)
            throws TransputError {
        List<MouldItem> signItems = moulds.flatten(sign, env);
        List<MouldItem> digitItems = moulds.flatten(digits, env);
        String magnitude = ctx.arithmetic.digitsOf(value, 10);
        if (sign == null && value.signum() < 0) {
            ctx.signError(subject);
            magnitude = null;
        }
        renderSigned(sign, signItems, digitItems, value.signum(), magnitude, env, subject);
    }

    /**
     * Renders a sign mould and a digit mould as one field. {@code magnitude == null} renders error characters; a
     * magnitude wider than the field is reported and rendered the same way.
     */
    private void renderSigned(
            Mould sign,
            List<MouldItem> signItems,
            List<MouldItem> digitItems,
            int signum,
            String magnitude,
            Environment env,
            TransputContext.Subject subject)
            throws TransputError {
        int width = MouldEngine.digitPositions(signItems, true) + MouldEngine.digitPositions(digitItems, false);
        MouldEngine.Edit edit;
        if (magnitude != null && magnitude.length() > width) {
            ctx.valueError(subject);
            magnitude = null;
        }
        if (magnitude == null) {
            edit = errorEdit(width + (sign == null ? 0 : 1));
        } else if (sign == null) {
            edit = MouldEngine.Edit.of((char) 0, magnitude, width);
        } else {
            char signChar = SignHandler.signChar(signum, sign.signFrame().orElseThrow());
            edit = MouldEngine.Edit.of(signChar, magnitude, width);
            ArrayList<MouldItem> frames = new ArrayList<>(signItems);
            frames.addAll(digitItems);
            SignHandler.shift(edit.chars(), frames);
        }
        MouldEngine.Suppression mood = MouldEngine.Suppression.blank();
        moulds.write(signItems, edit, mood, true, env);
        moulds.write(digitItems, edit, mood, false, env);
        moulds.writeRemainder(edit);
    }

    private MouldEngine.Edit errorEdit(int width) {
        return new MouldEngine.Edit(String.valueOf(ctx.settings.errorChar()).repeat(Math.max(0, width)));
    }

    private void writeSymbol(SymbolFrame frame, char symbol, Environment env) throws TransputError {
        for (Insertion ins : frame.insertions()) {
            insertions.write(ins, env, InsertionExecutor.Mood.NORMAL);
        }
        if (!frame.suppressed()) {
            ctx.buffer.append(symbol);
        }
    }

    // ====== read ======

    Value readIntegral(Pattern.Integral p, ValueMode mode, Environment env, TransputContext.Subject subject)
            throws TransputError {
        String text = readSigned(p.sign(), p.digits(), MouldEngine.DECIMAL_DIGITS, env, subject);
        return convert(mode, text, subject);
    }

    Value readReal(Pattern.Real p, ValueMode mode, Environment env, TransputContext.Subject subject)
            throws TransputError {
        return convert(mode, readRealText(p, env, subject), subject);
    }

    Value readComplex(Pattern.Complex p, ValueMode mode, Environment env, TransputContext.Subject subject)
            throws TransputError {
        ValueMode part = mode == ValueMode.LONG_COMPLEX ? ValueMode.LONG_REAL : ValueMode.REAL;
        Value re = convert(part, readRealText(p.real(), env, subject), subject);
        readSymbol(p.connective(), CONNECTIVE, new StringBuilder(), env, subject);
        Value im = convert(part, readRealText(p.imaginary(), env, subject), subject);
        if (part == ValueMode.REAL) {
            return new Value.Complex(((Value.Real) re).value(), ((Value.Real) im).value());
        }
        return new Value.LongComplex(((Value.LongReal) re).value(), ((Value.LongReal) im).value());
    }

    Value readBits(Pattern.Bits p, ValueMode mode, Environment env, TransputContext.Subject subject)
            throws TransputError {
        int radix = ctx.radix(p.radix(), env);
        if (radix < 0) {
            return Denotations.zero(mode);
        }
        List<MouldItem> items = moulds.flatten(p.digits(), env);
        MouldEngine.Reading state = MouldEngine.Reading.unsigned();
        moulds.read(items, state, MouldEngine.digitSet(radix), false, env, subject);
        return convert(mode, radix + "r" + state.digits(), subject);
    }

    private String readRealText(Pattern.Real p, Environment env, TransputContext.Subject subject)
            throws TransputError {
        StringBuilder den = new StringBuilder(readSigned(p.sign(), p.integer(), MouldEngine.DECIMAL_DIGITS, env, subject));
        if (den.length() == 1) {
            den.append('0');
        }
        if (p.point() != null) {
            readSymbol(p.point(), POINT, den, env, subject);
        }
        if (p.fraction() != null) {
            MouldEngine.Reading state = MouldEngine.Reading.unsigned();
            moulds.read(moulds.flatten(p.fraction(), env), state, MouldEngine.DECIMAL_DIGITS, false, env, subject);
            den.append(state.digits());
        }
        if (p.exponent() != null) {
            Pattern.Real.Exponent e = p.exponent();
            readSymbol(e.frame(), EXPONENT, den, env, subject);
            den.append(readSigned(e.sign(), e.digits(), MouldEngine.DECIMAL_DIGITS, env, subject));
        }
        return den.toString();
    }

    /** Reads a sign mould and digit mould as one field; the result is a sign followed by the digits. */
    private String readSigned(
            Mould sign, Mould digits, String digitSet, Environment env, TransputContext.Subject subject)
            throws TransputError {
        List<MouldItem> signItems = moulds.flatten(sign, env);
        List<MouldItem> digitItems = moulds.flatten(digits, env);
        MouldEngine.Reading state = sign == null ? MouldEngine.Reading.unsigned() : MouldEngine.Reading.signed();
        if (sign != null) {
            moulds.readSignSlot(state, subject);
        }
        moulds.read(signItems, state, digitSet, true, env, subject);
        moulds.read(digitItems, state, digitSet, false, env, subject);
        return (state.sign() == '-' ? "-" : "+") + state.digits();
    }

    private void readSymbol(
            SymbolFrame frame, char symbol, StringBuilder den, Environment env, TransputContext.Subject subject)
            throws TransputError {
        for (Insertion ins : frame.insertions()) {
            insertions.read(ins, env);
        }
        if (!frame.suppressed()) {
            char c = ctx.readChar();
            if (Character.toLowerCase(c) != Character.toLowerCase(symbol)) {
                ctx.valueError(subject);
            }
        }
        den.append(symbol);
    }

    private Value convert(ValueMode mode, String text, TransputContext.Subject subject) throws TransputError {
        Value value = denotations.parse(mode, text);
        if (value == null) {
            ctx.valueError(subject);
            return Denotations.zero(mode);
        }
        return value;
    }
}
