package dev.transput.engine;

import dev.transput.format.Environment;
import dev.transput.format.Pattern;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * printf/scanf-style patterns {@code %[-][+][w][.p]letter}.
 */
public final class CStylePatternFormatter {
    private final TransputContext ctx;
    private final Stringify stringify;
    private final StandardReader reader;
    private final Denotations denotations;

    CStylePatternFormatter(TransputContext ctx, Stringify stringify, StandardReader reader, Denotations denotations) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.stringify = Objects.requireNonNull(stringify, "stringify");
        this.reader = Objects.requireNonNull(reader, "reader");
        this.denotations = Objects.requireNonNull(denotations, "denotations");
    }

    static int radix(char letter) {
        return switch (letter) {
            case 'b' -> 2;
            case 'o' -> 8;
            case 'x' -> 16;
            default -> 10;
        };
    }

    private static int nibble(int radix) {
        return switch (radix) {
            case 2 -> 1;
            case 8 -> 3;
            case 16 -> 4;
            default -> 1;
        };
    }

    // ====== write ======

    void write(Pattern.CStyle p, Value value, Environment env, TransputContext.Subject subject) throws TransputError {
        Integer w = p.width() == null ? null : ctx.count(p.width(), env);
        Integer prec = p.precision() == null ? null : ctx.count(p.precision(), env);
        boolean sign = p.forcedSign();
        int width;
        String str;
        switch (p.kind()) {
            case CHAR, STRING -> {
                str = value instanceof Value.Char c ? String.valueOf(c.value()) : ((Value.Str) value).value();
                width = w != null ? w : str.length();
            }
            case INTEGRAL -> {
                width = w != null ? w : 0;
                str = stringify.whole(integer(value), sign ? width : -width);
            }
            case FIXED, FLOAT, GENERAL -> {
                boolean isLong = GeneralPatternHandler.isLong(value);
                int realWidth = ctx.settings.realWidth(isLong);
                int expWidth = ctx.settings.expWidth(isLong);
                BigDecimal x = GeneralPatternHandler.decimal(value);
                int digits = w != null ? w : 0;
                int after = prec != null ? prec : realWidth - 1;
                int exponent = 0;
                String s = null;
                width = 0;
                if (p.kind() != Pattern.CKind.FIXED) {
                    int expo = expWidth + 1;
                    width = realWidth + expWidth + 4;
                    if (digits == 0 && after > 0) {
                        width = after + expo + 4;
                    } else if (digits > 0) {
                        width = digits;
                    }
                    s = stringify.floatForm(x, sign ? width : -width, after, expo, realWidth);
                    exponent = exponentOf(s);
                }
                if (p.kind() == Pattern.CKind.FIXED
                        || (p.kind() == Pattern.CKind.GENERAL && exponent > -4 && exponent <= after)) {
                    width = realWidth + 2;
                    if (digits == 0 && after > 0) {
                        width = after + 2;
                    } else if (digits > 0) {
                        width = digits;
                    }
                    s = stringify.fixed(x, sign ? width : -width, after, realWidth);
                }
                str = s;
            }
            case BITS -> {
                int radix = radix(p.letter());
                boolean isLong = value instanceof Value.LongBits;
                width = w != null && w > 0
                        ? w
                        : (int) Math.ceil((double) ctx.settings.bitsWidth(isLong) / nibble(radix));
                String digits = stringify.convertRadix(bits(value), radix, width);
                str = digits != null ? digits : stringify.errorChars(width);
            }
            default -> throw new IllegalStateException("unknown C-style kind " + p.kind());
        }
        boolean text = p.kind() == Pattern.CKind.CHAR || p.kind() == Pattern.CKind.STRING;
        if (!text && stringify.failed(str)) {
            fail(width, subject);
            return;
        }
        if (width == 0) {
            ctx.buffer.append(str);
        } else if (p.align() == Pattern.Align.RIGHT) {
            int blanks = width - str.length();
            if (blanks < 0) {
                fail(width, subject);
                return;
            }
            ctx.buffer.blanks(blanks);
            ctx.buffer.append(str);
        } else {
            String stripped = str.stripLeading();
            int blanks = width - stripped.length();
            if (blanks < 0) {
                fail(width, subject);
                return;
            }
            ctx.buffer.append(stripped);
            ctx.buffer.blanks(blanks);
        }
    }

    private void fail(int width, TransputContext.Subject subject) throws TransputError {
        ctx.valueError(subject);
        ctx.buffer.append(stringify.errorChars(width));
    }

    /** Decimal exponent of a float-form text, {@code 0} when there is none. */
    private static int exponentOf(String s) {
        int e = s.indexOf('e');
        if (e < 0) {
            return 0;
        }
        try {
            return Integer.parseInt(s.substring(e + 1).replace(" ", ""));
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    private static BigInteger integer(Value value) {
        if (value instanceof Value.Int v) {
            return BigInteger.valueOf(v.value());
        }
        if (value instanceof Value.LongInt v) {
            return v.value();
        }
        throw new IllegalArgumentException("not an integer: " + value.modeName());
    }

    static BigInteger bits(Value value) {
        if (value instanceof Value.Bits v) {
            return new BigInteger(Long.toUnsignedString(v.value()));
        }
        if (value instanceof Value.LongBits v) {
            return v.value();
        }
        throw new IllegalArgumentException("not a bits value: " + value.modeName());
    }

    // ====== read ======

    Value read(Pattern.CStyle p, ValueMode mode, Environment env, TransputContext.Subject subject)
            throws TransputError {
        int width = p.width() == null ? 0 : ctx.count(p.width(), env);
        if (p.precision() != null) {
            ctx.count(p.precision(), env);
        }
        switch (p.kind()) {
            case CHAR -> {
                if (width == 0) {
                    return reader.read(mode, subject);
                }
                String s = scan(width);
                if (width > 1 && p.align() == Pattern.Align.LEFT) {
                    s = s.substring(0, 1);
                }
                return convert(mode, s, subject);
            }
            case BITS -> {
                int radix = radix(p.letter());
                String digits = width == 0 ? reader.scanHexDigits() : scan(width).strip();
                return convert(mode, radix + "r" + digits, subject);
            }
            default -> {
                if (width == 0) {
                    return reader.read(mode, subject);
                }
                boolean numeric = p.kind() != Pattern.CKind.STRING;
                return convert(mode, scan(numeric && p.forcedSign() ? width + 1 : width), subject);
            }
        }
    }

    private String scan(int n) throws TransputError {
        StringBuilder sb = new StringBuilder(n);
        for (int k = 0; k < n; k++) {
            sb.append(ctx.readChar());
        }
        return sb.toString();
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
