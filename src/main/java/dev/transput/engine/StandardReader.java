package dev.transput.engine;

import java.util.Objects;

/**
 * Free-format input: skips leading white space where the mode allows it and collects one denotation.
 */
final class StandardReader {
    private final TransputContext ctx;
    private final Denotations denotations;

    StandardReader(TransputContext ctx, Denotations denotations) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.denotations = Objects.requireNonNull(denotations, "denotations");
    }

    Value read(ValueMode mode, TransputContext.Subject subject) throws TransputError {
        String text = switch (mode) {
            case INT, LONG_INT -> {
                skipWhiteSpace();
                StringBuilder sb = new StringBuilder();
                acceptSign(sb);
                acceptDigits(sb, MouldEngine.DECIMAL_DIGITS);
                yield sb.toString();
            }
            case REAL, LONG_REAL -> scanReal();
            case COMPLEX, LONG_COMPLEX -> {
                String re = scanReal();
                skipBlanks();
                StringBuilder sb = new StringBuilder(re);
                int c = ctx.file.nextChar();
                if (c == 'I' || c == 'i') {
                    sb.append('I');
                } else if (c != TransputFile.EOF) {
                    ctx.file.pushBack((char) c);
                }
                yield sb.append(scanReal()).toString();
            }
            case BOOL -> {
                skipWhiteSpace();
                yield String.valueOf(ctx.readChar());
            }
            case CHAR -> {
                int c = ctx.file.nextChar();
                if (c == '\n' || c == '\f') {
                    c = ctx.file.nextChar();
                }
                if (c == TransputFile.EOF) {
                    ctx.endOfFile();
                    c = ' ';
                }
                yield String.valueOf((char) c);
            }
            case STRING -> scanLine();
            case BITS, LONG_BITS -> scanBits();
        };
        Value value = denotations.parse(mode, text);
        if (value == null) {
            ctx.valueError(subject);
            return Denotations.zero(mode);
        }
        return value;
    }

    private String scanReal() {
        skipWhiteSpace();
        StringBuilder sb = new StringBuilder();
        acceptSign(sb);
        acceptDigits(sb, MouldEngine.DECIMAL_DIGITS);
        if (accept(sb, '.')) {
            acceptDigits(sb, MouldEngine.DECIMAL_DIGITS);
        }
        int c = ctx.file.nextChar();
        if (c == 'e' || c == 'E') {
            sb.append('e');
            acceptSign(sb);
            acceptDigits(sb, MouldEngine.DECIMAL_DIGITS);
        } else if (c != TransputFile.EOF) {
            ctx.file.pushBack((char) c);
        }
        return sb.toString();
    }

    private String scanLine() {
        StringBuilder sb = new StringBuilder();
        int c;
        while ((c = ctx.file.nextChar()) != TransputFile.EOF) {
            if (c == '\n' || c == '\f') {
                ctx.file.pushBack((char) c);
                break;
            }
            sb.append((char) c);
        }
        return sb.toString();
    }

    private String scanBits() {
        skipWhiteSpace();
        StringBuilder sb = new StringBuilder();
        int c = ctx.file.nextChar();
        TransputSettings s = ctx.settings;
        if (c == s.flipChar() || c == s.flopChar()) {
            while (c == s.flipChar() || c == s.flopChar()) {
                sb.append((char) c);
                c = ctx.file.nextChar();
            }
        } else {
            while (c != TransputFile.EOF && MouldEngine.DECIMAL_DIGITS.indexOf(c) >= 0) {
                sb.append((char) c);
                c = ctx.file.nextChar();
            }
            if (c == 'r') {
                sb.append('r');
                c = ctx.file.nextChar();
                while (c != TransputFile.EOF && MouldEngine.digitSet(16).indexOf(Character.toLowerCase(c)) >= 0) {
                    sb.append((char) c);
                    c = ctx.file.nextChar();
                }
            }
        }
        if (c != TransputFile.EOF) {
            ctx.file.pushBack((char) c);
        }
        return sb.toString();
    }

    /** Hex digits after skipping white space, for C-style bits input without a width. */
    String scanHexDigits() {
        skipWhiteSpace();
        StringBuilder sb = new StringBuilder();
        acceptDigits(sb, MouldEngine.digitSet(16));
        return sb.toString();
    }

    private void skipWhiteSpace() {
        int c;
        while ((c = ctx.file.nextChar()) != TransputFile.EOF) {
            if (c != ' ' && c != '\t' && c != '\n' && c != '\f' && c != '\r') {
                ctx.file.pushBack((char) c);
                return;
            }
        }
    }

    private void skipBlanks() {
        int c;
        while ((c = ctx.file.nextChar()) != TransputFile.EOF) {
            if (c != ' ') {
                ctx.file.pushBack((char) c);
                return;
            }
        }
    }

    private void acceptSign(StringBuilder sb) {
        int c = ctx.file.nextChar();
        if (c == '+' || c == '-') {
            sb.append((char) c);
            skipBlanks();
        } else if (c != TransputFile.EOF) {
            ctx.file.pushBack((char) c);
        }
    }

    private boolean accept(StringBuilder sb, char expected) {
        int c = ctx.file.nextChar();
        if (c == expected) {
            sb.append(expected);
            return true;
        }
        if (c != TransputFile.EOF) {
            ctx.file.pushBack((char) c);
        }
        return false;
    }

    private void acceptDigits(StringBuilder sb, String digitSet) {
        int c;
        while ((c = ctx.file.nextChar()) != TransputFile.EOF) {
            if (digitSet.indexOf(Character.toLowerCase((char) c)) < 0) {
                ctx.file.pushBack((char) c);
                return;
            }
            sb.append((char) c);
        }
    }
}
