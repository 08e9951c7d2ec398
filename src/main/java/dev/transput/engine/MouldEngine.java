package dev.transput.engine;

import dev.transput.format.Environment;
import dev.transput.format.Insertion;
import dev.transput.format.Mould;
import dev.transput.format.MouldItem;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders and parses the fixed-shape digit sequences described by moulds.
 */
final class MouldEngine {
    static final String DECIMAL_DIGITS = "0123456789";
    private static final String ALL_DIGITS = "0123456789abcdef";

    private final TransputContext ctx;
    private final InsertionExecutor insertions;

    MouldEngine(TransputContext ctx, InsertionExecutor insertions) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.insertions = Objects.requireNonNull(insertions, "insertions");
    }

    static String digitSet(int radix) {
        return ALL_DIGITS.substring(0, radix);
    }

    /** Expands repeats; each dynamic count is evaluated once. A {@code null} mould flattens to nothing. */
    List<MouldItem> flatten(Mould mould, Environment env) throws TransputError {
        ArrayList<MouldItem> out = new ArrayList<>();
        if (mould != null) {
            flattenInto(mould.items(), env, out);
        }
        return out;
    }

    private void flattenInto(List<MouldItem> items, Environment env, ArrayList<MouldItem> out) throws TransputError {
        for (MouldItem item : items) {
            if (item instanceof MouldItem.Repeat r) {
                int n = ctx.count(r.count(), env);
                for (int k = 0; k < n; k++) {
                    flattenInto(r.items(), env, out);
                }
            } else {
                out.add(item);
            }
        }
    }

    /** Number of digit positions; {@code s} frames count unless they sit in a sign mould. */
    static int digitPositions(List<MouldItem> flat, boolean signMould) {
        int n = 0;
        for (MouldItem item : flat) {
            if (item == MouldItem.DigitFrame.ZERO_SUPPRESSING || item == MouldItem.DigitFrame.MANDATORY) {
                n++;
            } else if (item == MouldItem.DigitFrame.SUPPRESSED && !signMould) {
                n++;
            }
        }
        return n;
    }

    // ====== write ======

    /** Edit string being rendered: an optional sign followed by digits. */
    static final class Edit {
        private final char[] chars;
        private int pos;

        Edit(char[] chars) {
            this.chars = chars;
        }

        Edit(String s) {
            this(s.toCharArray());
        }

        /** Zero-padded digits of width {@code width}, preceded by {@code sign} unless it is {@code 0}. */
        static Edit of(char sign, String digits, int width) {
            StringBuilder sb = new StringBuilder(width + 1);
            if (sign != 0) {
                sb.append(sign);
            }
            for (int k = digits.length(); k < width; k++) {
                sb.append('0');
            }
            sb.append(digits);
            return new Edit(sb.toString());
        }

        char[] chars() {
            return chars;
        }

        boolean atSign() {
            return pos < chars.length && (SignHandler.isSign(chars[pos]) || chars[pos] == ' ');
        }

        char next() {
            return pos < chars.length ? chars[pos++] : 0;
        }

        boolean exhausted() {
            return pos >= chars.length;
        }
    }

    /** Suppression state shared by the moulds of one numeric field. */
    static final class Suppression {
        private boolean digits = true;
        private boolean insertions = false;

        static Suppression blank() {
            return new Suppression();
        }

        static Suppression normal() {
            Suppression s = new Suppression();
            s.digits = false;
            return s;
        }

        private void stop() {
            digits = false;
            insertions = false;
        }
    }

    void write(List<MouldItem> flat, Edit edit, Suppression mood, boolean signMould, Environment env)
            throws TransputError {
        OutputBuffer out = ctx.buffer;
        for (MouldItem item : flat) {
            if (item instanceof Insertion ins) {
                insertions.write(ins, env, mood.insertions ? InsertionExecutor.Mood.BLANK : InsertionExecutor.Mood.NORMAL);
            } else if (item == MouldItem.DigitFrame.ZERO_SUPPRESSING) {
                putSign(edit);
                char c = edit.next();
                if (c == 0) {
                    continue;
                }
                if (c == '0' && mood.digits) {
                    out.append(' ');
                    mood.insertions = true;
                } else {
                    out.append(c);
                    mood.stop();
                }
            } else if (item == MouldItem.DigitFrame.MANDATORY) {
                putSign(edit);
                char c = edit.next();
                if (c != 0) {
                    out.append(c);
                }
                mood.stop();
            } else if (item == MouldItem.DigitFrame.SUPPRESSED) {
                if (!signMould) {
                    edit.next();
                }
            }
            // Sign frames print through the edit string.
        }
    }

    /** Emits whatever the frames did not consume, such as a sign that floated past every frame. */
    void writeRemainder(Edit edit) {
        while (!edit.exhausted()) {
            ctx.buffer.append(edit.next());
        }
    }

    private void putSign(Edit edit) {
        if (edit.atSign()) {
            ctx.buffer.append(edit.next());
        }
    }

    // ====== read ======

    /** Accumulates a sign and digits while reading one numeric field. */
    static final class Reading {
        private final StringBuilder digits = new StringBuilder();
        private char sign;
        private boolean signOpen;

        /** A field with a sign mould: the sign slot is still to be found. */
        static Reading signed() {
            Reading r = new Reading();
            r.signOpen = true;
            return r;
        }

        static Reading unsigned() {
            return new Reading();
        }

        String digits() {
            return digits.toString();
        }

        char sign() {
            return sign;
        }
    }

    /** Reads the sign slot that precedes the frames of a signed field. */
    void readSignSlot(Reading state, TransputContext.Subject subject) throws TransputError {
        char c = ctx.readChar();
        if (SignHandler.isSign(c)) {
            state.sign = c;
            state.signOpen = false;
        } else if (c == ' ') {
            // The sign floated further right, or this is a blank sign.
        } else if (DECIMAL_DIGITS.indexOf(c) >= 0) {
            // A digit where the sign belongs: '+' is assumed.
            state.digits.append(c);
            state.signOpen = false;
        } else {
            ctx.signError(subject);
        }
    }

    void read(
            List<MouldItem> flat,
            Reading state,
            String digitSet,
            boolean signMould,
            Environment env,
            TransputContext.Subject subject)
            throws TransputError {
        for (MouldItem item : flat) {
            if (item instanceof Insertion ins) {
                insertions.read(ins, env);
            } else if (item == MouldItem.DigitFrame.ZERO_SUPPRESSING) {
                char c = ctx.readChar();
                if (state.signOpen && SignHandler.isSign(c)) {
                    state.sign = c;
                    state.signOpen = false;
                    state.digits.append('0');
                } else if (c == ' ') {
                    state.digits.append('0');
                } else if (isDigit(c, digitSet)) {
                    state.digits.append(Character.toLowerCase(c));
                    state.signOpen = false;
                } else {
                    mismatch(state, subject);
                }
            } else if (item == MouldItem.DigitFrame.MANDATORY) {
                char c = ctx.readChar();
                if (isDigit(c, digitSet)) {
                    state.digits.append(Character.toLowerCase(c));
                } else {
                    mismatch(state, subject);
                }
                state.signOpen = false;
            } else if (item == MouldItem.DigitFrame.SUPPRESSED) {
                if (!signMould) {
                    state.digits.append('0');
                }
            }
        }
    }

    private void mismatch(Reading state, TransputContext.Subject subject) throws TransputError {
        ctx.valueError(subject);
        state.digits.append('0');
    }

    private static boolean isDigit(char c, String digitSet) {
        return digitSet.indexOf(Character.toLowerCase(c)) >= 0;
    }
}
