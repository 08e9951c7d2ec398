package dev.transput.engine;

import dev.transput.format.Environment;
import dev.transput.format.Insertion;
import java.util.Objects;

/**
 * Executes insertions: emits or skips literal text and blanks, advances lines and pages, moves the position.
 */
public final class InsertionExecutor {
    /** How literals are written inside a mould whose leading zeros are still being suppressed. */
    enum Mood {
        NORMAL,
        BLANK
    }

    private final TransputContext ctx;

    InsertionExecutor(TransputContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    /** Executes {@code insertion} in the direction of the active call. */
    public void execute(Insertion insertion, Environment env) throws TransputError {
        if (ctx.reading()) {
            read(insertion, env);
        } else {
            write(insertion, env, Mood.NORMAL);
        }
    }

    void write(Insertion insertion, Environment env, Mood mood) throws TransputError {
        OutputBuffer out = ctx.buffer;
        if (insertion instanceof Insertion.Literal lit) {
            if (mood == Mood.BLANK) {
                out.blanks(lit.text().length());
            } else {
                out.append(lit.text());
            }
        } else if (insertion instanceof Insertion.Space) {
            out.append(' ');
        } else if (insertion instanceof Insertion.LineBreak) {
            out.flushTo(ctx.file);
            if (!ctx.fire(TransputEvent.LINE_END)) {
                ctx.file.newLine();
            }
        } else if (insertion instanceof Insertion.PageBreak) {
            out.flushTo(ctx.file);
            if (!ctx.fire(TransputEvent.PAGE_END)) {
                ctx.file.newPage();
            }
        } else if (insertion instanceof Insertion.BackSkip b) {
            int n = ctx.count(b.count(), env);
            out.flushTo(ctx.file);
            ctx.file.reposition(-n);
        } else if (insertion instanceof Insertion.Column c) {
            int target = ctx.count(c.count(), env);
            int column = ctx.file.column() + out.length();
            out.blanks(target - 1 - column);
        } else if (insertion instanceof Insertion.Replicated r) {
            int n = ctx.count(r.count(), env);
            for (int k = 0; k < n; k++) {
                for (Insertion item : r.items()) {
                    write(item, env, mood);
                }
            }
        } else {
            throw new IllegalStateException("unknown insertion " + insertion);
        }
    }

    void read(Insertion insertion, Environment env) throws TransputError {
        TransputFile file = ctx.file;
        if (insertion instanceof Insertion.Literal lit) {
            // Literal text is skipped, not checked.
            for (int k = 0; k < lit.text().length() && !file.atEof(); k++) {
                file.nextChar();
            }
        } else if (insertion instanceof Insertion.Space) {
            if (!file.atEof()) {
                file.nextChar();
            }
        } else if (insertion instanceof Insertion.LineBreak) {
            if (!ctx.fire(TransputEvent.LINE_END)) {
                skipPast('\n');
            }
        } else if (insertion instanceof Insertion.PageBreak) {
            if (!ctx.fire(TransputEvent.PAGE_END)) {
                skipPast('\f');
            }
        } else if (insertion instanceof Insertion.BackSkip b) {
            file.reposition(-ctx.count(b.count(), env));
        } else if (insertion instanceof Insertion.Column c) {
            int target = ctx.count(c.count(), env);
            while (file.column() < target - 1 && !file.atEof()) {
                int ch = file.nextChar();
                if (ch == '\n' || ch == '\f') {
                    file.pushBack((char) ch);
                    break;
                }
            }
        } else if (insertion instanceof Insertion.Replicated r) {
            int n = ctx.count(r.count(), env);
            for (int k = 0; k < n; k++) {
                for (Insertion item : r.items()) {
                    read(item, env);
                }
            }
        } else {
            throw new IllegalStateException("unknown insertion " + insertion);
        }
    }

    /** The characters a literal-only insertion stands for; used to match choice alternatives. */
    String text(Insertion insertion, Environment env) throws TransputError {
        StringBuilder sb = new StringBuilder();
        appendText(insertion, env, sb);
        return sb.toString();
    }

    private void appendText(Insertion insertion, Environment env, StringBuilder sb) throws TransputError {
        if (insertion instanceof Insertion.Literal lit) {
            sb.append(lit.text());
        } else if (insertion instanceof Insertion.Space) {
            sb.append(' ');
        } else if (insertion instanceof Insertion.Replicated r) {
            int n = ctx.count(r.count(), env);
            for (int k = 0; k < n; k++) {
                for (Insertion item : r.items()) {
                    appendText(item, env, sb);
                }
            }
        }
        // Layout insertions carry no characters to match.
    }

    private void skipPast(char terminator) {
        TransputFile file = ctx.file;
        while (!file.atEof()) {
            if (file.nextChar() == terminator) {
                return;
            }
        }
    }
}
