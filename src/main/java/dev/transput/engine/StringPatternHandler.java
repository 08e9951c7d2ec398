package dev.transput.engine;

import dev.transput.format.Environment;
import dev.transput.format.Insertion;
import dev.transput.format.Pattern;
import dev.transput.format.StringItem;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * String patterns: {@code a} frames carry characters of a CHAR or STRING value, {@code s} frames skip one.
 */
public final class StringPatternHandler {
    private final TransputContext ctx;
    private final InsertionExecutor insertions;

    StringPatternHandler(TransputContext ctx, InsertionExecutor insertions) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.insertions = Objects.requireNonNull(insertions, "insertions");
    }

    void write(Pattern.Str p, String value, Environment env, TransputContext.Subject subject) throws TransputError {
        List<StringItem> items = flatten(p.items(), env);
        int frames = 0;
        for (StringItem item : items) {
            if (item instanceof StringItem.StringFrame) {
                frames++;
            }
        }
        boolean fits = frames == value.length();
        if (!fits) {
            ctx.valueError(subject);
        }
        int next = 0;
        for (StringItem item : items) {
            if (item instanceof Insertion ins) {
                insertions.write(ins, env, InsertionExecutor.Mood.NORMAL);
            } else if (item == StringItem.StringFrame.CHARACTER) {
                ctx.buffer.append(fits ? value.charAt(next) : ctx.settings.errorChar());
                next++;
            } else if (item == StringItem.StringFrame.SKIP) {
                next++;
            }
        }
    }

    Value read(Pattern.Str p, ValueMode mode, Environment env, TransputContext.Subject subject) throws TransputError {
        StringBuilder sb = new StringBuilder();
        for (StringItem item : flatten(p.items(), env)) {
            if (item instanceof Insertion ins) {
                insertions.read(ins, env);
            } else if (item == StringItem.StringFrame.CHARACTER) {
                sb.append(ctx.readChar());
            } else if (item == StringItem.StringFrame.SKIP) {
                sb.append(' ');
            }
        }
        if (mode == ValueMode.CHAR) {
            if (sb.length() != 1) {
                ctx.valueError(subject);
                return new Value.Char(sb.length() == 0 ? ' ' : sb.charAt(0));
            }
            return new Value.Char(sb.charAt(0));
        }
        return new Value.Str(sb.toString());
    }

    private List<StringItem> flatten(List<StringItem> items, Environment env) throws TransputError {
        ArrayList<StringItem> out = new ArrayList<>();
        flattenInto(items, env, out);
        return out;
    }

    private void flattenInto(List<StringItem> items, Environment env, ArrayList<StringItem> out) throws TransputError {
        for (StringItem item : items) {
            if (item instanceof StringItem.Repeat r) {
                int n = ctx.count(r.count(), env);
                for (int k = 0; k < n; k++) {
                    flattenInto(r.items(), env, out);
                }
            } else {
                out.add(item);
            }
        }
    }
}
