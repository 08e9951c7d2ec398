package dev.transput.engine;

import dev.transput.format.Environment;
import dev.transput.format.Insertion;
import dev.transput.format.Pattern;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Boolean and integral choice patterns: a 1-based selector picks one of a list of literal alternatives.
 */
public final class ChoicePatternHandler {
    private static final Logger LOGGER = Logger.getLogger(ChoicePatternHandler.class.getName());

    private final TransputContext ctx;
    private final InsertionExecutor insertions;

    ChoicePatternHandler(TransputContext ctx, InsertionExecutor insertions) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.insertions = Objects.requireNonNull(insertions, "insertions");
    }

    void writeSelector(Pattern.Choice p, long selector, Environment env, TransputContext.Subject subject)
            throws TransputError {
        List<Insertion> alternatives = p.alternatives();
        if (selector < 1 || selector > alternatives.size()) {
            ctx.valueError(subject);
            ctx.buffer.append(ctx.settings.errorChar());
            return;
        }
        insertions.write(alternatives.get((int) selector - 1), env, InsertionExecutor.Mood.NORMAL);
    }

    void writeBool(Pattern.Choice p, boolean value, Environment env, TransputContext.Subject subject)
            throws TransputError {
        if (p.alternatives().isEmpty()) {
            ctx.buffer.append(value ? ctx.settings.flipChar() : ctx.settings.flopChar());
            return;
        }
        writeSelector(p, value ? 1 : 2, env, subject);
    }

    Value readBool(Pattern.Choice p, Environment env, TransputContext.Subject subject) throws TransputError {
        if (p.alternatives().isEmpty()) {
            char c = ctx.readChar();
            if (c == ctx.settings.flipChar()) {
                return new Value.Bool(true);
            }
            if (c != ctx.settings.flopChar()) {
                ctx.valueError(subject);
            }
            return new Value.Bool(false);
        }
        return new Value.Bool(readSelector(p, env, subject) == 1);
    }

    Value readInt(Pattern.Choice p, Environment env, TransputContext.Subject subject) throws TransputError {
        return new Value.Int(readSelector(p, env, subject));
    }

    /**
     * Reads characters until no alternative can match any more. The longest alternative matched in full wins, ties
     * going to the first declared; failing that, an alternative that was the only candidate at the previous length
     * wins. Look-ahead past the chosen alternative is pushed back. Returns {@code 0} after a mended mismatch.
     */
    int readSelector(Pattern.Choice p, Environment env, TransputContext.Subject subject) throws TransputError {
        ArrayList<String> texts = new ArrayList<>();
        for (Insertion alt : p.alternatives()) {
            texts.add(insertions.text(alt, env));
        }
        TransputFile file = ctx.file;
        StringBuilder seen = new StringBuilder();
        int best = -1;
        int bestLength = 0;
        int unique = -1;
        int uniqueLength = 0;
        while (!file.atEof()) {
            seen.append((char) file.nextChar());
            int matches = 0;
            int first = -1;
            int full = -1;
            for (int k = 0; k < texts.size(); k++) {
                String text = texts.get(k);
                if (text.startsWith(seen.toString())) {
                    matches++;
                    if (first < 0) {
                        first = k;
                    }
                    if (full < 0 && text.length() == seen.length()) {
                        full = k;
                    }
                }
            }
            if (matches == 0) {
                break;
            }
            if (full >= 0) {
                if (matches == 1) {
                    return full + 1;
                }
                best = full;
                bestLength = seen.length();
            }
            if (matches == 1) {
                unique = first;
                uniqueLength = seen.length();
            } else {
                unique = -1;
            }
        }
        int chosen;
        int length;
        if (best >= 0) {
            chosen = best;
            length = bestLength;
        } else if (unique >= 0) {
            chosen = unique;
            length = uniqueLength;
        } else {
            ctx.valueError(subject);
            return 0;
        }
        for (int k = seen.length() - 1; k >= length; k--) {
            file.pushBack(seen.charAt(k));
        }
        int selected = chosen;
        LOGGER.log(Level.FINEST, () -> "choice matched alternative " + (selected + 1) + " of " + texts.size());
        return chosen + 1;
    }
}
