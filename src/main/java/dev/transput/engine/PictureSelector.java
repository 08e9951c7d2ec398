package dev.transput.engine;

import dev.transput.format.Environment;
import dev.transput.format.FormatText;
import dev.transput.format.Insertion;
import dev.transput.format.Pattern;
import dev.transput.format.PictureNode;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Picture selector：在活动帧上做深度优先、从左到右的扫描，沿途执行到期的 insertion，返回下一个 pattern。
 *
 * <p>格式耗尽时：嵌入帧弹出并回到父帧继续；最外层帧先交给 format-end 事件处理器，处理器拒绝时格式原地重启。</p>
 */
public final class PictureSelector {
    private static final Logger LOGGER = Logger.getLogger(PictureSelector.class.getName());

    public enum Mood {
        /** A value is waiting: exhaustion restarts or pops the format. */
        REQUIRED,
        /** End of statement: run what is left, report leftover pictures. */
        DRAIN
    }

    public record ActivePattern(Pattern pattern, Environment environment) {
        public ActivePattern {
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(environment, "environment");
        }
    }

    private final TransputContext ctx;
    private final InsertionExecutor insertions;

    PictureSelector(TransputContext ctx, InsertionExecutor insertions) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.insertions = Objects.requireNonNull(insertions, "insertions");
    }

    public Optional<ActivePattern> nextPattern(Mood mood) throws TransputError {
        Objects.requireNonNull(mood, "mood");
        if (ctx.frames.isEmpty()) {
            if (mood == Mood.DRAIN) {
                return Optional.empty();
            }
            ctx.offerFormatError(new TransputError.FormatUndefined("cannot use undefined format"));
            if (ctx.frames.isEmpty()) {
                throw new TransputError.FormatUndefined("no format is open for formatted transput");
            }
        }
        ActivePattern found = scanTop();
        if (found == null && mood == Mood.REQUIRED) {
            boolean popped;
            do {
                popped = endOfFormat();
                found = scanTop();
            } while (popped && found == null);
            if (found == null) {
                throw new TransputError.FormatExhausted("patterns exhausted in format");
            }
        }
        return Optional.ofNullable(found);
    }

    /**
     * Runs the insertions that remain, reports every picture still unused and returns to the outermost frame.
     */
    public void drain() throws TransputError {
        while (!ctx.frames.isEmpty()) {
            ActivePattern leftover = scanTop();
            if (leftover != null) {
                ctx.offerFormatError(new TransputError.PictureCountMismatch(
                        "number of pictures does not match number of arguments: "
                                + leftover.pattern().describe() + " left over"));
                continue;
            }
            FormatFrame top = ctx.frames.top();
            if (!top.embedded()) {
                return;
            }
            ctx.frames.close(top);
        }
    }

    /** Opens a fresh outermost frame; a nil format is reported and leaves the stack unchanged. */
    void openOutermost(FormatText format) throws TransputError {
        if (format.isNil()) {
            ctx.offerFormatError(new TransputError.FormatUndefined("cannot use undefined format"));
            return;
        }
        ctx.frames.open(format, false);
    }

    /** Returns {@code true} when an embedded frame was popped. */
    private boolean endOfFormat() throws TransputError {
        FormatFrame top = ctx.frames.top();
        if (top.embedded()) {
            ctx.frames.close(top);
            return true;
        }
        if (!ctx.fire(TransputEvent.FORMAT_END)) {
            FormatFrame outermost = ctx.frames.top();
            if (outermost != null) {
                outermost.reinitialise();
                LOGGER.log(Level.FINE, () -> "restarted " + outermost);
            }
        }
        return false;
    }

    private ActivePattern scanTop() throws TransputError {
        FormatFrame top = ctx.frames.top();
        if (top == null) {
            return null;
        }
        return scan(top, top.format().root());
    }

    private ActivePattern scan(FormatFrame frame, PictureNode node) throws TransputError {
        Environment env = frame.format().environment();
        if (frame.state(node) instanceof CollItem.Exhausted) {
            return null;
        }
        if (node instanceof Insertion ins) {
            frame.setState(ins, CollItem.EXHAUSTED);
            insertions.execute(ins, env);
            return null;
        }
        if (node instanceof PictureNode.Picture pic) {
            frame.setState(pic, CollItem.EXHAUSTED);
            if (pic.pattern() instanceof Pattern.Embedded embedded) {
                return scanEmbedded(embedded, env);
            }
            return new ActivePattern(pic.pattern(), env);
        }
        if (node instanceof PictureNode.Replicator r) {
            int remaining;
            if (frame.state(r) instanceof CollItem.Remaining rem) {
                remaining = rem.n();
            } else {
                remaining = ctx.count(r.count(), env);
                frame.resetSubtree(r.child());
            }
            while (remaining > 0) {
                frame.setState(r, new CollItem.Remaining(remaining));
                ActivePattern found = scan(frame, r.child());
                if (found != null) {
                    return found;
                }
                remaining--;
                if (remaining > 0) {
                    frame.resetSubtree(r.child());
                }
            }
            frame.setState(r, CollItem.EXHAUSTED);
            return null;
        }
        if (node instanceof PictureNode.Collection c) {
            for (PictureNode child : c.children()) {
                ActivePattern found = scan(frame, child);
                if (found != null) {
                    return found;
                }
            }
            frame.setState(c, CollItem.EXHAUSTED);
            return null;
        }
        throw new IllegalStateException("unknown picture node " + node);
    }

    private ActivePattern scanEmbedded(Pattern.Embedded embedded, Environment env) throws TransputError {
        FormatText sub = ctx.evaluator.evalFormat(embedded.format(), env);
        if (sub == null || sub.isNil()) {
            ctx.offerFormatError(new TransputError.FormatUndefined(
                    "cannot use undefined format `" + embedded.format().source() + "`"));
            return null;
        }
        FormatFrame inner = ctx.frames.open(sub, true);
        ActivePattern found = scan(inner, sub.root());
        if (found == null) {
            // Nothing to transput in the sub-format: carry on with the next sibling.
            ctx.frames.close(inner);
        }
        return found;
    }
}
