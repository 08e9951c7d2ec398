package dev.transput.engine;

import dev.transput.format.FormatText;
import java.util.ArrayList;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Explicit LIFO of the format frames of one transput call. Frames are closed exactly once, innermost first.
 */
public final class FrameStack {
    private static final Logger LOGGER = Logger.getLogger(FrameStack.class.getName());

    private final ArrayList<FormatFrame> frames = new ArrayList<>();

    /**
     * Opens a frame over {@code format} on top of the stack. The caller reports nil formats before calling this.
     */
    public FormatFrame open(FormatText format, boolean embedded) {
        Objects.requireNonNull(format, "format");
        if (format.isNil()) {
            throw new IllegalArgumentException("cannot open a frame over the nil format");
        }
        FormatFrame frame = new FormatFrame(format, top(), embedded);
        frames.add(frame);
        LOGGER.log(Level.FINE, () -> "opened " + frame + " at depth " + frames.size());
        return frame;
    }

    /** Closes {@code frame}, which must be the top of the stack. */
    public void close(FormatFrame frame) {
        Objects.requireNonNull(frame, "frame");
        if (frames.isEmpty() || frames.get(frames.size() - 1) != frame) {
            throw new IllegalStateException("format frames must be closed in LIFO order");
        }
        frames.remove(frames.size() - 1);
        frame.markClosed();
        LOGGER.log(Level.FINE, () -> "closed " + frame + " at depth " + (frames.size() + 1));
    }

    /** The active frame, or {@code null} when no format is open. */
    public FormatFrame top() {
        return frames.isEmpty() ? null : frames.get(frames.size() - 1);
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public int depth() {
        return frames.size();
    }

    /** Closes every frame, innermost first. */
    public void closeAll() {
        while (!frames.isEmpty()) {
            close(frames.get(frames.size() - 1));
        }
    }
}
