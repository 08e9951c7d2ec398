package dev.transput.engine;

import dev.transput.format.FormatText;
import dev.transput.format.PictureNode;
import java.util.Arrays;
import java.util.Objects;

/**
 * 一次 format 使用的运行时状态：所属 {@link FormatText}、指向先前活动帧的链接，以及按 slot 索引的消费计数。
 *
 * <p>计数只存在于帧中，不写回 picture tree，因此同一个 FormatText 可以被多个调用同时使用。</p>
 */
public final class FormatFrame {
    private final FormatText format;
    private final FormatFrame parent;
    private final boolean embedded;
    private final CollItem[] items;
    private boolean closed;

    FormatFrame(FormatText format, FormatFrame parent, boolean embedded) {
        this.format = Objects.requireNonNull(format, "format");
        this.parent = parent;
        this.embedded = embedded;
        this.items = new CollItem[format.slotCount()];
        reinitialise();
    }

    public FormatText format() {
        return format;
    }

    /** The frame that was active when this one was opened, or {@code null}. */
    public FormatFrame parent() {
        return parent;
    }

    /** Whether this frame was opened for a format pattern inside another format. */
    public boolean embedded() {
        return embedded;
    }

    public boolean closed() {
        return closed;
    }

    public CollItem state(PictureNode node) {
        return items[format.slotOf(node)];
    }

    void setState(PictureNode node, CollItem state) {
        items[format.slotOf(node)] = Objects.requireNonNull(state, "state");
    }

    /** Makes every node available again; used when the format restarts. */
    void reinitialise() {
        Arrays.fill(items, CollItem.UNINITIALISED);
    }

    /** Resets {@code node} and its descendants, ready for another iteration of an enclosing replicator. */
    void resetSubtree(PictureNode node) {
        setState(node, CollItem.UNINITIALISED);
        if (node instanceof PictureNode.Replicator r) {
            resetSubtree(r.child());
        } else if (node instanceof PictureNode.Collection c) {
            for (PictureNode child : c.children()) {
                resetSubtree(child);
            }
        }
    }

    void markClosed() {
        if (closed) {
            throw new IllegalStateException("format frame closed twice");
        }
        closed = true;
    }

    @Override
    public String toString() {
        return "FormatFrame[" + format + (embedded ? ", embedded" : "") + (closed ? ", closed" : "") + "]";
    }
}
