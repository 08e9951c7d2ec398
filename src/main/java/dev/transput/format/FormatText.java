package dev.transput.format;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 编译后的 format：picture tree 根节点加捕获的环境。
 *
 * <p>构造时为树中每个节点按身份分配稠密 slot 号（Replicated insertion 的内部项除外）；同一节点实例在树中出现两次会被拒绝，
 * 否则两处会共享同一计数。FormatText 本身不可变，可被多个并发/嵌套的 transput 调用同时使用。</p>
 */
public final class FormatText {
    private static final FormatText NIL = new FormatText();

    private final PictureNode.Collection root;
    private final Environment environment;
    private final Map<PictureNode, Integer> slots;

    private FormatText() {
        this.root = null;
        this.environment = Environment.EMPTY;
        this.slots = Map.of();
    }

    public FormatText(PictureNode.Collection root, Environment environment) {
        this.root = Objects.requireNonNull(root, "root");
        this.environment = Objects.requireNonNull(environment, "environment");
        IdentityHashMap<PictureNode, Integer> table = new IdentityHashMap<>();
        number(root, table);
        this.slots = table;
    }

    public static FormatText of(PictureNode... pictures) {
        return new FormatText(new PictureNode.Collection(List.of(pictures)), Environment.EMPTY);
    }

    /** The undefined format. Opening a frame over it is a format error. */
    public static FormatText nil() {
        return NIL;
    }

    public boolean isNil() {
        return root == null;
    }

    public PictureNode.Collection root() {
        if (root == null) {
            throw new IllegalStateException("nil format has no root");
        }
        return root;
    }

    public Environment environment() {
        return environment;
    }

    public int slotCount() {
        return slots.size();
    }

    public int slotOf(PictureNode node) {
        Integer slot = slots.get(node);
        if (slot == null) {
            throw new IllegalArgumentException("node does not belong to this format: " + node);
        }
        return slot;
    }

    private static void number(PictureNode node, IdentityHashMap<PictureNode, Integer> table) {
        if (table.containsKey(node)) {
            throw new IllegalArgumentException("picture node appears more than once in format: " + node);
        }
        table.put(node, table.size());
        if (node instanceof PictureNode.Replicator r) {
            number(r.child(), table);
        } else if (node instanceof PictureNode.Collection c) {
            for (PictureNode child : c.children()) {
                number(child, table);
            }
        }
    }

    @Override
    public String toString() {
        return isNil() ? "FormatText[nil]" : "FormatText[slots=" + slots.size() + "]";
    }
}
