package dev.transput.format;

import java.util.List;
import java.util.Objects;

/**
 * Picture tree 的节点。
 *
 * <p>每个节点在 {@link FormatText} 中占一个 slot，
 * 帧（frame）按 slot 保存消费计数：insertion 执行一次即耗尽，replicator 记录剩余次数。</p>
 */
public sealed interface PictureNode permits Insertion, PictureNode.Picture, PictureNode.Replicator, PictureNode.Collection {
    record Picture(Pattern pattern) implements PictureNode {
        public Picture {
            Objects.requireNonNull(pattern, "pattern");
        }
    }

    record Replicator(Count count, PictureNode child) implements PictureNode {
        public Replicator {
            Objects.requireNonNull(count, "count");
            Objects.requireNonNull(child, "child");
        }
    }

    record Collection(List<PictureNode> children) implements PictureNode {
        public Collection {
            Objects.requireNonNull(children, "children");
            children = List.copyOf(children);
        }
    }
}
