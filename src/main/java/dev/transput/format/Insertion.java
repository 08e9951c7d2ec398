package dev.transput.format;

import java.util.List;
import java.util.Objects;

/**
 * Non-value-bearing directives. They appear between pictures, inside moulds, inside string patterns and as
 * choice alternatives.
 */
public sealed interface Insertion extends PictureNode, MouldItem, StringItem
        permits Insertion.Literal,
                Insertion.Space,
                Insertion.LineBreak,
                Insertion.PageBreak,
                Insertion.BackSkip,
                Insertion.Column,
                Insertion.Replicated {
    record Literal(String text) implements Insertion {
        public Literal {
            Objects.requireNonNull(text, "text");
        }
    }

    /** {@code x} / {@code q}. */
    record Space() implements Insertion {}

    /** {@code l}. */
    record LineBreak() implements Insertion {}

    /** {@code p}. */
    record PageBreak() implements Insertion {}

    /** {@code y}: move the file position back. */
    record BackSkip(Count count) implements Insertion {
        public BackSkip {
            Objects.requireNonNull(count, "count");
        }
    }

    /** {@code nk}: tab to column {@code n}. */
    record Column(Count count) implements Insertion {
        public Column {
            Objects.requireNonNull(count, "count");
        }
    }

    record Replicated(Count count, List<Insertion> items) implements Insertion {
        public Replicated {
            Objects.requireNonNull(count, "count");
            Objects.requireNonNull(items, "items");
            items = List.copyOf(items);
        }
    }

    static Insertion literal(String text) {
        return new Literal(text);
    }
}
