package dev.transput.format;

import java.util.List;
import java.util.Objects;

public sealed interface MouldItem permits MouldItem.DigitFrame, MouldItem.SignFrame, Insertion, MouldItem.Repeat {
    enum DigitFrame implements MouldItem {
        /** {@code z} */
        ZERO_SUPPRESSING,
        /** {@code d} */
        MANDATORY,
        /** {@code s} */
        SUPPRESSED
    }

    enum SignFrame implements MouldItem {
        /** {@code +}: always shows the sign. */
        PLUS,
        /** {@code -}: blank for non-negative values. */
        MINUS
    }

    record Repeat(Count count, List<MouldItem> items) implements MouldItem {
        public Repeat {
            Objects.requireNonNull(count, "count");
            Objects.requireNonNull(items, "items");
            items = List.copyOf(items);
        }
    }
}
