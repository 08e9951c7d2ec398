package dev.transput.format;

import java.util.List;
import java.util.Objects;

public sealed interface StringItem permits StringItem.StringFrame, Insertion, StringItem.Repeat {
    enum StringFrame implements StringItem {
        /** {@code a}: one character of the value. */
        CHARACTER,
        /** {@code s}: a character that is skipped on write and taken as blank on read. */
        SKIP
    }

    record Repeat(Count count, List<StringItem> items) implements StringItem {
        public Repeat {
            Objects.requireNonNull(count, "count");
            Objects.requireNonNull(items, "items");
            items = List.copyOf(items);
        }
    }
}
