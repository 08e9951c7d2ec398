package dev.transput.engine;

import dev.transput.format.FormatText;
import java.util.Objects;

/**
 * One element of a formatted read: either a format switch or a target whose mode decides what is read.
 */
public sealed interface ReadItem permits ReadItem.Format, ReadItem.Target {
    record Format(FormatText format) implements ReadItem {
        public Format {
            Objects.requireNonNull(format, "format");
        }
    }

    record Target(ValueMode mode) implements ReadItem {
        public Target {
            Objects.requireNonNull(mode, "mode");
        }
    }

    static ReadItem of(ValueMode mode) {
        return new Target(mode);
    }
}
