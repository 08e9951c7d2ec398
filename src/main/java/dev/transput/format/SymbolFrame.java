package dev.transput.format;

import java.util.List;
import java.util.Objects;

/**
 * Point ({@code .}), exponent ({@code e}) or complex connective ({@code i}) frame, with the insertions that
 * precede it. A suppressed frame ({@code s.}) writes nothing; on read the symbol is supplied without consuming
 * input.
 */
public record SymbolFrame(List<Insertion> insertions, boolean suppressed) {
    public SymbolFrame {
        Objects.requireNonNull(insertions, "insertions");
        insertions = List.copyOf(insertions);
    }

    public static SymbolFrame plain() {
        return new SymbolFrame(List.of(), false);
    }

    public static SymbolFrame suppressedFrame() {
        return new SymbolFrame(List.of(), true);
    }
}
