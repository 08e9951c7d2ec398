package dev.transput.format;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A fixed-shape digit sequence: digit frames, at most one sign frame (sign moulds only), insertions and repeats.
 */
public record Mould(List<MouldItem> items) {
    public Mould {
        Objects.requireNonNull(items, "items");
        items = List.copyOf(items);
    }

    public static Mould of(MouldItem... items) {
        return new Mould(List.of(items));
    }

    /** The sign frame of a sign mould; only top-level frames count. */
    public Optional<MouldItem.SignFrame> signFrame() {
        for (MouldItem item : items) {
            if (item instanceof MouldItem.SignFrame s) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    public boolean containsSignFrame() {
        return containsSignFrame(items);
    }

    private static boolean containsSignFrame(List<MouldItem> items) {
        for (MouldItem item : items) {
            if (item instanceof MouldItem.SignFrame) {
                return true;
            }
            if (item instanceof MouldItem.Repeat r && containsSignFrame(r.items())) {
                return true;
            }
        }
        return false;
    }

    static Mould requireSignMould(Mould mould, String what) {
        if (mould == null) {
            return null;
        }
        long signs = mould.items().stream().filter(i -> i instanceof MouldItem.SignFrame).count();
        if (signs != 1) {
            throw new IllegalArgumentException(what + " must contain exactly one top-level sign frame, found " + signs);
        }
        for (MouldItem item : mould.items()) {
            if (item instanceof MouldItem.Repeat r && containsSignFrame(r.items())) {
                throw new IllegalArgumentException(what + " cannot repeat its sign frame");
            }
        }
        return mould;
    }

    static Mould requireDigitMould(Mould mould, String what) {
        if (mould != null && mould.containsSignFrame()) {
            throw new IllegalArgumentException(what + " cannot contain a sign frame");
        }
        return mould;
    }
}
