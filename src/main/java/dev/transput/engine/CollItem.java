package dev.transput.engine;

/**
 * Per-frame consumption state of one picture-tree node.
 */
public sealed interface CollItem permits CollItem.Uninitialised, CollItem.Exhausted, CollItem.Remaining {
    CollItem UNINITIALISED = new Uninitialised();
    CollItem EXHAUSTED = new Exhausted();

    record Uninitialised() implements CollItem {}

    record Exhausted() implements CollItem {}

    /** Replicator with {@code n} iterations left, the current one included. */
    record Remaining(int n) implements CollItem {
        public Remaining {
            if (n < 0) {
                throw new IllegalArgumentException("negative remaining count " + n);
            }
        }
    }
}
