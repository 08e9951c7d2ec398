package dev.transput.format;

import java.util.Objects;

public sealed interface Count permits Count.Static, Count.Dynamic {
    record Static(int n) implements Count {}

    record Dynamic(Expr expr) implements Count {
        public Dynamic {
            Objects.requireNonNull(expr, "expr");
        }
    }

    static Count of(int n) {
        return new Static(n);
    }

    static Count of(Expr expr) {
        return new Dynamic(expr);
    }
}
