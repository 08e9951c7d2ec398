package dev.transput.format;

import java.util.Objects;

/**
 * Handle to a compiled sub-expression (a dynamic replicator, a sub-format or general-pattern arguments).
 *
 * <p>{@code source} is kept for diagnostics only.</p>
 */
public record Expr(String source) {
    public Expr {
        Objects.requireNonNull(source, "source");
    }
}
