package dev.transput.engine;

import dev.transput.format.Environment;
import dev.transput.format.Expr;
import dev.transput.format.FormatText;
import java.util.List;

/**
 * Expression evaluator of the host language. Evaluation may itself run formatted transput on the same
 * {@link Transput}; such nested calls get their own frame stack.
 */
public interface Evaluator {
    long evalInt(Expr expr, Environment env) throws TransputError;

    FormatText evalFormat(Expr expr, Environment env) throws TransputError;

    /** Arguments of a general pattern such as {@code g(w, a)}. */
    List<Long> evalInts(Expr expr, Environment env) throws TransputError;

    /** Evaluator for formats with static counts only. */
    static Evaluator none() {
        return new Evaluator() {
            @Override
            public long evalInt(Expr expr, Environment env) {
                throw new UnsupportedOperationException("no evaluator for `" + expr.source() + "`");
            }

            @Override
            public FormatText evalFormat(Expr expr, Environment env) {
                throw new UnsupportedOperationException("no evaluator for `" + expr.source() + "`");
            }

            @Override
            public List<Long> evalInts(Expr expr, Environment env) {
                throw new UnsupportedOperationException("no evaluator for `" + expr.source() + "`");
            }
        };
    }
}
