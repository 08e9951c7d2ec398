package dev.transput.engine;

import dev.transput.format.Environment;
import dev.transput.format.Expr;
import dev.transput.format.FormatText;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Evaluator answering from fixed tables keyed by expression source. */
final class ScriptedEvaluator implements Evaluator {
    @FunctionalInterface
    interface IntSource {
        long get() throws TransputError;
    }

    private final Map<String, IntSource> ints = new HashMap<>();
    private final Map<String, FormatText> formats = new HashMap<>();
    private final Map<String, List<Long>> lists = new HashMap<>();

    ScriptedEvaluator withInt(String source, long value) {
        ints.put(source, () -> value);
        return this;
    }

    ScriptedEvaluator withInt(String source, IntSource value) {
        ints.put(source, value);
        return this;
    }

    ScriptedEvaluator withFormat(String source, FormatText format) {
        formats.put(source, format);
        return this;
    }

    ScriptedEvaluator withInts(String source, Long... values) {
        lists.put(source, List.of(values));
        return this;
    }

    @Override
    public long evalInt(Expr expr, Environment env) throws TransputError {
        IntSource source = ints.get(expr.source());
        if (source == null) {
            throw new IllegalArgumentException("unscripted expression " + expr.source());
        }
        return source.get();
    }

    @Override
    public FormatText evalFormat(Expr expr, Environment env) {
        FormatText format = formats.get(expr.source());
        if (format == null) {
            throw new IllegalArgumentException("unscripted format " + expr.source());
        }
        return format;
    }

    @Override
    public List<Long> evalInts(Expr expr, Environment env) {
        List<Long> values = lists.get(expr.source());
        if (values == null) {
            throw new IllegalArgumentException("unscripted arguments " + expr.source());
        }
        return values;
    }
}
