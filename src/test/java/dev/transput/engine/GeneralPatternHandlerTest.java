package dev.transput.engine;

import static dev.transput.engine.Pictures.format;
import static dev.transput.engine.Pictures.pic;
import static dev.transput.engine.Pictures.write;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.transput.format.Expr;
import dev.transput.format.FormatText;
import dev.transput.format.Pattern;
import java.util.List;
import org.junit.jupiter.api.Test;

class GeneralPatternHandlerTest {

    private static Pattern.General g(String args) {
        return new Pattern.General(Pattern.GeneralKind.G, args == null ? null : new Expr(args));
    }

    private static Pattern.General h(String args) {
        return new Pattern.General(Pattern.GeneralKind.H, new Expr(args));
    }

    private static String run(ScriptedEvaluator evaluator, FormatText format, Value... values) throws TransputError {
        StringTransputFile file = new StringTransputFile();
        Transput transput = new Transput(file, evaluator, new TransputEvents());
        transput.setFormat(format);
        transput.writeFormatted(List.of(values));
        return file.contents();
    }

    @Test
    void withoutArguments_writesStandardForm() throws TransputError {
        assertThat(write(format(pic(g(null))), new Value.Int(42))).isEqualTo(" ".repeat(17) + "+42");
        assertThat(write(format(pic(g(null))), new Value.Bool(true))).isEqualTo("T");
        assertThat(write(format(pic(g(null))), new Value.Str("text"))).isEqualTo("text");
    }

    @Test
    void g_withWidthWritesWhole() throws TransputError {
        ScriptedEvaluator evaluator = new ScriptedEvaluator().withInts("w", 5L);

        assertThat(run(evaluator, format(pic(g("w"))), new Value.Int(42))).isEqualTo("  +42");
    }

    @Test
    void g_withWidthAndAfterWritesFixed() throws TransputError {
        ScriptedEvaluator evaluator = new ScriptedEvaluator().withInts("w, a", -7L, 2L);

        assertThat(run(evaluator, format(pic(g("w, a"))), new Value.Real(3.14159))).isEqualTo("   3.14");
    }

    @Test
    void g_withThreeArgumentsWritesFloat() throws TransputError {
        ScriptedEvaluator evaluator = new ScriptedEvaluator().withInts("w, a, e", -11L, 3L, 4L);

        assertThat(run(evaluator, format(pic(g("w, a, e"))), new Value.Real(1234.5))).isEqualTo(" 1.235e  +3");
    }

    @Test
    void h_keepsExponentAMultipleOfThree() throws TransputError {
        ScriptedEvaluator evaluator = new ScriptedEvaluator().withInts("a", 3L);

        assertThat(run(evaluator, format(pic(h("a"))), new Value.Real(1234.5))).isEqualTo("+1.235e  +3");
        assertThat(run(evaluator, format(pic(h("a"))), new Value.Real(12345.0))).isEqualTo("+12.35e  +3");
    }

    @Test
    void nonNumericValueIgnoresArguments() throws TransputError {
        ScriptedEvaluator evaluator = new ScriptedEvaluator().withInts("w", 5L);

        assertThat(run(evaluator, format(pic(g("w"))), new Value.Char('c'))).isEqualTo("c");
    }

    @Test
    void wrongArgumentCountIsPatternMismatch() {
        ScriptedEvaluator evaluator = new ScriptedEvaluator().withInts("four", 1L, 2L, 3L, 4L);

        assertThatThrownBy(() -> run(evaluator, format(pic(g("four"))), new Value.Int(1)))
                .isInstanceOf(TransputError.PatternMismatch.class)
                .hasMessageContaining("4 integer argument");
    }

    @Test
    void read_usesStandardInput() throws TransputError {
        StringTransputFile file = new StringTransputFile(" -12 T");
        Transput transput = new Transput(file, Evaluator.none(), new TransputEvents());
        transput.setFormat(format(pic(g(null))));

        List<Value> values = transput.readFormatted(List.of(ReadItem.of(ValueMode.INT), ReadItem.of(ValueMode.BOOL)));

        assertThat(values).containsExactly(new Value.Int(-12), new Value.Bool(true));
    }
}
