package dev.transput.engine;

import static dev.transput.engine.Pictures.D;
import static dev.transput.engine.Pictures.digits;
import static dev.transput.engine.Pictures.format;
import static dev.transput.engine.Pictures.lit;
import static dev.transput.engine.Pictures.pic;
import static dev.transput.engine.Pictures.times;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.transput.format.FormatText;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class TransputTest {

    @Test
    void writeFormatted_flattensStructsAndRows() throws TransputError {
        StringTransputFile file = new StringTransputFile();
        Transput transput = new Transput(file, Evaluator.none(), new TransputEvents());
        transput.setFormat(format(pic(digits(D)), lit(",")));

        transput.writeFormatted(List.of(
                new Value.Struct(List.of(new Value.Int(1), new Value.Int(2))),
                new Value.Row(List.of(new Value.Int(3)))));

        assertThat(file.contents()).isEqualTo("1,2,3,");
    }

    @Test
    void writeFormatted_formatItemDrainsPreviousFormat() throws TransputError {
        StringTransputFile file = new StringTransputFile();
        Transput transput = new Transput(file, Evaluator.none(), new TransputEvents());

        transput.writeFormatted(List.of(
                new Value.Format(format(pic(digits(D)), lit(";"))),
                new Value.Int(1),
                new Value.Format(format(lit("<"), pic(digits(D, D)))),
                new Value.Int(2)));

        assertThat(file.contents()).isEqualTo("1;<02");
    }

    @Test
    void setFormat_fromFormatEndHandlerReplacesFormat() throws TransputError {
        TransputEvents events = new TransputEvents().on(TransputEvent.FORMAT_END, t -> {
            t.setFormat(format(lit("<"), pic(digits(D, D))));
            return true;
        });
        StringTransputFile file = new StringTransputFile();
        Transput transput = new Transput(file, Evaluator.none(), events);
        transput.setFormat(format(pic(digits(D)), lit(";")));

        transput.writeFormatted(List.of(new Value.Int(1), new Value.Int(2)));

        assertThat(file.contents()).isEqualTo("1;<02");
    }

    @Test
    void setFormat_appliesToNextStatementOnly() throws TransputError {
        Transput transput = new Transput(new StringTransputFile(), Evaluator.none(), new TransputEvents());
        transput.setFormat(format(pic(digits(D))));
        transput.writeFormatted(List.of(new Value.Int(1)));

        assertThatThrownBy(() -> transput.writeFormatted(List.of(new Value.Int(2))))
                .isInstanceOf(TransputError.FormatUndefined.class);
    }

    @Test
    void setFormat_nilIsFormatError() {
        Transput transput = new Transput(new StringTransputFile(), Evaluator.none(), new TransputEvents());

        assertThatThrownBy(() -> {
                    transput.setFormat(FormatText.nil());
                    transput.writeFormatted(List.of(new Value.Int(1)));
                })
                .isInstanceOf(TransputError.FormatUndefined.class);
    }

    @Test
    void evaluator_mayRunNestedTransputOnSameFile() throws TransputError {
        AtomicReference<Transput> self = new AtomicReference<>();
        ScriptedEvaluator evaluator = new ScriptedEvaluator().withInt("n", () -> {
            self.get().writeFormatted(List.of(
                    new Value.Format(format(lit("["), pic(digits(D)), lit("]"))), new Value.Int(9)));
            return 2;
        });
        StringTransputFile file = new StringTransputFile();
        Transput transput = new Transput(file, evaluator, new TransputEvents());
        self.set(transput);
        transput.setFormat(format(lit("a"), times("n", pic(digits(D)))));

        transput.writeFormatted(List.of(new Value.Int(1), new Value.Int(2)));

        assertThat(file.contents()).isEqualTo("a[9]12");
        assertThat(transput.active()).isFalse();
        assertThat(transput.frames().isEmpty()).isTrue();
    }

    @Test
    void abortedStatement_flushesOutputAndClosesFrames() {
        StringTransputFile file = new StringTransputFile();
        Transput transput = new Transput(file, Evaluator.none(), new TransputEvents());

        assertThatThrownBy(() -> {
                    transput.setFormat(format(lit("ab"), pic(digits(D, D))));
                    transput.writeFormatted(List.of(new Value.Int(123)));
                })
                .isInstanceOf(TransputError.ValueError.class);
        assertThat(file.contents()).isEqualTo("ab");
        assertThat(transput.frames().depth()).isZero();
    }

    @Test
    void readFormatted_mendedMismatchYieldsZero() throws TransputError {
        TransputEvents events = new TransputEvents().on(TransputEvent.FORMAT_ERROR, t -> true);
        Transput transput = new Transput(new StringTransputFile("7"), Evaluator.none(), events);
        transput.setFormat(format(pic(digits(D))));

        assertThat(transput.readFormatted(List.of(ReadItem.of(ValueMode.BOOL)))).containsExactly(new Value.Bool(false));
    }

    @Test
    void readFormatted_fileEndHandlerSuppliesBlanks() throws TransputError {
        TransputEvents events = new TransputEvents().on(TransputEvent.FILE_END, t -> true);
        Transput transput = new Transput(new StringTransputFile(""), Evaluator.none(), events);
        transput.setFormat(format(pic(digits(D))));

        assertThat(transput.readFormatted(List.of(ReadItem.of(ValueMode.INT)))).containsExactly(new Value.Int(0));
    }

    @Test
    void readFormatted_formatItemsSwitchFormats() throws TransputError {
        Transput transput = new Transput(new StringTransputFile("12;34"), Evaluator.none(), new TransputEvents());

        List<Value> values = transput.readFormatted(List.of(
                new ReadItem.Format(format(pic(digits(D, D)), lit(";"))),
                ReadItem.of(ValueMode.INT),
                new ReadItem.Format(format(pic(digits(D, D)))),
                ReadItem.of(ValueMode.INT)));

        assertThat(values).containsExactly(new Value.Int(12), new Value.Int(34));
    }

    @Test
    void settings_changeErrorCharacter() throws TransputError {
        TransputSettings hashes = new TransputSettings('#', 'T', 'F', 19, 39, 15, 32, 3, 4, 64, 128);
        TransputEvents events = new TransputEvents().on(TransputEvent.VALUE_ERROR, t -> true);
        StringTransputFile file = new StringTransputFile();
        Transput transput = new Transput(file, Evaluator.none(), events, hashes, new DecimalArithmetic());
        transput.setFormat(format(pic(digits(D, D))));

        transput.writeFormatted(List.of(new Value.Int(123)));

        assertThat(file.contents()).isEqualTo("##");
    }
}
