package dev.transput.engine;

import static dev.transput.engine.Pictures.D;
import static dev.transput.engine.Pictures.digits;
import static dev.transput.engine.Pictures.format;
import static dev.transput.engine.Pictures.lit;
import static dev.transput.engine.Pictures.pic;
import static dev.transput.engine.Pictures.read;
import static dev.transput.engine.Pictures.write;
import static org.assertj.core.api.Assertions.assertThat;

import dev.transput.format.Count;
import dev.transput.format.Insertion;
import java.util.List;
import org.junit.jupiter.api.Test;

class InsertionExecutorTest {

    @Test
    void write_columnPadsToTarget() throws TransputError {
        assertThat(write(format(lit("ab"), new Insertion.Column(Count.of(5)), pic(digits(D))), new Value.Int(1)))
                .isEqualTo("ab  1");
    }

    @Test
    void write_lineAndPageBreaks() throws TransputError {
        assertThat(write(format(pic(digits(D)), new Insertion.LineBreak(), pic(digits(D))),
                        new Value.Int(1), new Value.Int(2)))
                .isEqualTo("1\n2");
        assertThat(write(format(pic(digits(D)), new Insertion.PageBreak(), pic(digits(D))),
                        new Value.Int(1), new Value.Int(2)))
                .isEqualTo("1\f2");
    }

    @Test
    void write_handledLineEndSuppressesNewline() throws TransputError {
        TransputEvents events = new TransputEvents().on(TransputEvent.LINE_END, t -> true);

        assertThat(write(events, format(pic(digits(D)), new Insertion.LineBreak(), pic(digits(D))),
                        new Value.Int(1), new Value.Int(2)))
                .isEqualTo("12");
    }

    @Test
    void write_backSkipOverwrites() throws TransputError {
        StringTransputFile file = new StringTransputFile();
        Transput transput = new Transput(file, Evaluator.none(), new TransputEvents());
        transput.setFormat(format(lit("abc"), new Insertion.BackSkip(Count.of(1)), lit("X")));

        transput.writeFormatted(List.of());

        assertThat(file.contents()).isEqualTo("abX");
    }

    @Test
    void write_replicatedInsertion() throws TransputError {
        Insertion.Replicated dashes = new Insertion.Replicated(Count.of(3), List.of(lit("ab")));

        assertThat(write(format(dashes, pic(digits(D))), new Value.Int(0))).isEqualTo("ababab0");
    }

    @Test
    void write_blankSpace() throws TransputError {
        assertThat(write(format(pic(digits(D)), new Insertion.Space(), pic(digits(D))),
                        new Value.Int(1), new Value.Int(2)))
                .isEqualTo("1 2");
    }

    @Test
    void read_skipsLiteralsAndSpaces() throws TransputError {
        assertThat(read("x=4 5", format(lit("x="), pic(digits(D)), new Insertion.Space(), pic(digits(D))),
                        ValueMode.INT, ValueMode.INT))
                .containsExactly(new Value.Int(4), new Value.Int(5));
    }

    @Test
    void read_columnSkipsToTarget() throws TransputError {
        assertThat(read("xxxx7", format(new Insertion.Column(Count.of(5)), pic(digits(D))), ValueMode.INT))
                .containsExactly(new Value.Int(7));
    }

    @Test
    void read_lineBreakSkipsRestOfLine() throws TransputError {
        assertThat(read("1 ignored\n2", format(pic(digits(D)), new Insertion.LineBreak(), pic(digits(D))),
                        ValueMode.INT, ValueMode.INT))
                .containsExactly(new Value.Int(1), new Value.Int(2));
    }
}
