package dev.transput.engine;

import static dev.transput.engine.Pictures.choice;
import static dev.transput.engine.Pictures.format;
import static dev.transput.engine.Pictures.lit;
import static dev.transput.engine.Pictures.pic;
import static dev.transput.engine.Pictures.read;
import static dev.transput.engine.Pictures.write;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.transput.format.Pattern;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChoicePatternHandlerTest {

    @Test
    void writeSelector_emitsChosenAlternative() throws TransputError {
        Pattern.Choice numbers = choice(Pattern.ChoiceKind.INTEGRAL, "one", "two", "three");

        assertThat(write(format(pic(numbers)), new Value.Int(2))).isEqualTo("two");
    }

    @Test
    void writeSelector_outOfRangeIsValueError() throws TransputError {
        assertThatThrownBy(() -> write(format(pic(choice(Pattern.ChoiceKind.INTEGRAL, "a", "b"))), new Value.Int(3)))
                .isInstanceOf(TransputError.ValueError.class);

        TransputEvents events = new TransputEvents().on(TransputEvent.VALUE_ERROR, t -> true);
        assertThat(write(events, format(pic(choice(Pattern.ChoiceKind.INTEGRAL, "a", "b"))), new Value.Int(0)))
                .isEqualTo("*");
    }

    @Test
    void writeBool_usesAlternativesOrFlipFlop() throws TransputError {
        assertThat(write(format(pic(choice(Pattern.ChoiceKind.BOOLEAN, "yes", "no"))), new Value.Bool(false)))
                .isEqualTo("no");
        assertThat(write(format(pic(choice(Pattern.ChoiceKind.BOOLEAN)), pic(choice(Pattern.ChoiceKind.BOOLEAN))),
                        new Value.Bool(true), new Value.Bool(false)))
                .isEqualTo("TF");
    }

    @Test
    void readBool_fullMatchAndUniquePrefix() throws TransputError {
        List<Value> values = read("yes,n,", format(pic(choice(Pattern.ChoiceKind.BOOLEAN, "yes", "no")), lit(",")),
                ValueMode.BOOL, ValueMode.BOOL);

        assertThat(values).containsExactly(new Value.Bool(true), new Value.Bool(false));
    }

    @Test
    void readSelector_leavesTerminatorUnread() throws TransputError {
        StringTransputFile full = new StringTransputFile("yes,");
        Transput first = new Transput(full, Evaluator.none(), new TransputEvents());
        first.setFormat(format(pic(choice(Pattern.ChoiceKind.INTEGRAL, "no", "yes"))));
        StringTransputFile prefix = new StringTransputFile("n,");
        Transput second = new Transput(prefix, Evaluator.none(), new TransputEvents());
        second.setFormat(format(pic(choice(Pattern.ChoiceKind.INTEGRAL, "no", "yes"))));

        assertThat(first.readFormatted(List.of(ReadItem.of(ValueMode.INT)))).containsExactly(new Value.Int(2));
        assertThat(full.remaining()).isEqualTo(",");
        assertThat(second.readFormatted(List.of(ReadItem.of(ValueMode.INT)))).containsExactly(new Value.Int(1));
        assertThat(prefix.remaining()).isEqualTo(",");
    }

    @Test
    void readSelector_prefersLongestFullMatch() throws TransputError {
        assertThat(read("ab", format(pic(choice(Pattern.ChoiceKind.INTEGRAL, "a", "ab"))), ValueMode.INT))
                .containsExactly(new Value.Int(2));
    }

    @Test
    void readSelector_pushesBackLookAhead() throws TransputError {
        StringTransputFile file = new StringTransputFile("ax");
        Transput transput = new Transput(file, Evaluator.none(), new TransputEvents());
        transput.setFormat(format(pic(choice(Pattern.ChoiceKind.INTEGRAL, "a", "ab"))));

        List<Value> values = transput.readFormatted(List.of(ReadItem.of(ValueMode.INT)));

        assertThat(values).containsExactly(new Value.Int(1));
        assertThat(file.remaining()).isEqualTo("x");
    }

    @Test
    void readSelector_equalLengthTieGoesToFirstDeclared() throws TransputError {
        assertThat(read("ab", format(pic(choice(Pattern.ChoiceKind.INTEGRAL, "ab", "ab", "abc"))), ValueMode.INT))
                .containsExactly(new Value.Int(1));
    }

    @Test
    void readSelector_noMatchIsValueError() {
        assertThatThrownBy(() -> read("zz", format(pic(choice(Pattern.ChoiceKind.INTEGRAL, "a", "b"))), ValueMode.INT))
                .isInstanceOf(TransputError.ValueError.class);
    }

    @Test
    void readBool_flipFlopWithoutAlternatives() throws TransputError {
        assertThat(read("TF", format(pic(choice(Pattern.ChoiceKind.BOOLEAN))), ValueMode.BOOL, ValueMode.BOOL))
                .containsExactly(new Value.Bool(true), new Value.Bool(false));
    }

    @Test
    void choice_rejectsMismatchedModes() {
        assertThatThrownBy(() -> write(format(pic(choice(Pattern.ChoiceKind.BOOLEAN, "y", "n"))), new Value.Int(1)))
                .isInstanceOf(TransputError.PatternMismatch.class)
                .hasMessageContaining("cannot transput INT value with");
    }
}
