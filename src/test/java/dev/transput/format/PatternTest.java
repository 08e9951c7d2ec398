package dev.transput.format;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class PatternTest {
    private static final Mould ONE_DIGIT = Mould.of(MouldItem.DigitFrame.MANDATORY);

    @Test
    void integral_signMouldNeedsExactlyOneSignFrame() {
        assertThatThrownBy(() -> new Pattern.Integral(Mould.of(MouldItem.DigitFrame.ZERO_SUPPRESSING), ONE_DIGIT))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Pattern.Integral(
                        Mould.of(MouldItem.SignFrame.PLUS, MouldItem.SignFrame.MINUS), ONE_DIGIT))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Pattern.Integral(null, Mould.of(MouldItem.SignFrame.PLUS)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void real_fractionNeedsPoint() {
        assertThatThrownBy(() -> new Pattern.Real(null, ONE_DIGIT, null, ONE_DIGIT, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Pattern.Real(null, null, SymbolFrame.plain(), null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void choice_alternativeCounts() {
        assertThatThrownBy(() -> new Pattern.Choice(Pattern.ChoiceKind.BOOLEAN, List.of(Insertion.literal("y"))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Pattern.Choice(Pattern.ChoiceKind.INTEGRAL, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cStyle_bitsLetterIsChecked() {
        assertThatThrownBy(() -> new Pattern.CStyle(
                        Pattern.CKind.BITS, Pattern.Align.RIGHT, false, null, null, 'q'))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new Pattern.CStyle(Pattern.CKind.BITS, Pattern.Align.LEFT, false, null, null, 'x').describe())
                .isEqualTo("C-style bits pattern");
    }

    @Test
    void mould_signFrameIsTopLevelOnly() {
        Mould mould = Mould.of(
                MouldItem.DigitFrame.ZERO_SUPPRESSING,
                new MouldItem.Repeat(Count.of(2), List.of(MouldItem.SignFrame.PLUS)));

        assertThat(mould.signFrame()).isEmpty();
        assertThat(mould.containsSignFrame()).isTrue();
    }
}
