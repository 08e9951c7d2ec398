package dev.transput.engine;

import static dev.transput.engine.Pictures.D;
import static dev.transput.engine.Pictures.Z;
import static org.assertj.core.api.Assertions.assertThat;

import dev.transput.format.MouldItem;
import java.util.List;
import org.junit.jupiter.api.Test;

class SignHandlerTest {

    @Test
    void shift_movesSignPastLeadingZeros() {
        char[] edit = "-003".toCharArray();

        SignHandler.shift(edit, List.of(MouldItem.SignFrame.MINUS, Z, Z, D));

        assertThat(new String(edit)).isEqualTo("00-3");
    }

    @Test
    void shift_stopsAtMandatoryFrame() {
        char[] edit = "+003".toCharArray();

        SignHandler.shift(edit, List.of(MouldItem.SignFrame.PLUS, D, Z, D));

        assertThat(new String(edit)).isEqualTo("+003");
    }

    @Test
    void shift_stopsAtSignificantDigit() {
        char[] edit = "-012".toCharArray();

        SignHandler.shift(edit, List.of(MouldItem.SignFrame.MINUS, Z, Z, D));

        assertThat(new String(edit)).isEqualTo("0-12");
    }

    @Test
    void shift_ignoresBlankSign() {
        char[] edit = " 003".toCharArray();

        SignHandler.shift(edit, List.of(MouldItem.SignFrame.MINUS, Z, Z, D));

        assertThat(new String(edit)).isEqualTo(" 003");
    }

    @Test
    void signChar_followsFrame() {
        assertThat(SignHandler.signChar(-1, MouldItem.SignFrame.MINUS)).isEqualTo('-');
        assertThat(SignHandler.signChar(1, MouldItem.SignFrame.MINUS)).isEqualTo(' ');
        assertThat(SignHandler.signChar(0, MouldItem.SignFrame.PLUS)).isEqualTo('+');
    }
}
