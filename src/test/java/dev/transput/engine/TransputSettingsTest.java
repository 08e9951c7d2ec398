package dev.transput.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.transput.format.Pattern;
import java.io.IOException;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class TransputSettingsTest {

    @Test
    void defaults_matchStandardWidths() {
        TransputSettings s = TransputSettings.defaults();

        assertThat(s.errorChar()).isEqualTo('*');
        assertThat(s.flipChar()).isEqualTo('T');
        assertThat(s.flopChar()).isEqualTo('F');
        assertThat(s.intWidth()).isEqualTo(19);
        assertThat(s.realWidth()).isEqualTo(15);
        assertThat(s.expWidth()).isEqualTo(3);
        assertThat(s.bitsWidth()).isEqualTo(64);
    }

    @Test
    void fromProperties_overridesOnlyGivenKeys() {
        Properties props = new Properties();
        props.setProperty("transput.int-width", "9");
        props.setProperty("transput.error-char", "#");

        TransputSettings s = TransputSettings.fromProperties(props);

        assertThat(s.intWidth()).isEqualTo(9);
        assertThat(s.errorChar()).isEqualTo('#');
        assertThat(s.realWidth()).isEqualTo(TransputSettings.defaults().realWidth());
    }

    @Test
    void fromProperties_rejectsBadValues() {
        Properties notNumber = new Properties();
        notNumber.setProperty("transput.real-width", "wide");
        Properties twoChars = new Properties();
        twoChars.setProperty("transput.flip-char", "ab");
        Properties sameFlipFlop = new Properties();
        sameFlipFlop.setProperty("transput.flop-char", "T");

        assertThatThrownBy(() -> TransputSettings.fromProperties(notNumber))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("transput.real-width");
        assertThatThrownBy(() -> TransputSettings.fromProperties(twoChars))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TransputSettings.fromProperties(sameFlipFlop))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void load_readsClasspathResource() throws IOException {
        TransputSettings s = TransputSettings.load("transput-test.properties");

        assertThat(s.errorChar()).isEqualTo('?');
        assertThat(s.flipChar()).isEqualTo('1');
        assertThat(s.flopChar()).isEqualTo('0');
        assertThat(s.realWidth()).isEqualTo(10);
        assertThat(s.expWidth()).isEqualTo(3);
    }

    @Test
    void load_missingResourceFails() {
        assertThatThrownBy(() -> TransputSettings.load("no-such-settings.properties"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("no-such-settings.properties");
    }

    @Test
    void loadedSettingsDriveBooleanOutput() throws Exception {
        TransputSettings s = TransputSettings.load("transput-test.properties");
        StringTransputFile file = new StringTransputFile();
        Transput transput = new Transput(file, Evaluator.none(), new TransputEvents(), s, new DecimalArithmetic());
        transput.setFormat(Pictures.format(Pictures.pic(Pictures.choice(Pattern.ChoiceKind.BOOLEAN))));

        transput.writeFormatted(List.of(new Value.Bool(true), new Value.Bool(false)));

        assertThat(file.contents()).isEqualTo("10");
    }
}
