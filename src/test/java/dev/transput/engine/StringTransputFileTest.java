package dev.transput.engine;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class StringTransputFileTest {

    @Test
    void put_overwritesThenExtends() {
        StringTransputFile file = new StringTransputFile("abcd");
        file.reposition(1);

        file.put("XYZW");

        assertThat(file.contents()).isEqualTo("aXYZW");
    }

    @Test
    void column_countsFromLastLineBreak() {
        StringTransputFile file = new StringTransputFile();
        file.put("abc");
        file.newLine();
        file.put("de");

        assertThat(file.column()).isEqualTo(2);
    }

    @Test
    void pushBack_isReadAgain() {
        StringTransputFile file = new StringTransputFile("xy");
        int first = file.nextChar();
        file.pushBack((char) first);

        assertThat(file.remaining()).isEqualTo("xy");
        assertThat(file.nextChar()).isEqualTo('x');
        assertThat(file.nextChar()).isEqualTo('y');
        assertThat(file.atEof()).isTrue();
        assertThat(file.nextChar()).isEqualTo(TransputFile.EOF);
    }

    @Test
    void reposition_staysWithinText() {
        StringTransputFile file = new StringTransputFile("abc");
        file.reposition(-5);
        assertThat(file.remaining()).isEqualTo("abc");

        file.reposition(10);
        assertThat(file.atEof()).isTrue();
    }
}
