package com.prettyprinter.output;

import java.io.IOException;
import java.io.StringWriter;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TabWriterTest {

    private static String format(String text, int tabWidth, char padChar, boolean html) throws IOException {
        StringWriter out = new StringWriter();
        TabWriter writer = new TabWriter(out, tabWidth, 1, padChar, html);
        writer.write(text);
        writer.flush();
        return out.toString();
    }

    @Test
    void write_alignsCellsOfAdjacentLines() throws IOException {
        assertThat(format("a\tb\nccc\td\n", 4, ' ', false))
                .isEqualTo("a   b\nccc d\n");
    }

    @Test
    void write_passesLinesWithoutTabsThrough() throws IOException {
        assertThat(format("hello\nworld", 8, ' ', false))
                .isEqualTo("hello\nworld");
    }

    @Test
    void write_lineWithoutTabsEndsColumnBlock() throws IOException {
        assertThat(format("a\tb\nxxxxxx\tc\nplain\nd\te\n", 2, ' ', false))
                .isEqualTo("a      b\nxxxxxx c\nplain\nd e\n");
    }

    @Test
    void write_lastCellOfLineIsNotAligned() throws IOException {
        assertThat(format("x\tshort\nx\ta much longer trailing cell\n", 2, ' ', false))
                .isEqualTo("x short\nx a much longer trailing cell\n");
    }

    @Test
    void write_padsWithTabsRoundedToTabWidth() throws IOException {
        assertThat(format("a\tb\nlonger_name\tc\n", 8, '\t', false))
                .isEqualTo("a\t\tb\nlonger_name\tc\n");
    }

    @Test
    void write_keepsIndentationTabsWhenPaddingWithTabs() throws IOException {
        assertThat(format("func f() {\n\tx++\n\t\ty++\n}\n", 8, '\t', false))
                .isEqualTo("func f() {\n\tx++\n\t\ty++\n}\n");
    }

    @Test
    void write_htmlTagsHaveNoWidth() throws IOException {
        assertThat(format("<b>x</b>\ty\nabc\tz\n", 1, ' ', true))
                .isEqualTo("<b>x</b>   y\nabc z\n");
    }

    @Test
    void write_htmlEntitiesHaveWidthOne() throws IOException {
        assertThat(format("&lt;\ty\nab\tz\n", 1, ' ', true))
                .isEqualTo("&lt;  y\nab z\n");
    }

    @Test
    void write_countsCodePointsNotChars() throws IOException {
        assertThat(format("😀\ty\nab\tz\n", 1, ' ', false))
                .isEqualTo("😀  y\nab z\n");
    }

    @Test
    void flush_terminatesPartialLine() throws IOException {
        StringWriter out = new StringWriter();
        TabWriter writer = new TabWriter(out, 4, 1, ' ', false);
        writer.write("a\tb\nc");
        assertThat(out.toString()).isEmpty();

        writer.flush();
        assertThat(out.toString()).isEqualTo("a   b\nc");
    }

    @Test
    void constructor_rejectsInvalidTabWidth() {
        assertThatThrownBy(() -> new TabWriter(new StringWriter(), 0, 1, ' ', false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
