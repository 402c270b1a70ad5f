package com.prettyprinter.output;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * A writer filter that aligns tab-terminated cells in adjacent lines into columns.
 *
 * <p>Text is split into cells at tab characters. The cell after the last tab of a line is
 * not part of any column. A column block is a run of consecutive lines that all have a
 * terminated cell in that column; all its cells are padded to the width of the widest
 * cell plus padding, but at least to the minimal cell width. A line without tabs ends all
 * column blocks, at which point the buffered lines are written out.
 *
 * <p>With HTML filtering, markup tags have width 0 and character entities width 1.
 */
public class TabWriter extends Writer {
    private final Writer out;
    private final int minWidth;
    private final int tabWidth;
    private final int padding;
    private final char padChar;
    private final boolean filterHtml;

    private final StringBuilder cell = new StringBuilder();
    private final List<List<Cell>> lines = new ArrayList<>();
    private final List<Integer> widths = new ArrayList<>();

    /**
     * Creates a tab writer.
     *
     * @param out        the destination
     * @param tabWidth   minimal cell width, and the width of a tab when padding with tabs
     * @param padding    padding added to the widest cell of a column
     * @param padChar    padding character; with {@code '\t'} cells are padded with tabs
     * @param filterHtml whether the text contains HTML markup
     */
    public TabWriter(Writer out, int tabWidth, int padding, char padChar, boolean filterHtml) {
        if (tabWidth < 1 || padding < 0) {
            throw new IllegalArgumentException("Invalid cell layout: tabWidth=" + tabWidth + ", padding=" + padding);
        }
        this.out = out;
        this.minWidth = tabWidth;
        this.tabWidth = tabWidth;
        this.padding = padding;
        this.padChar = padChar;
        this.filterHtml = filterHtml;
        reset();
    }

    @Override
    public void write(char[] buf, int off, int len) throws IOException {
        int start = off;
        int end = off + len;
        for (int i = off; i < end; i++) {
            char ch = buf[i];
            if (ch == '\t' || ch == '\n') {
                cell.append(buf, start, i - start);
                start = i + 1;
                int ncells = terminateCell();
                if (ch == '\n') {
                    lines.add(new ArrayList<>());
                    if (ncells == 1) {
                        // a single-cell line does not affect the alignment of later lines
                        flushLines();
                    }
                }
            }
        }
        cell.append(buf, start, end - start);
    }

    /**
     * Writes all buffered text, terminating the current line's cells, and flushes the
     * destination.
     */
    @Override
    public void flush() throws IOException {
        if (cell.length() > 0) {
            terminateCell();
        }
        flushLines();
        out.flush();
    }

    @Override
    public void close() throws IOException {
        flush();
        out.close();
    }

    private void reset() {
        cell.setLength(0);
        lines.clear();
        widths.clear();
        lines.add(new ArrayList<>());
    }

    private int terminateCell() {
        String text = cell.toString();
        cell.setLength(0);
        List<Cell> line = lines.get(lines.size() - 1);
        line.add(new Cell(text, width(text)));
        return line.size();
    }

    private void flushLines() throws IOException {
        format(0, lines.size());
        reset();
    }

    private void format(int line0, int line1) throws IOException {
        int column = widths.size();
        for (int current = line0; current < line1; current++) {
            List<Cell> line = lines.get(current);
            if (column >= line.size() - 1) {
                continue;
            }

            // this line has a cell in this column: it starts a column block
            writeLines(line0, current);
            line0 = current;

            int width = minWidth;
            for (; current < line1; current++) {
                line = lines.get(current);
                if (column >= line.size() - 1) {
                    break;
                }
                int w = line.get(column).width + padding;
                if (w > width) {
                    width = w;
                }
            }

            widths.add(width);
            format(line0, current);
            widths.remove(widths.size() - 1);
            line0 = current;
        }
        writeLines(line0, line1);
    }

    private void writeLines(int line0, int line1) throws IOException {
        for (int i = line0; i < line1; i++) {
            List<Cell> line = lines.get(i);
            for (int j = 0; j < line.size(); j++) {
                Cell c = line.get(j);
                out.write(c.text);
                if (j < widths.size()) {
                    writePadding(c.width, widths.get(j));
                }
            }
            if (i + 1 < lines.size()) {
                out.write('\n');
            }
        }
    }

    private void writePadding(int textWidth, int cellWidth) throws IOException {
        if (padChar == '\t') {
            // cell widths are multiples of the tab width
            cellWidth = (cellWidth + tabWidth - 1) / tabWidth * tabWidth;
            int n = cellWidth - textWidth;
            repeat('\t', (n + tabWidth - 1) / tabWidth);
            return;
        }
        repeat(padChar, cellWidth - textWidth);
    }

    private void repeat(char ch, int n) throws IOException {
        for (int i = 0; i < n; i++) {
            out.write(ch);
        }
    }

    private int width(String text) {
        if (!filterHtml) {
            return text.codePointCount(0, text.length());
        }
        int width = 0;
        boolean inTag = false;
        boolean inEntity = false;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            i += Character.charCount(cp);
            if (inTag) {
                inTag = cp != '>';
            } else if (inEntity) {
                inEntity = cp != ';';
            } else if (cp == '<') {
                inTag = true;
            } else if (cp == '&') {
                inEntity = true;
                width++;
            } else {
                width++;
            }
        }
        return width;
    }

    private static final class Cell {
        final String text;
        final int width;

        Cell(String text, int width) {
            this.text = text;
            this.width = width;
        }
    }
}
