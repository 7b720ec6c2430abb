package org.dxworks.man2html.converter.table;

import org.dxworks.man2html.model.ColumnFormat;
import org.dxworks.man2html.model.TableSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Renders a parsed table as an HTML {@code <table>}, one row per line.
 */
public final class TableRenderer {

    private TableRenderer() {
    }

    /**
     * @param cellText turns a cell's escaped text into markup, closing any font it opens
     */
    public static String render(TableSpec table, UnaryOperator<String> cellText) {
        StringBuilder sb = new StringBuilder();
        sb.append(openingTag(table)).append('\n');

        for (int row = 0; row < table.rows.size(); row++) {
            String tag = row < table.headerRows ? "th" : "td";
            sb.append("<tr>");
            for (Cell cell : layoutRow(table, row)) {
                sb.append('<').append(tag).append(attributes(cell)).append('>')
                        .append(cellText.apply(fontTagged(cell)))
                        .append("</").append(tag).append('>');
            }
            sb.append("</tr>\n");
        }

        return sb.append("</table>").toString();
    }

    // Spanned columns carry no data of their own; they widen the cell to their left.
    private static List<Cell> layoutRow(TableSpec table, int row) {
        List<String> data = table.rows.get(row);
        List<Cell> cells = new ArrayList<>();
        int columns = Math.max(data.size(), table.columnCount(row));
        for (int column = 0; column < columns; column++) {
            ColumnFormat format = table.formatAt(row, column);
            if (format.code == ColumnFormat.Code.SPAN && !cells.isEmpty()) {
                cells.get(cells.size() - 1).span++;
            } else if (column < data.size()) {
                cells.add(new Cell(data.get(column), format));
            } else {
                break;
            }
        }
        return cells;
    }

    private static String fontTagged(Cell cell) {
        if (cell.format.bold) {
            return "\\fB" + cell.text + "\\fR";
        }
        if (cell.format.italic) {
            return "\\fI" + cell.text + "\\fR";
        }
        return cell.text;
    }

    private static String attributes(Cell cell) {
        StringBuilder sb = new StringBuilder();
        switch (cell.format.code) {
            case RIGHT, NUMERIC -> sb.append(" align=\"right\"");
            case CENTER -> sb.append(" align=\"center\"");
            default -> {
                // left is the HTML default
            }
        }
        if (cell.span > 1) {
            sb.append(" colspan=\"").append(cell.span).append('"');
        }
        return sb.toString();
    }

    private static String openingTag(TableSpec table) {
        StringBuilder sb = new StringBuilder("<table");
        if (table.border) {
            sb.append(" border=\"1\"");
        }
        if ("center".equals(table.alignment)) {
            sb.append(" align=\"center\"");
        } else if ("expand".equals(table.alignment)) {
            sb.append(" width=\"100%\"");
        }
        return sb.append('>').toString();
    }

    private static class Cell {
        final String text;
        final ColumnFormat format;
        int span = 1;

        Cell(String text, ColumnFormat format) {
            this.text = text;
            this.format = format;
        }
    }
}
