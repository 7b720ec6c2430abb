package org.dxworks.man2html.converter.table;

import org.dxworks.man2html.converter.ConversionException;
import org.dxworks.man2html.converter.Diagnostics;
import org.dxworks.man2html.converter.InputResolver;
import org.dxworks.man2html.model.ColumnFormat;
import org.dxworks.man2html.model.TableSpec;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a {@code .TS} ... {@code .TE} block from the input, starting after the {@code .TS} line.
 * <p>
 * Format phase: an optional options line ending in {@code ;}, then format lines up to the one
 * ending in {@code .}. Body phase: data lines until {@code .TE}; a {@code T{} cell continues
 * over the following lines until its {@code T}} and the pieces are joined with a space.
 */
public class TableParser {

    private static final String TABLE_END = ".TE";
    private static final String CELL_OPEN = "T{";
    private static final String CELL_CLOSE = "T}";
    private static final Pattern REQUEST = Pattern.compile("[.'][A-Za-z\\\\]");
    private static final Pattern TAB_OPTION = Pattern.compile("tab\\s*\\((.)\\)");

    private final InputResolver input;
    private final Diagnostics diagnostics;

    public TableParser(InputResolver input, Diagnostics diagnostics) {
        this.input = input;
        this.diagnostics = diagnostics;
    }

    public TableSpec parse() {
        TableSpec table = new TableSpec();
        if (readFormat(table)) {
            readBody(table);
        }
        table.headerRows = countHeaderRows(table.formatLines);
        return table;
    }

    // Returns false when the table ended before any data
    private boolean readFormat(TableSpec table) {
        String line;
        while ((line = input.nextLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.startsWith(TABLE_END)) {
                diagnostics.warn(input.location(), "table ended before its format was complete");
                return false;
            }
            if (trimmed.endsWith(";")) {
                parseOptions(table, trimmed.substring(0, trimmed.length() - 1));
                continue;
            }
            boolean last = trimmed.endsWith(".");
            String formats = last ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
            for (String formatLine : formats.split(",")) {
                if (!formatLine.isBlank()) {
                    addFormatLine(table, formatLine.trim());
                }
            }
            if (last) {
                return true;
            }
        }
        diagnostics.warn(input.location(), "end of input inside table format");
        return false;
    }

    private void readBody(TableSpec table) {
        String line;
        while ((line = input.nextLine()) != null) {
            if (line.startsWith(TABLE_END)) {
                return;
            }
            if (isRequest(line)) {
                diagnostics.warn(input.location(), "request not supported inside a table: " + line.trim());
                continue;
            }
            String trimmed = line.trim();
            if (trimmed.isEmpty() || "_".equals(trimmed) || "=".equals(trimmed)) {
                continue;
            }
            if (line.contains(CELL_OPEN)) {
                line = readMultiLineCell(line);
            }
            table.rows.add(splitCells(line, table.separator));
        }
        diagnostics.warn(input.location(), "end of input inside table, missing " + TABLE_END);
    }

    private String readMultiLineCell(String first) {
        StringBuilder row = new StringBuilder(first);
        int startLine = input.lineNumber();
        while (count(row, CELL_OPEN) > count(row, CELL_CLOSE)) {
            String next = input.nextLine();
            if (next == null || next.startsWith(TABLE_END)) {
                throw new ConversionException(
                        "Unmatched " + CELL_OPEN + " in table cell starting at " + input.sourceName() + ":" + startLine);
            }
            if (isRequest(next)) {
                continue;
            }
            row.append(' ').append(next);
        }
        return row.toString();
    }

    private static List<String> splitCells(String line, char separator) {
        List<String> cells = new ArrayList<>();
        for (String cell : line.split(Pattern.quote(String.valueOf(separator)), -1)) {
            String text = cell.trim();
            if (text.startsWith(CELL_OPEN)) {
                text = text.substring(CELL_OPEN.length());
            }
            if (text.endsWith(CELL_CLOSE)) {
                text = text.substring(0, text.length() - CELL_CLOSE.length());
            }
            cells.add(text.trim());
        }
        return cells;
    }

    private static void parseOptions(TableSpec table, String options) {
        String lower = options.toLowerCase(Locale.ROOT);
        Matcher tab = TAB_OPTION.matcher(options);
        if (tab.find()) {
            table.separator = tab.group(1).charAt(0);
        }
        for (String option : lower.split("[\\s,]+")) {
            switch (option) {
                case "center", "centre" -> table.alignment = "center";
                case "expand" -> table.alignment = "expand";
                case "box", "allbox", "doublebox", "frame", "doubleframe" -> table.border = true;
                default -> {
                    // tab(x), delim(xy), linesize(n) and friends
                }
            }
        }
    }

    private static void addFormatLine(TableSpec table, String formatLine) {
        List<ColumnFormat> columns = parseFormatLine(formatLine);
        List<ColumnFormat> cells = new ArrayList<>();
        for (ColumnFormat column : columns) {
            if (column.isRule()) {
                table.border = true;
            } else {
                cells.add(column);
            }
        }
        table.formatLines.add(formatLine);
        table.formats.add(cells);
    }

    static List<ColumnFormat> parseFormatLine(String formatLine) {
        List<ColumnFormat> columns = new ArrayList<>();
        ColumnFormat last = null;
        int n = formatLine.length();
        int i = 0;

        while (i < n) {
            char c = formatLine.charAt(i);
            ColumnFormat.Code code = keyLetter(c);
            if (code != null) {
                last = new ColumnFormat(code);
                columns.add(last);
                i++;
                continue;
            }
            if (c == '|') {
                boolean isDouble = i + 1 < n && formatLine.charAt(i + 1) == '|';
                columns.add(new ColumnFormat(isDouble ? ColumnFormat.Code.DOUBLE_RULE : ColumnFormat.Code.VERTICAL_RULE));
                i += isDouble ? 2 : 1;
                continue;
            }
            if (c == 'f' || c == 'F') {
                i = applyFontModifier(formatLine, i + 1, last);
                continue;
            }
            if (c == '(' || c == 'w' || c == 'W') {
                int close = formatLine.indexOf(')', i);
                i = close < 0 ? n : close + 1;
                continue;
            }
            if (last != null && (c == 'b' || c == 'B')) {
                last.bold = true;
            } else if (last != null && (c == 'i' || c == 'I')) {
                last.italic = true;
            }
            // widths, spacing and the e/t/u/x/z/d modifiers have no HTML counterpart
            i++;
        }
        return columns;
    }

    private static ColumnFormat.Code keyLetter(char c) {
        return switch (c) {
            case 'l', 'L', 'a', 'A', '^', '_', '-', '=' -> ColumnFormat.Code.LEFT;
            case 'r', 'R' -> ColumnFormat.Code.RIGHT;
            case 'c', 'C' -> ColumnFormat.Code.CENTER;
            case 'n', 'N' -> ColumnFormat.Code.NUMERIC;
            case 's', 'S' -> ColumnFormat.Code.SPAN;
            default -> null;
        };
    }

    private static int applyFontModifier(String formatLine, int start, ColumnFormat column) {
        int i = start;
        int n = formatLine.length();
        while (i < n && formatLine.charAt(i) == ' ') {
            i++;
        }
        if (i >= n) {
            return n;
        }
        String name;
        if (formatLine.charAt(i) == '(' && i + 3 <= n) {
            name = formatLine.substring(i + 1, i + 3);
            i += 3;
        } else {
            name = String.valueOf(formatLine.charAt(i));
            i++;
        }
        if (column != null) {
            switch (name.toUpperCase(Locale.ROOT)) {
                case "B", "3", "BI", "CB" -> column.bold = true;
                case "I", "2", "CI" -> column.italic = true;
                default -> {
                    // roman and constant width render as plain text
                }
            }
        }
        return i;
    }

    /**
     * Rows rendered as header cells: the number of distinct format lines after the first,
     * and only when the table has more than one format line.
     */
    static int countHeaderRows(List<String> formatLines) {
        if (formatLines.size() <= 1) {
            return 0;
        }
        return new HashSet<>(formatLines.subList(1, formatLines.size())).size();
    }

    private static boolean isRequest(String line) {
        return REQUEST.matcher(line).lookingAt();
    }

    private static int count(CharSequence text, String marker) {
        String s = text.toString();
        int found = 0;
        for (int i = s.indexOf(marker); i >= 0; i = s.indexOf(marker, i + marker.length())) {
            found++;
        }
        return found;
    }
}
