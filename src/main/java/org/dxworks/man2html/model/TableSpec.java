package org.dxworks.man2html.model;

import java.util.ArrayList;
import java.util.List;

public class TableSpec {
    public String alignment; // "center", "expand" or null
    public char separator = '\t';
    public boolean border;
    public List<String> formatLines = new ArrayList<>(); // as written, for the header heuristic
    public List<List<ColumnFormat>> formats = new ArrayList<>(); // one list per format line, rules removed
    public List<List<String>> rows = new ArrayList<>();
    public int headerRows;

    /** Number of entries on the format line that applies to {@code row}. */
    public int columnCount(int row) {
        return formats.isEmpty() ? 0 : formats.get(Math.min(row, formats.size() - 1)).size();
    }

    /**
     * Format of a cell. Rows past the last format line reuse it, as do columns past its last entry.
     */
    public ColumnFormat formatAt(int row, int column) {
        if (formats.isEmpty()) {
            return new ColumnFormat(ColumnFormat.Code.LEFT);
        }
        List<ColumnFormat> line = formats.get(Math.min(row, formats.size() - 1));
        if (line.isEmpty()) {
            return new ColumnFormat(ColumnFormat.Code.LEFT);
        }
        return line.get(Math.min(column, line.size() - 1));
    }
}
