package org.dxworks.man2html.converter.table;

import org.dxworks.man2html.converter.ConversionException;
import org.dxworks.man2html.converter.Diagnostics;
import org.dxworks.man2html.converter.InputResolver;
import org.dxworks.man2html.model.ColumnFormat;
import org.dxworks.man2html.model.TableSpec;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TableParserTest {

    @Test
    void parse_OptionsFormatsAndRows() {
        TableSpec table = parse("center tab(:);\ncb cb\nl n.\nName:Size\nalpha:10\n.TE\n", Diagnostics.silent());

        assertEquals("center", table.alignment);
        assertEquals(':', table.separator);
        assertFalse(table.border);
        assertEquals(List.of("cb cb", "l n"), table.formatLines);
        assertEquals(1, table.headerRows);
        assertEquals(List.of(List.of("Name", "Size"), List.of("alpha", "10")), table.rows);
        assertTrue(table.formatAt(0, 1).bold);
        assertEquals(ColumnFormat.Code.NUMERIC, table.formatAt(1, 1).code);
    }

    @Test
    void parse_LastFormatLineAndEntryAreReused() {
        TableSpec table = parse("l r.\na\tb\tc\td\ne\tf\n.TE\n", Diagnostics.silent());

        assertEquals(0, table.headerRows);
        assertEquals(ColumnFormat.Code.RIGHT, table.formatAt(0, 3).code);
        assertEquals(ColumnFormat.Code.LEFT, table.formatAt(5, 0).code);
    }

    @Test
    void parse_CommaSeparatedFormatLines() {
        TableSpec table = parse("c s, l l, l l.\nT\na\tb\n.TE\n", Diagnostics.silent());

        assertEquals(3, table.formats.size());
        assertEquals(1, table.headerRows);
        assertEquals(ColumnFormat.Code.SPAN, table.formatAt(0, 1).code);
    }

    @Test
    void parse_RulesTurnOnBorderAndAreDropped() {
        TableSpec table = parse("l | r.\na\tb\n.TE\n", Diagnostics.silent());

        assertTrue(table.border);
        assertEquals(2, table.formats.get(0).size());
    }

    @Test
    void parse_MultiLineCellIsJoinedWithSpaces() {
        TableSpec table = parse("l l.\nbeta\tT{\nspans\ntwo lines\nT}\n.TE\n", Diagnostics.silent());

        assertEquals(List.of(List.of("beta", "spans two lines")), table.rows);
    }

    @Test
    void parse_UnmatchedCellIsFatal() {
        assertThrows(ConversionException.class, () -> parse("l.\nT{\nabc\n.TE\n", Diagnostics.silent()));
    }

    @Test
    void parse_RequestInsideBodyIsSkippedWithWarning() {
        Diagnostics diagnostics = Diagnostics.silent();
        TableSpec table = parse("l.\n.sp\n.5 kg\n.TE\n", diagnostics);

        assertEquals(List.of(List.of(".5 kg")), table.rows);
        assertEquals(1, diagnostics.warnings().size());
        assertTrue(diagnostics.warnings().get(0).startsWith("table.1:2: warning:"));
    }

    @Test
    void parse_MissingTableEndWarns() {
        Diagnostics diagnostics = Diagnostics.silent();
        TableSpec table = parse("l.\nrow\n", diagnostics);

        assertEquals(1, table.rows.size());
        assertEquals(1, diagnostics.warnings().size());
    }

    @Test
    void parseFormatLine_KeyLettersAndModifiers() {
        List<ColumnFormat> columns = TableParser.parseFormatLine("lb | r fI c s");

        assertEquals(5, columns.size());
        assertEquals(ColumnFormat.Code.LEFT, columns.get(0).code);
        assertTrue(columns.get(0).bold);
        assertEquals(ColumnFormat.Code.VERTICAL_RULE, columns.get(1).code);
        assertEquals(ColumnFormat.Code.RIGHT, columns.get(2).code);
        assertTrue(columns.get(2).italic);
        assertEquals(ColumnFormat.Code.CENTER, columns.get(3).code);
        assertEquals(ColumnFormat.Code.SPAN, columns.get(4).code);
    }

    @Test
    void countHeaderRows() {
        assertEquals(0, TableParser.countHeaderRows(List.of("l")));
        assertEquals(1, TableParser.countHeaderRows(List.of("c c", "l l", "l l")));
        assertEquals(2, TableParser.countHeaderRows(List.of("c c", "c s", "l l")));
    }

    @Test
    void render_SpanAndBox() {
        TableSpec table = parse("tab(;) box;\nc s\nl l.\nTitle\na;b\n.TE\n", Diagnostics.silent());

        assertEquals("<table border=\"1\">\n"
                        + "<tr><th align=\"center\" colspan=\"2\">Title</th></tr>\n"
                        + "<tr><td>a</td><td>b</td></tr>\n"
                        + "</table>",
                TableRenderer.render(table, text -> text));
    }

    private static TableSpec parse(String source, Diagnostics diagnostics) {
        try (InputResolver input = new InputResolver()) {
            input.open("table.1", new StringReader(source));
            return new TableParser(input, diagnostics).parse();
        }
    }
}
