package org.dxworks.man2html.converter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RequestSplitterTest {

    @Test
    void split_PlainWords() {
        assertEquals(List.of("SH", "NAME"), RequestSplitter.split("SH NAME"));
        assertEquals(List.of("TP", "8"), RequestSplitter.split("TP\t8"));
    }

    @Test
    void split_QuotedWordsKeepTheirSpaces() {
        assertEquals(List.of("TH", "LS", "1", "2024-03-01", "GNU coreutils"),
                RequestSplitter.split("TH LS 1 \"2024-03-01\" \"GNU coreutils\""));
    }

    @Test
    void split_DoubledQuoteInsideQuotesIsLiteral() {
        assertEquals(List.of("BR", "say \"hi\"", "now"), RequestSplitter.split("BR \"say \"\"hi\"\"\" now"));
    }

    @Test
    void split_EmptyQuotedArgument() {
        assertEquals(List.of("IP", "", "4"), RequestSplitter.split("IP \"\" 4"));
    }

    @Test
    void split_EscapedSpaceStaysInsideWord() {
        assertEquals(List.of("B", "foo bar", "baz"), RequestSplitter.split("B foo\\ bar baz"));
    }

    @Test
    void split_BlankBodyHasNoWords() {
        assertTrue(RequestSplitter.split("   ").isEmpty());
        assertTrue(RequestSplitter.split("").isEmpty());
    }
}
