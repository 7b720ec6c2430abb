package org.dxworks.man2html.converter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class SpecialCharactersTest {

    @Test
    void translate_Glyphs() {
        assertEquals("&mdash;", SpecialCharacters.translate("\\(em"));
        assertEquals("a &mdash; b", SpecialCharacters.translate("a \\[em] b"));
        assertEquals("&eacute;", SpecialCharacters.translate("\\('e"));
        assertEquals("&#x00E9;", SpecialCharacters.translate("\\[u00e9]"));
    }

    @Test
    void translate_HyphenBecomesEnDash() {
        assertEquals("&ndash;v", SpecialCharacters.translate("\\-v"));
    }

    @Test
    void translate_EscapesMarkupCharacters() {
        assertEquals("a &amp; b", SpecialCharacters.translate("a & b"));
        assertEquals("&amp;", SpecialCharacters.translate("&amp;"));
        assertEquals("&lt;tag&gt;", SpecialCharacters.translate("<tag>"));
    }

    @Test
    void translate_LiteralBackslash() {
        assertEquals("C:\\dir", SpecialCharacters.translate("C:\\\\dir"));
        assertEquals("a\\b", SpecialCharacters.translate("a\\eb"));
        assertEquals("\\(em", SpecialCharacters.translate("\\(rs(em"));
    }

    @Test
    void translate_UnknownEscapesAreKept() {
        assertEquals("\\(zz", SpecialCharacters.translate("\\(zz"));
        assertEquals("\\[nosuch]", SpecialCharacters.translate("\\[nosuch]"));
    }

    @Test
    void translate_PredefinedStrings() {
        assertEquals("&ldquo;quoted&rdquo;", SpecialCharacters.translate("\\*(lqquoted\\*(rq"));
        assertEquals("&reg;", SpecialCharacters.translate("\\*R"));
        assertEquals("&trade;", SpecialCharacters.translate("\\*[Tm]"));
    }

    @Test
    void translate_ZeroWidthAndSizeEscapes() {
        assertEquals(".foo", SpecialCharacters.translate("\\&.foo"));
        assertEquals("a b", SpecialCharacters.translate("a\\ b"));
        assertEquals("small", SpecialCharacters.translate("\\s-1small\\s0"));
        assertEquals("big text", SpecialCharacters.translate("\\s12big\\s0 text"));
        assertEquals("big", SpecialCharacters.translate("\\s(14big\\s[0]"));
        assertEquals("big", SpecialCharacters.translate("\\s[+2]big\\s+0"));
    }

    @Test
    void translate_FontEscapesPassThrough() {
        assertEquals("\\fBbold\\fR", SpecialCharacters.translate("\\fBbold\\fR"));
    }

    @Test
    void translate_IsIdempotent() {
        List<String> inputs = List.of("\\(em and \\(co", "R&D <x>", "\\*(lqq\\*(rq", "\\('e\\(:u", "a \\- b", "&#x00E9;");
        for (String input : inputs) {
            String once = SpecialCharacters.translate(input);
            assertEquals(once, SpecialCharacters.translate(once), input);
        }
    }

    @Test
    void stripComment() {
        assertEquals("text", SpecialCharacters.stripComment("text \\\" comment"));
        assertEquals("", SpecialCharacters.stripComment("\\# whole line"));
        assertEquals("a\\\\\"b", SpecialCharacters.stripComment("a\\\\\"b"));
    }
}
