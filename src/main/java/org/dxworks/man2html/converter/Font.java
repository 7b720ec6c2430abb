package org.dxworks.man2html.converter;

import java.util.Locale;

public enum Font {
    BOLD("<b>", "</b>"),
    ITALIC("<i>", "</i>"),
    ROMAN("", "");

    private final String openTag;
    private final String closeTag;

    Font(String openTag, String closeTag) {
        this.openTag = openTag;
        this.closeTag = closeTag;
    }

    public String getOpenTag() {
        return openTag;
    }

    public String getCloseTag() {
        return closeTag;
    }

    /**
     * Maps a roff font name or position ({@code B}, {@code 3}, {@code CI}, ...) to a font.
     * Unknown names render as roman.
     */
    public static Font fromName(String name) {
        return switch (name.toUpperCase(Locale.ROOT)) {
            case "B", "3", "4", "BI", "CB" -> BOLD;
            case "I", "2", "CI" -> ITALIC;
            default -> ROMAN;
        };
    }
}
