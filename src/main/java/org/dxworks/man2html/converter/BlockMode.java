package org.dxworks.man2html.converter;

/**
 * Structural context of one margin level, with the markup that opens it and the markup owed when it ends.
 */
public enum BlockMode {
    PARAGRAPH("", ""),
    BULLET_LIST("<ul>", "</li>\n</ul>"),
    DEFINITION_LIST("<dl>", "</dd>\n</dl>");

    private final String opening;
    private final String closing;

    BlockMode(String opening, String closing) {
        this.opening = opening;
        this.closing = closing;
    }

    public String getOpening() {
        return opening;
    }

    public String getClosing() {
        return closing;
    }
}
