package org.dxworks.man2html.model;

public class ColumnFormat {

    public enum Code {
        LEFT,
        RIGHT,
        CENTER,
        NUMERIC,
        SPAN,
        VERTICAL_RULE,
        DOUBLE_RULE
    }

    public Code code;
    public boolean bold;
    public boolean italic;

    public ColumnFormat(Code code) {
        this.code = code;
    }

    public boolean isRule() {
        return code == Code.VERTICAL_RULE || code == Code.DOUBLE_RULE;
    }
}
