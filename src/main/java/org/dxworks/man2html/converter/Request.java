package org.dxworks.man2html.converter;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The requests the converter understands. Several roff names can share one kind.
 */
public enum Request {
    TITLE("TH"),
    SECTION_HEADING("SH"),
    SUBSECTION_HEADING("SS"),
    PARAGRAPH("PP", "LP", "P", "HP"),
    INDENTED_PARAGRAPH("IP"),
    TAGGED_PARAGRAPH("TP"),
    MARGIN_START("RS"),
    MARGIN_END("RE"),
    FONT("B", "I"),
    SMALL("SM"),
    SMALL_BOLD("SB"),
    ALTERNATING_FONT("BI", "BR", "IB", "IR", "RB", "RI"),
    FONT_CHANGE("ft"),
    LINE_BREAK("br", "sp"),
    NO_FILL("nf", "EX"),
    FILL("fi", "EE"),
    INCLUDE("so"),
    TABLE_START("TS"),
    TABLE_END("TE"),
    LINK_START("UR"),
    MAIL_START("MT"),
    LINK_END("UE", "ME"),
    SKIPPED_BLOCK("de", "am", "ig"),
    IGNORED("ad", "na", "nh", "hy", "ne", "ll", "PD", "ta", "in", "ti", "ce", "ss", "fam",
            "ds", "rm", "nr", "OP", "UC", "AT", "DT", "hw", "cs", "bp", "pl", "lf");

    private static final Map<String, Request> BY_NAME = new HashMap<>();

    static {
        for (Request request : values()) {
            for (String name : request.names) {
                BY_NAME.put(name, request);
            }
        }
    }

    private final String[] names;

    Request(String... names) {
        this.names = names;
    }

    public static Optional<Request> fromName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    /** Requests that render their arguments inline and can therefore stand in a term line. */
    public boolean isInlineFont() {
        return this == FONT || this == SMALL || this == SMALL_BOLD || this == ALTERNATING_FONT;
    }
}
