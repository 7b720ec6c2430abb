package org.dxworks.man2html;

import java.util.Locale;
import java.util.Optional;

public enum OutputFormat {
    HTML("html"),
    FRONT_MATTER("frontmatter"),
    RAW("raw"),
    DOXYGEN("doxygen");

    private final String name;

    OutputFormat(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static Optional<OutputFormat> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (OutputFormat format : values()) {
            if (format.getName().equals(lower)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
