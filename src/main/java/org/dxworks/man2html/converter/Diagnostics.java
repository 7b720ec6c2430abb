package org.dxworks.man2html.converter;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects recoverable warnings and prints them as {@code name:line: warning: message}.
 */
public class Diagnostics {

    private final PrintStream stream;
    private final List<String> warnings = new ArrayList<>();

    public Diagnostics(PrintStream stream) {
        this.stream = stream;
    }

    public static Diagnostics toStandardError() {
        return new Diagnostics(System.err);
    }

    /** Records the warning without printing it anywhere. */
    public static Diagnostics silent() {
        return new Diagnostics(null);
    }

    public void warn(String location, String message) {
        String formatted = location + ": warning: " + message;
        warnings.add(formatted);
        if (stream != null) {
            stream.println(formatted);
        }
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }
}
