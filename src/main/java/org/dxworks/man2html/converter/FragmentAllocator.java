package org.dxworks.man2html.converter;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Hands out unique anchor ids for headings. Keys are never released during a conversion.
 */
public class FragmentAllocator {

    private static final Pattern MARKUP = Pattern.compile("<[^>]*>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Set<String> used = new HashSet<>();

    public String allocate(String rawText) {
        String stripped = MARKUP.matcher(rawText).replaceAll("").trim();
        String key = WHITESPACE.matcher(stripped).replaceAll("_");

        if (used.add(key)) {
            return key;
        }
        for (int suffix = 2; ; suffix++) {
            String candidate = key + "_" + suffix;
            if (used.add(candidate)) {
                return candidate;
            }
        }
    }
}
