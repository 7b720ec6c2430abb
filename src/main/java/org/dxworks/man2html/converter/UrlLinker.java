package org.dxworks.man2html.converter;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Wraps bare {@code http(s)://} addresses in running text in a hyperlink.
 * Only a restricted grammar is recognised: host, optional port, slash separated path
 * segments and an optional extension, so trailing sentence punctuation stays outside.
 */
public final class UrlLinker {

    private static final Pattern URL = Pattern.compile(
            "https?://[A-Za-z0-9-]+(?:\\.[A-Za-z0-9-]+)*(?::[0-9]+)?(?:/[A-Za-z0-9_~%+-]*)*(?:\\.[A-Za-z0-9]+)?/?");

    // Placeholder hosts used in examples are never linked
    private static final List<String> EXCEPTIONS = List.of("://localhost", "://example.");

    private UrlLinker() {
    }

    public static String link(String text) {
        if (!text.contains("://")) {
            return text;
        }
        Matcher m = URL.matcher(text);
        StringBuilder sb = new StringBuilder(text.length() + 32);
        while (m.find()) {
            String url = m.group();
            String replacement = isLinkable(url)
                    ? "<a href=\"" + url + "\">" + url + "</a>"
                    : url;
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static boolean isLinkable(String url) {
        for (String exception : EXCEPTIONS) {
            if (url.contains(exception)) {
                return false;
            }
        }
        return true;
    }
}
