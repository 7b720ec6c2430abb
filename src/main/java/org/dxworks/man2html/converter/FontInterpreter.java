package org.dxworks.man2html.converter;

import java.util.List;

/**
 * Resolves inline font escapes ({@code \fB}, {@code \fI}, {@code \fR}, {@code \fP},
 * {@code \f(XX}, {@code \f[XX]}) into {@code <b>}/{@code <i>} elements.
 * <p>
 * Keeps the (current, previous) font pair. A pop swaps the pair and never looks further back.
 * Body text leaves the state open across lines; headings, terms and table cells close it.
 */
public class FontInterpreter {

    private Font current = Font.ROMAN;
    private Font previous = Font.ROMAN;

    public String translate(String text, boolean addClose) {
        StringBuilder out = new StringBuilder(text.length() + 16);
        int n = text.length();
        int i = 0;

        while (i < n) {
            char c = text.charAt(i);
            if (c != '\\' || i + 2 >= n || text.charAt(i + 1) != 'f') {
                out.append(c);
                i++;
                continue;
            }

            char selector = text.charAt(i + 2);
            String name;
            int end;
            if (selector == '(') {
                if (i + 5 > n) {
                    out.append(c);
                    i++;
                    continue;
                }
                name = text.substring(i + 3, i + 5);
                end = i + 5;
            } else if (selector == '[') {
                int close = text.indexOf(']', i + 3);
                if (close < 0) {
                    out.append(c);
                    i++;
                    continue;
                }
                name = text.substring(i + 3, close);
                end = close + 1;
            } else {
                name = String.valueOf(selector);
                end = i + 3;
            }

            out.append(name.isEmpty() || "P".equals(name) ? popFont() : switchFont(Font.fromName(name)));
            i = end;
        }

        if (addClose) {
            out.append(close());
        }
        return out.toString();
    }

    /**
     * Closes the open element, if any, and resets the pair to roman/roman.
     */
    public String close() {
        String markup = current.getCloseTag();
        current = Font.ROMAN;
        previous = Font.ROMAN;
        return markup;
    }

    public Font current() {
        return current;
    }

    public Font previous() {
        return previous;
    }

    /**
     * Wraps text in a font escape and a trailing {@code \fR}, as {@code .B} and {@code .I} do.
     */
    public static String withFont(char fontLetter, String text) {
        return "\\f" + fontLetter + text + "\\fR";
    }

    /**
     * Builds the escaped text of an alternating-font request such as {@code .BR}:
     * arguments are joined without spaces, fonts cycle through {@code fontLetters}.
     */
    public static String alternating(String fontLetters, List<String> args) {
        if (args.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            sb.append("\\f").append(fontLetters.charAt(i % fontLetters.length())).append(args.get(i));
        }
        return sb.append("\\fR").toString();
    }

    private String switchFont(Font font) {
        String markup = font == current ? "" : current.getCloseTag() + font.getOpenTag();
        previous = current;
        current = font;
        return markup;
    }

    private String popFont() {
        Font old = current;
        current = previous;
        previous = old;
        return old == current ? "" : old.getCloseTag() + current.getOpenTag();
    }
}
