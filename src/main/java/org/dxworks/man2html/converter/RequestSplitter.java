package org.dxworks.man2html.converter;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a request line into its command name and arguments.
 * <ul>
 *   <li>words are separated by runs of spaces or tabs</li>
 *   <li>a double quote starts a word that runs to the closing quote; {@code ""} inside it is a literal quote</li>
 *   <li>{@code \ } keeps a space inside a word and comes back as a plain space</li>
 * </ul>
 */
public final class RequestSplitter {

    private static final char PROTECTED_SPACE = '\u0001';

    private RequestSplitter() {
    }

    /**
     * @param body the request line without its leading {@code .} or {@code '}
     * @return command name first, then the arguments; empty for a blank line
     */
    public static List<String> split(String body) {
        String text = body.replace("\\ ", String.valueOf(PROTECTED_SPACE));
        List<String> words = new ArrayList<>();
        int i = 0;
        int n = text.length();

        while (i < n) {
            char c = text.charAt(i);
            if (c == ' ' || c == '\t') {
                i++;
                continue;
            }

            StringBuilder word = new StringBuilder();
            if (c == '"') {
                i++;
                while (i < n) {
                    char q = text.charAt(i);
                    if (q == '"') {
                        if (i + 1 < n && text.charAt(i + 1) == '"') {
                            word.append('"');
                            i += 2;
                            continue;
                        }
                        i++;
                        break;
                    }
                    word.append(q);
                    i++;
                }
            } else {
                while (i < n && text.charAt(i) != ' ' && text.charAt(i) != '\t') {
                    word.append(text.charAt(i));
                    i++;
                }
            }
            words.add(word.toString().replace(PROTECTED_SPACE, ' '));
        }
        return words;
    }
}
