package org.dxworks.man2html.converter;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates roff special-character escapes and predefined strings into HTML.
 * <p>
 * The passes run in a fixed order; a later pass must never re-expand what an earlier one produced:
 * <ol>
 *   <li>strip zero-width and size escapes, normalize spacing and backslash escapes</li>
 *   <li>{@code \-} becomes {@code \(en}</li>
 *   <li>escape {@code &} that does not already start an entity</li>
 *   <li>{@code \(xx} glyphs</li>
 *   <li>{@code \[name]} glyphs</li>
 *   <li>restore the backslash placeholder</li>
 *   <li>{@code \*(xx}, {@code \*[name]} and {@code \*x} strings</li>
 *   <li>escape {@code <} and {@code >}</li>
 * </ol>
 * Unknown escapes are left as they are.
 */
public final class SpecialCharacters {

    private static final char BACKSLASH_PLACEHOLDER = '\uE000';

    private static final Pattern BARE_AMPERSAND =
            Pattern.compile("&(?!(?:[A-Za-z][A-Za-z0-9]*|#[0-9]+|#[xX][0-9A-Fa-f]+);)");
    private static final Pattern TWO_CHAR_GLYPH = Pattern.compile("\\\\\\((..)");
    private static final Pattern NAMED_GLYPH = Pattern.compile("\\\\\\[([^\\]\\s]+)]");
    private static final Pattern UNICODE_NAME = Pattern.compile("u([0-9A-Fa-f]{4,6})");
    private static final Pattern PREDEFINED_STRING =
            Pattern.compile("\\\\\\*(?:\\((..)|\\[([^\\]\\s]+)]|([^(\\[]))");
    private static final Pattern SIZE_ESCAPE = Pattern.compile(
            "\\\\s(?:[-+]?(?:[1-3][0-9]|[0-9])|\\([-+]?[0-9]{2}|\\[[-+]?[0-9]+])");

    private static final Map<String, String> GLYPHS = new HashMap<>();
    private static final Map<String, String> STRINGS = new HashMap<>();

    static {
        // Dashes, quotes and punctuation
        glyph("em", "&mdash;");
        glyph("en", "&ndash;");
        glyph("hy", "-");
        glyph("bu", "&bull;");
        glyph("co", "&copy;");
        glyph("rg", "&reg;");
        glyph("tm", "&trade;");
        glyph("dg", "&dagger;");
        glyph("dd", "&Dagger;");
        glyph("sc", "&sect;");
        glyph("ps", "&para;");
        glyph("de", "&deg;");
        glyph("lq", "&ldquo;");
        glyph("rq", "&rdquo;");
        glyph("oq", "&lsquo;");
        glyph("cq", "&rsquo;");
        glyph("aq", "'");
        glyph("dq", "&quot;");
        glyph("Bq", "&bdquo;");
        glyph("bq", "&sbquo;");
        glyph("Fo", "&laquo;");
        glyph("Fc", "&raquo;");
        glyph("fo", "&lsaquo;");
        glyph("fc", "&rsaquo;");
        glyph("r!", "&iexcl;");
        glyph("r?", "&iquest;");
        glyph("ha", "^");
        glyph("ti", "~");
        glyph("rs", String.valueOf(BACKSLASH_PLACEHOLDER));
        glyph("sl", "/");
        glyph("ba", "|");
        glyph("or", "|");
        glyph("br", "&#9474;");
        glyph("ul", "_");
        glyph("ru", "_");
        glyph("rn", "&oline;");
        glyph("bb", "&brvbar;");
        glyph("at", "@");
        glyph("sh", "#");
        glyph("aa", "&acute;");
        glyph("ga", "`");
        glyph("ci", "&#9675;");
        glyph("sq", "&#9633;");
        glyph("OK", "&#10003;");
        glyph("mc", "&micro;");
        glyph("lh", "&#9756;");
        glyph("rh", "&#9758;");

        // Currency
        glyph("Do", "$");
        glyph("ct", "&cent;");
        glyph("Eu", "&euro;");
        glyph("eu", "&euro;");
        glyph("Ye", "&yen;");
        glyph("Po", "&pound;");
        glyph("Cs", "&curren;");
        glyph("Fn", "&fnof;");

        // Arrows
        glyph("<-", "&larr;");
        glyph("->", "&rarr;");
        glyph("<>", "&harr;");
        glyph("da", "&darr;");
        glyph("ua", "&uarr;");
        glyph("va", "&#8597;");
        glyph("lA", "&lArr;");
        glyph("rA", "&rArr;");
        glyph("hA", "&hArr;");
        glyph("dA", "&dArr;");
        glyph("uA", "&uArr;");
        glyph("vA", "&#8661;");

        // Brackets
        glyph("lB", "[");
        glyph("rB", "]");
        glyph("lC", "{");
        glyph("rC", "}");
        glyph("la", "&lang;");
        glyph("ra", "&rang;");
        glyph("bv", "&#9130;");
        glyph("lt", "&#9127;");
        glyph("lk", "&#9128;");
        glyph("lb", "&#9129;");
        glyph("rt", "&#9131;");
        glyph("rk", "&#9132;");
        glyph("rb", "&#9133;");

        // Mathematics and logic
        glyph("pl", "+");
        glyph("mi", "&minus;");
        glyph("-+", "&#8723;");
        glyph("+-", "&plusmn;");
        glyph("pc", "&middot;");
        glyph("md", "&sdot;");
        glyph("mu", "&times;");
        glyph("di", "&divide;");
        glyph("f/", "&frasl;");
        glyph("**", "&lowast;");
        glyph("<=", "&le;");
        glyph(">=", "&ge;");
        glyph("<<", "&#8810;");
        glyph(">>", "&#8811;");
        glyph("!=", "&ne;");
        glyph("==", "&equiv;");
        glyph("ne", "&#8802;");
        glyph("=~", "&cong;");
        glyph("|=", "&#8771;");
        glyph("ap", "&sim;");
        glyph("~~", "&asymp;");
        glyph("~=", "&asymp;");
        glyph("pt", "&prop;");
        glyph("es", "&empty;");
        glyph("mo", "&isin;");
        glyph("nm", "&notin;");
        glyph("sb", "&sub;");
        glyph("nb", "&nsub;");
        glyph("sp", "&sup;");
        glyph("nc", "&#8835;");
        glyph("ib", "&sube;");
        glyph("ip", "&supe;");
        glyph("ca", "&cap;");
        glyph("cu", "&cup;");
        glyph("/_", "&ang;");
        glyph("pp", "&perp;");
        glyph("is", "&int;");
        glyph("integral", "&int;");
        glyph("sum", "&sum;");
        glyph("product", "&prod;");
        glyph("coproduct", "&#8720;");
        glyph("gr", "&nabla;");
        glyph("sr", "&radic;");
        glyph("sqrt", "&radic;");
        glyph("if", "&infin;");
        glyph("Ah", "&alefsym;");
        glyph("Im", "&image;");
        glyph("Re", "&real;");
        glyph("wp", "&weierp;");
        glyph("pd", "&part;");
        glyph("-h", "&#8463;");
        glyph("12", "&frac12;");
        glyph("14", "&frac14;");
        glyph("34", "&frac34;");
        glyph("S1", "&sup1;");
        glyph("S2", "&sup2;");
        glyph("S3", "&sup3;");
        glyph("fa", "&forall;");
        glyph("te", "&exist;");
        glyph("no", "&not;");
        glyph("AN", "&and;");
        glyph("OR", "&or;");
        glyph("tf", "&there4;");
        glyph("3d", "&there4;");

        // Greek
        glyph("*a", "&alpha;");
        glyph("*b", "&beta;");
        glyph("*g", "&gamma;");
        glyph("*d", "&delta;");
        glyph("*e", "&epsilon;");
        glyph("*z", "&zeta;");
        glyph("*y", "&eta;");
        glyph("*h", "&theta;");
        glyph("*i", "&iota;");
        glyph("*k", "&kappa;");
        glyph("*l", "&lambda;");
        glyph("*m", "&mu;");
        glyph("*n", "&nu;");
        glyph("*c", "&xi;");
        glyph("*o", "&omicron;");
        glyph("*p", "&pi;");
        glyph("*r", "&rho;");
        glyph("*s", "&sigma;");
        glyph("ts", "&sigmaf;");
        glyph("*t", "&tau;");
        glyph("*u", "&upsilon;");
        glyph("*f", "&phi;");
        glyph("*x", "&chi;");
        glyph("*q", "&psi;");
        glyph("*w", "&omega;");
        glyph("*G", "&Gamma;");
        glyph("*D", "&Delta;");
        glyph("*H", "&Theta;");
        glyph("*L", "&Lambda;");
        glyph("*C", "&Xi;");
        glyph("*P", "&Pi;");
        glyph("*S", "&Sigma;");
        glyph("*F", "&Phi;");
        glyph("*Q", "&Psi;");
        glyph("*W", "&Omega;");

        // Card suits
        glyph("CL", "&clubs;");
        glyph("SP", "&spades;");
        glyph("HE", "&hearts;");
        glyph("DI", "&diams;");

        // Letters
        glyph("ss", "&szlig;");
        glyph("ae", "&aelig;");
        glyph("AE", "&AElig;");
        glyph("oe", "&oelig;");
        glyph("OE", "&OElig;");
        glyph("o/", "&oslash;");
        glyph("O/", "&Oslash;");
        glyph("-D", "&ETH;");
        glyph("Sd", "&eth;");
        glyph("TP", "&THORN;");
        glyph("Tp", "&thorn;");
        glyph(".i", "&#305;");
        glyph("~n", "&ntilde;");
        glyph("~N", "&Ntilde;");
        glyph(",c", "&ccedil;");
        glyph(",C", "&Ccedil;");
        glyph("oa", "&aring;");
        glyph("oA", "&Aring;");
        accented('\'', "acute", "aeiouyAEIOUY");
        accented('`', "grave", "aeiouAEIOU");
        accented(':', "uml", "aeiouyAEIOU");
        accented('^', "circ", "aeiouAEIOU");

        // Predefined strings of the man and mdoc packages
        STRINGS.put("lq", "&ldquo;");
        STRINGS.put("rq", "&rdquo;");
        STRINGS.put("Lq", "&ldquo;");
        STRINGS.put("Rq", "&rdquo;");
        STRINGS.put("Tm", "&trade;");
        STRINGS.put("R", "&reg;");
        STRINGS.put("S", "");
        STRINGS.put("Aq", "'");
        STRINGS.put("Ba", "|");
        STRINGS.put("Gt", "&gt;");
        STRINGS.put("Lt", "&lt;");
        STRINGS.put("Le", "&le;");
        STRINGS.put("Ge", "&ge;");
        STRINGS.put("Ne", "&ne;");
        STRINGS.put("Pi", "&pi;");
        STRINGS.put("If", "&infin;");
        STRINGS.put("Am", "&amp;");
        STRINGS.put("Na", "NaN");
        STRINGS.put("Px", "POSIX");
        STRINGS.put("Ai", "ANSI");
        STRINGS.put("Ux", "UNIX");
    }

    private SpecialCharacters() {
    }

    public static String translate(String text) {
        String result = normalizeEscapes(text);
        result = result.replace("\\-", "\\(en");
        result = BARE_AMPERSAND.matcher(result).replaceAll("&amp;");
        result = replaceRepeatedly(result, TWO_CHAR_GLYPH, m -> GLYPHS.get(m.group(1)));
        result = replaceRepeatedly(result, NAMED_GLYPH, m -> namedGlyph(m.group(1)));
        result = result.replace(BACKSLASH_PLACEHOLDER, '\\');
        result = replaceRepeatedly(result, PREDEFINED_STRING, SpecialCharacters::predefinedString);
        return result.replace("<", "&lt;").replace(">", "&gt;");
    }

    /**
     * Cuts a {@code \"} or {@code \#} comment off the line.
     */
    public static String stripComment(String line) {
        int n = line.length();
        for (int i = 0; i + 1 < n; i++) {
            if (line.charAt(i) != '\\') {
                continue;
            }
            char next = line.charAt(i + 1);
            if (next == '"' || next == '#') {
                return stripTrailingWhitespace(line.substring(0, i));
            }
            i++;
        }
        return line;
    }

    private static String normalizeEscapes(String text) {
        String input = SIZE_ESCAPE.matcher(text).replaceAll("");
        StringBuilder out = new StringBuilder(input.length());
        int n = input.length();
        int i = 0;
        while (i < n) {
            char c = input.charAt(i);
            if (c != '\\' || i + 1 >= n) {
                out.append(c);
                i++;
                continue;
            }
            char next = input.charAt(i + 1);
            switch (next) {
                case '&', ':', '|', '^', '%', 'c', '/', ',', ')' -> {
                    // zero width
                }
                case ' ', '~', '0' -> out.append(' ');
                case '\\', 'e' -> out.append("\\(rs");
                case '\'' -> out.append("\\(aa");
                case '`' -> out.append("\\(ga");
                case '.' -> out.append('.');
                default -> out.append(c).append(next);
            }
            i += 2;
        }
        return out.toString();
    }

    private static String namedGlyph(String name) {
        String glyph = GLYPHS.get(name);
        if (glyph != null) {
            return glyph;
        }
        Matcher unicode = UNICODE_NAME.matcher(name);
        return unicode.matches() ? "&#x" + unicode.group(1).toUpperCase(Locale.ROOT) + ";" : null;
    }

    private static String predefinedString(Matcher m) {
        String name = m.group(1) != null ? m.group(1) : m.group(2) != null ? m.group(2) : m.group(3);
        return STRINGS.get(name);
    }

    // A lookup returning null keeps the escape untouched.
    private static String replaceRepeatedly(String text, Pattern pattern, Function<Matcher, String> lookup) {
        String current = text;
        while (true) {
            Matcher m = pattern.matcher(current);
            StringBuilder sb = new StringBuilder(current.length());
            boolean changed = false;
            while (m.find()) {
                String replacement = lookup.apply(m);
                if (replacement == null) {
                    replacement = m.group();
                } else {
                    changed = true;
                }
                m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
            }
            m.appendTail(sb);
            if (!changed) {
                return current;
            }
            current = sb.toString();
        }
    }

    private static void glyph(String name, String html) {
        GLYPHS.put(name, html);
    }

    private static void accented(char mark, String entitySuffix, String letters) {
        for (char letter : letters.toCharArray()) {
            GLYPHS.put("" + mark + letter, "&" + letter + entitySuffix + ";");
        }
    }

    private static String stripTrailingWhitespace(String s) {
        int end = s.length();
        while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(0, end);
    }
}
