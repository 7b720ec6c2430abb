package org.dxworks.man2html.converter;

import org.dxworks.man2html.converter.table.TableParser;
import org.dxworks.man2html.converter.table.TableRenderer;
import org.dxworks.man2html.model.PageTitle;
import org.dxworks.man2html.model.TableSpec;
import org.dxworks.man2html.output.OutputStrategy;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Interprets a man page line by line and writes the converted markup.
 * <p>
 * Request lines are split and dispatched on their {@link Request} kind; empty lines are paragraph
 * breaks; everything else is running text. {@code .TP}, {@code .IP} with a bullet and a bare
 * {@code .SH}/{@code .SS} read one more line as their term, item body or heading; that line is
 * expanded in place and never dispatched on its own.
 * <p>
 * An instance holds the state of one conversion and is not reusable.
 */
public class ManPageConverter {

    private static final Set<String> BULLET_GLYPHS =
            Set.of("\\(bu", "\\[bu]", "*", "-", "\\-", "o", "\\(em", "\\[em]", "\\(en", "\\(ci");

    private static final String TERM = "term";
    private static final String LIST_ITEM = "list item";
    private static final String HEADING = "heading";

    private final OutputStrategy output;
    private final Diagnostics diagnostics;
    private final FontInterpreter fonts = new FontInterpreter();
    private final BlockStack blocks = new BlockStack();
    private final FragmentAllocator fragments = new FragmentAllocator();

    private InputResolver input;
    private Writer out;
    private String trailer;
    private boolean titleSeen;
    private boolean preformatted;
    private boolean linkOpen;
    private Character pendingFont;

    public ManPageConverter(OutputStrategy output, Diagnostics diagnostics) {
        this.output = output;
        this.diagnostics = diagnostics;
    }

    /**
     * Converts an in-memory page.
     */
    public static String convert(String sourceName, String source, OutputStrategy output, Diagnostics diagnostics) {
        StringWriter writer = new StringWriter();
        try (InputResolver input = new InputResolver()) {
            input.open(sourceName, new StringReader(source));
            new ManPageConverter(output, diagnostics).convert(input, writer);
        }
        return writer.toString();
    }

    public void convert(InputResolver input, Writer out) {
        this.input = input;
        this.out = out;

        String line;
        while ((line = input.nextLine()) != null) {
            processLine(line);
        }
        finish();

        try {
            out.flush();
        } catch (IOException e) {
            throw new ConversionException("Failed to write output: " + e.getMessage(), e);
        }
    }

    private void processLine(String rawLine) {
        if (isRequestLine(rawLine)) {
            handleRequest(rawLine);
            return;
        }

        String line = SpecialCharacters.stripComment(rawLine);
        if (line.isBlank()) {
            if (line.length() != rawLine.length()) {
                return; // comment only
            }
            if (preformatted) {
                emit("");
            } else {
                paragraph();
            }
            return;
        }

        if (pendingFont != null) {
            emit(renderInline(FontInterpreter.withFont(pendingFont, line)));
            pendingFont = null;
            return;
        }
        emit(renderText(line));
    }

    private void handleRequest(String rawLine) {
        String body = SpecialCharacters.stripComment(rawLine.substring(1));
        List<String> words = RequestSplitter.split(body);
        if (words.isEmpty()) {
            return;
        }

        String name = words.get(0);
        List<String> args = words.subList(1, words.size());
        Optional<Request> request = Request.fromName(name);
        if (request.isEmpty()) {
            warn("unknown request ." + name + ", line dropped");
            return;
        }
        dispatch(request.get(), name, args);
    }

    private void dispatch(Request request, String name, List<String> args) {
        switch (request) {
            case TITLE -> title(args);
            case SECTION_HEADING -> heading("h1", name, args);
            case SUBSECTION_HEADING -> heading("h2", name, args);
            case PARAGRAPH -> paragraph();
            case INDENTED_PARAGRAPH -> indentedParagraph(args);
            case TAGGED_PARAGRAPH -> taggedParagraph();
            case MARGIN_START -> emit(blocks.enterMargin());
            case MARGIN_END -> marginEnd();
            case FONT, SMALL, SMALL_BOLD, ALTERNATING_FONT -> fontRequest(request, name, args);
            case FONT_CHANGE -> emitIfPresent(fonts.translate("\\f[" + (args.isEmpty() ? "" : args.get(0)) + "]", false));
            case LINE_BREAK -> emit(preformatted ? "" : "<br>");
            case NO_FILL -> startPreformatted();
            case FILL -> endPreformatted();
            case INCLUDE -> include(name, args);
            case TABLE_START -> table();
            case TABLE_END -> warn("." + name + " without matching .TS");
            case LINK_START -> linkStart(name, args, "");
            case MAIL_START -> linkStart(name, args, "mailto:");
            case LINK_END -> linkEnd(name, args);
            case SKIPPED_BLOCK -> skipBlock();
            case IGNORED -> {
                // no HTML counterpart
            }
        }
    }

    private void title(List<String> args) {
        if (titleSeen) {
            warn("repeated .TH ignored");
            return;
        }
        titleSeen = true;

        PageTitle title = new PageTitle();
        title.name = titleField(args, 0);
        title.section = titleField(args, 1);
        title.date = titleField(args, 2);
        title.source = titleField(args, 3);
        title.manual = titleField(args, 4);

        emitIfPresent(output.header(title));
        trailer = output.trailer();
    }

    private String titleField(List<String> args, int index) {
        return index < args.size() ? renderInline(args.get(index)) : null;
    }

    // Without arguments the next line is the heading text.
    private void heading(String tag, String name, List<String> args) {
        closeOpenBlocks();
        String label = args.isEmpty()
                ? expandLookahead(input.nextLine(), HEADING)
                : renderInline(String.join(" ", args));
        if (label.isBlank()) {
            warn("." + name + " without heading text");
            return;
        }

        String id = fragments.allocate(label);
        emit("<" + tag + " id=\"" + id + "\"><a href=\"#" + id + "\">" + label + "</a></" + tag + ">");
    }

    private void paragraph() {
        endPreformatted();
        emitIfPresent(blocks.closeCurrent());
        emit("<p>");
    }

    private void indentedParagraph(List<String> args) {
        endPreformatted();
        if (args.isEmpty() || args.get(0).isEmpty()) {
            // continues the current item or definition
            emit("<p>");
            return;
        }

        String tag = args.get(0);
        if (BULLET_GLYPHS.contains(tag)) {
            bulletItem();
        } else {
            definitionTerm(renderInline(tag));
        }
    }

    private void bulletItem() {
        if (blocks.current() == BlockMode.BULLET_LIST) {
            emit("</li>");
        } else {
            emit(blocks.switchTo(BlockMode.BULLET_LIST));
        }
        emit("<li>" + expandLookahead(input.nextLine(), LIST_ITEM));
    }

    private void taggedParagraph() {
        endPreformatted();
        definitionTerm(expandLookahead(input.nextLine(), TERM));
    }

    private void definitionTerm(String term) {
        if (blocks.current() == BlockMode.DEFINITION_LIST) {
            emit("</dd>");
        } else {
            emit(blocks.switchTo(BlockMode.DEFINITION_LIST));
        }
        emit("<dt>" + term + "</dt>");
        emit("<dd>");
    }

    /**
     * Expands the line pulled in by {@code .TP}, a bulleted {@code .IP} or a bare {@code .SH}/{@code .SS}.
     * A font request there is rendered inline; any other request only contributes its arguments as text.
     */
    private String expandLookahead(String line, String role) {
        if (line == null) {
            warn("end of input where a " + role + " was expected");
            return "";
        }
        if (!isRequestLine(line)) {
            String text = SpecialCharacters.stripComment(line);
            return LIST_ITEM.equals(role) ? renderText(text) : renderInline(text);
        }

        List<String> words = RequestSplitter.split(SpecialCharacters.stripComment(line.substring(1)));
        if (words.isEmpty()) {
            return "";
        }
        String name = words.get(0);
        List<String> args = words.subList(1, words.size());
        Optional<Request> request = Request.fromName(name);
        if (request.isPresent() && request.get().isInlineFont()) {
            return inlineFont(request.get(), name, args);
        }
        warn("request ." + name + " cannot start a " + role + ", using its arguments as text");
        return renderInline(String.join(" ", args));
    }

    private void marginEnd() {
        if (!blocks.canExitMargin()) {
            warn("unmatched .RE, margins reset");
        }
        emitIfPresent(blocks.exitMargin());
    }

    private void fontRequest(Request request, String name, List<String> args) {
        if (args.isEmpty()) {
            if (request == Request.FONT) {
                pendingFont = name.charAt(0);
            }
            return;
        }
        emit(inlineFont(request, name, args));
    }

    private String inlineFont(Request request, String name, List<String> args) {
        if (args.isEmpty()) {
            return "";
        }
        String text = String.join(" ", args);
        return switch (request) {
            case FONT -> renderInline(FontInterpreter.withFont(name.charAt(0), text));
            case SMALL -> "<small>" + renderInline(text) + "</small>";
            case SMALL_BOLD -> "<small>" + renderInline(FontInterpreter.withFont('B', text)) + "</small>";
            case ALTERNATING_FONT -> renderInline(FontInterpreter.alternating(name, args));
            default -> renderInline(text);
        };
    }

    private void include(String name, List<String> args) {
        if (args.isEmpty()) {
            warn("." + name + " without a file name");
            return;
        }
        input.open(args.get(0));
    }

    private void table() {
        emitIfPresent(fonts.close());
        TableSpec table = new TableParser(input, diagnostics).parse();
        emit(TableRenderer.render(table, this::renderInline));
    }

    private void linkStart(String name, List<String> args, String scheme) {
        if (args.isEmpty()) {
            warn("." + name + " without an address");
            return;
        }
        if (linkOpen) {
            emit("</a>");
        }
        emit("<a href=\"" + scheme + SpecialCharacters.translate(args.get(0)) + "\">");
        linkOpen = true;
    }

    private void linkEnd(String name, List<String> args) {
        if (!linkOpen) {
            warn("." + name + " without matching link start");
            return;
        }
        linkOpen = false;
        emit("</a>" + (args.isEmpty() ? "" : renderInline(args.get(0))));
    }

    // .de, .am and .ig run up to a line holding only ".."
    private void skipBlock() {
        String line;
        while ((line = input.nextLine()) != null) {
            if ("..".equals(line.trim())) {
                return;
            }
        }
    }

    private void startPreformatted() {
        if (!preformatted) {
            emit("<pre>");
            preformatted = true;
        }
    }

    private void endPreformatted() {
        if (preformatted) {
            emit("</pre>");
            preformatted = false;
        }
    }

    private void closeOpenBlocks() {
        emitIfPresent(fonts.close());
        endPreformatted();
        emitIfPresent(blocks.closeAll());
    }

    private void finish() {
        emitIfPresent(fonts.close());
        if (linkOpen) {
            emit("</a>");
            linkOpen = false;
        }
        endPreformatted();
        if (blocks.canExitMargin()) {
            warn("end of input with " + (blocks.depth() - 1) + " unclosed .RS");
        }
        emitIfPresent(blocks.closeAll());
        if (trailer != null) {
            emit(trailer);
        }
    }

    private String renderText(String line) {
        return UrlLinker.link(fonts.translate(SpecialCharacters.translate(line), false));
    }

    private String renderInline(String text) {
        return fonts.translate(SpecialCharacters.translate(text), true);
    }

    private static boolean isRequestLine(String line) {
        return !line.isEmpty() && (line.charAt(0) == '.' || line.charAt(0) == '\'');
    }

    private void warn(String message) {
        diagnostics.warn(input.location(), message);
    }

    private void emitIfPresent(String markup) {
        if (!markup.isEmpty()) {
            emit(markup);
        }
    }

    private void emit(String markup) {
        try {
            out.write(markup);
            out.write('\n');
        } catch (IOException e) {
            throw new ConversionException("Failed to write output: " + e.getMessage(), e);
        }
    }
}
