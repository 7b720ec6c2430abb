package org.dxworks.man2html.converter;

import java.util.ArrayList;
import java.util.List;

/**
 * One block mode per margin level. {@code .RS} pushes a level, {@code .RE} pops it; the base
 * level is always present. Methods return the markup to emit, never {@code null}.
 */
public class BlockStack {

    static final String INDENT_OPEN = "<div style=\"margin-left: 4ex\">";
    static final String INDENT_CLOSE = "</div>";

    private final List<BlockMode> modes = new ArrayList<>();

    public BlockStack() {
        modes.add(BlockMode.PARAGRAPH);
    }

    public BlockMode current() {
        return modes.get(modes.size() - 1);
    }

    public int depth() {
        return modes.size();
    }

    public boolean canExitMargin() {
        return modes.size() > 1;
    }

    /**
     * Closes the current level's block, if it is not a plain paragraph, and opens {@code mode}.
     * Returns nothing when the level already is in {@code mode}.
     */
    public String switchTo(BlockMode mode) {
        BlockMode current = current();
        if (current == mode) {
            return "";
        }
        modes.set(modes.size() - 1, mode);
        return join(current.getClosing(), mode.getOpening());
    }

    /** Back to a plain paragraph on the current level. */
    public String closeCurrent() {
        return switchTo(BlockMode.PARAGRAPH);
    }

    public String enterMargin() {
        modes.add(BlockMode.PARAGRAPH);
        return INDENT_OPEN;
    }

    /**
     * Pops one level. When only the base is left its block is closed instead and the
     * caller is expected to report the unmatched request.
     */
    public String exitMargin() {
        if (!canExitMargin()) {
            return closeCurrent();
        }
        BlockMode popped = modes.remove(modes.size() - 1);
        return join(popped.getClosing(), INDENT_CLOSE);
    }

    /** Closes every open block and margin, leaving only a plain base level. */
    public String closeAll() {
        StringBuilder sb = new StringBuilder();
        while (canExitMargin()) {
            append(sb, exitMargin());
        }
        append(sb, closeCurrent());
        return sb.toString();
    }

    private static String join(String first, String second) {
        StringBuilder sb = new StringBuilder();
        append(sb, first);
        append(sb, second);
        return sb.toString();
    }

    private static void append(StringBuilder sb, String markup) {
        if (markup.isEmpty()) {
            return;
        }
        if (sb.length() > 0) {
            sb.append('\n');
        }
        sb.append(markup);
    }
}
