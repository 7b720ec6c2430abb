package org.dxworks.man2html.converter;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Line source over a stack of open inputs. The top frame is the source being read;
 * {@code .so} pushes a new frame and exhausted frames are popped, so nested
 * inclusion reads as one flat stream of lines.
 */
public class InputResolver implements Closeable {

    public static final String STANDARD_INPUT = "-";

    private static final int MAX_DEPTH = 32;

    private final Deque<InputFrame> frames = new ArrayDeque<>();

    // Location of the last frame popped, reported once the stack has drained
    private String lastName = STANDARD_INPUT;
    private int lastLineNumber = 0;

    /**
     * Opens a named source. A relative name is resolved against the directory of
     * the including source, so includes keep working wherever the page tree lives.
     */
    public void open(String name) {
        if (STANDARD_INPUT.equals(name)) {
            open(name, new InputStreamReader(System.in, StandardCharsets.UTF_8));
            return;
        }

        String resolved = resolve(name);
        Path path = Paths.get(resolved);
        if (!Files.isRegularFile(path)) {
            throw new ConversionException("Cannot open input file: " + resolved);
        }
        try {
            open(resolved, new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConversionException("Cannot open input file: " + resolved, e);
        }
    }

    /** Pushes an already open source under the given name. */
    public void open(String name, Reader reader) {
        if (frames.size() >= MAX_DEPTH) {
            closeQuietly(reader, name);
            throw new ConversionException("Include nesting deeper than " + MAX_DEPTH + " at " + name);
        }
        BufferedReader buffered = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        frames.push(new InputFrame(name, buffered));
    }

    /**
     * Returns the next raw line, or {@code null} once every frame is exhausted.
     */
    public String nextLine() {
        while (!frames.isEmpty()) {
            InputFrame frame = frames.peek();
            String line;
            try {
                line = frame.reader.readLine();
            } catch (IOException e) {
                throw new ConversionException("Failed to read " + frame.name + ": " + e.getMessage(), e);
            }
            if (line != null) {
                frame.lineNumber++;
                return line;
            }
            frames.pop();
            lastName = frame.name;
            lastLineNumber = frame.lineNumber;
            closeFrame(frame);
        }
        return null;
    }

    public String sourceName() {
        InputFrame frame = frames.peek();
        return frame != null ? frame.name : lastName;
    }

    public int lineNumber() {
        InputFrame frame = frames.peek();
        return frame != null ? frame.lineNumber : lastLineNumber;
    }

    public String location() {
        return sourceName() + ":" + lineNumber();
    }

    public int depth() {
        return frames.size();
    }

    /**
     * Closes the frames still open, most recently opened first.
     */
    @Override
    public void close() {
        while (!frames.isEmpty()) {
            InputFrame frame = frames.pop();
            lastName = frame.name;
            lastLineNumber = frame.lineNumber;
            closeFrame(frame);
        }
    }

    private String resolve(String name) {
        InputFrame including = frames.peek();
        if (including == null || Paths.get(name).isAbsolute()) {
            return name;
        }
        Path parent = Paths.get(including.name).getParent();
        return parent == null ? name : parent.resolve(name).toString();
    }

    private static void closeFrame(InputFrame frame) {
        try {
            frame.reader.close();
        } catch (IOException e) {
            throw new ConversionException("Failed to close " + frame.name + ": " + e.getMessage(), e);
        }
    }

    private static void closeQuietly(Reader reader, String name) {
        try {
            reader.close();
        } catch (IOException e) {
            System.err.println("Failed to close " + name + ": " + e.getMessage());
        }
    }

    private static final class InputFrame {
        final String name;
        final BufferedReader reader;
        int lineNumber;

        InputFrame(String name, BufferedReader reader) {
            this.name = name;
            this.reader = reader;
        }
    }
}
