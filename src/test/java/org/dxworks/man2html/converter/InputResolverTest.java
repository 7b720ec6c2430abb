package org.dxworks.man2html.converter;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InputResolverTest {

    @TempDir
    Path tempDir;

    @Test
    void nextLine_ResumesIncludingSourceAfterInclude() throws IOException {
        Path main = tempDir.resolve("main.1");
        Files.writeString(main, "a\n.so sub/inc.1\nb\n");
        Files.createDirectories(tempDir.resolve("sub"));
        Path inc = tempDir.resolve("sub/inc.1");
        Files.writeString(inc, "x\n");

        try (InputResolver input = new InputResolver()) {
            input.open(main.toString());
            assertEquals("a", input.nextLine());
            assertEquals(".so sub/inc.1", input.nextLine());

            input.open("sub/inc.1");
            assertEquals(2, input.depth());
            assertEquals("x", input.nextLine());
            assertEquals(inc + ":1", input.location());

            assertEquals("b", input.nextLine());
            assertEquals(main + ":3", input.location());

            assertNull(input.nextLine());
            assertEquals(0, input.depth());
            assertEquals(main + ":3", input.location());
        }
    }

    @Test
    void open_MissingFileIsFatal() {
        try (InputResolver input = new InputResolver()) {
            ConversionException e = assertThrows(ConversionException.class,
                    () -> input.open(tempDir.resolve("missing.1").toString()));
            assertTrue(e.getMessage().contains("missing.1"));
        }
    }

    @Test
    void open_NestingIsLimited() {
        try (InputResolver input = new InputResolver()) {
            for (int i = 0; i < 32; i++) {
                input.open("page" + i, new StringReader(""));
            }
            assertThrows(ConversionException.class, () -> input.open("one-too-many", new StringReader("")));
        }
    }

    @Test
    void close_ClosesMostRecentFirst() {
        List<String> closed = new ArrayList<>();
        InputResolver input = new InputResolver();
        input.open("outer", new TrackingReader("outer", closed));
        input.open("inner", new TrackingReader("inner", closed));

        input.close();

        assertEquals(List.of("inner", "outer"), closed);
        assertEquals(0, input.depth());
    }

    private static class TrackingReader extends StringReader {
        private final String name;
        private final List<String> closed;

        TrackingReader(String name, List<String> closed) {
            super("");
            this.name = name;
            this.closed = closed;
        }

        @Override
        public void close() {
            closed.add(name);
            super.close();
        }
    }
}
