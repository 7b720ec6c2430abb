package org.dxworks.man2html;

import org.dxworks.man2html.converter.ConversionException;
import org.dxworks.man2html.converter.Diagnostics;
import org.dxworks.man2html.converter.InputResolver;
import org.dxworks.man2html.converter.ManPageConverter;
import org.dxworks.man2html.output.OutputStrategies;
import org.dxworks.man2html.output.OutputStrategy;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class App {

    public static void main(String[] args) {
        String format = null;
        String permalink = null;
        String outputFile = null;
        String inputFile = InputResolver.STANDARD_INPUT;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-f", "--format" -> format = requireValue(args, ++i, arg);
                case "-p", "--permalink" -> permalink = requireValue(args, ++i, arg);
                case "-o", "--output" -> outputFile = requireValue(args, ++i, arg);
                case "-h", "--help" -> {
                    printUsage();
                    System.exit(0);
                }
                default -> {
                    if (arg.startsWith("-") && !InputResolver.STANDARD_INPUT.equals(arg)) {
                        System.err.println("Error: Unknown option: " + arg);
                        printUsage();
                        System.exit(2);
                    }
                    inputFile = arg;
                }
            }
        }

        Man2HtmlConfig config = Man2HtmlConfig.load();
        try {
            OutputStrategy output = OutputStrategies.create(format != null ? format : config.getFormat(), permalink, config);
            run(inputFile, outputFile, output);
        } catch (ConversionException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        } catch (IOException e) {
            System.err.println("Error: Cannot write " + outputFile + ": " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Converts {@code inputFile} into {@code outputFile}; a null output means standard output.
     */
    public static void run(String inputFile, String outputFile, OutputStrategy output) throws IOException {
        Diagnostics diagnostics = Diagnostics.toStandardError();

        try (InputResolver input = new InputResolver()) {
            input.open(inputFile);

            if (outputFile == null) {
                Writer writer = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
                new ManPageConverter(output, diagnostics).convert(input, writer);
                return;
            }

            Path outputPath = Paths.get(outputFile);
            if (outputPath.getParent() != null) {
                Files.createDirectories(outputPath.getParent());
            }
            // closed after the trailer is written
            try (Writer writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
                new ManPageConverter(output, diagnostics).convert(input, writer);
            }
        }
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            System.err.println("Error: Missing value for " + option);
            printUsage();
            System.exit(2);
        }
        return args[index];
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar man2html.jar [-f <format>] [-p <permalink>] [-o <output-file>] [<input-file>]");
        System.err.println("  -f, --format:    html, frontmatter, raw or doxygen (default from man2html-config.yml, else html)");
        System.err.println("  -p, --permalink: permalink written to front matter");
        System.err.println("  -o, --output:    output file (default: standard output)");
        System.err.println("  <input-file>:    man page to convert; '-' or none reads standard input");
    }
}
