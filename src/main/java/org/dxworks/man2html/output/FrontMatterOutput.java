package org.dxworks.man2html.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.dxworks.man2html.converter.ConversionException;
import org.dxworks.man2html.model.PageTitle;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTML body preceded by a YAML front-matter block for static site generators.
 * Only fields that have a value are written.
 */
public class FrontMatterOutput implements OutputStrategy {

    private static final String DELIMITER = "---";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));

    private static final Map<Character, String> SECTION_DESCRIPTIONS = Map.of(
            '1', "User Commands",
            '2', "System Calls",
            '3', "Library Functions",
            '4', "Devices and Special Files",
            '5', "File Formats and Conventions",
            '6', "Games",
            '7', "Miscellaneous",
            '8', "System Administration",
            '9', "Kernel Routines");

    private final String permalink;
    private final String layout;
    private final String defaultPackage;

    public FrontMatterOutput(String permalink, String layout, String defaultPackage) {
        this.permalink = permalink;
        this.layout = layout;
        this.defaultPackage = defaultPackage;
    }

    @Override
    public String header(PageTitle title) {
        Map<String, String> fields = new LinkedHashMap<>();
        put(fields, "permalink", permalink);
        put(fields, "layout", layout);
        put(fields, "title", title.displayTitle());
        put(fields, "package", title.source != null && !title.source.isEmpty() ? title.source : defaultPackage);
        put(fields, "date", title.date);
        put(fields, "section", sectionDescription(title.section));

        try {
            String yaml = YAML_MAPPER.writeValueAsString(fields);
            return DELIMITER + "\n" + yaml.stripTrailing() + "\n" + DELIMITER;
        } catch (JsonProcessingException e) {
            throw new ConversionException("Failed to write front matter: " + e.getMessage(), e);
        }
    }

    static String sectionDescription(String section) {
        if (section == null || section.isEmpty()) {
            return null;
        }
        return SECTION_DESCRIPTIONS.get(section.charAt(0));
    }

    private static void put(Map<String, String> fields, String key, String value) {
        if (value != null && !value.isEmpty()) {
            fields.put(key, value);
        }
    }
}
