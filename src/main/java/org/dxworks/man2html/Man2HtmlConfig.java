package org.dxworks.man2html;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class Man2HtmlConfig {

    private static final String CONFIG_FILE_NAME = "man2html-config.yml";
    private static final String DEFAULT_FORMAT = "html";
    private static final String DEFAULT_LAYOUT = "manpage";

    private final String format;
    private final String layout;
    private final String packageName;

    private Man2HtmlConfig(String format, String layout, String packageName) {
        this.format = format;
        this.layout = layout;
        this.packageName = packageName;
    }

    /** Output format used when none is given on the command line. */
    public String getFormat() {
        return format;
    }

    /** Layout written to front matter. */
    public String getLayout() {
        return layout;
    }

    /** Package written to front matter when the page's {@code .TH} names none; may be null. */
    public String getPackageName() {
        return packageName;
    }

    public static Man2HtmlConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static Man2HtmlConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return with(yamlConfig.format, yamlConfig.layout, yamlConfig.packageName);
            }
        } catch (IOException e) {
            System.err.println("Warning: ignoring unreadable " + configPath + ": " + e.getMessage());
        }

        return defaults();
    }

    public static Man2HtmlConfig defaults() {
        return new Man2HtmlConfig(DEFAULT_FORMAT, DEFAULT_LAYOUT, null);
    }

    public static Man2HtmlConfig with(String format, String layout, String packageName) {
        String effectiveFormat = (format != null && !format.isBlank()) ? format : DEFAULT_FORMAT;
        String effectiveLayout = (layout != null && !layout.isBlank()) ? layout : DEFAULT_LAYOUT;
        return new Man2HtmlConfig(effectiveFormat, effectiveLayout, packageName);
    }

    private static class YamlConfig {
        public String format;
        public String layout;
        public String packageName;
    }
}
