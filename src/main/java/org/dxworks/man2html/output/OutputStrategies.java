package org.dxworks.man2html.output;

import org.dxworks.man2html.Man2HtmlConfig;
import org.dxworks.man2html.OutputFormat;
import org.dxworks.man2html.converter.ConversionException;

public final class OutputStrategies {

    private OutputStrategies() {
    }

    /**
     * @param selector format name as given by the user or the configuration
     * @param permalink location override, only used by front matter; may be null
     * @throws ConversionException for an unknown selector
     */
    public static OutputStrategy create(String selector, String permalink, Man2HtmlConfig config) {
        OutputFormat format = OutputFormat.fromName(selector)
                .orElseThrow(() -> new ConversionException("Unknown output format: " + selector));
        return create(format, permalink, config);
    }

    public static OutputStrategy create(OutputFormat format, String permalink, Man2HtmlConfig config) {
        return switch (format) {
            case HTML -> new HtmlOutput();
            case FRONT_MATTER -> new FrontMatterOutput(permalink, config.getLayout(), config.getPackageName());
            case RAW -> new RawOutput();
            case DOXYGEN -> new DoxygenOutput();
        };
    }
}
