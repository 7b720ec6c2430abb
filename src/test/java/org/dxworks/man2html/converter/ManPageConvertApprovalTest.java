package org.dxworks.man2html.converter;

import org.approvaltests.Approvals;
import org.dxworks.man2html.Man2HtmlConfig;
import org.dxworks.man2html.OutputFormat;
import org.dxworks.man2html.TestUtils;
import org.dxworks.man2html.output.OutputStrategies;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;

public class ManPageConvertApprovalTest {

    @Test
    void convert_Ls() {
        verify("ls.1", OutputFormat.HTML);
    }

    @Test
    void convert_TablesAndPreformatted() {
        verify("tables.5", OutputFormat.RAW);
    }

    @Test
    void convert_NestedIncludes() {
        verify("include/main.1", OutputFormat.RAW);
    }

    private static void verify(String fileName, OutputFormat format) {
        StringWriter writer = new StringWriter();
        try (InputResolver input = new InputResolver()) {
            input.open(TestUtils.SAMPLES_BASE_PATH + fileName);
            new ManPageConverter(OutputStrategies.create(format, null, Man2HtmlConfig.defaults()), Diagnostics.silent())
                    .convert(input, writer);
        }
        Approvals.verify(writer.toString());
    }
}
