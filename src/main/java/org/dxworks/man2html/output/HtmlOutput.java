package org.dxworks.man2html.output;

import org.dxworks.man2html.model.PageTitle;

public class HtmlOutput implements OutputStrategy {

    private static final String TRAILER = "</body>\n</html>";

    @Override
    public String header(PageTitle title) {
        return "<!DOCTYPE html>\n"
                + "<html>\n"
                + "<head>\n"
                + "<meta http-equiv=\"Content-Type\" content=\"text/html; charset=UTF-8\">\n"
                + "<title>" + title.displayTitle() + "</title>\n"
                + "</head>\n"
                + "<body>";
    }

    @Override
    public String trailer() {
        return TRAILER;
    }
}
