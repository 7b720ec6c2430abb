package org.dxworks.man2html.output;

import org.dxworks.man2html.model.PageTitle;

/**
 * Bare HTML fragment, for pages embedded by some other template.
 */
public class RawOutput implements OutputStrategy {

    @Override
    public String header(PageTitle title) {
        return "";
    }
}
