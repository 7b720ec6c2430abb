package org.dxworks.man2html.output;

import org.dxworks.man2html.model.PageTitle;

/**
 * Wraps the page in a Doxygen comment block so it can be dropped into a source tree
 * and picked up as a related page.
 */
public class DoxygenOutput implements OutputStrategy {

    @Override
    public String header(PageTitle title) {
        return "/*!\n"
                + "\\page " + pageId(title.name) + " " + title.displayTitle() + "\n"
                + "\\htmlonly";
    }

    @Override
    public String trailer() {
        return "\\endhtmlonly\n*/";
    }

    private static String pageId(String name) {
        return name == null ? "page" : name.replaceAll("[^A-Za-z0-9_]", "_");
    }
}
