package org.dxworks.man2html.model;

/**
 * Fields of the {@code .TH} request. Everything but the name may be null.
 */
public class PageTitle {
    public String name;
    public String section;
    public String date;
    public String source; // package and version, e.g. "coreutils 9.4"
    public String manual;

    public String displayTitle() {
        String base = name == null ? "" : name;
        return section == null || section.isEmpty() ? base : base + "(" + section + ")";
    }
}
