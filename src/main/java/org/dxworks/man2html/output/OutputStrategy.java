package org.dxworks.man2html.output;

import org.dxworks.man2html.model.PageTitle;

/**
 * Decides what surrounds the converted body: the header written when {@code .TH} is seen
 * and the trailer written once after the last input line.
 */
public interface OutputStrategy {

    /**
     * @return header markup, possibly several lines, or an empty string
     */
    String header(PageTitle title);

    /**
     * Trailer owed once a header has been written, or {@code null} when there is none.
     */
    default String trailer() {
        return null;
    }
}
