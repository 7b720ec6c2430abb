package org.dxworks.man2html.converter;

/**
 * Fatal conversion failure. Aborts the run; nothing already written is rolled back.
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
