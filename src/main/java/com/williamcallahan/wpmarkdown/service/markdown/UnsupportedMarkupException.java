package com.williamcallahan.wpmarkdown.service.markdown;

/**
 * Raised for node kinds that never belong in post content, such as a DOCTYPE declaration.
 */
public class UnsupportedMarkupException extends MarkupConversionException {

    public UnsupportedMarkupException(String message) {
        super(message);
    }
}
