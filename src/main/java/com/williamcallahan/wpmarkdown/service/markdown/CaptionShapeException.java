package com.williamcallahan.wpmarkdown.service.markdown;

/**
 * Raised when a caption shortcode does not start with an image, optionally wrapped in a link.
 */
public class CaptionShapeException extends MarkupConversionException {

    public CaptionShapeException(String tagName) {
        super("The content of the '" + tagName
                + "' shortcode must start with an image, possibly nested inside a link");
    }
}
