package com.williamcallahan.wpmarkdown.service.markdown;

/**
 * Raised when a shortcode element reaches the renderer without a rendering rule.
 *
 * <p>This points at a registry that knows more tags than the renderer handles, not at bad input.</p>
 */
public class UnsupportedShortcodeException extends MarkupConversionException {

    private final String tagName;

    public UnsupportedShortcodeException(String tagName) {
        super("No rendering rule for shortcode '" + tagName + "'");
        this.tagName = tagName;
    }

    public String tagName() {
        return tagName;
    }
}
