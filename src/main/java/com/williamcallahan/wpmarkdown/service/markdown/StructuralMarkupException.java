package com.williamcallahan.wpmarkdown.service.markdown;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Raised when shortcode open and close tags do not nest properly.
 */
public class StructuralMarkupException extends MarkupConversionException {

    private final String tagName;
    private final List<String> openTagNames;

    private StructuralMarkupException(String message, String tagName, List<String> openTagNames) {
        super(message);
        this.tagName = tagName;
        this.openTagNames = List.copyOf(openTagNames);
    }

    /**
     * Creates the failure for a closing tag that does not match the innermost open tag.
     *
     * @param tagName name of the closing tag
     * @param openTagNames tags open at that point, innermost first
     * @return structural failure
     */
    public static StructuralMarkupException unexpectedClose(String tagName, List<String> openTagNames) {
        Objects.requireNonNull(tagName, "tagName");
        String message = openTagNames.isEmpty()
                ? String.format(Locale.ROOT, "Unexpected closing shortcode '%s'; no shortcode is open", tagName)
                : String.format(
                        Locale.ROOT,
                        "Unexpected closing shortcode '%s'; innermost open shortcode is '%s'",
                        tagName,
                        openTagNames.get(0));
        return new StructuralMarkupException(message, tagName, openTagNames);
    }

    /**
     * Creates the failure for tags still open when their enclosing element ends.
     *
     * @param openTagNames tags still open, innermost first
     * @return structural failure
     */
    public static StructuralMarkupException stillOpen(List<String> openTagNames) {
        String message = String.format(
                Locale.ROOT, "Shortcodes still open at end of surrounding element: %s", openTagNames);
        return new StructuralMarkupException(message, null, openTagNames);
    }

    /**
     * Returns the closing tag that failed to match.
     *
     * @return tag name, or null when the failure is an unclosed tag
     */
    public String tagName() {
        return tagName;
    }

    /**
     * Returns the tags that were open when the failure was detected.
     *
     * @return open tag names, innermost first
     */
    public List<String> openTagNames() {
        return openTagNames;
    }
}
