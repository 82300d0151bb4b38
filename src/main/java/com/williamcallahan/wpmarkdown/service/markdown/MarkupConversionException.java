package com.williamcallahan.wpmarkdown.service.markdown;

/**
 * Signals that a document's markup could not be converted to markdown.
 *
 * <p>Conversion failures come from the input itself, so callers skip the document rather than retry it.</p>
 */
public class MarkupConversionException extends IllegalStateException {

    /**
     * Creates a conversion exception with a failure summary.
     *
     * @param message failure summary
     */
    public MarkupConversionException(String message) {
        super(message);
    }

    /**
     * Creates a conversion exception with context and root cause.
     *
     * @param message failure summary
     * @param cause the underlying failure
     */
    public MarkupConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
