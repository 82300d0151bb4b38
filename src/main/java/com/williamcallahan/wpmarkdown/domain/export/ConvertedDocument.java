package com.williamcallahan.wpmarkdown.domain.export;

import java.util.Objects;

/**
 * A document together with its markdown rendering.
 *
 * @param document source document
 * @param markdown converted content
 */
public record ConvertedDocument(BlogDocument document, String markdown) {

    public ConvertedDocument {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(markdown, "markdown");
    }
}
