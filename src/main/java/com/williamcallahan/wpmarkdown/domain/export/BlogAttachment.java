package com.williamcallahan.wpmarkdown.domain.export;

import java.util.Objects;
import java.util.Optional;

/**
 * Media file uploaded to the blog.
 *
 * @param url file URL on the WordPress site
 * @param parentDocumentId id of the document it was uploaded to, null when unattached
 */
public record BlogAttachment(String url, String parentDocumentId) {

    public BlogAttachment {
        Objects.requireNonNull(url, "url");
    }

    public Optional<String> parentDocument() {
        return Optional.ofNullable(parentDocumentId);
    }
}
