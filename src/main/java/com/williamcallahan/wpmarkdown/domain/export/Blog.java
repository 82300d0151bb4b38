package com.williamcallahan.wpmarkdown.domain.export;

import java.util.List;
import java.util.Objects;

/**
 * Documents and attachments assembled from one export.
 *
 * @param author blog author
 * @param documents posts and pages in export order
 * @param attachments media attachments in export order
 */
public record Blog(BlogAuthor author, List<BlogDocument> documents, List<BlogAttachment> attachments) {

    public Blog {
        Objects.requireNonNull(author, "author");
        documents = List.copyOf(documents);
        attachments = List.copyOf(attachments);
    }
}
