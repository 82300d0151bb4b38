package com.williamcallahan.wpmarkdown.domain.export;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A post or page ready for conversion.
 *
 * @param id unique document id, used as the output file name
 * @param title document title
 * @param link permalink on the WordPress site
 * @param contentHtml original post HTML
 * @param type post or page
 * @param status publication status
 * @param publishedDate GMT publication time, null when WordPress reports no date
 * @param commentsEnabled whether comments were open
 * @param comments validated comments
 */
public record BlogDocument(
        String id,
        String title,
        String link,
        String contentHtml,
        DocumentType type,
        DocumentStatus status,
        LocalDateTime publishedDate,
        boolean commentsEnabled,
        List<BlogComment> comments) {

    public BlogDocument {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Document id is required");
        }
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(link, "link");
        Objects.requireNonNull(contentHtml, "contentHtml");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(status, "status");
        comments = comments == null ? List.of() : List.copyOf(comments);
    }

    public Optional<LocalDateTime> published() {
        return Optional.ofNullable(publishedDate);
    }

    public boolean isPublished() {
        return status == DocumentStatus.PUBLISH;
    }
}
