package com.williamcallahan.wpmarkdown.domain.export;

import java.util.Objects;

/**
 * Validated comment of a document.
 *
 * @param id WordPress comment id
 * @param author commenter name
 * @param type comment kind
 * @param content comment HTML
 */
public record BlogComment(long id, String author, CommentType type, String content) {

    public BlogComment {
        Objects.requireNonNull(author, "author");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(content, "content");
    }
}
