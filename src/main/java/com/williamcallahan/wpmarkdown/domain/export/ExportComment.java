package com.williamcallahan.wpmarkdown.domain.export;

/**
 * Comment attached to an export item.
 *
 * @param id WordPress comment id
 * @param author commenter name
 * @param type WordPress comment type, empty for regular comments
 * @param content comment HTML
 */
public record ExportComment(long id, String author, String type, String content) {

    public ExportComment {
        author = author == null ? "" : author;
        type = type == null ? "" : type;
        content = content == null ? "" : content;
    }
}
