package com.williamcallahan.wpmarkdown.domain.export;

import java.util.List;

/**
 * One {@code <item>} of a WordPress export: a post, page, attachment or other post type.
 *
 * <p>Text fields are never null; absent elements read as empty strings and absent numbers as zero.</p>
 *
 * @param title item title
 * @param link permalink
 * @param content post HTML from {@code content:encoded}
 * @param postId WordPress post id
 * @param postDateGmt publication time as {@code yyyy-MM-dd HH:mm:ss}
 * @param postName slug
 * @param postType post type such as {@code post}, {@code page} or {@code attachment}
 * @param postParent parent post id, zero when none
 * @param commentStatus {@code open} or {@code closed}
 * @param status publication status
 * @param attachmentUrl file URL for attachments
 * @param categories category names
 * @param comments comments on the item
 */
public record ExportItem(
        String title,
        String link,
        String content,
        long postId,
        String postDateGmt,
        String postName,
        String postType,
        long postParent,
        String commentStatus,
        String status,
        String attachmentUrl,
        List<String> categories,
        List<ExportComment> comments) {

    public ExportItem {
        title = title == null ? "" : title;
        link = link == null ? "" : link;
        content = content == null ? "" : content;
        postDateGmt = postDateGmt == null ? "" : postDateGmt;
        postName = postName == null ? "" : postName;
        postType = postType == null ? "" : postType;
        commentStatus = commentStatus == null ? "" : commentStatus;
        status = status == null ? "" : status;
        attachmentUrl = attachmentUrl == null ? "" : attachmentUrl;
        categories = categories == null ? List.of() : List.copyOf(categories);
        comments = comments == null ? List.of() : List.copyOf(comments);
    }
}
