package com.williamcallahan.wpmarkdown.domain.export;

import java.util.List;

/**
 * The {@code <channel>} of a WordPress eXtended RSS export.
 *
 * @param title blog title
 * @param link blog URL
 * @param baseBlogUrl base URL reported by WordPress
 * @param authors blog authors
 * @param items posts, pages, attachments and other items in export order
 */
public record ExportChannel(
        String title, String link, String baseBlogUrl, List<ExportAuthor> authors, List<ExportItem> items) {

    public ExportChannel {
        title = title == null ? "" : title;
        link = link == null ? "" : link;
        baseBlogUrl = baseBlogUrl == null ? "" : baseBlogUrl;
        authors = authors == null ? List.of() : List.copyOf(authors);
        items = items == null ? List.of() : List.copyOf(items);
    }
}
