package com.williamcallahan.wpmarkdown.service.export;

import com.williamcallahan.wpmarkdown.domain.export.Blog;
import com.williamcallahan.wpmarkdown.domain.export.BlogAttachment;
import com.williamcallahan.wpmarkdown.domain.export.BlogAuthor;
import com.williamcallahan.wpmarkdown.domain.export.BlogComment;
import com.williamcallahan.wpmarkdown.domain.export.BlogDocument;
import com.williamcallahan.wpmarkdown.domain.export.CommentType;
import com.williamcallahan.wpmarkdown.domain.export.DocumentStatus;
import com.williamcallahan.wpmarkdown.domain.export.DocumentType;
import com.williamcallahan.wpmarkdown.domain.export.ExportAuthor;
import com.williamcallahan.wpmarkdown.domain.export.ExportChannel;
import com.williamcallahan.wpmarkdown.domain.export.ExportComment;
import com.williamcallahan.wpmarkdown.domain.export.ExportItem;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns export items into validated documents and attachments.
 *
 * <p>Posts and pages become documents, attachment items become attachments and every other post
 * type is ignored. Inconsistent exports fail with {@link ExportFormatException}.</p>
 */
@Service
public class BlogAssembler {
    private static final Logger log = LoggerFactory.getLogger(BlogAssembler.class);

    /** Formatter for WordPress GMT timestamps. */
    public static final DateTimeFormatter WORDPRESS_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);

    private static final String UNDATED = "0000-00-00 00:00:00";
    private static final String ATTACHMENT_POST_TYPE = "attachment";
    private static final String COMMENTS_OPEN = "open";
    private static final String COMMENTS_CLOSED = "closed";

    /**
     * Assembles the blog described by an export channel.
     *
     * @param channel parsed export
     * @return documents and attachments
     * @throws ExportFormatException when the export is inconsistent
     */
    public Blog assemble(ExportChannel channel) {
        Objects.requireNonNull(channel, "channel");
        BlogAuthor author = resolveAuthor(channel.authors());

        Map<String, BlogDocument> documentsById = new HashMap<>();
        Map<Long, BlogDocument> documentsByPostId = new HashMap<>();
        List<BlogDocument> documents = new ArrayList<>();
        for (ExportItem item : channel.items()) {
            Optional<BlogDocument> built = buildDocument(item);
            if (built.isEmpty()) {
                continue;
            }
            BlogDocument document = built.get();
            BlogDocument other = documentsById.putIfAbsent(document.id(), document);
            if (other != null) {
                throw new ExportFormatException(String.format(
                        Locale.ROOT,
                        "Post name '%s' occurs twice (posts '%s' and '%s')",
                        document.id(),
                        other.title(),
                        document.title()));
            }
            documentsByPostId.put(item.postId(), document);
            documents.add(document);
        }

        List<BlogAttachment> attachments = new ArrayList<>();
        for (ExportItem item : channel.items()) {
            if (ATTACHMENT_POST_TYPE.equals(item.postType())) {
                attachments.add(buildAttachment(item, documentsByPostId));
            }
        }

        log.info("Assembled {} documents and {} attachments", documents.size(), attachments.size());
        return new Blog(author, documents, attachments);
    }

    private static BlogAuthor resolveAuthor(List<ExportAuthor> authors) {
        if (authors.isEmpty()) {
            log.warn("Export lists no authors");
            return new BlogAuthor("", "");
        }
        if (authors.size() > 1) {
            log.warn("Export lists {} authors; crediting only the first", authors.size());
        }
        ExportAuthor first = authors.get(0);
        return new BlogAuthor(first.displayName(), first.email());
    }

    private static Optional<BlogDocument> buildDocument(ExportItem item) {
        Optional<DocumentType> type = DocumentType.fromWordPressName(item.postType());
        if (type.isEmpty()) {
            return Optional.empty();
        }
        if (item.postParent() != 0) {
            throw new ExportFormatException(String.format(
                    Locale.ROOT, "'%s' (%d): documents with parents are not supported", item.title(), item.postId()));
        }

        String id = item.postName().isBlank() ? generateDocumentId(item.title()) : item.postName();
        if (id.isEmpty()) {
            throw new ExportFormatException(String.format(
                    Locale.ROOT, "Post %d has neither a post name nor a usable title", item.postId()));
        }

        return Optional.of(new BlogDocument(
                id,
                item.title(),
                item.link(),
                item.content(),
                type.get(),
                parseStatus(item.status()),
                parseWordPressTime(item.postDateGmt()).orElse(null),
                parseCommentsEnabled(item.commentStatus()),
                buildComments(item.comments())));
    }

    private static BlogAttachment buildAttachment(ExportItem item, Map<Long, BlogDocument> documentsByPostId) {
        try {
            new URI(item.attachmentUrl());
        } catch (URISyntaxException exception) {
            throw new ExportFormatException(
                    "Attachment " + item.postId() + " has an unparseable URL '" + item.attachmentUrl() + "'", exception);
        }

        String parentId = null;
        if (item.postParent() != 0) {
            BlogDocument parent = documentsByPostId.get(item.postParent());
            if (parent == null) {
                log.warn("Attachment {} refers to unknown parent {}", item.postId(), item.postParent());
            } else {
                parentId = parent.id();
            }
        }
        return new BlogAttachment(item.attachmentUrl(), parentId);
    }

    private static List<BlogComment> buildComments(List<ExportComment> comments) {
        List<BlogComment> result = new ArrayList<>(comments.size());
        for (ExportComment comment : comments) {
            CommentType type = CommentType.fromWordPressName(comment.type())
                    .orElseThrow(() -> new ExportFormatException("Unknown comment type '" + comment.type() + "'"));
            result.add(new BlogComment(comment.id(), comment.author(), type, comment.content()));
        }
        return result;
    }

    /**
     * Derives a document id from a title: ASCII letters and digits lowercased, spaces as dashes,
     * dashes and underscores kept, everything else dropped.
     *
     * @param title post title
     * @return generated id, possibly empty
     */
    static String generateDocumentId(String title) {
        StringBuilder id = new StringBuilder(title.length());
        for (int index = 0; index < title.length(); index++) {
            char ch = title.charAt(index);
            if ((ch >= '0' && ch <= '9') || (ch >= 'a' && ch <= 'z') || ch == '-' || ch == '_') {
                id.append(ch);
            } else if (ch >= 'A' && ch <= 'Z') {
                id.append((char) (ch - 'A' + 'a'));
            } else if (ch == ' ') {
                id.append('-');
            }
        }
        return id.toString();
    }

    static DocumentStatus parseStatus(String status) {
        return DocumentStatus.fromWordPressName(status)
                .orElseThrow(() -> new ExportFormatException("Unknown post status '" + status + "'"));
    }

    static boolean parseCommentsEnabled(String commentStatus) {
        if (COMMENTS_OPEN.equals(commentStatus)) {
            return true;
        }
        if (COMMENTS_CLOSED.equals(commentStatus)) {
            return false;
        }
        throw new ExportFormatException("Unknown comment status '" + commentStatus + "'");
    }

    /**
     * Parses a WordPress timestamp; the all-zero timestamp means the post has no date.
     */
    static Optional<LocalDateTime> parseWordPressTime(String value) {
        if (UNDATED.equals(value)) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDateTime.parse(value, WORDPRESS_TIME));
        } catch (DateTimeParseException exception) {
            throw new ExportFormatException("Failed to parse WordPress time '" + value + "'", exception);
        }
    }
}
