package com.williamcallahan.wpmarkdown.service.export;

import com.williamcallahan.wpmarkdown.domain.export.ExportAuthor;
import com.williamcallahan.wpmarkdown.domain.export.ExportChannel;
import com.williamcallahan.wpmarkdown.domain.export.ExportComment;
import com.williamcallahan.wpmarkdown.domain.export.ExportItem;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reads WordPress eXtended RSS (WXR) export files.
 *
 * <p>Elements are matched by their prefixed names ({@code wp:post_id}, {@code content:encoded}),
 * which is how WordPress writes every export.</p>
 */
@Service
public class WxrExportReader {
    private static final Logger log = LoggerFactory.getLogger(WxrExportReader.class);

    /**
     * Reads and parses an export file.
     *
     * @param exportFile path to the WXR file
     * @return parsed channel
     * @throws ExportFormatException when the file cannot be read or has no channel
     */
    public ExportChannel read(Path exportFile) {
        Objects.requireNonNull(exportFile, "exportFile");
        String xml;
        try {
            xml = Files.readString(exportFile, StandardCharsets.UTF_8);
        } catch (IOException exception) {
            throw new ExportFormatException("Failed to read export file " + exportFile, exception);
        }
        ExportChannel channel = parse(xml);
        log.info("Read export '{}' with {} items from {}", channel.title(), channel.items().size(), exportFile);
        return channel;
    }

    /**
     * Parses export XML.
     *
     * @param xml WXR document text
     * @return parsed channel
     * @throws ExportFormatException when the document has no channel
     */
    public ExportChannel parse(String xml) {
        Document document = Jsoup.parse(xml, "", Parser.xmlParser());
        Element channel = document.selectFirst("rss > channel");
        if (channel == null) {
            throw new ExportFormatException("Export has no <rss><channel> element");
        }

        List<ExportAuthor> authors = new ArrayList<>();
        List<ExportItem> items = new ArrayList<>();
        for (Element child : channel.children()) {
            String name = child.normalName();
            if ("wp:author".equals(name)) {
                authors.add(readAuthor(child));
            } else if ("item".equals(name)) {
                items.add(readItem(child));
            }
        }

        return new ExportChannel(
                childText(channel, "title"),
                childText(channel, "link"),
                childText(channel, "wp:base_blog_url"),
                authors,
                items);
    }

    private static ExportAuthor readAuthor(Element author) {
        return new ExportAuthor(
                childText(author, "wp:author_login"),
                childText(author, "wp:author_email"),
                childText(author, "wp:author_display_name"),
                childText(author, "wp:author_first_name"),
                childText(author, "wp:author_last_name"));
    }

    private static ExportItem readItem(Element item) {
        List<String> categories = new ArrayList<>();
        List<ExportComment> comments = new ArrayList<>();
        for (Element child : item.children()) {
            String name = child.normalName();
            if ("category".equals(name)) {
                categories.add(child.wholeText().trim());
            } else if ("wp:comment".equals(name)) {
                comments.add(new ExportComment(
                        childNumber(child, "wp:comment_id"),
                        childText(child, "wp:comment_author"),
                        childText(child, "wp:comment_type"),
                        childText(child, "wp:comment_content")));
            }
        }

        return new ExportItem(
                childText(item, "title"),
                childText(item, "link"),
                childText(item, "content:encoded"),
                childNumber(item, "wp:post_id"),
                childText(item, "wp:post_date_gmt"),
                childText(item, "wp:post_name"),
                childText(item, "wp:post_type"),
                childNumber(item, "wp:post_parent"),
                childText(item, "wp:comment_status"),
                childText(item, "wp:status"),
                childText(item, "wp:attachment_url"),
                categories,
                comments);
    }

    /**
     * Returns the text of the first direct child with the given name; nested items are never searched.
     */
    private static String childText(Element parent, String name) {
        for (Element child : parent.children()) {
            if (name.equals(child.normalName())) {
                return child.wholeText();
            }
        }
        return "";
    }

    private static long childNumber(Element parent, String name) {
        String text = childText(parent, name).trim();
        if (text.isEmpty()) {
            return 0L;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException exception) {
            throw new ExportFormatException(
                    String.format(Locale.ROOT, "Element <%s> must be a number but was '%s'", name, text), exception);
        }
    }
}
