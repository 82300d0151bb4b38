package com.williamcallahan.wpmarkdown.service.export;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.wpmarkdown.domain.export.ExportChannel;
import com.williamcallahan.wpmarkdown.domain.export.ExportItem;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies reading of WordPress export XML into channel and item records.
 */
class WxrExportReaderTest {

    private WxrExportReader reader;

    @BeforeEach
    void setUp() {
        reader = new WxrExportReader();
    }

    @Test
    void readsChannelAndAuthors() throws URISyntaxException {
        ExportChannel channel = reader.read(sampleExport());

        assertEquals("Sample Blog", channel.title());
        assertEquals("http://blog.example.com", channel.link());
        assertEquals("http://blog.example.com", channel.baseBlogUrl());
        assertEquals(1, channel.authors().size());
        assertEquals("Ryg", channel.authors().get(0).displayName());
        assertEquals("ryg@example.com", channel.authors().get(0).email());
        assertEquals(7, channel.items().size());
    }

    @Test
    void readsPostFieldsCategoriesAndComments() throws URISyntaxException {
        ExportItem post = reader.read(sampleExport()).items().get(0);

        assertEquals("Hello World", post.title());
        assertEquals(10L, post.postId());
        assertEquals("hello-world", post.postName());
        assertEquals("post", post.postType());
        assertEquals("2013-07-15 10:00:00", post.postDateGmt());
        assertEquals("open", post.commentStatus());
        assertEquals("publish", post.status());
        assertTrue(post.content().startsWith("Welcome! See <a href=\"http://blog.example.com/about/\">"),
                "CDATA content should be kept as raw HTML");
        assertEquals(List.of("General"), post.categories());
        assertEquals(2, post.comments().size());
        assertEquals("", post.comments().get(0).type());
        assertEquals("Nice post", post.comments().get(0).content());
        assertEquals("pingback", post.comments().get(1).type());
    }

    @Test
    void readsAttachmentParentAndUrl() throws URISyntaxException {
        ExportItem attachment = reader.read(sampleExport()).items().get(4);

        assertEquals("attachment", attachment.postType());
        assertEquals(10L, attachment.postParent());
        assertEquals("http://blog.example.com/wp-content/uploads/2013/07/cat.png", attachment.attachmentUrl());
    }

    @Test
    void missingElementsReadAsEmptyValues() {
        ExportChannel channel = reader.parse("<rss><channel><item><title>t</title></item></channel></rss>");

        ExportItem item = channel.items().get(0);
        assertEquals("t", item.title());
        assertEquals("", item.content());
        assertEquals(0L, item.postId());
        assertTrue(channel.authors().isEmpty());
    }

    @Test
    void rejectsDocumentWithoutChannel() {
        assertThrows(ExportFormatException.class, () -> reader.parse("<feed><entry/></feed>"));
    }

    @Test
    void rejectsNonNumericPostId() {
        assertThrows(ExportFormatException.class, () -> reader.parse(
                "<rss><channel><item><wp:post_id>abc</wp:post_id></item></channel></rss>"));
    }

    @Test
    void rejectsUnreadableFile(@TempDir Path tempDir) {
        assertThrows(ExportFormatException.class, () -> reader.read(tempDir.resolve("missing.xml")));
    }

    private Path sampleExport() throws URISyntaxException {
        return Path.of(getClass().getResource("/wxr/sample-export.xml").toURI());
    }
}
