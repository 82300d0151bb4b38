package com.williamcallahan.wpmarkdown.service.export;

import com.williamcallahan.wpmarkdown.domain.export.BlogDocument;
import com.williamcallahan.wpmarkdown.domain.export.DocumentType;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.stereotype.Service;

/**
 * Writes one converted document as a markdown file with a {@code -key=value} header block.
 */
@Service
public class PostWriter {

    static final String MARKDOWN_EXTENSION = ".md";

    /**
     * Formats the header block followed by the markdown body.
     *
     * @param document document metadata
     * @param markdown converted content
     * @return file content
     */
    public String format(BlogDocument document, String markdown) {
        StringBuilder post = new StringBuilder(markdown.length() + 64);
        post.append("-title=").append(document.title()).append('\n');
        post.append("-time=")
                .append(document.published().map(BlogAssembler.WORDPRESS_TIME::format).orElse(""))
                .append('\n');
        if (document.type() == DocumentType.PAGE) {
            post.append("-type=page\n");
        }
        post.append(markdown);
        return post.toString();
    }

    /**
     * Writes {@code <outputDir>/<id>.md}, creating parent directories as needed.
     *
     * @param outputDir destination directory
     * @param document document metadata
     * @param markdown converted content
     * @return written file
     * @throws IOException if file operations fail
     */
    public Path write(Path outputDir, BlogDocument document, String markdown) throws IOException {
        Path file = outputDir.resolve(document.id() + MARKDOWN_EXTENSION);
        Files.createDirectories(file.getParent());
        Files.writeString(file, format(document, markdown), StandardCharsets.UTF_8);
        return file;
    }
}
