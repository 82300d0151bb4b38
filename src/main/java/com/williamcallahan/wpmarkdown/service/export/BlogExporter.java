package com.williamcallahan.wpmarkdown.service.export;

import com.williamcallahan.wpmarkdown.domain.export.ConvertedDocument;
import com.williamcallahan.wpmarkdown.domain.export.DocumentOutcome;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Lays out converted documents and the media manifest on disk.
 */
@Service
public class BlogExporter {
    private static final Logger log = LoggerFactory.getLogger(BlogExporter.class);

    static final String MANIFEST_FILE = "MANIFEST.txt";

    private final PostWriter postWriter;
    private final ExportFailureFactory failureFactory;

    public BlogExporter(PostWriter postWriter, ExportFailureFactory failureFactory) {
        this.postWriter = Objects.requireNonNull(postWriter, "postWriter");
        this.failureFactory = Objects.requireNonNull(failureFactory, "failureFactory");
    }

    /**
     * Creates the output and media directories.
     *
     * @param outputDir output root
     * @param mediaDir media directory relative to the output root
     * @return resolved media directory
     * @throws IOException if the directories cannot be created
     */
    public Path prepare(Path outputDir, String mediaDir) throws IOException {
        Path mediaPath = outputDir.resolve(mediaDir);
        Files.createDirectories(mediaPath);
        return mediaPath;
    }

    /**
     * Writes one document unless it is unpublished and only published documents are wanted.
     *
     * @param outputDir output root
     * @param converted converted document
     * @param publishedOnly whether to skip unpublished documents
     * @return outcome; write failures are returned, not thrown
     */
    public DocumentOutcome export(Path outputDir, ConvertedDocument converted, boolean publishedOnly) {
        if (publishedOnly && !converted.document().isPublished()) {
            log.debug("Skipping unpublished document {}", converted.document().id());
            return DocumentOutcome.skippedUnpublished();
        }
        try {
            Path file = postWriter.write(outputDir, converted.document(), converted.markdown());
            return DocumentOutcome.writtenTo(file);
        } catch (IOException exception) {
            log.error("Failed to write document {}", converted.document().id(), exception);
            return DocumentOutcome.failedWith(
                    failureFactory.failure(converted.document(), ExportFailureFactory.PHASE_WRITE, exception));
        }
    }

    /**
     * Writes {@code MANIFEST.txt} listing {@code filename<TAB>url} for every referenced attachment.
     *
     * @param mediaPath media directory
     * @param attachments original URL to local file name
     * @return manifest file
     * @throws IOException if the manifest cannot be written
     */
    public Path writeManifest(Path mediaPath, Map<String, String> attachments) throws IOException {
        StringBuilder manifest = new StringBuilder();
        attachments.forEach((url, filename) -> manifest.append(filename).append('\t').append(url).append('\n'));
        Path file = mediaPath.resolve(MANIFEST_FILE);
        Files.writeString(file, manifest.toString(), StandardCharsets.UTF_8);
        return file;
    }
}
