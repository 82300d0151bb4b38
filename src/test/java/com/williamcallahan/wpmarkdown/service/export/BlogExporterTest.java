package com.williamcallahan.wpmarkdown.service.export;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.williamcallahan.wpmarkdown.domain.export.BlogDocument;
import com.williamcallahan.wpmarkdown.domain.export.ConvertedDocument;
import com.williamcallahan.wpmarkdown.domain.export.DocumentOutcome;
import com.williamcallahan.wpmarkdown.domain.export.DocumentStatus;
import com.williamcallahan.wpmarkdown.domain.export.DocumentType;
import com.williamcallahan.wpmarkdown.domain.export.ExportFailure;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies per-document export outcomes and the media manifest.
 */
class BlogExporterTest {

    @TempDir
    Path outputDir;

    private BlogExporter exporter;

    @BeforeEach
    void setUp() {
        exporter = new BlogExporter(new PostWriter(), new ExportFailureFactory());
    }

    @Test
    void writesPublishedDocument() {
        DocumentOutcome outcome = exporter.export(outputDir, converted(DocumentStatus.PUBLISH), true);

        assertTrue(outcome.written());
        assertTrue(Files.exists(outputDir.resolve("hello.md")));
    }

    @Test
    void skipsUnpublishedDocumentWhenOnlyPublishedWanted() {
        DocumentOutcome outcome = exporter.export(outputDir, converted(DocumentStatus.DRAFT), true);

        assertInstanceOf(DocumentOutcome.Skipped.class, outcome);
        assertFalse(outcome.written());
        assertTrue(outcome.failure().isEmpty());
        assertFalse(Files.exists(outputDir.resolve("hello.md")));
    }

    @Test
    void writesUnpublishedDocumentWhenAllWanted() {
        assertTrue(exporter.export(outputDir, converted(DocumentStatus.DRAFT), false).written());
    }

    @Test
    void reportsWriteFailureAsOutcome() throws IOException {
        PostWriter failingWriter = mock(PostWriter.class);
        when(failingWriter.write(any(Path.class), any(BlogDocument.class), anyString()))
                .thenThrow(new AccessDeniedException("hello.md"));
        BlogExporter failingExporter = new BlogExporter(failingWriter, new ExportFailureFactory());

        DocumentOutcome outcome = failingExporter.export(outputDir, converted(DocumentStatus.PUBLISH), true);

        ExportFailure failure = outcome.failure().orElseThrow();
        assertEquals("hello", failure.documentId());
        assertEquals(ExportFailureFactory.PHASE_WRITE, failure.phase());
        assertEquals("AccessDeniedException: hello.md (permission denied)", failure.details());
    }

    @Test
    void writesManifestInReferenceOrder() throws IOException {
        Path mediaPath = exporter.prepare(outputDir, "wpmedia");
        Map<String, String> attachments = new LinkedHashMap<>();
        attachments.put("http://x.org/b.png", "b.png");
        attachments.put("http://x.org/a.png", "a.png");

        Path manifest = exporter.writeManifest(mediaPath, attachments);

        assertEquals(outputDir.resolve("wpmedia").resolve(BlogExporter.MANIFEST_FILE), manifest);
        assertEquals("b.png\thttp://x.org/b.png\na.png\thttp://x.org/a.png\n",
                Files.readString(manifest, StandardCharsets.UTF_8));
    }

    private static ConvertedDocument converted(DocumentStatus status) {
        BlogDocument document = new BlogDocument("hello", "Hello", "", "", DocumentType.POST, status, null, true, List.of());
        return new ConvertedDocument(document, "body");
    }
}
