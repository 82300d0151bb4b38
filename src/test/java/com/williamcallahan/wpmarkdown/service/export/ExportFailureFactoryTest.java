package com.williamcallahan.wpmarkdown.service.export;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.williamcallahan.wpmarkdown.domain.export.BlogDocument;
import com.williamcallahan.wpmarkdown.domain.export.DocumentStatus;
import com.williamcallahan.wpmarkdown.domain.export.DocumentType;
import com.williamcallahan.wpmarkdown.domain.export.ExportFailure;
import com.williamcallahan.wpmarkdown.service.markdown.CaptionShapeException;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies the diagnostic details recorded for failed documents.
 */
class ExportFailureFactoryTest {

    private final ExportFailureFactory factory = new ExportFailureFactory();
    private final BlogDocument document = new BlogDocument(
            "broken", "Broken", "", "", DocumentType.POST, DocumentStatus.PUBLISH, null, true, List.of());

    @Test
    void appendsHintForKnownException() {
        ExportFailure failure = factory.failure(
                document, ExportFailureFactory.PHASE_CONVERT, new CaptionShapeException("caption"));

        assertEquals("broken", failure.documentId());
        assertEquals("Broken", failure.title());
        assertEquals(ExportFailureFactory.PHASE_CONVERT, failure.phase());
        assertEquals("CaptionShapeException: The content of the 'caption' shortcode must start with an image, "
                + "possibly nested inside a link (caption must wrap an image, optionally inside a link)",
                failure.details());
    }

    @Test
    void namesRootCauseForExceptionWithoutRemedy() {
        IOException exception = new IOException("disk full",
                new RuntimeException("wrapped", new IllegalStateException("inner")));

        ExportFailure failure = factory.failure(document, ExportFailureFactory.PHASE_WRITE, exception);

        assertEquals("IOException: disk full; root cause IllegalStateException: inner", failure.details());
    }

    @Test
    void subclassInheritsRemedyOfNearestRegisteredSupertype() {
        ExportFailure failure = factory.failure(
                document, ExportFailureFactory.PHASE_WRITE, new NoSuchFileException("out/broken.md"));

        assertEquals("NoSuchFileException: out/broken.md (file system rejected the write)", failure.details());
    }

    @Test
    void omitsBlankMessage() {
        ExportFailure failure = factory.failure(document, ExportFailureFactory.PHASE_WRITE, new IOException());

        assertEquals("IOException", failure.details());
    }
}
