package com.williamcallahan.wpmarkdown.domain.export;

import java.util.Objects;

/**
 * Captures a single document that could not be exported, with enough context to fix the source post.
 *
 * @param documentId document id
 * @param title document title
 * @param phase export phase that failed
 * @param details failure details for diagnostics
 */
public record ExportFailure(String documentId, String title, String phase, String details) {

    public ExportFailure {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("Document id is required");
        }
        if (phase == null || phase.isBlank()) {
            throw new IllegalArgumentException("Failure phase is required");
        }
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(details, "Failure details are required");
    }
}
