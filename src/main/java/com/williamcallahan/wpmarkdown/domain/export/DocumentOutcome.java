package com.williamcallahan.wpmarkdown.domain.export;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of exporting a single document.
 */
public sealed interface DocumentOutcome
        permits DocumentOutcome.Written, DocumentOutcome.Skipped, DocumentOutcome.Failed {

    /**
     * Returns true when a markdown file was written for the document.
     */
    boolean written();

    /**
     * Returns a typed failure when conversion or writing failed.
     */
    Optional<ExportFailure> failure();

    static DocumentOutcome writtenTo(Path file) {
        return new Written(file);
    }

    /**
     * Returns a skipped outcome for documents that converted but are not published.
     */
    static DocumentOutcome skippedUnpublished() {
        return Skipped.INSTANCE;
    }

    static DocumentOutcome failedWith(ExportFailure failure) {
        Objects.requireNonNull(failure, "failure");
        return new Failed(failure);
    }

    record Written(Path file) implements DocumentOutcome {
        public Written {
            Objects.requireNonNull(file, "file");
        }

        @Override
        public boolean written() {
            return true;
        }

        @Override
        public Optional<ExportFailure> failure() {
            return Optional.empty();
        }
    }

    record Skipped() implements DocumentOutcome {
        private static final Skipped INSTANCE = new Skipped();

        @Override
        public boolean written() {
            return false;
        }

        @Override
        public Optional<ExportFailure> failure() {
            return Optional.empty();
        }
    }

    record Failed(ExportFailure detail) implements DocumentOutcome {
        public Failed {
            Objects.requireNonNull(detail, "detail");
        }

        @Override
        public boolean written() {
            return false;
        }

        @Override
        public Optional<ExportFailure> failure() {
            return Optional.of(detail());
        }
    }
}
