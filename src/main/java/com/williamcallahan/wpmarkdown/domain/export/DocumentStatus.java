package com.williamcallahan.wpmarkdown.domain.export;

import java.util.Optional;

/**
 * Publication status of a document.
 */
public enum DocumentStatus {
    PUBLISH("publish"),
    DRAFT("draft"),
    PENDING("pending"),
    PRIVATE("private");

    private final String wordPressName;

    DocumentStatus(String wordPressName) {
        this.wordPressName = wordPressName;
    }

    public String wordPressName() {
        return wordPressName;
    }

    public static Optional<DocumentStatus> fromWordPressName(String status) {
        for (DocumentStatus candidate : values()) {
            if (candidate.wordPressName.equals(status)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
