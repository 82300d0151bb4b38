package com.williamcallahan.wpmarkdown.domain.export;

import java.util.Optional;

/**
 * Comment kinds WordPress exports.
 */
public enum CommentType {
    REGULAR(""),
    PINGBACK("pingback");

    private final String wordPressName;

    CommentType(String wordPressName) {
        this.wordPressName = wordPressName;
    }

    public static Optional<CommentType> fromWordPressName(String type) {
        for (CommentType candidate : values()) {
            if (candidate.wordPressName.equals(type)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
