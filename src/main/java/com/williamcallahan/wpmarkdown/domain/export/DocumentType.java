package com.williamcallahan.wpmarkdown.domain.export;

import java.util.Optional;

/**
 * Kinds of export items that become documents.
 */
public enum DocumentType {
    POST("post"),
    PAGE("page");

    private final String wordPressName;

    DocumentType(String wordPressName) {
        this.wordPressName = wordPressName;
    }

    public String wordPressName() {
        return wordPressName;
    }

    /**
     * Maps a WordPress post type; other post types are not documents.
     *
     * @param postType value of {@code wp:post_type}
     * @return document type, or empty
     */
    public static Optional<DocumentType> fromWordPressName(String postType) {
        for (DocumentType type : values()) {
            if (type.wordPressName.equals(postType)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
