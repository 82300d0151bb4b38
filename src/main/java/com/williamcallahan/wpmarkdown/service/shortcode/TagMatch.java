package com.williamcallahan.wpmarkdown.service.shortcode;

import java.util.Objects;

/**
 * Result of recognizing a shortcode right after an unconsumed {@code [}.
 *
 * <p>{@code length} counts the characters after that first bracket, so the whole tag spans
 * {@code length + 1} characters. An escape match ({@code [[tag]]}) has an empty name and a
 * non-null {@code literal} holding the single-bracketed text to emit instead.</p>
 *
 * @param length characters consumed after the opening bracket
 * @param opening whether the tag opens an element
 * @param closing whether the tag closes an element
 * @param name tag name, empty for escape matches
 * @param rawAttributes attribute text between the name and the closing bracket
 * @param literal replacement text for escape matches, otherwise null
 */
public record TagMatch(int length, boolean opening, boolean closing, String name, String rawAttributes, String literal) {

    public TagMatch {
        if (length <= 0) {
            throw new IllegalArgumentException("A tag match must consume input");
        }
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(rawAttributes, "rawAttributes");
    }

    static TagMatch tag(int length, boolean opening, boolean closing, String name, String rawAttributes) {
        return new TagMatch(length, opening, closing, name, rawAttributes, null);
    }

    static TagMatch escape(int length, String literal) {
        Objects.requireNonNull(literal, "literal");
        return new TagMatch(length, false, false, "", "", literal);
    }

    /**
     * Returns whether this match is an escaped literal rather than a real tag.
     *
     * @return true for {@code [[tag]]}
     */
    public boolean isEscape() {
        return name.isEmpty();
    }
}
