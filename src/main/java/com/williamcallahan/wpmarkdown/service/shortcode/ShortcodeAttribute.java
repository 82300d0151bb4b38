package com.williamcallahan.wpmarkdown.service.shortcode;

import java.util.Objects;

/**
 * A single key/value pair parsed from a shortcode's attribute text.
 *
 * <p>Positional values carry synthetic keys {@code @0}, {@code @1}, ... in encounter order.</p>
 *
 * @param key attribute key
 * @param value attribute value, never null
 */
public record ShortcodeAttribute(String key, String value) {

    private static final String POSITIONAL_PREFIX = "@";

    public ShortcodeAttribute {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    /**
     * Creates a positional attribute.
     *
     * @param position zero-based position among positional values
     * @param value attribute value
     * @return attribute keyed {@code @position}
     */
    public static ShortcodeAttribute positional(int position, String value) {
        return new ShortcodeAttribute(POSITIONAL_PREFIX + position, value);
    }

    /**
     * Returns whether this attribute was given without a key.
     *
     * @return true for {@code @n} keys
     */
    public boolean isPositional() {
        return key.startsWith(POSITIONAL_PREFIX);
    }
}
