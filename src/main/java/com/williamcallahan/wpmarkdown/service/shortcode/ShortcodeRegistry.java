package com.williamcallahan.wpmarkdown.service.shortcode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Names the shortcodes that are recognized as markup and whether each one is a block tag.
 *
 * <p>A block tag needs both {@code [tag]} and {@code [/tag]} and collects the content between them.
 * A standalone tag is always self-closing. Names missing from the registry are left as literal text.</p>
 *
 * @param blockByName tag name to "is block tag" flag
 */
public record ShortcodeRegistry(Map<String, Boolean> blockByName) {

    /** WordPress caption shortcode. */
    public static final String CAPTION = "caption";

    /** Legacy spelling of the caption shortcode. */
    public static final String WP_CAPTION = "wp_caption";

    /** WP-LaTeX shortcode, also used for spans produced from {@code $latex ...$}. */
    public static final String LATEX = "latex";

    private static final ShortcodeRegistry DEFAULTS = builder()
            .block(CAPTION)
            .block(WP_CAPTION)
            .block(LATEX)
            .build();

    public ShortcodeRegistry {
        Objects.requireNonNull(blockByName, "blockByName");
        blockByName.forEach((name, block) -> {
            requireName(name);
            if (block == null) {
                throw new IllegalArgumentException("Block flag is required for shortcode: " + name);
            }
        });
        blockByName = Map.copyOf(blockByName);
    }

    /**
     * Returns the registry used when nothing else is configured: caption, wp_caption and latex, all block tags.
     *
     * @return default registry
     */
    public static ShortcodeRegistry defaults() {
        return DEFAULTS;
    }

    /**
     * Starts an empty registry builder.
     *
     * @return registry builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a tag name.
     *
     * @param name tag name as written in the text
     * @return block flag, or empty when the name is not registered
     */
    public Optional<Boolean> lookup(String name) {
        return Optional.ofNullable(blockByName.get(name));
    }

    /**
     * Returns whether the name is registered at all.
     *
     * @param name tag name
     * @return true when the tag is recognized as markup
     */
    public boolean isKnown(String name) {
        return blockByName.containsKey(name);
    }

    /**
     * Returns all registered names.
     *
     * @return registered tag names
     */
    public Set<String> names() {
        return blockByName.keySet();
    }

    /**
     * Accumulates tag registrations; a later registration of the same name replaces the earlier one.
     */
    public static final class Builder {
        private final Map<String, Boolean> entries = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder block(String name) {
            entries.put(requireName(name), Boolean.TRUE);
            return this;
        }

        public Builder standalone(String name) {
            entries.put(requireName(name), Boolean.FALSE);
            return this;
        }

        public ShortcodeRegistry build() {
            return new ShortcodeRegistry(entries);
        }
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Shortcode name is required");
        }
        for (int index = 0; index < name.length(); index++) {
            if (!TagLexer.isNameCharacter(name.charAt(index))) {
                throw new IllegalArgumentException("Invalid shortcode name: " + name);
            }
        }
        return name;
    }
}
