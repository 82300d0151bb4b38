package com.williamcallahan.wpmarkdown.config;

import com.williamcallahan.wpmarkdown.service.shortcode.ShortcodeRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Shortcodes recognized in post content.
 */
public class ShortcodeConfig {

    private static final String BLOCK_TAGS_KEY = "app.shortcodes.block-tags";
    private static final String STANDALONE_TAGS_KEY = "app.shortcodes.standalone-tags";
    private static final String NULL_LIST_FMT = "%s must not be null.";
    private static final String BOTH_KINDS_FMT = "Shortcode '%s' is listed in both %s and %s.";

    private List<String> blockTags = new ArrayList<>(List.of(
            ShortcodeRegistry.CAPTION, ShortcodeRegistry.WP_CAPTION, ShortcodeRegistry.LATEX));
    private List<String> standaloneTags = new ArrayList<>();

    /**
     * Creates shortcode configuration.
     */
    public ShortcodeConfig() {
    }

    /**
     * Validates shortcode settings.
     */
    public void validateConfiguration() {
        Set<String> blockNames = new HashSet<>(blockTags);
        for (String standaloneTag : standaloneTags) {
            if (blockNames.contains(standaloneTag)) {
                throw new IllegalArgumentException(String.format(
                        Locale.ROOT, BOTH_KINDS_FMT, standaloneTag, BLOCK_TAGS_KEY, STANDALONE_TAGS_KEY));
            }
        }
        toRegistry();
    }

    /**
     * Builds the registry described by this configuration.
     *
     * @return shortcode registry
     * @throws IllegalArgumentException when a tag name is not a valid shortcode name
     */
    public ShortcodeRegistry toRegistry() {
        ShortcodeRegistry.Builder builder = ShortcodeRegistry.builder();
        blockTags.forEach(builder::block);
        standaloneTags.forEach(builder::standalone);
        return builder.build();
    }

    public List<String> getBlockTags() {
        return blockTags;
    }

    public void setBlockTags(final List<String> blockTags) {
        this.blockTags = requireNonNullList(BLOCK_TAGS_KEY, blockTags);
    }

    public List<String> getStandaloneTags() {
        return standaloneTags;
    }

    public void setStandaloneTags(final List<String> standaloneTags) {
        this.standaloneTags = requireNonNullList(STANDALONE_TAGS_KEY, standaloneTags);
    }

    private static List<String> requireNonNullList(final String propertyKey, final List<String> values) {
        if (values == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NULL_LIST_FMT, propertyKey));
        }
        return values;
    }
}
