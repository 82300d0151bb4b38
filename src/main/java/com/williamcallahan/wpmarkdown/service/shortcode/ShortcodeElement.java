package com.williamcallahan.wpmarkdown.service.shortcode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Attributes;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.ParseSettings;
import org.jsoup.parser.Tag;

/**
 * Element created from shortcode markup rather than parsed from the post's HTML.
 *
 * <p>The renderer tells these apart from native elements by type, so a {@code [caption]} never
 * collides with an HTML {@code <caption>}.</p>
 */
public final class ShortcodeElement extends Element {

    private final String shortcodeName;

    /**
     * Creates a shortcode element carrying the given attributes in encounter order.
     *
     * @param shortcodeName tag name as registered
     * @param attributes parsed attributes, duplicate keys kept
     */
    public ShortcodeElement(String shortcodeName, List<ShortcodeAttribute> attributes) {
        super(Tag.valueOf(Objects.requireNonNull(shortcodeName, "shortcodeName"), ParseSettings.preserveCase), "", toAttributes(attributes));
        this.shortcodeName = shortcodeName;
    }

    /**
     * Creates a math element holding the formula as its only text child.
     *
     * @param formula LaTeX source between the delimiters
     * @return math shortcode element
     */
    public static ShortcodeElement latex(String formula) {
        ShortcodeElement element = new ShortcodeElement(ShortcodeRegistry.LATEX, List.of());
        element.appendChild(new TextNode(formula));
        return element;
    }

    public String shortcodeName() {
        return shortcodeName;
    }

    /**
     * Returns the attributes as parsed, positional ones keyed {@code @n}.
     *
     * @return attributes in encounter order
     */
    public List<ShortcodeAttribute> shortcodeAttributes() {
        List<ShortcodeAttribute> result = new ArrayList<>();
        for (Attribute attribute : attributes()) {
            result.add(new ShortcodeAttribute(attribute.getKey(), attribute.getValue()));
        }
        return result;
    }

    private static Attributes toAttributes(List<ShortcodeAttribute> attributes) {
        Attributes result = new Attributes();
        for (ShortcodeAttribute attribute : attributes) {
            result.add(attribute.key(), attribute.value());
        }
        return result;
    }
}
