package com.williamcallahan.wpmarkdown.service.shortcode;

import com.williamcallahan.wpmarkdown.service.markdown.StructuralMarkupException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns bracketed shortcodes found in text nodes into {@link ShortcodeElement} nodes.
 *
 * <p>Content between {@code [tag]} and {@code [/tag]} is moved under the new element, so a flat
 * run of siblings becomes a nested subtree. Open and close tags must balance within one parent
 * element; anything else aborts with {@link StructuralMarkupException} and leaves the tree
 * partially rewritten.</p>
 */
public final class ShortcodeProcessor {

    private static final Logger log = LoggerFactory.getLogger(ShortcodeProcessor.class);

    private final TagLexer tagLexer;
    private final AttributeLexer attributeLexer = new AttributeLexer();

    /**
     * Creates a processor recognizing the tags of the given registry.
     *
     * @param registry known shortcodes
     */
    public ShortcodeProcessor(ShortcodeRegistry registry) {
        this.tagLexer = new TagLexer(Objects.requireNonNull(registry, "registry"));
    }

    /**
     * Rewrites shortcodes below {@code root} in place.
     *
     * @param root subtree to rewrite
     * @throws StructuralMarkupException when tags do not nest
     */
    public void process(Element root) {
        Objects.requireNonNull(root, "root");
        processChildren(root);
        removeEmptyTextNodes(root);
    }

    private void processChildren(Node parent) {
        Deque<OpenShortcode> openTags = new ArrayDeque<>();

        Node child = parent.childNodeSize() > 0 ? parent.childNode(0) : null;
        while (child != null) {
            Node next = child.nextSibling();
            Element newParent = openTags.isEmpty() ? null : openTags.peek().element();

            if (child instanceof TextNode textNode) {
                next = processText(textNode, openTags);
            } else if (child instanceof Element) {
                processChildren(child);
            }

            if (newParent != null) {
                // also carries an element created while splitting the text node
                Node moving = child;
                while (moving != null && moving != next) {
                    Node following = moving.nextSibling();
                    newParent.appendChild(moving);
                    moving = following;
                }
            }
            child = next;
        }

        if (!openTags.isEmpty()) {
            throw StructuralMarkupException.stillOpen(namesOf(openTags));
        }
    }

    /**
     * Scans one text node and handles at most one real tag; text after the tag moves to a new
     * sibling that the caller visits next.
     */
    private Node processText(TextNode node, Deque<OpenShortcode> openTags) {
        String data = node.getWholeText();
        boolean modified = false;
        int index = 0;
        while (index < data.length()) {
            int codePoint = data.codePointAt(index);
            if (codePoint == '[') {
                Optional<TagMatch> lexed = tagLexer.lex(data, index + 1);
                if (lexed.isPresent()) {
                    TagMatch match = lexed.get();
                    if (match.isEscape()) {
                        data = data.substring(0, index) + match.literal() + data.substring(index + 1 + match.length());
                        index += match.literal().length();
                        modified = true;
                        continue;
                    }
                    return handleTag(node, data, index, index + 1 + match.length(), match, openTags);
                }
            }
            index += Character.charCount(codePoint);
        }

        if (modified) {
            node.text(data);
        }
        return node.nextSibling();
    }

    private TextNode handleTag(
            TextNode node, String data, int tagStart, int tagEnd, TagMatch match, Deque<OpenShortcode> openTags) {
        TextNode tail = new TextNode(data.substring(tagEnd));
        node.text(data.substring(0, tagStart));
        node.after(tail);

        if (match.opening()) {
            ShortcodeElement element = new ShortcodeElement(match.name(), attributeLexer.lex(match.rawAttributes()));
            node.after(element);
            openTags.push(new OpenShortcode(match.name(), element));
            log.debug("Opened shortcode '{}' with {} attribute(s)", match.name(), element.attributesSize());
        }

        if (match.closing()) {
            OpenShortcode innermost = openTags.peek();
            if (innermost == null || !innermost.name().equals(match.name())) {
                throw StructuralMarkupException.unexpectedClose(match.name(), namesOf(openTags));
            }
            openTags.pop();
        }
        return tail;
    }

    private static void removeEmptyTextNodes(Node parent) {
        Node child = parent.childNodeSize() > 0 ? parent.childNode(0) : null;
        while (child != null) {
            Node next = child.nextSibling();
            if (child instanceof TextNode textNode) {
                if (textNode.getWholeText().isEmpty()) {
                    textNode.remove();
                }
            } else if (child instanceof Element) {
                removeEmptyTextNodes(child);
            }
            child = next;
        }
    }

    private static List<String> namesOf(Deque<OpenShortcode> openTags) {
        List<String> names = new ArrayList<>(openTags.size());
        for (OpenShortcode openTag : openTags) {
            names.add(openTag.name());
        }
        return names;
    }

    private record OpenShortcode(String name, Element element) {}
}
