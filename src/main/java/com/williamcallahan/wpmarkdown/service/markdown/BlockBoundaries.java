package com.williamcallahan.wpmarkdown.service.markdown;

import com.williamcallahan.wpmarkdown.service.shortcode.ShortcodeElement;
import java.util.Set;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

/**
 * Detects whether a node sits directly after or before a block-level element.
 *
 * <p>The walk climbs ancestors until one has a sibling on the requested side, then descends that
 * sibling along its nearest edge. Meeting a block-level element on either leg, or running out of
 * tree at {@code root}, counts as a boundary.</p>
 */
final class BlockBoundaries {

    private static final Set<String> BLOCK_LEVEL_TAGS = Set.of(
            "h1", "h2", "h3", "h4", "h5", "h6",
            "div", "p", "hr", "blockquote", "pre",
            "ol", "ul", "dl", "dd",
            "form");

    private BlockBoundaries() {
    }

    static boolean isBlockLevel(Node node) {
        return node instanceof Element element
                && !(element instanceof ShortcodeElement)
                && BLOCK_LEVEL_TAGS.contains(element.normalName());
    }

    static boolean precededByBlock(Node node, Node root) {
        Node current = node;
        while (true) {
            if (isBlockLevel(current)) {
                return true;
            }
            if (current == root) {
                return true;
            }
            Node previous = current.previousSibling();
            if (previous != null) {
                current = previous;
                break;
            }
            current = current.parent();
            if (current == null) {
                return true;
            }
        }

        while (current != null) {
            if (isBlockLevel(current)) {
                return true;
            }
            int size = current.childNodeSize();
            current = size > 0 ? current.childNode(size - 1) : null;
        }
        return false;
    }

    static boolean followedByBlock(Node node, Node root) {
        Node current = node;
        while (true) {
            if (isBlockLevel(current)) {
                return true;
            }
            if (current == root) {
                return true;
            }
            Node next = current.nextSibling();
            if (next != null) {
                current = next;
                break;
            }
            current = current.parent();
            if (current == null) {
                return true;
            }
        }

        while (current != null) {
            if (isBlockLevel(current)) {
                return true;
            }
            current = current.childNodeSize() > 0 ? current.childNode(0) : null;
        }
        return false;
    }
}
