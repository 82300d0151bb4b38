package com.williamcallahan.wpmarkdown.service.shortcode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts WP-LaTeX inline spans ({@code $latex x^2$}) into math {@link ShortcodeElement} nodes.
 *
 * <p>Unterminated spans stay literal text. A {@code \$} pair inside a span does not end it.</p>
 */
public final class LatexSpanProcessor {

    private static final Logger log = LoggerFactory.getLogger(LatexSpanProcessor.class);

    static final String MARKER = "$latex ";

    /**
     * Rewrites every text node below {@code root}.
     *
     * @param root subtree to rewrite
     */
    public void process(Node root) {
        Objects.requireNonNull(root, "root");
        List<TextNode> textNodes = new ArrayList<>();
        collectTextNodes(root, textNodes);
        for (TextNode textNode : textNodes) {
            splitSpans(textNode);
        }
    }

    private static void collectTextNodes(Node node, List<TextNode> sink) {
        if (node instanceof TextNode textNode) {
            sink.add(textNode);
            return;
        }
        for (int childIndex = 0; childIndex < node.childNodeSize(); childIndex++) {
            collectTextNodes(node.childNode(childIndex), sink);
        }
    }

    private static void splitSpans(TextNode node) {
        TextNode current = node;
        boolean split = false;
        while (true) {
            String data = current.getWholeText();
            int markerStart = data.indexOf(MARKER);
            if (markerStart < 0) {
                break;
            }
            int formulaStart = markerStart + MARKER.length();
            int terminator = findTerminator(data, formulaStart);
            if (terminator < 0) {
                break;
            }

            String formula = data.substring(formulaStart, terminator);
            TextNode tail = new TextNode(data.substring(terminator + 1));
            current.text(data.substring(0, markerStart));
            current.after(tail);
            current.after(ShortcodeElement.latex(formula));
            log.debug("Converted inline LaTeX span of {} character(s)", formula.length());

            if (current.getWholeText().isEmpty()) {
                current.remove();
            }
            current = tail;
            split = true;
        }

        if (split && current.getWholeText().isEmpty()) {
            current.remove();
        }
    }

    private static int findTerminator(String data, int start) {
        int index = start;
        while (index < data.length()) {
            char ch = data.charAt(index);
            if (ch == '\\' && index + 1 < data.length() && data.charAt(index + 1) == '$') {
                index += 2;
            } else if (ch == '$') {
                return index;
            } else {
                index++;
            }
        }
        return -1;
    }
}
