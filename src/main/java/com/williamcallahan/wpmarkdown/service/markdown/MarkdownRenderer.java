package com.williamcallahan.wpmarkdown.service.markdown;

import static com.williamcallahan.wpmarkdown.service.markdown.MarkdownEscaper.surround;

import com.williamcallahan.wpmarkdown.service.shortcode.ShortcodeElement;
import com.williamcallahan.wpmarkdown.service.shortcode.ShortcodeRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.DocumentType;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Renders a rewritten jsoup tree as markdown.
 *
 * <p>Each HTML rule applies only when the element has the shape markdown can express; everything
 * else is passed through as the element's own HTML. Shortcode elements have no passthrough and must
 * match a rule.</p>
 */
public final class MarkdownRenderer {

    private static final int TAB_STOP = 8;
    private static final String LIST_INDENT = "    ";
    private static final String QUOTE_PREFIX = "> ";
    private static final String CODE_FENCE = "```";
    private static final String SINGLE_LINE_BREAK = "\n<br>";
    private static final String PARAGRAPH_BREAK = "\n\n";
    private static final String CAPTION_ATTRIBUTE = "caption";

    private static final Set<String> IMAGE_ATTRIBUTES =
            Set.of("src", "alt", "title", "width", "height", "class", "style");
    private static final Pattern FLOAT_LEFT = Pattern.compile("(\\W|^)float:\\s*left\\s*(;|$)");
    private static final Pattern FLOAT_RIGHT = Pattern.compile("(\\W|^)float:\\s*right\\s*(;|$)");

    private final UrlRewriter urlRewriter;

    /**
     * Creates a renderer that routes every emitted URL through {@code urlRewriter}.
     *
     * @param urlRewriter link and image URL mapping
     */
    public MarkdownRenderer(UrlRewriter urlRewriter) {
        this.urlRewriter = Objects.requireNonNull(urlRewriter, "urlRewriter");
    }

    /**
     * Renders the children of {@code root}.
     *
     * @param root container element, normally the fragment's body
     * @return markdown text
     * @throws MarkupConversionException when the tree contains markup that has no markdown form
     */
    public String render(Element root) {
        Objects.requireNonNull(root, "root");
        Document owner = root.ownerDocument();
        if (owner == null) {
            throw new IllegalArgumentException("Render root must belong to a document");
        }
        owner.outputSettings().prettyPrint(false).outline(false);

        MarkdownWriter writer = new MarkdownWriter();
        new Pass(root).renderChildren(writer, root);
        return writer.finish();
    }

    /**
     * One rendering run; holds the root that bounds block-boundary walks.
     */
    private final class Pass {
        private final Element root;

        Pass(Element root) {
            this.root = root;
        }

        void renderChildren(MarkdownWriter out, Element parent) {
            for (Node child = firstChild(parent); child != null; child = child.nextSibling()) {
                renderNode(out, child, -1);
            }
        }

        void renderNode(MarkdownWriter out, Node node, int listIndex) {
            if (node instanceof TextNode textNode) {
                renderText(out, textNode);
                return;
            }
            if (node instanceof DocumentType) {
                throw new UnsupportedMarkupException("Post content must not contain a DOCTYPE declaration");
            }
            if (!(node instanceof Element element)) {
                return;
            }
            if (element instanceof ShortcodeElement shortcode) {
                renderShortcode(out, shortcode);
                return;
            }
            if (!renderElement(out, element, listIndex)) {
                renderPassthrough(out, element);
            }
        }

        private boolean renderElement(MarkdownWriter out, Element element, int listIndex) {
            switch (element.normalName()) {
                case "h1", "h2", "h3", "h4", "h5", "h6":
                    return renderHeading(out, element);
                case "em", "i":
                    renderContents(out, "*", element, "*");
                    return true;
                case "strong", "b":
                    renderContents(out, "**", element, "**");
                    return true;
                case "code":
                    return renderInlineCode(out, element);
                case "pre":
                    return renderPreformatted(out, element);
                case "a":
                    return renderLink(out, element);
                case "img":
                    return renderImage(out, element);
                case "ol", "ul":
                    return renderList(out, element);
                case "li":
                    return renderListItem(out, element, listIndex);
                case "blockquote":
                    renderBlockquote(out, element);
                    return true;
                default:
                    return false;
            }
        }

        private void renderContents(MarkdownWriter out, String prefix, Element element, String suffix) {
            out.write(prefix);
            renderChildren(out, element);
            out.write(suffix);
        }

        private void renderText(MarkdownWriter out, TextNode textNode) {
            String text = textNode.getWholeText();
            if (BlockBoundaries.precededByBlock(textNode, root)) {
                text = trimLeadingLinefeed(text);
            }
            if (BlockBoundaries.followedByBlock(textNode, root)) {
                text = trimTrailingLinefeed(text);
            }

            int linefeed = text.indexOf('\n');
            while (linefeed >= 0) {
                MarkdownEscaper.escape(out, text.substring(0, linefeed), MarkdownEscaper.ALL);
                int runEnd = linefeed + 1;
                while (runEnd < text.length() && text.charAt(runEnd) == '\n') {
                    runEnd++;
                }
                out.write(runEnd == linefeed + 1 ? SINGLE_LINE_BREAK : PARAGRAPH_BREAK);
                text = text.substring(runEnd);
                linefeed = text.indexOf('\n');
            }
            MarkdownEscaper.escape(out, text, MarkdownEscaper.ALL);
        }

        private boolean renderHeading(MarkdownWriter out, Element heading) {
            MarkdownWriter scratch = out.scratch();
            renderChildren(scratch, heading);
            if (scratch.containsRawMarkup()) {
                return false;
            }
            int level = heading.normalName().charAt(1) - '0';
            out.ensureLinefeeds(2);
            out.write("#".repeat(level)).write(' ');
            out.write(scratch.toString().replace('\r', ' ').replace('\n', ' '));
            out.ensureLinefeeds(2);
            return true;
        }

        private boolean renderInlineCode(MarkdownWriter out, Element code) {
            Optional<String> contents = leafText(code);
            if (contents.isEmpty() || contents.get().indexOf('`') >= 0) {
                return false;
            }
            out.beginVerbatim();
            out.write('`').write(contents.get()).write('`');
            out.endVerbatim();
            return true;
        }

        private boolean renderPreformatted(MarkdownWriter out, Element pre) {
            Optional<String> contents = leafText(pre);
            if (contents.isEmpty() || contents.get().contains(CODE_FENCE)) {
                return false;
            }
            out.ensureLinefeeds(2);
            out.write(CODE_FENCE).write('\n');
            out.beginVerbatim();
            out.write(expandTabs(contents.get(), TAB_STOP));
            out.endVerbatim();
            out.ensureLinefeeds(1);
            out.write(CODE_FENCE);
            out.ensureLinefeeds(2);
            return true;
        }

        private boolean renderLink(MarkdownWriter out, Element link) {
            if (isSimpleLink(link)) {
                String href = urlRewriter.rewrite(link.attr("href"));
                surround(out, "[", childText(link), "]", MarkdownEscaper.BRACKETS);
                surround(out, "(", href, ")", MarkdownEscaper.PARENTHESES);
                return true;
            }
            return isImageLink(link) && renderImage(out, (Element) link.childNode(0));
        }

        private boolean renderImage(MarkdownWriter out, Element image) {
            for (Attribute attribute : image.attributes()) {
                if (!IMAGE_ATTRIBUTES.contains(attribute.getKey())) {
                    return false;
                }
            }

            String url = urlRewriter.rewrite(image.attr("src"));
            String alt = image.attr("alt");
            String title = image.attr("title");

            List<String> annotations = new ArrayList<>();
            String style = image.attr("style");
            if (FLOAT_LEFT.matcher(style).find()) {
                annotations.add("floatleft");
            }
            if (FLOAT_RIGHT.matcher(style).find()) {
                annotations.add("floatright");
            }
            if (!annotations.isEmpty()) {
                alt = "{" + String.join(" ", annotations) + "}" + alt;
            }

            surround(out, "![", alt, "]", MarkdownEscaper.BRACKETS);
            if (title.isEmpty()) {
                surround(out, "(", url, ")", MarkdownEscaper.PARENTHESES);
            } else {
                surround(out, "(", url, " ", MarkdownEscaper.PARENTHESES_AND_QUOTE);
                surround(out, "\"", title, "\")", MarkdownEscaper.QUOTE);
            }
            return true;
        }

        private boolean renderList(MarkdownWriter out, Element list) {
            if (!containsOnlyListItems(list)) {
                return false;
            }
            out.ensureLinefeeds(2);
            int index = 0;
            for (Node child = firstChild(list); child != null; child = child.nextSibling()) {
                if (child instanceof Element) {
                    renderNode(out, child, index);
                    index++;
                }
            }
            out.ensureLinefeeds(2);
            return true;
        }

        private boolean renderListItem(MarkdownWriter out, Element item, int listIndex) {
            Element parent = item.parent();
            if (listIndex < 0 || parent == null || parent instanceof ShortcodeElement) {
                return false;
            }
            String marker;
            if ("ol".equals(parent.normalName())) {
                marker = (listIndex + 1) + ". ";
            } else if ("ul".equals(parent.normalName())) {
                marker = "* ";
            } else {
                return false;
            }
            out.pushIndent(LIST_INDENT);
            renderContents(out, marker, item, "");
            out.popIndent();
            out.ensureLinefeeds(1);
            return true;
        }

        private void renderBlockquote(MarkdownWriter out, Element quote) {
            out.ensureLinefeeds(2);
            out.pushIndent(QUOTE_PREFIX);
            renderContents(out, QUOTE_PREFIX, quote, "");
            out.popIndent();
            out.ensureLinefeeds(1);
        }

        private void renderShortcode(MarkdownWriter out, ShortcodeElement shortcode) {
            switch (shortcode.shortcodeName()) {
                case ShortcodeRegistry.LATEX:
                    renderMath(out, shortcode);
                    break;
                case ShortcodeRegistry.CAPTION, ShortcodeRegistry.WP_CAPTION:
                    renderCaption(out, shortcode);
                    break;
                default:
                    throw new UnsupportedShortcodeException(shortcode.shortcodeName());
            }
        }

        private void renderMath(MarkdownWriter out, ShortcodeElement math) {
            String formula = math.wholeText();
            // "$$[" would open a display block with a caption
            out.write(formula.startsWith("[") ? "$$ " : "$$");
            out.write(formula);
            out.write("$$");
        }

        private void renderCaption(MarkdownWriter out, ShortcodeElement caption) {
            Node lead = firstMeaningfulChild(caption);
            requireCaptionShape(caption, lead);

            if (caption.hasAttr(CAPTION_ATTRIBUTE)) {
                out.write("{% figure %}");
                renderChildren(out, caption);
                writeFigureCaption(out, caption.attr(CAPTION_ATTRIBUTE));
                return;
            }

            MarkdownWriter scratch = out.scratch();
            for (Node node = lead.nextSibling(); node != null; node = node.nextSibling()) {
                renderNode(scratch, node, -1);
            }
            if (scratch.containsRawMarkup()) {
                out.markRawMarkup();
            }

            out.write("{% figure %}");
            renderNode(out, lead, -1);
            writeFigureCaption(out, scratch.toString().strip());
        }

        private void writeFigureCaption(MarkdownWriter out, String captionText) {
            out.write("{% figcaption %}");
            out.write(captionText);
            out.write("{% endfigcaption %}{% endfigure %}");
        }

        private void renderPassthrough(MarkdownWriter out, Element element) {
            out.beginVerbatim();
            out.write(element.outerHtml());
            out.endVerbatim();
            out.markRawMarkup();
        }
    }

    private static void requireCaptionShape(ShortcodeElement caption, Node lead) {
        Node candidate = lead;
        if (isHtmlElement(candidate, "a")) {
            candidate = firstMeaningfulChild((Element) candidate);
        }
        if (!isHtmlElement(candidate, "img")) {
            throw new CaptionShapeException(caption.shortcodeName());
        }
    }

    private static boolean isHtmlElement(Node node, String tagName) {
        return node instanceof Element element
                && !(element instanceof ShortcodeElement)
                && tagName.equals(element.normalName());
    }

    private static Node firstChild(Node parent) {
        return parent.childNodeSize() > 0 ? parent.childNode(0) : null;
    }

    private static Node firstMeaningfulChild(Element parent) {
        for (Node child = firstChild(parent); child != null; child = child.nextSibling()) {
            if (child instanceof TextNode textNode && textNode.getWholeText().isBlank()) {
                continue;
            }
            if (child instanceof Comment) {
                continue;
            }
            return child;
        }
        return null;
    }

    private static boolean containsMarkup(Element element) {
        int size = element.childNodeSize();
        return size > 1 || (size == 1 && !(element.childNode(0) instanceof TextNode));
    }

    /**
     * Returns the text of an element that has no attributes and at most one text child.
     */
    private static Optional<String> leafText(Element element) {
        if (element.attributesSize() != 0 || containsMarkup(element)) {
            return Optional.empty();
        }
        return Optional.of(childText(element));
    }

    private static String childText(Element element) {
        if (element.childNodeSize() > 0 && element.childNode(0) instanceof TextNode textNode) {
            return textNode.getWholeText();
        }
        return "";
    }

    private static boolean hasOnlyHref(Element link) {
        return link.attributesSize() == 1 && link.hasAttr("href");
    }

    private static boolean isSimpleLink(Element link) {
        return !containsMarkup(link) && hasOnlyHref(link);
    }

    private static boolean isImageLink(Element link) {
        if (!hasOnlyHref(link) || link.childNodeSize() != 1) {
            return false;
        }
        Node child = link.childNode(0);
        return isHtmlElement(child, "img") && link.attr("href").equals(((Element) child).attr("src"));
    }

    private static boolean containsOnlyListItems(Element list) {
        for (Node child = firstChild(list); child != null; child = child.nextSibling()) {
            if (child instanceof TextNode textNode) {
                if (!textNode.getWholeText().isBlank()) {
                    return false;
                }
            } else if (!isHtmlElement(child, "li")) {
                return false;
            }
        }
        return true;
    }

    static String trimLeadingLinefeed(String text) {
        if (!text.isEmpty() && text.charAt(0) == '\n' && (text.length() < 2 || text.charAt(1) != '\n')) {
            return text.substring(1);
        }
        return text;
    }

    static String trimTrailingLinefeed(String text) {
        int length = text.length();
        if (length >= 1 && text.charAt(length - 1) == '\n' && (length < 2 || text.charAt(length - 2) != '\n')) {
            return text.substring(0, length - 1);
        }
        return text;
    }

    /**
     * Replaces tabs with spaces up to the next multiple of {@code tabSize}, counting columns in
     * code points from the last line terminator.
     */
    static String expandTabs(String text, int tabSize) {
        if (text.indexOf('\t') < 0) {
            return text;
        }
        StringBuilder expanded = new StringBuilder(text.length() + tabSize);
        int column = 0;
        int index = 0;
        while (index < text.length()) {
            int codePoint = text.codePointAt(index);
            index += Character.charCount(codePoint);
            if (codePoint == '\t') {
                int spaces = tabSize - (column % tabSize);
                expanded.append(" ".repeat(spaces));
                column += spaces;
            } else if (codePoint == '\n' || codePoint == '\r' || codePoint == '\f') {
                expanded.append((char) codePoint);
                column = 0;
            } else {
                expanded.appendCodePoint(codePoint);
                column++;
            }
        }
        return expanded.toString();
    }
}
