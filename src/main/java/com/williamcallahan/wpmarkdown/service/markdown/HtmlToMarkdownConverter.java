package com.williamcallahan.wpmarkdown.service.markdown;

import com.williamcallahan.wpmarkdown.service.shortcode.LatexSpanProcessor;
import com.williamcallahan.wpmarkdown.service.shortcode.ShortcodeProcessor;
import com.williamcallahan.wpmarkdown.service.shortcode.ShortcodeRegistry;
import java.util.Objects;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

/**
 * Converts WordPress post HTML to markdown: shortcodes first, then inline LaTeX spans, then rendering.
 *
 * <p>The tree is rewritten in place. On failure the partially rewritten tree and any output are
 * unusable.</p>
 */
@Service
public class HtmlToMarkdownConverter {

    private final ShortcodeProcessor shortcodeProcessor;
    private final LatexSpanProcessor latexSpanProcessor = new LatexSpanProcessor();

    /**
     * Creates a converter recognizing the shortcodes of {@code shortcodeRegistry}.
     *
     * @param shortcodeRegistry known shortcodes
     */
    public HtmlToMarkdownConverter(ShortcodeRegistry shortcodeRegistry) {
        this.shortcodeProcessor = new ShortcodeProcessor(Objects.requireNonNull(shortcodeRegistry, "shortcodeRegistry"));
    }

    /**
     * Parses {@code html} as a body fragment and converts it.
     *
     * @param html post content
     * @param urlRewriter mapping applied to every emitted link and image URL
     * @return markdown text
     * @throws MarkupConversionException when the content cannot be expressed as markdown
     */
    public String convert(String html, UrlRewriter urlRewriter) {
        Document document = Jsoup.parseBodyFragment(html == null ? "" : html);
        document.outputSettings().prettyPrint(false);
        return convert(document.body(), urlRewriter);
    }

    /**
     * Converts an already parsed tree; {@code root} must belong to a jsoup document.
     *
     * @param root container whose children are converted
     * @param urlRewriter mapping applied to every emitted link and image URL
     * @return markdown text
     */
    public String convert(Element root, UrlRewriter urlRewriter) {
        Objects.requireNonNull(root, "root");
        shortcodeProcessor.process(root);
        latexSpanProcessor.process(root);
        return new MarkdownRenderer(urlRewriter).render(root);
    }
}
