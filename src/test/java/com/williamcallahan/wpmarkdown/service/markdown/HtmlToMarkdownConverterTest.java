package com.williamcallahan.wpmarkdown.service.markdown;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.wpmarkdown.service.shortcode.ShortcodeRegistry;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.DocumentType;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies end-to-end conversion of post HTML with shortcodes and inline math to markdown.
 */
class HtmlToMarkdownConverterTest {

    private HtmlToMarkdownConverter converter;

    @BeforeEach
    void setUp() {
        converter = new HtmlToMarkdownConverter(ShortcodeRegistry.defaults());
    }

    @Test
    void convertsInlineMath() {
        assertEquals("a $$1+2$$ b", convert("a $latex 1+2$ b"));
        assertEquals("$$a_b$$", convert("[latex]a_b[/latex]"));
    }

    @Test
    void mathStartingWithBracketGetsSeparatingSpace() {
        assertEquals("$$ [x]$$", convert("$latex [x]$"));
    }

    @Test
    void unterminatedMathStaysEscapedText() {
        assertEquals("a \\$latex 1\\+2 b", convert("a $latex 1+2 b"));
    }

    @Test
    void captionWithoutImageIsRejected() {
        CaptionShapeException exception =
                assertThrows(CaptionShapeException.class, () -> convert("a[caption]b[/caption]c"));

        assertEquals(
                "The content of the 'caption' shortcode must start with an image, possibly nested inside a link",
                exception.getMessage());
    }

    @Test
    void captionAroundImageBecomesFigure() {
        String markdown = convert("a[caption id=\"x\" width=10]<img src=\"u\"/>[/caption]b");

        assertEquals("a{% figure %}![](u){% figcaption %}{% endfigcaption %}{% endfigure %}b", markdown);
    }

    @Test
    void captionTextFollowsImage() {
        String markdown = convert("[wp_caption width=\"300\"]<img src=\"c.png\" alt=\"cat\"> A <em>small</em> cat [/wp_caption]");

        assertEquals("{% figure %}![cat](c.png){% figcaption %}A *small* cat{% endfigcaption %}{% endfigure %}", markdown);
    }

    @Test
    void legacyCaptionAttributeSuppliesCaptionText() {
        String markdown = convert("[caption caption=\"A cat\"]<img src=\"c.png\">[/caption]");

        assertEquals("{% figure %}![](c.png){% figcaption %}A cat{% endfigcaption %}{% endfigure %}", markdown);
    }

    @Test
    void captionMayWrapImageInLink() {
        String markdown = convert(
                "[caption]<a href=\"big.png\"><img src=\"small.png\" alt=\"x\"></a> A small cat[/caption]");

        assertEquals(
                "{% figure %}<a href=\"big.png\"><img src=\"small.png\" alt=\"x\"></a>"
                        + "{% figcaption %}A small cat{% endfigcaption %}{% endfigure %}",
                markdown);
    }

    @Test
    void unbalancedShortcodesAreRejected() {
        assertThrows(StructuralMarkupException.class, () -> convert("[caption]<img src=\"u\">"));
    }

    @Test
    void registeredShortcodeWithoutRuleIsRejected() {
        HtmlToMarkdownConverter withGallery =
                new HtmlToMarkdownConverter(ShortcodeRegistry.builder().standalone("gallery").build());

        UnsupportedShortcodeException exception = assertThrows(
                UnsupportedShortcodeException.class, () -> withGallery.convert("[gallery]", UrlRewriter.identity()));

        assertEquals("gallery", exception.tagName());
    }

    @Test
    void routesLinkTargetsThroughRewriter() {
        UrlRewriter rewriter = mock(UrlRewriter.class);
        when(rewriter.rewrite("http://old/p")).thenReturn("*p");

        String markdown = converter.convert("see <a href=\"http://old/p\">post</a>", rewriter);

        assertEquals("see [post](*p)", markdown);
        verify(rewriter).rewrite("http://old/p");
    }

    @Test
    void doctypeInTreeIsRejected() {
        Document document = Jsoup.parseBodyFragment("text");
        Element body = document.body();
        body.appendChild(new DocumentType("html", "", ""));

        assertThrows(UnsupportedMarkupException.class, () -> converter.convert(body, UrlRewriter.identity()));
    }

    @Test
    void nullHtmlConvertsToEmptyText() {
        assertEquals("", converter.convert((String) null, UrlRewriter.identity()));
    }

    private String convert(String html) {
        return converter.convert(html, UrlRewriter.identity());
    }
}
