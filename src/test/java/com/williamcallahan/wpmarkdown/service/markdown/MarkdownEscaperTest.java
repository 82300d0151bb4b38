package com.williamcallahan.wpmarkdown.service.markdown;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.vladsch.flexmark.html.HtmlRenderer;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.data.MutableDataSet;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies markdown escaping, including a check that escaped text renders back to the original
 * through a CommonMark parser.
 */
class MarkdownEscaperTest {

    private Parser parser;
    private HtmlRenderer renderer;

    @BeforeEach
    void setUp() {
        MutableDataSet options = new MutableDataSet();
        parser = Parser.builder(options).build();
        renderer = HtmlRenderer.builder(options).build();
    }

    @Test
    void escapesMetacharactersInRunningText() {
        assertEquals("a\\*b\\_c \\[d\\]", escape("a*b_c [d]", MarkdownEscaper.ALL));
        assertEquals("Price: 5\\.00 \\#1", escape("Price: 5.00 #1", MarkdownEscaper.ALL));
    }

    @Test
    void periodIsEscapedOnlyAfterDigit() {
        assertEquals("1\\. item", escape("1. item", MarkdownEscaper.ALL));
        assertEquals("end. a.b", escape("end. a.b", MarkdownEscaper.ALL));
    }

    @Test
    void colonIsEscapedOnlyBeforeDoubleSlash() {
        assertEquals("http\\://x", escape("http://x", MarkdownEscaper.ALL));
        assertEquals("note: y", escape("note: y", MarkdownEscaper.ALL));
    }

    @Test
    void exclamationIsEscapedOnlyBeforeAnotherExclamation() {
        assertEquals("wow!", escape("wow!", MarkdownEscaper.ALL));
        assertEquals("\\!!", escape("!!", MarkdownEscaper.ALL));
    }

    @Test
    void restrictedSetsOnlyTouchTheirCharacters() {
        assertEquals("a*\\[b\\]", escape("a*[b]", MarkdownEscaper.BRACKETS));
        assertEquals("u\\(1\\)_x", escape("u(1)_x", MarkdownEscaper.PARENTHESES));
        assertEquals("say \\\"hi\\\"", escape("say \"hi\"", MarkdownEscaper.QUOTE));
    }

    @Test
    void surroundWritesPrefixAndSuffixUnescaped() {
        MarkdownWriter out = new MarkdownWriter();

        MarkdownEscaper.surround(out, "[", "a]b", "]", MarkdownEscaper.BRACKETS);

        assertEquals("[a\\]b]", out.finish());
    }

    @Test
    void escapedTextRendersBackToOriginal() {
        String text = "1. a\\b`c*d_e{f}g[h]i(j)k#l+m-n!!o://p|q&r<s>t$u";

        assertEquals(text, renderedText(escape(text, MarkdownEscaper.ALL)));
    }

    @Test
    void everyEscapedCharacterRendersLiterally() {
        for (char ch : MarkdownEscaper.ALL.toCharArray()) {
            String text = "x" + ch + "y";
            assertEquals(text, renderedText(escape(text, MarkdownEscaper.ALL)), "Character " + ch);
        }
    }

    private static String escape(String text, String escapedChars) {
        MarkdownWriter out = new MarkdownWriter();
        MarkdownEscaper.escape(out, text, escapedChars);
        return out.finish();
    }

    private String renderedText(String markdown) {
        String html = renderer.render(parser.parse(markdown));
        return Jsoup.parse(html).text();
    }
}
