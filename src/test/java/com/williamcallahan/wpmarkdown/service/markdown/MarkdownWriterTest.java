package com.williamcallahan.wpmarkdown.service.markdown;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies deferred linefeeds, indentation and verbatim output of the markdown writer.
 */
class MarkdownWriterTest {

    private MarkdownWriter writer;

    @BeforeEach
    void setUp() {
        writer = new MarkdownWriter();
    }

    @Test
    void linefeedRequestAtStartIsDropped() {
        writer.ensureLinefeeds(2);
        writer.write("a");

        assertEquals("a", writer.finish());
    }

    @Test
    void largestPendingRequestWins() {
        writer.write("a");
        writer.ensureLinefeeds(1);
        writer.ensureLinefeeds(2);
        writer.ensureLinefeeds(1);
        writer.write("b");

        assertEquals("a\n\nb", writer.finish());
    }

    @Test
    void linefeedsAlreadyWrittenCountTowardsRequest() {
        writer.write("a\n");
        writer.ensureLinefeeds(2);
        writer.write("b");

        assertEquals("a\n\nb", writer.finish());
    }

    @Test
    void indentFollowsEveryLinefeed() {
        writer.pushIndent("  ");
        writer.pushIndent("> ");
        writer.write("x\ny");
        writer.popIndent();
        writer.write("\nz");

        assertEquals("x\n  > y\n  z", writer.finish());
    }

    @Test
    void verbatimModeSkipsIndentAndLinefeedRequests() {
        writer.write("a");
        writer.pushIndent("    ");
        writer.beginVerbatim();
        writer.ensureLinefeeds(2);
        writer.write("b\nc");
        writer.endVerbatim();

        assertEquals("ab\nc", writer.finish());
    }

    @Test
    void pendingRequestStillFlushesInsideVerbatim() {
        writer.write("a");
        writer.ensureLinefeeds(2);
        writer.beginVerbatim();
        writer.write("b");
        writer.endVerbatim();

        assertEquals("a\n\nb", writer.finish());
    }

    @Test
    void finishSettlesAtMostOneLinefeed() {
        writer.write("a");
        writer.ensureLinefeeds(2);

        assertEquals("a\n", writer.finish());
    }

    @Test
    void scratchWriterStartsEmptyAndTracksRawMarkup() {
        writer.pushIndent("> ");
        MarkdownWriter scratch = writer.scratch();
        scratch.write("a\nb");
        scratch.markRawMarkup();

        assertEquals("a\nb", scratch.toString());
        assertTrue(scratch.containsRawMarkup());
        assertFalse(writer.containsRawMarkup());
    }

    @Test
    void unbalancedModeChangesAreRejected() {
        assertThrows(IllegalStateException.class, writer::popIndent);
        assertThrows(IllegalStateException.class, writer::endVerbatim);
    }
}
