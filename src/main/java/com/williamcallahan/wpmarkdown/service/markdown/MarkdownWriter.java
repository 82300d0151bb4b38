package com.williamcallahan.wpmarkdown.service.markdown;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Output buffer for the renderer with deferred blank lines and line prefixes.
 *
 * <p>Block rules request a minimum run of linefeeds with {@link #ensureLinefeeds(int)} instead of
 * writing them directly; the shortfall is emitted only when real content follows, so adjacent
 * blocks never stack up blank lines. Every linefeed written outside verbatim mode is followed by
 * the innermost indent prefix.</p>
 */
public final class MarkdownWriter {

    private static final char LINEFEED = '\n';

    private final StringBuilder out = new StringBuilder();
    private final Deque<String> indents = new ArrayDeque<>();
    private int linefeedRun;
    private int linefeedTarget;
    private int verbatimDepth;
    private boolean rawMarkup;

    /**
     * Writes text, expanding each linefeed with the current indent prefix.
     *
     * @param text text to append
     * @return this writer
     */
    public MarkdownWriter write(CharSequence text) {
        int segmentStart = 0;
        int length = text.length();
        for (int index = 0; index < length; index++) {
            if (text.charAt(index) == LINEFEED) {
                appendContent(text, segmentStart, index);
                writeLinefeed();
                segmentStart = index + 1;
            }
        }
        appendContent(text, segmentStart, length);
        return this;
    }

    /**
     * Writes a single character.
     *
     * @param ch character to append
     * @return this writer
     */
    public MarkdownWriter write(char ch) {
        if (ch == LINEFEED) {
            writeLinefeed();
        } else {
            flushPendingLinefeeds();
            out.append(ch);
            linefeedRun = 0;
        }
        return this;
    }

    /**
     * Requests at least {@code count} consecutive linefeeds before the next content.
     * Ignored in verbatim mode.
     *
     * @param count minimum linefeed run
     */
    public void ensureLinefeeds(int count) {
        if (verbatimDepth == 0 && count > linefeedTarget) {
            linefeedTarget = count;
        }
    }

    /**
     * Pushes a prefix nested inside the current one. Pending linefeeds are flushed first, since
     * they belong to the outer context.
     *
     * @param prefix prefix added after every following linefeed
     */
    public void pushIndent(String prefix) {
        flushPendingLinefeeds();
        String outer = indents.peek();
        indents.push(outer == null ? prefix : outer + prefix);
    }

    public void popIndent() {
        if (indents.isEmpty()) {
            throw new IllegalStateException("No indent to pop");
        }
        indents.pop();
    }

    /**
     * Enters verbatim mode; nests with {@link #endVerbatim()}.
     */
    public void beginVerbatim() {
        verbatimDepth++;
    }

    public void endVerbatim() {
        if (verbatimDepth == 0) {
            throw new IllegalStateException("Not in verbatim mode");
        }
        verbatimDepth--;
    }

    /**
     * Records that some output was passed through as the source's own markup.
     */
    public void markRawMarkup() {
        rawMarkup = true;
    }

    public boolean containsRawMarkup() {
        return rawMarkup;
    }

    /**
     * Creates an empty writer for rendering a fragment on the side.
     *
     * @return fresh writer without indentation
     */
    public MarkdownWriter scratch() {
        return new MarkdownWriter();
    }

    /**
     * Settles any pending linefeed request as at most one linefeed and returns the output.
     *
     * <p>A request flushed mid-stream by the next write emits its full run of linefeeds; only the
     * request still pending at the end is cut down to one.</p>
     *
     * @return rendered text
     */
    public String finish() {
        if (linefeedTarget > 0 && out.length() > 0 && linefeedRun == 0) {
            writeLinefeed();
        }
        linefeedTarget = 0;
        return out.toString();
    }

    /**
     * Returns the text written so far, without settling pending linefeeds.
     */
    @Override
    public String toString() {
        return out.toString();
    }

    private void appendContent(CharSequence text, int start, int end) {
        if (end > start) {
            flushPendingLinefeeds();
            out.append(text, start, end);
            linefeedRun = 0;
        }
    }

    private void writeLinefeed() {
        out.append(LINEFEED);
        linefeedRun++;
        if (verbatimDepth == 0 && !indents.isEmpty()) {
            out.append(indents.peek());
        }
    }

    private void flushPendingLinefeeds() {
        if (linefeedTarget == 0) {
            return;
        }
        int target = linefeedTarget;
        linefeedTarget = 0;
        if (out.length() == 0) {
            return;
        }
        while (linefeedRun < target) {
            writeLinefeed();
        }
    }
}
