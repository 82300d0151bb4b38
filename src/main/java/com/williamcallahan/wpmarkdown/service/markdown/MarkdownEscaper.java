package com.williamcallahan.wpmarkdown.service.markdown;

/**
 * Backslash-escapes markdown metacharacters in text content.
 *
 * <p>A few characters are only escaped where they could actually trigger markdown: {@code .}
 * after a digit (ordered list marker), {@code :} before {@code //} (autolink) and {@code !}
 * before another {@code !}.</p>
 */
public final class MarkdownEscaper {

    /** Characters escaped in running text. */
    public static final String ALL = "\\`*_{}[]()#+-.!:|&<>$";

    /** Characters escaped inside link text and image alt text. */
    public static final String BRACKETS = "[]";

    /** Characters escaped inside a link destination. */
    public static final String PARENTHESES = "()";

    /** Characters escaped inside a link destination followed by a title. */
    public static final String PARENTHESES_AND_QUOTE = "\"()";

    /** Characters escaped inside a link title. */
    public static final String QUOTE = "\"";

    private MarkdownEscaper() {
    }

    /**
     * Writes {@code text} to {@code out}, escaping the characters of {@code escapedChars}.
     *
     * @param out destination writer
     * @param text text to write
     * @param escapedChars characters that need a backslash
     */
    public static void escape(MarkdownWriter out, String text, String escapedChars) {
        int segmentStart = 0;
        int length = text.length();
        for (int index = 0; index < length; index++) {
            char ch = text.charAt(index);
            if (escapedChars.indexOf(ch) < 0) {
                continue;
            }
            if (index > segmentStart) {
                out.write(text.subSequence(segmentStart, index));
            }
            if (needsEscape(text, index)) {
                out.write('\\');
            }
            out.write(ch);
            segmentStart = index + 1;
        }
        if (segmentStart < length) {
            out.write(text.subSequence(segmentStart, length));
        }
    }

    /**
     * Writes {@code prefix}, the escaped {@code text} and {@code suffix}.
     */
    static void surround(MarkdownWriter out, String prefix, String text, String suffix, String escapedChars) {
        out.write(prefix);
        escape(out, text, escapedChars);
        out.write(suffix);
    }

    private static boolean needsEscape(String text, int index) {
        char ch = text.charAt(index);
        switch (ch) {
            case '.':
                return index > 0 && isAsciiDigit(text.charAt(index - 1));
            case ':':
                return text.startsWith("//", index + 1);
            case '!':
                return index + 1 < text.length() && text.charAt(index + 1) == '!';
            default:
                return true;
        }
    }

    private static boolean isAsciiDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }
}
