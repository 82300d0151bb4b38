package com.williamcallahan.wpmarkdown.service.shortcode;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the text between a shortcode's name and its closing bracket into attributes.
 *
 * <p>Accepted forms, separated by whitespace:
 * <ul>
 *   <li>{@code key="value"} or {@code key='value'}</li>
 *   <li>{@code key=value} where the value runs to the next whitespace or quote</li>
 *   <li>{@code "value"} or a bare run of non-whitespace, recorded as a positional value</li>
 * </ul>
 * Nothing here ever fails: malformed input degrades to positional values.</p>
 */
public final class AttributeLexer {

    /**
     * Parses attribute text.
     *
     * @param raw attribute text, may be empty
     * @return attributes in encounter order; keys may repeat
     */
    public List<ShortcodeAttribute> lex(String raw) {
        List<ShortcodeAttribute> attributes = new ArrayList<>();
        if (raw == null) {
            return attributes;
        }

        int length = raw.length();
        int position = 0;
        int positionalCount = 0;
        while (true) {
            position = skipSpace(raw, position);
            if (position >= length) {
                break;
            }

            int keyEnd = position;
            while (keyEnd < length && isWordCharacter(raw.charAt(keyEnd))) {
                keyEnd++;
            }

            if (keyEnd > position && keyEnd < length && raw.charAt(keyEnd) == '=') {
                String key = raw.substring(position, keyEnd);
                int valueStart = keyEnd + 1;
                int closingQuote = findClosingQuote(raw, valueStart);
                if (closingQuote >= 0) {
                    attributes.add(new ShortcodeAttribute(key, raw.substring(valueStart + 1, closingQuote)));
                    position = closingQuote + 1;
                } else {
                    // unquoted, or a quote that is never closed: read up to the next space or quote
                    int valueEnd = valueStart;
                    while (valueEnd < length && !isSpace(raw.charAt(valueEnd)) && !isQuote(raw.charAt(valueEnd))) {
                        valueEnd++;
                    }
                    attributes.add(new ShortcodeAttribute(key, raw.substring(valueStart, valueEnd)));
                    position = valueEnd;
                }
                continue;
            }

            if (raw.charAt(position) == '"') {
                int closingQuote = raw.indexOf('"', position + 1);
                if (closingQuote >= 0) {
                    attributes.add(ShortcodeAttribute.positional(
                            positionalCount++, raw.substring(position + 1, closingQuote)));
                    position = closingQuote + 1;
                    continue;
                }
            }

            int tokenEnd = position;
            while (tokenEnd < length && !isSpace(raw.charAt(tokenEnd))) {
                tokenEnd++;
            }
            attributes.add(ShortcodeAttribute.positional(positionalCount++, raw.substring(position, tokenEnd)));
            position = tokenEnd;
        }
        return attributes;
    }

    private static int findClosingQuote(String raw, int quoteIndex) {
        if (quoteIndex >= raw.length() || !isQuote(raw.charAt(quoteIndex))) {
            return -1;
        }
        return raw.indexOf(raw.charAt(quoteIndex), quoteIndex + 1);
    }

    private static int skipSpace(String raw, int position) {
        while (position < raw.length() && isSpace(raw.charAt(position))) {
            position++;
        }
        return position;
    }

    static boolean isSpace(char ch) {
        return ch == ' ' || ch == '\t' || ch == '\n' || ch == '\r' || ch == '\f';
    }

    static boolean isWordCharacter(char ch) {
        return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z') || (ch >= '0' && ch <= '9') || ch == '_';
    }

    private static boolean isQuote(char ch) {
        return ch == '"' || ch == '\'';
    }
}
