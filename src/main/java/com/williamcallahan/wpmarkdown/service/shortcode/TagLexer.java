package com.williamcallahan.wpmarkdown.service.shortcode;

import java.util.Objects;
import java.util.Optional;

/**
 * Recognizes {@code [tag attrs]}, {@code [tag/]}, {@code [/tag]} and the escape form {@code [[tag]]}.
 *
 * <p>Only names present in the {@link ShortcodeRegistry} are recognized. Standalone tags always
 * come back as open+close, and a bare {@code [/tag]} for a standalone tag is not a match.</p>
 */
public final class TagLexer {

    private static final char OPEN_BRACKET = '[';
    private static final char CLOSE_BRACKET = ']';
    private static final char SLASH = '/';

    private final ShortcodeRegistry registry;

    /**
     * Creates a lexer for the given registry.
     *
     * @param registry known tag names
     */
    public TagLexer(ShortcodeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Tries to read a tag starting at {@code start}, the index just past an unconsumed {@code [}.
     *
     * @param text text being scanned
     * @param start index right after the opening bracket
     * @return the match, or empty when the bracket is plain text
     */
    public Optional<TagMatch> lex(String text, int start) {
        int length = text.length();
        int position = start;

        boolean escapeCandidate = false;
        if (position < length && text.charAt(position) == OPEN_BRACKET) {
            escapeCandidate = true;
            position++;
        }

        boolean closing = false;
        if (position < length && text.charAt(position) == SLASH) {
            closing = true;
            position++;
        }
        boolean opening = !closing;

        int nameStart = position;
        int nameEnd = position;
        while (nameEnd < length && isNameCharacter(text.charAt(nameEnd))) {
            nameEnd++;
        }
        if (nameEnd == nameStart) {
            return Optional.empty();
        }

        String name = text.substring(nameStart, nameEnd);
        Optional<Boolean> block = registry.lookup(name);
        if (block.isEmpty()) {
            return Optional.empty();
        }
        if (!block.get()) {
            if (closing) {
                return Optional.empty();
            }
            opening = true;
            closing = true;
        }

        int end = text.indexOf(CLOSE_BRACKET, nameEnd);
        if (end < 0) {
            return Optional.empty();
        }

        if (escapeCandidate && end == nameEnd && end + 1 < length && text.charAt(end + 1) == CLOSE_BRACKET) {
            return Optional.of(TagMatch.escape(end + 2 - start, text.substring(start, end + 1)));
        }
        // any other "[[tag ..." is read as a tag and both brackets are consumed

        int attributesEnd = end;
        if (text.charAt(end - 1) == SLASH) {
            closing = true;
            attributesEnd = end - 1;
        } else if (closing && !opening && attributesEnd != nameEnd) {
            return Optional.empty();
        }

        return Optional.of(TagMatch.tag(end + 1 - start, opening, closing, name, text.substring(nameEnd, attributesEnd)));
    }

    static boolean isNameCharacter(char ch) {
        return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z') || (ch >= '0' && ch <= '9') || ch == '_' || ch == '-';
    }
}
