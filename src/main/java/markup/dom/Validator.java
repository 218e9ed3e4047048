// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package markup.dom;

/**
 * The name and raw text validator.
 * <p>
 * The rules for what the HTML standard considers a valid tag or attribute name are complicated, so the rules here are
 * deliberately conservative: anything accepted here parses the same way in every context an element can appear in.
 */
public final class Validator {
    private Validator() {
    }

    /**
     * Returns {@code true} iff the given string is acceptable as a tag name: it must be non-empty, start with an ASCII
     * letter and consist only of ASCII letters and digits.
     *
     * @see <a href="https://html.spec.whatwg.org/multipage/syntax.html#syntax-tag-name">HTML Standard, tag names</a>
     */
    public static boolean isValidTagName(final String name) {
        if (name.isEmpty() || !Ascii.isAlpha(name.charAt(0))) {
            return false;
        }
        final var length = name.length();
        for (int i = 1; i < length; i += 1) {
            if (!Ascii.isAlphanumeric(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns {@code true} iff the given string is acceptable as an attribute name: it must be non-empty, start with
     * an ASCII letter and consist only of ASCII letters, digits, {@code -} and {@code _}.
     *
     * @see <a href="https://html.spec.whatwg.org/multipage/syntax.html#syntax-attribute-name">HTML Standard,
     * attribute names</a>
     */
    public static boolean isValidAttributeName(final String name) {
        if (name.isEmpty() || !Ascii.isAlpha(name.charAt(0))) {
            return false;
        }
        final var length = name.length();
        for (int i = 1; i < length; i += 1) {
            final var character = name.charAt(i);
            if (!Ascii.isAlphanumeric(character) && character != '-' && character != '_') {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns {@code true} iff the given text can appear as the content of a raw text element named {@code tagName}.
     * <p>
     * The text must not contain {@code </} followed by the tag name, compared ignoring ASCII case, followed by one of
     * tab, line feed, form feed, carriage return, space, {@code >} or {@code /}. If the tag name runs up to the very
     * end of the text, so that there is no following character at all, the occurrence is accepted.
     * <p>
     * The tag name must consist of ASCII characters only.
     *
     * @see <a href="https://html.spec.whatwg.org/multipage/syntax.html#cdata-rcdata-restrictions">HTML Standard,
     * restrictions on the contents of raw text elements</a>
     */
    public static boolean isValidRawText(final String tagName, final String text) {
        assert Ascii.isAscii(tagName) : "Raw text validated against a non-ASCII tag name";
        final var textLength = text.length();
        for (int i = text.indexOf("</"); i >= 0; i = text.indexOf("</", i + 1)) {
            final var nameStart = i + 2;
            if (!Ascii.regionMatchesIgnoreCase(text, nameStart, tagName)) {
                continue;
            }
            final var nameEnd = nameStart + tagName.length();
            if (nameEnd < textLength && isTagNameTerminator(text.charAt(nameEnd))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isTagNameTerminator(final char character) {
        return switch (character) {
            case '\t', '\n', '\f', '\r', ' ', '>', '/' -> true;
            default -> false;
        };
    }
}
