// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package markup.dom;

/**
 * ASCII-only character classification and case folding.
 * <p>
 * {@link Character} and {@link String} methods apply Unicode rules, which e.g. fold U+212A KELVIN SIGN into
 * {@code k}. Names in HTML are compared using ASCII rules only.
 */
final class Ascii {
    private Ascii() {
    }

    static boolean isAlpha(final char character) {
        return (character >= 'a' && character <= 'z') || (character >= 'A' && character <= 'Z');
    }

    static boolean isAlphanumeric(final char character) {
        return isAlpha(character) || (character >= '0' && character <= '9');
    }

    static boolean isAscii(final String string) {
        final var length = string.length();
        for (int i = 0; i < length; i += 1) {
            if (string.charAt(i) > lastAsciiCharacter) {
                return false;
            }
        }
        return true;
    }

    static char toLowerCase(final char character) {
        return (character >= 'A' && character <= 'Z') ? (char) (character + caseDifference) : character;
    }

    static String toLowerCase(final String string) {
        final var length = string.length();
        for (int i = 0; i < length; i += 1) {
            final var character = string.charAt(i);
            if (character >= 'A' && character <= 'Z') {
                return toLowerCaseFrom(string, i);
            }
        }
        return string;
    }

    /**
     * Returns {@code true} iff the characters of {@code string} starting at {@code offset} match all of
     * {@code expected}, ignoring ASCII case.
     */
    static boolean regionMatchesIgnoreCase(final String string, final int offset, final String expected) {
        final var length = expected.length();
        if (offset + length > string.length()) {
            return false;
        }
        for (int i = 0; i < length; i += 1) {
            if (toLowerCase(string.charAt(offset + i)) != toLowerCase(expected.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static String toLowerCaseFrom(final String string, final int firstUpperCase) {
        final var builder = new StringBuilder(string.length());
        builder.append(string, 0, firstUpperCase);
        final var length = string.length();
        for (int i = firstUpperCase; i < length; i += 1) {
            builder.append(toLowerCase(string.charAt(i)));
        }
        return builder.toString();
    }

    private static final char lastAsciiCharacter = 0x7F;
    private static final int caseDifference = 'a' - 'A';
}
