// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package markup.dom;

import java.io.IOException;
import java.io.Serializable;
import org.jetbrains.annotations.NotNull;

/**
 * The reason serialization failed.
 */
public sealed interface RenderError extends Serializable {
    /**
     * Returns a user-readable description of this error.
     */
    @NotNull String describe();

    /**
     * The sink refused to accept output.
     */
    record Format(@NotNull IOException exception) implements RenderError {
        @Override
        public @NotNull String describe() {
            return String.valueOf(exception.getMessage());
        }
    }

    /**
     * An element's name is not a valid tag name.
     *
     * @see Validator#isValidTagName(String)
     */
    record InvalidTagName(@NotNull String name) implements RenderError {
        @Override
        public @NotNull String describe() {
            return "Invalid tag name " + quote(name);
        }
    }

    /**
     * An attribute's name is not a valid attribute name.
     *
     * @see Validator#isValidAttributeName(String)
     */
    record InvalidAttrName(@NotNull String name) implements RenderError {
        @Override
        public @NotNull String describe() {
            return "Invalid attribute name " + quote(name);
        }
    }

    /**
     * A child is not allowed by the kind of its parent element, such as any child of a void element, or an element
     * inside a raw text element.
     */
    final class InvalidChild implements RenderError {
        private InvalidChild() {
        }

        /**
         * Retrieves the only instance of this error.
         */
        public static @NotNull InvalidChild instance() {
            return instance;
        }

        @Override
        public @NotNull String describe() {
            return "Invalid child";
        }

        @Override
        public @NotNull String toString() {
            return "InvalidChild";
        }

        private Object readResolve() {
            return instance;
        }

        private static final long serialVersionUID = 1L;
        private static final InvalidChild instance = new InvalidChild();
    }

    /**
     * A text child of a raw text element contains something that would be parsed as the element's closing tag.
     *
     * @see Validator#isValidRawText(String, String)
     */
    record InvalidRawText(@NotNull String text) implements RenderError {
        @Override
        public @NotNull String describe() {
            return "Invalid raw text " + quote(text);
        }
    }

    private static @NotNull String quote(final @NotNull String string) {
        return '"' + string.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
