// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package markup.dom;

import org.jetbrains.annotations.NotNull;

/**
 * A single node of serializable material: raw passthrough text, escaped text, a comment, or a nested element.
 * <p>
 * Content nodes are guaranteed to be immutable. Every content node is also an {@link ElementComponent} that adds
 * itself as the last child of the element being built.
 */
public sealed interface Content extends Renderable, ElementComponent
    permits Content.Raw, Content.Text, Content.Comment, Element {
    /**
     * Returns a new raw content node, inserted into the output verbatim.
     */
    static @NotNull Raw raw(final @NotNull String text) {
        return new Raw(text);
    }

    /**
     * Returns a new text content node, escaped as appropriate for the containing element.
     */
    static @NotNull Text text(final @NotNull String text) {
        return new Text(text);
    }

    /**
     * Returns a new comment content node.
     */
    static @NotNull Comment comment(final @NotNull String text) {
        return new Comment(text);
    }

    /**
     * Returns the raw content node representing the HTML5 document type declaration.
     */
    static @NotNull Raw doctype() {
        return new Raw("<!DOCTYPE html>");
    }

    @Override
    default void appendTo(final @NotNull Element.Builder builder) {
        builder.child(this);
    }

    /**
     * Text inserted into the output verbatim, without any escaping nor validation.
     * <p>
     * This is an escape hatch: it's entirely up to the caller to ensure the result is well-formed and safe.
     */
    record Raw(@NotNull String text) implements Content {
    }

    /**
     * Text escaped according to the kind of the containing element.
     */
    record Text(@NotNull String text) implements Content {
    }

    /**
     * An HTML comment.
     * <p>
     * Character sequences that are not allowed in HTML comments are mangled on output, so that the comment can never
     * end prematurely.
     */
    record Comment(@NotNull String text) implements Content {
    }
}
