// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package markup.dom;

import org.jetbrains.annotations.NotNull;

/**
 * Something that can be serialized into HTML: a {@link Document} or any {@link Content}.
 */
public sealed interface Renderable permits Content, Document {
    /**
     * Serializes this node into HTML, appending the output to the given sink.
     * <p>
     * If a {@link RenderException} is thrown, whatever has been appended to the sink so far is incomplete and should
     * be discarded.
     */
    default void render(final @NotNull Appendable sink) throws RenderException {
        Serializer.serialize(sink, this);
    }

    /**
     * Serializes this node into a freshly allocated string of HTML.
     */
    default @NotNull String renderToString() throws RenderException {
        return Serializer.serializeToString(this);
    }
}
