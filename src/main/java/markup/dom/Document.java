// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package markup.dom;

import org.jetbrains.annotations.NotNull;

/**
 * A complete HTML document: a root element, serialized with a preceding {@code <!DOCTYPE html>}.
 * <p>
 * For the purposes of serialization, a document is the same as the content sequence of {@link Content#doctype()}
 * followed by the root element.
 */
public record Document(@NotNull Element root) implements Renderable {
}
