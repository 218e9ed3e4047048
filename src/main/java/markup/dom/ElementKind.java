// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package markup.dom;

/**
 * The kind of an HTML element, as far as serialization is concerned.
 * <p>
 * The kind determines which children an element may have, how its text children are written, and how the element is
 * closed when it has no children at all.
 *
 * @see <a href="https://html.spec.whatwg.org/multipage/syntax.html#elements-2">HTML Standard, kinds of elements</a>
 */
public enum ElementKind {
    /**
     * An element that never has children nor a closing tag, such as {@code <input>}.
     */
    VOID,
    /**
     * An element whose text is not parsed for markup, such as {@code <script>}. Text children are written unescaped,
     * and must not contain anything resembling the element's own closing tag.
     */
    RAW_TEXT,
    /**
     * An element whose text is not parsed for markup, but where character references are recognized, such as
     * {@code <textarea>}. Text children are escaped.
     */
    ESCAPABLE_RAW_TEXT,
    /**
     * An element from a foreign namespace, that is SVG or MathML. Its name keeps its casing and empty elements are
     * self-closing.
     */
    FOREIGN,
    /**
     * The {@code <template>} element.
     */
    TEMPLATE,
    /**
     * Any other element.
     */
    NORMAL
}
