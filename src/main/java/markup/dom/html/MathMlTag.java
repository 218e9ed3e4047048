// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package markup.dom.html;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import markup.dom.Content;
import markup.dom.Element;
import markup.dom.ElementComponent;
import markup.dom.ElementKind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * All non-deprecated, standard MathML elements.
 *
 * @see <a href="https://developer.mozilla.org/en-US/docs/Web/MathML/Element">MathML elements reference</a>
 */
public enum MathMlTag {
    ANNOTATION,
    ANNOTATION_XML,
    MATH,
    MERROR,
    MFRAC,
    MI,
    MMULTISCRIPTS,
    MN,
    MO,
    MOVER,
    MPADDED,
    MPHANTOM,
    MPRESCRIPTS,
    MROOT,
    MROW,
    MS,
    MSPACE,
    MSQRT,
    MSTYLE,
    MSUB,
    MSUBSUP,
    MSUP,
    MTABLE,
    MTD,
    MTEXT,
    MTR,
    MUNDER,
    MUNDEROVER,
    SEMANTICS;

    MathMlTag() {
        tagName = name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    MathMlTag(final String tagName) {
        this.tagName = tagName;
    }

    /**
     * Retrieves the tag with the given name, or {@code null} if one doesn't exist.
     * <p>
     * Matching is case-sensitive.
     */
    public static @Nullable MathMlTag byName(final String tagName) {
        return tagsByName.get(tagName);
    }

    /**
     * Retrieves the tag name.
     */
    public String tagName() {
        return tagName;
    }

    /**
     * Returns a new {@link ElementKind#FOREIGN} element with this tag, built from the given components.
     */
    public Element of(final ElementComponent... components) {
        return Element.builder(tagName, ElementKind.FOREIGN).with(components).build();
    }

    /**
     * Returns a new element with this tag and a single text child.
     */
    public Element of(final String text) {
        return of(Content.text(text));
    }

    private static final Map<String, MathMlTag> tagsByName =
        Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(MathMlTag::tagName, Function.identity()));

    private final String tagName;
}
