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
 * All non-deprecated SVG elements.
 * <p>
 * SVG elements are foreign elements, so tag names keep their mixed case, such as {@code linearGradient}.
 *
 * @see <a href="https://developer.mozilla.org/en-US/docs/Web/SVG/Element">SVG elements reference</a>
 */
public enum SvgTag {
    A,
    ANIMATE,
    ANIMATE_MOTION("animateMotion"),
    ANIMATE_TRANSFORM("animateTransform"),
    CIRCLE,
    CLIP_PATH("clipPath"),
    DEFS,
    DESC,
    ELLIPSE,
    FE_BLEND("feBlend"),
    FE_COLOR_MATRIX("feColorMatrix"),
    FE_COMPONENT_TRANSFER("feComponentTransfer"),
    FE_COMPOSITE("feComposite"),
    FE_CONVOLVE_MATRIX("feConvolveMatrix"),
    FE_DIFFUSE_LIGHTING("feDiffuseLighting"),
    FE_DISPLACEMENT_MAP("feDisplacementMap"),
    FE_DISTANT_LIGHT("feDistantLight"),
    FE_DROP_SHADOW("feDropShadow"),
    FE_FLOOD("feFlood"),
    FE_FUNC_A("feFuncA"),
    FE_FUNC_B("feFuncB"),
    FE_FUNC_G("feFuncG"),
    FE_FUNC_R("feFuncR"),
    FE_GAUSSIAN_BLUR("feGaussianBlur"),
    FE_IMAGE("feImage"),
    FE_MERGE("feMerge"),
    FE_MERGE_NODE("feMergeNode"),
    FE_MORPHOLOGY("feMorphology"),
    FE_OFFSET("feOffset"),
    FE_POINT_LIGHT("fePointLight"),
    FE_SPECULAR_LIGHTING("feSpecularLighting"),
    FE_SPOT_LIGHT("feSpotLight"),
    FE_TILE("feTile"),
    FE_TURBULENCE("feTurbulence"),
    FILTER,
    FOREIGN_OBJECT("foreignObject"),
    G,
    IMAGE,
    LINE,
    LINEAR_GRADIENT("linearGradient"),
    MARKER,
    MASK,
    METADATA,
    MPATH,
    PATH,
    PATTERN,
    POLYGON,
    POLYLINE,
    RADIAL_GRADIENT("radialGradient"),
    RECT,
    SCRIPT,
    SET,
    STOP,
    STYLE,
    SVG,
    SWITCH,
    SYMBOL,
    TEXT,
    TEXT_PATH("textPath"),
    TITLE,
    TSPAN,
    USE,
    VIEW;

    SvgTag() {
        tagName = name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    SvgTag(final String tagName) {
        this.tagName = tagName;
    }

    /**
     * Retrieves the tag with the given name, or {@code null} if one doesn't exist.
     * <p>
     * Matching is case-sensitive, so {@code lineargradient} is not found.
     */
    public static @Nullable SvgTag byName(final String tagName) {
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

    private static final Map<String, SvgTag> tagsByName =
        Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(SvgTag::tagName, Function.identity()));

    private final String tagName;
}
