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
 * All non-deprecated HTML elements, with their element kinds.
 * <p>
 * Obsolete and deprecated elements are intentionally excluded.
 *
 * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTML/Element">HTML elements reference</a>
 */
public enum HtmlTag {
    // Main root
    HTML(ElementKind.NORMAL),

    // Document metadata
    BASE(ElementKind.VOID),
    HEAD(ElementKind.NORMAL),
    LINK(ElementKind.VOID),
    META(ElementKind.VOID),
    STYLE(ElementKind.RAW_TEXT),
    TITLE(ElementKind.ESCAPABLE_RAW_TEXT),

    // Sectioning root
    BODY(ElementKind.NORMAL),

    // Content sectioning
    ADDRESS(ElementKind.NORMAL),
    ARTICLE(ElementKind.NORMAL),
    ASIDE(ElementKind.NORMAL),
    FOOTER(ElementKind.NORMAL),
    HEADER(ElementKind.NORMAL),
    H1(ElementKind.NORMAL),
    H2(ElementKind.NORMAL),
    H3(ElementKind.NORMAL),
    H4(ElementKind.NORMAL),
    H5(ElementKind.NORMAL),
    H6(ElementKind.NORMAL),
    HGROUP(ElementKind.NORMAL),
    MAIN(ElementKind.NORMAL),
    NAV(ElementKind.NORMAL),
    SECTION(ElementKind.NORMAL),
    SEARCH(ElementKind.NORMAL),

    // Text content
    BLOCKQUOTE(ElementKind.NORMAL),
    DD(ElementKind.NORMAL),
    DIV(ElementKind.NORMAL),
    DL(ElementKind.NORMAL),
    DT(ElementKind.NORMAL),
    FIGCAPTION(ElementKind.NORMAL),
    FIGURE(ElementKind.NORMAL),
    HR(ElementKind.VOID),
    LI(ElementKind.NORMAL),
    MENU(ElementKind.NORMAL),
    OL(ElementKind.NORMAL),
    P(ElementKind.NORMAL),
    PRE(ElementKind.NORMAL),
    UL(ElementKind.NORMAL),

    // Inline text semantics
    A(ElementKind.NORMAL),
    ABBR(ElementKind.NORMAL),
    B(ElementKind.NORMAL),
    BDI(ElementKind.NORMAL),
    BDO(ElementKind.NORMAL),
    BR(ElementKind.VOID),
    CITE(ElementKind.NORMAL),
    CODE(ElementKind.NORMAL),
    DATA(ElementKind.NORMAL),
    DFN(ElementKind.NORMAL),
    EM(ElementKind.NORMAL),
    I(ElementKind.NORMAL),
    KBD(ElementKind.NORMAL),
    MARK(ElementKind.NORMAL),
    Q(ElementKind.NORMAL),
    RP(ElementKind.NORMAL),
    RT(ElementKind.NORMAL),
    RUBY(ElementKind.NORMAL),
    S(ElementKind.NORMAL),
    SAMP(ElementKind.NORMAL),
    SMALL(ElementKind.NORMAL),
    SPAN(ElementKind.NORMAL),
    STRONG(ElementKind.NORMAL),
    SUB(ElementKind.NORMAL),
    SUP(ElementKind.NORMAL),
    TIME(ElementKind.NORMAL),
    U(ElementKind.NORMAL),
    VAR(ElementKind.NORMAL),
    WBR(ElementKind.VOID),

    // Image and multimedia
    AREA(ElementKind.VOID),
    AUDIO(ElementKind.NORMAL),
    IMG(ElementKind.VOID),
    MAP(ElementKind.NORMAL),
    TRACK(ElementKind.VOID),
    VIDEO(ElementKind.NORMAL),

    // Embedded content
    EMBED(ElementKind.VOID),
    FENCEDFRAME(ElementKind.NORMAL),
    IFRAME(ElementKind.NORMAL),
    OBJECT(ElementKind.NORMAL),
    PICTURE(ElementKind.NORMAL),
    PORTAL(ElementKind.NORMAL),
    SOURCE(ElementKind.VOID),

    // SVG and MathML
    SVG(ElementKind.FOREIGN),
    MATH(ElementKind.FOREIGN),

    // Scripting
    CANVAS(ElementKind.NORMAL),
    NOSCRIPT(ElementKind.NORMAL),
    SCRIPT(ElementKind.RAW_TEXT),

    // Demarcating edits
    DEL(ElementKind.NORMAL),
    INS(ElementKind.NORMAL),

    // Table content
    CAPTION(ElementKind.NORMAL),
    COL(ElementKind.VOID),
    COLGROUP(ElementKind.NORMAL),
    TABLE(ElementKind.NORMAL),
    TBODY(ElementKind.NORMAL),
    TD(ElementKind.NORMAL),
    TFOOT(ElementKind.NORMAL),
    TH(ElementKind.NORMAL),
    THEAD(ElementKind.NORMAL),
    TR(ElementKind.NORMAL),

    // Forms
    BUTTON(ElementKind.NORMAL),
    DATALIST(ElementKind.NORMAL),
    FIELDSET(ElementKind.NORMAL),
    FORM(ElementKind.NORMAL),
    INPUT(ElementKind.VOID),
    LABEL(ElementKind.NORMAL),
    LEGEND(ElementKind.NORMAL),
    METER(ElementKind.NORMAL),
    OPTGROUP(ElementKind.NORMAL),
    OPTION(ElementKind.NORMAL),
    OUTPUT(ElementKind.NORMAL),
    PROGRESS(ElementKind.NORMAL),
    SELECT(ElementKind.NORMAL),
    TEXTAREA(ElementKind.ESCAPABLE_RAW_TEXT),

    // Interactive elements
    DETAILS(ElementKind.NORMAL),
    DIALOG(ElementKind.NORMAL),
    SUMMARY(ElementKind.NORMAL),

    // Web Components
    SLOT(ElementKind.NORMAL),
    TEMPLATE(ElementKind.TEMPLATE);

    HtmlTag(final ElementKind kind) {
        tagName = name().toLowerCase(Locale.ROOT);
        this.kind = kind;
    }

    /**
     * Retrieves the tag with the given name, or {@code null} if one doesn't exist.
     * <p>
     * Tag names are lowercase, as is the case for all HTML elements.
     */
    public static @Nullable HtmlTag byName(final String tagName) {
        return tagsByName.get(tagName);
    }

    /**
     * Retrieves the tag name.
     */
    public String tagName() {
        return tagName;
    }

    /**
     * Retrieves the kind of elements with this tag.
     */
    public ElementKind kind() {
        return kind;
    }

    /**
     * Returns a new element with this tag, built from the given components.
     */
    public Element of(final ElementComponent... components) {
        return Element.builder(tagName, kind).with(components).build();
    }

    /**
     * Returns a new element with this tag and a single text child.
     */
    public Element of(final String text) {
        return of(Content.text(text));
    }

    private static final Map<String, HtmlTag> tagsByName =
        Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(HtmlTag::tagName, Function.identity()));

    private final String tagName;
    private final ElementKind kind;
}
