// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package markup.dom.html;

import markup.dom.Attr;
import markup.dom.Element;
import markup.dom.ElementComponent;

/**
 * The catalog of standard HTML attributes.
 * <p>
 * Free-form attributes are created by static methods. Attributes with a fixed set of values are nested enums whose
 * constants are element components themselves, so {@code HtmlTag.INPUT.of(HtmlAttr.InputType.NUMBER)} works.
 * <p>
 * Attributes holding space or comma separated lists, such as {@code class} or {@code accept}, are appended to rather
 * than replaced. Deprecated and redundant attributes are not included.
 *
 * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTML/Attributes">HTML attribute reference</a>
 */
public final class HtmlAttr {
    private HtmlAttr() {
    }

    public static Attr.Append accept(final String value) {
        return Attr.append("accept", value, ", ");
    }

    public static Attr.Append accesskey(final String value) {
        return Attr.append("accesskey", value, " ");
    }

    public static Attr.Set action(final String value) {
        return Attr.set("action", value);
    }

    public static Attr.Append allow(final String value) {
        return Attr.append("allow", value, "; ");
    }

    public static Attr.Set alt(final String value) {
        return Attr.set("alt", value);
    }

    public static Attr.Set async() {
        return Attr.yes("async");
    }

    public static Attr.Append autocomplete(final String value) {
        return Attr.append("autocomplete", value, " ");
    }

    public static Attr.Set autofocus() {
        return Attr.yes("autofocus");
    }

    public static Attr.Set autoplay() {
        return Attr.yes("autoplay");
    }

    public static Attr.Set checked() {
        return Attr.yes("checked");
    }

    public static Attr.Set cite(final String value) {
        return Attr.set("cite", value);
    }

    public static Attr.Append clazz(final String value) {
        return Attr.append("class", value, " ");
    }

    public static Attr.Set cols(final String value) {
        return Attr.set("cols", value);
    }

    public static Attr.Set cols(final long value) {
        return Attr.set("cols", value);
    }

    public static Attr.Set colspan(final String value) {
        return Attr.set("colspan", value);
    }

    public static Attr.Set colspan(final long value) {
        return Attr.set("colspan", value);
    }

    public static Attr.Set content(final String value) {
        return Attr.set("content", value);
    }

    public static Attr.Set controls() {
        return Attr.yes("controls");
    }

    public static Attr.Set coords(final String value) {
        return Attr.set("coords", value);
    }

    public static Attr.Set data(final String value) {
        return Attr.set("data", value);
    }

    public static Attr.Set datetime(final String value) {
        return Attr.set("datetime", value);
    }

    public static Attr.Set defaultTrack() {
        return Attr.yes("default");
    }

    public static Attr.Set defer() {
        return Attr.yes("defer");
    }

    public static Attr.Set dirname(final String value) {
        return Attr.set("dirname", value);
    }

    public static Attr.Set disabled() {
        return Attr.yes("disabled");
    }

    public static Attr.Set download(final String value) {
        return Attr.set("download", value);
    }

    public static Attr.Append exportparts(final String value) {
        return Attr.append("exportparts", value, ", ");
    }

    public static Attr.Set htmlFor(final String value) {
        return Attr.set("for", value);
    }

    public static Attr.Set form(final String value) {
        return Attr.set("form", value);
    }

    public static Attr.Set formaction(final String value) {
        return Attr.set("formaction", value);
    }

    public static Attr.Set formnovalidate() {
        return Attr.yes("formnovalidate");
    }

    public static Attr.Append headers(final String value) {
        return Attr.append("headers", value, " ");
    }

    public static Attr.Set height(final String value) {
        return Attr.set("height", value);
    }

    public static Attr.Set height(final long value) {
        return Attr.set("height", value);
    }

    public static Attr.Set high(final String value) {
        return Attr.set("high", value);
    }

    public static Attr.Set high(final long value) {
        return Attr.set("high", value);
    }

    public static Attr.Set href(final String value) {
        return Attr.set("href", value);
    }

    public static Attr.Set hreflang(final String value) {
        return Attr.set("hreflang", value);
    }

    public static Attr.Set id(final String value) {
        return Attr.set("id", value);
    }

    public static Attr.Set inert() {
        return Attr.yes("inert");
    }

    public static Attr.Set integrity(final String value) {
        return Attr.set("integrity", value);
    }

    public static Attr.Set is(final String value) {
        return Attr.set("is", value);
    }

    public static Attr.Set ismap() {
        return Attr.yes("ismap");
    }

    public static Attr.Set itemid(final String value) {
        return Attr.set("itemid", value);
    }

    public static Attr.Set itemprop(final String value) {
        return Attr.set("itemprop", value);
    }

    public static Attr.Set itemref(final String value) {
        return Attr.set("itemref", value);
    }

    public static Attr.Set itemscope() {
        return Attr.yes("itemscope");
    }

    public static Attr.Set itemtype(final String value) {
        return Attr.set("itemtype", value);
    }

    public static Attr.Set lang(final String value) {
        return Attr.set("lang", value);
    }

    public static Attr.Set list(final String value) {
        return Attr.set("list", value);
    }

    public static Attr.Set loop() {
        return Attr.yes("loop");
    }

    public static Attr.Set low(final String value) {
        return Attr.set("low", value);
    }

    public static Attr.Set low(final long value) {
        return Attr.set("low", value);
    }

    public static Attr.Set max(final String value) {
        return Attr.set("max", value);
    }

    public static Attr.Set max(final long value) {
        return Attr.set("max", value);
    }

    public static Attr.Set maxlength(final String value) {
        return Attr.set("maxlength", value);
    }

    public static Attr.Set maxlength(final long value) {
        return Attr.set("maxlength", value);
    }

    public static Attr.Set minlength(final String value) {
        return Attr.set("minlength", value);
    }

    public static Attr.Set minlength(final long value) {
        return Attr.set("minlength", value);
    }

    public static Attr.Set min(final String value) {
        return Attr.set("min", value);
    }

    public static Attr.Set min(final long value) {
        return Attr.set("min", value);
    }

    public static Attr.Set multiple() {
        return Attr.yes("multiple");
    }

    public static Attr.Set muted() {
        return Attr.yes("muted");
    }

    public static Attr.Set name(final String value) {
        return Attr.set("name", value);
    }

    public static Attr.Set nonce(final String value) {
        return Attr.set("nonce", value);
    }

    public static Attr.Set novalidate() {
        return Attr.yes("novalidate");
    }

    public static Attr.Set open() {
        return Attr.yes("open");
    }

    public static Attr.Set optimum(final String value) {
        return Attr.set("optimum", value);
    }

    public static Attr.Set optimum(final long value) {
        return Attr.set("optimum", value);
    }

    public static Attr.Append part(final String value) {
        return Attr.append("part", value, " ");
    }

    public static Attr.Set pattern(final String value) {
        return Attr.set("pattern", value);
    }

    public static Attr.Append ping(final String value) {
        return Attr.append("ping", value, " ");
    }

    public static Attr.Set placeholder(final String value) {
        return Attr.set("placeholder", value);
    }

    public static Attr.Set playsinline() {
        return Attr.yes("playsinline");
    }

    public static Attr.Set poster(final String value) {
        return Attr.set("poster", value);
    }

    public static Attr.Set readonly() {
        return Attr.yes("readonly");
    }

    public static Attr.Append rel(final String value) {
        return Attr.append("rel", value, " ");
    }

    public static Attr.Set required() {
        return Attr.yes("required");
    }

    public static Attr.Set reversed() {
        return Attr.yes("reversed");
    }

    public static Attr.Set rows(final String value) {
        return Attr.set("rows", value);
    }

    public static Attr.Set rows(final long value) {
        return Attr.set("rows", value);
    }

    public static Attr.Set rowspan(final String value) {
        return Attr.set("rowspan", value);
    }

    public static Attr.Set rowspan(final long value) {
        return Attr.set("rowspan", value);
    }

    public static Attr.Append sandbox(final String value) {
        return Attr.append("sandbox", value, " ");
    }

    public static Attr.Set selected() {
        return Attr.yes("selected");
    }

    public static Attr.Set size(final String value) {
        return Attr.set("size", value);
    }

    public static Attr.Set size(final long value) {
        return Attr.set("size", value);
    }

    public static Attr.Append sizes(final String value) {
        return Attr.append("sizes", value, ", ");
    }

    public static Attr.Append sizesLink(final String value) {
        return Attr.append("sizes", value, " ");
    }

    public static Attr.Set slot(final String value) {
        return Attr.set("slot", value);
    }

    public static Attr.Set span(final String value) {
        return Attr.set("span", value);
    }

    public static Attr.Set span(final long value) {
        return Attr.set("span", value);
    }

    public static Attr.Set src(final String value) {
        return Attr.set("src", value);
    }

    public static Attr.Set srcdoc(final String value) {
        return Attr.set("srcdoc", value);
    }

    public static Attr.Set srclang(final String value) {
        return Attr.set("srclang", value);
    }

    public static Attr.Append srcset(final String value) {
        return Attr.append("srcset", value, ", ");
    }

    public static Attr.Set start(final String value) {
        return Attr.set("start", value);
    }

    public static Attr.Set start(final long value) {
        return Attr.set("start", value);
    }

    public static Attr.Set step(final String value) {
        return Attr.set("step", value);
    }

    public static Attr.Set step(final long value) {
        return Attr.set("step", value);
    }

    public static Attr.Append style(final String value) {
        return Attr.append("style", value, "; ");
    }

    public static Attr.Set tabindex(final String value) {
        return Attr.set("tabindex", value);
    }

    public static Attr.Set tabindex(final long value) {
        return Attr.set("tabindex", value);
    }

    public static Attr.Set title(final String value) {
        return Attr.set("title", value);
    }

    public static Attr.Set type(final String value) {
        return Attr.set("type", value);
    }

    public static Attr.Set usemap(final String value) {
        return Attr.set("usemap", value);
    }

    public static Attr.Set value(final String value) {
        return Attr.set("value", value);
    }

    public static Attr.Set width(final String value) {
        return Attr.set("width", value);
    }

    public static Attr.Set width(final long value) {
        return Attr.set("width", value);
    }

    /**
     * An attribute with an enumerated value.
     */
    public interface Keyword extends ElementComponent {
        /**
         * Retrieves the name of the attribute.
         */
        String attributeName();

        /**
         * Retrieves the value of the attribute.
         */
        String value();

        @Override
        default void appendTo(final Element.Builder builder) {
            builder.attribute(attributeName(), value());
        }
    }

    /**
     * Values of the {@code as} attribute.
     */
    public enum As implements Keyword {
        AUDIO("audio"),
        DOCUMENT("document"),
        EMBED("embed"),
        FETCH("fetch"),
        FONT("font"),
        IMAGE("image"),
        OBJECT("object"),
        SCRIPT("script"),
        STYLE("style"),
        TRACK("track"),
        VIDEO("video"),
        WORKER("worker");

        As(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "as";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code autocapitalize} attribute.
     */
    public enum Autocapitalize implements Keyword {
        NONE("none"),
        SENTENCES("sentences"),
        WORDS("words"),
        CHARACTERS("characters");

        Autocapitalize(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "autocapitalize";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code capture} attribute.
     */
    public enum Capture implements Keyword {
        USER("user"),
        ENVIRONMENT("environment");

        Capture(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "capture";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code contenteditable} attribute.
     */
    public enum Contenteditable implements Keyword {
        TRUE(""),
        FALSE("false"),
        PLAINTEXT_ONLY("plaintext-only");

        Contenteditable(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "contenteditable";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code crossorigin} attribute.
     */
    public enum Crossorigin implements Keyword {
        ANONYMOUS("anonymous"),
        USE_CREDENTIALS("use-credentials");

        Crossorigin(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "crossorigin";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code decoding} attribute.
     */
    public enum Decoding implements Keyword {
        SYNC("sync"),
        ASYNC("async"),
        AUTO("auto");

        Decoding(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "decoding";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code dir} attribute.
     */
    public enum Dir implements Keyword {
        LTR("ltr"),
        RTL("rtl"),
        AUTO("auto");

        Dir(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "dir";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code draggable} attribute.
     */
    public enum Draggable implements Keyword {
        TRUE("true"),
        FALSE("false");

        Draggable(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "draggable";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code enctype} attribute.
     */
    public enum Enctype implements Keyword {
        FORM("application/x-www-form-urlencoded"),
        MULTIPART("multipart/form-data"),
        PLAIN("text/plain");

        Enctype(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "enctype";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code enterkeyhint} attribute.
     */
    public enum Enterkeyhint implements Keyword {
        ENTER("enter"),
        DONE("done"),
        GO("go"),
        NEXT("next"),
        PREVIOUS("previous"),
        SEARCH("search"),
        SEND("send");

        Enterkeyhint(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "enterkeyhint";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code formenctype} attribute.
     */
    public enum Formenctype implements Keyword {
        FORM("application/x-www-form-urlencoded"),
        MULTIPART("multipart/form-data"),
        PLAIN("text/plain");

        Formenctype(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "formenctype";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code formmethod} attribute.
     */
    public enum Formmethod implements Keyword {
        POST("post"),
        GET("get"),
        DIALOG("dialog");

        Formmethod(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "formmethod";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code formtarget} attribute.
     */
    public enum Formtarget implements Keyword {
        SELF("_self"),
        BLANK("_blank"),
        PARENT("_parent"),
        TOP("_top");

        Formtarget(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "formtarget";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code hidden} attribute.
     */
    public enum Hidden implements Keyword {
        YES(""),
        UNTIL_FOUND("until-found");

        Hidden(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "hidden";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code http-equiv} attribute.
     */
    public enum HttpEquiv implements Keyword {
        CONTENT_SECURITY_POLICY("content-security-policy"),
        CONTENT_TYPE("content-type"),
        DEFAULT_STYLE("default-style"),
        X_UA_COMPATIBLE("x-ua-compatible"),
        REFRESH("refresh");

        HttpEquiv(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "http-equiv";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code inputmode} attribute.
     */
    public enum Inputmode implements Keyword {
        NONE("none"),
        TEXT("text"),
        DECIMAL("decimal"),
        NUMERIC("numeric"),
        TEL("tel"),
        SEARCH("search"),
        EMAIL("email"),
        URL("url");

        Inputmode(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "inputmode";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code kind} attribute.
     */
    public enum Kind implements Keyword {
        SUBTITLES("subtitles"),
        CAPTIONS("captions"),
        CHAPTERS("chapters"),
        METADATA("metadata");

        Kind(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "kind";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code loading} attribute.
     */
    public enum Loading implements Keyword {
        EAGER("eager"),
        LAZY("lazy");

        Loading(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "loading";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code method} attribute.
     */
    public enum Method implements Keyword {
        POST("post"),
        GET("get"),
        DIALOG("dialog");

        Method(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "method";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code popover} attribute.
     */
    public enum Popover implements Keyword {
        AUTO(""),
        MANUAL("manual");

        Popover(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "popover";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code preload} attribute.
     */
    public enum Preload implements Keyword {
        NONE("none"),
        METADATA("metadata"),
        AUTO("auto");

        Preload(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "preload";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code referrerpolicy} attribute.
     */
    public enum Referrerpolicy implements Keyword {
        NO_REFERRER("no-referrer"),
        NO_REFERRER_WHEN_DOWNGRADE("no-referrer-when-downgrade"),
        ORIGIN("origin"),
        ORIGIN_WHEN_CROSS_ORIGIN("origin-when-cross-origin"),
        SAME_ORIGIN("same-origin"),
        STRICT_ORIGIN("strict-origin"),
        STRICT_ORIGIN_WHEN_CROSS_ORIGIN("strict-origin-when-cross-origin"),
        UNSAFE_URL("unsafe-url");

        Referrerpolicy(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "referrerpolicy";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code rel} attribute.
     */
    public enum Rel implements Keyword {
        ALTERNATE("alternate"),
        AUTHOR("author"),
        BOOKMARK("bookmark"),
        CANONICAL("canonical"),
        DNS_PREFETCH("dns-prefetch"),
        EXTERNAL("external"),
        EXPECT("expect"),
        HELP("help"),
        ICON("icon"),
        LICENSE("license"),
        MANIFEST("manifest"),
        ME("me"),
        MODULEPRELOAD("modulepreload"),
        NEXT("next"),
        NOFOLLOW("nofollow"),
        NOOPENER("noopener"),
        NOREFERRER("noreferrer"),
        OPENER("opener"),
        PINGBACK("pingback"),
        PRECONNECT("preconnect"),
        PREFETCH("prefetch"),
        PRELOAD("preload"),
        PRERENDER("prerender"),
        PREV("prev"),
        PRIVACY_POLICY("privacy-policy"),
        SEARCH("search"),
        STYLESHEET("stylesheet"),
        TAG("tag"),
        TERMS_OF_SERVICE("terms-of-service");

        Rel(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "rel";
        }

        @Override
        public String value() {
            return value;
        }

        @Override
        public void appendTo(final Element.Builder builder) {
            builder.appendAttribute(attributeName(), value, " ");
        }

        private final String value;
    }

    /**
     * Values of the {@code scope} attribute.
     */
    public enum Scope implements Keyword {
        ROW("row"),
        COL("col"),
        ROWGROUP("rowgroup"),
        COLGROUP("colgroup");

        Scope(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "scope";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code shape} attribute.
     */
    public enum Shape implements Keyword {
        RECT("rect"),
        CIRCLE("circle"),
        POLY("poly"),
        DEFAULT("default");

        Shape(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "shape";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code spellcheck} attribute.
     */
    public enum Spellcheck implements Keyword {
        TRUE(""),
        FALSE("false");

        Spellcheck(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "spellcheck";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code target} attribute.
     */
    public enum Target implements Keyword {
        SELF("_self"),
        BLANK("_blank"),
        PARENT("_parent"),
        TOP("_top"),
        UNFENCED_TOP("_unfencedTop");

        Target(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "target";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code translate} attribute.
     */
    public enum Translate implements Keyword {
        YES(""),
        NO("no");

        Translate(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "translate";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code type} attribute.
     */
    public enum ButtonType implements Keyword {
        SUBMIT("submit"),
        RESET("reset"),
        BUTTON("button");

        ButtonType(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "type";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code type} attribute.
     */
    public enum InputType implements Keyword {
        BUTTON("button"),
        CHECKBOX("checkbox"),
        COLOR("color"),
        DATE("date"),
        DATETIME_LOCAL("datetime-local"),
        EMAIL("email"),
        FILE("file"),
        HIDDEN("hidden"),
        IMAGE("image"),
        MONTH("month"),
        NUMBER("number"),
        PASSWORD("password"),
        RADIO("radio"),
        RANGE("range"),
        RESET("reset"),
        SEARCH("search"),
        SUBMIT("submit"),
        TEL("tel"),
        TEXT("text"),
        TIME("time"),
        URL("url"),
        WEEK("week");

        InputType(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "type";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code type} attribute.
     */
    public enum OlType implements Keyword {
        LOWERCASE_ALPHABETIC("a"),
        UPPERCASE_ALPHABETIC("A"),
        LOWERCASE_ROMAN("i"),
        UPPERCASE_ROMAN("I"),
        NUMBERS("1");

        OlType(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "type";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code type} attribute.
     */
    public enum ScriptType implements Keyword {
        CLASSIC(""),
        IMPORTMAP("importmap"),
        MODULE("module");

        ScriptType(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "type";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code wrap} attribute.
     */
    public enum Wrap implements Keyword {
        HARD("hard"),
        SOFT("soft");

        Wrap(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "wrap";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }

    /**
     * Values of the {@code writingsuggestions} attribute.
     */
    public enum WritingSuggestions implements Keyword {
        TRUE(""),
        FALSE("false");

        WritingSuggestions(final String value) {
            this.value = value;
        }

        @Override
        public String attributeName() {
            return "writingsuggestions";
        }

        @Override
        public String value() {
            return value;
        }

        private final String value;
    }
}
