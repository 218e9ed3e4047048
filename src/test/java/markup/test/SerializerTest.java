// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package markup.test;

import java.io.IOException;
import markup.dom.Attr;
import markup.dom.Content;
import markup.dom.Element;
import markup.dom.ElementKind;
import markup.dom.RenderError;
import markup.dom.RenderException;
import markup.dom.Serializer;
import markup.dom.html.HtmlTag;
import markup.dom.html.SvgTag;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

final class SerializerTest {
    @Test
    void fullDocumentIsSerialized() throws RenderException {
        final var document = HtmlTag.HTML.of(
            HtmlTag.HEAD.of(HtmlTag.TITLE.of("Hello")),
            HtmlTag.BODY.of(
                HtmlTag.H1.of("Hello"),
                HtmlTag.P.of(Content.text("Hello "), HtmlTag.EM.of("world"), Content.text("!"))
            )
        ).toDocument();
        assertThat(document.renderToString()).isEqualTo(
            "<!DOCTYPE html><html><head><title>Hello</title></head>"
                + "<body><h1>Hello</h1><p>Hello <em>world</em>!</p></body></html>"
        );
    }

    @Test
    void emptyElementsAreClosedAccordingToKind() throws RenderException {
        assertThat(HtmlTag.HEAD.of().renderToString()).isEqualTo("<head></head>");
        assertThat(HtmlTag.INPUT.of().renderToString()).isEqualTo("<input>");
        assertThat(HtmlTag.SCRIPT.of().renderToString()).isEqualTo("<script></script>");
        assertThat(HtmlTag.TEXTAREA.of().renderToString()).isEqualTo("<textarea></textarea>");
        assertThat(HtmlTag.TEMPLATE.of().renderToString()).isEqualTo("<template></template>");
        assertThat(SvgTag.CIRCLE.of().renderToString()).isEqualTo("<circle />");
    }

    @Test
    void voidElementWithChildIsRejected() {
        for (final Content child : new Content[]{
            Content.text("x"), Content.raw("x"), Content.comment("x"), HtmlTag.SPAN.of()
        }) {
            assertThatExceptionOfType(RenderException.class)
                .isThrownBy(() -> HtmlTag.INPUT.of(child).renderToString())
                .satisfies(e -> {
                    assertThat(e.error()).isSameAs(RenderError.InvalidChild.instance());
                    assertThat(e.pathSegments()).extracting(RenderException.PathSegment::index).containsExactly(0);
                });
        }
    }

    @Test
    void rawTextIsNotEscaped() throws RenderException {
        assertThat(HtmlTag.SCRIPT.of("foo <script> & </style> bar").renderToString())
            .isEqualTo("<script>foo <script> & </style> bar</script>");
        assertThat(HtmlTag.SCRIPT.of(Content.raw("</script>")).renderToString())
            .isEqualTo("<script></script></script>");
    }

    @Test
    void closingTagInRawTextIsRejected() {
        assertThatExceptionOfType(RenderException.class)
            .isThrownBy(() -> HtmlTag.SCRIPT.of("hello </script> world").renderToString())
            .satisfies(e -> assertThat(e.error()).isEqualTo(new RenderError.InvalidRawText("hello </script> world")));
        assertThatExceptionOfType(RenderException.class)
            .isThrownBy(() -> HtmlTag.SCRIPT.of("</ScRiPt ").renderToString())
            .satisfies(e -> assertThat(e.error()).isInstanceOf(RenderError.InvalidRawText.class))
            .withMessageContaining("Invalid raw text");
    }

    @Test
    void unterminatedClosingTagAtEndOfRawTextIsAccepted() throws RenderException {
        assertThat(HtmlTag.SCRIPT.of("x </script").renderToString()).isEqualTo("<script>x </script</script>");
    }

    @Test
    void rawTextElementsAcceptOnlyText() {
        assertThatExceptionOfType(RenderException.class)
            .isThrownBy(() -> HtmlTag.SCRIPT.of(Content.comment("x")).renderToString())
            .satisfies(e -> assertThat(e.error()).isSameAs(RenderError.InvalidChild.instance()));
        assertThatExceptionOfType(RenderException.class)
            .isThrownBy(() -> HtmlTag.TITLE.of(HtmlTag.B.of("x")).renderToString())
            .satisfies(e -> assertThat(e.path()).isEqualTo("/0(b)"));
    }

    @Test
    void escapableRawTextIsEscaped() throws RenderException {
        assertThat(HtmlTag.TEXTAREA.of("foo <p> & bar").renderToString())
            .isEqualTo("<textarea>foo &lt;p&gt; &amp; bar</textarea>");
        assertThat(HtmlTag.TITLE.of("</title>").renderToString()).isEqualTo("<title>&lt;/title&gt;</title>");
    }

    @Test
    void textIsEscaped() throws RenderException {
        assertThat(Content.text("a < b && c > \"d\" 'e'").renderToString())
            .isEqualTo("a &lt; b &amp;&amp; c &gt; \"d\" 'e'");
        assertThat(Content.raw("<b>&amp;</b>").renderToString()).isEqualTo("<b>&amp;</b>");
    }

    @Test
    void namesAreLowercasedOutsideForeignElements() throws RenderException {
        final var element = Element.normal("HTML").with(Attr.set("LANG", "EN"));
        assertThat(element.renderToString()).isEqualTo("<html lang=\"EN\"></html>");
        final var foreign = Element.of("linearGradient", ElementKind.FOREIGN).with(Attr.set("gradientUnits", "x"));
        assertThat(foreign.renderToString()).isEqualTo("<linearGradient gradientUnits=\"x\" />");
    }

    @Test
    void attributesAreSortedByName() throws RenderException {
        final var input = HtmlTag.INPUT.of(
            Attr.set("type", "number"),
            Attr.set("name", "tentacles"),
            Attr.set("min", 10),
            Attr.set("max", 100)
        );
        assertThat(input.renderToString())
            .isEqualTo("<input max=\"100\" min=\"10\" name=\"tentacles\" type=\"number\">");
        final var checkbox = HtmlTag.INPUT.of(Attr.set("name", "horns"), Attr.yes("checked"));
        assertThat(checkbox.renderToString()).isEqualTo("<input checked name=\"horns\">");
    }

    @Test
    void attributeValuesEscapeOnlyQuotes() throws RenderException {
        final var element = HtmlTag.A.of(Attr.set("title", "\"><script>alert(1)</script>&amp;'"));
        assertThat(element.renderToString())
            .isEqualTo("<a title=\"&quot;><script>alert(1)</script>&amp;'\"></a>");
    }

    @Test
    void invalidNamesAreRejected() {
        assertThatExceptionOfType(RenderException.class)
            .isThrownBy(() -> Element.normal("my-element").renderToString())
            .satisfies(e -> assertThat(e.error()).isEqualTo(new RenderError.InvalidTagName("my-element")))
            .withMessage("Render error at /: Invalid tag name \"my-element\"");
        assertThatExceptionOfType(RenderException.class)
            .isThrownBy(() -> HtmlTag.DIV.of(Attr.set("on click", "x")).renderToString())
            .satisfies(e -> assertThat(e.error()).isEqualTo(new RenderError.InvalidAttrName("on click")));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '`', value = {
        "hello                  | <!--hello-->",
        "a<!--b                 | <!--a<!==b-->",
        "a-->b                  | <!--a==>b-->",
        "a--!>b                 | <!--a==!>b-->",
        ">a                     | <!-- >a-->",
        "->a                    | <!-- ->a-->",
        "a<!-                   | <!--a<!- -->",
        "<!---->                | <!--<!====>-->",
        "``                     | <!---->",
    })
    void commentsAreMangled(final String text, final String expected) throws RenderException {
        assertThat(Content.comment(text).renderToString()).isEqualTo(expected);
    }

    @Test
    void foreignAndTemplateElementsAcceptAnyContent() throws RenderException {
        final var svg = HtmlTag.SVG.of(
            Attr.set("viewBox", "0 0 10 10"),
            SvgTag.LINEAR_GRADIENT.of(Attr.set("id", "g")),
            Content.comment("c"),
            SvgTag.TEXT.of("a < b")
        );
        assertThat(svg.renderToString()).isEqualTo(
            "<svg viewBox=\"0 0 10 10\"><linearGradient id=\"g\" /><!--c--><text>a &lt; b</text></svg>"
        );
        final var template = HtmlTag.TEMPLATE.of(HtmlTag.P.of("x"), Content.raw("<br>"));
        assertThat(template.renderToString()).isEqualTo("<template><p>x</p><br></template>");
    }

    @Test
    void sinkFailureIsReported() {
        final var exception = new IOException("disk on fire");
        final Appendable failingSink = new Appendable() {
            @Override
            public Appendable append(final CharSequence csq) throws IOException {
                throw exception;
            }

            @Override
            public Appendable append(final CharSequence csq, final int start, final int end) throws IOException {
                throw exception;
            }

            @Override
            public Appendable append(final char c) throws IOException {
                throw exception;
            }
        };
        assertThatExceptionOfType(RenderException.class)
            .isThrownBy(() -> Serializer.serialize(failingSink, HtmlTag.P.of("x").toDocument()))
            .withCause(exception)
            .satisfies(e -> assertThat(e.error()).isEqualTo(new RenderError.Format(exception)));
    }

    @Test
    void renderingIsDeterministic() throws RenderException {
        final var element = HtmlTag.DIV.of(
            Attr.clazz("b"),
            Attr.set("id", "x"),
            Attr.clazz("a"),
            HtmlTag.SPAN.of("1"),
            Content.text("2"),
            HtmlTag.SPAN.of("3")
        );
        final var first = element.renderToString();
        final var second = element.renderToString();
        assertThat(first).isEqualTo(second)
            .isEqualTo("<div class=\"b a\" id=\"x\"><span>1</span>2<span>3</span></div>");
        final var builder = new StringBuilder();
        element.render(builder);
        assertThat(builder).hasToString(first);
    }
}
