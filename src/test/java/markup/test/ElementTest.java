// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package markup.test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import markup.dom.Attr;
import markup.dom.Content;
import markup.dom.Element;
import markup.dom.ElementComponent;
import markup.dom.ElementKind;
import markup.dom.RenderException;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.entry;
import org.junit.jupiter.api.Test;

final class ElementTest {
    @Test
    void namesAreLowercasedUnlessForeign() {
        final var element = Element.builder("DiV", ElementKind.NORMAL).attribute("Data-X", "Y").build();
        assertThat(element.name()).isEqualTo("div");
        assertThat(element.attributes()).containsOnlyKeys("data-x").containsEntry("data-x", "Y");
        final var foreign = Element.builder("feGaussianBlur", ElementKind.FOREIGN)
            .attribute("stdDeviation", "1")
            .build();
        assertThat(foreign.name()).isEqualTo("feGaussianBlur");
        assertThat(foreign.attributes()).containsOnlyKeys("stdDeviation");
    }

    @Test
    void lowercasingIsAsciiOnly() {
        assertThat(Element.normal("TİTLE").name()).isEqualTo("tİtle");
    }

    @Test
    void setReplacesAndAppendConcatenates() {
        final var element = Element.normal("p").with(
            Attr.set("id", "first"),
            Attr.id("second"),
            Attr.clazz("a"),
            Attr.clazz("b"),
            Attr.style("color: red"),
            Attr.style("margin: 0"),
            Attr.data("count", "3")
        );
        assertThat(element.attributes()).containsExactly(
            entry("class", "a b"),
            entry("data-count", "3"),
            entry("id", "second"),
            entry("style", "color: red; margin: 0")
        );
    }

    @Test
    void appendingToEmptyValueReplacesIt() {
        final var element = Element.normal("p").with(Attr.yes("class"), Attr.clazz("a"));
        assertThat(element.attributes()).containsEntry("class", "a");
    }

    @Test
    void componentsComposeInOrder() throws RenderException {
        final var element = Element.normal("ul").with(
            ElementComponent.of(Content.text("a"), ElementComponent.empty()),
            ElementComponent.ofAll(List.of(Content.text("b"), Content.text("c"))),
            ElementComponent.optional(Optional.of(Content.text("d"))),
            ElementComponent.optional(Optional.empty()),
            builder -> builder.child(Content.text(builder.name()))
        );
        assertThat(element.children()).containsExactly(
            Content.text("a"), Content.text("b"), Content.text("c"), Content.text("d"), Content.text("ul")
        );
        assertThat(element.renderToString()).isEqualTo("<ul>abcdul</ul>");
    }

    @Test
    void elementsAreImmutable() {
        final var builder = Element.builder("p", ElementKind.NORMAL).child(Content.text("a"));
        final var first = builder.build();
        builder.child(Content.text("b")).attribute("id", "x");
        final var second = builder.build();
        assertThat(first.children()).hasSize(1);
        assertThat(first.attributes()).isEmpty();
        assertThat(second.children()).hasSize(2);
        assertThatExceptionOfType(UnsupportedOperationException.class)
            .isThrownBy(() -> first.children().add(Content.text("c")));
        assertThatExceptionOfType(UnsupportedOperationException.class)
            .isThrownBy(() -> first.attributes().put("id", "y"));

        final var derived = first.withAttribute("id", "z").withChild(Content.comment("c"));
        assertThat(first.attributes()).isEmpty();
        assertThat(derived.attributes()).containsEntry("id", "z");
        assertThat(derived.children()).hasSize(2);
    }

    @Test
    void equalityIsStructural() {
        final var a = Element.normal("p").with(Attr.set("id", "x"), Content.text("t"));
        final var b = Element.normal("P").with(Attr.set("ID", "x"), Content.text("t"));
        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(Element.of("p", ElementKind.TEMPLATE).with(Attr.set("id", "x"), Content.text("t")));
        assertThat(a.toBuilder().build()).isEqualTo(a);
    }

    @Test
    void groupDoesNotSeeLaterChangesToItsList() {
        final var components = new ArrayList<ElementComponent>(List.of(Attr.clazz("a")));
        final var group = new ElementComponent.Group(components);
        components.add(Attr.clazz("b"));

        assertThat(group.components()).hasSize(1);
        assertThat(Element.normal("p").with(group).attributes()).containsExactly(entry("class", "a"));
        assertThatExceptionOfType(UnsupportedOperationException.class)
            .isThrownBy(() -> group.components().add(Attr.clazz("c")));
    }
}
