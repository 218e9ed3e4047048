// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package markup.test;

import java.util.stream.LongStream;
import markup.dom.Attr;
import markup.dom.Content;
import markup.dom.RenderException;
import markup.dom.html.HtmlTag;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

final class EscapingPropertyTest {
    static LongStream provideSeeds() {
        return RandomUtils.provideSeeds();
    }

    @ParameterizedTest
    @MethodSource("provideSeeds")
    void escapedTextDecodesToOriginal(final long seed) throws RenderException {
        final var random = RandomUtils.createGenerator(seed);
        for (int i = 0; i < iterations; i += 1) {
            final var text = RandomUtils.generateMarkupyString(random, maxLength);
            final var rendered = Content.text(text).renderToString();
            assertThat(rendered).as("seed %d", seed).doesNotContain("<", ">");
            assertThat(decodeText(rendered)).as("seed %d", seed).isEqualTo(text);
        }
    }

    @ParameterizedTest
    @MethodSource("provideSeeds")
    void escapedAttributeValueStaysQuoted(final long seed) throws RenderException {
        final var random = RandomUtils.createGenerator(seed);
        final var prefix = "<span title=\"";
        final var suffix = "\"></span>";
        for (int i = 0; i < iterations; i += 1) {
            final var value = RandomUtils.generateMarkupyString(random, maxLength);
            final var rendered = HtmlTag.SPAN.of(Attr.set("title", value)).renderToString();
            final var expectedValue = value.isEmpty() ? null : value.replace("\"", "&quot;");
            if (expectedValue == null) {
                assertThat(rendered).isEqualTo("<span title></span>");
            } else {
                assertThat(rendered).as("seed %d", seed).startsWith(prefix).endsWith(suffix);
                final var quoted = rendered.substring(prefix.length(), rendered.length() - suffix.length());
                assertThat(quoted).as("seed %d", seed).doesNotContain("\"").isEqualTo(expectedValue);
            }
        }
    }

    @ParameterizedTest
    @MethodSource("provideSeeds")
    void commentNeverEndsEarly(final long seed) throws RenderException {
        final var random = RandomUtils.createGenerator(seed);
        for (int i = 0; i < iterations; i += 1) {
            final var text = RandomUtils.generateMarkupyString(random, maxLength);
            final var rendered = Content.comment(text).renderToString();
            assertThat(rendered).startsWith("<!--").endsWith("-->");
            final var body = rendered.substring(4, rendered.length() - 3);
            assertThat(body).as("seed %d", seed)
                .doesNotStartWith(">")
                .doesNotStartWith("->")
                .doesNotContain("<!--", "-->", "--!>")
                .doesNotEndWith("<!-");
        }
    }

    private static String decodeText(final String escaped) {
        final var builder = new StringBuilder(escaped.length());
        int i = 0;
        while (i < escaped.length()) {
            if (escaped.startsWith("&lt;", i)) {
                builder.append('<');
                i += 4;
            } else if (escaped.startsWith("&gt;", i)) {
                builder.append('>');
                i += 4;
            } else if (escaped.startsWith("&amp;", i)) {
                builder.append('&');
                i += 5;
            } else {
                assertThat(escaped.charAt(i)).isNotEqualTo('&');
                builder.append(escaped.charAt(i));
                i += 1;
            }
        }
        return builder.toString();
    }

    private static final int iterations = 500;
    private static final int maxLength = 40;
}
