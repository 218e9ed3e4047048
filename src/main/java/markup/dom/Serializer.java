// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package markup.dom;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import markup.util.UnreachableCodeReachedError;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The tree-to-HTML serializer.
 * <p>
 * Serialization validates tag and attribute names and enforces the content model of each {@link ElementKind}, so that
 * the output is parsed by a standards-compliant HTML parser into the same tree. Invalid trees are rejected with
 * a {@link RenderException} pointing at the offending node.
 * <p>
 * Serialization never modifies the tree, so the same tree can be serialized by several threads at once.
 */
public final class Serializer {
    private Serializer(final @NotNull Appendable sink) {
        this.sink = sink;
    }

    /**
     * Serializes the given node to HTML, appending the output to the given sink.
     * <p>
     * Any {@link IOException}s thrown by the sink are wrapped in a {@link RenderException} with a
     * {@link RenderError.Format} error. On failure, the output appended so far is incomplete.
     */
    public static void serialize(final @NotNull Appendable sink, final @NotNull Renderable node)
        throws RenderException {
        final var serializer = new Serializer(sink);
        serializer.serializeNode(node);
    }

    /**
     * Serializes the given node to a string of HTML.
     */
    public static @NotNull String serializeToString(final @NotNull Renderable node) throws RenderException {
        final var builder = new StringBuilder();
        serialize(builder, node);
        return builder.toString();
    }

    private void serializeNode(final @NotNull Renderable node) throws RenderException {
        if (node instanceof Document document) {
            serializeContent(Content.doctype());
            serializeElement(document.root());
        } else if (node instanceof Content content) {
            serializeContent(content);
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private void serializeContent(final @NotNull Content content) throws RenderException {
        if (content instanceof Content.Raw raw) {
            write(raw.text());
        } else if (content instanceof Content.Text text) {
            serializeString(text.text(), TextEscaper.instance);
        } else if (content instanceof Content.Comment comment) {
            serializeComment(comment.text());
        } else if (content instanceof Element element) {
            serializeElement(element);
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private void serializeElement(final @NotNull Element element) throws RenderException {
        final var name = element.name();
        if (!Validator.isValidTagName(name)) {
            throw new RenderException(new RenderError.InvalidTagName(name));
        }
        final var attributes = element.attributes();
        for (final var attributeName : attributes.keySet()) {
            if (!Validator.isValidAttributeName(attributeName)) {
                throw new RenderException(new RenderError.InvalidAttrName(attributeName));
            }
        }

        write('<');
        write(name);
        serializeAttributes(attributes);

        final var kind = element.kind();
        final var children = element.children();
        if (children.isEmpty()) {
            final String emptyClosing = switch (kind) {
                case VOID -> ">";
                case FOREIGN -> " />";
                case RAW_TEXT, ESCAPABLE_RAW_TEXT, TEMPLATE, NORMAL -> "></" + name + '>';
            };
            write(emptyClosing);
            return;
        }
        write('>');

        final var childRule = ChildRule.of(kind);
        final var childCount = children.size();
        for (int i = 0; i < childCount; i += 1) {
            final var child = children.get(i);
            try {
                serializeChild(name, childRule, child);
            } catch (final RenderException e) {
                throw e.at(i, child);
            }
        }

        if (kind != ElementKind.VOID) {
            write("</");
            write(name);
            write('>');
        }
    }

    private void serializeChild(
        final @NotNull String parentName,
        final @NotNull ChildRule rule,
        final @NotNull Content child
    ) throws RenderException {
        switch (rule) {
            case NONE -> throw new RenderException(RenderError.InvalidChild.instance());
            case RAW_TEXT -> serializeRawTextChild(parentName, child);
            case TEXT -> {
                if (child instanceof Content.Raw || child instanceof Content.Text) {
                    serializeContent(child);
                } else {
                    throw new RenderException(RenderError.InvalidChild.instance());
                }
            }
            case ANY -> serializeContent(child);
        }
    }

    private void serializeRawTextChild(final @NotNull String parentName, final @NotNull Content child)
        throws RenderException {
        if (child instanceof Content.Raw raw) {
            write(raw.text());
        } else if (child instanceof Content.Text text) {
            final var string = text.text();
            if (!Validator.isValidRawText(parentName, string)) {
                throw new RenderException(new RenderError.InvalidRawText(string));
            }
            write(string);
        } else {
            throw new RenderException(RenderError.InvalidChild.instance());
        }
    }

    private void serializeAttributes(final @NotNull Map<String, String> attributes) throws RenderException {
        for (final var attribute : attributes.entrySet()) {
            write(' ');
            write(attribute.getKey());
            final var value = attribute.getValue();
            // An empty value is the same as no value at all, so use the shorter form.
            if (!value.isEmpty()) {
                write("=\"");
                serializeString(value, AttributeEscaper.instance);
                write('"');
            }
        }
    }

    private void serializeComment(final @NotNull String text) throws RenderException {
        // A comment must not start with ">" or "->", must not contain "<!--", "-->" or "--!>", and must not end with
        // "<!-". The replacements are lossy, they only need to keep the comment from ending early.
        final var mangled = text
            .replace("<!--", "<!==")
            .replace("-->", "==>")
            .replace("--!>", "==!>");
        write("<!--");
        if (mangled.startsWith(">") || mangled.startsWith("->")) {
            write(' ');
        }
        write(mangled);
        if (mangled.endsWith("<!-")) {
            write(' ');
        }
        write("-->");
    }

    private void serializeString(final @NotNull String string, final @NotNull Escaper escaper)
        throws RenderException {
        int index = 0;
        int indexToEscape;
        while ((indexToEscape = findCharacterToEscape(string, index, escaper)) >= 0) {
            write(string, index, indexToEscape);
            write(Objects.requireNonNull(escaper.escape(string.charAt(indexToEscape))));
            index = indexToEscape + 1;
        }
        if (index < string.length()) {
            write(string, index, string.length());
        }
    }

    private static int findCharacterToEscape(
        final @NotNull String string,
        final int startIndex,
        final @NotNull Escaper escaper
    ) {
        final var length = string.length();
        for (int i = startIndex; i < length; i += 1) {
            if (escaper.escape(string.charAt(i)) != null) {
                return i;
            }
        }
        return -1;
    }

    private void write(final char character) throws RenderException {
        try {
            sink.append(character);
        } catch (final IOException e) {
            throw new RenderException(new RenderError.Format(e));
        }
    }

    private void write(final @NotNull CharSequence string) throws RenderException {
        try {
            sink.append(string);
        } catch (final IOException e) {
            throw new RenderException(new RenderError.Format(e));
        }
    }

    private void write(final @NotNull CharSequence string, final int start, final int end) throws RenderException {
        try {
            sink.append(string, start, end);
        } catch (final IOException e) {
            throw new RenderException(new RenderError.Format(e));
        }
    }

    private final @NotNull Appendable sink;

    private enum ChildRule {
        /**
         * No children are allowed at all.
         */
        NONE,
        /**
         * Raw content and unescaped text that doesn't contain the parent's closing tag are allowed.
         */
        RAW_TEXT,
        /**
         * Raw content and escaped text are allowed.
         */
        TEXT,
        /**
         * Any content is allowed.
         */
        ANY;

        private static @NotNull ChildRule of(final @NotNull ElementKind kind) {
            return switch (kind) {
                case VOID -> NONE;
                case RAW_TEXT -> RAW_TEXT;
                case ESCAPABLE_RAW_TEXT -> TEXT;
                case FOREIGN, TEMPLATE, NORMAL -> ANY;
            };
        }
    }

    private sealed interface Escaper {
        @Nullable String escape(char character);
    }

    private static final class TextEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return switch (character) {
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '&' -> "&amp;";
                default -> null;
            };
        }

        private static final TextEscaper instance = new TextEscaper();
    }

    // Attribute values are always quoted, so only the quote itself needs escaping.
    private static final class AttributeEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return (character == '"') ? "&quot;" : null;
        }

        private static final AttributeEscaper instance = new AttributeEscaper();
    }
}
