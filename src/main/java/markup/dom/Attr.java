// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package markup.dom;

import org.jetbrains.annotations.NotNull;

/**
 * An element component that sets or extends an attribute.
 * <p>
 * Attribute names are converted to ASCII lowercase when applied to an element that's not
 * {@link ElementKind#FOREIGN}.
 */
public abstract sealed class Attr implements ElementComponent {
    private Attr(final @NotNull String name, final @NotNull String value) {
        this.name = name;
        this.value = value;
    }

    /**
     * Returns a component that sets the given attribute, replacing the previous value.
     */
    public static @NotNull Set set(final @NotNull String name, final @NotNull String value) {
        return new Set(name, value);
    }

    /**
     * Returns a component that sets the given attribute to the decimal representation of the given integer.
     */
    public static @NotNull Set set(final @NotNull String name, final long value) {
        return new Set(name, Long.toString(value));
    }

    /**
     * Returns a component that sets the given boolean attribute, that is, an attribute with an empty value.
     * <p>
     * Boolean attributes are serialized without a value.
     */
    public static @NotNull Set yes(final @NotNull String name) {
        return new Set(name, "");
    }

    /**
     * Returns a component that appends a value to the given attribute, using the given separator if the attribute
     * already has a non-empty value.
     */
    public static @NotNull Append append(
        final @NotNull String name,
        final @NotNull String value,
        final @NotNull String separator
    ) {
        return new Append(name, value, separator);
    }

    /**
     * Returns a component that sets the {@code id} attribute.
     */
    public static @NotNull Set id(final @NotNull String id) {
        return set("id", id);
    }

    /**
     * Returns a component that adds a class name to the {@code class} attribute.
     */
    public static @NotNull Append clazz(final @NotNull String className) {
        return append("class", className, " ");
    }

    /**
     * Returns a component that adds a declaration to the {@code style} attribute.
     */
    public static @NotNull Append style(final @NotNull String declaration) {
        return append("style", declaration, "; ");
    }

    /**
     * Returns a component that sets the custom data attribute {@code data-name}.
     */
    public static @NotNull Set data(final @NotNull String name, final @NotNull String value) {
        return set("data-" + name, value);
    }

    /**
     * Retrieves the name of the attribute this component affects.
     */
    public final @NotNull String name() {
        return name;
    }

    /**
     * Retrieves the value this component sets or appends.
     */
    public final @NotNull String value() {
        return value;
    }

    private final @NotNull String name;
    private final @NotNull String value;

    /**
     * An attribute component replacing the previous value.
     */
    public static final class Set extends Attr {
        private Set(final @NotNull String name, final @NotNull String value) {
            super(name, value);
        }

        @Override
        public void appendTo(final @NotNull Element.Builder builder) {
            builder.attribute(name(), value());
        }
    }

    /**
     * An attribute component appending to the previous value.
     */
    public static final class Append extends Attr {
        private Append(final @NotNull String name, final @NotNull String value, final @NotNull String separator) {
            super(name, value);
            this.separator = separator;
        }

        /**
         * Retrieves the separator placed between the previous value and the appended one.
         */
        public @NotNull String separator() {
            return separator;
        }

        @Override
        public void appendTo(final @NotNull Element.Builder builder) {
            builder.appendAttribute(name(), value(), separator);
        }

        private final @NotNull String separator;
    }
}
