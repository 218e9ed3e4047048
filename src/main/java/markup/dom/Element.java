// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package markup.dom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.Unmodifiable;

/**
 * An HTML element, with a name, a kind, attributes, and children.
 * <p>
 * Elements are immutable: methods that "modify" an element return a new one instead. Since children can only be
 * attached to an element under construction, an element can never be its own ancestor.
 * <p>
 * Unless the element is {@link ElementKind#FOREIGN}, its name and the names of its attributes are converted to ASCII
 * lowercase when the element is constructed.
 */
public final class Element implements Content {
    private Element(
        final @NotNull String name,
        final @NotNull ElementKind kind,
        final @NotNull SortedMap<String, String> attributes,
        final @NotNull List<Content> children
    ) {
        this.name = name;
        this.kind = kind;
        this.attributes = attributes;
        this.children = children;
    }

    /**
     * Returns a new element with the given name and kind, and no attributes nor children.
     */
    public static @NotNull Element of(final @NotNull String name, final @NotNull ElementKind kind) {
        return builder(name, kind).build();
    }

    /**
     * Returns a new {@link ElementKind#NORMAL} element with the given name, and no attributes nor children.
     */
    public static @NotNull Element normal(final @NotNull String name) {
        return of(name, ElementKind.NORMAL);
    }

    /**
     * Returns a new builder for an element with the given name and kind.
     */
    public static @NotNull Builder builder(final @NotNull String name, final @NotNull ElementKind kind) {
        return new Builder(normalizeName(name, kind), kind, new TreeMap<>(), new ArrayList<>());
    }

    /**
     * Retrieves the name of this element.
     */
    public @NotNull String name() {
        return name;
    }

    /**
     * Retrieves the kind of this element.
     */
    public @NotNull ElementKind kind() {
        return kind;
    }

    /**
     * Retrieves the attributes of this element, ordered by name.
     */
    public @NotNull @Unmodifiable SortedMap<String, String> attributes() {
        return attributes;
    }

    /**
     * Retrieves the children of this element, in document order.
     */
    public @NotNull @Unmodifiable List<Content> children() {
        return children;
    }

    /**
     * Returns a new element with the given components added to a copy of this one.
     */
    @CheckReturnValue
    public @NotNull Element with(final @NotNull ElementComponent... components) {
        return toBuilder().with(components).build();
    }

    /**
     * Returns a new element with the given attribute set, replacing the previous value if there was one.
     */
    @CheckReturnValue
    public @NotNull Element withAttribute(final @NotNull String name, final @NotNull String value) {
        return toBuilder().attribute(name, value).build();
    }

    /**
     * Returns a new element with the given content appended as the last child.
     */
    @CheckReturnValue
    public @NotNull Element withChild(final @NotNull Content child) {
        return toBuilder().child(child).build();
    }

    /**
     * Returns a new builder initialized with the name, kind, attributes and children of this element.
     */
    public @NotNull Builder toBuilder() {
        return new Builder(name, kind, new TreeMap<>(attributes), new ArrayList<>(children));
    }

    /**
     * Returns a new document with this element as the root.
     */
    public @NotNull Document toDocument() {
        return new Document(this);
    }

    @Override
    public boolean equals(final @Nullable Object object) {
        return object instanceof Element other
            && name.equals(other.name)
            && kind == other.kind
            && attributes.equals(other.attributes)
            && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind, attributes, children);
    }

    @Override
    public @NotNull String toString() {
        return "Element[name=" + name + ", kind=" + kind + ", attributes=" + attributes + ", children=" + children
            + ']';
    }

    private static @NotNull String normalizeName(final @NotNull String name, final @NotNull ElementKind kind) {
        return (kind == ElementKind.FOREIGN) ? name : Ascii.toLowerCase(name);
    }

    private final @NotNull String name;
    private final @NotNull ElementKind kind;
    private final @NotNull @Unmodifiable SortedMap<String, String> attributes;
    private final @NotNull @Unmodifiable List<Content> children;

    /**
     * A mutable builder of {@link Element}s.
     * <p>
     * Builders are not thread-safe. The elements they build are.
     */
    public static final class Builder {
        private Builder(
            final @NotNull String name,
            final @NotNull ElementKind kind,
            final @NotNull TreeMap<String, String> attributes,
            final @NotNull ArrayList<Content> children
        ) {
            this.name = name;
            this.kind = kind;
            this.attributes = attributes;
            this.children = children;
        }

        /**
         * Retrieves the name of the element being built.
         */
        public @NotNull String name() {
            return name;
        }

        /**
         * Retrieves the kind of the element being built.
         */
        public @NotNull ElementKind kind() {
            return kind;
        }

        /**
         * Sets the given attribute, replacing the previous value if there was one.
         */
        public @NotNull Builder attribute(final @NotNull String name, final @NotNull String value) {
            attributes.put(normalizeName(name, kind), value);
            return this;
        }

        /**
         * Appends the given value to the given attribute, separated from the previous value by {@code separator}.
         * <p>
         * If the attribute is not present yet, or its value is empty, it's set to {@code value} instead.
         */
        public @NotNull Builder appendAttribute(
            final @NotNull String name,
            final @NotNull String value,
            final @NotNull String separator
        ) {
            attributes.merge(
                normalizeName(name, kind),
                value,
                (previous, appended) -> previous.isEmpty() ? appended : previous + separator + appended
            );
            return this;
        }

        /**
         * Appends the given content as the last child.
         */
        public @NotNull Builder child(final @NotNull Content child) {
            children.add(child);
            return this;
        }

        /**
         * Adds the given components, in order.
         */
        public @NotNull Builder with(final @NotNull ElementComponent... components) {
            for (final var component : components) {
                component.appendTo(this);
            }
            return this;
        }

        /**
         * Builds a new element with the current state of this builder.
         * <p>
         * The builder can still be used afterwards; further changes don't affect the returned element.
         */
        public @NotNull Element build() {
            return new Element(
                name,
                kind,
                Collections.unmodifiableSortedMap(new TreeMap<>(attributes)),
                List.copyOf(children)
            );
        }

        private final @NotNull String name;
        private final @NotNull ElementKind kind;
        private final @NotNull TreeMap<String, String> attributes;
        private final @NotNull ArrayList<Content> children;
    }
}
