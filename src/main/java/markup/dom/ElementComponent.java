// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package markup.dom;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;

/**
 * Something that can be added to an element under construction: a child, an attribute, or a group of those.
 * <p>
 * Components are applied in order, so the order of children within a group is preserved.
 */
@FunctionalInterface
public interface ElementComponent {
    /**
     * Adds this component to the given element builder.
     */
    void appendTo(@NotNull Element.Builder builder);

    /**
     * Returns a component that adds nothing.
     */
    static @NotNull ElementComponent empty() {
        return Empty.instance;
    }

    /**
     * Returns a component that adds all the given components, in order.
     */
    static @NotNull ElementComponent of(final @NotNull ElementComponent... components) {
        return new Group(List.of(components));
    }

    /**
     * Returns a component that adds all components of the given iterable, in iteration order.
     */
    static @NotNull ElementComponent ofAll(final @NotNull Iterable<? extends ElementComponent> components) {
        final var list = new ArrayList<ElementComponent>();
        components.forEach(list::add);
        return new Group(list);
    }

    /**
     * Returns a component that adds the given component if present, and nothing otherwise.
     */
    static @NotNull ElementComponent optional(final @NotNull Optional<? extends ElementComponent> component) {
        return component.isPresent() ? component.get() : Empty.instance;
    }

    final class Empty implements ElementComponent {
        private Empty() {
        }

        @Override
        public void appendTo(final @NotNull Element.Builder builder) {
            // Intentionally adds nothing.
        }

        private static final Empty instance = new Empty();
    }

    record Group(@NotNull List<ElementComponent> components) implements ElementComponent {
        public Group {
            components = List.copyOf(components);
        }

        @Override
        public void appendTo(final @NotNull Element.Builder builder) {
            for (final var component : components) {
                component.appendTo(builder);
            }
        }
    }
}
