// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package markup.dom;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.Unmodifiable;

/**
 * An exception type indicating that a tree could not be serialized into HTML.
 * <p>
 * Besides the {@link RenderError} describing what went wrong, the exception records the path from the node being
 * serialized to the offending node, so that the problem can be found without walking the tree again.
 */
public final class RenderException extends Exception {
    RenderException(final @NotNull RenderError error) {
        super(null, (error instanceof RenderError.Format format) ? format.exception() : null);
        this.error = error;
    }

    /**
     * Retrieves the reason serialization failed.
     */
    public @NotNull RenderError error() {
        return error;
    }

    /**
     * Retrieves the path to the offending node, starting at the outermost node.
     * <p>
     * Each segment is the index of a child within its parent, so an empty list means the error was found in the node
     * serialization was started from.
     */
    public @NotNull @Unmodifiable List<PathSegment> pathSegments() {
        final var segments = new ArrayList<>(reversePath);
        Collections.reverse(segments);
        return Collections.unmodifiableList(segments);
    }

    /**
     * Returns a user-readable path to the offending node, starting at the outermost node.
     * <p>
     * The path consists of segments of the form {@code /index(tagname)} for element children, and {@code /index} for
     * other content, for example {@code /1(input)/0}. If the error was found in the node serialization was started
     * from, the path is {@code /}.
     */
    public @NotNull String path() {
        if (reversePath.isEmpty()) {
            return "/";
        }
        final var builder = new StringBuilder();
        for (int i = reversePath.size() - 1; i >= 0; i -= 1) {
            builder.append(reversePath.get(i));
        }
        return builder.toString();
    }

    @Override
    public @NotNull String getMessage() {
        return "Render error at " + path() + ": " + error.describe();
    }

    /**
     * Records that this error occurred while serializing the child at the given index, and returns this exception.
     */
    @NotNull RenderException at(final int index, final @NotNull Content child) {
        final var tagName = (child instanceof Element element) ? element.name() : null;
        reversePath.add(new PathSegment(index, tagName));
        return this;
    }

    private static final long serialVersionUID = 1L;

    private final @NotNull RenderError error;
    private final @NotNull ArrayList<PathSegment> reversePath = new ArrayList<>();

    /**
     * A single step on the path to the offending node: the index of a child, and its tag name if it's an element.
     */
    public record PathSegment(int index, @Nullable String tagName) implements Serializable {
        @Override
        public @NotNull String toString() {
            return (tagName == null) ? ("/" + index) : ("/" + index + '(' + tagName + ')');
        }
    }
}
