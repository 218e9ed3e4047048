// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package markup.util;

/**
 * Error type signifying that control flow reached a point that should be unreachable, such as an instance of
 * a sealed type that none of the branches matched.
 * <p>
 * Since this represents a programming error, this class extends {@link AssertionError}.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    /**
     * Initializes a new error with a generic message.
     */
    public UnreachableCodeReachedError() {
        super("Execution reached a point expected to be unreachable");
    }

    /**
     * Initializes a new error with the given message describing the impossible state.
     */
    public UnreachableCodeReachedError(final String message) {
        super(message);
    }
}
