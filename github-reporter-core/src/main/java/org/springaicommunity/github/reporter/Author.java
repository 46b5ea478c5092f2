package org.springaicommunity.github.reporter;

import org.jspecify.annotations.Nullable;

/**
 * Represents a GitHub user (author of a comment).
 *
 * @param login the GitHub username (unique identifier, never null)
 * @param name the user's display name (may be null if not returned by the API)
 */
public record Author(String login, @Nullable String name) {
}
