package org.springaicommunity.github.reporter;

import org.jspecify.annotations.Nullable;

/**
 * Result of creating or updating a comment.
 *
 * @param id the comment id
 * @param htmlUrl the web URL of the comment (null if not returned)
 */
public record CommentResult(long id, @Nullable String htmlUrl) {
}
