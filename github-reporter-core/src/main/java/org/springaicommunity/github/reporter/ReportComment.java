package org.springaicommunity.github.reporter;

/**
 * A comment on the issue behind a pull request.
 *
 * <p>
 * Whether the comment is a report posted by this bot is decided from its body alone, see
 * {@link ReportSignature}.
 *
 * @param id the comment id
 * @param author the user who posted the comment
 * @param body the comment text
 */
public record ReportComment(long id, Author author, String body) {
}
