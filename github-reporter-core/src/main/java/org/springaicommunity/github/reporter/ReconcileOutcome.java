package org.springaicommunity.github.reporter;

import org.jspecify.annotations.Nullable;

/**
 * Result of reconciling the report comment.
 *
 * @param action the action taken
 * @param commentId id of the report comment left standing (null after delete/no-op)
 * @param detailsUrl web URL of the report comment left standing (null after
 * delete/no-op)
 */
public record ReconcileOutcome(ReconcileAction action, @Nullable Long commentId, @Nullable String detailsUrl) {

	public static ReconcileOutcome noOp() {
		return new ReconcileOutcome(ReconcileAction.NO_OP, null, null);
	}

	public static ReconcileOutcome deleted() {
		return new ReconcileOutcome(ReconcileAction.DELETED, null, null);
	}

	public static ReconcileOutcome created(CommentResult comment) {
		return new ReconcileOutcome(ReconcileAction.CREATED, comment.id(), comment.htmlUrl());
	}

	public static ReconcileOutcome updated(CommentResult comment) {
		return new ReconcileOutcome(ReconcileAction.UPDATED, comment.id(), comment.htmlUrl());
	}

}
