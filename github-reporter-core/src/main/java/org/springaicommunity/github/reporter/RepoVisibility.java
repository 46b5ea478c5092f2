package org.springaicommunity.github.reporter;

/**
 * Visibility of the repository a pull request targets.
 */
public enum RepoVisibility {

	PUBLIC, PRIVATE;

	public static RepoVisibility fromPrivateFlag(boolean isPrivate) {
		return isPrivate ? PRIVATE : PUBLIC;
	}

}
