package org.springaicommunity.github.reporter;

import org.jspecify.annotations.Nullable;

/**
 * The signature embedded in every report body.
 *
 * <p>
 * A comment is a report of a given reporter identity if and only if its body contains
 * {@link #marker(String)} for that identity, compared as an exact, case-sensitive
 * substring. The closing {@code -->} keeps {@code danger} from matching a report of
 * {@code danger2}. This string is the on-wire format shared by every run, so changing it
 * orphans previously posted reports: bump {@link #VERSION} only together with a
 * migration.
 */
public final class ReportSignature {

	public static final String VERSION = "v1";

	private ReportSignature() {
	}

	public static String marker(String dangerId) {
		return "<!-- github-reporter:" + VERSION + " generated_by_" + dangerId + " -->";
	}

	public static boolean isGeneratedBy(@Nullable String body, String dangerId) {
		return body != null && body.contains(marker(dangerId));
	}

}
