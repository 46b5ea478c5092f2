package org.springaicommunity.github.reporter;

/**
 * Counts with a correctly pluralized noun: "0 errors", "1 error", "2 errors".
 */
public final class Pluralizer {

	private Pluralizer() {
	}

	public static String pluralize(int count, String noun) {
		return count + " " + (count == 1 ? noun : noun + "s");
	}

}
