package org.springaicommunity.github.reporter;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code > danger: ignore "<text>"} directives from a pull request description.
 *
 * <p>
 * Matching is case-insensitive and tolerates any whitespace around {@code :} and
 * {@code ignore}. Tokens are returned in the order they appear, duplicates included, and
 * are not validated.
 */
public class IgnoreDirectiveScanner {

	private static final Pattern IGNORE_DIRECTIVE = Pattern.compile(">\\s*danger\\s*:\\s*ignore\\s*\"(.*)\"",
			Pattern.CASE_INSENSITIVE);

	public IgnoreSet scan(@Nullable String description) {
		if (description == null || description.isEmpty()) {
			return IgnoreSet.empty();
		}
		List<String> tokens = new ArrayList<>();
		Matcher matcher = IGNORE_DIRECTIVE.matcher(description);
		while (matcher.find()) {
			tokens.add(matcher.group(1));
		}
		return new IgnoreSet(tokens);
	}

}
