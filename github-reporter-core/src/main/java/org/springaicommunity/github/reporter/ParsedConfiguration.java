package org.springaicommunity.github.reporter;

import org.jspecify.annotations.Nullable;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Target pull request
	public @Nullable String repository;

	public int pullRequestId = -1;

	// Input
	public @Nullable String findingsFile;

	// Reporter identity and status
	public String dangerId;

	public String statusContext;

	public boolean applyIgnoreDirectives;

	// Mode flags
	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(ReporterProperties defaultProperties) {
		this.dangerId = defaultProperties.getDangerId();
		this.statusContext = defaultProperties.getStatusContext();
		this.applyIgnoreDirectives = defaultProperties.isApplyIgnoreDirectives();
	}

	/**
	 * Copy the parsed options onto reporter properties.
	 * @param properties properties to update
	 * @return the same properties
	 */
	public ReporterProperties applyTo(ReporterProperties properties) {
		properties.setDangerId(dangerId);
		properties.setStatusContext(statusContext);
		properties.setApplyIgnoreDirectives(applyIgnoreDirectives);
		return properties;
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "repository='" + repository + '\'' + ", pullRequestId=" + pullRequestId
				+ ", findingsFile='" + findingsFile + '\'' + ", dangerId='" + dangerId + '\'' + ", statusContext='"
				+ statusContext + '\'' + ", applyIgnoreDirectives=" + applyIgnoreDirectives + ", verbose=" + verbose
				+ ", helpRequested=" + helpRequested + '}';
	}

}
