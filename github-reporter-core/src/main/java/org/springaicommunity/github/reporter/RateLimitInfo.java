package org.springaicommunity.github.reporter;

import java.time.Instant;

/**
 * Rate limit headers of the most recent GitHub API response.
 *
 * <p>
 * A publish run makes a handful of calls, so the budget only matters when a token is
 * shared with other jobs; the HTTP client logs it and uses it to tell rate limiting apart
 * from missing write access on a {@code 403}.
 *
 * @param limit the maximum number of requests allowed per hour
 * @param remaining the number of requests remaining in the current window
 * @param reset the time when the rate limit resets (epoch seconds)
 * @param used the number of requests used in the current window
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used) {

	static final int LOW_WATERMARK = 100;

	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	public boolean isExceeded() {
		return remaining == 0;
	}

	/**
	 * Returns true when fewer than {@value #LOW_WATERMARK} requests are left.
	 * @return true if the remaining budget is low
	 */
	public boolean isLow() {
		return remaining < LOW_WATERMARK;
	}

}
