package de.komoot.demtiles.acquire;

import java.time.Duration;

/**
 * Bounded retry with a fixed delay between attempts.
 */
public final class RetryPolicy {
	public static final RetryPolicy DEFAULT = new RetryPolicy(5, Duration.ofSeconds(10));

	private final int maxAttempts;
	private final Duration delay;

	public RetryPolicy(int maxAttempts, Duration delay) {
		if(maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be at least 1 but was " + maxAttempts);
		}
		this.maxAttempts = maxAttempts;
		this.delay = delay;
	}

	public int getMaxAttempts() {
		return maxAttempts;
	}

	public Duration getDelay() {
		return delay;
	}
}
