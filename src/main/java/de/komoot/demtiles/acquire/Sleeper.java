package de.komoot.demtiles.acquire;

import java.time.Duration;

/**
 * Blocks the calling thread between retry attempts.
 */
public interface Sleeper {
	Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

	void sleep(Duration duration) throws InterruptedException;
}
