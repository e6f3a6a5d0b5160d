package de.komoot.demtiles;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative abort flag shared between the pipeline thread and whoever wants to stop it (usually the JVM
 * shutdown hook installed by {@link Main}). The pipeline polls it between stages.
 */
public class CancellationToken {
	private final AtomicBoolean cancelled = new AtomicBoolean(false);

	public void cancel() {
		cancelled.set(true);
	}

	public boolean isCancelled() {
		return cancelled.get();
	}

	/**
	 * @param checkpoint name of the step about to start, used in the exception message
	 * @throws PipelineCancelledException if {@link #cancel()} has been called
	 */
	public void throwIfCancelled(String checkpoint) {
		if(cancelled.get()) {
			throw new PipelineCancelledException("Run cancelled before " + checkpoint);
		}
	}
}
