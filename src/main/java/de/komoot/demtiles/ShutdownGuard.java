package de.komoot.demtiles;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shutdown hook body. Cancels a run that has not finished yet and waits for the worker thread to wind down.
 */
class ShutdownGuard implements Runnable {
	private static final Logger logger = LoggerFactory.getLogger(ShutdownGuard.class);

	private final CancellationToken cancellation;
	private final Thread worker;
	private final long graceMillis;
	private final AtomicBoolean finished = new AtomicBoolean(false);

	ShutdownGuard(CancellationToken cancellation, Thread worker, long graceMillis) {
		this.cancellation = cancellation;
		this.worker = worker;
		this.graceMillis = graceMillis;
	}

	/**
	 * Marks the run as done, a later shutdown leaves the worker alone.
	 */
	void finish() {
		finished.set(true);
	}

	@Override
	public void run() {
		if(finished.get()) {
			return;
		}
		logger.warn("Intercepted interrupt, cancelling run...");
		cancellation.cancel();
		worker.interrupt();
		try {
			worker.join(graceMillis);
		} catch(InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}
}
