package de.komoot.demtiles.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the dense fractional progress callbacks of the engine into a log line every 5 percent.
 * Create one relay per engine operation.
 */
public class ProgressRelay implements ProgressListener {
	private static final Logger logger = LoggerFactory.getLogger(ProgressRelay.class);
	private static final int STEP = 5;

	private final String operation;
	private int lastPercent;

	public ProgressRelay(String operation) {
		this.operation = operation;
		this.lastPercent = -1;
	}

	@Override
	public boolean onProgress(double complete, String message) {
		int percent = (int) (complete * 100);
		if(percent > lastPercent) {
			lastPercent = percent;
			if(percent % STEP == 0) {
				logger.info("{} progress: {}%", operation, percent);
			}
		}
		return true;
	}

	/**
	 * @return the highest whole percentage seen so far, -1 before the first callback
	 */
	public int getLastPercent() {
		return lastPercent;
	}
}
