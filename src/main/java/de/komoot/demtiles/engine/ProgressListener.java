package de.komoot.demtiles.engine;

/**
 * Receives progress of long running engine operations.
 */
public interface ProgressListener {

	/**
	 * @param complete fraction done, 0.0 to 1.0
	 * @param message optional engine message, may be null
	 * @return true to continue, false to ask the engine to stop
	 */
	boolean onProgress(double complete, String message);
}
