package de.komoot.demtiles.engine;

import de.komoot.demtiles.PipelineException;

/**
 * Failure reported by a {@link RasterEngine}. Carries the engine's structured error number where one was
 * available so callers can classify the failure without parsing the message.
 */
public class RasterEngineException extends PipelineException {
	public static final int NO_ERROR_NUMBER = -1;

	private final int errorNumber;

	public RasterEngineException(String message) {
		this(message, NO_ERROR_NUMBER, null);
	}

	public RasterEngineException(String message, int errorNumber, Throwable cause) {
		super(message, cause);
		this.errorNumber = errorNumber;
	}

	/**
	 * @return the engine error number or {@link #NO_ERROR_NUMBER}
	 */
	public int getErrorNumber() {
		return errorNumber;
	}

	public boolean hasErrorNumber() {
		return errorNumber > 0;
	}
}
