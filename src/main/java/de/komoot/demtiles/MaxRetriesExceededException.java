package de.komoot.demtiles;

/**
 * Thrown when tile acquisition kept failing with network errors until the attempt limit was reached.
 */
public class MaxRetriesExceededException extends PipelineException {
	private final int attempts;

	public MaxRetriesExceededException(int attempts, Throwable lastFailure) {
		super("Giving up after " + attempts + " attempts, check your internet connection: " + lastFailure.getMessage(), lastFailure);
		this.attempts = attempts;
	}

	public int getAttempts() {
		return attempts;
	}
}
