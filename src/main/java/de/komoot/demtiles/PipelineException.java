package de.komoot.demtiles;

/**
 * Base class of all failures that terminate a pipeline run.
 */
public class PipelineException extends RuntimeException {

	public PipelineException(String message) {
		super(message);
	}

	public PipelineException(String message, Throwable cause) {
		super(message, cause);
	}
}
