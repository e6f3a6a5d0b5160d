package de.komoot.demtiles;

/**
 * The raster engine ran out of a local resource (disk space, memory, write access). Never retried.
 */
public class ResourceException extends PipelineException {

	public ResourceException(String message, Throwable cause) {
		super(message, cause);
	}
}
