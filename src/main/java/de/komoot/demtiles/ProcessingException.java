package de.komoot.demtiles;

/**
 * The requested processing can not be carried out, e.g. an unknown terrain derivative or a vector export of
 * continuous data.
 */
public class ProcessingException extends PipelineException {

	public ProcessingException(String message) {
		super(message);
	}
}
