package de.komoot.demtiles;

public class PipelineCancelledException extends PipelineException {

	public PipelineCancelledException(String message) {
		super(message);
	}
}
