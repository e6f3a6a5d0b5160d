package de.komoot.demtiles;

/**
 * The steps of a run, in execution order.
 */
public enum PipelineStage {
	DESCRIBE_SOURCE("Writing tile source descriptor"),
	ACQUIRE("Fetching tiles"),
	DECODE("Decoding RGB bands into metric elevation data"),
	PROCESS("Running terrain analysis"),
	MASK("Evaluating mask"),
	EXPORT("Exporting result");

	private final String description;

	PipelineStage(String description) {
		this.description = description;
	}

	public String getDescription() {
		return description;
	}
}
