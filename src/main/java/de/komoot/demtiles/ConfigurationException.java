package de.komoot.demtiles;

/**
 * A required configuration field is missing or has an invalid value.
 */
public class ConfigurationException extends PipelineException {

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
