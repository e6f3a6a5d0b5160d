package de.komoot.demtiles.terrain;

import de.komoot.demtiles.ProcessingException;

import java.util.Locale;

/**
 * Terrain derivatives the pipeline can compute, with their engine names.
 */
public enum TerrainProcess {
	HILLSHADE("hillshade"),
	SLOPE("slope"),
	ASPECT("aspect"),
	TRI("TRI"),
	TPI("TPI"),
	ROUGHNESS("roughness");

	private final String engineName;

	TerrainProcess(String engineName) {
		this.engineName = engineName;
	}

	public String getEngineName() {
		return engineName;
	}

	/**
	 * @param name derivative name, case insensitive
	 * @throws ProcessingException for unknown derivatives and for ones that need extra input (color-relief)
	 */
	public static TerrainProcess fromName(String name) {
		if(name != null) {
			for(TerrainProcess p : values()) {
				if(p.engineName.equalsIgnoreCase(name.trim())) {
					return p;
				}
			}
		}
		throw new ProcessingException(String.format(Locale.US, "Unsupported terrain process '%s', expected one of hillshade, slope, aspect, TRI, TPI, roughness", name));
	}
}
