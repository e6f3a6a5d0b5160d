package de.komoot.demtiles.engine;

/**
 * Sample types written by the pipeline.
 */
public enum PixelType {
	/** unsigned 8 bit, used for binary masks */
	BYTE,
	/** 32 bit IEEE float, used for elevation and continuous terrain products */
	FLOAT32
}
