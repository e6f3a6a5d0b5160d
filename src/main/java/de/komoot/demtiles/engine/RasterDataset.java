package de.komoot.demtiles.engine;

import javax.annotation.Nonnull;

/**
 * Read handle on a raster owned by a {@link RasterEngine}.
 */
public interface RasterDataset extends AutoCloseable {

	int getWidth();

	int getHeight();

	int getBandCount();

	/**
	 * @return projection and affine transform of this dataset
	 */
	@Nonnull
	Georeference getGeoreference();

	/**
	 * Reads a whole band.
	 * @param band 1-based band index
	 * @return the samples in row major order, {@code width * height} values
	 * @throws IllegalArgumentException if the band does not exist
	 */
	@Nonnull
	double[] readBand(int band);

	/**
	 * Releases the underlying engine resources, never throws.
	 */
	@Override
	void close();
}
