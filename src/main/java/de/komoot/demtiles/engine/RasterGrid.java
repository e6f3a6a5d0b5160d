package de.komoot.demtiles.engine;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Single band in-memory raster. The sample array is shared, not copied: a grid is produced by one step and
 * handed to the next.
 */
public final class RasterGrid {
	private final int width;
	private final int height;
	private final double[] samples;
	private final PixelType pixelType;
	@Nullable
	private final Double nodata;

	public RasterGrid(int width, int height, @Nonnull double[] samples, @Nonnull PixelType pixelType, @Nullable Double nodata) {
		if(width <= 0 || height <= 0) {
			throw new IllegalArgumentException("Grid size must be positive but was " + width + "x" + height);
		}
		if(samples.length != (long) width * height) {
			throw new IllegalArgumentException("Expected " + ((long) width * height) + " samples for " + width + "x" + height + " but got " + samples.length);
		}
		this.width = width;
		this.height = height;
		this.samples = samples;
		this.pixelType = pixelType;
		this.nodata = nodata;
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public double[] getSamples() {
		return samples;
	}

	public double get(int col, int row) {
		return samples[row * width + col];
	}

	public PixelType getPixelType() {
		return pixelType;
	}

	@Nullable
	public Double getNodata() {
		return nodata;
	}

	/**
	 * @return true for a 0/1 byte grid as produced by the mask evaluator
	 */
	public boolean isBinaryMask() {
		return pixelType == PixelType.BYTE;
	}
}
