package de.komoot.demtiles.mask;

import de.komoot.demtiles.config.MaskSettings;
import de.komoot.demtiles.engine.PixelType;
import de.komoot.demtiles.engine.RasterDataset;
import de.komoot.demtiles.engine.RasterGrid;
import de.komoot.demtiles.terrain.TerrainProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Decides between continuous and binary output. Without thresholds the terrain product is passed through as a
 * float grid with nodata {@value TerrainProcessor#NODATA}. With thresholds every cell becomes 1 if it lies
 * within {@code [min, max]} and is not nodata, 0 otherwise; the binary grid uses 0 as nodata, so "no data" and
 * "outside the mask" can not be told apart afterwards.
 */
public class MaskEvaluator {
	private static final Logger logger = LoggerFactory.getLogger(MaskEvaluator.class);
	public static final double MASK_NODATA = 0;

	/**
	 * Reads band 1 of the processed raster and applies the mask.
	 * @param processed the terrain product
	 * @param mask thresholds or null for continuous output
	 */
	public RasterGrid evaluate(@Nonnull RasterDataset processed, @Nullable MaskSettings mask) {
		double[] data = processed.readBand(1);
		if(mask == null || mask.isEmpty()) {
			logger.info("No mask detected. Generating continuous float output.");
		} else {
			logger.info("Mask detected. Generating binary output (Thresholds: {})", mask);
		}
		return apply(data, processed.getWidth(), processed.getHeight(), mask);
	}

	/**
	 * @param data terrain product, row major
	 * @param mask thresholds or null
	 * @return a FLOAT32 grid sharing {@code data} if there is no mask, a new BYTE grid of 0/1 otherwise
	 */
	public static RasterGrid apply(@Nonnull double[] data, int width, int height, @Nullable MaskSettings mask) {
		if(mask == null || mask.isEmpty()) {
			return new RasterGrid(width, height, data, PixelType.FLOAT32, TerrainProcessor.NODATA);
		}
		Double min = mask.getMin();
		Double max = mask.getMax();
		double[] binary = new double[data.length];
		for(int i = 0; i < data.length; i++) {
			double v = data[i];
			boolean condition = true;
			if(min != null) {
				condition &= v >= min;
			}
			if(max != null) {
				condition &= v <= max;
			}
			binary[i] = condition && v != TerrainProcessor.NODATA ? 1 : 0;
		}
		return new RasterGrid(width, height, binary, PixelType.BYTE, MASK_NODATA);
	}
}
