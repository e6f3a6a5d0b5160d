package de.komoot.demtiles.decode;

import de.komoot.demtiles.ProcessingException;
import de.komoot.demtiles.engine.PixelType;
import de.komoot.demtiles.engine.RasterDataset;
import de.komoot.demtiles.engine.RasterEngine;
import de.komoot.demtiles.engine.RasterGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.nio.file.Path;

/**
 * Decodes Terrarium encoded RGB rasters into metres: {@code elevation = R * 256 + G + B / 256 - 32768}.
 * Values are neither clamped nor checked; void tiles decode to whatever the tile service encodes for them.
 */
public class TerrariumDecoder {
	private static final Logger logger = LoggerFactory.getLogger(TerrariumDecoder.class);
	public static final String FILE_NAME = "base_elevation.tif";
	private static final double OFFSET = 32768.0;

	private final RasterEngine engine;

	public TerrariumDecoder(RasterEngine engine) {
		this.engine = engine;
	}

	/**
	 * Decodes a single pixel.
	 */
	public static double decode(double r, double g, double b) {
		return (r * 256.0 + g + b / 256.0) - OFFSET;
	}

	/**
	 * Decodes the first three bands of a dataset.
	 * @return a float grid without nodata
	 * @throws ProcessingException if the dataset has less than 3 bands
	 */
	public static RasterGrid decode(@Nonnull RasterDataset rgb) {
		if(rgb.getBandCount() < 3) {
			throw new ProcessingException("Terrarium decoding needs 3 bands but the raster has " + rgb.getBandCount());
		}
		double[] r = rgb.readBand(1);
		double[] g = rgb.readBand(2);
		double[] b = rgb.readBand(3);
		double[] elevation = new double[r.length];
		for(int i = 0; i < elevation.length; i++) {
			elevation[i] = decode(r[i], g[i], b[i]);
		}
		return new RasterGrid(rgb.getWidth(), rgb.getHeight(), elevation, PixelType.FLOAT32, null);
	}

	/**
	 * Decodes the acquired RGB raster and stores the elevation next to it as {@value #FILE_NAME}.
	 * @param rgbRaster the acquired raster
	 * @param cacheDir target directory
	 * @return path of the elevation raster
	 */
	public Path decodeToFile(@Nonnull Path rgbRaster, @Nonnull Path cacheDir) {
		Path target = cacheDir.resolve(FILE_NAME);
		try(RasterDataset rgb = engine.open(rgbRaster)) {
			RasterGrid elevation = decode(rgb);
			logger.info("Elevation stats: {}", ElevationStatistics.of(elevation.getSamples()));
			engine.writeRaster(target, elevation, rgb.getGeoreference());
		}
		return target;
	}
}
