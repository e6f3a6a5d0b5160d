package de.komoot.demtiles.terrain;

import de.komoot.demtiles.engine.ProgressRelay;
import de.komoot.demtiles.engine.RasterEngine;
import de.komoot.demtiles.engine.WarpRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Computes the terrain derivative on the whole decoded rectangle and only then clips it, so cells along the
 * clipping boundary still see their real neighbours.
 */
public class TerrainProcessor {
	private static final Logger logger = LoggerFactory.getLogger(TerrainProcessor.class);
	public static final double NODATA = -9999;
	public static final String CLIPPED_FILE_NAME = "terrain_clipped.tif";
	private static final String VSI_CURL = "/vsicurl/";

	private final RasterEngine engine;

	public TerrainProcessor(RasterEngine engine) {
		this.engine = engine;
	}

	/**
	 * @param elevation decoded elevation raster
	 * @param process the derivative
	 * @param clipping optional polygon source, path or http(s) URL
	 * @param cacheDir directory for the intermediate rasters
	 * @return the raster holding the (clipped) derivative
	 */
	public Path process(@Nonnull Path elevation, @Nonnull TerrainProcess process, @Nullable String clipping, @Nonnull Path cacheDir) {
		logger.info("Running terrain analysis: '{}'...", process.getEngineName());
		Path derivative = cacheDir.resolve("terrain_" + process.name().toLowerCase(Locale.ROOT) + ".tif");
		engine.terrainDerivative(derivative, elevation, process.getEngineName());
		if(clipping == null) {
			return derivative;
		}

		String cutline = toEnginePath(clipping);
		logger.info("Applying final cutline: {}", cutline);
		Path clipped = cacheDir.resolve(CLIPPED_FILE_NAME);
		WarpRequest request = WarpRequest.builder()
				.cutline(cutline, true)
				.targetNodata(NODATA)
				.build();
		engine.warp(clipped, derivative.toString(), request, new ProgressRelay("Clip"));
		return clipped;
	}

	/**
	 * Remote clipping sources are streamed through the engine's virtual curl file system instead of being
	 * downloaded.
	 */
	static String toEnginePath(String clipping) {
		String lower = clipping.toLowerCase(Locale.ROOT);
		if(lower.startsWith("http://") || lower.startsWith("https://")) {
			return VSI_CURL + clipping;
		}
		return clipping;
	}
}
