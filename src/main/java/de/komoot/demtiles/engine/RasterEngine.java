package de.komoot.demtiles.engine;

import javax.annotation.Nonnull;
import java.nio.file.Path;

/**
 * The geospatial processing library the pipeline delegates to. All calls block until done and report failures as
 * {@link RasterEngineException}.
 *
 * @see de.komoot.demtiles.engine.gdal.GdalRasterEngine
 */
public interface RasterEngine {

	/**
	 * Points the engine's HTTP tile cache at the given directory.
	 */
	void configureTileCache(@Nonnull Path cacheDir);

	/**
	 * Reprojects / resamples / clips a raster into a new GeoTIFF.
	 * @param destination file to write, replaced if present
	 * @param source engine readable source (path, descriptor or virtual path)
	 * @param request warp parameters
	 * @param listener progress receiver
	 */
	void warp(@Nonnull Path destination, @Nonnull String source, @Nonnull WarpRequest request, @Nonnull ProgressListener listener);

	/**
	 * Computes a single band terrain derivative of an elevation raster.
	 */
	void terrainDerivative(@Nonnull Path destination, @Nonnull Path source, @Nonnull String processName);

	/**
	 * Opens a raster for reading. The caller closes the handle.
	 */
	@Nonnull
	RasterDataset open(@Nonnull Path path);

	/**
	 * Writes a single band GeoTIFF using the pixel type and nodata value of the grid.
	 */
	void writeRaster(@Nonnull Path destination, @Nonnull RasterGrid grid, @Nonnull Georeference georeference);

	/**
	 * Deletes a vector dataset including all side car files of its format. Does nothing if it does not exist.
	 */
	void deleteVector(@Nonnull Path path, @Nonnull VectorFormat format);

	/**
	 * Polygonises all cells with value 1 of a binary grid into a new single layer vector dataset. Each polygon
	 * gets the cell value in the integer field {@code fieldName}.
	 */
	void extractPolygons(@Nonnull Path destination, @Nonnull VectorFormat format, @Nonnull String layerName, @Nonnull String fieldName,
						 @Nonnull RasterGrid mask, @Nonnull Georeference georeference, @Nonnull ProgressListener listener);
}
