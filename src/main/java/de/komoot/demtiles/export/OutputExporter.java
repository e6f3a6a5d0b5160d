package de.komoot.demtiles.export;

import de.komoot.demtiles.PipelineException;
import de.komoot.demtiles.ProcessingException;
import de.komoot.demtiles.engine.Georeference;
import de.komoot.demtiles.engine.ProgressRelay;
import de.komoot.demtiles.engine.RasterEngine;
import de.komoot.demtiles.engine.RasterGrid;
import de.komoot.demtiles.engine.VectorFormat;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes the final grid. The extension of the output path decides: vector containers (see {@link VectorFormat})
 * get the polygons of a binary mask, everything else becomes a single band GeoTIFF.
 */
public class OutputExporter {
	private static final Logger logger = LoggerFactory.getLogger(OutputExporter.class);
	public static final String LAYER_NAME = "mask";
	public static final String VALUE_FIELD = "dn";

	private final RasterEngine engine;

	public OutputExporter(RasterEngine engine) {
		this.engine = engine;
	}

	/**
	 * @param grid continuous or binary result
	 * @param georeference georeference of the processed raster
	 * @param output output path
	 * @return the written path
	 * @throws ProcessingException if a vector container is requested for a continuous grid
	 */
	public Path export(@Nonnull RasterGrid grid, @Nonnull Georeference georeference, @Nonnull String output) {
		Path target = Paths.get(output);
		VectorFormat format = VectorFormat.forPath(output);
		if(format != null && grid.isBinaryMask() == false) {
			throw new ProcessingException("Vector output " + output + " needs a mask, configure 'mask.min' and/or 'mask.max' or use a raster extension");
		}
		createParent(target);
		if(format != null) {
			logger.info("Exporting to Vector format: {}", output);
			engine.deleteVector(target, format);
			engine.extractPolygons(target, format, LAYER_NAME, VALUE_FIELD, grid, georeference, new ProgressRelay("Polygonize"));
		} else {
			logger.info("Exporting to Raster format: {} ({})", output, grid.getPixelType());
			engine.writeRaster(target, grid, georeference);
		}
		return target;
	}

	private static void createParent(Path target) {
		try {
			FileUtils.forceMkdirParent(target.toAbsolutePath().toFile());
		} catch(IOException e) {
			throw new PipelineException("Could not create directory for " + target, e);
		}
	}
}
