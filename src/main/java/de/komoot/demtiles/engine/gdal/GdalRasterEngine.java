package de.komoot.demtiles.engine.gdal;

import de.komoot.demtiles.engine.Georeference;
import de.komoot.demtiles.engine.PixelType;
import de.komoot.demtiles.engine.ProgressListener;
import de.komoot.demtiles.engine.RasterDataset;
import de.komoot.demtiles.engine.RasterEngine;
import de.komoot.demtiles.engine.RasterEngineException;
import de.komoot.demtiles.engine.RasterGrid;
import de.komoot.demtiles.engine.VectorFormat;
import de.komoot.demtiles.engine.WarpRequest;
import org.gdal.gdal.Band;
import org.gdal.gdal.DEMProcessingOptions;
import org.gdal.gdal.Dataset;
import org.gdal.gdal.Driver;
import org.gdal.gdal.WarpOptions;
import org.gdal.gdal.gdal;
import org.gdal.gdalconst.gdalconst;
import org.gdal.ogr.DataSource;
import org.gdal.ogr.FieldDefn;
import org.gdal.ogr.Layer;
import org.gdal.ogr.ogr;
import org.gdal.osr.SpatialReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Vector;
import java.util.function.Supplier;

/**
 * {@link RasterEngine} backed by the GDAL/OGR Java bindings. Needs the native GDAL libraries on the library path.
 */
public class GdalRasterEngine implements RasterEngine {
	private static final Logger logger = LoggerFactory.getLogger(GdalRasterEngine.class);
	private static final String RASTER_DRIVER = "GTiff";

	public GdalRasterEngine() {
		gdal.AllRegister();
		ogr.RegisterAll();
		gdal.UseExceptions();
		logger.debug("GDAL {} initialised", gdal.VersionInfo("RELEASE_NAME"));
	}

	@Override
	public void configureTileCache(@Nonnull Path cacheDir) {
		String path = cacheDir.toAbsolutePath().toString();
		gdal.SetConfigOption("GDAL_DEFAULT_WMS_CACHE_PATH", path);
		gdal.SetConfigOption("GDAL_HTTP_CACHE", "YES");
		gdal.SetConfigOption("GDAL_HTTP_CACHE_DIRECTORY", path);
	}

	@Override
	public void warp(@Nonnull Path destination, @Nonnull String source, @Nonnull WarpRequest request, @Nonnull ProgressListener listener) {
		Vector<String> options = warpOptions(request);
		logger.debug("gdalwarp {} {} {}", options, source, destination);
		Dataset src = call("Opening " + source, () -> gdal.Open(source, gdalconst.GA_ReadOnly));
		try {
			Dataset result = call("Warp of " + source, () -> gdal.Warp(destination.toString(), new Dataset[]{src}, new WarpOptions(options), new GdalProgress(listener)));
			result.delete();
		} finally {
			src.delete();
		}
	}

	static Vector<String> warpOptions(WarpRequest request) {
		Vector<String> options = new Vector<>(Arrays.asList("-of", RASTER_DRIVER, "-overwrite"));
		if(request.getOutputBounds() != null) {
			options.addAll(Arrays.asList("-te",
					Double.toString(request.getOutputBounds().getMinX()), Double.toString(request.getOutputBounds().getMinY()),
					Double.toString(request.getOutputBounds().getMaxX()), Double.toString(request.getOutputBounds().getMaxY())));
			if(request.getOutputBoundsSrs() != null) {
				options.addAll(Arrays.asList("-te_srs", request.getOutputBoundsSrs()));
			}
		}
		if(request.hasResolution()) {
			options.addAll(Arrays.asList("-tr", Double.toString(request.getXResolution()), Double.toString(request.getYResolution())));
		}
		if(request.getTargetSrs() != null) {
			options.addAll(Arrays.asList("-t_srs", request.getTargetSrs()));
		}
		if(request.getCutline() != null) {
			options.addAll(Arrays.asList("-cutline", request.getCutline()));
			if(request.isCropToCutline()) {
				options.add("-crop_to_cutline");
			}
		}
		if(request.getTargetNodata() != null) {
			options.addAll(Arrays.asList("-dstnodata", Double.toString(request.getTargetNodata())));
		}
		return options;
	}

	@Override
	public void terrainDerivative(@Nonnull Path destination, @Nonnull Path source, @Nonnull String processName) {
		Dataset src = call("Opening " + source, () -> gdal.Open(source.toString(), gdalconst.GA_ReadOnly));
		try {
			DEMProcessingOptions options = new DEMProcessingOptions(new Vector<>(Arrays.asList("-of", RASTER_DRIVER)));
			Dataset result = call("Terrain derivative '" + processName + "'",
					() -> gdal.DEMProcessing(destination.toString(), src, processName, null, options));
			result.delete();
		} finally {
			src.delete();
		}
	}

	@Nonnull
	@Override
	public RasterDataset open(@Nonnull Path path) {
		Dataset ds = call("Opening " + path, () -> gdal.Open(path.toString(), gdalconst.GA_ReadOnly));
		return new GdalDataset(path.toString(), ds);
	}

	@Override
	public void writeRaster(@Nonnull Path destination, @Nonnull RasterGrid grid, @Nonnull Georeference georeference) {
		Driver driver = call("Looking up driver " + RASTER_DRIVER, () -> gdal.GetDriverByName(RASTER_DRIVER));
		Dataset ds = call("Creating " + destination,
				() -> driver.Create(destination.toString(), grid.getWidth(), grid.getHeight(), 1, toGdalType(grid.getPixelType())));
		try {
			fill(ds, grid, georeference, destination.toString());
			ds.FlushCache();
		} finally {
			ds.delete();
		}
	}

	@Override
	public void deleteVector(@Nonnull Path path, @Nonnull VectorFormat format) {
		if(Files.exists(path)) {
			org.gdal.ogr.Driver driver = call("Looking up driver " + format.getDriverName(), () -> ogr.GetDriverByName(format.getDriverName()));
			check("Deleting " + path, () -> driver.DeleteDataSource(path.toString()));
		}
	}

	@Override
	public void extractPolygons(@Nonnull Path destination, @Nonnull VectorFormat format, @Nonnull String layerName, @Nonnull String fieldName,
								@Nonnull RasterGrid mask, @Nonnull Georeference georeference, @Nonnull ProgressListener listener) {
		Driver memDriver = call("Looking up driver MEM", () -> gdal.GetDriverByName("MEM"));
		Dataset mem = call("Creating in-memory raster", () -> memDriver.Create("", mask.getWidth(), mask.getHeight(), 1, gdalconst.GDT_Byte));
		try {
			fill(mem, mask, georeference, "in-memory raster");
			Band band = call("Band 1 of in-memory raster", () -> mem.GetRasterBand(1));
			check("Setting nodata of in-memory raster", () -> band.SetNoDataValue(0));

			org.gdal.ogr.Driver vectorDriver = call("Looking up driver " + format.getDriverName(), () -> ogr.GetDriverByName(format.getDriverName()));
			DataSource dataSource = call("Creating " + destination, () -> vectorDriver.CreateDataSource(destination.toString()));
			try {
				SpatialReference srs = call("Parsing projection", () -> new SpatialReference(georeference.getProjectionWkt()));
				Layer layer = call("Creating layer " + layerName, () -> dataSource.CreateLayer(layerName, srs, ogr.wkbPolygon));
				check("Creating field " + fieldName, () -> layer.CreateField(new FieldDefn(fieldName, ogr.OFTInteger)));
				// the band doubles as its own mask so only cells with value 1 become polygons
				check("Polygonize into " + destination, () -> gdal.Polygonize(band, band, layer, 0, new Vector<String>(), new GdalProgress(listener)));
				check("Writing layer " + layerName, layer::SyncToDisk);
			} finally {
				dataSource.delete();
			}
		} finally {
			mem.delete();
		}
	}

	private static void fill(Dataset ds, RasterGrid grid, Georeference georeference, String name) {
		check("Setting projection of " + name, () -> ds.SetProjection(georeference.getProjectionWkt()));
		check("Setting geotransform of " + name, () -> ds.SetGeoTransform(georeference.getGeoTransform()));
		Band band = call("Band 1 of " + name, () -> ds.GetRasterBand(1));
		Double nodata = grid.getNodata();
		if(nodata != null) {
			check("Setting nodata of " + name, () -> band.SetNoDataValue(nodata));
		}
		check("Writing samples to " + name,
				() -> band.WriteRaster(0, 0, grid.getWidth(), grid.getHeight(), gdalconst.GDT_Float64, grid.getSamples()));
	}

	static int toGdalType(PixelType type) {
		switch(type) {
			case BYTE:
				return gdalconst.GDT_Byte;
			case FLOAT32:
				return gdalconst.GDT_Float32;
			default:
				throw new IllegalArgumentException("Unsupported pixel type " + type);
		}
	}

	/**
	 * Runs a GDAL call and converts both thrown errors and null results into a {@link RasterEngineException} carrying
	 * GDAL's last error number.
	 */
	private static <T> T call(String what, Supplier<T> operation) {
		gdal.ErrorReset();
		T result;
		try {
			result = operation.get();
		} catch(RasterEngineException e) {
			throw e;
		} catch(RuntimeException e) {
			throw failure(what, e);
		}
		if(result == null) {
			throw failure(what, null);
		}
		return result;
	}

	/**
	 * Like {@link #call} for GDAL methods reporting a CPLErr/OGRErr status, non-zero statuses fail as well.
	 */
	private static void check(String what, Supplier<Integer> operation) {
		int err = call(what, operation);
		if(err != gdalconst.CE_None) {
			int errorNumber = gdal.GetLastErrorNo();
			throw new RasterEngineException(String.format(Locale.US, "%s failed with status %d: %s", what, err, gdal.GetLastErrorMsg()),
					errorNumber > 0 ? errorNumber : RasterEngineException.NO_ERROR_NUMBER, null);
		}
	}

	private static RasterEngineException failure(String what, RuntimeException cause) {
		int errorNumber = gdal.GetLastErrorNo();
		String detail = cause != null && cause.getMessage() != null ? cause.getMessage() : gdal.GetLastErrorMsg();
		return new RasterEngineException(String.format(Locale.US, "%s failed: %s", what, detail),
				errorNumber > 0 ? errorNumber : RasterEngineException.NO_ERROR_NUMBER, cause);
	}
}
