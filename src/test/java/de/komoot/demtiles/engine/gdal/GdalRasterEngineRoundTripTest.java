package de.komoot.demtiles.engine.gdal;

import de.komoot.demtiles.engine.Georeference;
import de.komoot.demtiles.engine.PixelType;
import de.komoot.demtiles.engine.RasterDataset;
import de.komoot.demtiles.engine.RasterGrid;
import de.komoot.demtiles.engine.VectorFormat;
import lombok.extern.slf4j.Slf4j;
import org.gdal.gdal.Band;
import org.gdal.gdal.Dataset;
import org.gdal.gdal.gdal;
import org.gdal.gdalconst.gdalconst;
import org.gdal.ogr.DataSource;
import org.gdal.ogr.Feature;
import org.gdal.ogr.Layer;
import org.gdal.ogr.ogr;
import org.junit.Assume;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

/**
 * Runs the engine against the native GDAL libraries, skipped where they cannot be loaded.
 */
@Slf4j
public class GdalRasterEngineRoundTripTest {
	private static final String WGS84 = "GEOGCS[\"WGS 84\",DATUM[\"WGS_1984\",SPHEROID[\"WGS 84\",6378137,298.257223563]],"
			+ "PRIMEM[\"Greenwich\",0],UNIT[\"degree\",0.0174532925199433]]";
	private static final Georeference GEOREFERENCE = new Georeference(WGS84, new double[]{10.0, 0.001, 0, 47.0, 0, -0.001});

	private static GdalRasterEngine engine;

	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	@BeforeClass
	public static void loadGdal() {
		try {
			engine = new GdalRasterEngine();
		} catch(LinkageError e) {
			log.warn("Native GDAL libraries not available: {}", e.toString());
		}
	}

	@Before
	public void requireGdal() {
		Assume.assumeTrue("native GDAL libraries not available", engine != null);
	}

	@Test
	public void testWriteByteRaster() throws Exception {
		Path path = tmp.getRoot().toPath().resolve("mask.tif");
		double[] samples = {0, 1, 1, 0, 1, 0};
		engine.writeRaster(path, new RasterGrid(3, 2, samples, PixelType.BYTE, 0.0), GEOREFERENCE);

		assertBand(path, gdalconst.GDT_Byte, 0.0);
		try(RasterDataset ds = engine.open(path)) {
			assertEquals(3, ds.getWidth());
			assertEquals(2, ds.getHeight());
			assertEquals(1, ds.getBandCount());
			assertArrayEquals(samples, ds.readBand(1), 0.0);
			assertArrayEquals(GEOREFERENCE.getGeoTransform(), ds.getGeoreference().getGeoTransform(), 1e-12);
		}
	}

	@Test
	public void testWriteFloatRaster() throws Exception {
		Path path = tmp.getRoot().toPath().resolve("slope.tif");
		double[] samples = {12.5, -9999, 0.25, 3};
		engine.writeRaster(path, new RasterGrid(2, 2, samples, PixelType.FLOAT32, -9999.0), GEOREFERENCE);

		assertBand(path, gdalconst.GDT_Float32, -9999.0);
		try(RasterDataset ds = engine.open(path)) {
			assertArrayEquals(samples, ds.readBand(1), 0.0);
		}
	}

	@Test
	public void testSlopeBorderIsNodata() throws Exception {
		Path elevation = tmp.getRoot().toPath().resolve("base_elevation.tif");
		int size = 5;
		double[] samples = new double[size * size];
		for(int i = 0; i < samples.length; i++) {
			samples[i] = 100 + (i % size) * 10;
		}
		engine.writeRaster(elevation, new RasterGrid(size, size, samples, PixelType.FLOAT32, null), GEOREFERENCE);

		Path slope = tmp.getRoot().toPath().resolve("terrain_slope.tif");
		engine.terrainDerivative(slope, elevation, "slope");

		try(RasterDataset ds = engine.open(slope)) {
			double[] values = ds.readBand(1);
			assertEquals(-9999, values[0], 0.0);
			assertEquals(-9999, values[size - 1], 0.0);
			assertEquals(-9999, values[values.length - 1], 0.0);
			assertNotEquals(-9999, values[2 * size + 2], 0.0);
		}
	}

	@Test
	public void testPolygonizeToGeoPackage() {
		Path path = tmp.getRoot().toPath().resolve("mask.gpkg");
		// two separate regions of ones
		double[] samples = {
				1, 1, 0, 0,
				1, 0, 0, 1,
				0, 0, 0, 1};
		RasterGrid mask = new RasterGrid(4, 3, samples, PixelType.BYTE, 0.0);
		List<Double> progress = new ArrayList<>();
		engine.extractPolygons(path, VectorFormat.GEOPACKAGE, "mask", "dn", mask, GEOREFERENCE, (complete, message) -> {
			progress.add(complete);
			return true;
		});

		List<Integer> values = readField(path.toFile(), "mask", "dn");
		assertEquals(2, values.size());
		for(int dn : values) {
			assertEquals(1, dn);
		}
		assertFalse(progress.isEmpty());
	}

	@Test
	public void testDeleteVector() {
		Path path = tmp.getRoot().toPath().resolve("mask.gpkg");
		RasterGrid mask = new RasterGrid(2, 1, new double[]{1, 0}, PixelType.BYTE, 0.0);
		engine.extractPolygons(path, VectorFormat.GEOPACKAGE, "mask", "dn", mask, GEOREFERENCE, (complete, message) -> true);
		assertTrue(path.toFile().exists());

		engine.deleteVector(path, VectorFormat.GEOPACKAGE);
		assertFalse(path.toFile().exists());

		// deleting a missing container is a no-op, and the path can be written again
		engine.deleteVector(path, VectorFormat.GEOPACKAGE);
		engine.extractPolygons(path, VectorFormat.GEOPACKAGE, "mask", "dn", mask, GEOREFERENCE, (complete, message) -> true);
		assertEquals(1, readField(path.toFile(), "mask", "dn").size());
	}

	private static void assertBand(Path path, int expectedType, double expectedNodata) {
		Dataset ds = gdal.Open(path.toString(), gdalconst.GA_ReadOnly);
		assertNotNull(ds);
		try {
			Band band = ds.GetRasterBand(1);
			assertEquals(expectedType, band.GetRasterDataType());
			Double[] nodata = new Double[1];
			band.GetNoDataValue(nodata);
			assertNotNull(nodata[0]);
			assertEquals(expectedNodata, nodata[0], 0.0);
		} finally {
			ds.delete();
		}
	}

	private static List<Integer> readField(File file, String layerName, String fieldName) {
		DataSource ds = ogr.Open(file.getPath());
		assertNotNull(ds);
		try {
			Layer layer = ds.GetLayerByName(layerName);
			assertNotNull(layer);
			List<Integer> values = new ArrayList<>();
			Feature feature;
			while((feature = layer.GetNextFeature()) != null) {
				values.add(feature.GetFieldAsInteger(fieldName));
				feature.delete();
			}
			assertEquals(values.size(), layer.GetFeatureCount());
			return values;
		} finally {
			ds.delete();
		}
	}
}
