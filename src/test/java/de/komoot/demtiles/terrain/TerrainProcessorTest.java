package de.komoot.demtiles.terrain;

import de.komoot.demtiles.ProcessingException;
import de.komoot.demtiles.engine.Georeference;
import de.komoot.demtiles.engine.InMemoryRasterEngine;
import de.komoot.demtiles.engine.PixelType;
import de.komoot.demtiles.engine.RasterGrid;
import de.komoot.demtiles.engine.WarpRequest;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class TerrainProcessorTest {

	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	private InMemoryRasterEngine engine;
	private Path cache;
	private Path elevation;

	@Before
	public void setUp() {
		engine = new InMemoryRasterEngine();
		cache = tmp.getRoot().toPath();
		elevation = cache.resolve("base_elevation.tif");
		engine.writeRaster(elevation, new RasterGrid(2, 2, new double[]{1, 2, 3, 4}, PixelType.FLOAT32, null),
				new Georeference(InMemoryRasterEngine.PROJECTION, new double[]{0, 10, 0, 0, 0, -10}));
		engine.calls.clear();
	}

	@Test
	public void testWithoutClipping() {
		Path result = new TerrainProcessor(engine).process(elevation, TerrainProcess.SLOPE, null, cache);

		assertEquals(cache.resolve("terrain_slope.tif"), result);
		assertEquals(Arrays.asList("terrain slope base_elevation.tif"), engine.calls);
		assertNull(engine.require(result).nodata);
	}

	@Test
	public void testDerivativeRunsBeforeClipping() {
		Path result = new TerrainProcessor(engine).process(elevation, TerrainProcess.HILLSHADE, "/data/area.geojson", cache);

		assertEquals(cache.resolve(TerrainProcessor.CLIPPED_FILE_NAME), result);
		assertEquals(Arrays.asList("terrain hillshade base_elevation.tif", "warp terrain_clipped.tif"), engine.calls);
		WarpRequest request = engine.warpRequests.get(0);
		assertEquals("/data/area.geojson", request.getCutline());
		assertTrue(request.isCropToCutline());
		assertEquals(-9999, request.getTargetNodata(), 0.0);
		assertNull(request.getOutputBounds());
		assertEquals(-9999, engine.require(result).nodata, 0.0);
	}

	@Test
	public void testRemoteClippingIsStreamed() {
		assertEquals("/vsicurl/https://example.org/area.geojson", TerrainProcessor.toEnginePath("https://example.org/area.geojson"));
		assertEquals("/vsicurl/http://example.org/area.gpkg", TerrainProcessor.toEnginePath("http://example.org/area.gpkg"));
		assertEquals("area.shp", TerrainProcessor.toEnginePath("area.shp"));
		assertEquals("/vsizip/areas.zip/area.shp", TerrainProcessor.toEnginePath("/vsizip/areas.zip/area.shp"));
	}

	@Test
	public void testProcessNames() {
		assertEquals(TerrainProcess.SLOPE, TerrainProcess.fromName("slope"));
		assertEquals(TerrainProcess.SLOPE, TerrainProcess.fromName(" Slope "));
		assertEquals(TerrainProcess.TRI, TerrainProcess.fromName("tri"));
		assertEquals("TPI", TerrainProcess.fromName("tpi").getEngineName());
		assertEquals(TerrainProcess.ROUGHNESS, TerrainProcess.fromName("ROUGHNESS"));
	}

	@Test(expected = ProcessingException.class)
	public void testColorReliefIsUnsupported() {
		TerrainProcess.fromName("color-relief");
	}

	@Test(expected = ProcessingException.class)
	public void testUnknownProcess() {
		TerrainProcess.fromName("curvature");
	}
}
