package de.komoot.demtiles.mask;

import de.komoot.demtiles.config.MaskSettings;
import de.komoot.demtiles.engine.PixelType;
import de.komoot.demtiles.engine.RasterGrid;
import org.junit.Test;

import java.util.Random;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class MaskEvaluatorTest {
	private static final double[] DATA = {-9999, 0, 0.05, 0.1, 5, 30, 45, 60, 89.9};

	@Test
	public void testNoMaskPassesThroughAsFloat() {
		RasterGrid grid = MaskEvaluator.apply(DATA, 3, 3, null);
		assertEquals(PixelType.FLOAT32, grid.getPixelType());
		assertEquals(-9999, grid.getNodata(), 0.0);
		assertSame(DATA, grid.getSamples());
		assertTrue(grid.isBinaryMask() == false);
	}

	@Test
	public void testEmptyMaskPassesThrough() {
		RasterGrid grid = MaskEvaluator.apply(DATA, 3, 3, new MaskSettings(null, null));
		assertEquals(PixelType.FLOAT32, grid.getPixelType());
	}

	@Test
	public void testMinOnly() {
		RasterGrid grid = MaskEvaluator.apply(DATA, 3, 3, MaskSettings.atLeast(0.1));
		assertEquals(PixelType.BYTE, grid.getPixelType());
		assertEquals(0, grid.getNodata(), 0.0);
		assertArrayEquals(new double[]{0, 0, 0, 1, 1, 1, 1, 1, 1}, grid.getSamples(), 0.0);
	}

	@Test
	public void testMaxOnlyExcludesNodata() {
		RasterGrid grid = MaskEvaluator.apply(DATA, 3, 3, MaskSettings.atMost(5));
		assertArrayEquals(new double[]{0, 1, 1, 1, 1, 0, 0, 0, 0}, grid.getSamples(), 0.0);
	}

	@Test
	public void testBoundsAreInclusive() {
		RasterGrid grid = MaskEvaluator.apply(DATA, 3, 3, MaskSettings.between(5, 45));
		assertArrayEquals(new double[]{0, 0, 0, 0, 1, 1, 1, 0, 0}, grid.getSamples(), 0.0);
	}

	@Test
	public void testNodataExcludedEvenIfThresholdMatches() {
		RasterGrid grid = MaskEvaluator.apply(new double[]{-9999, -9998}, 2, 1, MaskSettings.atMost(0));
		assertArrayEquals(new double[]{0, 1}, grid.getSamples(), 0.0);
	}

	@Test
	public void testNaNNeverMatches() {
		RasterGrid grid = MaskEvaluator.apply(new double[]{Double.NaN, 1}, 2, 1, MaskSettings.atLeast(0));
		assertArrayEquals(new double[]{0, 1}, grid.getSamples(), 0.0);
	}

	@Test
	public void testMinOnlyIsSupersetOfMinAndMax() {
		Random random = new Random(42);
		double[] data = new double[400];
		for(int i = 0; i < data.length; i++) {
			data[i] = random.nextInt(10) == 0 ? -9999 : random.nextDouble() * 90;
		}
		for(double max : new double[]{0, 10, 30, 89}) {
			double[] minOnly = MaskEvaluator.apply(data, 20, 20, MaskSettings.atLeast(10)).getSamples();
			double[] both = MaskEvaluator.apply(data, 20, 20, MaskSettings.between(10, Math.max(10, max))).getSamples();
			for(int i = 0; i < data.length; i++) {
				assertTrue(minOnly[i] >= both[i]);
			}
		}
	}
}
