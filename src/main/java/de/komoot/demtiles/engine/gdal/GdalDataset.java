package de.komoot.demtiles.engine.gdal;

import de.komoot.demtiles.engine.Georeference;
import de.komoot.demtiles.engine.RasterDataset;
import de.komoot.demtiles.engine.RasterEngineException;
import org.gdal.gdal.Band;
import org.gdal.gdal.Dataset;
import org.gdal.gdalconst.gdalconst;

import javax.annotation.Nonnull;

/**
 * {@link RasterDataset} on top of an open GDAL dataset.
 */
class GdalDataset implements RasterDataset {
	private final String name;
	private Dataset dataset;

	GdalDataset(String name, Dataset dataset) {
		this.name = name;
		this.dataset = dataset;
	}

	@Override
	public int getWidth() {
		return handle().GetRasterXSize();
	}

	@Override
	public int getHeight() {
		return handle().GetRasterYSize();
	}

	@Override
	public int getBandCount() {
		return handle().GetRasterCount();
	}

	@Nonnull
	@Override
	public Georeference getGeoreference() {
		Dataset ds = handle();
		return new Georeference(ds.GetProjection(), ds.GetGeoTransform());
	}

	@Nonnull
	@Override
	public double[] readBand(int band) {
		Dataset ds = handle();
		if(band < 1 || band > ds.GetRasterCount()) {
			throw new IllegalArgumentException(name + " has " + ds.GetRasterCount() + " bands, band " + band + " does not exist");
		}
		int width = ds.GetRasterXSize();
		int height = ds.GetRasterYSize();
		double[] samples = new double[width * height];
		Band b = ds.GetRasterBand(band);
		int err = b.ReadRaster(0, 0, width, height, gdalconst.GDT_Float64, samples);
		if(err != gdalconst.CE_None) {
			throw new RasterEngineException("Could not read band " + band + " of " + name, err, null);
		}
		return samples;
	}

	private Dataset handle() {
		if(dataset == null) {
			throw new IllegalStateException(name + " is already closed");
		}
		return dataset;
	}

	@Override
	public void close() {
		if(dataset != null) {
			dataset.delete();
			dataset = null;
		}
	}
}
