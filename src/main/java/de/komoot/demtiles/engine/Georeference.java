package de.komoot.demtiles.engine;

import javax.annotation.Nonnull;
import java.util.Arrays;

/**
 * Spatial reference (as WKT) and the 6 coefficient affine transform of a raster:
 * {@code x = t[0] + col * t[1] + row * t[2]; y = t[3] + col * t[4] + row * t[5]}.
 */
public final class Georeference {
	private final String projectionWkt;
	private final double[] geoTransform;

	public Georeference(@Nonnull String projectionWkt, @Nonnull double[] geoTransform) {
		if(geoTransform.length != 6) {
			throw new IllegalArgumentException("Affine transform needs 6 coefficients but has " + geoTransform.length);
		}
		this.projectionWkt = projectionWkt;
		this.geoTransform = geoTransform.clone();
	}

	public String getProjectionWkt() {
		return projectionWkt;
	}

	public double[] getGeoTransform() {
		return geoTransform.clone();
	}

	public double getPixelWidth() {
		return geoTransform[1];
	}

	public double getPixelHeight() {
		return Math.abs(geoTransform[5]);
	}

	@Override
	public boolean equals(Object o) {
		if(this == o) {
			return true;
		}
		if(o instanceof Georeference == false) {
			return false;
		}
		Georeference other = (Georeference) o;
		return projectionWkt.equals(other.projectionWkt) && Arrays.equals(geoTransform, other.geoTransform);
	}

	@Override
	public int hashCode() {
		return 31 * projectionWkt.hashCode() + Arrays.hashCode(geoTransform);
	}

	@Override
	public String toString() {
		return "Georeference{" + Arrays.toString(geoTransform) + "}";
	}
}
