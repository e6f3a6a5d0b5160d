package de.komoot.demtiles.decode;

import java.util.Locale;

/**
 * Minimum and maximum of a decoded elevation grid, for the log only.
 */
public final class ElevationStatistics {
	private final double min;
	private final double max;

	private ElevationStatistics(double min, double max) {
		this.min = min;
		this.max = max;
	}

	public static ElevationStatistics of(double[] elevations) {
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for(double e : elevations) {
			if(e < min) {
				min = e;
			}
			if(e > max) {
				max = e;
			}
		}
		return new ElevationStatistics(min, max);
	}

	public double getMin() {
		return min;
	}

	public double getMax() {
		return max;
	}

	@Override
	public String toString() {
		return String.format(Locale.US, "Min %.2fm, Max %.2fm", min, max);
	}
}
