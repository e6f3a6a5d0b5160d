package de.komoot.demtiles.engine;

import com.vividsolutions.jts.geom.Envelope;

import javax.annotation.Nullable;
import java.util.Locale;

/**
 * Parameters of a {@link RasterEngine#warp} call. Either an output window (bounds + resolution) or a cutline or
 * both may be given.
 */
public final class WarpRequest {
	@Nullable
	private final Envelope outputBounds;
	@Nullable
	private final String outputBoundsSrs;
	private final double xResolution;
	private final double yResolution;
	@Nullable
	private final String targetSrs;
	@Nullable
	private final String cutline;
	private final boolean cropToCutline;
	@Nullable
	private final Double targetNodata;

	private WarpRequest(Builder b) {
		this.outputBounds = b.outputBounds;
		this.outputBoundsSrs = b.outputBoundsSrs;
		this.xResolution = b.xResolution;
		this.yResolution = b.yResolution;
		this.targetSrs = b.targetSrs;
		this.cutline = b.cutline;
		this.cropToCutline = b.cropToCutline;
		this.targetNodata = b.targetNodata;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Nullable
	public Envelope getOutputBounds() {
		return outputBounds;
	}

	@Nullable
	public String getOutputBoundsSrs() {
		return outputBoundsSrs;
	}

	public double getXResolution() {
		return xResolution;
	}

	public double getYResolution() {
		return yResolution;
	}

	public boolean hasResolution() {
		return xResolution > 0 && yResolution > 0;
	}

	@Nullable
	public String getTargetSrs() {
		return targetSrs;
	}

	@Nullable
	public String getCutline() {
		return cutline;
	}

	public boolean isCropToCutline() {
		return cropToCutline;
	}

	@Nullable
	public Double getTargetNodata() {
		return targetNodata;
	}

	@Override
	public String toString() {
		return String.format(Locale.US, "WarpRequest{bounds=%s (%s), res=%s/%s, t_srs=%s, cutline=%s, crop=%s, nodata=%s}",
				outputBounds, outputBoundsSrs, xResolution, yResolution, targetSrs, cutline, cropToCutline, targetNodata);
	}

	public static class Builder {
		private Envelope outputBounds;
		private String outputBoundsSrs;
		private double xResolution;
		private double yResolution;
		private String targetSrs;
		private String cutline;
		private boolean cropToCutline;
		private Double targetNodata;

		public Builder outputBounds(Envelope bounds, String srs) {
			this.outputBounds = bounds;
			this.outputBoundsSrs = srs;
			return this;
		}

		public Builder resolution(double x, double y) {
			this.xResolution = x;
			this.yResolution = y;
			return this;
		}

		public Builder targetSrs(String srs) {
			this.targetSrs = srs;
			return this;
		}

		public Builder cutline(String cutline, boolean crop) {
			this.cutline = cutline;
			this.cropToCutline = crop;
			return this;
		}

		public Builder targetNodata(double nodata) {
			this.targetNodata = nodata;
			return this;
		}

		public WarpRequest build() {
			return new WarpRequest(this);
		}
	}
}
