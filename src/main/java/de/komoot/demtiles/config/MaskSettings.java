package de.komoot.demtiles.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nullable;
import java.util.Locale;

/**
 * Thresholds turning the continuous terrain product into a binary mask. Both bounds are inclusive and optional.
 */
public class MaskSettings {
	@Nullable
	private final Double min;
	@Nullable
	private final Double max;

	@JsonCreator
	public MaskSettings(@JsonProperty("min") @Nullable Double min, @JsonProperty("max") @Nullable Double max) {
		this.min = min;
		this.max = max;
	}

	public static MaskSettings atLeast(double min) {
		return new MaskSettings(min, null);
	}

	public static MaskSettings atMost(double max) {
		return new MaskSettings(null, max);
	}

	public static MaskSettings between(double min, double max) {
		return new MaskSettings(min, max);
	}

	@Nullable
	public Double getMin() {
		return min;
	}

	@Nullable
	public Double getMax() {
		return max;
	}

	/**
	 * @return true if neither bound is set; such a block is treated like an absent mask
	 */
	public boolean isEmpty() {
		return min == null && max == null;
	}

	@Override
	public String toString() {
		return String.format(Locale.US, "{min=%s, max=%s}", min, max);
	}
}
