package de.komoot.demtiles.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vividsolutions.jts.geom.Envelope;
import de.komoot.demtiles.ConfigurationException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * Immutable run configuration, usually read from a YAML file via {@link #load(File)}.
 *
 * <pre>
 * source: https://s3.amazonaws.com/elevation-tiles-prod/terrarium/${z}/${x}/${y}.png
 * bounds: [10.0, 47.0, 10.5, 47.5]
 * resolution: 30
 * process: slope
 * output: steep.gpkg
 * clipping: https://example.org/area.geojson
 * mask:
 *   min: 30
 * cache_dir: ./cache
 * </pre>
 */
public class PipelineConfig {
	public static final String DEFAULT_CACHE_DIR = "./cache";

	private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

	@Nullable
	private final String source;
	private final Envelope bounds;
	private final double resolution;
	private final String process;
	private final String output;
	@Nullable
	private final String clipping;
	@Nullable
	private final MaskSettings mask;
	private final Path cacheDir;

	/**
	 * @param source tile URL template, checked when the source descriptor is written
	 * @param bounds geographic bounds (longitude = x, latitude = y)
	 * @param resolution target pixel size in metres of EPSG:3857
	 * @param process terrain derivative name
	 * @param output output path, the extension selects raster or vector export
	 * @param clipping optional polygon source (path or URL)
	 * @param mask optional thresholds, an empty block counts as no mask
	 * @param cacheDir cache directory, {@link #DEFAULT_CACHE_DIR} if null
	 * @throws ConfigurationException if a field is missing or invalid
	 */
	public PipelineConfig(@Nullable String source, Envelope bounds, double resolution, String process, String output,
						  @Nullable String clipping, @Nullable MaskSettings mask, @Nullable Path cacheDir) {
		this.source = source;
		this.bounds = validateBounds(bounds);
		if(Double.isNaN(resolution) || resolution <= 0) {
			throw new ConfigurationException("'resolution' must be greater than 0 but was " + resolution);
		}
		this.resolution = resolution;
		this.process = require("process", process);
		this.output = require("output", output);
		this.clipping = clipping == null || clipping.trim().isEmpty() ? null : clipping.trim();
		if(mask != null && mask.getMin() != null && mask.getMax() != null && mask.getMin() > mask.getMax()) {
			throw new ConfigurationException("'mask.min' (" + mask.getMin() + ") is greater than 'mask.max' (" + mask.getMax() + ")");
		}
		this.mask = mask == null || mask.isEmpty() ? null : mask;
		this.cacheDir = cacheDir == null ? Paths.get(DEFAULT_CACHE_DIR) : cacheDir;
	}

	/**
	 * Reads a YAML configuration file.
	 * @param file the file
	 * @return the validated configuration
	 * @throws ConfigurationException if the file can not be read or holds invalid values
	 */
	public static PipelineConfig load(@Nonnull File file) {
		if(file.isFile() && file.length() == 0) {
			throw new ConfigurationException("Configuration " + file + " is empty");
		}
		RawConfig raw;
		try {
			raw = YAML.readValue(file, RawConfig.class);
		} catch(IOException e) {
			throw new ConfigurationException("Could not read configuration " + file + ": " + e.getMessage(), e);
		}
		if(raw == null) {
			throw new ConfigurationException("Configuration " + file + " is empty");
		}
		return raw.toConfig();
	}

	private static String require(String field, String value) {
		if(value == null || value.trim().isEmpty()) {
			throw new ConfigurationException("'" + field + "' is required");
		}
		return value.trim();
	}

	private static Envelope validateBounds(Envelope bounds) {
		if(bounds == null) {
			throw new ConfigurationException("'bounds' is required");
		}
		if(bounds.getMinX() < -180 || bounds.getMaxX() > 180 || bounds.getMinY() < -90 || bounds.getMaxY() > 90) {
			throw new ConfigurationException("'bounds' " + bounds + " exceed the geographic range [-180,180] x [-90,90]");
		}
		if(bounds.getWidth() <= 0 || bounds.getHeight() <= 0) {
			throw new ConfigurationException("'bounds' " + bounds + " must have min < max on both axes");
		}
		return bounds;
	}

	static Envelope toEnvelope(List<Double> values) {
		if(values == null) {
			return null;
		}
		if(values.size() != 4 || values.contains(null)) {
			throw new ConfigurationException("'bounds' needs 4 numbers [minLon, minLat, maxLon, maxLat] but was " + values);
		}
		double minX = values.get(0);
		double minY = values.get(1);
		double maxX = values.get(2);
		double maxY = values.get(3);
		if(minX >= maxX || minY >= maxY) {
			throw new ConfigurationException(String.format(Locale.US, "'bounds' must have min < max on both axes but was %s", values));
		}
		return new Envelope(minX, maxX, minY, maxY);
	}

	@Nullable
	public String getSource() {
		return source;
	}

	public Envelope getBounds() {
		return bounds;
	}

	public double getResolution() {
		return resolution;
	}

	public String getProcess() {
		return process;
	}

	public String getOutput() {
		return output;
	}

	@Nullable
	public String getClipping() {
		return clipping;
	}

	@Nullable
	public MaskSettings getMask() {
		return mask;
	}

	public boolean isMasked() {
		return mask != null;
	}

	public Path getCacheDir() {
		return cacheDir;
	}

	@Override
	public String toString() {
		return String.format(Locale.US, "PipelineConfig{source=%s, bounds=%s, resolution=%s, process=%s, output=%s, clipping=%s, mask=%s, cacheDir=%s}",
				source, bounds, resolution, process, output, clipping, mask, cacheDir);
	}

	/**
	 * Mirrors the YAML document; turned into a validated {@link PipelineConfig}.
	 */
	static class RawConfig {
		@JsonProperty("source")
		public String source;
		@JsonProperty("bounds")
		public List<Double> bounds;
		@JsonProperty("resolution")
		public Double resolution;
		@JsonProperty("process")
		public String process;
		@JsonProperty("output")
		public String output;
		@JsonProperty("clipping")
		public String clipping;
		@JsonProperty("mask")
		public MaskSettings mask;
		@JsonProperty("cache_dir")
		public String cacheDir;

		PipelineConfig toConfig() {
			if(resolution == null) {
				throw new ConfigurationException("'resolution' is required");
			}
			return new PipelineConfig(source, toEnvelope(bounds), resolution, process, output, clipping, mask,
					cacheDir == null ? null : Paths.get(cacheDir));
		}
	}
}
