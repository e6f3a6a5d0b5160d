package de.komoot.demtiles.engine;

import org.apache.commons.io.FilenameUtils;

import javax.annotation.Nullable;
import java.util.Locale;

/**
 * Vector containers a mask can be polygonised into, keyed by file extension.
 */
public enum VectorFormat {
	GEOPACKAGE("gpkg", "GPKG"),
	GEOJSON("geojson", "GeoJSON"),
	SHAPEFILE("shp", "ESRI Shapefile");

	private final String extension;
	private final String driverName;

	VectorFormat(String extension, String driverName) {
		this.extension = extension;
		this.driverName = driverName;
	}

	public String getExtension() {
		return extension;
	}

	public String getDriverName() {
		return driverName;
	}

	/**
	 * @param path output path
	 * @return the vector format for the (case insensitive) extension of the path or null if it is not a vector
	 * 		container
	 */
	@Nullable
	public static VectorFormat forPath(String path) {
		String extension = FilenameUtils.getExtension(path).toLowerCase(Locale.ROOT);
		for(VectorFormat format : values()) {
			if(format.extension.equals(extension)) {
				return format;
			}
		}
		return null;
	}
}
