package de.komoot.demtiles.source;

import com.vividsolutions.jts.geom.Coordinate;
import com.vividsolutions.jts.geom.Envelope;

/**
 * Constants and formulas of the spherical Web Mercator (EPSG:3857) tile pyramid.
 */
public final class WebMercator {
	public static final String EPSG_CODE = "EPSG:3857";
	public static final String GEOGRAPHIC_EPSG_CODE = "EPSG:4326";
	/** half the side length of the square world extent in metres */
	public static final double ORIGIN_SHIFT = 20037508.34;
	public static final int TILE_SIZE = 256;
	public static final int ZOOM_LEVELS = 15;
	public static final int BAND_COUNT = 3;

	private static final double EARTH_RADIUS = 6378137.0;
	private static final double MAX_LATITUDE = 85.0511287798066;

	private WebMercator() {
	}

	/**
	 * Projects a geographic coordinate (x = longitude, y = latitude) to Web Mercator metres. Latitudes beyond the
	 * pyramid are clamped.
	 */
	public static Coordinate project(Coordinate lonLat) {
		double lat = Math.max(-MAX_LATITUDE, Math.min(MAX_LATITUDE, lonLat.y));
		double x = Math.toRadians(lonLat.x) * EARTH_RADIUS;
		double y = Math.log(Math.tan(Math.PI / 4 + Math.toRadians(lat) / 2)) * EARTH_RADIUS;
		return new Coordinate(x, y);
	}

	/**
	 * @param geographic bounds in longitude / latitude
	 * @return the same bounds in Web Mercator metres
	 */
	public static Envelope project(Envelope geographic) {
		Coordinate min = project(new Coordinate(geographic.getMinX(), geographic.getMinY()));
		Coordinate max = project(new Coordinate(geographic.getMaxX(), geographic.getMaxY()));
		return new Envelope(min, max);
	}

	/**
	 * Size of the raster a warp of the given geographic bounds into EPSG:3857 produces.
	 * @return {width, height} in pixels
	 */
	public static int[] rasterSize(Envelope geographic, double resolution) {
		Envelope projected = project(geographic);
		int width = Math.max(1, (int) (projected.getWidth() / resolution + 0.5));
		int height = Math.max(1, (int) (projected.getHeight() / resolution + 0.5));
		return new int[]{width, height};
	}
}
