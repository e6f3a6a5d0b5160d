package de.komoot.demtiles.source;

import java.nio.file.Path;

/**
 * The written description of the remote tile source; the raster engine opens {@link #getPath()} like any other
 * raster.
 */
public final class SourceDescriptor {
	private final Path path;
	private final String sourceUrl;

	SourceDescriptor(Path path, String sourceUrl) {
		this.path = path;
		this.sourceUrl = sourceUrl;
	}

	public Path getPath() {
		return path;
	}

	public String getSourceUrl() {
		return sourceUrl;
	}
}
