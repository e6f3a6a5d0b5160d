package de.komoot.demtiles.engine.gdal;

import de.komoot.demtiles.engine.ProgressListener;
import org.gdal.gdal.ProgressCallback;

/**
 * Bridges GDAL's progress callback to a {@link ProgressListener}.
 */
class GdalProgress extends ProgressCallback {
	private final ProgressListener listener;

	GdalProgress(ProgressListener listener) {
		this.listener = listener;
	}

	@Override
	public int run(double dfComplete, String pszMessage) {
		return listener.onProgress(dfComplete, pszMessage) ? 1 : 0;
	}
}
