package de.komoot.demtiles.acquire;

import de.komoot.demtiles.engine.RasterEngineException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Classifies by the CPL error number GDAL attaches to a failure. Numbers that say nothing about the cause
 * (e.g. {@code CPLE_AppDefined}, which GDAL uses for most network and disk errors alike) are left to the next
 * classifier.
 */
public class ErrorNumberClassifier implements FailureClassifier {
	static final int CPLE_OUT_OF_MEMORY = 2;
	static final int CPLE_NO_WRITE_ACCESS = 8;
	static final int CPLE_HTTP_RESPONSE = 11;

	@Nullable
	@Override
	public FailureKind classify(@Nonnull RasterEngineException failure) {
		if(failure.hasErrorNumber() == false) {
			return null;
		}
		switch(failure.getErrorNumber()) {
			case CPLE_HTTP_RESPONSE:
				return FailureKind.TRANSIENT_NETWORK;
			case CPLE_OUT_OF_MEMORY:
			case CPLE_NO_WRITE_ACCESS:
				return FailureKind.RESOURCE;
			default:
				return null;
		}
	}
}
