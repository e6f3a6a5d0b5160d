package de.komoot.demtiles.acquire;

import de.komoot.demtiles.engine.RasterEngineException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Falls back to well known fragments of GDAL / curl error messages.
 */
public class MessagePatternClassifier implements FailureClassifier {
	private static final List<String> NETWORK_PATTERNS = Arrays.asList(
			"could not resolve host",
			"ireadblock failed");
	private static final List<String> RESOURCE_PATTERNS = Arrays.asList(
			"no space left on device",
			"disk full",
			"free disk space available");

	@Nullable
	@Override
	public FailureKind classify(@Nonnull RasterEngineException failure) {
		String message = failure.getMessage();
		if(message == null) {
			return null;
		}
		String lower = message.toLowerCase(Locale.ROOT);
		if(containsAny(lower, RESOURCE_PATTERNS)) {
			return FailureKind.RESOURCE;
		}
		if(containsAny(lower, NETWORK_PATTERNS)) {
			return FailureKind.TRANSIENT_NETWORK;
		}
		return null;
	}

	private static boolean containsAny(String text, List<String> patterns) {
		for(String p : patterns) {
			if(text.contains(p)) {
				return true;
			}
		}
		return false;
	}
}
