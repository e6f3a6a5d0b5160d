package de.komoot.demtiles.acquire;

import de.komoot.demtiles.engine.RasterEngineException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Decides from an engine failure whether it is worth retrying.
 */
public interface FailureClassifier {

	/**
	 * @param failure the failure of one attempt
	 * @return the kind or null if this classifier can not tell
	 */
	@Nullable
	FailureKind classify(@Nonnull RasterEngineException failure);

	/**
	 * Structured error numbers first, message patterns as fallback, {@link FailureKind#OTHER} if neither knows.
	 */
	static FailureClassifier defaults() {
		return new ChainedFailureClassifier(new ErrorNumberClassifier(), new MessagePatternClassifier());
	}
}
