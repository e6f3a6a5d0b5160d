package de.komoot.demtiles.acquire;

import de.komoot.demtiles.engine.RasterEngineException;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.List;

/**
 * Asks its delegates in order, the first answer wins. Never returns null.
 */
public class ChainedFailureClassifier implements FailureClassifier {
	private final List<FailureClassifier> delegates;

	public ChainedFailureClassifier(FailureClassifier... delegates) {
		this.delegates = Arrays.asList(delegates);
	}

	@Nonnull
	@Override
	public FailureKind classify(@Nonnull RasterEngineException failure) {
		for(FailureClassifier delegate : delegates) {
			FailureKind kind = delegate.classify(failure);
			if(kind != null) {
				return kind;
			}
		}
		return FailureKind.OTHER;
	}
}
