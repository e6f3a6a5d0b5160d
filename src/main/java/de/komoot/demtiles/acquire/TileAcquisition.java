package de.komoot.demtiles.acquire;

import com.vividsolutions.jts.geom.Envelope;
import de.komoot.demtiles.CancellationToken;
import de.komoot.demtiles.MaxRetriesExceededException;
import de.komoot.demtiles.PipelineCancelledException;
import de.komoot.demtiles.ResourceException;
import de.komoot.demtiles.engine.ProgressRelay;
import de.komoot.demtiles.engine.RasterEngine;
import de.komoot.demtiles.engine.RasterEngineException;
import de.komoot.demtiles.engine.WarpRequest;
import de.komoot.demtiles.source.SourceDescriptor;
import de.komoot.demtiles.source.WebMercator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.nio.file.Path;

/**
 * Fetches the tiles covering the requested bounds by warping the tile source into a local 3 band GeoTIFF.
 * Network failures are retried with a fixed delay, all other failures end the acquisition at once.
 */
public class TileAcquisition {
	private static final Logger logger = LoggerFactory.getLogger(TileAcquisition.class);
	public static final String FILE_NAME = "terrarium_rgb.tif";

	private final RasterEngine engine;
	private final RetryPolicy policy;
	private final FailureClassifier classifier;
	private final Sleeper sleeper;
	private final CancellationToken cancellation;

	public TileAcquisition(RasterEngine engine, RetryPolicy policy, FailureClassifier classifier, Sleeper sleeper, CancellationToken cancellation) {
		this.engine = engine;
		this.policy = policy;
		this.classifier = classifier;
		this.sleeper = sleeper;
		this.cancellation = cancellation;
	}

	/**
	 * @param descriptor the tile source
	 * @param bounds geographic bounds (EPSG:4326)
	 * @param resolution pixel size in EPSG:3857 metres
	 * @param cacheDir directory receiving {@value #FILE_NAME}
	 * @return path of the acquired RGB raster
	 * @throws MaxRetriesExceededException if every attempt failed with a network error
	 * @throws ResourceException if the engine ran out of disk space or memory
	 * @throws RasterEngineException for any other engine failure
	 */
	public Path acquire(@Nonnull SourceDescriptor descriptor, @Nonnull Envelope bounds, double resolution, @Nonnull Path cacheDir) {
		Path target = cacheDir.resolve(FILE_NAME);
		WarpRequest request = WarpRequest.builder()
				.outputBounds(bounds, WebMercator.GEOGRAPHIC_EPSG_CODE)
				.resolution(resolution, resolution)
				.targetSrs(WebMercator.EPSG_CODE)
				.build();
		int[] size = WebMercator.rasterSize(bounds, resolution);
		logger.info("Fetching {} for {} at {}m (about {}x{} px)", descriptor.getSourceUrl(), bounds, resolution, size[0], size[1]);

		RetryState state = new RetryState(policy.getMaxAttempts());
		while(true) {
			cancellation.throwIfCancelled("warp attempt " + state.nextAttempt());
			logger.info("Warp attempt {}/{}...", state.nextAttempt(), policy.getMaxAttempts());
			try {
				engine.warp(target, descriptor.getPath().toString(), request, new ProgressRelay("Warp"));
				return target;
			} catch(RasterEngineException e) {
				FailureKind kind = classifier.classify(e);
				state.failed(kind == null ? FailureKind.OTHER : kind);
				switch(state.getLastFailure()) {
					case TRANSIENT_NETWORK:
						logger.warn("Network glitch detected: {}", e.getMessage());
						if(state.isExhausted()) {
							logger.error("Max retries reached. Check your internet connection.");
							throw new MaxRetriesExceededException(state.getAttempts(), e);
						}
						logger.info("Retrying in {} seconds...", policy.getDelay().getSeconds());
						pause();
						break;
					case RESOURCE:
						throw new ResourceException("Tile acquisition ran out of resources: " + e.getMessage(), e);
					default:
						throw e;
				}
			}
		}
	}

	private void pause() {
		try {
			sleeper.sleep(policy.getDelay());
		} catch(InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new PipelineCancelledException("Interrupted while waiting for the next warp attempt");
		}
	}

	/**
	 * Attempt counter of one acquisition.
	 */
	static class RetryState {
		private final int maxAttempts;
		private int attempts;
		private FailureKind lastFailure;

		RetryState(int maxAttempts) {
			this.maxAttempts = maxAttempts;
		}

		void failed(FailureKind kind) {
			attempts++;
			lastFailure = kind;
		}

		int nextAttempt() {
			return attempts + 1;
		}

		int getAttempts() {
			return attempts;
		}

		FailureKind getLastFailure() {
			return lastFailure;
		}

		boolean isExhausted() {
			return attempts >= maxAttempts;
		}
	}
}
