package de.komoot.demtiles;

import de.komoot.demtiles.acquire.FailureClassifier;
import de.komoot.demtiles.acquire.RetryPolicy;
import de.komoot.demtiles.acquire.Sleeper;
import de.komoot.demtiles.acquire.TileAcquisition;
import de.komoot.demtiles.config.PipelineConfig;
import de.komoot.demtiles.decode.TerrariumDecoder;
import de.komoot.demtiles.engine.RasterDataset;
import de.komoot.demtiles.engine.RasterEngine;
import de.komoot.demtiles.engine.RasterGrid;
import de.komoot.demtiles.engine.VectorFormat;
import de.komoot.demtiles.export.OutputExporter;
import de.komoot.demtiles.mask.MaskEvaluator;
import de.komoot.demtiles.source.SourceDescriptor;
import de.komoot.demtiles.source.SourceDescriptorBuilder;
import de.komoot.demtiles.terrain.TerrainProcess;
import de.komoot.demtiles.terrain.TerrainProcessor;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * One run from tile source to output file: describe source, acquire, decode, derive, mask, export.
 * Runs synchronously on the calling thread and checks the cancellation token before every stage.
 * Intermediate rasters stay in the cache directory.
 */
public class DemPipeline {
	private static final Logger logger = LoggerFactory.getLogger(DemPipeline.class);

	private final PipelineConfig config;
	private final RasterEngine engine;
	private final CancellationToken cancellation;
	private final SourceDescriptorBuilder descriptors;
	private final TileAcquisition acquisition;
	private final TerrariumDecoder decoder;
	private final TerrainProcessor terrain;
	private final MaskEvaluator masks;
	private final OutputExporter exporter;

	public DemPipeline(PipelineConfig config, RasterEngine engine, CancellationToken cancellation) {
		this(config, engine, cancellation, RetryPolicy.DEFAULT, FailureClassifier.defaults(), Sleeper.THREAD);
	}

	public DemPipeline(PipelineConfig config, RasterEngine engine, CancellationToken cancellation,
					   RetryPolicy retryPolicy, FailureClassifier classifier, Sleeper sleeper) {
		this.config = config;
		this.engine = engine;
		this.cancellation = cancellation;
		this.descriptors = new SourceDescriptorBuilder();
		this.acquisition = new TileAcquisition(engine, retryPolicy, classifier, sleeper, cancellation);
		this.decoder = new TerrariumDecoder(engine);
		this.terrain = new TerrainProcessor(engine);
		this.masks = new MaskEvaluator();
		this.exporter = new OutputExporter(engine);
	}

	/**
	 * @return the written output
	 * @throws PipelineException on any failure, nothing is retried except network errors during acquisition
	 */
	public Path run() {
		TerrainProcess process = TerrainProcess.fromName(config.getProcess());
		if(VectorFormat.forPath(config.getOutput()) != null && config.isMasked() == false) {
			throw new ProcessingException("Vector output " + config.getOutput() + " needs a mask, configure 'mask.min' and/or 'mask.max'");
		}
		Path cacheDir = prepareCacheDir(config.getCacheDir());
		engine.configureTileCache(cacheDir);

		enter(PipelineStage.DESCRIBE_SOURCE);
		SourceDescriptor descriptor = descriptors.build(config.getSource(), cacheDir);

		enter(PipelineStage.ACQUIRE);
		Path rgb = acquisition.acquire(descriptor, config.getBounds(), config.getResolution(), cacheDir);

		enter(PipelineStage.DECODE);
		Path elevation = decoder.decodeToFile(rgb, cacheDir);

		enter(PipelineStage.PROCESS);
		Path processSource = terrain.process(elevation, process, config.getClipping(), cacheDir);

		Path output;
		try(RasterDataset processed = engine.open(processSource)) {
			enter(PipelineStage.MASK);
			RasterGrid result = masks.evaluate(processed, config.getMask());

			enter(PipelineStage.EXPORT);
			output = exporter.export(result, processed.getGeoreference(), config.getOutput());
		}
		logger.info("Process complete: {}", output);
		return output;
	}

	private void enter(PipelineStage stage) {
		cancellation.throwIfCancelled(stage.name());
		logger.debug("{}...", stage.getDescription());
	}

	private static Path prepareCacheDir(Path cacheDir) {
		try {
			FileUtils.forceMkdir(cacheDir.toFile());
		} catch(IOException e) {
			throw new PipelineException("Could not create cache directory " + cacheDir, e);
		}
		return cacheDir;
	}
}
