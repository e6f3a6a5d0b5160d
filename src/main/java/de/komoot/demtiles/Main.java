package de.komoot.demtiles;

import de.komoot.demtiles.config.PipelineConfig;
import de.komoot.demtiles.engine.RasterEngine;
import de.komoot.demtiles.engine.gdal.GdalRasterEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.PrintStream;
import java.util.function.Supplier;

/**
 * Command line entry point: {@code dem-tile-pipeline <config.yml>}.
 */
public class Main {
	private static final Logger logger = LoggerFactory.getLogger(Main.class);
	private static final long SHUTDOWN_GRACE_MILLIS = 5000;

	public static void main(String[] args) {
		CancellationToken cancellation = new CancellationToken();
		ShutdownGuard guard = new ShutdownGuard(cancellation, Thread.currentThread(), SHUTDOWN_GRACE_MILLIS);
		Runtime.getRuntime().addShutdownHook(new Thread(guard, "dem-tile-pipeline-shutdown"));

		int status;
		try {
			status = run(args, System.err, GdalRasterEngine::new, cancellation);
		} finally {
			guard.finish();
		}
		// only the shutdown hook cancels, System.exit blocks while hooks are running
		if(cancellation.isCancelled() == false) {
			System.exit(status);
		}
	}

	/**
	 * @return the process exit status
	 */
	static int run(String[] args, PrintStream err, Supplier<RasterEngine> engines, CancellationToken cancellation) {
		if(args.length < 1) {
			err.println("Usage: dem-tile-pipeline <config.yml>");
			return 1;
		}
		File configFile = new File(args[0]);
		if(configFile.exists() == false) {
			err.println("Error: Config file not found at " + args[0]);
			return 1;
		}
		try {
			PipelineConfig config = PipelineConfig.load(configFile);
			logger.info("Initialized with config: {}", configFile);
			RasterEngine engine;
			try {
				engine = engines.get();
			} catch(LinkageError e) {
				logger.error("Could not load the native GDAL libraries: {}", e.getMessage(), e);
				return 1;
			}
			new DemPipeline(config, engine, cancellation).run();
			return 0;
		} catch(PipelineCancelledException e) {
			logger.warn("{}", e.getMessage());
			return 130;
		} catch(PipelineException e) {
			logger.error("Run failed: {}", e.getMessage(), e);
			return 1;
		}
	}
}
