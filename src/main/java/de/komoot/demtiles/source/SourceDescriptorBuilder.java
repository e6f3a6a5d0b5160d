package de.komoot.demtiles.source;

import de.komoot.demtiles.ConfigurationException;
import de.komoot.demtiles.PipelineException;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Writes a GDAL WMS/TMS descriptor for a Terrarium style tile service covering the whole Web Mercator extent.
 */
public class SourceDescriptorBuilder {
	private static final Logger logger = LoggerFactory.getLogger(SourceDescriptorBuilder.class);
	public static final String FILE_NAME = "source.xml";

	/**
	 * Writes {@value #FILE_NAME} into the cache directory, replacing an earlier one.
	 * @param sourceUrl tile URL template with {@code ${z}}, {@code ${x}} and {@code ${y}} placeholders
	 * @param cacheDir cache directory, also used by the engine for fetched tiles
	 * @return the descriptor
	 * @throws ConfigurationException if no source is given
	 */
	public SourceDescriptor build(@Nullable String sourceUrl, @Nonnull Path cacheDir) {
		if(sourceUrl == null || sourceUrl.trim().isEmpty()) {
			throw new ConfigurationException("'source' is required");
		}
		String url = sourceUrl.trim();
		Path target = cacheDir.resolve(FILE_NAME);
		try {
			FileUtils.writeStringToFile(target.toFile(), render(url, cacheDir.toAbsolutePath().normalize()), StandardCharsets.UTF_8);
		} catch(IOException e) {
			throw new PipelineException("Could not write source descriptor " + target, e);
		}
		logger.debug("Wrote source descriptor {} for {}", target, url);
		return new SourceDescriptor(target, url);
	}

	static String render(String url, Path absoluteCacheDir) {
		return String.format(Locale.US, "<GDAL_WMS>\n"
						+ "    <Service name=\"TMS\">\n"
						+ "        <ServerUrl>%s</ServerUrl>\n"
						+ "    </Service>\n"
						+ "    <DataWindow>\n"
						+ "        <UpperLeftX>%.2f</UpperLeftX>\n"
						+ "        <UpperLeftY>%.2f</UpperLeftY>\n"
						+ "        <LowerRightX>%.2f</LowerRightX>\n"
						+ "        <LowerRightY>%.2f</LowerRightY>\n"
						+ "        <TileLevel>%d</TileLevel>\n"
						+ "        <YOrigin>top</YOrigin>\n"
						+ "    </DataWindow>\n"
						+ "    <Projection>%s</Projection>\n"
						+ "    <BlockSizeX>%d</BlockSizeX>\n"
						+ "    <BlockSizeY>%d</BlockSizeY>\n"
						+ "    <BandsCount>%d</BandsCount>\n"
						+ "    <Cache><Path>%s</Path></Cache>\n"
						+ "</GDAL_WMS>",
				escape(url),
				-WebMercator.ORIGIN_SHIFT, WebMercator.ORIGIN_SHIFT, WebMercator.ORIGIN_SHIFT, -WebMercator.ORIGIN_SHIFT,
				WebMercator.ZOOM_LEVELS, WebMercator.EPSG_CODE,
				WebMercator.TILE_SIZE, WebMercator.TILE_SIZE, WebMercator.BAND_COUNT,
				escape(absoluteCacheDir.toString()));
	}

	private static String escape(String text) {
		return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
	}
}
