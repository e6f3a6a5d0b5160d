package de.komoot.demtiles.acquire;

import de.komoot.demtiles.engine.RasterEngineException;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class FailureClassifierTest {
	private final FailureClassifier classifier = FailureClassifier.defaults();

	@Test
	public void testNetworkMessages() {
		assertEquals(FailureKind.TRANSIENT_NETWORK, classify("Could not resolve host: s3.amazonaws.com", -1));
		assertEquals(FailureKind.TRANSIENT_NETWORK, classify("source.xml, band 1: IReadBlock failed at X offset 12, Y offset 7: error", 1));
	}

	@Test
	public void testResourceMessages() {
		assertEquals(FailureKind.RESOURCE, classify("Write error: No space left on device", 1));
		assertEquals(FailureKind.RESOURCE, classify("Disk full", -1));
	}

	@Test
	public void testErrorNumberWinsOverMessage() {
		assertEquals(FailureKind.RESOURCE, classify("IReadBlock failed", ErrorNumberClassifier.CPLE_OUT_OF_MEMORY));
		assertEquals(FailureKind.TRANSIENT_NETWORK, classify("Something odd", ErrorNumberClassifier.CPLE_HTTP_RESPONSE));
		assertEquals(FailureKind.RESOURCE, classify("Permission denied", ErrorNumberClassifier.CPLE_NO_WRITE_ACCESS));
	}

	@Test
	public void testUnknownIsOther() {
		assertEquals(FailureKind.OTHER, classify("Attempt to create 0x0 dataset is illegal", 1));
		assertEquals(FailureKind.OTHER, classify("Cannot open source.xml", 4));
	}

	@Test
	public void testSingleStrategiesAbstain() {
		assertNull(new ErrorNumberClassifier().classify(new RasterEngineException("Could not resolve host: x")));
		assertNull(new MessagePatternClassifier().classify(new RasterEngineException("HTTP error code : 503", 11, null)));
	}

	private FailureKind classify(String message, int errorNumber) {
		return classifier.classify(new RasterEngineException(message, errorNumber, null));
	}
}
