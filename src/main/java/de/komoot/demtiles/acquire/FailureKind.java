package de.komoot.demtiles.acquire;

/**
 * How a failed acquisition attempt is treated.
 */
public enum FailureKind {
	/** host resolution, block read or HTTP errors; retried */
	TRANSIENT_NETWORK,
	/** disk space, memory or write access exhausted; never retried */
	RESOURCE,
	/** everything else; never retried */
	OTHER
}
