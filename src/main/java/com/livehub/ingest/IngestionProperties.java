package com.livehub.ingest;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.PositiveOrZero;

@Validated
@ConfigurationProperties(prefix = "live-hub.ingestion")
public record IngestionProperties(
		@PositiveOrZero int batchSize,
		@PositiveOrZero int maxRetries,
		Duration retryBackoffMin,
		Duration retryBackoffMax,
		boolean archiveEnabled,
		Duration archiveFlushInterval) {

	public int resolvedBatchSize() {
		return batchSize > 0 ? batchSize : 100;
	}

	public int resolvedMaxRetries() {
		return maxRetries > 0 ? maxRetries : 5;
	}

	public Duration resolvedRetryBackoffMin() {
		return retryBackoffMin != null ? retryBackoffMin : Duration.ofMillis(200);
	}

	public Duration resolvedRetryBackoffMax() {
		return retryBackoffMax != null ? retryBackoffMax : Duration.ofSeconds(10);
	}

	public Duration resolvedArchiveFlushInterval() {
		return archiveFlushInterval != null ? archiveFlushInterval : Duration.ofSeconds(5);
	}
}
