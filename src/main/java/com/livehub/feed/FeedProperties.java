package com.livehub.feed;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;

@Validated
@ConfigurationProperties(prefix = "live-hub.feed")
public record FeedProperties(
		@NotBlank String mode,
		String url,
		List<String> symbols,
		Duration syntheticInterval,
		Path replayFile,
		Duration replayDelay,
		Duration reconnectBackoffMin,
		Duration reconnectBackoffMax) {

	public List<String> resolvedSymbols() {
		if (symbols != null && !symbols.isEmpty()) {
			return symbols;
		}
		return List.of("BTCUSDT");
	}

	public Duration resolvedSyntheticInterval() {
		return syntheticInterval != null ? syntheticInterval : Duration.ofMillis(250);
	}

	public Duration resolvedReplayDelay() {
		return replayDelay != null ? replayDelay : Duration.ZERO;
	}

	public Duration resolvedReconnectBackoffMin() {
		return reconnectBackoffMin != null ? reconnectBackoffMin : Duration.ofSeconds(2);
	}

	public Duration resolvedReconnectBackoffMax() {
		return reconnectBackoffMax != null ? reconnectBackoffMax : Duration.ofSeconds(60);
	}
}
