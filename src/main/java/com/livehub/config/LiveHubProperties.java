package com.livehub.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.livehub.hub.HubSettings;
import com.livehub.hub.OverflowPolicy;

import jakarta.validation.constraints.PositiveOrZero;

@Validated
@ConfigurationProperties(prefix = "live-hub")
public record LiveHubProperties(
		@PositiveOrZero int bufferSize,
		OverflowPolicy overflowPolicy,
		Duration candleInterval,
		@PositiveOrZero int windowSize) {

	public HubSettings settings(String hubName) {
		return new HubSettings(hubName, resolvedBufferSize(), resolvedOverflowPolicy());
	}

	public int resolvedBufferSize() {
		return bufferSize > 0 ? bufferSize : HubSettings.DEFAULT_BUFFER_SIZE;
	}

	public OverflowPolicy resolvedOverflowPolicy() {
		return overflowPolicy != null ? overflowPolicy : OverflowPolicy.DROP_OLDEST;
	}

	public Duration resolvedCandleInterval() {
		return candleInterval != null ? candleInterval : Duration.ofMinutes(1);
	}

	public int resolvedWindowSize() {
		return windowSize > 0 ? windowSize : 20;
	}
}
