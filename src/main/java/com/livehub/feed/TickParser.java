package com.livehub.feed;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads one tick from a JSON text frame or line. Accepts both the compact form
 * ({@code {"s":"BTCUSDT","p":"42000.1","q":"0.5","E":1700000000000}}) and the same payload wrapped in a
 * {@code data} envelope, as combined streams deliver it.
 */
public class TickParser {

	private static final Logger LOGGER = LoggerFactory.getLogger(TickParser.class);

	private final ObjectMapper objectMapper;

	public TickParser(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public Optional<Tick> parse(String payload) {
		if (payload == null || payload.isBlank()) {
			return Optional.empty();
		}
		try {
			JsonNode node = objectMapper.readTree(payload);
			JsonNode dataNode = node.hasNonNull("data") ? node.get("data") : node;
			String symbol = dataNode.path("s").asText();
			if (symbol == null || symbol.isBlank()) {
				return Optional.empty();
			}
			if (!dataNode.hasNonNull("p")) {
				return Optional.empty();
			}
			double price = dataNode.path("p").asDouble();
			double quantity = dataNode.path("q").asDouble(0.0);
			long eventTime = dataNode.hasNonNull("E")
					? dataNode.path("E").asLong()
					: dataNode.path("T").asLong(System.currentTimeMillis());
			return Optional.of(new Tick(symbol, price, quantity, eventTime));
		} catch (JsonProcessingException ex) {
			LOGGER.warn("EVENT=TICK_PARSE_FAIL reason={}", ex.getOriginalMessage());
			return Optional.empty();
		}
	}
}
