package com.livehub.view;

public record Candle(
		String symbol,
		double open,
		double high,
		double low,
		double close,
		double volume,
		long trades,
		long openTime,
		long closeTime) {
}
