package com.livehub.view;

import java.time.Duration;
import java.util.Optional;

import com.livehub.feed.Tick;

/**
 * Folds the ticks of one symbol into interval-aligned OHLCV candles. A candle is emitted when the first
 * tick of a later bucket arrives.
 */
public class CandleAggregator {

	private final String symbol;
	private final long intervalMs;

	private long bucket = Long.MIN_VALUE;
	private Candle current;

	public CandleAggregator(String symbol, Duration interval) {
		if (interval.isZero() || interval.isNegative()) {
			throw new IllegalArgumentException("interval must be positive, got: " + interval);
		}
		this.symbol = symbol;
		this.intervalMs = interval.toMillis();
	}

	public Optional<Candle> update(Tick tick) {
		long tickBucket = Math.floorDiv(tick.eventTimeMs(), intervalMs);
		if (current == null) {
			open(tick, tickBucket);
			return Optional.empty();
		}
		if (tickBucket > bucket) {
			Candle completed = current;
			open(tick, tickBucket);
			return Optional.of(completed);
		}
		// late ticks from an already closed bucket are folded into the open candle
		double high = Math.max(current.high(), tick.price());
		double low = Math.min(current.low(), tick.price());
		current = new Candle(symbol, current.open(), high, low, tick.price(), current.volume() + tick.quantity(),
				current.trades() + 1, current.openTime(), current.closeTime());
		return Optional.empty();
	}

	public Optional<Candle> flush() {
		Candle open = current;
		current = null;
		bucket = Long.MIN_VALUE;
		return Optional.ofNullable(open);
	}

	private void open(Tick tick, long tickBucket) {
		bucket = tickBucket;
		long openTime = tickBucket * intervalMs;
		current = new Candle(symbol, tick.price(), tick.price(), tick.price(), tick.price(), tick.quantity(), 1,
				openTime, openTime + intervalMs - 1);
	}
}
