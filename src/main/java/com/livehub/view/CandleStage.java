package com.livehub.view;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.livehub.feed.Tick;

import reactor.core.publisher.Flux;

/**
 * Derived-view stage turning a tick stream into per-symbol candles. Open candles are flushed when the
 * tick stream completes.
 */
public class CandleStage implements Function<Flux<Tick>, Flux<Candle>> {

	private final Duration interval;

	public CandleStage(Duration interval) {
		this.interval = interval;
	}

	@Override
	public Flux<Candle> apply(Flux<Tick> ticks) {
		return Flux.defer(() -> {
			Map<String, CandleAggregator> aggregators = new LinkedHashMap<>();
			Flux<Candle> closed = ticks.<Candle>handle((tick, sink) -> aggregators
					.computeIfAbsent(tick.symbol(), symbol -> new CandleAggregator(symbol, interval))
					.update(tick)
					.ifPresent(sink::next));
			return closed.concatWith(Flux.defer(() -> Flux.fromIterable(flushAll(aggregators))));
		});
	}

	private static List<Candle> flushAll(Map<String, CandleAggregator> aggregators) {
		List<Candle> open = new ArrayList<>();
		for (CandleAggregator aggregator : aggregators.values()) {
			aggregator.flush().ifPresent(open::add);
		}
		return open;
	}
}
