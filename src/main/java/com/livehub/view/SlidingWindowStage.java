package com.livehub.view;

import java.util.ArrayDeque;
import java.util.List;
import java.util.function.Function;

import reactor.core.publisher.Flux;

/**
 * Emits the last {@code size} elements every time a new element arrives, once the window is full.
 */
public class SlidingWindowStage<T> implements Function<Flux<T>, Flux<List<T>>> {

	private final int size;

	public SlidingWindowStage(int size) {
		if (size <= 0) {
			throw new IllegalArgumentException("size must be > 0, got: " + size);
		}
		this.size = size;
	}

	@Override
	public Flux<List<T>> apply(Flux<T> elements) {
		return Flux.defer(() -> {
			ArrayDeque<T> window = new ArrayDeque<>(size);
			return elements.<List<T>>handle((element, sink) -> {
				if (window.size() == size) {
					window.pollFirst();
				}
				window.addLast(element);
				if (window.size() == size) {
					sink.next(List.copyOf(window));
				}
			});
		});
	}
}
