package com.livehub.ingest;

import java.util.List;

import reactor.core.publisher.Mono;

/**
 * Writes one size-bounded batch to a destination. Implementations signal a full admission queue on the
 * destination side with {@link BatchWriteRejectedException} so the batch can be retried.
 */
public interface BatchWriter<R> {

	Mono<Integer> write(String destination, List<R> batch);
}
