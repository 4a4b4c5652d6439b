package com.livehub.ingest;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.dao.TransientDataAccessException;

import com.livehub.domain.entity.TickEntity;
import com.livehub.domain.repository.TickRepository;
import com.livehub.feed.Tick;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Stores tick batches through JPA. Transient store errors (lock timeouts, pool exhaustion, query timeouts)
 * mean the store cannot admit the batch right now and are reported as rejections.
 */
public class JpaTickBatchWriter implements BatchWriter<Tick> {

	private final TickRepository repository;
	private final Scheduler scheduler;

	public JpaTickBatchWriter(TickRepository repository) {
		this(repository, Schedulers.boundedElastic());
	}

	JpaTickBatchWriter(TickRepository repository, Scheduler scheduler) {
		this.repository = repository;
		this.scheduler = scheduler;
	}

	@Override
	public Mono<Integer> write(String destination, List<Tick> batch) {
		return Mono.fromCallable(() -> repository.saveAll(toEntities(batch)).size())
				.subscribeOn(scheduler)
				.onErrorMap(TransientDataAccessException.class, ex -> new BatchWriteRejectedException(destination,
						"Store rejected batch of " + batch.size() + " ticks: " + ex.getMessage(), ex));
	}

	static List<TickEntity> toEntities(List<Tick> batch) {
		return batch.stream().map(JpaTickBatchWriter::toEntity).toList();
	}

	private static TickEntity toEntity(Tick tick) {
		TickEntity entity = new TickEntity();
		entity.setSymbol(tick.symbol());
		entity.setPrice(BigDecimal.valueOf(tick.price()));
		entity.setQuantity(BigDecimal.valueOf(tick.quantity()));
		entity.setEventTimeMs(tick.eventTimeMs());
		return entity;
	}
}
