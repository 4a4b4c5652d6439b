package com.livehub.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Loads a finite, known-size list of records into a write-constrained destination as a sequence of
 * size-bounded batches, one batch in flight at a time.
 */
public class BatchIngestionService {

	private static final Logger LOGGER = LoggerFactory.getLogger(BatchIngestionService.class);

	private final IngestionProperties properties;

	public BatchIngestionService(IngestionProperties properties) {
		this.properties = properties;
	}

	/**
	 * A rejected batch is retried with backoff; batches written before it are never re-sent. A batch that
	 * still fails is reported and the remaining batches are written anyway.
	 */
	public <R> Mono<IngestionReport> ingest(String destination, List<R> records, BatchWriter<R> writer) {
		Objects.requireNonNull(destination, "destination");
		Objects.requireNonNull(records, "records");
		Objects.requireNonNull(writer, "writer");
		List<List<R>> batches = partition(records, properties.resolvedBatchSize());
		return Mono.defer(() -> {
			long startedAt = System.currentTimeMillis();
			return Flux.range(0, batches.size())
					.concatMap(index -> writeBatch(destination, index, batches.get(index), writer))
					.collectList()
					.map(results -> new IngestionReport(destination, records.size(), results))
					.doOnNext(report -> LOGGER.info(
							"EVENT=INGEST_DONE destination={} records={} batches={} written={} failedBatches={} attempts={} elapsedMs={}",
							destination,
							report.totalRecords(),
							report.batches().size(),
							report.writtenRecords(),
							report.failedBatches().size(),
							report.writeAttempts(),
							System.currentTimeMillis() - startedAt));
		});
	}

	static <R> List<List<R>> partition(List<R> records, int batchSize) {
		List<List<R>> batches = new ArrayList<>((records.size() + batchSize - 1) / batchSize);
		for (int from = 0; from < records.size(); from += batchSize) {
			int to = Math.min(records.size(), from + batchSize);
			batches.add(List.copyOf(records.subList(from, to)));
		}
		return batches;
	}

	private <R> Mono<BatchResult> writeBatch(String destination, int index, List<R> batch, BatchWriter<R> writer) {
		AtomicInteger attempts = new AtomicInteger();
		return Mono.defer(() -> {
			attempts.incrementAndGet();
			return writer.write(destination, batch);
		})
				.retryWhen(retrySpec(destination, index))
				.then(Mono.fromSupplier(() -> BatchResult.success(index, batch.size(), attempts.get())))
				.onErrorResume(error -> {
					Throwable cause = Exceptions.isRetryExhausted(error) && error.getCause() != null
							? error.getCause()
							: error;
					LOGGER.error("EVENT=INGEST_BATCH_FAILED destination={} batch={} size={} attempts={} reason={}",
							destination, index, batch.size(), attempts.get(), cause.getMessage());
					return Mono.just(BatchResult.failed(index, batch.size(), attempts.get(), cause));
				});
	}

	private Retry retrySpec(String destination, int index) {
		return Retry.backoff(properties.resolvedMaxRetries(), properties.resolvedRetryBackoffMin())
				.maxBackoff(properties.resolvedRetryBackoffMax())
				.jitter(0.3)
				.filter(BatchWriteRejectedException.class::isInstance)
				.doBeforeRetry(signal -> LOGGER.warn(
						"EVENT=INGEST_BATCH_REJECTED destination={} batch={} attempt={} reason={}",
						destination,
						index,
						signal.totalRetries() + 1,
						signal.failure().getMessage()));
	}
}
