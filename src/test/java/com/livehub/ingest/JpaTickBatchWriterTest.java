package com.livehub.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;

import com.livehub.domain.entity.TickEntity;
import com.livehub.domain.repository.TickRepository;
import com.livehub.feed.Tick;

import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

class JpaTickBatchWriterTest {

	private final TickRepository repository = mock(TickRepository.class);
	private final JpaTickBatchWriter writer = new JpaTickBatchWriter(repository, Schedulers.immediate());

	@Test
	void savesBatchAndReportsStoredCount() {
		when(repository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));

		StepVerifier.create(writer.write("ticks", List.of(
						new Tick("BTCUSDT", 100.5, 1.0, 1L),
						new Tick("ETHUSDT", 10.0, 2.0, 2L))))
				.expectNext(2)
				.verifyComplete();
	}

	@Test
	void transientStoreErrorBecomesRejection() {
		when(repository.saveAll(anyList())).thenThrow(new QueryTimeoutException("lock wait timeout"));

		StepVerifier.create(writer.write("ticks", List.of(new Tick("BTCUSDT", 1.0, 1.0, 1L))))
				.expectErrorSatisfies(error -> assertThat(error)
						.isInstanceOf(BatchWriteRejectedException.class)
						.hasMessageContaining("lock wait timeout"))
				.verify();
	}

	@Test
	void permanentStoreErrorIsPassedThrough() {
		when(repository.saveAll(anyList())).thenThrow(new DataIntegrityViolationException("duplicate"));

		StepVerifier.create(writer.write("ticks", List.of(new Tick("BTCUSDT", 1.0, 1.0, 1L))))
				.expectError(DataIntegrityViolationException.class)
				.verify();
	}

	@Test
	void mapsTicksToEntities() {
		List<TickEntity> entities = JpaTickBatchWriter.toEntities(List.of(new Tick("BTCUSDT", 42000.25, 0.5, 99L)));

		assertThat(entities).singleElement().satisfies(entity -> {
			assertThat(entity.getSymbol()).isEqualTo("BTCUSDT");
			assertThat(entity.getPrice()).isEqualByComparingTo(new BigDecimal("42000.25"));
			assertThat(entity.getQuantity()).isEqualByComparingTo(new BigDecimal("0.5"));
			assertThat(entity.getEventTimeMs()).isEqualTo(99L);
			assertThat(entity.getArchivedAt()).isNotNull();
		});
	}
}
