package com.livehub.ingest;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.livehub.domain.repository.TickRepository;
import com.livehub.feed.Tick;
import com.livehub.hub.BroadcastHub;

@Configuration
@EnableConfigurationProperties(IngestionProperties.class)
public class IngestionConfiguration {

	@Bean
	public BatchIngestionService batchIngestionService(IngestionProperties properties) {
		return new BatchIngestionService(properties);
	}

	@Bean
	public JpaTickBatchWriter jpaTickBatchWriter(TickRepository tickRepository) {
		return new JpaTickBatchWriter(tickRepository);
	}

	@Bean
	@ConditionalOnProperty(prefix = "live-hub.ingestion", name = "archive-enabled", havingValue = "true")
	public TickArchiver tickArchiver(
			BroadcastHub<Tick> tickHub,
			BatchIngestionService batchIngestionService,
			JpaTickBatchWriter jpaTickBatchWriter,
			IngestionProperties properties) {
		return new TickArchiver(tickHub, batchIngestionService, jpaTickBatchWriter, properties);
	}
}
