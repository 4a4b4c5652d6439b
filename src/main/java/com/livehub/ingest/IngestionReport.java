package com.livehub.ingest;

import java.util.List;

public record IngestionReport(
		String destination,
		int totalRecords,
		List<BatchResult> batches) {

	public IngestionReport {
		batches = List.copyOf(batches);
	}

	public int writtenRecords() {
		return batches.stream().filter(BatchResult::success).mapToInt(BatchResult::size).sum();
	}

	public List<BatchResult> failedBatches() {
		return batches.stream().filter(batch -> !batch.success()).toList();
	}

	public int writeAttempts() {
		return batches.stream().mapToInt(BatchResult::attempts).sum();
	}

	public boolean isComplete() {
		return writtenRecords() == totalRecords;
	}
}
