package com.livehub.ingest;

public record BatchResult(
		int index,
		int size,
		int attempts,
		boolean success,
		boolean rejected,
		String error) {

	public static BatchResult success(int index, int size, int attempts) {
		return new BatchResult(index, size, attempts, true, false, null);
	}

	public static BatchResult failed(int index, int size, int attempts, Throwable error) {
		return new BatchResult(index, size, attempts, false, error instanceof BatchWriteRejectedException,
				error == null ? "unknown" : error.getMessage());
	}
}
