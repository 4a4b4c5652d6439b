package com.livehub.ingest;

public class BatchWriteRejectedException extends RuntimeException {

	private final String destination;

	public BatchWriteRejectedException(String destination, String message) {
		super(message);
		this.destination = destination;
	}

	public BatchWriteRejectedException(String destination, String message, Throwable cause) {
		super(message, cause);
		this.destination = destination;
	}

	public String destination() {
		return destination;
	}
}
