package com.baykanat.iot.ingestion.domain.exception;

/** Ingest kuyruğu dolu; GlobalExceptionHandler 503 + Retry-After döner. */
public class BackpressureException extends RuntimeException {

    private final long retryAfterSeconds;

    public BackpressureException(String message, long retryAfterSeconds) {
        super(message);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
