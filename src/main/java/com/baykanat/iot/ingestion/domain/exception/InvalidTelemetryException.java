package com.baykanat.iot.ingestion.domain.exception;

/** Normalizasyon sırasında reddedilen istek (ör. ts <= 0); HTTP tarafında 422. */
public class InvalidTelemetryException extends RuntimeException {

    public InvalidTelemetryException(String message) {
        super(message);
    }
}
