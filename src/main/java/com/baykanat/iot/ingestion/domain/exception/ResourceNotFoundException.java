package com.baykanat.iot.ingestion.domain.exception;

/** Bulunamayan cihaz / pipeline; 404. */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
