package com.baykanat.iot.ingestion.domain.pipeline;

/** Batch yazımı başarısız; batch'in tamamı hata sayılır ve düşürülür. */
public class BatchPersistenceException extends RuntimeException {

    public BatchPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
