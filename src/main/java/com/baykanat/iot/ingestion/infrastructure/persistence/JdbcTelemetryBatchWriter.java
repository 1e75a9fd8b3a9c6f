package com.baykanat.iot.ingestion.infrastructure.persistence;

import com.baykanat.iot.ingestion.domain.model.TelemetryRecord;
import com.baykanat.iot.ingestion.domain.pipeline.BatchPersistenceException;
import com.baykanat.iot.ingestion.domain.pipeline.TelemetryBatchWriter;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Statement;
import java.util.List;

/**
 * Batch'i tek transaction'da yazar: ya hepsi ya hiçbiri. Store erişilemezken circuit breaker
 * açılır ve batch'ler bağlantı timeout'u beklemeden hata verir.
 */
@Slf4j
public class JdbcTelemetryBatchWriter implements TelemetryBatchWriter {

    private final String pipelineName;
    private final TelemetryJdbcRepository repository;
    private final DedupStrategy dedupStrategy;

    public JdbcTelemetryBatchWriter(String pipelineName, TelemetryJdbcRepository repository,
                                    DedupStrategy dedupStrategy) {
        this.pipelineName = pipelineName;
        this.repository = repository;
        this.dedupStrategy = dedupStrategy;
    }

    @Override
    @Transactional
    @CircuitBreaker(name = "telemetryWriter", fallbackMethod = "persistFallback")
    public int persist(List<TelemetryRecord> batch) {
        if (batch.isEmpty()) {
            return 0;
        }
        try {
            int[] counts = repository.batchInsert(batch, dedupStrategy);
            int inserted = countInserted(counts);
            log.debug("[{}] Batch insert completed: {} records, {} inserted", pipelineName, batch.size(), inserted);
            return inserted;
        } catch (RuntimeException e) {
            throw new BatchPersistenceException(
                    "batch of " + batch.size() + " records failed: " + e.getMessage(), e);
        }
    }

    /** SUCCESS_NO_INFO satırı eklenmiş sayılır. */
    static int countInserted(int[] counts) {
        int inserted = 0;
        for (int count : counts) {
            if (count > 0) {
                inserted += count;
            } else if (count == Statement.SUCCESS_NO_INFO) {
                inserted++;
            }
        }
        return inserted;
    }

    /** Circuit breaker açıkken veya yazım hata verdiğinde. */
    @SuppressWarnings("unused")
    private int persistFallback(List<TelemetryRecord> batch, CallNotPermittedException ex) {
        log.warn("[{}] Circuit breaker is OPEN for telemetry writer, failing batch of {} records",
                pipelineName, batch.size());
        throw new BatchPersistenceException("telemetry store unavailable (circuit breaker open)", ex);
    }

    @SuppressWarnings("unused")
    private int persistFallback(List<TelemetryRecord> batch, Exception ex) {
        if (ex instanceof BatchPersistenceException persistenceException) {
            throw persistenceException;
        }
        throw new BatchPersistenceException("batch of " + batch.size() + " records failed: " + ex.getMessage(), ex);
    }
}
