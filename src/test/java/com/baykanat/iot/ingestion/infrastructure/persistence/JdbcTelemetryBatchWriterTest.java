package com.baykanat.iot.ingestion.infrastructure.persistence;

import com.baykanat.iot.ingestion.domain.model.TelemetryRecord;
import com.baykanat.iot.ingestion.domain.pipeline.BatchPersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.sql.Statement;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JdbcTelemetryBatchWriter with a mocked repository.
 *
 * <p>Transaction and circuit breaker advice are not active here; they are covered by the
 * integration test.
 */
@ExtendWith(MockitoExtension.class)
class JdbcTelemetryBatchWriterTest {

    @Mock
    private TelemetryJdbcRepository repository;

    private final DedupStrategy dedup = DedupStrategy.keyed(List.of("app_id", "msg_id"));
    private JdbcTelemetryBatchWriter writer;

    @BeforeEach
    void setUp() {
        writer = new JdbcTelemetryBatchWriter("ingest", repository, dedup);
    }

    @Test
    @DisplayName("persist - returns the number of rows actually inserted")
    void returnsInsertedCount() {
        when(repository.batchInsert(anyList(), eq(dedup))).thenReturn(new int[]{1, 0, 1});

        int inserted = writer.persist(List.of(record("a"), record("b"), record("c")));

        assertThat(inserted).isEqualTo(2);
    }

    @Test
    @DisplayName("persist - empty batch never reaches the database")
    void emptyBatch() {
        assertThat(writer.persist(List.of())).isZero();
        verifyNoInteractions(repository);
    }

    @Test
    @DisplayName("persist - database failure surfaces as BatchPersistenceException")
    void wrapsDatabaseFailure() {
        when(repository.batchInsert(anyList(), any()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> writer.persist(List.of(record("a"))))
                .isInstanceOf(BatchPersistenceException.class)
                .hasMessageContaining("connection refused");
    }

    @Test
    @DisplayName("countInserted - SUCCESS_NO_INFO counts as inserted, failures and conflicts do not")
    void countInserted() {
        int[] counts = {1, 0, Statement.SUCCESS_NO_INFO, Statement.EXECUTE_FAILED, 1};

        assertThat(JdbcTelemetryBatchWriter.countInserted(counts)).isEqualTo(3);
    }

    private static TelemetryRecord record(String msgId) {
        return TelemetryRecord.builder()
                .deviceId("dev-1")
                .appId("app-1")
                .messageId(msgId)
                .timestamp(1771156800000L)
                .payload(Map.of("v", 1))
                .build();
    }
}
