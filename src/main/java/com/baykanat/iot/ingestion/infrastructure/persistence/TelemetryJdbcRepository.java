package com.baykanat.iot.ingestion.infrastructure.persistence;

import com.baykanat.iot.ingestion.domain.model.TelemetryRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/** device_telemetry tablosuna JDBC batch insert. Dedup stratejisine göre ON CONFLICT DO NOTHING. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class TelemetryJdbcRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private static final String INSERT_SQL = """
            INSERT INTO device_telemetry (device_id, device_type, topic, app_id, msg_id, timestamp, payload, received_at)
            VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?)
            """;

    /**
     * Kayıtları tek JDBC batch ile yazar; satır başına etkilenen sayıyı döner (çakışmada 0).
     * Payload'lar DB'ye gitmeden önce serialize edilir, biri bile olmazsa batch hiç yazılmaz.
     */
    public int[] batchInsert(List<TelemetryRecord> records, DedupStrategy dedup) {
        List<String> payloads = records.stream().map(this::toJson).toList();
        String sql = INSERT_SQL + dedup.conflictClause();

        return jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                TelemetryRecord record = records.get(i);
                ps.setString(1, record.getDeviceId());
                ps.setString(2, record.getDeviceType());
                ps.setString(3, record.getTopic());
                ps.setString(4, record.getAppId());
                ps.setString(5, record.getMessageId());
                ps.setObject(6, toOffsetDateTime(Instant.ofEpochMilli(record.getTimestamp())));
                ps.setString(7, payloads.get(i));
                ps.setObject(8, toOffsetDateTime(record.getReceivedAt() != null ? record.getReceivedAt() : Instant.now()));
            }

            @Override
            public int getBatchSize() {
                return records.size();
            }
        });
    }

    private String toJson(TelemetryRecord record) {
        try {
            return objectMapper.writeValueAsString(record.getPayload());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "payload of device " + record.getDeviceId() + " is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private static OffsetDateTime toOffsetDateTime(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }
}
