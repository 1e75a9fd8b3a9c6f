package com.baykanat.iot.ingestion.infrastructure.persistence;

import com.baykanat.iot.ingestion.api.dto.DeviceInfoResponse;
import com.baykanat.iot.ingestion.api.dto.TelemetryRecordResponse;
import com.baykanat.iot.ingestion.api.dto.TelemetryStatsResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** device_telemetry üzerinde okuma sorguları ve eski kayıt silme. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class TelemetryQueryJdbcRepository {

    private static final String SELECT_COLUMNS = """
            SELECT id, device_id, device_type, topic, app_id, msg_id, timestamp, payload, received_at, created_at
            FROM device_telemetry
            """;

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    /** device_id / device_type filtreli, en yeni önce, sayfalı. */
    public List<TelemetryRecordResponse> findTelemetry(String deviceId, String deviceType, int limit, int offset) {
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append(" WHERE 1=1");
        List<Object> params = new ArrayList<>();

        if (deviceId != null && !deviceId.isBlank()) {
            sql.append(" AND device_id = ?");
            params.add(deviceId);
        }
        if (deviceType != null && !deviceType.isBlank()) {
            sql.append(" AND device_type = ?");
            params.add(deviceType);
        }

        sql.append(" ORDER BY timestamp DESC LIMIT ? OFFSET ?");
        params.add(limit);
        params.add(offset);

        String sqlStr = Objects.requireNonNull(sql.toString());
        return jdbcTemplate.query(sqlStr, telemetryRowMapper(), params.toArray());
    }

    /** Cihaz bazında son görülme ve mesaj sayısı. */
    public List<DeviceInfoResponse> findDevices() {
        String sql = """
                SELECT device_id,
                       device_type,
                       MAX(timestamp) AS last_seen,
                       COUNT(*) AS message_count
                FROM device_telemetry
                GROUP BY device_id, device_type
                ORDER BY last_seen DESC
                """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> DeviceInfoResponse.builder()
                .deviceId(rs.getString("device_id"))
                .deviceType(Objects.requireNonNullElse(rs.getString("device_type"), "unknown"))
                .lastSeen(toInstant(rs.getObject("last_seen", OffsetDateTime.class)))
                .messageCount(rs.getLong("message_count"))
                .build());
    }

    public Optional<TelemetryRecordResponse> findLatest(String deviceId) {
        String sql = SELECT_COLUMNS + " WHERE device_id = ? ORDER BY timestamp DESC LIMIT 1";
        return jdbcTemplate.query(sql, telemetryRowMapper(), deviceId).stream().findFirst();
    }

    /** Son N saatlik kayıtlar. */
    public List<TelemetryRecordResponse> findHistory(String deviceId, int hours) {
        String sql = SELECT_COLUMNS
                + " WHERE device_id = ? AND timestamp > NOW() - INTERVAL '1 hour' * ? ORDER BY timestamp DESC";
        return jdbcTemplate.query(sql, telemetryRowMapper(), deviceId, hours);
    }

    /** Toplam mesaj, cihaz sayısı, tip dağılımı ve zaman aralığı. */
    public TelemetryStatsResponse queryStats() {
        TelemetryStatsResponse stats = jdbcTemplate.queryForObject("""
                SELECT COUNT(*) AS total_messages,
                       COUNT(DISTINCT device_id) AS total_devices,
                       MIN(timestamp) AS oldest_message,
                       MAX(timestamp) AS newest_message
                FROM device_telemetry
                """, (rs, rowNum) -> TelemetryStatsResponse.builder()
                .totalMessages(rs.getLong("total_messages"))
                .totalDevices(rs.getLong("total_devices"))
                .oldestMessage(toInstant(rs.getObject("oldest_message", OffsetDateTime.class)))
                .newestMessage(toInstant(rs.getObject("newest_message", OffsetDateTime.class)))
                .build());

        Map<String, Long> deviceTypes = new LinkedHashMap<>();
        jdbcTemplate.query("""
                SELECT COALESCE(device_type, 'unknown') AS device_type, COUNT(*) AS count
                FROM device_telemetry
                GROUP BY COALESCE(device_type, 'unknown')
                ORDER BY count DESC
                """, rs -> {
            deviceTypes.put(rs.getString("device_type"), rs.getLong("count"));
        });

        Objects.requireNonNull(stats, "stats").setDeviceTypes(deviceTypes);
        return stats;
    }

    /** Belirtilen günden eski kayıtları siler; silinen sayıyı döner. */
    public int deleteOlderThan(int days) {
        String sql = "DELETE FROM device_telemetry WHERE timestamp < NOW() - INTERVAL '1 day' * ?";
        return jdbcTemplate.update(sql, days);
    }

    private RowMapper<TelemetryRecordResponse> telemetryRowMapper() {
        return (rs, rowNum) -> TelemetryRecordResponse.builder()
                .id(rs.getLong("id"))
                .deviceId(rs.getString("device_id"))
                .deviceType(rs.getString("device_type"))
                .topic(rs.getString("topic"))
                .appId(rs.getString("app_id"))
                .msgId(rs.getString("msg_id"))
                .timestamp(toInstant(rs.getObject("timestamp", OffsetDateTime.class)))
                .payload(readPayload(rs))
                .receivedAt(toInstant(rs.getObject("received_at", OffsetDateTime.class)))
                .createdAt(toInstant(rs.getObject("created_at", OffsetDateTime.class)))
                .build();
    }

    private Map<String, Object> readPayload(ResultSet rs) throws SQLException {
        String json = rs.getString("payload");
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Stored payload of row " + rs.getLong("id") + " is not valid JSON", e);
        }
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value != null ? value.toInstant() : null;
    }
}
