package com.baykanat.iot.ingestion.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/** Pipeline'dan geçen normalize edilmiş telemetry kaydı; MQTT ve HTTP için tek şekil. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TelemetryRecord {

    private String deviceId;
    private String deviceType;
    /** MQTT topic'i veya HTTP tarafında topic/app_id. */
    private String topic;
    private String appId;     // sadece HTTP
    private String messageId; // sadece HTTP, idempotency token
    /** Epoch milisaniye. */
    private long timestamp;
    private Map<String, Object> payload;
    private Instant receivedAt;
}
