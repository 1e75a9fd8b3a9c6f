package com.baykanat.iot.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/** device_telemetry satırı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Persisted telemetry record")
public class TelemetryRecordResponse {

    @JsonProperty("id")
    private long id;

    @JsonProperty("device_id")
    @Schema(example = "esp32-0042")
    private String deviceId;

    @JsonProperty("device_type")
    @Schema(example = "ESP32")
    private String deviceType;

    @JsonProperty("topic")
    @Schema(example = "devices/esp32-0042/telemetry")
    private String topic;

    @JsonProperty("app_id")
    private String appId;

    @JsonProperty("msg_id")
    private String msgId;

    @JsonProperty("timestamp")
    private Instant timestamp;

    @JsonProperty("payload")
    private Map<String, Object> payload;

    @JsonProperty("received_at")
    private Instant receivedAt;

    @JsonProperty("created_at")
    private Instant createdAt;
}
