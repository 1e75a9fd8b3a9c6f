package com.baykanat.iot.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/** POST /ingest gövdesi; API katmanında doğrulanır, sonra kuyruğa girer. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Telemetry ingestion payload")
public class IngestRequest {

    @NotBlank(message = "app_id is required")
    @Size(max = 255, message = "app_id must be at most 255 characters")
    @JsonProperty("app_id")
    @Schema(description = "Logical producer / application id", example = "greenhouse-gw")
    private String appId;

    @NotNull(message = "ts is required")
    @Positive(message = "ts must be epoch ms > 0")
    @Max(value = 253_402_300_799_999L, message = "ts must be epoch ms <= 253402300799999")
    @JsonProperty("ts")
    @Schema(description = "Event timestamp as epoch milliseconds", example = "1771156800000")
    private Long ts;

    @NotNull(message = "payload is required")
    @JsonProperty("payload")
    @Schema(description = "Free-form telemetry body", example = "{\"temperature\": 21.4, \"humidity\": 48}")
    private Map<String, Object> payload;

    @Size(max = 255, message = "device_id must be at most 255 characters")
    @JsonProperty("device_id")
    @Schema(description = "Device id; defaults to app_id", example = "esp32-0042")
    private String deviceId;

    @Size(max = 255, message = "msg_id must be at most 255 characters")
    @JsonProperty("msg_id")
    @Schema(description = "Idempotency token; (app_id, msg_id) is stored at most once", example = "b7c1e2d0-0001")
    private String msgId;

    @Size(max = 255, message = "topic must be at most 255 characters")
    @JsonProperty("topic")
    @Schema(description = "Origin label; defaults to app_id", example = "greenhouse/zone-1")
    private String topic;

    @Size(max = 100, message = "device_type must be at most 100 characters")
    @JsonProperty("device_type")
    @Schema(description = "Device type; defaults to 'unknown'", example = "ESP32")
    private String deviceType;
}
