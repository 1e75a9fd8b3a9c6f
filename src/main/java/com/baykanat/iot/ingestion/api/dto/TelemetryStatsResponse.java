package com.baykanat.iot.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/** Saklanan telemetry üzerine genel istatistik. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Overall statistics about stored telemetry")
public class TelemetryStatsResponse {

    @JsonProperty("total_messages")
    @Schema(example = "1048576")
    private long totalMessages;

    @JsonProperty("total_devices")
    @Schema(example = "12")
    private long totalDevices;

    @JsonProperty("device_types")
    @Schema(description = "Message count per device type", example = "{\"ESP32\": 512000, \"STM32\": 536576}")
    private Map<String, Long> deviceTypes;

    @JsonProperty("oldest_message")
    private Instant oldestMessage;

    @JsonProperty("newest_message")
    private Instant newestMessage;
}
