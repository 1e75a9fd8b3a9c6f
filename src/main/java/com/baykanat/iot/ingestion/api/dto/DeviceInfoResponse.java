package com.baykanat.iot.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Cihaz özeti: son görülme ve mesaj sayısı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Device summary")
public class DeviceInfoResponse {

    @JsonProperty("device_id")
    @Schema(example = "esp32-0042")
    private String deviceId;

    @JsonProperty("device_type")
    @Schema(example = "ESP32")
    private String deviceType;

    @JsonProperty("last_seen")
    private Instant lastSeen;

    @JsonProperty("message_count")
    @Schema(example = "1284")
    private long messageCount;
}
