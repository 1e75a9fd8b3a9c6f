package com.baykanat.iot.ingestion.api.controller;

import com.baykanat.iot.ingestion.api.dto.DeleteResponse;
import com.baykanat.iot.ingestion.api.dto.DeviceInfoResponse;
import com.baykanat.iot.ingestion.api.dto.TelemetryRecordResponse;
import com.baykanat.iot.ingestion.api.dto.TelemetryStatsResponse;
import com.baykanat.iot.ingestion.domain.service.TelemetryQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** /api/v1 altında saklanan telemetry sorguları. */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
@Tag(name = "Telemetry", description = "Query stored telemetry")
public class TelemetryQueryController {

    private final TelemetryQueryService queryService;

    @GetMapping("/telemetry")
    @Operation(summary = "List telemetry", description = "Newest first, optionally filtered by device id and type")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Telemetry retrieved"),
            @ApiResponse(responseCode = "422", description = "limit or offset out of range")
    })
    public ResponseEntity<List<TelemetryRecordResponse>> getTelemetry(
            @Parameter(description = "Filter by device id", example = "esp32-0042")
            @RequestParam(value = "device_id", required = false) String deviceId,

            @Parameter(description = "Filter by device type", example = "ESP32")
            @RequestParam(value = "device_type", required = false) String deviceType,

            @Parameter(description = "Page size (1-1000)", example = "100")
            @RequestParam(value = "limit", defaultValue = "100") @Min(1) @Max(1000) int limit,

            @Parameter(description = "Rows to skip", example = "0")
            @RequestParam(value = "offset", defaultValue = "0") @Min(0) int offset
    ) {
        return ResponseEntity.ok(queryService.findTelemetry(deviceId, deviceType, limit, offset));
    }

    @GetMapping("/devices")
    @Operation(summary = "List devices", description = "Last seen time and message count per device")
    public ResponseEntity<List<DeviceInfoResponse>> getDevices() {
        return ResponseEntity.ok(queryService.findDevices());
    }

    @GetMapping("/device/{deviceId}/latest")
    @Operation(summary = "Latest telemetry of a device")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Latest record"),
            @ApiResponse(responseCode = "404", description = "Device has no telemetry")
    })
    public ResponseEntity<TelemetryRecordResponse> getLatest(@PathVariable("deviceId") String deviceId) {
        return ResponseEntity.ok(queryService.findLatest(deviceId));
    }

    @GetMapping("/device/{deviceId}/history")
    @Operation(summary = "Telemetry history of a device", description = "Records of the last N hours (1-168)")
    public ResponseEntity<List<TelemetryRecordResponse>> getHistory(
            @PathVariable("deviceId") String deviceId,
            @Parameter(description = "Look-back window in hours", example = "24")
            @RequestParam(value = "hours", defaultValue = "24") @Min(1) @Max(168) int hours
    ) {
        return ResponseEntity.ok(queryService.findHistory(deviceId, hours));
    }

    @GetMapping("/stats")
    @Operation(summary = "Stored telemetry statistics")
    public ResponseEntity<TelemetryStatsResponse> getStats() {
        return ResponseEntity.ok(queryService.getStats());
    }

    @DeleteMapping("/telemetry")
    @Operation(summary = "Delete old telemetry", description = "Deletes records older than N days (1-365)")
    public ResponseEntity<DeleteResponse> deleteOldTelemetry(
            @Parameter(description = "Age threshold in days", example = "30")
            @RequestParam(value = "days", defaultValue = "30") @Min(1) @Max(365) int days
    ) {
        return ResponseEntity.ok(queryService.deleteOlderThan(days));
    }
}
