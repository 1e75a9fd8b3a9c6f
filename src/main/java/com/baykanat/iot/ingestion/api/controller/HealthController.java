package com.baykanat.iot.ingestion.api.controller;

import com.baykanat.iot.ingestion.api.dto.HealthResponse;
import com.baykanat.iot.ingestion.config.AppProperties;
import com.baykanat.iot.ingestion.infrastructure.mqtt.MqttTelemetrySubscriber;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Liveness (/health) ve bağımlılık durumları (/). */
@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Health", description = "Service health")
public class HealthController {

    private final JdbcTemplate jdbcTemplate;
    private final AppProperties appProperties;
    private final ObjectProvider<MqttTelemetrySubscriber> mqttSubscriber;

    @GetMapping("/health")
    @Operation(summary = "Liveness check")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(HealthResponse.builder().status("ok").build());
    }

    @GetMapping("/")
    @Operation(summary = "Service info", description = "Name, version and dependency status")
    public ResponseEntity<HealthResponse> root() {
        return ResponseEntity.ok(HealthResponse.builder()
                .status("running")
                .service(appProperties.getName())
                .version(appProperties.getVersion())
                .database(databaseStatus())
                .mqtt(mqttStatus())
                .build());
    }

    private String databaseStatus() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return "connected";
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return "disconnected";
        }
    }

    private String mqttStatus() {
        MqttTelemetrySubscriber subscriber = mqttSubscriber.getIfAvailable();
        if (subscriber == null) {
            return "disabled";
        }
        return subscriber.isConnected() ? "connected" : "disconnected";
    }
}
