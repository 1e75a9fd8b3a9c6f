package com.baykanat.iot.ingestion.infrastructure.mqtt;

import com.baykanat.iot.ingestion.config.AppProperties;
import com.baykanat.iot.ingestion.domain.model.TelemetryRecord;
import com.baykanat.iot.ingestion.domain.pipeline.IngestionPipeline;
import com.baykanat.iot.ingestion.domain.service.TelemetryNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeviceMessageHandlerTest {

    private static final String TOPIC = "devices/dev-1/telemetry";
    private static final byte[] BODY = "{\"ts\":1771156800000}".getBytes();

    @Mock
    private TelemetryNormalizer normalizer;

    @Mock
    private IngestionPipeline devicePipeline;

    private DeviceMessageHandler handler;
    private final TelemetryRecord record = TelemetryRecord.builder().deviceId("dev-1").build();

    @BeforeEach
    void setUp() {
        handler = new DeviceMessageHandler(normalizer, devicePipeline, new AppProperties());
    }

    @Test
    @DisplayName("handle - valid message is offered to the device pipeline")
    void offersValidMessage() {
        when(normalizer.fromMqtt(TOPIC, BODY)).thenReturn(Optional.of(record));
        when(devicePipeline.offer(record)).thenReturn(true);

        assertThat(handler.handle(TOPIC, BODY)).isTrue();
        assertThat(handler.getAcceptedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("handle - invalid message is dropped before the queue")
    void dropsInvalidMessage() {
        when(normalizer.fromMqtt(TOPIC, BODY)).thenReturn(Optional.empty());

        assertThat(handler.handle(TOPIC, BODY)).isFalse();
        verify(devicePipeline, never()).offer(any());
    }

    @Test
    @DisplayName("handle - full queue drops the message without throwing")
    void dropsOnBackpressure() {
        when(normalizer.fromMqtt(TOPIC, BODY)).thenReturn(Optional.of(record));
        when(devicePipeline.offer(record)).thenReturn(false);

        assertThat(handler.handle(TOPIC, BODY)).isFalse();
        assertThat(handler.getAcceptedCount()).isZero();
    }

    @Test
    @DisplayName("handle - unexpected errors never escape to the MQTT callback thread")
    void swallowsUnexpectedErrors() {
        when(normalizer.fromMqtt(TOPIC, BODY)).thenThrow(new IllegalStateException("boom"));

        assertThat(handler.handle(TOPIC, BODY)).isFalse();
    }
}
