package com.baykanat.iot.ingestion.infrastructure.mqtt;

import com.baykanat.iot.ingestion.config.AppProperties;
import com.baykanat.iot.ingestion.config.PipelineConfig;
import com.baykanat.iot.ingestion.domain.model.TelemetryRecord;
import com.baykanat.iot.ingestion.domain.pipeline.IngestionPipeline;
import com.baykanat.iot.ingestion.domain.service.TelemetryNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Gelen MQTT mesajını normalize edip device pipeline'ına verir. Hiçbir durumda exception
 * fırlatmaz: geçersiz mesaj ve dolu kuyruk loglanıp düşürülür (MQTT'de geri basınç sinyali yok).
 */
@Slf4j
@Component
public class DeviceMessageHandler {

    private final TelemetryNormalizer normalizer;
    private final IngestionPipeline devicePipeline;
    private final int progressLogInterval;
    private final AtomicLong accepted = new AtomicLong();

    public DeviceMessageHandler(TelemetryNormalizer normalizer,
                                @Qualifier(PipelineConfig.DEVICE_PIPELINE) IngestionPipeline devicePipeline,
                                AppProperties appProperties) {
        this.normalizer = normalizer;
        this.devicePipeline = devicePipeline;
        this.progressLogInterval = appProperties.getMqtt().getProgressLogInterval();
    }

    /** Kayıt kuyruğa girdiyse true. */
    public boolean handle(String topic, byte[] payload) {
        try {
            Optional<TelemetryRecord> record = normalizer.fromMqtt(topic, payload);
            if (record.isEmpty()) {
                return false;
            }
            if (!devicePipeline.offer(record.get())) {
                log.warn("Device queue full, dropping message from {}", record.get().getDeviceId());
                return false;
            }

            long count = accepted.incrementAndGet();
            if (progressLogInterval > 0 && count % progressLogInterval == 0) {
                log.info("Received {} device messages (queue={})", count, devicePipeline.getQueueSize());
            }
            return true;
        } catch (Exception e) {
            log.error("Error processing message on topic {}: {}", topic, e.getMessage(), e);
            return false;
        }
    }

    public long getAcceptedCount() {
        return accepted.get();
    }
}
