package com.baykanat.iot.ingestion.config;

import com.baykanat.iot.ingestion.domain.pipeline.IngestionPipeline;
import com.baykanat.iot.ingestion.domain.pipeline.PipelineRegistry;
import com.baykanat.iot.ingestion.infrastructure.persistence.DedupStrategy;
import com.baykanat.iot.ingestion.infrastructure.persistence.JdbcTelemetryBatchWriter;
import com.baykanat.iot.ingestion.infrastructure.persistence.TelemetryJdbcRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/** İki pipeline: device (MQTT, dedup yok) ve ingest (HTTP, app_id + msg_id dedup). */
@Configuration
public class PipelineConfig {

    public static final String DEVICE_PIPELINE = "devicePipeline";
    public static final String INGEST_PIPELINE = "ingestPipeline";

    public static final String DEVICE_WRITER = "deviceTelemetryWriter";
    public static final String INGEST_WRITER = "ingestTelemetryWriter";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(DEVICE_WRITER)
    public JdbcTelemetryBatchWriter deviceTelemetryWriter(TelemetryJdbcRepository repository,
                                                         AppProperties appProperties) {
        AppProperties.PipelineSettings settings = appProperties.getPipeline().getDevice();
        return new JdbcTelemetryBatchWriter(PipelineRegistry.DEVICE, repository,
                DedupStrategy.fromConflictKey(settings.getConflictKey()));
    }

    @Bean(INGEST_WRITER)
    public JdbcTelemetryBatchWriter ingestTelemetryWriter(TelemetryJdbcRepository repository,
                                                         AppProperties appProperties) {
        AppProperties.PipelineSettings settings = appProperties.getPipeline().getIngest();
        return new JdbcTelemetryBatchWriter(PipelineRegistry.INGEST, repository,
                DedupStrategy.fromConflictKey(settings.getConflictKey()));
    }

    @Bean(DEVICE_PIPELINE)
    public IngestionPipeline devicePipeline(@Qualifier(DEVICE_WRITER) JdbcTelemetryBatchWriter writer,
                                            AppProperties appProperties) {
        return new IngestionPipeline(PipelineRegistry.DEVICE, appProperties.getPipeline().getDevice(), writer);
    }

    @Bean(INGEST_PIPELINE)
    public IngestionPipeline ingestPipeline(@Qualifier(INGEST_WRITER) JdbcTelemetryBatchWriter writer,
                                            AppProperties appProperties) {
        return new IngestionPipeline(PipelineRegistry.INGEST, appProperties.getPipeline().getIngest(), writer);
    }
}
