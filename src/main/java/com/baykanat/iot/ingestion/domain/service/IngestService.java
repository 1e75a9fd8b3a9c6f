package com.baykanat.iot.ingestion.domain.service;

import com.baykanat.iot.ingestion.api.dto.IngestRequest;
import com.baykanat.iot.ingestion.config.PipelineConfig;
import com.baykanat.iot.ingestion.domain.exception.BackpressureException;
import com.baykanat.iot.ingestion.domain.model.TelemetryRecord;
import com.baykanat.iot.ingestion.domain.pipeline.IngestionPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/** HTTP ingest tarafı: normalize et, ingest pipeline'ına ekle; kuyruk doluysa BackpressureException. */
@Slf4j
@Service
public class IngestService {

    private final TelemetryNormalizer normalizer;
    private final IngestionPipeline ingestPipeline;

    public IngestService(TelemetryNormalizer normalizer,
                         @Qualifier(PipelineConfig.INGEST_PIPELINE) IngestionPipeline ingestPipeline) {
        this.normalizer = normalizer;
        this.ingestPipeline = ingestPipeline;
    }

    public void accept(IngestRequest request) {
        TelemetryRecord record = normalizer.fromIngestRequest(request);

        if (!ingestPipeline.offer(record)) {
            log.warn("Ingest queue full, rejecting message app_id={}, msg_id={}",
                    record.getAppId(), record.getMessageId());
            throw new BackpressureException("ingest backpressure: queue is full, retry later",
                    Math.max(1, ingestPipeline.getSettings().getRetryAfter().toSeconds()));
        }
        log.debug("Queued message app_id={}, device_id={}, msg_id={}",
                record.getAppId(), record.getDeviceId(), record.getMessageId());
    }
}
