package com.baykanat.iot.ingestion.domain.service;

import com.baykanat.iot.ingestion.api.dto.IngestRequest;
import com.baykanat.iot.ingestion.config.AppProperties.PipelineSettings;
import com.baykanat.iot.ingestion.domain.exception.BackpressureException;
import com.baykanat.iot.ingestion.domain.model.TelemetryRecord;
import com.baykanat.iot.ingestion.domain.pipeline.IngestionPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestServiceTest {

    @Mock
    private TelemetryNormalizer normalizer;

    @Mock
    private IngestionPipeline ingestPipeline;

    private IngestService service;

    private final IngestRequest request = IngestRequest.builder()
            .appId("app-1")
            .msgId("m-1")
            .ts(1771156800000L)
            .payload(Map.of("v", 1))
            .build();

    private final TelemetryRecord record = TelemetryRecord.builder()
            .appId("app-1")
            .messageId("m-1")
            .deviceId("app-1")
            .build();

    @BeforeEach
    void setUp() {
        service = new IngestService(normalizer, ingestPipeline);
        when(normalizer.fromIngestRequest(request)).thenReturn(record);
    }

    @Test
    @DisplayName("accept - normalized record is offered to the ingest pipeline")
    void acceptOffersRecord() {
        when(ingestPipeline.offer(record)).thenReturn(true);

        assertThatCode(() -> service.accept(request)).doesNotThrowAnyException();

        verify(ingestPipeline).offer(record);
    }

    @Test
    @DisplayName("accept - full queue raises BackpressureException with the configured retry-after")
    void acceptFullQueue() {
        PipelineSettings settings = new PipelineSettings();
        settings.setRetryAfter(Duration.ofSeconds(3));
        when(ingestPipeline.offer(record)).thenReturn(false);
        when(ingestPipeline.getSettings()).thenReturn(settings);

        assertThatThrownBy(() -> service.accept(request))
                .isInstanceOf(BackpressureException.class)
                .extracting(e -> ((BackpressureException) e).getRetryAfterSeconds())
                .isEqualTo(3L);
    }
}
