package com.baykanat.iot.ingestion.api.controller;

import com.baykanat.iot.ingestion.api.dto.PipelineStatsResponse;
import com.baykanat.iot.ingestion.domain.exception.ResourceNotFoundException;
import com.baykanat.iot.ingestion.domain.pipeline.IngestionPipeline;
import com.baykanat.iot.ingestion.domain.pipeline.PipelineRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** Pipeline sayaçlarının anlık görüntüsü. */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Pipeline", description = "Ingestion pipeline statistics")
public class PipelineStatsController {

    private final PipelineRegistry pipelineRegistry;

    @GetMapping("/pipeline/stats")
    @Operation(summary = "Device pipeline statistics", description = "Counters of the MQTT device pipeline")
    public ResponseEntity<PipelineStatsResponse> getDeviceStats() {
        return ResponseEntity.ok(stats(PipelineRegistry.DEVICE));
    }

    @GetMapping("/pipeline/{name}/stats")
    @Operation(summary = "Pipeline statistics by name")
    public ResponseEntity<PipelineStatsResponse> getStats(
            @Parameter(description = "Pipeline name", example = "ingest") @PathVariable("name") String name) {
        return ResponseEntity.ok(stats(name));
    }

    @GetMapping("/pipelines")
    @Operation(summary = "Statistics of all pipelines")
    public ResponseEntity<List<PipelineStatsResponse>> getAllStats() {
        return ResponseEntity.ok(pipelineRegistry.all().stream()
                .map(IngestionPipeline::getStats)
                .toList());
    }

    private PipelineStatsResponse stats(String name) {
        return pipelineRegistry.find(name)
                .map(IngestionPipeline::getStats)
                .orElseThrow(() -> new ResourceNotFoundException("Unknown pipeline: " + name));
    }
}
