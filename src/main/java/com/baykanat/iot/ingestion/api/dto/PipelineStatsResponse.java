package com.baykanat.iot.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Pipeline anlık sayaçları. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Ingestion pipeline statistics")
public class PipelineStatsResponse {

    @JsonProperty("pipeline")
    @Schema(description = "Pipeline name", example = "device")
    private String pipeline;

    @JsonProperty("queue_size")
    @Schema(description = "Records currently waiting in the queue", example = "42")
    private int queueSize;

    @JsonProperty("queue_capacity")
    @Schema(description = "Configured queue capacity", example = "10000")
    private int queueCapacity;

    @JsonProperty("total_received")
    @Schema(description = "Valid records accepted into the queue", example = "15234")
    private long totalReceived;

    @JsonProperty("total_ingested")
    @Schema(description = "Records handed to the store in successful batches", example = "15190")
    private long totalIngested;

    @JsonProperty("total_errors")
    @Schema(description = "Records lost in failed batches", example = "0")
    private long totalErrors;

    @JsonProperty("total_batches")
    @Schema(description = "Successfully written batches", example = "153")
    private long totalBatches;

    @JsonProperty("total_rejected")
    @Schema(description = "Records dropped because the queue was full", example = "0")
    private long totalRejected;

    @JsonProperty("total_duplicates")
    @Schema(description = "Records skipped by the uniqueness constraint", example = "3")
    private long totalDuplicates;

    @JsonProperty("success_rate")
    @Schema(description = "total_ingested / total_received as a percentage", example = "99.71")
    private double successRate;
}
