package com.baykanat.iot.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** POST /ingest yanıtı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Response for telemetry ingestion")
public class IngestResponse {

    @Schema(description = "Status message", example = "queued")
    private String status;

    public static IngestResponse queued() {
        return IngestResponse.builder().status("queued").build();
    }
}
