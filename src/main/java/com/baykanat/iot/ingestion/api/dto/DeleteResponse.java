package com.baykanat.iot.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DELETE /telemetry yanıtı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeleteResponse {

    @JsonProperty("status")
    private String status;

    @JsonProperty("deleted_records")
    private int deletedRecords;

    @JsonProperty("older_than_days")
    private int olderThanDays;
}
