package com.baykanat.iot.ingestion.api.controller;

import com.baykanat.iot.ingestion.api.dto.IngestRequest;
import com.baykanat.iot.ingestion.api.dto.IngestResponse;
import com.baykanat.iot.ingestion.domain.service.IngestService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** POST /ingest. Mesaj ingest kuyruğuna girer, 202 döner; DB yazımı collector'da. */
@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Ingestion", description = "HTTP telemetry ingestion")
public class IngestController {

    private final IngestService ingestService;

    /** Geçersiz gövde → 422, kuyruk dolu → 503 + Retry-After, kabul → 202. */
    @PostMapping("/ingest")
    @Operation(summary = "Ingest a telemetry message",
            description = "Queues a message for batched persistence; (app_id, msg_id) duplicates are stored once")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Message queued"),
            @ApiResponse(responseCode = "400", description = "Malformed JSON body"),
            @ApiResponse(responseCode = "422", description = "Invalid message"),
            @ApiResponse(responseCode = "503", description = "Ingest queue full, retry later")
    })
    public ResponseEntity<IngestResponse> ingest(@Valid @RequestBody IngestRequest request) {
        log.debug("Received ingest request: app_id={}, msg_id={}", request.getAppId(), request.getMsgId());

        ingestService.accept(request);

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(IngestResponse.queued());
    }
}
