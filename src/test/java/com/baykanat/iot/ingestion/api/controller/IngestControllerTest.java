package com.baykanat.iot.ingestion.api.controller;

import com.baykanat.iot.ingestion.api.dto.IngestRequest;
import com.baykanat.iot.ingestion.domain.exception.BackpressureException;
import com.baykanat.iot.ingestion.domain.service.IngestService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web layer tests for IngestController.
 *
 * <p>IngestService is mocked; these tests verify:
 * <ul>
 *   <li>202 with {"status":"queued"} on the happy path</li>
 *   <li>422 on invalid messages, 400 on unreadable JSON</li>
 *   <li>503 with Retry-After when the ingest queue is full</li>
 * </ul>
 */
@WebMvcTest(IngestController.class)
class IngestControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private IngestService ingestService;

    @Test
    @DisplayName("POST /ingest - valid message should return 202 queued")
    void validMessageReturns202() throws Exception {
        String payload = objectMapper.writeValueAsString(Map.of(
                "app_id", "greenhouse-gw",
                "msg_id", "m-1",
                "ts", 1771156800000L,
                "payload", Map.of("temperature", 21.4)
        ));

        mockMvc.perform(post("/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("queued"));

        verify(ingestService).accept(any(IngestRequest.class));
    }

    @Test
    @DisplayName("POST /ingest - negative ts should return 422")
    void negativeTimestampReturns422() throws Exception {
        String payload = """
                {
                    "app_id": "greenhouse-gw",
                    "ts": -5,
                    "payload": {"temperature": 21.4}
                }
                """;

        mockMvc.perform(post("/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.message").value("Validation failed"))
                .andExpect(jsonPath("$.details[0].field").value("ts"));

        verifyNoInteractions(ingestService);
    }

    @Test
    @DisplayName("POST /ingest - ts past year 9999 should return 422")
    void timestampBeyondStorableRangeReturns422() throws Exception {
        String payload = objectMapper.writeValueAsString(Map.of(
                "app_id", "greenhouse-gw",
                "ts", Long.MAX_VALUE,
                "payload", Map.of("temperature", 21.4)
        ));

        mockMvc.perform(post("/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.details[0].field").value("ts"));

        verifyNoInteractions(ingestService);
    }

    @Test
    @DisplayName("POST /ingest - device_type over 100 characters should return 422")
    void oversizeDeviceTypeReturns422() throws Exception {
        String payload = objectMapper.writeValueAsString(Map.of(
                "app_id", "greenhouse-gw",
                "ts", 1771156800000L,
                "device_type", "T".repeat(101),
                "payload", Map.of("temperature", 21.4)
        ));

        mockMvc.perform(post("/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.details[0].field").value("deviceType"));

        verifyNoInteractions(ingestService);
    }

    @Test
    @DisplayName("POST /ingest - missing app_id and payload should return 422")
    void missingFieldsReturn422() throws Exception {
        mockMvc.perform(post("/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ts\": 1771156800000}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.details.length()").value(2));
    }

    @Test
    @DisplayName("POST /ingest - malformed JSON should return 400")
    void malformedJsonReturns400() throws Exception {
        mockMvc.perform(post("/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"app_id\": "))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /ingest - full queue should return 503 with Retry-After")
    void fullQueueReturns503() throws Exception {
        doThrow(new BackpressureException("ingest backpressure: queue is full, retry later", 1))
                .when(ingestService).accept(any(IngestRequest.class));

        String payload = objectMapper.writeValueAsString(Map.of(
                "app_id", "greenhouse-gw",
                "ts", 1771156800000L,
                "payload", Map.of("temperature", 21.4)
        ));

        mockMvc.perform(post("/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "1"))
                .andExpect(jsonPath("$.status").value(503));
    }
}
