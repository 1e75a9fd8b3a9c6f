package com.baykanat.iot.ingestion.domain.service;

import com.baykanat.iot.ingestion.api.dto.DeleteResponse;
import com.baykanat.iot.ingestion.api.dto.DeviceInfoResponse;
import com.baykanat.iot.ingestion.api.dto.TelemetryRecordResponse;
import com.baykanat.iot.ingestion.api.dto.TelemetryStatsResponse;
import com.baykanat.iot.ingestion.domain.exception.ResourceNotFoundException;
import com.baykanat.iot.ingestion.infrastructure.persistence.TelemetryQueryJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/** Saklanan telemetry için okuma ve silme işlemleri; ingest yolundan bağımsız. */
@Slf4j
@Service
@RequiredArgsConstructor
public class TelemetryQueryService {

    private final TelemetryQueryJdbcRepository queryRepository;

    public List<TelemetryRecordResponse> findTelemetry(String deviceId, String deviceType, int limit, int offset) {
        log.debug("Querying telemetry device_id={}, device_type={}, limit={}, offset={}",
                deviceId, deviceType, limit, offset);
        return queryRepository.findTelemetry(deviceId, deviceType, limit, offset);
    }

    public List<DeviceInfoResponse> findDevices() {
        return queryRepository.findDevices();
    }

    /** Cihazın en son kaydı; hiç kayıt yoksa ResourceNotFoundException. */
    public TelemetryRecordResponse findLatest(String deviceId) {
        return queryRepository.findLatest(deviceId)
                .orElseThrow(() -> new ResourceNotFoundException("No telemetry found for device " + deviceId));
    }

    public List<TelemetryRecordResponse> findHistory(String deviceId, int hours) {
        return queryRepository.findHistory(deviceId, hours);
    }

    public TelemetryStatsResponse getStats() {
        return queryRepository.queryStats();
    }

    public DeleteResponse deleteOlderThan(int days) {
        int deleted = queryRepository.deleteOlderThan(days);
        log.info("Deleted {} telemetry records older than {} days", deleted, days);
        return DeleteResponse.builder()
                .status("success")
                .deletedRecords(deleted)
                .olderThanDays(days)
                .build();
    }
}
