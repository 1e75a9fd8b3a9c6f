package com.baykanat.iot.ingestion.scheduler;

import com.baykanat.iot.ingestion.config.AppProperties;
import com.baykanat.iot.ingestion.infrastructure.persistence.TelemetryQueryJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** retention-days > 0 ise device_telemetry'den o günden eski kayıtları periyodik siler; varsayılan kapalı. */
@Slf4j
@Component
@RequiredArgsConstructor
public class TelemetryRetentionScheduler {

    private final TelemetryQueryJdbcRepository queryRepository;
    private final AppProperties appProperties;

    /** retention-days 0 veya negatifse hiçbir şey yapmaz. */
    @Scheduled(
            fixedRateString = "${app.scheduler.retention-cleanup-rate:3600000}",
            initialDelayString = "${app.scheduler.retention-initial-delay:60000}"
    )
    public void cleanupOldTelemetry() {
        int retentionDays = appProperties.getScheduler().getRetentionDays();
        if (retentionDays <= 0) {
            log.debug("Telemetry retention disabled (retention-days={})", retentionDays);
            return;
        }
        try {
            int deleted = queryRepository.deleteOlderThan(retentionDays);
            if (deleted > 0) {
                log.info("Telemetry retention: deleted {} records older than {} days", deleted, retentionDays);
            } else {
                log.debug("Telemetry retention: no records older than {} days to delete", retentionDays);
            }
        } catch (Exception e) {
            log.error("Failed to cleanup old telemetry: {}", e.getMessage(), e);
        }
    }
}
