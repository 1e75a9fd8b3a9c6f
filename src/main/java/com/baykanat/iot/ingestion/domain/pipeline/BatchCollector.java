package com.baykanat.iot.ingestion.domain.pipeline;

import com.baykanat.iot.ingestion.config.AppProperties.PipelineSettings;
import com.baykanat.iot.ingestion.domain.model.TelemetryRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Kuyruğu batch'lere bölen tek collector döngüsü: batch-size dolunca veya batch-timeout
 * geçince (hangisi önce olursa) batch writer'a verir. Writer çağrıları sıralıdır; bir sonraki
 * batch ancak önceki yazım bitince toplanır.
 *
 * <p>Durdurma isteğinden sonra kuyruk boşalana kadar çalışmaya devam eder.
 */
@Slf4j
class BatchCollector implements Runnable {

    private final String pipelineName;
    private final BoundedQueue<TelemetryRecord> queue;
    private final TelemetryBatchWriter writer;
    private final PipelineStats stats;
    private final PipelineSettings settings;

    private volatile boolean running = true;

    BatchCollector(String pipelineName, BoundedQueue<TelemetryRecord> queue, TelemetryBatchWriter writer,
                   PipelineStats stats, PipelineSettings settings) {
        this.pipelineName = pipelineName;
        this.queue = queue;
        this.writer = writer;
        this.stats = stats;
        this.settings = settings;
    }

    void requestStop() {
        running = false;
    }

    @Override
    public void run() {
        log.info("[{}] Batch collector started (batchSize={}, batchTimeout={})",
                pipelineName, settings.getBatchSize(), settings.getBatchTimeout());

        while (running || !queue.isEmpty()) {
            try {
                List<TelemetryRecord> batch = collectBatch();
                if (!batch.isEmpty()) {
                    processBatch(batch);
                } else {
                    pause(settings.getIdleSleep());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[{}] Batch collector interrupted, {} records left in queue", pipelineName, queue.size());
                break;
            } catch (Exception e) {
                // Döngü hiçbir hatada ölmemeli
                log.error("[{}] Batch collector error: {}", pipelineName, e.getMessage(), e);
                try {
                    pause(settings.getErrorBackoff());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        log.info("[{}] Batch collector stopped", pipelineName);
    }

    /** batch-size kayda veya deadline'a kadar toplar; boş dönebilir. */
    List<TelemetryRecord> collectBatch() throws InterruptedException {
        int batchSize = settings.getBatchSize();
        List<TelemetryRecord> batch = new ArrayList<>(batchSize);
        long deadline = System.nanoTime() + settings.getBatchTimeout().toNanos();

        while (batch.size() < batchSize) {
            List<TelemetryRecord> drained = queue.drainUpTo(batchSize - batch.size());
            if (drained.isEmpty()) {
                if (!running) {
                    break; // kapanışta boş kuyruk için timeout beklenmez
                }
                pause(settings.getPollInterval());
            } else {
                batch.addAll(drained);
            }

            if (System.nanoTime() - deadline >= 0) {
                break;
            }
        }
        return batch;
    }

    /** Batch'i yazar; hata olursa tüm batch errored sayılır ve düşürülür (retry/requeue yok). */
    void processBatch(List<TelemetryRecord> batch) {
        try {
            int inserted = writer.persist(batch);
            stats.recordBatchPersisted(batch.size(), inserted);

            if (inserted < batch.size()) {
                log.debug("[{}] Batch of {} records persisted, {} duplicates skipped",
                        pipelineName, batch.size(), batch.size() - inserted);
            }

            int logInterval = settings.getStatsLogInterval();
            if (logInterval > 0 && stats.getBatches() % logInterval == 0) {
                logStats();
            }
        } catch (RuntimeException e) {
            stats.recordBatchFailed(batch.size());
            log.error("[{}] Failed to persist batch of {} records, batch dropped: {}",
                    pipelineName, batch.size(), e.getMessage());
            log.debug("[{}] Batch failure detail", pipelineName, e);
        }
    }

    private void logStats() {
        long ingested = stats.getIngested();
        long errored = stats.getErrored();
        long received = stats.getReceived();
        log.info("[{}] Pipeline stats | received={} ingested={} errors={} batches={} queue={} success={}%",
                pipelineName, received, ingested, errored, stats.getBatches(), queue.size(),
                PipelineStats.successRate(ingested, received));
    }

    private static void pause(Duration duration) throws InterruptedException {
        if (!duration.isZero() && !duration.isNegative()) {
            TimeUnit.NANOSECONDS.sleep(duration.toNanos());
        }
    }
}
