package com.baykanat.iot.ingestion.domain.pipeline;

import com.baykanat.iot.ingestion.api.dto.PipelineStatsResponse;
import com.baykanat.iot.ingestion.config.AppProperties.PipelineSettings;
import com.baykanat.iot.ingestion.domain.model.TelemetryRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Bounded queue + tek collector thread + batch writer + sayaçlar.
 *
 * <p>Producer adapter'lar sadece {@link #offer} çağırır. Collector Spring lifecycle ile başlar ve
 * producer'lardan sonra durur; durdurulunca kuyruktaki kayıtlar yazılmadan çıkılmaz
 * (shutdown-timeout aşılmadıkça).
 */
@Slf4j
public class IngestionPipeline implements SmartLifecycle {

    /** MQTT subscriber ve web server bu fazdan sonra başlar, önce durur. */
    public static final int PHASE = 0;

    private final String name;
    private final PipelineSettings settings;
    private final TelemetryBatchWriter writer;
    private final BoundedQueue<TelemetryRecord> queue;
    private final PipelineStats stats = new PipelineStats();

    private ExecutorService executor;
    private BatchCollector collector;
    private volatile boolean running;

    public IngestionPipeline(String name, PipelineSettings settings, TelemetryBatchWriter writer) {
        if (settings.getBatchSize() <= 0) {
            throw new IllegalArgumentException("batch-size must be positive for pipeline " + name);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.settings = settings;
        this.writer = Objects.requireNonNull(writer, "writer");
        this.queue = new BoundedQueue<>(settings.getQueueCapacity());
    }

    /**
     * Kaydı kuyruğa ekler. Asla bloklamaz; kuyruk doluysa false döner ve kayıt received sayılmaz.
     * Slot önce ayrılır, received sonra artar, kayıt en son kuyruğa girer: collector bir kaydı
     * görmeden received artmış olur ve received hiç azalmaz.
     */
    public boolean offer(TelemetryRecord record) {
        Objects.requireNonNull(record, "record");
        if (!queue.tryReserve()) {
            stats.recordRejected();
            return false;
        }
        stats.recordReceived();
        queue.putReserved(record);
        return true;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        collector = new BatchCollector(name, queue, writer, stats, settings);
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "ingest-collector-" + name);
            thread.setDaemon(false);
            return thread;
        });
        executor.submit(collector);
        running = true;
        log.info("Ingestion pipeline '{}' started (queueCapacity={})", name, queue.capacity());
    }

    /** Kuyruk boşalana kadar (en fazla shutdown-timeout) bekler. */
    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        log.info("Stopping ingestion pipeline '{}', draining {} queued records", name, queue.size());

        collector.requestStop();
        executor.shutdown();
        try {
            long timeoutMs = settings.getShutdownTimeout().toMillis();
            if (!executor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Pipeline '{}' did not drain within {}ms, {} records discarded",
                        name, timeoutMs, queue.size());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        log.info("Ingestion pipeline '{}' stopped (received={}, ingested={}, errors={})",
                name, stats.getReceived(), stats.getIngested(), stats.getErrored());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    /** Anlık istatistik; received en son okunur ki ingested + errored <= received kalsın. */
    public PipelineStatsResponse getStats() {
        long ingested = stats.getIngested();
        long errored = stats.getErrored();
        long batches = stats.getBatches();
        long duplicates = stats.getDuplicates();
        long rejected = stats.getRejected();
        long received = stats.getReceived();

        return PipelineStatsResponse.builder()
                .pipeline(name)
                .queueSize(queue.size())
                .queueCapacity(queue.capacity())
                .totalReceived(received)
                .totalIngested(ingested)
                .totalErrors(errored)
                .totalBatches(batches)
                .totalRejected(rejected)
                .totalDuplicates(duplicates)
                .successRate(PipelineStats.successRate(ingested, received))
                .build();
    }

    public String getName() {
        return name;
    }

    public int getQueueSize() {
        return queue.size();
    }

    public PipelineSettings getSettings() {
        return settings;
    }
}
