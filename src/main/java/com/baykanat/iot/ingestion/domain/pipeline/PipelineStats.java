package com.baykanat.iot.ingestion.domain.pipeline;

import java.util.concurrent.atomic.LongAdder;

/**
 * Pipeline sayaçları; sadece artar. Producer thread'leri ve collector aynı anda günceller,
 * okuma hiçbir zaman kilitlemez (anlık değerler biraz eski olabilir).
 */
public class PipelineStats {

    private final LongAdder received = new LongAdder();
    private final LongAdder ingested = new LongAdder();
    private final LongAdder errored = new LongAdder();
    private final LongAdder batches = new LongAdder();
    private final LongAdder rejected = new LongAdder();
    private final LongAdder duplicates = new LongAdder();

    /** Kuyrukta yer ayrıldıktan sonra, kayıt kuyruğa girmeden önce çağrılır. */
    void recordReceived() {
        received.increment();
    }

    /** Dolu kuyruk; received'a dokunmaz. */
    void recordRejected() {
        rejected.increment();
    }

    void recordBatchPersisted(int batchSize, int inserted) {
        ingested.add(batchSize);
        batches.increment();
        if (inserted < batchSize) {
            duplicates.add(batchSize - inserted);
        }
    }

    void recordBatchFailed(int batchSize) {
        errored.add(batchSize);
    }

    public long getReceived() {
        return received.sum();
    }

    public long getIngested() {
        return ingested.sum();
    }

    public long getErrored() {
        return errored.sum();
    }

    public long getBatches() {
        return batches.sum();
    }

    public long getRejected() {
        return rejected.sum();
    }

    public long getDuplicates() {
        return duplicates.sum();
    }

    /** ingested / received yüzdesi, iki ondalık; received 0 ise 0. */
    public static double successRate(long ingested, long received) {
        if (received <= 0) {
            return 0.0;
        }
        return Math.round(ingested * 10000.0 / received) / 100.0;
    }
}
