package com.baykanat.iot.ingestion.domain.pipeline;

import com.baykanat.iot.ingestion.domain.model.TelemetryRecord;

import java.util.List;

/** Bir batch'i store'a tek seferde yazar. */
@FunctionalInterface
public interface TelemetryBatchWriter {

    /**
     * Batch'i atomik yazar.
     *
     * @return gerçekten eklenen satır sayısı (dedup ile atlananlar hariç)
     * @throws BatchPersistenceException batch'in tamamı yazılamadıysa
     */
    int persist(List<TelemetryRecord> batch);
}
