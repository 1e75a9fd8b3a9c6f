package com.baykanat.iot.ingestion.domain.pipeline;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Context'teki pipeline'lara isimle erişim (stats endpoint'i için). */
@Component
public class PipelineRegistry {

    public static final String DEVICE = "device";
    public static final String INGEST = "ingest";

    private final Map<String, IngestionPipeline> pipelines = new LinkedHashMap<>();

    public PipelineRegistry(List<IngestionPipeline> pipelines) {
        pipelines.forEach(pipeline -> this.pipelines.put(pipeline.getName(), pipeline));
    }

    public Optional<IngestionPipeline> find(String name) {
        return Optional.ofNullable(pipelines.get(name));
    }

    public Collection<IngestionPipeline> all() {
        return pipelines.values();
    }
}
