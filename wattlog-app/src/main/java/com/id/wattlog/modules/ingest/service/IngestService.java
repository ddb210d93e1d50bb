package com.id.wattlog.modules.ingest.service;

import com.id.wattlog.modules.ingest.logic.SampleNormalizer;
import com.id.wattlog.modules.ingest.model.NormalizedSample;
import com.id.wattlog.modules.measurements.service.MeasurementStore;
import com.id.wattlog.modules.retention.service.RetentionSweeper;
import com.id.wattlog.model.IngestStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
@Slf4j
public class IngestService {

    private final SampleNormalizer sampleNormalizer;
    private final MeasurementStore measurementStore;
    private final RetentionSweeper retentionSweeper;

    public IngestService(SampleNormalizer sampleNormalizer,
                         MeasurementStore measurementStore,
                         RetentionSweeper retentionSweeper) {
        this.sampleNormalizer = sampleNormalizer;
        this.measurementStore = measurementStore;
        this.retentionSweeper = retentionSweeper;
    }

    /**
     * Validate, filter and append one reading. Pure append: safe under concurrent calls.
     */
    public IngestStatus ingest(Map<String, Object> body) {
        NormalizedSample sample = sampleNormalizer.normalize(body);
        if (!sample.isAccepted()) {
            return IngestStatus.ignored(sample.ignoredReason());
        }

        measurementStore.append(sample.measurement());
        retentionSweeper.requestSweep();
        return IngestStatus.ok();
    }
}
