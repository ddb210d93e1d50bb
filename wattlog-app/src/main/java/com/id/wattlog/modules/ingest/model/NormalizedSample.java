package com.id.wattlog.modules.ingest.model;

import com.id.wattlog.modules.measurements.model.WattMeasurementEntity;

/**
 * Outcome of normalizing one raw reading: either a measurement ready to append, or the
 * reason it was deliberately dropped.
 */
public record NormalizedSample(WattMeasurementEntity measurement, String ignoredReason) {

    public static NormalizedSample accepted(WattMeasurementEntity measurement) {
        return new NormalizedSample(measurement, null);
    }

    public static NormalizedSample ignored(String reason) {
        return new NormalizedSample(null, reason);
    }

    public boolean isAccepted() {
        return measurement != null;
    }
}
