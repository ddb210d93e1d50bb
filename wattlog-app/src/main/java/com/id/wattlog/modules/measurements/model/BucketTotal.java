package com.id.wattlog.modules.measurements.model;

import java.time.Instant;

/**
 * Sum and count of the non-null values of one field inside one bucket, as grouped by the database.
 */
public record BucketTotal(Instant bucketStart, double sum, long count) {

    public static final String SUM = "sum";
    public static final String COUNT = "count";
}
