package com.id.wattlog.modules.series.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class SeriesQuery {

    Instant start;
    BucketGranularity granularity;

    @Builder.Default
    SeriesAggregation aggregation = SeriesAggregation.SUM;

    @Builder.Default
    SeriesColumn column = SeriesColumn.ENERGY;

    @Builder.Default
    MissingBucketPolicy missingPolicy = MissingBucketPolicy.NULL;

    // When false only buckets holding at least one value are emitted
    @Builder.Default
    boolean enumerateEmpty = true;

}
