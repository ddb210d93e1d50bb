package com.id.wattlog.modules.series.model;

/**
 * Per-request overrides of the configured series defaults. Null fields keep the default.
 */
public record SeriesOverrides(
        SeriesAggregation aggregation,
        SeriesColumn column,
        MissingBucketPolicy missingPolicy,
        Boolean enumerateEmpty
) {

    public static SeriesOverrides none() {
        return new SeriesOverrides(null, null, null, null);
    }

    public static SeriesOverrides fromParams(String aggregation, String column, String missing, Boolean fill) {
        return new SeriesOverrides(
                aggregation == null ? null : SeriesAggregation.fromParam(aggregation),
                column == null ? null : SeriesColumn.fromParam(column),
                missing == null ? null : MissingBucketPolicy.fromParam(missing),
                fill
        );
    }

    public SeriesQuery applyTo(SeriesQuery query) {
        var builder = query.toBuilder();
        if (aggregation != null) {
            builder.aggregation(aggregation);
        }
        if (column != null) {
            builder.column(column);
        }
        if (missingPolicy != null) {
            builder.missingPolicy(missingPolicy);
        }
        if (enumerateEmpty != null) {
            builder.enumerateEmpty(enumerateEmpty);
        }
        return builder.build();
    }
}
