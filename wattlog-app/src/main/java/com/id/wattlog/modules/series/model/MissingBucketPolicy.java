package com.id.wattlog.modules.series.model;

import com.id.wattlog.errors.InvalidInputException;

import java.util.Locale;

/**
 * How a bucket without samples is rendered: as a gap ({@code null}) or as zero output.
 */
public enum MissingBucketPolicy {
    NULL(null),
    ZERO(0.0);

    private final Double fill;

    MissingBucketPolicy(Double fill) {
        this.fill = fill;
    }

    public Double fill() {
        return fill;
    }

    public static MissingBucketPolicy fromParam(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "null", "gap", "none" -> NULL;
            case "zero", "0" -> ZERO;
            default -> throw new InvalidInputException("Unsupported missing-bucket policy: " + value);
        };
    }
}
