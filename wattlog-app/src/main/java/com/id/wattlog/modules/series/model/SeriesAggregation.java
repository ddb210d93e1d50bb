package com.id.wattlog.modules.series.model;

import com.id.wattlog.errors.InvalidInputException;

import java.util.Locale;

public enum SeriesAggregation {
    SUM,
    AVG;

    public static SeriesAggregation fromParam(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "sum" -> SUM;
            case "avg", "average", "mean" -> AVG;
            default -> throw new InvalidInputException("Unsupported aggregation: " + value);
        };
    }
}
