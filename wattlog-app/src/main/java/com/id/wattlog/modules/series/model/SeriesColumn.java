package com.id.wattlog.modules.series.model;

import com.id.wattlog.errors.InvalidInputException;
import com.id.wattlog.modules.measurements.model.WattMeasurementEntity;

import java.util.Locale;

/**
 * Stored value a series is computed from.
 */
public enum SeriesColumn {
    ENERGY(WattMeasurementEntity.ENERGY_KWH),
    POWER(WattMeasurementEntity.POWER_WATTS);

    private final String field;

    SeriesColumn(String field) {
        this.field = field;
    }

    /**
     * Document field holding this column.
     */
    public String field() {
        return field;
    }

    public static SeriesColumn fromParam(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "energy", "kwh" -> ENERGY;
            case "power", "watt" -> POWER;
            default -> throw new InvalidInputException("Unsupported column: " + value);
        };
    }
}
