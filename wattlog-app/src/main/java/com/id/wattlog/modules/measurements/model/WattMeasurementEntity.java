package com.id.wattlog.modules.measurements.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * One stored sample. Written once, never updated; only the retention sweep removes it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document(collection = WattMeasurementEntity.COLLECTION)
public class WattMeasurementEntity {

    public static final String COLLECTION = "WattMeasurement";

    public static final String ID = "id";
    public static final String ZEIT = "zeit";
    public static final String POWER_WATTS = "powerWatts";
    public static final String ENERGY_KWH = "energyKwh";

    @Id
    @Field("_id")
    private String id;

    @Indexed
    private Instant zeit;

    // Nullable: rows from power-only deployments carry no energy, and vice versa for legacy imports
    private Double powerWatts;
    private Double energyKwh;

}
