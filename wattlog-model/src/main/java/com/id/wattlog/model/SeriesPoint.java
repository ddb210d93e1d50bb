package com.id.wattlog.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of a watt series.
 * <p>
 * {@code watt} keeps its name even when the series carries energy (kWh), since existing
 * dashboards read that field. A {@code null} value marks a bucket without data.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeriesPoint {

    private String zeit;
    private Double watt;

}
