package com.id.wattlog.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LatestReading {

    private String zeit;
    private Double watt;

    public static LatestReading empty() {
        return new LatestReading(null, null);
    }
}
