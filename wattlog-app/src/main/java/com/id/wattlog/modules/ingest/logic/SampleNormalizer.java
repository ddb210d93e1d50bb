package com.id.wattlog.modules.ingest.logic;

import com.id.wattlog.config.AppConfig;
import com.id.wattlog.errors.InvalidInputException;
import com.id.wattlog.modules.ingest.model.NormalizedSample;
import com.id.wattlog.modules.measurements.model.WattMeasurementEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Turns one raw device reading into a storable measurement.
 * <p>
 * Energy is attributed with a zero-order hold over the configured nominal sampling interval,
 * not over the real gap to the previous sample. Totals are therefore exact only when the device
 * actually reports at that cadence; retries or dropped deliveries bias them.
 */
@Component
@Slf4j
public class SampleNormalizer {

    public static final String WATT_FIELD = "watt";

    private static final double SECONDS_PER_HOUR = 3600.0;
    private static final double WATTS_PER_KILOWATT = 1000.0;

    private final AppConfig appConfig;
    private final Clock clock;

    public SampleNormalizer(AppConfig appConfig, Clock clock) {
        this.appConfig = appConfig;
        this.clock = clock;
    }

    /**
     * Normalize a JSON body of the form {@code {"watt": <number>}}.
     *
     * @throws InvalidInputException if the field is missing or not a finite number
     */
    public NormalizedSample normalize(Map<String, Object> body) {
        if (body == null || !body.containsKey(WATT_FIELD)) {
            throw new InvalidInputException("watt missing");
        }
        return normalize(parseWatts(body.get(WATT_FIELD)), Instant.now(clock));
    }

    public NormalizedSample normalize(double watts, Instant zeit) {
        if (isBelowThreshold(watts)) {
            log.trace("Ignoring reading {} W below threshold {} W", watts, appConfig.getThresholdWatts());
            return NormalizedSample.ignored(ignoredReason());
        }
        Double energy = appConfig.isEnergyTrackingEnabled()
                ? energyKwh(watts, appConfig.getSampleIntervalSeconds())
                : null;
        return NormalizedSample.accepted(WattMeasurementEntity.builder()
                .zeit(zeit)
                .powerWatts(watts)
                .energyKwh(energy)
                .build());
    }

    public boolean isBelowThreshold(double watts) {
        return watts < appConfig.getThresholdWatts();
    }

    /**
     * Reason reported for dropped readings, e.g. {@code "watt < 10"}.
     */
    public String ignoredReason() {
        String threshold = BigDecimal.valueOf(appConfig.getThresholdWatts()).stripTrailingZeros().toPlainString();
        return "watt < " + threshold;
    }

    /**
     * Energy in kWh for a constant power held over {@code intervalSeconds}.
     */
    public static double energyKwh(double watts, long intervalSeconds) {
        return watts * (intervalSeconds / SECONDS_PER_HOUR) / WATTS_PER_KILOWATT;
    }

    static double parseWatts(Object raw) {
        if (raw == null) {
            throw new InvalidInputException("watt missing");
        }
        double watts;
        if (raw instanceof Number number) {
            watts = number.doubleValue();
        } else if (raw instanceof String text) {
            try {
                watts = Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new InvalidInputException("invalid watt value");
            }
        } else {
            throw new InvalidInputException("invalid watt value");
        }
        if (Double.isNaN(watts) || Double.isInfinite(watts)) {
            throw new InvalidInputException("invalid watt value");
        }
        return watts;
    }
}
