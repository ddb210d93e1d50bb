package com.id.wattlog.modules.series.service;

import com.id.wattlog.config.AppConfig;
import com.id.wattlog.errors.InvalidInputException;
import com.id.wattlog.model.LatestReading;
import com.id.wattlog.model.SeriesPoint;
import com.id.wattlog.modules.measurements.model.BucketTotal;
import com.id.wattlog.modules.measurements.service.MeasurementStore;
import com.id.wattlog.modules.series.logic.ResolutionAggregator;
import com.id.wattlog.modules.series.model.MissingBucketPolicy;
import com.id.wattlog.modules.series.model.SeriesAggregation;
import com.id.wattlog.modules.series.model.SeriesColumn;
import com.id.wattlog.modules.series.model.SeriesOverrides;
import com.id.wattlog.modules.series.model.SeriesQuery;
import com.id.wattlog.modules.series.model.SeriesWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Read side: the four fixed windows, the raw 24h feed and the latest reading.
 */
@Service
@Slf4j
public class SeriesService {

    private final AppConfig appConfig;
    private final MeasurementStore measurementStore;
    private final ResolutionAggregator resolutionAggregator;
    private final Clock clock;
    private final MissingBucketPolicy defaultMissingPolicy;

    public SeriesService(AppConfig appConfig,
                         MeasurementStore measurementStore,
                         ResolutionAggregator resolutionAggregator,
                         Clock clock) {
        this.appConfig = appConfig;
        this.measurementStore = measurementStore;
        this.resolutionAggregator = resolutionAggregator;
        this.clock = clock;
        this.defaultMissingPolicy = parseMissingPolicy(appConfig.getMissingPolicy());
    }

    public List<SeriesPoint> window(SeriesWindow window, SeriesOverrides overrides) {
        SeriesQuery query = defaultQuery(window, Instant.now(clock));
        if (overrides != null) {
            query = overrides.applyTo(query);
        }
        List<Instant> boundaries = resolutionAggregator.boundaries(query);
        if (boundaries.isEmpty()) {
            return List.of();
        }
        List<BucketTotal> totals = measurementStore.totalsByBucket(query.getColumn().field(), query.getStart(), boundaries);
        return resolutionAggregator.assemble(query, boundaries, totals);
    }

    public List<SeriesPoint> raw(SeriesWindow window) {
        Instant start = window.start(ZonedDateTime.now(clock)).toInstant();
        return resolutionAggregator.passthrough(measurementStore.findSince(start), start);
    }

    public LatestReading latest() {
        return measurementStore.findLatest()
                .map(m -> new LatestReading(
                        DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(LocalDateTime.ofInstant(m.getZeit(), clock.getZone())),
                        m.getPowerWatts()))
                .orElseGet(LatestReading::empty);
    }

    /**
     * Configured defaults for a window: sum of energy when energy is tracked, sum of power
     * otherwise, with the configured missing-bucket policy.
     */
    public SeriesQuery defaultQuery(SeriesWindow window, Instant now) {
        return SeriesQuery.builder()
                .start(window.start(now.atZone(clock.getZone())).toInstant())
                .granularity(window.granularity())
                .aggregation(SeriesAggregation.SUM)
                .column(appConfig.isEnergyTrackingEnabled() ? SeriesColumn.ENERGY : SeriesColumn.POWER)
                .missingPolicy(defaultMissingPolicy)
                .enumerateEmpty(window.enumerateEmpty())
                .build();
    }

    private static MissingBucketPolicy parseMissingPolicy(String configured) {
        try {
            return MissingBucketPolicy.fromParam(configured);
        } catch (InvalidInputException e) {
            throw new IllegalStateException("Invalid wattlog.series.missing-policy: " + configured, e);
        }
    }
}
