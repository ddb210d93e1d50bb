package com.id.wattlog.modules.series.logic;

import com.id.wattlog.config.AppConfig;
import com.id.wattlog.model.SeriesPoint;
import com.id.wattlog.modules.measurements.model.BucketTotal;
import com.id.wattlog.modules.measurements.model.WattMeasurementEntity;
import com.id.wattlog.modules.series.model.BucketGranularity;
import com.id.wattlog.modules.series.model.SeriesQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lays out a calendar-aligned series and fills it from per-bucket totals grouped by the store.
 * <p>
 * With {@link SeriesQuery#isEnumerateEmpty()} the output shape is fixed by the calendar alone:
 * one entry per bucket from the bucket containing {@code start} through the bucket containing
 * now, whatever the data.
 */
@Component
@Slf4j
public class ResolutionAggregator {

    private final AppConfig appConfig;
    private final Clock clock;

    public ResolutionAggregator(AppConfig appConfig, Clock clock) {
        this.appConfig = appConfig;
        this.clock = clock;
    }

    /**
     * Bucket starts from the bucket containing the query start through the bucket containing
     * now, followed by the end of that last bucket. Empty when the start lies in the future.
     */
    public List<Instant> boundaries(SeriesQuery query) {
        if (query == null || query.getStart() == null || query.getGranularity() == null) {
            throw new IllegalArgumentException("Query start and granularity are required");
        }

        ZoneId zone = clock.getZone();
        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime start = query.getStart().atZone(zone);
        if (start.isAfter(now)) {
            return List.of();
        }

        BucketGranularity granularity = query.getGranularity();
        List<Instant> boundaries = new ArrayList<>();
        ZonedDateTime b = granularity.align(start);
        while (!b.isAfter(now)) {
            boundaries.add(b.toInstant());
            b = granularity.next(b);
        }
        boundaries.add(b.toInstant());
        return boundaries;
    }

    public List<SeriesPoint> assemble(SeriesQuery query, List<Instant> boundaries, List<BucketTotal> totals) {
        if (boundaries.size() < 2) {
            return List.of();
        }

        Map<Instant, BucketTotal> byStart = new HashMap<>();
        for (BucketTotal total : totals) {
            byStart.put(total.bucketStart(), total);
        }

        ZoneId zone = clock.getZone();
        BucketGranularity granularity = query.getGranularity();
        List<SeriesPoint> series = new ArrayList<>(boundaries.size() - 1);
        for (Instant bucketStart : boundaries.subList(0, boundaries.size() - 1)) {
            BucketTotal total = byStart.get(bucketStart);
            boolean empty = total == null || total.count() == 0;
            if (empty && !query.isEnumerateEmpty()) {
                continue;
            }
            Double value = empty ? query.getMissingPolicy().fill() : reduce(total, query);
            series.add(new SeriesPoint(granularity.label(bucketStart.atZone(zone)), value));
        }

        log.trace("Assembled {} {} buckets from {} totals", series.size(), granularity, totals.size());
        return series;
    }

    /**
     * Unbucketed power readings since {@code start}, ascending.
     */
    public List<SeriesPoint> passthrough(List<WattMeasurementEntity> measurements, Instant start) {
        ZoneId zone = clock.getZone();
        return measurements.stream()
                .filter(m -> m.getZeit() != null && !m.getZeit().isBefore(start))
                .sorted(Comparator.comparing(WattMeasurementEntity::getZeit))
                .map(m -> new SeriesPoint(
                        DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(LocalDateTime.ofInstant(m.getZeit(), zone)),
                        m.getPowerWatts()))
                .toList();
    }

    private Double reduce(BucketTotal total, SeriesQuery query) {
        double value = switch (query.getAggregation()) {
            case SUM -> total.sum();
            case AVG -> total.sum() / total.count();
        };
        return round(value);
    }

    private double round(double value) {
        return BigDecimal.valueOf(value).setScale(appConfig.getSeriesDecimals(), RoundingMode.HALF_UP).doubleValue();
    }
}
