package com.id.wattlog.modules.backfill.service;

import com.id.wattlog.config.AppConfig;
import com.id.wattlog.modules.backfill.logic.SyntheticPowerSource;
import com.id.wattlog.modules.backfill.model.BackfillResult;
import com.id.wattlog.modules.ingest.logic.SampleNormalizer;
import com.id.wattlog.modules.measurements.model.WattMeasurementEntity;
import com.id.wattlog.modules.measurements.service.MeasurementStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fills the store with one synthetic sample per hour, from the latest stored sample (or the
 * configured horizon when the store is empty) up to the current hour.
 * <p>
 * Runs are serialized: the latest timestamp is read and the gap filled while holding a lock, so
 * a second run started concurrently sees the first run's rows and inserts nothing. The lock is
 * per JVM only. The closing hour is never dropped (a draw below the threshold is raised to it),
 * which keeps a second run a no-op.
 */
@Service
@Slf4j
public class BackfillGenerator {

    private static final long HOUR_SECONDS = Duration.ofHours(1).toSeconds();

    private final AppConfig appConfig;
    private final MeasurementStore measurementStore;
    private final SampleNormalizer sampleNormalizer;
    private final SyntheticPowerSource powerSource;
    private final Clock clock;
    private final ReentrantLock runLock = new ReentrantLock();

    public BackfillGenerator(AppConfig appConfig,
                             MeasurementStore measurementStore,
                             SampleNormalizer sampleNormalizer,
                             SyntheticPowerSource powerSource,
                             Clock clock) {
        this.appConfig = appConfig;
        this.measurementStore = measurementStore;
        this.sampleNormalizer = sampleNormalizer;
        this.powerSource = powerSource;
        this.clock = clock;
    }

    public BackfillResult run() {
        runLock.lock();
        try {
            return fillGap();
        } finally {
            runLock.unlock();
        }
    }

    private BackfillResult fillGap() {
        ZonedDateTime now = ZonedDateTime.now(clock);
        Optional<Instant> last = measurementStore.findLatestTimestamp();

        ZonedDateTime start = last
                .map(ts -> ts.atZone(clock.getZone()).truncatedTo(ChronoUnit.HOURS).plusHours(1))
                .orElseGet(() -> now.minusDays(appConfig.getBackfillHorizonDays()).truncatedTo(ChronoUnit.HOURS));
        ZonedDateTime end = now.truncatedTo(ChronoUnit.HOURS);

        if (start.isAfter(end)) {
            log.debug("Backfill not needed, latest sample at {}", last.orElse(null));
            return BackfillResult.upToDate();
        }

        log.info("Backfilling hourly samples from {} to {}", start, end);
        int batchSize = Math.max(1, appConfig.getBackfillBatchSize());
        List<WattMeasurementEntity> batch = new ArrayList<>(batchSize);
        int visited = 0;
        int inserted = 0;
        int skipped = 0;
        LocalDate currentDay = null;
        boolean skipCurrentDay = false;

        for (ZonedDateTime t = start; !t.isAfter(end); t = t.plusHours(1)) {
            visited++;
            boolean closing = t.equals(end);

            LocalDate day = t.toLocalDate();
            if (!day.equals(currentDay)) {
                currentDay = day;
                skipCurrentDay = powerSource.skipDay();
            }
            if (skipCurrentDay && !closing) {
                skipped++;
                continue;
            }

            int watts = powerSource.nextWatts();
            if (sampleNormalizer.isBelowThreshold(watts)) {
                if (!closing) {
                    skipped++;
                    continue;
                }
                watts = (int) Math.ceil(appConfig.getThresholdWatts());
            }

            batch.add(WattMeasurementEntity.builder()
                    .zeit(t.toInstant())
                    .powerWatts((double) watts)
                    .energyKwh(appConfig.isEnergyTrackingEnabled() ? SampleNormalizer.energyKwh(watts, HOUR_SECONDS) : null)
                    .build());
            if (batch.size() >= batchSize) {
                inserted += measurementStore.appendAll(batch);
                batch = new ArrayList<>(batchSize);
            }
        }
        inserted += measurementStore.appendAll(batch);

        log.info("Backfill done: {} hours visited, {} samples inserted, {} skipped", visited, inserted, skipped);
        return new BackfillResult(start.toInstant(), end.toInstant(), visited, inserted, skipped);
    }
}
