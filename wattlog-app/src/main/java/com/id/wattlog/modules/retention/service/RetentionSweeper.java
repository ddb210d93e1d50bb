package com.id.wattlog.modules.retention.service;

import com.id.wattlog.config.AppConfig;
import com.id.wattlog.modules.measurements.service.MeasurementStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Age-based cutoff for stored measurements, triggered by ingestion.
 */
@Service
@Slf4j
public class RetentionSweeper {

    private final AppConfig appConfig;
    private final MeasurementStore measurementStore;
    private final Clock clock;
    private final AtomicBoolean sweepRunning = new AtomicBoolean(false);
    private final AtomicReference<Instant> lastSweep = new AtomicReference<>(Instant.MIN);

    public RetentionSweeper(AppConfig appConfig, MeasurementStore measurementStore, Clock clock) {
        this.appConfig = appConfig;
        this.measurementStore = measurementStore;
        this.clock = clock;
    }

    /**
     * Fire-and-forget entry point for the ingestion path. Never throws.
     */
    @Async
    public void requestSweep() {
        if (!appConfig.isRetentionEnabled()) {
            return;
        }
        sweepIfDue();
    }

    /**
     * Runs a sweep unless one is already running or the last one is more recent than the
     * configured minimum interval.
     *
     * @return number of deleted rows, or -1 if the sweep was skipped or failed
     */
    public long sweepIfDue() {
        Instant now = Instant.now(clock);
        Duration minInterval = Duration.ofMinutes(appConfig.getRetentionMinIntervalMinutes());
        if (lastSweep.get().isAfter(now.minus(minInterval))) {
            return -1;
        }
        if (!sweepRunning.compareAndSet(false, true)) {
            return -1;
        }
        try {
            Instant cutoff = now.minus(Duration.ofDays(appConfig.getRetentionMaxAgeDays()));
            long deleted = measurementStore.deleteOlderThan(cutoff);
            lastSweep.set(now);
            if (deleted > 0) {
                log.info("Retention sweep removed {} measurements older than {}", deleted, cutoff);
            }
            return deleted;
        } catch (Exception ex) {
            log.warn("Retention sweep failed", ex);
            return -1;
        } finally {
            sweepRunning.set(false);
        }
    }
}
