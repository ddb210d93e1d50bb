package com.id.wattlog.modules.backfill.service;

import com.id.wattlog.config.AppConfig;
import com.id.wattlog.modules.backfill.logic.SyntheticPowerSource;
import com.id.wattlog.modules.backfill.model.BackfillResult;
import com.id.wattlog.modules.ingest.logic.SampleNormalizer;
import com.id.wattlog.modules.measurements.model.WattMeasurementEntity;
import com.id.wattlog.modules.measurements.service.MeasurementStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BackfillGeneratorTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:34:56Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Mock
    private AppConfig appConfig;
    @Mock
    private MeasurementStore measurementStore;

    // Backing rows for the mocked store
    private final List<WattMeasurementEntity> rows = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void setUp() {
        lenient().when(appConfig.getThresholdWatts()).thenReturn(10.0);
        lenient().when(appConfig.isEnergyTrackingEnabled()).thenReturn(true);
        lenient().when(appConfig.getBackfillHorizonDays()).thenReturn(2);
        lenient().when(appConfig.getBackfillBatchSize()).thenReturn(1000);

        lenient().when(measurementStore.findLatestTimestamp()).thenAnswer(inv -> {
            synchronized (rows) {
                return rows.stream().map(WattMeasurementEntity::getZeit).max(Comparator.naturalOrder());
            }
        });
        lenient().when(measurementStore.appendAll(anyList())).thenAnswer(inv -> {
            List<WattMeasurementEntity> batch = inv.getArgument(0);
            rows.addAll(batch);
            return batch.size();
        });
    }

    @Test
    void emptyStoreIsFilledFromHorizonToCurrentHour() {
        BackfillResult result = generator(new FixedSource(50)).run();

        // 2024-05-08T12:00 .. 2024-05-10T12:00 inclusive
        assertEquals(49, result.inserted());
        assertEquals(49, result.hoursVisited());
        assertEquals(Instant.parse("2024-05-08T12:00:00Z"), result.start());
        assertEquals(Instant.parse("2024-05-10T12:00:00Z"), result.end());
        assertEquals(Instant.parse("2024-05-08T12:00:00Z"), rows.get(0).getZeit());
        assertEquals(Instant.parse("2024-05-10T12:00:00Z"), rows.get(rows.size() - 1).getZeit());
        assertEquals(50.0, rows.get(0).getPowerWatts());
        assertEquals(0.05, rows.get(0).getEnergyKwh(), 1e-12);
    }

    @Test
    void secondRunInsertsNothing() {
        BackfillGenerator generator = generator(new FixedSource(50));

        BackfillResult first = generator.run();
        BackfillResult second = generator.run();

        assertEquals(49, first.inserted());
        assertTrue(second.isNoOp());
        assertEquals(0, second.hoursVisited());
        assertEquals(49, rows.size());
    }

    @Test
    void resumesAfterLatestStoredSample() {
        rows.add(WattMeasurementEntity.builder().zeit(Instant.parse("2024-05-10T09:15:00Z")).powerWatts(20.0).build());

        BackfillResult result = generator(new FixedSource(50)).run();

        assertEquals(Instant.parse("2024-05-10T10:00:00Z"), result.start());
        assertEquals(3, result.inserted());
    }

    @Test
    void latestSampleInCurrentHourMeansCaughtUp() {
        rows.add(WattMeasurementEntity.builder().zeit(Instant.parse("2024-05-10T12:01:00Z")).powerWatts(20.0).build());

        BackfillResult result = generator(new FixedSource(50)).run();

        assertTrue(result.isNoOp());
        assertNull(result.start());
        verify(measurementStore, times(0)).appendAll(anyList());
    }

    @Test
    void hoursBelowThresholdContributeNothing() {
        BackfillResult result = generator(new FixedSource(5, 50)).run();

        // 25 draws of 5 W; the last one lands on the closing hour and is raised to 10 W
        assertEquals(49, result.hoursVisited());
        assertEquals(25, result.inserted());
        assertEquals(24, result.skipped());
        assertTrue(rows.stream().allMatch(r -> r.getPowerWatts() >= 10.0));
        assertEquals(10.0, rows.get(rows.size() - 1).getPowerWatts());
    }

    @Test
    void closingHourIsKeptSoSecondRunStaysNoOp() {
        BackfillGenerator generator = generator(new FixedSource(5));

        BackfillResult first = generator.run();
        BackfillResult second = generator.run();

        assertEquals(1, first.inserted());
        assertEquals(48, first.skipped());
        assertEquals(Instant.parse("2024-05-10T12:00:00Z"), rows.get(0).getZeit());
        assertTrue(second.isNoOp());
        assertEquals(1, rows.size());
    }

    @Test
    void skippedDaysLeaveWholeDayEmpty() {
        FixedSource source = new FixedSource(50);
        source.skipFirstDay = true;

        BackfillResult result = generator(source).run();

        // 2024-05-08 from 12:00 holds 12 hours
        assertEquals(12, result.skipped());
        assertEquals(37, result.inserted());
        assertTrue(rows.stream().noneMatch(r -> r.getZeit().isBefore(Instant.parse("2024-05-09T00:00:00Z"))));
    }

    @Test
    void energyIsOmittedWhenTrackingDisabled() {
        when(appConfig.isEnergyTrackingEnabled()).thenReturn(false);

        generator(new FixedSource(50)).run();

        assertTrue(rows.stream().allMatch(r -> r.getEnergyKwh() == null));
    }

    @Test
    void insertsAreFlushedInBatches() {
        when(appConfig.getBackfillBatchSize()).thenReturn(10);

        BackfillResult result = generator(new FixedSource(50)).run();

        assertEquals(49, result.inserted());
        verify(measurementStore, times(5)).appendAll(anyList());
    }

    @Test
    void concurrentRunsDoNotDuplicateRows() throws Exception {
        BackfillGenerator generator = generator(new FixedSource(50));
        int threadCount = 8;

        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        try {
            List<Future<BackfillResult>> futures = new ArrayList<>();
            Callable<BackfillResult> task = generator::run;
            for (int i = 0; i < threadCount; i++) {
                futures.add(executor.submit(task));
            }
            int inserted = 0;
            for (Future<BackfillResult> future : futures) {
                inserted += future.get().inserted();
            }
            assertEquals(49, inserted);
        } finally {
            executor.shutdownNow();
        }
        assertEquals(49, rows.size());
        assertEquals(49, rows.stream().map(WattMeasurementEntity::getZeit).distinct().count());
    }

    private BackfillGenerator generator(SyntheticPowerSource source) {
        return new BackfillGenerator(appConfig, measurementStore, new SampleNormalizer(appConfig, CLOCK), source, CLOCK);
    }

    private static class FixedSource implements SyntheticPowerSource {

        private final int[] cycle;
        private final AtomicInteger calls = new AtomicInteger();
        private final AtomicInteger days = new AtomicInteger();
        private boolean skipFirstDay;

        FixedSource(int... cycle) {
            this.cycle = cycle;
        }

        @Override
        public int nextWatts() {
            return cycle[calls.getAndIncrement() % cycle.length];
        }

        @Override
        public boolean skipDay() {
            return skipFirstDay && days.getAndIncrement() == 0;
        }
    }
}
