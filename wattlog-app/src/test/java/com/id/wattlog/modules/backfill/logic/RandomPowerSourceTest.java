package com.id.wattlog.modules.backfill.logic;

import com.id.wattlog.config.AppConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RandomPowerSourceTest {

    @Mock
    private AppConfig appConfig;

    @Test
    void drawsStayWithinInclusiveBounds() {
        when(appConfig.getBackfillMinWatts()).thenReturn(5);
        when(appConfig.getBackfillMaxWatts()).thenReturn(7);
        RandomPowerSource source = new RandomPowerSource(appConfig);

        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            int watts = source.nextWatts();
            assertTrue(watts >= 5 && watts <= 7, "out of range: " + watts);
            seen.add(watts);
        }
        assertEquals(Set.of(5, 6, 7), seen);
    }

    @Test
    void zeroProbabilityNeverSkips() {
        when(appConfig.getBackfillMinWatts()).thenReturn(5);
        when(appConfig.getBackfillMaxWatts()).thenReturn(100);
        when(appConfig.getBackfillDaySkipProbability()).thenReturn(0.0);
        RandomPowerSource source = new RandomPowerSource(appConfig);

        for (int i = 0; i < 100; i++) {
            assertFalse(source.skipDay());
        }
    }

    @Test
    void certainProbabilityAlwaysSkips() {
        when(appConfig.getBackfillMinWatts()).thenReturn(5);
        when(appConfig.getBackfillMaxWatts()).thenReturn(100);
        when(appConfig.getBackfillDaySkipProbability()).thenReturn(1.0);
        RandomPowerSource source = new RandomPowerSource(appConfig);

        assertTrue(source.skipDay());
    }

    @Test
    void invertedBoundsAreRejected() {
        when(appConfig.getBackfillMinWatts()).thenReturn(50);
        when(appConfig.getBackfillMaxWatts()).thenReturn(10);

        assertThrows(IllegalArgumentException.class, () -> new RandomPowerSource(appConfig));
    }
}
