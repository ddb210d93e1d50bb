package com.id.wattlog.modules.backfill.logic;

import com.id.wattlog.config.AppConfig;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;

@Component
public class RandomPowerSource implements SyntheticPowerSource {

    private final AppConfig appConfig;

    public RandomPowerSource(AppConfig appConfig) {
        this.appConfig = appConfig;
        if (appConfig.getBackfillMinWatts() > appConfig.getBackfillMaxWatts()) {
            throw new IllegalArgumentException("Backfill min watts must not exceed max watts");
        }
    }

    @Override
    public int nextWatts() {
        // Both bounds inclusive
        return ThreadLocalRandom.current().nextInt(appConfig.getBackfillMinWatts(), appConfig.getBackfillMaxWatts() + 1);
    }

    @Override
    public boolean skipDay() {
        double probability = appConfig.getBackfillDaySkipProbability();
        return probability > 0 && ThreadLocalRandom.current().nextDouble() < probability;
    }
}
