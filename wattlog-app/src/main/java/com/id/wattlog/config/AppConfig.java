package com.id.wattlog.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
@Getter
public class AppConfig {

    @Value("${wattlog.zone-id:}")
    private String zoneId;

    @Value("${wattlog.ingest.threshold-watts:10.0}")
    private double thresholdWatts;

    @Value("${wattlog.energy.tracking-enabled:true}")
    private boolean energyTrackingEnabled;

    @Value("${wattlog.energy.sample-interval-seconds:5}")
    private long sampleIntervalSeconds;

    @Value("${wattlog.series.missing-policy:NULL}")
    private String missingPolicy;

    @Value("${wattlog.series.decimals:6}")
    private int seriesDecimals;

    @Value("${wattlog.backfill.enabled:false}")
    private boolean backfillEnabled;

    @Value("${wattlog.backfill.horizon-days:365}")
    private int backfillHorizonDays;

    @Value("${wattlog.backfill.min-watts:5}")
    private int backfillMinWatts;

    @Value("${wattlog.backfill.max-watts:100}")
    private int backfillMaxWatts;

    @Value("${wattlog.backfill.day-skip-probability:0.0}")
    private double backfillDaySkipProbability;

    @Value("${wattlog.backfill.batch-size:1000}")
    private int backfillBatchSize;

    @Value("${wattlog.retention.enabled:false}")
    private boolean retentionEnabled;

    @Value("${wattlog.retention.max-age-days:365}")
    private int retentionMaxAgeDays;

    @Value("${wattlog.retention.min-interval-minutes:60}")
    private long retentionMinIntervalMinutes;
}
