package com.id.wattlog.modules.series.model;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * The fixed look-back windows served by the read endpoints.
 * <p>
 * The 24h window reaches back 24 elapsed hours; the day-based windows reach back whole calendar
 * days, so a DST change inside the window never adds or drops a daily bucket.
 */
public enum SeriesWindow {
    H24(24, ChronoUnit.HOURS, BucketGranularity.HOUR, true),
    D7(7, ChronoUnit.DAYS, BucketGranularity.DAY, true),
    D30(30, ChronoUnit.DAYS, BucketGranularity.DAY, true),
    M12(365, ChronoUnit.DAYS, BucketGranularity.HALF_MONTH, false);

    private final long amount;
    private final ChronoUnit unit;
    private final BucketGranularity granularity;
    private final boolean enumerateEmpty;

    SeriesWindow(long amount, ChronoUnit unit, BucketGranularity granularity, boolean enumerateEmpty) {
        this.amount = amount;
        this.unit = unit;
        this.granularity = granularity;
        this.enumerateEmpty = enumerateEmpty;
    }

    public ZonedDateTime start(ZonedDateTime now) {
        return now.minus(amount, unit);
    }

    public BucketGranularity granularity() {
        return granularity;
    }

    public boolean enumerateEmpty() {
        return enumerateEmpty;
    }
}
