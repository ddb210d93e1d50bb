package com.id.wattlog.modules.backfill.model;

import java.time.Instant;

/**
 * Summary of one backfill run. {@code start} and {@code end} are null when the store was
 * already caught up.
 */
public record BackfillResult(
        Instant start,
        Instant end,
        int hoursVisited,
        int inserted,
        int skipped
) {

    public static BackfillResult upToDate() {
        return new BackfillResult(null, null, 0, 0, 0);
    }

    public boolean isNoOp() {
        return inserted == 0;
    }
}
