package com.id.wattlog.modules.series.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Calendar-aligned bucket widths in the service zone.
 * <p>
 * Bucket starts are real instants: hours step by elapsed time, so a DST change adds or removes a
 * wall-clock hour instead of inventing or merging one. Days and half-months start at local
 * midnight and therefore last 23, 24 or 25 hours.
 */
public enum BucketGranularity {

    HOUR {
        @Override
        public ZonedDateTime align(ZonedDateTime t) {
            return t.truncatedTo(ChronoUnit.HOURS);
        }

        @Override
        public ZonedDateTime next(ZonedDateTime bucketStart) {
            return bucketStart.plusHours(1);
        }

        /**
         * Local date-time; the offset is appended only for the repeated hour after clocks go back.
         */
        @Override
        public String label(ZonedDateTime bucketStart) {
            LocalDateTime local = bucketStart.toLocalDateTime();
            boolean ambiguous = bucketStart.getZone().getRules().getValidOffsets(local).size() > 1;
            return ambiguous
                    ? DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(bucketStart)
                    : DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(local);
        }
    },

    DAY {
        @Override
        public ZonedDateTime align(ZonedDateTime t) {
            return t.toLocalDate().atStartOfDay(t.getZone());
        }

        @Override
        public ZonedDateTime next(ZonedDateTime bucketStart) {
            return bucketStart.toLocalDate().plusDays(1).atStartOfDay(bucketStart.getZone());
        }

        @Override
        public String label(ZonedDateTime bucketStart) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format(bucketStart.toLocalDate());
        }
    },

    /**
     * Days 1-15 form half 1, days 16 to the end of the month form half 2.
     */
    HALF_MONTH {
        @Override
        public ZonedDateTime align(ZonedDateTime t) {
            LocalDate date = t.toLocalDate();
            int day = date.getDayOfMonth() < SECOND_HALF_FIRST_DAY ? 1 : SECOND_HALF_FIRST_DAY;
            return date.withDayOfMonth(day).atStartOfDay(t.getZone());
        }

        @Override
        public ZonedDateTime next(ZonedDateTime bucketStart) {
            LocalDate date = bucketStart.toLocalDate();
            LocalDate next = date.getDayOfMonth() < SECOND_HALF_FIRST_DAY
                    ? date.withDayOfMonth(SECOND_HALF_FIRST_DAY)
                    : date.plusMonths(1).withDayOfMonth(1);
            return next.atStartOfDay(bucketStart.getZone());
        }

        @Override
        public String label(ZonedDateTime bucketStart) {
            int half = bucketStart.getDayOfMonth() < SECOND_HALF_FIRST_DAY ? 1 : 2;
            return "%04d-%02d-%d".formatted(bucketStart.getYear(), bucketStart.getMonthValue(), half);
        }
    };

    private static final int SECOND_HALF_FIRST_DAY = 16;

    /**
     * @return the start of the bucket containing {@code t}
     */
    public abstract ZonedDateTime align(ZonedDateTime t);

    /**
     * @return the start of the bucket following the one starting at {@code bucketStart}
     */
    public abstract ZonedDateTime next(ZonedDateTime bucketStart);

    public abstract String label(ZonedDateTime bucketStart);
}
