package com.boxline.billing.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Half-open billing window [start, end).
 */
public record BillingPeriod(Instant start, Instant end) {

    private static final long DAY_MILLIS = Duration.ofDays(1).toMillis();

    public BillingPeriod {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("period end before start: " + start + " > " + end);
        }
    }

    /** Calendar month in UTC. */
    public static BillingPeriod ofMonth(YearMonth month) {
        Instant start = month.atDay(1).atStartOfDay().toInstant(ZoneOffset.UTC);
        Instant end = month.plusMonths(1).atDay(1).atStartOfDay().toInstant(ZoneOffset.UTC);
        return new BillingPeriod(start, end);
    }

    public static BillingPeriod previousMonth(Instant now) {
        return ofMonth(YearMonth.from(now.atZone(ZoneOffset.UTC)).minusMonths(1));
    }

    /**
     * Window ending at the next billing date and starting one month earlier.
     * Without a billing date the window collapses to the instant {@code now}.
     */
    public static BillingPeriod endingAt(Instant nextBillingDate, Instant now) {
        if (nextBillingDate == null) {
            return new BillingPeriod(now, now);
        }
        Instant start = nextBillingDate.atZone(ZoneOffset.UTC).minusMonths(1).toInstant();
        return new BillingPeriod(start, nextBillingDate);
    }

    /** Whole days in the window, rounded up. */
    public long totalDays() {
        return ceilDays(Duration.between(start, end));
    }

    /** Whole days left until {@code end}, rounded up and clamped to [0, totalDays]. */
    public long remainingDays(Instant now) {
        if (!now.isBefore(end)) {
            return 0;
        }
        long remaining = ceilDays(Duration.between(now, end));
        return Math.min(remaining, totalDays());
    }

    private static long ceilDays(Duration d) {
        long millis = d.toMillis();
        if (millis <= 0) {
            return 0;
        }
        return (millis + DAY_MILLIS - 1) / DAY_MILLIS;
    }
}
