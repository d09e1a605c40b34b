package com.civic.anomaly.model;

/**
 * Trailing time window for baseline calculation: the last {@code lookbackDays}
 * ending {@code excludeRecentDays} before the scan time.
 */
public record WindowSpec(int lookbackDays, int excludeRecentDays) {

    public WindowSpec {
        if (lookbackDays <= 0) throw new IllegalArgumentException("lookbackDays must be positive");
        if (excludeRecentDays < 0) throw new IllegalArgumentException("excludeRecentDays must not be negative");
    }

    public WindowSpec withLookbackDays(int days) {
        return new WindowSpec(days, excludeRecentDays);
    }

    public WindowSpec withExcludeRecentDays(int days) {
        return new WindowSpec(lookbackDays, days);
    }

    public long fromMillis(long now) {
        return toMillis(now) - lookbackDays * DAY_MILLIS;
    }

    public long toMillis(long now) {
        return now - excludeRecentDays * DAY_MILLIS;
    }

    public static final long DAY_MILLIS = 24L * 60 * 60 * 1000;
}
