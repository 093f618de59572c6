package stocksync.engine.sync;

import java.time.LocalDate;

/**
 * The two skip-if-fresh checks.
 *
 * <p>Planning skips a target whose marker already reaches the latest trading date.
 * Execution re-checks each item against a separate recency window counted back from
 * today. The two thresholds are configured independently.
 */
public class FreshnessPolicy {

    private final TradingCalendar calendar;
    private final int recencyWindowDays;

    public FreshnessPolicy(TradingCalendar calendar, int recencyWindowDays) {
        if (recencyWindowDays < 0) {
            throw new IllegalArgumentException("recencyWindowDays must not be negative");
        }
        this.calendar = calendar;
        this.recencyWindowDays = recencyWindowDays;
    }

    public LocalDate latestTradeDate() {
        return calendar.latestTradeDate();
    }

    /** Planning-time check against a resolved latest trade date. */
    public boolean isUpToDate(LocalDate marker, LocalDate latestTradeDate) {
        return marker != null && !marker.isBefore(latestTradeDate);
    }

    /** Oldest marker still counted as synced very recently. */
    public LocalDate recencyThreshold() {
        return calendar.today().minusDays(recencyWindowDays);
    }

    /** Execution-time check. */
    public boolean isRecentlySynced(LocalDate marker) {
        return marker != null && !marker.isBefore(recencyThreshold());
    }

    public int recencyWindowDays() {
        return recencyWindowDays;
    }

    public TradingCalendar calendar() {
        return calendar;
    }
}
