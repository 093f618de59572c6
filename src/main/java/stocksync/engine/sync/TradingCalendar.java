package stocksync.engine.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Resolves the most recent valid trading date.
 *
 * <p>The probe (typically the newest bar of a market index) is asked first. If it has no
 * answer or fails, yesterday is used, moved back to Friday when it falls on a weekend.
 * A probed date in the future is clamped to today.
 */
public class TradingCalendar {

    private static final Logger log = LoggerFactory.getLogger(TradingCalendar.class);

    private final Clock clock;
    private final Supplier<Optional<LocalDate>> probe;

    public TradingCalendar(Clock clock, Supplier<Optional<LocalDate>> probe) {
        this.clock = clock;
        this.probe = probe;
    }

    /** Calendar without a probe; always uses the weekday fallback. */
    public static TradingCalendar weekdays(Clock clock) {
        return new TradingCalendar(clock, Optional::empty);
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public LocalDate latestTradeDate() {
        LocalDate today = today();
        try {
            Optional<LocalDate> probed = probe.get();
            if (probed != null && probed.isPresent()) {
                LocalDate date = probed.get();
                return date.isAfter(today) ? today : date;
            }
        } catch (RuntimeException e) {
            log.warn("Latest trade date probe failed: {}, falling back to previous weekday", e.getMessage());
        }
        return previousWeekday(today);
    }

    static LocalDate previousWeekday(LocalDate today) {
        LocalDate yesterday = today.minusDays(1);
        if (yesterday.getDayOfWeek() == DayOfWeek.SATURDAY) {
            return yesterday.minusDays(1);
        }
        if (yesterday.getDayOfWeek() == DayOfWeek.SUNDAY) {
            return yesterday.minusDays(2);
        }
        return yesterday;
    }
}
