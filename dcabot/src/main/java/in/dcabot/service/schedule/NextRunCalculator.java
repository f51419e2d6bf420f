package in.dcabot.service.schedule;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;

/**
 * Computes when a task fires next. Pure: the caller supplies "now".
 */
public class NextRunCalculator {

    private static final int MONTH_SEARCH_LIMIT = 48;

    /**
     * @return next fire time strictly after {@code now}
     */
    public ZonedDateTime next(ScheduledTask task, ZonedDateTime now) {
        return switch (task.frequency()) {
            case SECONDS -> now.plusSeconds(task.seconds());
            case HOURLY -> now.plusHours(1);
            case DAILY, ONCE -> nextDaily(task, now);
            case WEEKLY -> nextWeekly(task, now);
            case MONTHLY -> nextMonthly(task, now);
        };
    }

    private ZonedDateTime nextDaily(ScheduledTask task, ZonedDateTime now) {
        ZonedDateTime candidate = atTime(now.toLocalDate(), task, now);
        return candidate.isAfter(now) ? candidate : atTime(now.toLocalDate().plusDays(1), task, now);
    }

    private ZonedDateTime nextWeekly(ScheduledTask task, ZonedDateTime now) {
        LocalDate date = now.toLocalDate().with(TemporalAdjusters.nextOrSame(task.dayOfWeek()));
        ZonedDateTime candidate = atTime(date, task, now);
        return candidate.isAfter(now) ? candidate : atTime(date.plusWeeks(1), task, now);
    }

    private ZonedDateTime nextMonthly(ScheduledTask task, ZonedDateTime now) {
        LocalDate firstOfMonth = now.toLocalDate().withDayOfMonth(1);
        for (int i = 0; i < MONTH_SEARCH_LIMIT; i++) {
            LocalDate month = firstOfMonth.plusMonths(i);
            if (task.dayOfMonth() > month.lengthOfMonth()) {
                continue;
            }
            ZonedDateTime candidate = atTime(month.withDayOfMonth(task.dayOfMonth()), task, now);
            if (candidate.isAfter(now)) {
                return candidate;
            }
        }
        throw new IllegalStateException("No month has day " + task.dayOfMonth());
    }

    private static ZonedDateTime atTime(LocalDate date, ScheduledTask task, ZonedDateTime now) {
        return ZonedDateTime.of(date, task.time(), now.getZone());
    }
}
