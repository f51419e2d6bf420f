package in.dcabot.service.schedule;

import in.dcabot.domain.campaign.OrderIntent;

import java.time.DayOfWeek;
import java.time.LocalTime;

/**
 * One entry of the schedule file: when to buy, and what.
 */
public record ScheduledTask(
    Frequency frequency,
    Integer seconds,
    LocalTime time,
    DayOfWeek dayOfWeek,
    Integer dayOfMonth,
    OrderIntent intent
) {
    public ScheduledTask {
        if (frequency == null) {
            throw new IllegalArgumentException("Frequency cannot be null");
        }
        if (intent == null) {
            throw new IllegalArgumentException("Intent cannot be null");
        }
        switch (frequency) {
            case SECONDS -> {
                if (seconds == null || seconds <= 0) {
                    throw new IllegalArgumentException("'seconds' frequency needs a positive seconds value");
                }
            }
            case DAILY, ONCE -> requireTime(frequency, time);
            case WEEKLY -> {
                requireTime(frequency, time);
                if (dayOfWeek == null) {
                    throw new IllegalArgumentException("Weekly frequency needs day_of_week");
                }
            }
            case MONTHLY -> {
                requireTime(frequency, time);
                if (dayOfMonth == null || dayOfMonth < 1 || dayOfMonth > 31) {
                    throw new IllegalArgumentException("Monthly frequency needs day_of_month between 1 and 31");
                }
            }
            case HOURLY -> { }
        }
    }

    private static void requireTime(Frequency frequency, LocalTime time) {
        if (time == null) {
            throw new IllegalArgumentException(frequency.name().toLowerCase() + " frequency needs a time (HH:mm)");
        }
    }

    /**
     * Short label for logs, e.g. "weekly MONDAY 09:00 BTC-USDC 25".
     */
    public String describe() {
        String when = switch (frequency) {
            case SECONDS -> "every " + seconds + "s";
            case HOURLY -> "hourly";
            case DAILY -> "daily " + time;
            case WEEKLY -> "weekly " + dayOfWeek + " " + time;
            case MONTHLY -> "monthly day " + dayOfMonth + " " + time;
            case ONCE -> "once " + time;
        };
        return when + " " + intent.productId() + " " + intent.quoteAmount().toPlainString();
    }
}
