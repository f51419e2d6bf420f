package in.dcabot.service.schedule;

import in.dcabot.domain.campaign.OrderIntent;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

class NextRunCalculatorTest {

    private static final ZoneId ZONE = ZoneId.of("UTC");
    private static final OrderIntent INTENT = OrderIntent.builder()
        .currencyPair("BTC/USDC").quoteAmount("25").build();

    private final NextRunCalculator calculator = new NextRunCalculator();

    private static ZonedDateTime at(int year, int month, int day, int hour, int minute) {
        return ZonedDateTime.of(year, month, day, hour, minute, 0, 0, ZONE);
    }

    @Test
    void everyNSeconds() {
        ScheduledTask task = new ScheduledTask(Frequency.SECONDS, 30, null, null, null, INTENT);
        ZonedDateTime now = at(2024, 3, 1, 10, 0);

        assertEquals(now.plusSeconds(30), calculator.next(task, now));
    }

    @Test
    void hourly() {
        ScheduledTask task = new ScheduledTask(Frequency.HOURLY, null, null, null, null, INTENT);
        ZonedDateTime now = at(2024, 3, 1, 10, 17);

        assertEquals(at(2024, 3, 1, 11, 17), calculator.next(task, now));
    }

    @Test
    void dailyLaterTodayOrTomorrow() {
        ScheduledTask task = new ScheduledTask(Frequency.DAILY, null, LocalTime.of(9, 0), null, null, INTENT);

        assertEquals(at(2024, 3, 1, 9, 0), calculator.next(task, at(2024, 3, 1, 8, 59)));
        assertEquals(at(2024, 3, 2, 9, 0), calculator.next(task, at(2024, 3, 1, 9, 0)));
        assertEquals(at(2024, 3, 2, 9, 0), calculator.next(task, at(2024, 3, 1, 23, 0)));
    }

    @Test
    void weeklyOnTheConfiguredDay() {
        ScheduledTask task = new ScheduledTask(Frequency.WEEKLY, null, LocalTime.of(9, 0), DayOfWeek.MONDAY, null, INTENT);

        // 2024-03-01 is a Friday
        assertEquals(at(2024, 3, 4, 9, 0), calculator.next(task, at(2024, 3, 1, 12, 0)));
        // Monday, before and after the time
        assertEquals(at(2024, 3, 4, 9, 0), calculator.next(task, at(2024, 3, 4, 8, 0)));
        assertEquals(at(2024, 3, 11, 9, 0), calculator.next(task, at(2024, 3, 4, 10, 0)));
    }

    @Test
    void monthlySkipsMonthsWithoutTheDay() {
        ScheduledTask task = new ScheduledTask(Frequency.MONTHLY, null, LocalTime.of(12, 0), null, 31, INTENT);

        assertEquals(at(2024, 1, 31, 12, 0), calculator.next(task, at(2024, 1, 15, 0, 0)));
        assertEquals(at(2024, 3, 31, 12, 0), calculator.next(task, at(2024, 1, 31, 13, 0)));
    }

    @Test
    void monthlyLeapDay() {
        ScheduledTask task = new ScheduledTask(Frequency.MONTHLY, null, LocalTime.of(0, 0), null, 29, INTENT);

        assertEquals(at(2024, 2, 29, 0, 0), calculator.next(task, at(2024, 2, 1, 0, 0)));
        assertEquals(at(2025, 3, 29, 0, 0), calculator.next(task, at(2025, 2, 1, 0, 0)));
    }

    @Test
    void nextIsAlwaysAfterNow() {
        ScheduledTask task = new ScheduledTask(Frequency.ONCE, null, LocalTime.of(6, 30), null, null, INTENT);
        ZonedDateTime now = at(2024, 3, 1, 6, 30);

        assertTrue(calculator.next(task, now).isAfter(now));
    }
}
