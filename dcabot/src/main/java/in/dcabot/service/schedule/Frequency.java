package in.dcabot.service.schedule;

/**
 * How often a scheduled purchase fires.
 */
public enum Frequency {
    SECONDS,  // Every n seconds
    HOURLY,
    DAILY,    // Every day at HH:mm
    WEEKLY,   // One weekday at HH:mm
    MONTHLY,  // One day of month at HH:mm; months without that day are skipped
    ONCE;     // Next HH:mm, then never again

    /**
     * @return the frequency, or null if the value is not recognised
     */
    public static Frequency fromConfig(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Frequency.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
