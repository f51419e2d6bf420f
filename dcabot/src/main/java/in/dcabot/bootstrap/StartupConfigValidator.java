package in.dcabot.bootstrap;

import in.dcabot.service.schedule.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Startup configuration validator.
 *
 * Runs before anything talks to the venue. Throws IllegalStateException if
 * the configuration is unusable; the process then refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(String apiKey, String apiSecret, Path scheduleFile, int metricsPort) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: COINBASE_API_KEY is not set\n" +
                "Product data and balances are read from Coinbase even in paper mode."
            );
        }
        if (apiSecret == null || apiSecret.isBlank()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: COINBASE_API_SECRET is not set\n" +
                "Expected the EC private key (PEM) of the CDP API key."
            );
        }
        log.info("✓ API credentials present");

        if (scheduleFile == null || !Files.isRegularFile(scheduleFile)) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: schedule file not found: " + scheduleFile + "\n" +
                "Set SCHEDULE_FILE or create schedule.json in the working directory."
            );
        }
        log.info("✓ Schedule file: {}", scheduleFile.toAbsolutePath());

        if (metricsPort < 0 || metricsPort > 65535) {
            throw new IllegalStateException("❌ INVALID CONFIG: METRICS_PORT out of range: " + metricsPort);
        }

        log.info("✅ Startup config validation passed");
    }

    /**
     * @throws IllegalStateException if no task survived loading
     */
    public static void validateSchedule(List<ScheduledTask> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: schedule contains no valid tasks\n" +
                "Check the log above for skipped entries."
            );
        }
        log.info("✓ {} scheduled task(s)", tasks.size());
    }

    private StartupConfigValidator() {}
}
