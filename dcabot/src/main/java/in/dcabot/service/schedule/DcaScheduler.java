package in.dcabot.service.schedule;

import in.dcabot.domain.order.OrderResult;
import in.dcabot.service.execution.ExecutionOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Fires scheduled purchases.
 *
 * Each task is armed for its next run; after firing it is re-armed from
 * the current time, except ONCE tasks. A failing firing is logged and the
 * task stays scheduled.
 */
public final class DcaScheduler {
    private static final Logger log = LoggerFactory.getLogger(DcaScheduler.class);

    private final List<ScheduledTask> tasks;
    private final ExecutionOrchestrator orchestrator;
    private final NextRunCalculator calculator;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    public DcaScheduler(List<ScheduledTask> tasks, ExecutionOrchestrator orchestrator) {
        this(tasks, orchestrator, new NextRunCalculator(), Clock.systemDefaultZone());
    }

    public DcaScheduler(List<ScheduledTask> tasks, ExecutionOrchestrator orchestrator,
                        NextRunCalculator calculator, Clock clock) {
        this.tasks = List.copyOf(tasks);
        this.orchestrator = orchestrator;
        this.calculator = calculator;
        this.clock = clock;
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "dca-scheduler");
            t.setDaemon(true);
            return t;
        });
        // Pending runs are dropped on stop; a firing in progress completes
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.scheduler = executor;
    }

    public void start() {
        for (ScheduledTask task : tasks) {
            arm(task);
        }
        log.info("[SCHEDULER] Started with {} task(s)", tasks.size());
    }

    private void arm(ScheduledTask task) {
        if (scheduler.isShutdown()) {
            return;
        }
        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime next = calculator.next(task, now);
        long delayMs = Math.max(Duration.between(now, next).toMillis(), 0);

        try {
            scheduler.schedule(() -> fire(task), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[SCHEDULER] Not re-arming {}, scheduler stopped", task.describe());
            return;
        }
        log.info("[SCHEDULER] {} next run at {}", task.describe(), next);
    }

    private void fire(ScheduledTask task) {
        log.info("[SCHEDULER] Firing {}", task.describe());
        try {
            OrderResult result = orchestrator.createOrder(task.intent());
            if (result.success()) {
                log.info("[SCHEDULER] ✓ Order {} placed for {}", result.orderId(), result.productId());
            } else {
                log.error("[SCHEDULER] ✗ Order for {} failed: {}", result.productId(), result.error());
            }
        } catch (Exception e) {
            log.error("[SCHEDULER] Task {} failed: {}", task.describe(), e.getMessage(), e);
        }

        if (task.frequency() == Frequency.ONCE) {
            log.info("[SCHEDULER] One-off task {} done", task.describe());
            return;
        }
        arm(task);
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[SCHEDULER] Stopped");
    }
}
