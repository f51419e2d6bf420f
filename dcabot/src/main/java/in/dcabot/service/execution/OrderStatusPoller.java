package in.dcabot.service.execution;

import in.dcabot.application.port.output.TradingVenue;
import in.dcabot.domain.order.OrderHandle;
import in.dcabot.domain.order.OrderState;
import in.dcabot.infrastructure.metrics.ExecutionMetrics;
import in.dcabot.infrastructure.venue.VenueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Reads order status and waits for cancelled orders to settle.
 */
public final class OrderStatusPoller {
    private static final Logger log = LoggerFactory.getLogger(OrderStatusPoller.class);

    private final TradingVenue venue;
    private final ExecutionConfig config;
    private final ExecutionMetrics metrics;

    public OrderStatusPoller(TradingVenue venue, ExecutionConfig config, ExecutionMetrics metrics) {
        this.venue = venue;
        this.config = config;
        this.metrics = metrics;
    }

    public StatusRead read(OrderHandle handle) {
        long startNanos = System.nanoTime();
        try {
            OrderState state = venue.getOrder(handle.orderId());
            if (state == null) {
                return StatusRead.failed("No state returned for " + handle.orderId());
            }
            return StatusRead.of(state);
        } catch (VenueException e) {
            log.warn("[{}] Failed to read order {}: {}", venue.getVenueCode(), handle.orderId(), e.getMessage());
            return StatusRead.failed(e.getMessage());
        } finally {
            if (metrics != null) {
                metrics.recordVenueLatency(venue.getVenueCode(), "get_order",
                    Duration.ofNanos(System.nanoTime() - startNanos));
            }
        }
    }

    public boolean isTerminal(OrderState state) {
        return state != null && config.isTerminal(state.status());
    }

    /**
     * Poll until the order reaches a terminal status, the wait cap elapses or
     * the token is cancelled. Never throws.
     */
    public TerminalWait awaitTerminal(OrderHandle handle, CancellationToken token) {
        long deadlineNanos = System.nanoTime() + config.terminalWaitCap().toNanos();
        OrderState last = null;

        while (true) {
            StatusRead read = read(handle);
            if (read.ok()) {
                last = read.state();
                if (isTerminal(last)) {
                    return new TerminalWait(last, true);
                }
            }

            long leftNanos = deadlineNanos - System.nanoTime();
            if (leftNanos <= 0) {
                log.warn("[{}] ⚠️ Order {} not terminal after {}ms, last status {}",
                    venue.getVenueCode(), handle.orderId(), config.terminalWaitCap().toMillis(),
                    last != null ? last.status() : "unread");
                return new TerminalWait(last, false);
            }

            Duration pause = Duration.ofNanos(Math.min(leftNanos, config.terminalPollInterval().toNanos()));
            if (!token.sleep(pause)) {
                return new TerminalWait(last, false);
            }
        }
    }
}
