package in.dcabot.service.execution;

import in.dcabot.application.port.output.TradingVenue;
import in.dcabot.domain.order.OrderHandle;
import in.dcabot.domain.order.ProductInfo;
import in.dcabot.infrastructure.metrics.ExecutionMetrics;
import in.dcabot.infrastructure.venue.VenueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Product reads and cancels as used by background campaigns: failures are
 * logged and reported as null / false, never thrown.
 */
final class VenueOperations {
    private static final Logger log = LoggerFactory.getLogger(VenueOperations.class);

    private final TradingVenue venue;
    private final ExecutionMetrics metrics;

    VenueOperations(TradingVenue venue, ExecutionMetrics metrics) {
        this.venue = venue;
        this.metrics = metrics;
    }

    String venueCode() {
        return venue.getVenueCode();
    }

    /**
     * @return fresh product snapshot, or null if it could not be read
     */
    ProductInfo fetchProduct(String productId) {
        long startNanos = System.nanoTime();
        try {
            return venue.getProduct(productId);
        } catch (VenueException e) {
            log.warn("[{}] Failed to fetch product {}: {}", venue.getVenueCode(), productId, e.getMessage());
            return null;
        } finally {
            recordLatency("get_product", startNanos);
        }
    }

    /**
     * Best-effort cancel.
     *
     * @return true if the venue accepted the request
     */
    boolean cancelQuietly(OrderHandle handle) {
        long startNanos = System.nanoTime();
        try {
            venue.cancelOrder(handle.orderId());
            return true;
        } catch (VenueException e) {
            log.warn("[{}] Cancel failed for order {}: {}", venue.getVenueCode(), handle.orderId(), e.getMessage());
            return false;
        } finally {
            recordLatency("cancel_order", startNanos);
        }
    }

    private void recordLatency(String operation, long startNanos) {
        if (metrics != null) {
            metrics.recordVenueLatency(venue.getVenueCode(), operation,
                Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }
}
