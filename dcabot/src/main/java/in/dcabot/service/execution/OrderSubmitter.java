package in.dcabot.service.execution;

import in.dcabot.application.port.output.TradingVenue;
import in.dcabot.domain.order.LimitOrderRequest;
import in.dcabot.domain.order.MarketOrderRequest;
import in.dcabot.domain.order.OrderAck;
import in.dcabot.domain.order.OrderHandle;
import in.dcabot.domain.order.TimeInForce;
import in.dcabot.infrastructure.metrics.ExecutionMetrics;
import in.dcabot.infrastructure.venue.VenueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Places single buy orders.
 *
 * Limit orders:
 * - GTD rejected for any reason: retried once as GTC
 * - Post-only cross: retried once, one price increment lower
 *
 * Every retry carries a fresh client order id. Market orders are never retried.
 */
public final class OrderSubmitter {
    private static final Logger log = LoggerFactory.getLogger(OrderSubmitter.class);

    static final String TRANSPORT_ERROR = "TRANSPORT_ERROR";

    private final TradingVenue venue;
    private final OrderSizer sizer;
    private final Supplier<String> keyGenerator;
    private final ExecutionMetrics metrics;

    public OrderSubmitter(TradingVenue venue, OrderSizer sizer, ExecutionMetrics metrics) {
        this(venue, sizer, () -> UUID.randomUUID().toString(), metrics);
    }

    public OrderSubmitter(TradingVenue venue, OrderSizer sizer, Supplier<String> keyGenerator,
                          ExecutionMetrics metrics) {
        this.venue = venue;
        this.sizer = sizer;
        this.keyGenerator = keyGenerator;
        this.metrics = metrics;
    }

    /**
     * Fresh client order id.
     */
    public String newClientOrderId() {
        return keyGenerator.get();
    }

    /**
     * Submit a limit buy. The request's own client order id is used for the
     * first attempt only.
     *
     * @param priceIncrement product tick, used for the post-only nudge
     */
    public SubmitOutcome submitLimit(LimitOrderRequest request, BigDecimal priceIncrement) {
        int attempts = 1;
        LimitOrderRequest current = request;
        OrderAck ack = place(current);

        if (!ack.success() && current.timeInForce() == TimeInForce.GTD) {
            log.warn("[{}] GTD placement rejected for {} ({}), retrying as GTC",
                venue.getVenueCode(), current.productId(), ack.describeError());
            if (metrics != null) {
                metrics.recordTimeInForceFallback(venue.getVenueCode());
            }
            current = current.asGoodTillCancelled(newClientOrderId());
            ack = place(current);
            attempts++;
        }

        if (!ack.success() && current.postOnly() && isPostOnlyCross(ack)) {
            BigDecimal nudged = sizer.oneTickBelow(current.limitPrice(), priceIncrement);
            if (nudged != null) {
                log.info("[{}] Post-only order would cross at {}, retrying once at {}",
                    venue.getVenueCode(), current.limitPrice().toPlainString(), nudged.toPlainString());
                if (metrics != null) {
                    metrics.recordPostOnlyNudge(venue.getVenueCode());
                }
                current = current.withPrice(nudged, newClientOrderId());
                ack = place(current);
                attempts++;
            }
        }

        if (metrics != null) {
            metrics.recordSubmission(venue.getVenueCode(), "LIMIT", ack.success());
        }

        if (!ack.success()) {
            log.warn("[{}] ✗ Limit order failed for {} after {} attempt(s): {}",
                venue.getVenueCode(), current.productId(), attempts, ack.describeError());
            return SubmitOutcome.failed(ack.errorCode(), ack.message(), attempts);
        }

        OrderHandle handle = new OrderHandle(ack.orderId(), current.clientOrderId(), current.side(), current.productId());
        log.info("[{}] ✓ Limit order placed: {} {} {} @ {} {} (orderId={})",
            venue.getVenueCode(), current.side(), current.baseSize().toPlainString(), current.productId(),
            current.limitPrice().toPlainString(), current.timeInForce(), ack.orderId());
        return SubmitOutcome.placed(handle, current.limitPrice(), attempts);
    }

    /**
     * Submit a market buy for the request's quote size. No retries.
     */
    public SubmitOutcome submitMarket(MarketOrderRequest request) {
        OrderAck ack;
        long startNanos = System.nanoTime();
        try {
            ack = venue.submitMarketOrder(request);
        } catch (VenueException e) {
            ack = OrderAck.rejected(TRANSPORT_ERROR, e.getMessage());
        }
        recordLatency(startNanos);

        if (metrics != null) {
            metrics.recordSubmission(venue.getVenueCode(), "MARKET", ack.success());
        }

        if (!ack.success()) {
            log.warn("[{}] ✗ Market order failed for {} {}: {}",
                venue.getVenueCode(), request.quoteSize().toPlainString(), request.productId(), ack.describeError());
            return SubmitOutcome.failed(ack.errorCode(), ack.message(), 1);
        }

        OrderHandle handle = new OrderHandle(ack.orderId(), request.clientOrderId(), request.side(), request.productId());
        log.info("[{}] ✓ Market order placed: {} {} {} (orderId={})",
            venue.getVenueCode(), request.side(), request.quoteSize().toPlainString(), request.productId(), ack.orderId());
        return SubmitOutcome.placed(handle, null, 1);
    }

    private OrderAck place(LimitOrderRequest request) {
        long startNanos = System.nanoTime();
        try {
            return venue.submitLimitOrder(request);
        } catch (VenueException e) {
            return OrderAck.rejected(TRANSPORT_ERROR, e.getMessage());
        } finally {
            recordLatency(startNanos);
        }
    }

    private void recordLatency(long startNanos) {
        if (metrics != null) {
            metrics.recordVenueLatency(venue.getVenueCode(), "submit_order",
                Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    /**
     * Whether a rejection means a post-only order would have taken liquidity.
     */
    static boolean isPostOnlyCross(OrderAck ack) {
        if (ack.errorCode() != null && ack.errorCode().toUpperCase().contains("POST_ONLY")) {
            return true;
        }
        if (ack.message() == null) {
            return false;
        }
        String message = ack.message().toLowerCase();
        return message.contains("post only") || message.contains("post-only") || message.contains("would cross");
    }
}
