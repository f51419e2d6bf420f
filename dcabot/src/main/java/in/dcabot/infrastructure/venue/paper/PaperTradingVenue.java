package in.dcabot.infrastructure.venue.paper;

import in.dcabot.application.port.output.TradingVenue;
import in.dcabot.domain.order.AccountBalance;
import in.dcabot.domain.order.LimitOrderRequest;
import in.dcabot.domain.order.MarketOrderRequest;
import in.dcabot.domain.order.OrderAck;
import in.dcabot.domain.order.OrderState;
import in.dcabot.domain.order.OrderStatus;
import in.dcabot.domain.order.ProductInfo;
import in.dcabot.domain.order.TimeInForce;
import in.dcabot.infrastructure.venue.VenueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simulated venue for running schedules without real money.
 *
 * Product data and balances come from the delegate (the real venue), so
 * prices are live. Orders only exist in memory:
 * - Market buys fill immediately at the reference price
 * - Limit buys fill at their limit once the reference price trades at or below it
 * - Post-only limits at or above the reference price are rejected as a cross
 * - GTD orders expire at their end time
 * - Cancels settle immediately
 *
 * Settled orders are kept for a retention window and then dropped, together
 * with their client order id, so a long-running process does not grow.
 */
public class PaperTradingVenue implements TradingVenue {
    private static final Logger log = LoggerFactory.getLogger(PaperTradingVenue.class);

    static final String POST_ONLY_REJECTION = "INVALID_LIMIT_PRICE_POST_ONLY";
    static final Duration DEFAULT_RETENTION = Duration.ofHours(1);

    private final TradingVenue marketData;
    private final Clock clock;
    private final Duration retention;
    private final Map<String, PaperOrder> orders = new ConcurrentHashMap<>();
    private final Map<String, String> orderIdByClientId = new ConcurrentHashMap<>();

    public PaperTradingVenue(TradingVenue marketData) {
        this(marketData, Clock.systemUTC(), DEFAULT_RETENTION);
    }

    public PaperTradingVenue(TradingVenue marketData, Clock clock) {
        this(marketData, clock, DEFAULT_RETENTION);
    }

    public PaperTradingVenue(TradingVenue marketData, Clock clock, Duration retention) {
        if (retention == null || retention.isNegative()) {
            throw new IllegalArgumentException("Retention must be zero or positive");
        }
        this.marketData = marketData;
        this.clock = clock;
        this.retention = retention;
    }

    @Override
    public String getVenueCode() {
        return "PAPER";
    }

    @Override
    public ProductInfo getProduct(String productId) {
        return marketData.getProduct(productId);
    }

    @Override
    public List<AccountBalance> getAccounts() {
        return marketData.getAccounts();
    }

    @Override
    public OrderAck submitMarketOrder(MarketOrderRequest request) {
        String existing = orderIdByClientId.get(request.clientOrderId());
        if (existing != null) {
            return OrderAck.accepted(existing);
        }
        ProductInfo product = marketData.getProduct(request.productId());
        if (!product.hasUsablePrice()) {
            return OrderAck.rejected("NO_PRICE", "No reference price for " + request.productId());
        }

        PaperOrder order = new PaperOrder(newOrderId(), request.clientOrderId(), request.productId(),
            null, null, null, null);
        order.fill(request.quoteSize().divide(product.price(), MathContext.DECIMAL64), product.price(),
            clock.instant());
        register(order);

        log.info("[PAPER] Market buy {} {} filled @ {} (orderId={})", request.quoteSize().toPlainString(),
            request.productId(), product.price().toPlainString(), order.orderId);
        return OrderAck.accepted(order.orderId);
    }

    @Override
    public OrderAck submitLimitOrder(LimitOrderRequest request) {
        String existing = orderIdByClientId.get(request.clientOrderId());
        if (existing != null) {
            return OrderAck.accepted(existing);
        }
        ProductInfo product = marketData.getProduct(request.productId());
        boolean crosses = product.hasUsablePrice() && request.limitPrice().compareTo(product.price()) >= 0;

        if (crosses && request.postOnly()) {
            log.info("[PAPER] Post-only buy @ {} would cross market {}", request.limitPrice().toPlainString(),
                product.price().toPlainString());
            return OrderAck.rejected(POST_ONLY_REJECTION, "Post only order would cross the spread");
        }

        Instant expiresAt = request.timeInForce() == TimeInForce.GTD ? request.expiresAt() : null;
        PaperOrder order = new PaperOrder(newOrderId(), request.clientOrderId(), request.productId(),
            request.baseSize(), request.limitPrice(), expiresAt, OrderStatus.OPEN);
        if (crosses) {
            order.fill(request.baseSize(), request.limitPrice(), clock.instant());
        }
        register(order);

        log.info("[PAPER] Limit buy {} {} @ {} {} -> {} (orderId={})", request.baseSize().toPlainString(),
            request.productId(), request.limitPrice().toPlainString(), request.timeInForce(), order.status,
            order.orderId);
        return OrderAck.accepted(order.orderId);
    }

    @Override
    public void cancelOrder(String orderId) {
        PaperOrder order = find(orderId, "cancel_order");
        synchronized (order) {
            if (order.status == OrderStatus.OPEN) {
                order.settle(OrderStatus.CANCELLED, clock.instant());
                log.info("[PAPER] Order {} cancelled", orderId);
            }
        }
    }

    @Override
    public OrderState getOrder(String orderId) {
        PaperOrder order = find(orderId, "get_order");
        synchronized (order) {
            if (order.status == OrderStatus.OPEN) {
                advance(order);
            }
            return order.snapshot();
        }
    }

    private void advance(PaperOrder order) {
        Instant now = clock.instant();
        if (order.expiresAt != null && !now.isBefore(order.expiresAt)) {
            order.settle(OrderStatus.EXPIRED, order.expiresAt);
            log.info("[PAPER] Order {} expired", order.orderId);
            return;
        }
        try {
            ProductInfo product = marketData.getProduct(order.productId);
            if (product.hasUsablePrice() && product.price().compareTo(order.limitPrice) <= 0) {
                order.fill(order.baseSize, order.limitPrice, now);
                log.info("[PAPER] Order {} filled @ {}", order.orderId, order.limitPrice.toPlainString());
            }
        } catch (VenueException e) {
            log.warn("[PAPER] Price check failed for {}: {}", order.orderId, e.getMessage());
        }
    }

    private PaperOrder find(String orderId, String operation) {
        PaperOrder order = orders.get(orderId);
        if (order == null) {
            throw new VenueException(getVenueCode(), operation, "Unknown order " + orderId);
        }
        return order;
    }

    private void register(PaperOrder order) {
        evictSettled();
        orders.put(order.orderId, order);
        orderIdByClientId.put(order.clientOrderId, order.orderId);
    }

    /**
     * Drop orders settled longer than the retention window ago. An open GTD
     * order past its end time counts as settled at that time.
     */
    void evictSettled() {
        Instant cutoff = clock.instant().minus(retention);
        orders.values().removeIf(order -> {
            synchronized (order) {
                if (order.status == OrderStatus.OPEN && order.expiresAt != null
                        && !cutoff.isBefore(order.expiresAt)) {
                    order.settle(OrderStatus.EXPIRED, order.expiresAt);
                }
                if (order.settledAt == null || cutoff.isBefore(order.settledAt)) {
                    return false;
                }
            }
            orderIdByClientId.remove(order.clientOrderId, order.orderId);
            log.debug("[PAPER] Evicted settled order {}", order.orderId);
            return true;
        });
    }

    int trackedOrders() {
        return orders.size();
    }

    private static String newOrderId() {
        return "paper-" + UUID.randomUUID();
    }

    private static final class PaperOrder {
        private final String orderId;
        private final String clientOrderId;
        private final String productId;
        private final BigDecimal baseSize;
        private final BigDecimal limitPrice;
        private final Instant expiresAt;

        private OrderStatus status;
        private BigDecimal filledSize = BigDecimal.ZERO;
        private BigDecimal averagePrice;
        private Instant settledAt;

        private PaperOrder(String orderId, String clientOrderId, String productId, BigDecimal baseSize,
                           BigDecimal limitPrice, Instant expiresAt, OrderStatus status) {
            this.orderId = orderId;
            this.clientOrderId = clientOrderId;
            this.productId = productId;
            this.baseSize = baseSize;
            this.limitPrice = limitPrice;
            this.expiresAt = expiresAt;
            this.status = status;
        }

        private void fill(BigDecimal size, BigDecimal price, Instant at) {
            this.filledSize = size.setScale(8, RoundingMode.DOWN);
            this.averagePrice = price;
            settle(OrderStatus.FILLED, at);
        }

        private void settle(OrderStatus terminal, Instant at) {
            this.status = terminal;
            this.settledAt = at;
        }

        private OrderState snapshot() {
            BigDecimal notional = averagePrice != null ? filledSize.multiply(averagePrice) : BigDecimal.ZERO;
            return new OrderState(orderId, status, notional, filledSize, averagePrice);
        }
    }
}
