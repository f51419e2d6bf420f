package in.dcabot.domain.campaign;

import in.dcabot.domain.order.OrderKind;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * What the scheduler asks for: buy {@code quoteAmount} of a pair.
 *
 * Field-level checks for callers live in OrderIntentValidator; the
 * constructor only rejects structurally broken values.
 *
 * @param currencyPair     pair in BASE/QUOTE or BASE-QUOTE notation
 * @param quoteAmount      notional to spend, in quote currency
 * @param orderKind        MARKET or LIMIT
 * @param clientOrderId    optional idempotency key for the first submission
 * @param pricing          limit pricing, required for LIMIT orders
 * @param postOnly         maker-only flag for limit orders
 * @param orderTimeout     total time budget of the campaign
 * @param repriceInterval  time between reprices; zero disables repricing
 * @param repriceDuration  optional repricing window, defaults to orderTimeout
 * @param disableFallback  never place the final market order
 */
public record OrderIntent(
    String currencyPair,
    BigDecimal quoteAmount,
    OrderKind orderKind,
    String clientOrderId,
    LimitPricing pricing,
    boolean postOnly,
    Duration orderTimeout,
    Duration repriceInterval,
    Duration repriceDuration,
    boolean disableFallback
) {
    public OrderIntent {
        if (orderKind == null) {
            throw new IllegalArgumentException("Order kind cannot be null");
        }
        if (orderTimeout == null) {
            orderTimeout = Duration.ofHours(24);
        }
        if (repriceInterval == null) {
            repriceInterval = Duration.ZERO;
        }
    }

    /**
     * Venue product id: "btc/usdc" becomes "BTC-USDC".
     */
    public String productId() {
        return currencyPair == null ? null : currencyPair.trim().replace('/', '-').toUpperCase();
    }

    public boolean repricingEnabled() {
        return repriceInterval.compareTo(Duration.ZERO) > 0;
    }

    /**
     * Window during which repricing runs, measured from the first submission.
     */
    public Duration repriceWindow() {
        return repriceDuration != null && repriceDuration.compareTo(Duration.ZERO) > 0
            ? repriceDuration
            : orderTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String currencyPair;
        private BigDecimal quoteAmount;
        private OrderKind orderKind = OrderKind.LIMIT;
        private String clientOrderId;
        private LimitPricing pricing = LimitPricing.percentBelow(new BigDecimal("0.1"));
        private boolean postOnly = true;
        private Duration orderTimeout = Duration.ofHours(24);
        private Duration repriceInterval = Duration.ZERO;
        private Duration repriceDuration;
        private boolean disableFallback;

        public Builder currencyPair(String currencyPair) {
            this.currencyPair = currencyPair;
            return this;
        }

        public Builder quoteAmount(BigDecimal quoteAmount) {
            this.quoteAmount = quoteAmount;
            return this;
        }

        public Builder quoteAmount(String quoteAmount) {
            this.quoteAmount = new BigDecimal(quoteAmount);
            return this;
        }

        public Builder orderKind(OrderKind orderKind) {
            this.orderKind = orderKind;
            return this;
        }

        public Builder clientOrderId(String clientOrderId) {
            this.clientOrderId = clientOrderId;
            return this;
        }

        public Builder limitPricePct(BigDecimal pct) {
            this.pricing = LimitPricing.percentBelow(pct);
            return this;
        }

        public Builder limitPrice(BigDecimal price) {
            this.pricing = LimitPricing.absolute(price);
            return this;
        }

        public Builder postOnly(boolean postOnly) {
            this.postOnly = postOnly;
            return this;
        }

        public Builder orderTimeout(Duration orderTimeout) {
            this.orderTimeout = orderTimeout;
            return this;
        }

        public Builder repriceInterval(Duration repriceInterval) {
            this.repriceInterval = repriceInterval;
            return this;
        }

        public Builder repriceDuration(Duration repriceDuration) {
            this.repriceDuration = repriceDuration;
            return this;
        }

        public Builder disableFallback(boolean disableFallback) {
            this.disableFallback = disableFallback;
            return this;
        }

        public OrderIntent build() {
            return new OrderIntent(currencyPair, quoteAmount, orderKind, clientOrderId, pricing,
                postOnly, orderTimeout, repriceInterval, repriceDuration, disableFallback);
        }
    }
}
