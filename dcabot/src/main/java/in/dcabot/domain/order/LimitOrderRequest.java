package in.dcabot.domain.order;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Limit order placement request.
 */
public record LimitOrderRequest(
    String clientOrderId,
    String productId,
    OrderSide side,
    BigDecimal baseSize,
    BigDecimal limitPrice,
    TimeInForce timeInForce,
    Instant expiresAt,
    boolean postOnly
) {
    public LimitOrderRequest {
        if (clientOrderId == null || clientOrderId.isBlank()) {
            throw new IllegalArgumentException("Client order id cannot be null or empty");
        }
        if (productId == null || productId.isBlank()) {
            throw new IllegalArgumentException("Product id cannot be null or empty");
        }
        if (side == null) {
            throw new IllegalArgumentException("Side cannot be null");
        }
        if (baseSize == null || baseSize.signum() <= 0) {
            throw new IllegalArgumentException("Base size must be positive");
        }
        if (limitPrice == null || limitPrice.signum() <= 0) {
            throw new IllegalArgumentException("Limit price must be positive");
        }
        if (timeInForce == null) {
            throw new IllegalArgumentException("Time in force cannot be null");
        }
        if (timeInForce == TimeInForce.GTD && expiresAt == null) {
            throw new IllegalArgumentException("GTD order requires an expiry");
        }
    }

    /**
     * Same order as GTC with a different client order id.
     */
    public LimitOrderRequest asGoodTillCancelled(String newClientOrderId) {
        return new LimitOrderRequest(newClientOrderId, productId, side, baseSize, limitPrice,
            TimeInForce.GTC, null, postOnly);
    }

    /**
     * Same order at a different price with a different client order id.
     */
    public LimitOrderRequest withPrice(BigDecimal newLimitPrice, String newClientOrderId) {
        return new LimitOrderRequest(newClientOrderId, productId, side, baseSize, newLimitPrice,
            timeInForce, expiresAt, postOnly);
    }
}
