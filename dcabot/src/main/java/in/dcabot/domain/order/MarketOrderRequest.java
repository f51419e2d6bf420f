package in.dcabot.domain.order;

import java.math.BigDecimal;

/**
 * Market order sized in quote currency.
 */
public record MarketOrderRequest(
    String clientOrderId,
    String productId,
    OrderSide side,
    BigDecimal quoteSize
) {
    public MarketOrderRequest {
        if (clientOrderId == null || clientOrderId.isBlank()) {
            throw new IllegalArgumentException("Client order id cannot be null or empty");
        }
        if (productId == null || productId.isBlank()) {
            throw new IllegalArgumentException("Product id cannot be null or empty");
        }
        if (side == null) {
            throw new IllegalArgumentException("Side cannot be null");
        }
        if (quoteSize == null || quoteSize.signum() <= 0) {
            throw new IllegalArgumentException("Quote size must be positive");
        }
    }
}
