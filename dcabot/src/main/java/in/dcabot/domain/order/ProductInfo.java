package in.dcabot.domain.order;

import java.math.BigDecimal;

/**
 * Venue metadata for one tradable pair.
 *
 * Snapshot only: callers fetch a fresh copy whenever they size an order.
 * Increments and minimums may be null when the venue does not report them.
 */
public record ProductInfo(
    String productId,
    BigDecimal price,
    BigDecimal priceIncrement,
    BigDecimal baseIncrement,
    BigDecimal quoteIncrement,
    BigDecimal quoteMinSize,
    BigDecimal baseMinSize
) {
    public ProductInfo {
        if (productId == null || productId.isBlank()) {
            throw new IllegalArgumentException("Product id cannot be null or empty");
        }
    }

    /**
     * True when the reference price is present and positive.
     */
    public boolean hasUsablePrice() {
        return price != null && price.signum() > 0;
    }
}
