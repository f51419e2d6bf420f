package in.dcabot.domain.order;

/**
 * Identifies one submitted order. A repriced campaign supersedes its handle
 * with a new one instead of mutating it.
 */
public record OrderHandle(
    String orderId,
    String clientOrderId,
    OrderSide side,
    String productId
) {
    public OrderHandle {
        if (orderId == null || orderId.isBlank()) {
            throw new IllegalArgumentException("Order id cannot be null or empty");
        }
        if (side == null) {
            throw new IllegalArgumentException("Side cannot be null");
        }
    }
}
