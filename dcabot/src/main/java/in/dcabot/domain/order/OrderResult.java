package in.dcabot.domain.order;

/**
 * Outcome of a createOrder call. Reflects only the first submission of the
 * campaign; repricing and fallback happen afterwards in the background.
 */
public record OrderResult(
    boolean success,
    String orderId,
    String productId,
    OrderSide side,
    String clientOrderId,
    String error
) {
    public static OrderResult success(String orderId, String productId, String clientOrderId) {
        return new OrderResult(true, orderId, productId, OrderSide.BUY, clientOrderId, null);
    }

    public static OrderResult failure(String productId, String clientOrderId, String error) {
        return new OrderResult(false, null, productId, OrderSide.BUY, clientOrderId, error);
    }
}
