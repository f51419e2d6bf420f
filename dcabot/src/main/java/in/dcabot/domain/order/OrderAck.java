package in.dcabot.domain.order;

/**
 * Venue answer to an order placement. Rejections are reported here, not thrown.
 */
public record OrderAck(
    boolean success,
    String orderId,
    String errorCode,
    String message
) {
    public static OrderAck accepted(String orderId) {
        return new OrderAck(true, orderId, null, "Order placed");
    }

    public static OrderAck rejected(String errorCode, String message) {
        return new OrderAck(false, null, errorCode, message);
    }

    /**
     * Error code and message joined for logs and results.
     */
    public String describeError() {
        if (errorCode == null) {
            return message != null ? message : "Unknown error";
        }
        return message != null ? errorCode + ": " + message : errorCode;
    }
}
