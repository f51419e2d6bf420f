package in.dcabot.service.execution;

import in.dcabot.domain.order.OrderHandle;

import java.math.BigDecimal;

/**
 * Result of a submission including any retries the submitter made.
 *
 * @param handle     handle of the accepted order, null on failure
 * @param limitPrice price the accepted limit order rests at, null for market orders
 * @param errorCode  venue error code of the last failed attempt
 * @param message    error text of the last failed attempt
 * @param attempts   number of placement calls made
 */
public record SubmitOutcome(
    boolean success,
    OrderHandle handle,
    BigDecimal limitPrice,
    String errorCode,
    String message,
    int attempts
) {
    public static SubmitOutcome placed(OrderHandle handle, BigDecimal limitPrice, int attempts) {
        return new SubmitOutcome(true, handle, limitPrice, null, null, attempts);
    }

    public static SubmitOutcome failed(String errorCode, String message, int attempts) {
        return new SubmitOutcome(false, null, null, errorCode, message, attempts);
    }

    public String describeError() {
        if (errorCode == null) {
            return message != null ? message : "Unknown error";
        }
        return message != null ? errorCode + ": " + message : errorCode;
    }
}
