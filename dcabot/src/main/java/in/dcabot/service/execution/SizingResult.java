package in.dcabot.service.execution;

import java.math.BigDecimal;

/**
 * Venue-legal order size, or the reason none could be produced.
 *
 * For limit orders {@code limitPrice} and {@code baseSize} are set and
 * {@code quoteSize} is their product; for market orders only {@code quoteSize}.
 */
public record SizingResult(
    Status status,
    BigDecimal limitPrice,
    BigDecimal baseSize,
    BigDecimal quoteSize,
    String reason
) {
    public enum Status {
        OK,
        BELOW_MINIMUM,  // Venue would reject the size; not an error
        INVALID         // No usable price or amount
    }

    public static SizingResult limit(BigDecimal limitPrice, BigDecimal baseSize) {
        return new SizingResult(Status.OK, limitPrice, baseSize, baseSize.multiply(limitPrice), null);
    }

    public static SizingResult market(BigDecimal quoteSize) {
        return new SizingResult(Status.OK, null, null, quoteSize, null);
    }

    public static SizingResult belowMinimum(String reason) {
        return new SizingResult(Status.BELOW_MINIMUM, null, null, null, reason);
    }

    public static SizingResult invalid(String reason) {
        return new SizingResult(Status.INVALID, null, null, null, reason);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
