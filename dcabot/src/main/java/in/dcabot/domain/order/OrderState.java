package in.dcabot.domain.order;

import java.math.BigDecimal;

/**
 * Point-in-time read of an order's progress.
 *
 * Numeric fields are nullable: venues occasionally omit them.
 */
public record OrderState(
    String orderId,
    OrderStatus status,
    BigDecimal filledNotional,
    BigDecimal filledSize,
    BigDecimal averageFillPrice
) {
    public OrderState {
        if (status == null) {
            status = OrderStatus.UNKNOWN;
        }
    }

    /**
     * Build a state, deriving the filled notional from size x average price
     * when the venue did not report it directly.
     */
    public static OrderState of(String orderId, OrderStatus status, BigDecimal filledNotional,
                                BigDecimal filledSize, BigDecimal averageFillPrice) {
        BigDecimal notional = filledNotional;
        if (notional == null && filledSize != null && averageFillPrice != null) {
            notional = filledSize.multiply(averageFillPrice);
        }
        return new OrderState(orderId, status, notional, filledSize, averageFillPrice);
    }

    public BigDecimal filledNotionalOrZero() {
        return filledNotional != null ? filledNotional : BigDecimal.ZERO;
    }
}
