package in.dcabot.service.execution;

import in.dcabot.domain.order.OrderState;

/**
 * One status read: the state, or why it could not be read.
 */
public record StatusRead(boolean ok, OrderState state, String reason) {

    public static StatusRead of(OrderState state) {
        return new StatusRead(true, state, null);
    }

    public static StatusRead failed(String reason) {
        return new StatusRead(false, null, reason);
    }
}
