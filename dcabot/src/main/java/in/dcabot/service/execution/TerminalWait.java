package in.dcabot.service.execution;

import in.dcabot.domain.order.OrderState;

/**
 * Result of waiting for an order to settle.
 *
 * @param lastState last state observed, null if no read succeeded
 * @param settled   true if a terminal status was observed before the cap
 */
public record TerminalWait(OrderState lastState, boolean settled) {}
