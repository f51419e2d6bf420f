package in.dcabot.domain.order;

import java.math.BigDecimal;

/**
 * Available balance for one currency.
 */
public record AccountBalance(String currency, BigDecimal available) {}
