package in.dcabot.domain.order;

/**
 * Order kind requested by a scheduled task.
 */
public enum OrderKind {
    MARKET,  // Spend the quote amount immediately at market
    LIMIT;   // Rest a maker order below market, reprice and fall back to market

    /**
     * Parse the schedule-file notation ("market" / "limit"), case-insensitive.
     *
     * @return the kind, or null if the value is not recognised
     */
    public static OrderKind fromConfig(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toLowerCase()) {
            case "market" -> MARKET;
            case "limit" -> LIMIT;
            default -> null;
        };
    }
}
