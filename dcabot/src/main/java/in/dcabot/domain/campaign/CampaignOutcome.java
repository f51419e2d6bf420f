package in.dcabot.domain.campaign;

/**
 * How a background campaign ended.
 */
public enum CampaignOutcome {
    FILLED,                  // Nothing left to buy
    FALLBACK_PLACED,         // Remainder bought with a market order
    REMAINDER_BELOW_MINIMUM, // Remainder too small for the venue, left unfilled
    FALLBACK_DISABLED,       // Remainder left unfilled on request
    FALLBACK_FAILED,         // Market order rejected or venue unreachable
    ABORTED                  // Operator abort or shutdown
}
