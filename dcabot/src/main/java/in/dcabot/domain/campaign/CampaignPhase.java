package in.dcabot.domain.campaign;

/**
 * Lifecycle of a repricing campaign.
 *
 * ACTIVE -> CANCELLING -> REPRICING -> ACTIVE, ending in DONE.
 */
public enum CampaignPhase {
    ACTIVE,      // Limit order resting on the book
    CANCELLING,  // Cancel sent, waiting for the venue to settle it
    REPRICING,   // Sizing and submitting the replacement order
    DONE         // Repricing finished; fallback may still run
}
