package in.dcabot.infrastructure.metrics;

import in.dcabot.domain.campaign.CampaignOutcome;

import java.time.Duration;

/**
 * Execution metrics for monitoring DCA campaigns.
 *
 * Key metrics:
 * - Order submissions by kind and outcome
 * - Time-in-force fallbacks and post-only nudges
 * - Reprice cycles and fallback market orders
 * - Campaign outcomes and active campaign count
 * - Venue call latency
 */
public interface ExecutionMetrics {

    /**
     * Record an order submission attempt.
     *
     * @param venueCode venue code
     * @param orderKind MARKET or LIMIT
     * @param success whether the venue accepted the order
     */
    void recordSubmission(String venueCode, String orderKind, boolean success);

    /**
     * Record a GTD placement retried as GTC.
     */
    void recordTimeInForceFallback(String venueCode);

    /**
     * Record a post-only cross retried one tick lower.
     */
    void recordPostOnlyNudge(String venueCode);

    /**
     * Record one completed reprice cycle.
     *
     * @param resubmitted whether a replacement order was placed
     */
    void recordRepriceCycle(String venueCode, boolean resubmitted);

    /**
     * Record a fallback market order attempt.
     */
    void recordFallbackOrder(String venueCode, boolean success);

    void recordCampaignStarted();

    void recordCampaignFinished(CampaignOutcome outcome);

    /**
     * Record latency of a single venue call.
     *
     * @param operation venue operation (get_product, submit_order, cancel_order, get_order)
     */
    void recordVenueLatency(String venueCode, String operation, Duration latency);
}
