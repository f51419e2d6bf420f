package in.dcabot.service.execution;

import in.dcabot.domain.campaign.CampaignOutcome;
import in.dcabot.domain.campaign.CampaignState;
import in.dcabot.domain.campaign.OrderIntent;
import in.dcabot.domain.order.MarketOrderRequest;
import in.dcabot.domain.order.OrderHandle;
import in.dcabot.domain.order.OrderSide;
import in.dcabot.domain.order.ProductInfo;
import in.dcabot.infrastructure.metrics.ExecutionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Buys whatever a campaign left unfilled with a single market order.
 *
 * Flow:
 * 1. Cancel the current limit order if it is still working
 * 2. Wait for it to settle and take its final fill
 * 3. Truncate the remainder to the quote increment
 * 4. Place a market buy if the venue minimum allows it
 */
public final class MarketFallbackWorker {
    private static final Logger log = LoggerFactory.getLogger(MarketFallbackWorker.class);

    private final VenueOperations venue;
    private final OrderSizer sizer;
    private final OrderSubmitter submitter;
    private final OrderStatusPoller poller;
    private final ExecutionConfig config;
    private final ExecutionMetrics metrics;

    MarketFallbackWorker(VenueOperations venue, OrderSizer sizer, OrderSubmitter submitter,
                         OrderStatusPoller poller, ExecutionConfig config, ExecutionMetrics metrics) {
        this.venue = venue;
        this.sizer = sizer;
        this.submitter = submitter;
        this.poller = poller;
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * Plain fallback: let the original order rest for the full timeout, then run.
     */
    public CampaignOutcome runAfterTimeout(OrderIntent intent, CampaignState state, CancellationToken token) {
        Instant due = state.getCurrentSubmittedAt().plus(intent.orderTimeout());
        Duration wait = Duration.between(config.clock().instant(), due);
        log.info("[CAMPAIGN {}] Fallback armed, checking order {} in {}s",
            state.getCampaignId(), state.getCurrentHandle().orderId(), Math.max(wait.toSeconds(), 0));

        if (!token.sleep(wait)) {
            return abort(state, token);
        }
        return run(intent, state, token);
    }

    /**
     * Settle the current order and buy the remainder at market. Never throws.
     */
    public CampaignOutcome run(OrderIntent intent, CampaignState state, CancellationToken token) {
        String campaignId = state.getCampaignId();
        try {
            OrderHandle handle = state.getCurrentHandle();

            StatusRead read = poller.read(handle);
            if (read.ok()) {
                state.recordFill(handle.orderId(), read.state().filledNotional());
            }
            if (!read.ok() || !poller.isTerminal(read.state())) {
                venue.cancelQuietly(handle);
                TerminalWait wait = poller.awaitTerminal(handle, token);
                if (wait.lastState() != null) {
                    state.recordFill(handle.orderId(), wait.lastState().filledNotional());
                }
            }

            if (token.isCancelled()) {
                return abort(state, token);
            }

            BigDecimal remaining = state.remaining();
            log.info("[CAMPAIGN {}] Filled {} of {}, remaining {}", campaignId,
                state.totalFilled().toPlainString(), state.getOriginalNotional().toPlainString(),
                remaining.toPlainString());

            if (remaining.signum() <= 0) {
                return CampaignOutcome.FILLED;
            }

            ProductInfo product = venue.fetchProduct(intent.productId());
            if (product == null) {
                log.warn("[CAMPAIGN {}] ⚠️ No product metadata, sizing fallback with default precision", campaignId);
            }

            SizingResult sizing = sizer.sizeMarketOrder(remaining, product);
            if (!sizing.isOk()) {
                log.info("[CAMPAIGN {}] Remainder {} left unfilled: {}", campaignId,
                    remaining.toPlainString(), sizing.reason());
                return CampaignOutcome.REMAINDER_BELOW_MINIMUM;
            }

            MarketOrderRequest request = new MarketOrderRequest(
                submitter.newClientOrderId(), intent.productId(), OrderSide.BUY, sizing.quoteSize());
            SubmitOutcome outcome = submitter.submitMarket(request);
            if (metrics != null) {
                metrics.recordFallbackOrder(venue.venueCode(), outcome.success());
            }

            if (!outcome.success()) {
                log.error("[CAMPAIGN {}] ✗ Fallback market order for {} failed: {}", campaignId,
                    sizing.quoteSize().toPlainString(), outcome.describeError());
                return CampaignOutcome.FALLBACK_FAILED;
            }

            log.info("[CAMPAIGN {}] ✓ Fallback market order {} placed for {}", campaignId,
                outcome.handle().orderId(), sizing.quoteSize().toPlainString());
            return CampaignOutcome.FALLBACK_PLACED;

        } catch (Exception e) {
            log.error("[CAMPAIGN {}] Fallback failed: {}", campaignId, e.getMessage(), e);
            return CampaignOutcome.FALLBACK_FAILED;
        }
    }

    /**
     * Aborted campaigns pull their resting order and place nothing.
     */
    CampaignOutcome abort(CampaignState state, CancellationToken token) {
        log.info("[CAMPAIGN {}] Aborted ({}), cancelling order {}", state.getCampaignId(),
            token.reason(), state.getCurrentHandle().orderId());
        venue.cancelQuietly(state.getCurrentHandle());
        return CampaignOutcome.ABORTED;
    }
}
