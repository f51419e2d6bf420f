package in.dcabot.service.execution;

import in.dcabot.domain.campaign.CampaignOutcome;
import in.dcabot.domain.campaign.CampaignPhase;
import in.dcabot.domain.campaign.CampaignState;
import in.dcabot.domain.campaign.OrderIntent;
import in.dcabot.domain.order.LimitOrderRequest;
import in.dcabot.domain.order.OrderHandle;
import in.dcabot.domain.order.OrderSide;
import in.dcabot.domain.order.ProductInfo;
import in.dcabot.domain.order.TimeInForce;
import in.dcabot.infrastructure.metrics.ExecutionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Keeps a campaign's limit order near the market for a bounded time.
 *
 * Each cycle cancels the resting order, waits for the venue to settle it,
 * recomputes the remainder from the settled fill and rests a new order for
 * that remainder at a fresh price. A new order is never placed while the
 * previous one might still be working, except after the terminal wait cap.
 *
 * The loop ends when nothing remains, the window closes, the iteration cap
 * is hit, the remainder becomes too small to size or the campaign is
 * aborted. Unless fallback is disabled or the campaign was aborted, the
 * remainder then goes to the {@link MarketFallbackWorker}.
 */
public final class RepriceLoop {
    private static final Logger log = LoggerFactory.getLogger(RepriceLoop.class);

    private final VenueOperations venue;
    private final OrderSizer sizer;
    private final OrderSubmitter submitter;
    private final OrderStatusPoller poller;
    private final MarketFallbackWorker fallbackWorker;
    private final ExecutionConfig config;
    private final ExecutionMetrics metrics;

    RepriceLoop(VenueOperations venue, OrderSizer sizer, OrderSubmitter submitter, OrderStatusPoller poller,
                MarketFallbackWorker fallbackWorker, ExecutionConfig config, ExecutionMetrics metrics) {
        this.venue = venue;
        this.sizer = sizer;
        this.submitter = submitter;
        this.poller = poller;
        this.fallbackWorker = fallbackWorker;
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * Run the campaign to completion. Never throws.
     */
    public CampaignOutcome run(OrderIntent intent, CampaignState state, CancellationToken token) {
        String campaignId = state.getCampaignId();
        Duration interval = intent.repriceInterval();
        log.info("[CAMPAIGN {}] Repricing every {}s until {}", campaignId, interval.toSeconds(), state.getDeadline());

        try {
            if (token.sleep(firstWait(interval, state))) {
                loop(intent, state, token);
            }
        } catch (Exception e) {
            log.error("[CAMPAIGN {}] Reprice loop failed: {}", campaignId, e.getMessage(), e);
        }
        state.setPhase(CampaignPhase.DONE);

        log.info("[CAMPAIGN {}] Repricing finished after {} cycle(s), remaining {}", campaignId,
            state.getIterations(), state.remaining().toPlainString());

        if (token.isCancelled()) {
            return fallbackWorker.abort(state, token);
        }
        if (intent.disableFallback()) {
            return state.isExhausted() ? CampaignOutcome.FILLED : CampaignOutcome.FALLBACK_DISABLED;
        }
        return fallbackWorker.run(intent, state, token);
    }

    private void loop(OrderIntent intent, CampaignState state, CancellationToken token) {
        String campaignId = state.getCampaignId();
        Duration interval = intent.repriceInterval();

        while (!token.isCancelled()) {
            if (state.getIterations() >= config.maxRepriceIterations()) {
                log.warn("[CAMPAIGN {}] ⚠️ Reprice iteration cap {} reached", campaignId, config.maxRepriceIterations());
                return;
            }
            if (timeLeft(state).isZero()) {
                return;
            }
            int iteration = state.nextIteration();
            OrderHandle handle = state.getCurrentHandle();

            StatusRead read = poller.read(handle);
            if (read.ok()) {
                state.recordFill(handle.orderId(), read.state().filledNotional());
            }
            if (state.isExhausted()) {
                log.info("[CAMPAIGN {}] Fully filled before cycle {}", campaignId, iteration);
                return;
            }

            state.setPhase(CampaignPhase.CANCELLING);
            venue.cancelQuietly(handle);
            TerminalWait settled = poller.awaitTerminal(handle, token);
            if (settled.lastState() != null) {
                state.recordFill(handle.orderId(), settled.lastState().filledNotional());
            }
            if (token.isCancelled()) {
                return;
            }
            if (state.isExhausted()) {
                log.info("[CAMPAIGN {}] Filled while cancelling in cycle {}", campaignId, iteration);
                return;
            }

            state.setPhase(CampaignPhase.REPRICING);
            boolean resubmitted = false;
            ProductInfo product = venue.fetchProduct(intent.productId());
            if (product == null) {
                log.warn("[CAMPAIGN {}] Cycle {} abandoned: product unavailable", campaignId, iteration);
            } else {
                SizingResult sizing = sizer.sizeLimitOrder(state.remaining(), product, intent.pricing());
                if (!sizing.isOk()) {
                    log.info("[CAMPAIGN {}] Remainder {} cannot be repriced: {}", campaignId,
                        state.remaining().toPlainString(), sizing.reason());
                    return;
                }
                Instant now = config.clock().instant();
                Duration left = Duration.between(now, state.getDeadline());
                if (left.isNegative() || left.isZero()) {
                    return;
                }
                Duration life = interval.compareTo(left) < 0 ? interval : left;
                LimitOrderRequest request = new LimitOrderRequest(
                    submitter.newClientOrderId(), intent.productId(), OrderSide.BUY, sizing.baseSize(),
                    sizing.limitPrice(), TimeInForce.GTD, now.plus(life), intent.postOnly());

                SubmitOutcome outcome = submitter.submitLimit(request, product.priceIncrement());
                if (outcome.success()) {
                    state.replaceHandle(outcome.handle(), now);
                    resubmitted = true;
                    log.info("[CAMPAIGN {}] Cycle {}: {} remaining, new order {} @ {}", campaignId, iteration,
                        state.remaining().toPlainString(), outcome.handle().orderId(),
                        outcome.limitPrice().toPlainString());
                } else {
                    log.warn("[CAMPAIGN {}] Cycle {} abandoned: {}", campaignId, iteration, outcome.describeError());
                }
            }
            if (metrics != null) {
                metrics.recordRepriceCycle(venue.venueCode(), resubmitted);
            }
            state.setPhase(CampaignPhase.ACTIVE);

            Duration left = timeLeft(state);
            if (!token.sleep(interval.compareTo(left) < 0 ? interval : left)) {
                return;
            }
        }
    }

    /**
     * Initial passive wait: what is left of the interval since submission,
     * but at least the minimum rest and at most the interval and window.
     */
    Duration firstWait(Duration interval, CampaignState state) {
        Duration sinceSubmit = Duration.between(state.getCurrentSubmittedAt(), config.clock().instant());
        Duration wait = interval.minus(sinceSubmit);
        if (wait.compareTo(config.minInitialRest()) < 0) {
            wait = config.minInitialRest();
        }
        if (wait.compareTo(interval) > 0) {
            wait = interval;
        }
        Duration left = timeLeft(state);
        return wait.compareTo(left) > 0 ? left : wait;
    }

    private Duration timeLeft(CampaignState state) {
        Duration left = Duration.between(config.clock().instant(), state.getDeadline());
        return left.isNegative() ? Duration.ZERO : left;
    }
}
