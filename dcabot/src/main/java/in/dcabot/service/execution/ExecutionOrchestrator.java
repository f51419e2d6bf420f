package in.dcabot.service.execution;

import in.dcabot.application.port.output.TradingVenue;
import in.dcabot.domain.campaign.CampaignOutcome;
import in.dcabot.domain.campaign.CampaignState;
import in.dcabot.domain.campaign.OrderIntent;
import in.dcabot.domain.order.LimitOrderRequest;
import in.dcabot.domain.order.MarketOrderRequest;
import in.dcabot.domain.order.OrderHandle;
import in.dcabot.domain.order.OrderKind;
import in.dcabot.domain.order.OrderResult;
import in.dcabot.domain.order.OrderSide;
import in.dcabot.domain.order.ProductInfo;
import in.dcabot.domain.order.TimeInForce;
import in.dcabot.infrastructure.metrics.ExecutionMetrics;
import in.dcabot.infrastructure.venue.VenueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Execution Orchestrator.
 * Turns an intent into a first order synchronously, then hands the campaign
 * to one background task (reprice loop or market fallback).
 *
 * Synchronous failures (bad input, product lookup, sizing, submission) come
 * back as failed OrderResults. Background outcomes are only logged.
 */
public final class ExecutionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ExecutionOrchestrator.class);

    private final TradingVenue venue;
    private final ExecutionConfig config;
    private final ExecutionMetrics metrics;

    private final OrderIntentValidator validator = new OrderIntentValidator();
    private final OrderSizer sizer;
    private final OrderSubmitter submitter;
    private final RepriceLoop repriceLoop;
    private final MarketFallbackWorker fallbackWorker;

    private final Map<String, RunningCampaign> campaigns = new ConcurrentHashMap<>();
    private final ExecutorService executor;

    public ExecutionOrchestrator(TradingVenue venue, ExecutionConfig config, ExecutionMetrics metrics) {
        this(venue, config, new OrderSubmitter(venue, new OrderSizer(config), metrics), metrics);
    }

    ExecutionOrchestrator(TradingVenue venue, ExecutionConfig config, OrderSubmitter submitter,
                          ExecutionMetrics metrics) {
        this.venue = venue;
        this.config = config;
        this.metrics = metrics;
        this.sizer = new OrderSizer(config);
        this.submitter = submitter;

        VenueOperations operations = new VenueOperations(venue, metrics);
        OrderStatusPoller poller = new OrderStatusPoller(venue, config, metrics);
        this.fallbackWorker = new MarketFallbackWorker(operations, sizer, submitter, poller, config, metrics);
        this.repriceLoop = new RepriceLoop(operations, sizer, submitter, poller, fallbackWorker, config, metrics);

        AtomicInteger threadCount = new AtomicInteger();
        // One thread per campaign; a resting campaign never delays another
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "dca-campaign-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Place the first order for an intent and start its campaign.
     * Safe to call concurrently; campaigns share no state.
     *
     * @return result of the first submission only
     */
    public OrderResult createOrder(OrderIntent intent) {
        String productId = intent != null ? intent.productId() : null;
        String callerKey = intent != null ? intent.clientOrderId() : null;

        List<String> errors = validator.validate(intent);
        if (!errors.isEmpty()) {
            log.warn("Rejected intent for {}: {}", productId, errors);
            return OrderResult.failure(productId, callerKey, String.join("; ", errors));
        }

        String clientOrderId = callerKey != null ? callerKey : submitter.newClientOrderId();
        try {
            ProductInfo product;
            try {
                product = venue.getProduct(productId);
            } catch (VenueException e) {
                log.error("[{}] Product lookup failed for {}: {}", venue.getVenueCode(), productId, e.getMessage());
                return OrderResult.failure(productId, clientOrderId, "Product lookup failed: " + e.getMessage());
            }

            return intent.orderKind() == OrderKind.MARKET
                ? placeMarket(intent, product, clientOrderId)
                : placeLimit(intent, product, clientOrderId);

        } catch (Exception e) {
            log.error("Unexpected error creating order for {}: {}", productId, e.getMessage(), e);
            return OrderResult.failure(productId, clientOrderId, "Unexpected error: " + e.getMessage());
        }
    }

    private OrderResult placeMarket(OrderIntent intent, ProductInfo product, String clientOrderId) {
        SizingResult sizing = sizer.sizeMarketOrder(intent.quoteAmount(), product);
        if (!sizing.isOk()) {
            return OrderResult.failure(product.productId(), clientOrderId, sizing.reason());
        }
        SubmitOutcome outcome = submitter.submitMarket(new MarketOrderRequest(
            clientOrderId, product.productId(), OrderSide.BUY, sizing.quoteSize()));
        if (!outcome.success()) {
            return OrderResult.failure(product.productId(), clientOrderId, outcome.describeError());
        }
        return OrderResult.success(outcome.handle().orderId(), product.productId(), clientOrderId);
    }

    private OrderResult placeLimit(OrderIntent intent, ProductInfo product, String clientOrderId) {
        SizingResult sizing = sizer.sizeLimitOrder(intent.quoteAmount(), product, intent.pricing());
        if (!sizing.isOk()) {
            return OrderResult.failure(product.productId(), clientOrderId, sizing.reason());
        }

        Instant now = config.clock().instant();
        LimitOrderRequest request = new LimitOrderRequest(
            clientOrderId, product.productId(), OrderSide.BUY, sizing.baseSize(), sizing.limitPrice(),
            TimeInForce.GTD, now.plus(intent.orderTimeout()), intent.postOnly());

        SubmitOutcome outcome = submitter.submitLimit(request, product.priceIncrement());
        if (!outcome.success()) {
            return OrderResult.failure(product.productId(), clientOrderId, outcome.describeError());
        }

        OrderHandle handle = outcome.handle();
        String campaignId = startCampaign(intent, handle, clientOrderId, now);
        return OrderResult.success(handle.orderId(), product.productId(), campaignId);
    }

    /**
     * @return the id the campaign is registered under, or the first key when no campaign runs
     */
    private String startCampaign(OrderIntent intent, OrderHandle handle, String clientOrderId, Instant submittedAt) {
        if (intent.disableFallback()) {
            log.info("Fallback disabled, order {} left to rest on its own", handle.orderId());
            return clientOrderId;
        }
        boolean reprice = intent.repricingEnabled();
        Duration window = reprice ? intent.repriceWindow() : intent.orderTimeout();

        CancellationToken token = new CancellationToken();
        CompletableFuture<CampaignOutcome> completion = new CompletableFuture<>();
        RunningCampaign running = new RunningCampaign(token, completion);
        String campaignId = claimCampaignId(clientOrderId, handle.orderId(), running);
        CampaignState state = new CampaignState(campaignId, intent.quoteAmount(), handle, submittedAt,
            submittedAt.plus(window));

        if (metrics != null) {
            metrics.recordCampaignStarted();
        }
        log.info("[CAMPAIGN {}] Started for {} {} ({}), order {}", campaignId, intent.quoteAmount().toPlainString(),
            intent.productId(), reprice ? "reprice" : "fallback", handle.orderId());

        CompletableFuture
            .supplyAsync(() -> reprice
                ? repriceLoop.run(intent, state, token)
                : fallbackWorker.runAfterTimeout(intent, state, token), executor)
            .whenComplete((outcome, error) -> {
                CampaignOutcome result = outcome;
                if (error != null) {
                    log.error("[CAMPAIGN {}] Task failed: {}", campaignId, error.getMessage(), error);
                    result = CampaignOutcome.FALLBACK_FAILED;
                }
                campaigns.remove(campaignId, running);
                if (metrics != null) {
                    metrics.recordCampaignFinished(result);
                }
                log.info("[CAMPAIGN {}] Finished: {} (filled {} of {})", campaignId, result,
                    state.totalFilled().toPlainString(), state.getOriginalNotional().toPlainString());
                completion.complete(result);
            });
        return campaignId;
    }

    // Order ids are unique per venue, so the suffixed id is always free
    private String claimCampaignId(String clientOrderId, String orderId, RunningCampaign running) {
        if (campaigns.putIfAbsent(clientOrderId, running) == null) {
            return clientOrderId;
        }
        String suffixed = clientOrderId + "-" + orderId;
        campaigns.put(suffixed, running);
        return suffixed;
    }

    /**
     * Abort a running campaign: its resting order is cancelled and no fallback
     * is placed.
     *
     * @return false if no such campaign is running
     */
    public boolean abortCampaign(String campaignId) {
        RunningCampaign running = campaigns.get(campaignId);
        if (running == null) {
            return false;
        }
        log.info("[CAMPAIGN {}] Abort requested", campaignId);
        running.token().cancel("aborted by operator");
        return true;
    }

    public Set<String> activeCampaigns() {
        return Set.copyOf(campaigns.keySet());
    }

    /**
     * Completion of a running campaign.
     */
    public Optional<CompletableFuture<CampaignOutcome>> campaignCompletion(String campaignId) {
        RunningCampaign running = campaigns.get(campaignId);
        return running != null ? Optional.of(running.completion()) : Optional.empty();
    }

    /**
     * Abort every running campaign and stop the executor.
     */
    public void shutdown() {
        log.info("Shutting down execution, aborting {} campaign(s)", campaigns.size());
        campaigns.values().forEach(c -> c.token().cancel("shutdown"));
        executor.shutdown();
        try {
            if (!executor.awaitTermination(config.terminalWaitCap().toMillis() + 5000, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Execution orchestrator stopped");
    }

    private record RunningCampaign(CancellationToken token, CompletableFuture<CampaignOutcome> completion) {}
}
