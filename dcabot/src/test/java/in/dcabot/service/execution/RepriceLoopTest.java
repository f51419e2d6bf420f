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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RepriceLoopTest {

    private final ExecutionConfig config = ExecutionConfig.builder()
        .terminalPollInterval(Duration.ofMillis(2))
        .terminalWaitCap(Duration.ofMillis(200))
        .minInitialRest(Duration.ZERO)
        .build();

    private ScriptedVenue venue;
    private RepriceLoop loop;

    private void wire(ScriptedVenue scripted, ExecutionConfig cfg) {
        this.venue = scripted;
        AtomicInteger keys = new AtomicInteger();
        OrderSizer sizer = new OrderSizer(cfg);
        OrderSubmitter submitter = new OrderSubmitter(scripted, sizer, () -> "key-" + keys.incrementAndGet(), null);
        VenueOperations operations = new VenueOperations(scripted, null);
        OrderStatusPoller poller = new OrderStatusPoller(scripted, cfg, null);
        MarketFallbackWorker worker = new MarketFallbackWorker(operations, sizer, submitter, poller, cfg, null);
        this.loop = new RepriceLoop(operations, sizer, submitter, poller, worker, cfg, null);
    }

    private static OrderIntent intent(String amount, Duration interval, Duration window, boolean disableFallback) {
        return OrderIntent.builder()
            .currencyPair("BTC/USDC")
            .quoteAmount(amount)
            .limitPricePct(new BigDecimal("0.01"))
            .repriceInterval(interval)
            .repriceDuration(window)
            .disableFallback(disableFallback)
            .build();
    }

    private CampaignState seed(OrderIntent intent) {
        String orderId = venue.seedOrder(intent.quoteAmount());
        Instant now = Instant.now();
        OrderHandle handle = new OrderHandle(orderId, "caller-key", OrderSide.BUY, "BTC-USDC");
        return new CampaignState("campaign-1", intent.quoteAmount(), handle, now, now.plus(intent.repriceWindow()));
    }

    @Test
    @DisplayName("Partial fill before the first reprice resizes the replacement against the remainder")
    void partialFillResizesReplacement() {
        wire(new ScriptedVenue(ScriptedVenue.btcUsdc("50000")).planFills("40"), config);
        OrderIntent intent = intent("100", Duration.ofMillis(200), Duration.ofMillis(300), false);
        CampaignState state = seed(intent);

        CampaignOutcome outcome = loop.run(intent, state, new CancellationToken());

        List<LimitOrderRequest> resubmitted = venue.limitRequests();
        assertFalse(resubmitted.isEmpty(), "Expected at least one reprice");
        LimitOrderRequest first = resubmitted.get(0);
        assertEquals(new BigDecimal("49995.00"), first.limitPrice());
        // 60 / 49995.00 truncated to 1e-8
        assertEquals(new BigDecimal("0.00120012"), first.baseSize());
        assertEquals(TimeInForce.GTD, first.timeInForce());
        assertNotNull(first.expiresAt());
        assertTrue(first.expiresAt().isBefore(state.getDeadline().plusMillis(1)),
            "Replacement must not outlive the window");

        assertEquals(CampaignOutcome.FALLBACK_PLACED, outcome);
        assertEquals(new BigDecimal("60.00"), venue.marketRequests().get(0).quoteSize());
        assertEquals(CampaignPhase.DONE, state.getPhase());
    }

    @Test
    @DisplayName("Remaining notional always equals original minus the latest fill of every order")
    void conservationAcrossCycles() {
        wire(new ScriptedVenue(ScriptedVenue.btcUsdc("50000")).planFills("10", "20", "5"),
            ExecutionConfig.builder()
                .terminalPollInterval(Duration.ofMillis(2))
                .terminalWaitCap(Duration.ofMillis(200))
                .minInitialRest(Duration.ZERO)
                .maxRepriceIterations(3)
                .build());
        OrderIntent intent = intent("100", Duration.ofMillis(20), Duration.ofSeconds(30), false);
        CampaignState state = seed(intent);

        CampaignOutcome outcome = loop.run(intent, state, new CancellationToken());

        assertEquals(3, state.getIterations());
        assertEquals(new BigDecimal("35"), state.totalFilled());
        assertEquals(new BigDecimal("65"), state.remaining());
        assertEquals(0, state.getOriginalNotional().subtract(state.remaining()).compareTo(state.totalFilled()));

        // Each replacement was sized against what was left at the time
        List<LimitOrderRequest> requests = venue.limitRequests();
        assertEquals(3, requests.size());
        assertEquals(OrderSizer.quantize(new BigDecimal("90").divide(new BigDecimal("49995.00"), MathContext.DECIMAL128),
            new BigDecimal("0.00000001"), 8), requests.get(0).baseSize());
        assertEquals(OrderSizer.quantize(new BigDecimal("70").divide(new BigDecimal("49995.00"), MathContext.DECIMAL128),
            new BigDecimal("0.00000001"), 8), requests.get(1).baseSize());

        assertEquals(CampaignOutcome.FALLBACK_PLACED, outcome);
        assertEquals(new BigDecimal("65.00"), venue.marketRequests().get(0).quoteSize());
    }

    @Test
    @DisplayName("A replacement is only placed after the cancelled order is seen terminal")
    void waitsForTerminalBeforeResubmitting() {
        wire(new ScriptedVenue(ScriptedVenue.btcUsdc("50000")).settleCancelsAfterReads(3),
            ExecutionConfig.builder()
                .terminalPollInterval(Duration.ofMillis(2))
                .terminalWaitCap(Duration.ofSeconds(2))
                .minInitialRest(Duration.ZERO)
                .maxRepriceIterations(2)
                .build());
        OrderIntent intent = intent("100", Duration.ofMillis(20), Duration.ofSeconds(30), true);
        CampaignState state = seed(intent);

        loop.run(intent, state, new CancellationToken());

        List<String> events = venue.events();
        for (int i = 1; i <= 2; i++) {
            int cancel = events.indexOf("cancel:order-" + i);
            int terminal = events.indexOf("terminal:order-" + i);
            int next = events.indexOf("submit:order-" + (i + 1));
            assertTrue(cancel >= 0 && terminal > cancel, "order-" + i + " cancelled then settled: " + events);
            assertTrue(next > terminal, "order-" + (i + 1) + " placed after order-" + i + " settled: " + events);
        }
    }

    @Test
    @DisplayName("Client order ids are unique across a campaign")
    void clientOrderIdsUnique() {
        wire(new ScriptedVenue(ScriptedVenue.btcUsdc("50000")),
            ExecutionConfig.builder()
                .terminalPollInterval(Duration.ofMillis(2))
                .terminalWaitCap(Duration.ofMillis(200))
                .minInitialRest(Duration.ZERO)
                .maxRepriceIterations(5)
                .build());
        OrderIntent intent = intent("100", Duration.ofMillis(10), Duration.ofSeconds(30), false);
        CampaignState state = seed(intent);

        loop.run(intent, state, new CancellationToken());

        Set<String> keys = new HashSet<>();
        keys.add("caller-key");
        venue.limitRequests().forEach(r -> assertTrue(keys.add(r.clientOrderId()), "Duplicate " + r.clientOrderId()));
        venue.marketRequests().forEach(r -> assertTrue(keys.add(r.clientOrderId()), "Duplicate " + r.clientOrderId()));
        assertEquals(5, venue.limitRequests().size());
        assertEquals(1, venue.marketRequests().size());
    }

    @Test
    void stopsWhenFilledBeforeFirstCycle() {
        wire(new ScriptedVenue(ScriptedVenue.btcUsdc("50000")).planFills("100"), config);
        OrderIntent intent = intent("100", Duration.ofMillis(20), Duration.ofSeconds(30), false);
        CampaignState state = seed(intent);

        CampaignOutcome outcome = loop.run(intent, state, new CancellationToken());

        assertEquals(CampaignOutcome.FILLED, outcome);
        assertTrue(venue.limitRequests().isEmpty());
        assertTrue(venue.marketRequests().isEmpty());
    }

    @Test
    void remainderTooSmallToRepriceEndsInBelowMinimum() {
        wire(new ScriptedVenue(ScriptedVenue.btcUsdc("50000")).planFills("99.5"), config);
        OrderIntent intent = intent("100", Duration.ofMillis(20), Duration.ofSeconds(30), false);
        CampaignState state = seed(intent);

        CampaignOutcome outcome = loop.run(intent, state, new CancellationToken());

        assertEquals(CampaignOutcome.REMAINDER_BELOW_MINIMUM, outcome);
        assertEquals(1, state.getIterations());
        assertTrue(venue.limitRequests().isEmpty());
        assertTrue(venue.marketRequests().isEmpty());
    }

    @Test
    void productFailureAbandonsOnlyThatCycle() {
        wire(new ScriptedVenue(ScriptedVenue.btcUsdc("50000")).failProductCalls(1),
            ExecutionConfig.builder()
                .terminalPollInterval(Duration.ofMillis(2))
                .terminalWaitCap(Duration.ofMillis(200))
                .minInitialRest(Duration.ZERO)
                .maxRepriceIterations(2)
                .build());
        OrderIntent intent = intent("100", Duration.ofMillis(10), Duration.ofSeconds(30), true);
        CampaignState state = seed(intent);

        CampaignOutcome outcome = loop.run(intent, state, new CancellationToken());

        assertEquals(2, state.getIterations());
        assertEquals(1, venue.limitRequests().size(), "Second cycle should still reprice");
        assertEquals(CampaignOutcome.FALLBACK_DISABLED, outcome);
        assertTrue(venue.marketRequests().isEmpty());
    }

    @Test
    void abortCancelsRestingOrderWithoutFallback() throws Exception {
        wire(new ScriptedVenue(ScriptedVenue.btcUsdc("50000")), config);
        OrderIntent intent = intent("100", Duration.ofSeconds(10), Duration.ofSeconds(30), false);
        CampaignState state = seed(intent);
        CancellationToken token = new CancellationToken();

        Thread aborter = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            token.cancel("test abort");
        });
        aborter.start();

        long start = System.nanoTime();
        CampaignOutcome outcome = loop.run(intent, state, token);
        aborter.join();

        assertEquals(CampaignOutcome.ABORTED, outcome);
        assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(5)) < 0);
        assertTrue(venue.events().contains("cancel:order-1"));
        assertTrue(venue.marketRequests().isEmpty());
    }

    @Test
    void firstWaitIsBoundedByMinimumRestAndInterval() {
        wire(new ScriptedVenue(ScriptedVenue.btcUsdc("50000")), ExecutionConfig.builder()
            .minInitialRest(Duration.ofSeconds(30))
            .build());
        Instant now = Instant.now();
        OrderHandle handle = new OrderHandle("order-x", "k", OrderSide.BUY, "BTC-USDC");

        // Submitted long ago: would be zero, raised to the minimum rest
        CampaignState stale = new CampaignState("c", BigDecimal.TEN, handle, now.minusSeconds(600), now.plusSeconds(3600));
        Duration wait = loop.firstWait(Duration.ofMinutes(5), stale);
        assertTrue(wait.compareTo(Duration.ofSeconds(29)) > 0 && wait.compareTo(Duration.ofSeconds(31)) < 0);

        // Interval shorter than the minimum rest: the interval wins
        CampaignState fresh = new CampaignState("c", BigDecimal.TEN, handle, now, now.plusSeconds(3600));
        assertEquals(Duration.ofSeconds(10), loop.firstWait(Duration.ofSeconds(10), fresh));

        // Window nearly over: never waits past the deadline
        CampaignState closing = new CampaignState("c", BigDecimal.TEN, handle, now, now.plusSeconds(5));
        assertTrue(loop.firstWait(Duration.ofMinutes(5), closing).compareTo(Duration.ofSeconds(5)) <= 0);
    }

    @Test
    void productUsedForPricingIsFetchedFreshEachCycle() {
        ScriptedVenue scripted = new ScriptedVenue(ScriptedVenue.btcUsdc("50000"));
        wire(scripted, ExecutionConfig.builder()
            .terminalPollInterval(Duration.ofMillis(2))
            .terminalWaitCap(Duration.ofMillis(200))
            .minInitialRest(Duration.ZERO)
            .maxRepriceIterations(1)
            .build());
        ProductInfo moved = ScriptedVenue.btcUsdc("40000");
        scripted.setProduct(moved);
        OrderIntent intent = intent("100", Duration.ofMillis(10), Duration.ofSeconds(30), true);
        CampaignState state = seed(intent);

        loop.run(intent, state, new CancellationToken());

        assertEquals(new BigDecimal("39996.00"), venue.limitRequests().get(0).limitPrice());
    }
}
