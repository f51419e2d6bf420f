package in.dcabot.domain.campaign;

import in.dcabot.domain.order.OrderHandle;
import in.dcabot.domain.order.OrderSide;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CampaignStateTest {

    private static OrderHandle handle(String orderId) {
        return new OrderHandle(orderId, "c-" + orderId, OrderSide.BUY, "BTC-USDC");
    }

    private static CampaignState state(String original) {
        Instant now = Instant.parse("2024-03-01T09:00:00Z");
        return new CampaignState("camp", new BigDecimal(original), handle("o-1"), now, now.plusSeconds(3600));
    }

    @Test
    void fillsAreReplacedPerOrderNotAccumulated() {
        CampaignState state = state("100");

        state.recordFill("o-1", new BigDecimal("10"));
        state.recordFill("o-1", new BigDecimal("25"));

        assertEquals(new BigDecimal("25"), state.totalFilled());
        assertEquals(new BigDecimal("75"), state.remaining());
    }

    @Test
    void remainingSumsEveryHandleIssued() {
        CampaignState state = state("100");
        state.recordFill("o-1", new BigDecimal("40"));

        state.replaceHandle(handle("o-2"), Instant.now());
        state.recordFill("o-2", new BigDecimal("35.5"));

        assertEquals("o-2", state.getCurrentHandle().orderId());
        assertEquals(new BigDecimal("24.5"), state.remaining());
        assertEquals(2, state.getFilledByOrder().size());
        assertFalse(state.isExhausted());
    }

    @Test
    void missingFillKeepsPreviousValue() {
        CampaignState state = state("100");
        state.recordFill("o-1", new BigDecimal("12"));

        state.recordFill("o-1", null);

        assertEquals(new BigDecimal("12"), state.totalFilled());
    }

    @Test
    void exhaustedWhenFullyOrOverFilled() {
        CampaignState state = state("50");
        state.recordFill("o-1", new BigDecimal("50.01"));

        assertTrue(state.isExhausted());
        assertTrue(state.remaining().signum() < 0);
    }

    @Test
    void iterationsAndPhase() {
        CampaignState state = state("50");

        assertEquals(CampaignPhase.ACTIVE, state.getPhase());
        assertEquals(1, state.nextIteration());
        assertEquals(2, state.nextIteration());
        state.setPhase(CampaignPhase.DONE);

        assertEquals(2, state.getIterations());
        assertEquals(CampaignPhase.DONE, state.getPhase());
    }

    @Test
    void rejectsNonPositiveNotional() {
        Instant now = Instant.now();
        assertThrows(IllegalArgumentException.class,
            () -> new CampaignState("camp", BigDecimal.ZERO, handle("o-1"), now, now));
    }
}
