package in.dcabot.service.execution;

import in.dcabot.domain.campaign.LimitPricing;
import in.dcabot.domain.order.ProductInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class OrderSizerTest {

    private final OrderSizer sizer = new OrderSizer(ExecutionConfig.defaults());

    private static ProductInfo product(String price, String quoteMin, String baseMin) {
        return new ProductInfo("BTC-USDC", price != null ? new BigDecimal(price) : null,
            new BigDecimal("0.01"), new BigDecimal("0.00000001"), new BigDecimal("0.01"),
            quoteMin != null ? new BigDecimal(quoteMin) : null,
            baseMin != null ? new BigDecimal(baseMin) : null);
    }

    @Test
    void quantizeTruncatesTowardZero() {
        assertEquals(new BigDecimal("1.23"), OrderSizer.quantize(new BigDecimal("1.239"), new BigDecimal("0.01"), 2));
        assertEquals(new BigDecimal("1.20"), OrderSizer.quantize(new BigDecimal("1.249"), new BigDecimal("0.05"), 2));
        assertEquals(new BigDecimal("120"), OrderSizer.quantize(new BigDecimal("129.99"), new BigDecimal("10"), 2));
        assertEquals(new BigDecimal("-1.23"), OrderSizer.quantize(new BigDecimal("-1.239"), new BigDecimal("0.01"), 2));
    }

    @Test
    void quantizeWithoutIncrementUsesDefaultScale() {
        assertEquals(new BigDecimal("25.12"), OrderSizer.quantize(new BigDecimal("25.129"), null, 2));
        assertEquals(new BigDecimal("0.12345678"), OrderSizer.quantize(new BigDecimal("0.123456789"), null, 8));
        assertEquals(new BigDecimal("3.99"), OrderSizer.quantize(new BigDecimal("3.999"), BigDecimal.ZERO, 2));
    }

    @Test
    @DisplayName("Quantized values never exceed the input and are multiples of the increment")
    void quantizeNeverRoundsUp() {
        Random random = new Random(42);
        BigDecimal[] increments = {
            new BigDecimal("0.01"), new BigDecimal("0.00000001"), new BigDecimal("0.5"), new BigDecimal("0.0025")
        };
        for (int i = 0; i < 500; i++) {
            BigDecimal value = BigDecimal.valueOf(random.nextDouble() * 100_000).setScale(random.nextInt(12), java.math.RoundingMode.DOWN);
            BigDecimal increment = increments[i % increments.length];

            BigDecimal q = OrderSizer.quantize(value, increment, 2);

            assertTrue(q.compareTo(value) <= 0, value + " -> " + q);
            assertEquals(0, q.remainder(increment).signum(), q + " not a multiple of " + increment);
            assertTrue(value.subtract(q).compareTo(increment) < 0, "Truncated more than one increment");
        }
    }

    @Test
    @DisplayName("$100 at $50,000, 0.01% below market")
    void percentBelowMarketSizing() {
        SizingResult result = sizer.sizeLimitOrder(new BigDecimal("100"), product("50000", "1", "0.00000001"),
            LimitPricing.percentBelow(new BigDecimal("0.01")));

        assertTrue(result.isOk());
        assertEquals(new BigDecimal("49995.00"), result.limitPrice());
        assertEquals(new BigDecimal("0.00200020"), result.baseSize());
        assertTrue(result.quoteSize().compareTo(new BigDecimal("100")) <= 0);
    }

    @Test
    void belowBaseMinimumIsSignalledNotThrown() {
        SizingResult result = sizer.sizeLimitOrder(new BigDecimal("5"), product("50000", null, "0.001"),
            LimitPricing.percentBelow(BigDecimal.ZERO));

        assertEquals(SizingResult.Status.BELOW_MINIMUM, result.status());
        assertNull(result.baseSize());
        assertTrue(result.reason().contains("Base size"));
    }

    @Test
    void belowQuoteMinimumIsSignalled() {
        SizingResult result = sizer.sizeLimitOrder(new BigDecimal("0.99"), product("50000", "1", null),
            LimitPricing.percentBelow(BigDecimal.ZERO));

        assertEquals(SizingResult.Status.BELOW_MINIMUM, result.status());
        assertTrue(result.reason().contains("Notional"));
    }

    @Test
    void absolutePriceAboveMarketWarnsButStillSizes() {
        SizingResult result = sizer.sizeLimitOrder(new BigDecimal("100"), product("50000", "1", null),
            LimitPricing.absolute(new BigDecimal("60000.129")));

        assertTrue(result.isOk());
        assertEquals(new BigDecimal("60000.12"), result.limitPrice());
    }

    @Test
    void absolutePriceWorksWithoutReferencePrice() {
        SizingResult result = sizer.sizeLimitOrder(new BigDecimal("100"), product(null, null, null),
            LimitPricing.absolute(new BigDecimal("50000")));

        assertTrue(result.isOk());
        assertEquals(new BigDecimal("0.00200000"), result.baseSize());
    }

    @Test
    void percentPricingWithoutReferencePriceIsInvalid() {
        SizingResult result = sizer.sizeLimitOrder(new BigDecimal("100"), product(null, null, null),
            LimitPricing.percentBelow(new BigDecimal("0.1")));

        assertEquals(SizingResult.Status.INVALID, result.status());
    }

    @Test
    void marketSizingTruncatesToQuoteIncrement() {
        SizingResult result = sizer.sizeMarketOrder(new BigDecimal("25.129"), product("50000", "1", null));

        assertTrue(result.isOk());
        assertEquals(new BigDecimal("25.12"), result.quoteSize());
    }

    @Test
    void marketSizingBelowQuoteMinimum() {
        SizingResult result = sizer.sizeMarketOrder(new BigDecimal("0.999"), product("50000", "1", null));

        assertEquals(SizingResult.Status.BELOW_MINIMUM, result.status());
    }

    @Test
    void marketSizingWithoutProductSkipsMinimum() {
        SizingResult result = sizer.sizeMarketOrder(new BigDecimal("0.509"), null);

        assertTrue(result.isOk());
        assertEquals(new BigDecimal("0.50"), result.quoteSize());
        assertFalse(sizer.sizeMarketOrder(new BigDecimal("0.001"), null).isOk());
    }

    @Test
    void oneTickBelow() {
        assertEquals(new BigDecimal("49994.99"), sizer.oneTickBelow(new BigDecimal("49995.00"), new BigDecimal("0.01")));
        assertEquals(new BigDecimal("99.99"), sizer.oneTickBelow(new BigDecimal("100.00"), null));
        assertNull(sizer.oneTickBelow(new BigDecimal("0.01"), new BigDecimal("0.01")));
    }
}
