package in.dcabot.service.execution;

import in.dcabot.domain.campaign.LimitPricing;
import in.dcabot.domain.order.ProductInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Turns a quote amount and a reference price into venue-legal values.
 *
 * All quantization truncates toward zero: a sized order never spends more
 * than it was given.
 */
public final class OrderSizer {
    private static final Logger log = LoggerFactory.getLogger(OrderSizer.class);

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final ExecutionConfig config;

    public OrderSizer(ExecutionConfig config) {
        this.config = config;
    }

    /**
     * Truncate {@code value} to a multiple of {@code increment}, expressed at the
     * increment's precision. Without a usable increment, truncate to
     * {@code defaultScale} decimals.
     */
    public static BigDecimal quantize(BigDecimal value, BigDecimal increment, int defaultScale) {
        if (value == null) {
            return null;
        }
        if (increment == null || increment.signum() <= 0) {
            return value.setScale(defaultScale, RoundingMode.DOWN);
        }
        int scale = Math.max(increment.stripTrailingZeros().scale(), 0);
        BigDecimal units = value.divide(increment, 0, RoundingMode.DOWN);
        return units.multiply(increment).setScale(scale, RoundingMode.DOWN);
    }

    /**
     * Limit price for the product's current reference price.
     *
     * @return quantized price, or null when it cannot be derived
     */
    public BigDecimal limitPrice(ProductInfo product, LimitPricing pricing) {
        BigDecimal raw;
        if (pricing.isAbsolute()) {
            raw = pricing.absolutePrice();
            if (product.hasUsablePrice()) {
                BigDecimal ceiling = product.price()
                    .multiply(BigDecimal.ONE.add(config.absolutePriceWarnPct().movePointLeft(2)));
                if (raw.compareTo(ceiling) > 0) {
                    log.warn("⚠️ Limit price {} for {} is more than {}% above market {}",
                        raw.toPlainString(), product.productId(),
                        config.absolutePriceWarnPct().toPlainString(), product.price().toPlainString());
                }
            }
        } else {
            if (!product.hasUsablePrice()) {
                return null;
            }
            BigDecimal factor = BigDecimal.ONE.subtract(pricing.percentBelowMarket().divide(HUNDRED));
            raw = product.price().multiply(factor);
        }
        BigDecimal price = quantize(raw, product.priceIncrement(), config.defaultQuoteScale());
        return price.signum() > 0 ? price : null;
    }

    /**
     * Size a limit buy spending at most {@code quoteAmount}.
     */
    public SizingResult sizeLimitOrder(BigDecimal quoteAmount, ProductInfo product, LimitPricing pricing) {
        BigDecimal price = limitPrice(product, pricing);
        if (price == null) {
            return SizingResult.invalid("No usable price for " + product.productId());
        }
        return sizeAtPrice(quoteAmount, product, price);
    }

    /**
     * Size a limit buy at an already quantized price.
     */
    public SizingResult sizeAtPrice(BigDecimal quoteAmount, ProductInfo product, BigDecimal limitPrice) {
        if (quoteAmount == null || quoteAmount.signum() <= 0) {
            return SizingResult.invalid("Quote amount must be positive");
        }
        if (limitPrice == null || limitPrice.signum() <= 0) {
            return SizingResult.invalid("Limit price must be positive");
        }

        BigDecimal rawSize = quoteAmount.divide(limitPrice, MathContext.DECIMAL128);
        BigDecimal baseSize = quantize(rawSize, product.baseIncrement(), config.defaultBaseScale());

        if (baseSize.signum() <= 0) {
            return SizingResult.belowMinimum(String.format(
                "Size for %s at %s rounds to zero", quoteAmount.toPlainString(), limitPrice.toPlainString()));
        }
        if (product.baseMinSize() != null && baseSize.compareTo(product.baseMinSize()) < 0) {
            return SizingResult.belowMinimum(String.format(
                "Base size %s below minimum %s", baseSize.toPlainString(), product.baseMinSize().toPlainString()));
        }
        BigDecimal notional = baseSize.multiply(limitPrice);
        if (product.quoteMinSize() != null && notional.compareTo(product.quoteMinSize()) < 0) {
            return SizingResult.belowMinimum(String.format(
                "Notional %s below minimum %s", notional.toPlainString(), product.quoteMinSize().toPlainString()));
        }
        return SizingResult.limit(limitPrice, baseSize);
    }

    /**
     * Size a market buy: the quote amount truncated to the quote increment.
     * A null product means metadata was unavailable; the default precision is
     * used and no minimum is enforced.
     */
    public SizingResult sizeMarketOrder(BigDecimal quoteAmount, ProductInfo product) {
        if (quoteAmount == null || quoteAmount.signum() <= 0) {
            return SizingResult.invalid("Quote amount must be positive");
        }
        BigDecimal increment = product != null ? product.quoteIncrement() : null;
        BigDecimal quoteSize = quantize(quoteAmount, increment, config.defaultQuoteScale());

        if (quoteSize.signum() <= 0) {
            return SizingResult.belowMinimum("Quote amount " + quoteAmount.toPlainString() + " rounds to zero");
        }
        if (product != null && product.quoteMinSize() != null && quoteSize.compareTo(product.quoteMinSize()) < 0) {
            return SizingResult.belowMinimum(String.format(
                "Quote size %s below minimum %s", quoteSize.toPlainString(), product.quoteMinSize().toPlainString()));
        }
        return SizingResult.market(quoteSize);
    }

    /**
     * One price increment below {@code price}, or null if that is not positive.
     */
    public BigDecimal oneTickBelow(BigDecimal price, BigDecimal priceIncrement) {
        BigDecimal tick = priceIncrement != null && priceIncrement.signum() > 0
            ? priceIncrement
            : BigDecimal.ONE.movePointLeft(config.defaultQuoteScale());
        BigDecimal nudged = price.subtract(tick);
        return nudged.signum() > 0 ? nudged : null;
    }
}
