package in.dcabot.domain.campaign;

import java.math.BigDecimal;

/**
 * How the limit price of a campaign's orders is chosen.
 *
 * Either a percentage below the current reference price, recomputed on
 * every reprice, or a fixed absolute price.
 */
public record LimitPricing(BigDecimal percentBelowMarket, BigDecimal absolutePrice) {

    public LimitPricing {
        if ((percentBelowMarket == null) == (absolutePrice == null)) {
            throw new IllegalArgumentException("Exactly one of percent or absolute price must be set");
        }
        if (percentBelowMarket != null
            && (percentBelowMarket.signum() < 0 || percentBelowMarket.compareTo(new BigDecimal("100")) >= 0)) {
            throw new IllegalArgumentException("Percent below market must be in [0, 100): " + percentBelowMarket);
        }
        if (absolutePrice != null && absolutePrice.signum() <= 0) {
            throw new IllegalArgumentException("Absolute price must be positive: " + absolutePrice);
        }
    }

    public static LimitPricing percentBelow(BigDecimal pct) {
        return new LimitPricing(pct, null);
    }

    public static LimitPricing absolute(BigDecimal price) {
        return new LimitPricing(null, price);
    }

    public boolean isAbsolute() {
        return absolutePrice != null;
    }
}
