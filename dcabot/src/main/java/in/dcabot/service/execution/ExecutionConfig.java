package in.dcabot.service.execution;

import in.dcabot.domain.order.OrderStatus;
import in.dcabot.util.Env;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Engine-wide constants, fixed at construction.
 *
 * Usage:
 * <pre>
 * ExecutionConfig config = ExecutionConfig.builder()
 *     .terminalPollInterval(Duration.ofMillis(500))
 *     .terminalWaitCap(Duration.ofSeconds(12))
 *     .minInitialRest(Duration.ofSeconds(30))
 *     .maxRepriceIterations(500)
 *     .build();
 * </pre>
 */
public final class ExecutionConfig {

    private final Set<OrderStatus> terminalStatuses;
    private final Duration terminalPollInterval;
    private final Duration terminalWaitCap;
    private final Duration minInitialRest;
    private final int maxRepriceIterations;
    private final BigDecimal absolutePriceWarnPct;
    private final int defaultQuoteScale;
    private final int defaultBaseScale;
    private final Clock clock;

    private ExecutionConfig(Builder b) {
        this.terminalStatuses = Set.copyOf(b.terminalStatuses);
        this.terminalPollInterval = b.terminalPollInterval;
        this.terminalWaitCap = b.terminalWaitCap;
        this.minInitialRest = b.minInitialRest;
        this.maxRepriceIterations = b.maxRepriceIterations;
        this.absolutePriceWarnPct = b.absolutePriceWarnPct;
        this.defaultQuoteScale = b.defaultQuoteScale;
        this.defaultBaseScale = b.defaultBaseScale;
        this.clock = b.clock;
    }

    public boolean isTerminal(OrderStatus status) {
        return status != null && terminalStatuses.contains(status);
    }

    public Set<OrderStatus> terminalStatuses() {
        return terminalStatuses;
    }

    public Duration terminalPollInterval() {
        return terminalPollInterval;
    }

    public Duration terminalWaitCap() {
        return terminalWaitCap;
    }

    public Duration minInitialRest() {
        return minInitialRest;
    }

    public int maxRepriceIterations() {
        return maxRepriceIterations;
    }

    public BigDecimal absolutePriceWarnPct() {
        return absolutePriceWarnPct;
    }

    public int defaultQuoteScale() {
        return defaultQuoteScale;
    }

    public int defaultBaseScale() {
        return defaultBaseScale;
    }

    public Clock clock() {
        return clock;
    }

    public static ExecutionConfig defaults() {
        return builder().build();
    }

    /**
     * Defaults overridden by TERMINAL_POLL_INTERVAL_MS, TERMINAL_WAIT_CAP_MS,
     * MIN_INITIAL_REST_MS, MAX_REPRICE_ITERATIONS and ABSOLUTE_PRICE_WARN_PCT.
     */
    public static ExecutionConfig fromEnv() {
        Builder defaults = new Builder();
        return builder()
            .terminalPollInterval(Env.getMillis("TERMINAL_POLL_INTERVAL_MS", defaults.terminalPollInterval))
            .terminalWaitCap(Env.getMillis("TERMINAL_WAIT_CAP_MS", defaults.terminalWaitCap))
            .minInitialRest(Env.getMillis("MIN_INITIAL_REST_MS", defaults.minInitialRest))
            .maxRepriceIterations(Env.getInt("MAX_REPRICE_ITERATIONS", defaults.maxRepriceIterations))
            .absolutePriceWarnPct(Env.getDecimal("ABSOLUTE_PRICE_WARN_PCT", defaults.absolutePriceWarnPct))
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ExecutionConfig{poll=" + terminalPollInterval.toMillis() + "ms"
            + ", waitCap=" + terminalWaitCap.toMillis() + "ms"
            + ", minRest=" + minInitialRest.toMillis() + "ms"
            + ", maxIterations=" + maxRepriceIterations + "}";
    }

    /**
     * Builder for ExecutionConfig.
     */
    public static class Builder {
        private Set<OrderStatus> terminalStatuses = EnumSet.of(
            OrderStatus.FILLED, OrderStatus.CANCELLED, OrderStatus.EXPIRED,
            OrderStatus.REJECTED, OrderStatus.FAILED);
        private Duration terminalPollInterval = Duration.ofMillis(500);
        private Duration terminalWaitCap = Duration.ofSeconds(12);
        private Duration minInitialRest = Duration.ofSeconds(30);
        private int maxRepriceIterations = 500;
        private BigDecimal absolutePriceWarnPct = new BigDecimal("5");
        private int defaultQuoteScale = 2;
        private int defaultBaseScale = 8;
        private Clock clock = Clock.systemUTC();

        public Builder terminalStatuses(Set<OrderStatus> terminalStatuses) {
            if (terminalStatuses == null || terminalStatuses.isEmpty()) {
                throw new IllegalArgumentException("Terminal statuses cannot be empty");
            }
            this.terminalStatuses = EnumSet.copyOf(terminalStatuses);
            return this;
        }

        public Builder terminalPollInterval(Duration terminalPollInterval) {
            if (terminalPollInterval.isNegative() || terminalPollInterval.isZero()) {
                throw new IllegalArgumentException("Terminal poll interval must be positive");
            }
            this.terminalPollInterval = terminalPollInterval;
            return this;
        }

        public Builder terminalWaitCap(Duration terminalWaitCap) {
            if (terminalWaitCap.isNegative()) {
                throw new IllegalArgumentException("Terminal wait cap cannot be negative");
            }
            this.terminalWaitCap = terminalWaitCap;
            return this;
        }

        public Builder minInitialRest(Duration minInitialRest) {
            if (minInitialRest.isNegative()) {
                throw new IllegalArgumentException("Minimum initial rest cannot be negative");
            }
            this.minInitialRest = minInitialRest;
            return this;
        }

        public Builder maxRepriceIterations(int maxRepriceIterations) {
            if (maxRepriceIterations <= 0) {
                throw new IllegalArgumentException("Max reprice iterations must be positive");
            }
            this.maxRepriceIterations = maxRepriceIterations;
            return this;
        }

        public Builder absolutePriceWarnPct(BigDecimal absolutePriceWarnPct) {
            if (absolutePriceWarnPct == null || absolutePriceWarnPct.signum() < 0) {
                throw new IllegalArgumentException("Absolute price warning threshold must be non-negative");
            }
            this.absolutePriceWarnPct = absolutePriceWarnPct;
            return this;
        }

        public Builder defaultQuoteScale(int defaultQuoteScale) {
            if (defaultQuoteScale < 0) {
                throw new IllegalArgumentException("Default quote scale cannot be negative");
            }
            this.defaultQuoteScale = defaultQuoteScale;
            return this;
        }

        public Builder defaultBaseScale(int defaultBaseScale) {
            if (defaultBaseScale < 0) {
                throw new IllegalArgumentException("Default base scale cannot be negative");
            }
            this.defaultBaseScale = defaultBaseScale;
            return this;
        }

        public Builder clock(Clock clock) {
            if (clock == null) {
                throw new IllegalArgumentException("Clock cannot be null");
            }
            this.clock = clock;
            return this;
        }

        public ExecutionConfig build() {
            if (terminalWaitCap.compareTo(terminalPollInterval) < 0) {
                throw new IllegalArgumentException("Terminal wait cap must not be shorter than the poll interval");
            }
            return new ExecutionConfig(this);
        }
    }
}
