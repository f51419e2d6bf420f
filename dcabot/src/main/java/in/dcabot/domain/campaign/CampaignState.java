package in.dcabot.domain.campaign;

import in.dcabot.domain.order.OrderHandle;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable bookkeeping for one campaign. Owned by the campaign's background
 * task; never shared between threads.
 *
 * remaining = original - sum(latest filled notional of every handle issued).
 * A handle's fill is replaced at each read, never added to.
 */
public final class CampaignState {

    private final String campaignId;
    private final BigDecimal originalNotional;
    private final Instant deadline;
    private final Map<String, BigDecimal> filledByOrder = new LinkedHashMap<>();

    private OrderHandle currentHandle;
    private Instant currentSubmittedAt;
    private int iterations;
    private CampaignPhase phase = CampaignPhase.ACTIVE;

    public CampaignState(String campaignId, BigDecimal originalNotional, OrderHandle firstHandle,
                         Instant firstSubmittedAt, Instant deadline) {
        if (originalNotional == null || originalNotional.signum() <= 0) {
            throw new IllegalArgumentException("Original notional must be positive");
        }
        if (firstHandle == null) {
            throw new IllegalArgumentException("First handle cannot be null");
        }
        this.campaignId = campaignId;
        this.originalNotional = originalNotional;
        this.deadline = deadline;
        this.currentHandle = firstHandle;
        this.currentSubmittedAt = firstSubmittedAt;
        filledByOrder.put(firstHandle.orderId(), BigDecimal.ZERO);
    }

    /**
     * Record the latest authoritative fill for an order. Null means the venue
     * did not report one; the previous value is kept.
     */
    public void recordFill(String orderId, BigDecimal filledNotional) {
        if (filledNotional == null) {
            filledByOrder.putIfAbsent(orderId, BigDecimal.ZERO);
            return;
        }
        filledByOrder.put(orderId, filledNotional);
    }

    public BigDecimal totalFilled() {
        BigDecimal total = BigDecimal.ZERO;
        for (BigDecimal filled : filledByOrder.values()) {
            total = total.add(filled);
        }
        return total;
    }

    public BigDecimal remaining() {
        return originalNotional.subtract(totalFilled());
    }

    public boolean isExhausted() {
        return remaining().signum() <= 0;
    }

    /**
     * Supersede the current handle with a freshly submitted order.
     */
    public void replaceHandle(OrderHandle handle, Instant submittedAt) {
        this.currentHandle = handle;
        this.currentSubmittedAt = submittedAt;
        filledByOrder.putIfAbsent(handle.orderId(), BigDecimal.ZERO);
    }

    public int nextIteration() {
        return ++iterations;
    }

    public void setPhase(CampaignPhase phase) {
        this.phase = phase;
    }

    public String getCampaignId() {
        return campaignId;
    }

    public BigDecimal getOriginalNotional() {
        return originalNotional;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public OrderHandle getCurrentHandle() {
        return currentHandle;
    }

    public Instant getCurrentSubmittedAt() {
        return currentSubmittedAt;
    }

    public int getIterations() {
        return iterations;
    }

    public CampaignPhase getPhase() {
        return phase;
    }

    public Map<String, BigDecimal> getFilledByOrder() {
        return Collections.unmodifiableMap(filledByOrder);
    }
}
