package in.dcabot.infrastructure.metrics;

import in.dcabot.domain.campaign.CampaignOutcome;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of ExecutionMetrics.
 *
 * Key Metrics:
 * - dca_order_submissions_total{venue, kind, status}
 * - dca_tif_fallbacks_total{venue}
 * - dca_post_only_nudges_total{venue}
 * - dca_reprice_cycles_total{venue, resubmitted}
 * - dca_fallback_orders_total{venue, status}
 * - dca_campaigns_total{outcome}
 * - dca_active_campaigns
 * - dca_venue_latency_seconds{venue, operation}
 *
 * Usage:
 * <pre>
 * PrometheusExecutionMetrics metrics = new PrometheusExecutionMetrics();
 * Handlers.routing().get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusExecutionMetrics implements ExecutionMetrics {

    private final CollectorRegistry registry;

    // Order metrics
    private final Counter submissionCounter;
    private final Counter tifFallbackCounter;
    private final Counter postOnlyNudgeCounter;

    // Campaign metrics
    private final Counter repriceCycleCounter;
    private final Counter fallbackOrderCounter;
    private final Counter campaignCounter;
    private final Gauge activeCampaigns;

    // Venue metrics
    private final Histogram venueLatency;

    public PrometheusExecutionMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusExecutionMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.submissionCounter = Counter.build()
            .name("dca_order_submissions_total")
            .help("Total number of order submissions")
            .labelNames("venue", "kind", "status")
            .register(registry);

        this.tifFallbackCounter = Counter.build()
            .name("dca_tif_fallbacks_total")
            .help("GTD placements retried as GTC")
            .labelNames("venue")
            .register(registry);

        this.postOnlyNudgeCounter = Counter.build()
            .name("dca_post_only_nudges_total")
            .help("Post-only crosses retried one tick lower")
            .labelNames("venue")
            .register(registry);

        this.repriceCycleCounter = Counter.build()
            .name("dca_reprice_cycles_total")
            .help("Completed reprice cycles")
            .labelNames("venue", "resubmitted")
            .register(registry);

        this.fallbackOrderCounter = Counter.build()
            .name("dca_fallback_orders_total")
            .help("Fallback market orders")
            .labelNames("venue", "status")
            .register(registry);

        this.campaignCounter = Counter.build()
            .name("dca_campaigns_total")
            .help("Finished campaigns by outcome")
            .labelNames("outcome")
            .register(registry);

        this.activeCampaigns = Gauge.build()
            .name("dca_active_campaigns")
            .help("Campaigns currently running in the background")
            .register(registry);

        this.venueLatency = Histogram.build()
            .name("dca_venue_latency_seconds")
            .help("Venue call latency in seconds")
            .labelNames("venue", "operation")
            .buckets(0.05, 0.1, 0.2, 0.5, 1.0, 2.0, 5.0, 10.0)
            .register(registry);
    }

    @Override
    public void recordSubmission(String venueCode, String orderKind, boolean success) {
        submissionCounter.labels(venueCode, orderKind, success ? "success" : "failure").inc();
    }

    @Override
    public void recordTimeInForceFallback(String venueCode) {
        tifFallbackCounter.labels(venueCode).inc();
    }

    @Override
    public void recordPostOnlyNudge(String venueCode) {
        postOnlyNudgeCounter.labels(venueCode).inc();
    }

    @Override
    public void recordRepriceCycle(String venueCode, boolean resubmitted) {
        repriceCycleCounter.labels(venueCode, String.valueOf(resubmitted)).inc();
    }

    @Override
    public void recordFallbackOrder(String venueCode, boolean success) {
        fallbackOrderCounter.labels(venueCode, success ? "success" : "failure").inc();
    }

    @Override
    public void recordCampaignStarted() {
        activeCampaigns.inc();
    }

    @Override
    public void recordCampaignFinished(CampaignOutcome outcome) {
        activeCampaigns.dec();
        campaignCounter.labels(outcome.name()).inc();
    }

    @Override
    public void recordVenueLatency(String venueCode, String operation, Duration latency) {
        venueLatency.labels(venueCode, operation).observe(latency.toMillis() / 1000.0);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
