package in.dcabot.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.dcabot.application.port.output.TradingVenue;
import in.dcabot.domain.order.AccountBalance;
import in.dcabot.infrastructure.metrics.PrometheusExecutionMetrics;
import in.dcabot.infrastructure.metrics.PrometheusMetricsHandler;
import in.dcabot.infrastructure.venue.VenueException;
import in.dcabot.infrastructure.venue.coinbase.CoinbaseJwtSigner;
import in.dcabot.infrastructure.venue.coinbase.CoinbaseVenue;
import in.dcabot.infrastructure.venue.paper.PaperTradingVenue;
import in.dcabot.service.execution.ExecutionConfig;
import in.dcabot.service.execution.ExecutionOrchestrator;
import in.dcabot.service.schedule.DcaScheduler;
import in.dcabot.service.schedule.ScheduleLoader;
import in.dcabot.service.schedule.ScheduledTask;
import in.dcabot.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * DCA bot entry point (NO Spring).
 *
 * Wires the Coinbase venue (or paper trading), the execution engine and the
 * scheduler, then blocks until the JVM is asked to stop.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws IOException, InterruptedException {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== DCA Bot Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        boolean tradingEnabled = Env.getBool("TRADING_ENABLED", false);
        String apiKey = Env.get("COINBASE_API_KEY", null);
        String apiSecret = Env.get("COINBASE_API_SECRET", null);
        String baseUrl = Env.get("COINBASE_BASE_URL", CoinbaseVenue.DEFAULT_BASE_URL);
        Path scheduleFile = Path.of(Env.get("SCHEDULE_FILE", "schedule.json"));
        int metricsPort = Env.getInt("METRICS_PORT", 9091);

        StartupConfigValidator.validate(apiKey, apiSecret, scheduleFile, metricsPort);

        List<ScheduledTask> tasks = new ScheduleLoader().load(scheduleFile);
        StartupConfigValidator.validateSchedule(tasks);

        ExecutionConfig config = ExecutionConfig.fromEnv();
        log.info("Execution config: {}", config);

        // ═══════════════════════════════════════════════════════════════
        // Venue
        // ═══════════════════════════════════════════════════════════════
        CoinbaseVenue coinbase = new CoinbaseVenue(baseUrl, new CoinbaseJwtSigner(apiKey, apiSecret));
        TradingVenue venue = tradingEnabled ? coinbase : new PaperTradingVenue(coinbase);
        if (tradingEnabled) {
            log.warn("⚠️ TRADING_ENABLED=true: orders go to {} with real funds", baseUrl);
        } else {
            log.info("✓ Paper trading (set TRADING_ENABLED=true to trade live)");
        }

        verifyCredentials(venue);

        // ═══════════════════════════════════════════════════════════════
        // Execution engine
        // ═══════════════════════════════════════════════════════════════
        PrometheusExecutionMetrics metrics = new PrometheusExecutionMetrics();
        ExecutionOrchestrator orchestrator = new ExecutionOrchestrator(venue, config, metrics);
        log.info("✓ Execution orchestrator initialized");

        Undertow server = metricsPort > 0 ? startMetricsServer(metricsPort, metrics, orchestrator, venue) : null;

        // ═══════════════════════════════════════════════════════════════
        // Scheduler
        // ═══════════════════════════════════════════════════════════════
        DcaScheduler scheduler = new DcaScheduler(tasks, orchestrator);
        scheduler.start();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            scheduler.stop();
            orchestrator.shutdown();
            if (server != null) {
                server.stop();
            }
            stopped.countDown();
        }, "dca-shutdown"));

        log.info("✓ DCA bot running ({} mode)", venue.getVenueCode());
        stopped.await();
    }

    /**
     * List balances once so bad credentials stop the process at startup.
     */
    private static void verifyCredentials(TradingVenue venue) {
        try {
            List<AccountBalance> balances = venue.getAccounts();
            log.info("✓ Credentials verified, {} account(s)", balances.size());
            for (AccountBalance balance : balances) {
                if (balance.available().signum() > 0) {
                    log.info("  {} available: {}", balance.currency(), balance.available().toPlainString());
                }
            }
        } catch (VenueException e) {
            throw new IllegalStateException("❌ Credential check failed: " + e.getMessage(), e);
        }
    }

    private static Undertow startMetricsServer(int port, PrometheusExecutionMetrics metrics,
                                               ExecutionOrchestrator orchestrator, TradingVenue venue) {
        ObjectMapper mapper = new ObjectMapper();
        RoutingHandler routes = Handlers.routing()
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            .get("/health", exchange -> {
                ObjectNode body = mapper.createObjectNode();
                body.put("status", "UP");
                body.put("venue", venue.getVenueCode());
                body.put("activeCampaigns", orchestrator.activeCampaigns().size());
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
                exchange.getResponseSender().send(mapper.writeValueAsString(body));
            });

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(routes)
            .build();
        server.start();
        log.info("✓ Metrics on http://localhost:{}/metrics", port);
        return server;
    }

    private App() {}
}
