package in.dcabot.infrastructure.venue.coinbase;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.dcabot.application.port.output.TradingVenue;
import in.dcabot.domain.order.AccountBalance;
import in.dcabot.domain.order.LimitOrderRequest;
import in.dcabot.domain.order.MarketOrderRequest;
import in.dcabot.domain.order.OrderAck;
import in.dcabot.domain.order.OrderSide;
import in.dcabot.domain.order.OrderState;
import in.dcabot.domain.order.OrderStatus;
import in.dcabot.domain.order.ProductInfo;
import in.dcabot.domain.order.TimeInForce;
import in.dcabot.infrastructure.venue.VenueAuthenticationException;
import in.dcabot.infrastructure.venue.VenueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Coinbase Advanced Trade REST adapter.
 *
 * API: https://api.coinbase.com/api/v3/brokerage
 *
 * Every call carries a fresh bearer token from the {@link RequestAuthenticator}.
 * Venue responses are normalized into domain values here; nothing above
 * this class sees Coinbase JSON.
 *
 * Error mapping:
 * - 401/403: VenueAuthenticationException
 * - Order rejections (success=false or 4xx on placement): unsuccessful OrderAck
 * - Anything else non-2xx, I/O, bad JSON: VenueException
 */
public class CoinbaseVenue implements TradingVenue {
    private static final Logger log = LoggerFactory.getLogger(CoinbaseVenue.class);

    public static final String DEFAULT_BASE_URL = "https://api.coinbase.com";
    private static final String VENUE_CODE = "COINBASE";
    private static final String API_PREFIX = "/api/v3/brokerage";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .build();

    private final String baseUrl;
    private final String host;
    private final RequestAuthenticator authenticator;

    public CoinbaseVenue(RequestAuthenticator authenticator) {
        this(DEFAULT_BASE_URL, authenticator);
    }

    public CoinbaseVenue(String baseUrl, RequestAuthenticator authenticator) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.host = URI.create(this.baseUrl).getHost();
        this.authenticator = authenticator;
    }

    @Override
    public String getVenueCode() {
        return VENUE_CODE;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // MARKET DATA
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public ProductInfo getProduct(String productId) {
        JsonNode json = expectOk(send("GET", API_PREFIX + "/products/" + encode(productId), null), "get_product");
        return new ProductInfo(
            json.has("product_id") ? json.get("product_id").asText() : productId,
            decimal(json, "price"),
            decimal(json, "price_increment"),
            decimal(json, "base_increment"),
            decimal(json, "quote_increment"),
            decimal(json, "quote_min_size"),
            decimal(json, "base_min_size")
        );
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ORDER PLACEMENT
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public OrderAck submitLimitOrder(LimitOrderRequest request) {
        ObjectNode payload = orderPayload(request.clientOrderId(), request.productId(), request.side());
        ObjectNode config = objectMapper.createObjectNode();
        config.put("base_size", request.baseSize().toPlainString());
        config.put("limit_price", request.limitPrice().toPlainString());
        if (request.timeInForce() == TimeInForce.GTD) {
            config.put("end_time", DateTimeFormatter.ISO_INSTANT.format(request.expiresAt()));
        }
        config.put("post_only", request.postOnly());
        payload.putObject("order_configuration")
            .set(request.timeInForce() == TimeInForce.GTD ? "limit_limit_gtd" : "limit_limit_gtc", config);

        return placeOrder(payload, request.productId());
    }

    @Override
    public OrderAck submitMarketOrder(MarketOrderRequest request) {
        ObjectNode payload = orderPayload(request.clientOrderId(), request.productId(), request.side());
        payload.putObject("order_configuration")
            .putObject("market_market_ioc")
            .put("quote_size", request.quoteSize().toPlainString());

        return placeOrder(payload, request.productId());
    }

    @Override
    public void cancelOrder(String orderId) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.putArray("order_ids").add(orderId);

        JsonNode json = expectOk(send("POST", API_PREFIX + "/orders/batch_cancel", write(payload)), "cancel_order");
        JsonNode results = json.path("results");
        for (JsonNode result : results) {
            if (!result.path("success").asBoolean(false)) {
                // Typically the order already reached a terminal state
                log.warn("[COINBASE] Cancel not accepted for {}: {}", orderId,
                    result.path("failure_reason").asText("UNKNOWN"));
            }
        }
        log.debug("[COINBASE] Cancel requested for {}", orderId);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ORDER STATUS
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public OrderState getOrder(String orderId) {
        JsonNode json = expectOk(send("GET", API_PREFIX + "/orders/historical/" + encode(orderId), null), "get_order");
        JsonNode order = json.has("order") ? json.get("order") : json;

        return OrderState.of(
            order.has("order_id") ? order.get("order_id").asText() : orderId,
            OrderStatus.fromVenue(order.path("status").asText(null)),
            decimal(order, "filled_value"),
            decimal(order, "filled_size"),
            decimal(order, "average_filled_price")
        );
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ACCOUNT
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public List<AccountBalance> getAccounts() {
        JsonNode json = expectOk(send("GET", API_PREFIX + "/accounts?limit=250", null), "get_accounts");
        List<AccountBalance> balances = new ArrayList<>();
        for (JsonNode account : json.path("accounts")) {
            BigDecimal available = decimal(account.path("available_balance"), "value");
            balances.add(new AccountBalance(
                account.path("currency").asText(),
                available != null ? available : BigDecimal.ZERO));
        }
        return balances;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // HTTP PLUMBING
    // ═══════════════════════════════════════════════════════════════════════

    private ObjectNode orderPayload(String clientOrderId, String productId, OrderSide side) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("client_order_id", clientOrderId);
        payload.put("product_id", productId);
        payload.put("side", side.name());
        return payload;
    }

    /**
     * POST an order and read Coinbase's success / error_response envelope.
     */
    private OrderAck placeOrder(ObjectNode payload, String productId) {
        HttpResponse<String> response = send("POST", API_PREFIX + "/orders", write(payload));
        int status = response.statusCode();
        if (status == 401 || status == 403) {
            throw new VenueAuthenticationException(VENUE_CODE, "submit_order", status, "Credentials rejected");
        }
        if (status >= 500) {
            throw new VenueException(VENUE_CODE, "submit_order", status, "Server error: " + response.body(), null);
        }

        JsonNode json = parse(response.body(), "submit_order");
        if (status < 300 && json.path("success").asBoolean(false)) {
            String orderId = json.path("success_response").path("order_id").asText(null);
            if (orderId == null) {
                orderId = json.path("order_id").asText(null);
            }
            if (orderId == null) {
                return OrderAck.rejected("NO_ORDER_ID", "No order id in response");
            }
            return OrderAck.accepted(orderId);
        }

        JsonNode error = json.has("error_response") ? json.get("error_response") : json;
        String code = firstText(error, "error", "new_order_failure_reason", "preview_failure_reason", "failure_reason");
        String message = firstText(error, "message", "error_details");
        log.warn("[COINBASE] Order rejected for {}: {} {}", productId, code, message);
        return OrderAck.rejected(code != null ? code : "HTTP_" + status, message);
    }

    private HttpResponse<String> send(String method, String pathAndQuery, String body) {
        String path = pathAndQuery.contains("?") ? pathAndQuery.substring(0, pathAndQuery.indexOf('?')) : pathAndQuery;
        String operation = method + " " + path;

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + pathAndQuery))
            .timeout(Duration.ofSeconds(15))
            .header("Authorization", "Bearer " + authenticator.bearerToken(method, host, path))
            .header("Accept", "application/json");

        if (body != null) {
            builder.header("Content-Type", "application/json")
                .method(method, HttpRequest.BodyPublishers.ofString(body));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        try {
            return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new VenueException(VENUE_CODE, operation, "I/O error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VenueException(VENUE_CODE, operation, "Interrupted", e);
        }
    }

    private JsonNode expectOk(HttpResponse<String> response, String operation) {
        int status = response.statusCode();
        if (status == 401 || status == 403) {
            throw new VenueAuthenticationException(VENUE_CODE, operation, status, "Credentials rejected");
        }
        if (status < 200 || status >= 300) {
            log.error("[COINBASE] {} HTTP {}: {}", operation, status, response.body());
            throw new VenueException(VENUE_CODE, operation, status, "HTTP error " + status, null);
        }
        return parse(response.body(), operation);
    }

    private JsonNode parse(String body, String operation) {
        try {
            return objectMapper.readTree(body == null || body.isBlank() ? "{}" : body);
        } catch (JsonProcessingException e) {
            throw new VenueException(VENUE_CODE, operation, "Malformed response: " + e.getOriginalMessage(), e);
        }
    }

    private String write(ObjectNode payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new VenueException(VENUE_CODE, "serialize", e.getOriginalMessage(), e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = node.path(field).asText(null);
            if (value != null && !value.isBlank() && !"UNKNOWN_FAILURE_REASON".equals(value)) {
                return value;
            }
        }
        return null;
    }

    /**
     * Coinbase sends decimals as strings; missing or blank fields read as null.
     */
    static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            log.warn("[COINBASE] Ignoring non-numeric {}: {}", field, text);
            return null;
        }
    }
}
