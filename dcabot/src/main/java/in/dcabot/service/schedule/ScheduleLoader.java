package in.dcabot.service.schedule;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.dcabot.domain.campaign.OrderIntent;
import in.dcabot.domain.order.OrderKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the schedule file: a JSON array of task objects.
 *
 * <pre>
 * [
 *   {"frequency": "weekly", "day_of_week": "monday", "time": "09:00",
 *    "currency_pair": "BTC/USDC", "quote_currency_amount": 25,
 *    "order_type": "limit", "limit_price_pct": 0.1, "reprice_interval_seconds": 600}
 * ]
 * </pre>
 *
 * Invalid entries are logged and skipped; the rest still load.
 */
public final class ScheduleLoader {
    private static final Logger log = LoggerFactory.getLogger(ScheduleLoader.class);

    private static final BigDecimal DEFAULT_LIMIT_PRICE_PCT = new BigDecimal("0.1");
    private static final BigDecimal DEFAULT_TIMEOUT_HOURS = new BigDecimal("24");

    private final ObjectMapper objectMapper = new ObjectMapper();

    public List<ScheduledTask> load(Path file) throws IOException {
        return parse(Files.readString(file));
    }

    public List<ScheduledTask> parse(String json) throws IOException {
        JsonNode root = objectMapper.readTree(json);
        if (root == null || !root.isArray()) {
            throw new IOException("Schedule must be a JSON array of tasks");
        }

        List<ScheduledTask> tasks = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root) {
            index++;
            try {
                tasks.add(toTask(node));
            } catch (IllegalArgumentException | DateTimeParseException e) {
                log.error("[SCHEDULER] Skipping task #{}: {}", index, e.getMessage());
            }
        }
        log.info("[SCHEDULER] Loaded {} of {} task(s)", tasks.size(), index);
        return tasks;
    }

    private ScheduledTask toTask(JsonNode node) {
        String frequencyText = node.path("frequency").asText(null);
        Frequency frequency = Frequency.fromConfig(frequencyText);
        if (frequency == null) {
            throw new IllegalArgumentException("Unknown frequency: " + frequencyText);
        }

        String timeText = node.path("time").asText(null);
        LocalTime time = timeText != null ? LocalTime.parse(timeText) : null;
        String dayText = node.path("day_of_week").asText(null);
        DayOfWeek dayOfWeek = dayText != null ? DayOfWeek.valueOf(dayText.trim().toUpperCase()) : null;
        Integer dayOfMonth = node.has("day_of_month") ? node.get("day_of_month").asInt() : null;
        Integer seconds = node.has("seconds") ? node.get("seconds").asInt() : null;

        return new ScheduledTask(frequency, seconds, time, dayOfWeek, dayOfMonth, toIntent(node));
    }

    private OrderIntent toIntent(JsonNode node) {
        String orderType = node.path("order_type").asText("limit");
        OrderKind kind = OrderKind.fromConfig(orderType);
        if (kind == null) {
            throw new IllegalArgumentException("Unknown order_type: " + orderType);
        }

        String pair = node.path("currency_pair").asText(null);
        if (pair == null || pair.isBlank()) {
            throw new IllegalArgumentException("currency_pair is required");
        }
        BigDecimal amount = decimal(node, "quote_currency_amount", null);
        if (amount == null) {
            throw new IllegalArgumentException("quote_currency_amount is required");
        }

        BigDecimal timeoutHours = decimal(node, "order_timeout_hours", DEFAULT_TIMEOUT_HOURS);
        OrderIntent.Builder builder = OrderIntent.builder()
            .currencyPair(pair)
            .quoteAmount(amount)
            .orderKind(kind)
            .clientOrderId(node.path("client_order_id").asText(null))
            .limitPricePct(decimal(node, "limit_price_pct", DEFAULT_LIMIT_PRICE_PCT))
            .postOnly(node.path("post_only").asBoolean(true))
            .orderTimeout(Duration.ofSeconds(timeoutHours.multiply(BigDecimal.valueOf(3600)).longValue()))
            .repriceInterval(Duration.ofSeconds(node.path("reprice_interval_seconds").asLong(0)))
            .disableFallback(node.path("disable_fallback").asBoolean(false));

        BigDecimal limitPrice = decimal(node, "limit_price", null);
        if (limitPrice != null) {
            builder.limitPrice(limitPrice);
        }
        if (node.has("reprice_duration_seconds")) {
            builder.repriceDuration(Duration.ofSeconds(node.get("reprice_duration_seconds").asLong()));
        }
        return builder.build();
    }

    private static BigDecimal decimal(JsonNode node, String field, BigDecimal defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        try {
            return value.isNumber() ? value.decimalValue() : new BigDecimal(value.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Field " + field + " is not a number: " + value.asText());
        }
    }
}
