package in.dcabot.service.execution;

import in.dcabot.domain.campaign.OrderIntent;
import in.dcabot.domain.order.OrderKind;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Field checks on an intent before anything touches the venue.
 */
public final class OrderIntentValidator {

    private static final Pattern PAIR = Pattern.compile("^[A-Za-z0-9]+[/-][A-Za-z0-9]+$");

    /**
     * @return problems found, empty if the intent can be executed
     */
    public List<String> validate(OrderIntent intent) {
        List<String> errors = new ArrayList<>();
        if (intent == null) {
            errors.add("Intent is required");
            return errors;
        }

        if (intent.currencyPair() == null || !PAIR.matcher(intent.currencyPair().trim()).matches()) {
            errors.add("Currency pair must look like BASE/QUOTE: " + intent.currencyPair());
        }
        if (intent.quoteAmount() == null || intent.quoteAmount().signum() <= 0) {
            errors.add("Quote amount must be positive: " + intent.quoteAmount());
        }
        if (intent.clientOrderId() != null && intent.clientOrderId().isBlank()) {
            errors.add("Client order id cannot be blank");
        }

        if (intent.orderKind() == OrderKind.LIMIT) {
            if (intent.pricing() == null) {
                errors.add("Limit orders need a limit price or a percentage below market");
            }
            if (intent.orderTimeout().isNegative() || intent.orderTimeout().isZero()) {
                errors.add("Order timeout must be positive");
            }
            if (intent.repriceInterval().isNegative()) {
                errors.add("Reprice interval cannot be negative");
            }
            Duration duration = intent.repriceDuration();
            if (duration != null && duration.isNegative()) {
                errors.add("Reprice duration cannot be negative");
            }
        }
        return errors;
    }
}
