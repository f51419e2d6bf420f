package in.dcabot.application.port.output;

import in.dcabot.domain.order.AccountBalance;
import in.dcabot.domain.order.LimitOrderRequest;
import in.dcabot.domain.order.MarketOrderRequest;
import in.dcabot.domain.order.OrderAck;
import in.dcabot.domain.order.OrderState;
import in.dcabot.domain.order.ProductInfo;
import in.dcabot.infrastructure.venue.VenueAuthenticationException;
import in.dcabot.infrastructure.venue.VenueException;

import java.util.List;

/**
 * Trading venue operations used by the execution engine.
 *
 * Calls are blocking: one campaign talks to the venue strictly in sequence,
 * so there is nothing to gain from async here. Implementations must be
 * thread-safe since campaigns share one instance.
 *
 * Error Handling:
 * - Order rejections come back as unsuccessful OrderAck values
 * - Transport and protocol failures throw VenueException
 * - Credential problems throw VenueAuthenticationException
 */
public interface TradingVenue {

    // ═══════════════════════════════════════════════════════════════════════
    // MARKET DATA
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Fetch product metadata including the current reference price.
     *
     * @param productId venue product id, e.g. BTC-USDC
     * @return fresh product snapshot
     * @throws VenueException if the product cannot be read
     */
    ProductInfo getProduct(String productId);

    // ═══════════════════════════════════════════════════════════════════════
    // ORDER PLACEMENT
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Place a limit buy.
     *
     * @return ack with the venue order id, or the rejection code and message
     * @throws VenueException on transport failure
     */
    OrderAck submitLimitOrder(LimitOrderRequest request);

    /**
     * Place a market buy sized in quote currency.
     *
     * @return ack with the venue order id, or the rejection code and message
     * @throws VenueException on transport failure
     */
    OrderAck submitMarketOrder(MarketOrderRequest request);

    /**
     * Request cancellation. The order may still fill until the venue settles it.
     *
     * @throws VenueException if the request could not be delivered
     */
    void cancelOrder(String orderId);

    // ═══════════════════════════════════════════════════════════════════════
    // ORDER STATUS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Read an order's current status and fill.
     *
     * @throws VenueException if the order cannot be read
     */
    OrderState getOrder(String orderId);

    // ═══════════════════════════════════════════════════════════════════════
    // ACCOUNT
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * List available balances.
     *
     * @throws VenueAuthenticationException if the credentials are rejected
     */
    List<AccountBalance> getAccounts();

    /**
     * Short venue code used in logs and metrics (COINBASE, PAPER).
     */
    String getVenueCode();
}
