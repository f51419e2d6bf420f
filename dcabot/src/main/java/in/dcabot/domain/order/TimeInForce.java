package in.dcabot.domain.order;

/**
 * Time in force for limit orders.
 */
public enum TimeInForce {
    GTD,  // Good Till Date, expires at an explicit end time
    GTC   // Good Till Cancelled
}
