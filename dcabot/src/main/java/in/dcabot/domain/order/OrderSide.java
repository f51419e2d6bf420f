package in.dcabot.domain.order;

/**
 * Order side. The bot only accumulates, so every order it places is a buy.
 */
public enum OrderSide {
    BUY
}
