package in.dcabot.infrastructure.venue.coinbase;

/**
 * Produces the bearer token for one REST call.
 */
@FunctionalInterface
public interface RequestAuthenticator {

    /**
     * @param method HTTP method
     * @param host   API host, e.g. api.coinbase.com
     * @param path   request path without query string
     * @return token to send as {@code Authorization: Bearer <token>}
     */
    String bearerToken(String method, String host, String path);
}
