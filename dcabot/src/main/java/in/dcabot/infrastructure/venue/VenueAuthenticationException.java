package in.dcabot.infrastructure.venue;

/**
 * Exception thrown when the venue rejects our credentials or they cannot be used.
 */
public class VenueAuthenticationException extends VenueException {

    public VenueAuthenticationException(String venueCode, String operation, String message) {
        super(venueCode, operation, message);
    }

    public VenueAuthenticationException(String venueCode, String operation, int httpStatus, String message) {
        super(venueCode, operation, httpStatus, message, null);
    }

    public VenueAuthenticationException(String venueCode, String operation, String message, Throwable cause) {
        super(venueCode, operation, message, cause);
    }
}
