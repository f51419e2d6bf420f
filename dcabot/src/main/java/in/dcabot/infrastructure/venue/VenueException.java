package in.dcabot.infrastructure.venue;

/**
 * Exception thrown when a venue call fails at the transport or protocol level.
 */
public class VenueException extends RuntimeException {

    private final String venueCode;
    private final String operation;
    private final int httpStatus;

    public VenueException(String venueCode, String operation, String message) {
        this(venueCode, operation, -1, message, null);
    }

    public VenueException(String venueCode, String operation, String message, Throwable cause) {
        this(venueCode, operation, -1, message, cause);
    }

    public VenueException(String venueCode, String operation, int httpStatus, String message, Throwable cause) {
        super(String.format("[%s:%s] %s%s",
            venueCode, operation, message, httpStatus > 0 ? " (HTTP " + httpStatus + ")" : ""), cause);
        this.venueCode = venueCode;
        this.operation = operation;
        this.httpStatus = httpStatus;
    }

    public String getVenueCode() {
        return venueCode;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * HTTP status of the failed call, or -1 when there was no response.
     */
    public int getHttpStatus() {
        return httpStatus;
    }
}
