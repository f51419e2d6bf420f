package in.dcabot.domain.order;

/**
 * Normalized order status.
 *
 * Which of these count as terminal is decided by the execution config,
 * not by this enum.
 */
public enum OrderStatus {
    PENDING,        // Accepted, not yet on the book
    QUEUED,         // Queued by the venue
    OPEN,           // Resting on the book
    CANCEL_QUEUED,  // Cancel requested, not yet settled
    FILLED,         // Completely filled
    CANCELLED,      // Cancelled by user or system
    EXPIRED,        // GTD end time reached
    REJECTED,       // Rejected by venue
    FAILED,         // Venue-side failure
    UNKNOWN;        // Anything the venue reports that we do not recognise

    /**
     * Map a venue status string onto the normalized set.
     * Unrecognised or missing values become UNKNOWN (treated as pending).
     */
    public static OrderStatus fromVenue(String status) {
        if (status == null || status.isBlank()) {
            return UNKNOWN;
        }
        return switch (status.trim().toUpperCase()) {
            case "PENDING" -> PENDING;
            case "QUEUED" -> QUEUED;
            case "OPEN" -> OPEN;
            case "CANCEL_QUEUED" -> CANCEL_QUEUED;
            case "FILLED" -> FILLED;
            case "CANCELLED", "CANCELED" -> CANCELLED;
            case "EXPIRED" -> EXPIRED;
            case "REJECTED" -> REJECTED;
            case "FAILED" -> FAILED;
            default -> UNKNOWN;
        };
    }
}
