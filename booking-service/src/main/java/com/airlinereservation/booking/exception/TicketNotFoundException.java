package com.airlinereservation.booking.exception;

/**
 * Thrown when a ticket does not exist, including when it was already released.
 */
public class TicketNotFoundException extends BookingException {

    private static final String ERROR_CODE = "TICKET_NOT_FOUND";

    private final Long ticketId;

    public TicketNotFoundException(Long ticketId) {
        super(ERROR_CODE, "Ticket not found: " + ticketId);
        this.ticketId = ticketId;
    }

    public Long getTicketId() {
        return ticketId;
    }
}
