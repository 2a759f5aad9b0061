package com.airlinereservation.booking.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Result of a successful ticket acquisition; also the key used to undo it.
 */
@Value
@Builder
public class TicketHandle {
    Long ticketId;
    Long customerId;
    Long flightId;
    Integer flightNumber;
    LocalDate flightDate;
}
