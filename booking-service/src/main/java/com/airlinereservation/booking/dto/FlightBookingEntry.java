package com.airlinereservation.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightBookingEntry {

    Long ticketId;
    String flightDetails;
    Integer seatNumber;
}
