package com.airlinereservation.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightScheduleEntry {

    Integer flightNumber;
    LocalDate startDate;
    LocalDate endDate;
    Integer flightsCreated;
    Integer seatsPerFlight;
    Integer availableTicketsPerFlight;
}
