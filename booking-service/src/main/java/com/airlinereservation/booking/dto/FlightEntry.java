package com.airlinereservation.booking.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Search result row. Field order matches the constructor expression in
 * {@code FlightRepository#searchAvailableFlights}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlightEntry {

    Long flightId;
    Integer flightNumber;
    String departureCity;
    String destinationCity;
    LocalTime departureTime;
    LocalTime arrivalTime;
    Integer availableTickets;
    LocalDate flightDate;
}
