package com.airlinereservation.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;
import java.time.LocalTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BookingHistoryEntry {

    Integer flightNumber;
    String seatNumber;
    String departureCity;
    String destinationCity;
    LocalDate flightDate;
    LocalTime departureTime;
    LocalTime arrivalTime;
}
