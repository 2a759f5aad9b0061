package com.airlinereservation.booking.dto;

import com.airlinereservation.booking.constants.ValidationMessages;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class SeatBookingRequest {

    @NotNull(message = ValidationMessages.FLIGHT_NUMBER_REQUIRED)
    Integer flightNumber;

    @NotNull(message = ValidationMessages.FLIGHT_DATE_REQUIRED)
    LocalDate flightDate;

    @NotNull(message = ValidationMessages.SEAT_NUMBER_REQUIRED)
    @Min(value = 1, message = ValidationMessages.SEAT_NUMBER_MIN)
    Integer seatNumber;
}
