package com.airlinereservation.booking.dto;

import com.airlinereservation.booking.constants.ValidationMessages;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;

/**
 * One leg of a booking request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightBookingRequest {

    @NotNull(message = ValidationMessages.FLIGHT_NUMBER_REQUIRED)
    Integer flightNumber;

    @NotNull(message = ValidationMessages.FLIGHT_DATE_REQUIRED)
    LocalDate flightDate;

    @Min(value = 1, message = ValidationMessages.SEAT_NUMBER_MIN)
    Integer preferredSeat;
}
