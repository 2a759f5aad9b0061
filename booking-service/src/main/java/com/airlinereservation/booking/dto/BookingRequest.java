package com.airlinereservation.booking.dto;

import com.airlinereservation.booking.constants.BookingConstants;
import com.airlinereservation.booking.constants.ValidationMessages;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BookingRequest {

    @Valid
    @NotEmpty(message = ValidationMessages.FLIGHTS_REQUIRED)
    @Size(max = BookingConstants.MAX_FLIGHTS_PER_BOOKING, message = ValidationMessages.FLIGHTS_MAX)
    List<FlightBookingRequest> flights;
}
