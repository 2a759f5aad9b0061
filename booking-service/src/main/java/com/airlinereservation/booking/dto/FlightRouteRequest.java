package com.airlinereservation.booking.dto;

import com.airlinereservation.booking.constants.ValidationMessages;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightRouteRequest {

    @NotNull(message = ValidationMessages.FLIGHT_NUMBER_REQUIRED)
    Integer flightNumber;

    @NotBlank(message = ValidationMessages.CITY_REQUIRED)
    String departureCity;

    @NotBlank(message = ValidationMessages.CITY_REQUIRED)
    String destinationCity;

    @NotNull(message = ValidationMessages.DEPARTURE_TIME_REQUIRED)
    LocalTime departureTime;

    @NotNull(message = ValidationMessages.ARRIVAL_TIME_REQUIRED)
    LocalTime arrivalTime;

    @NotNull(message = ValidationMessages.AIRCRAFT_ID_REQUIRED)
    Integer aircraftId;

    @DecimalMin(value = "0.00", message = ValidationMessages.OVERBOOKING_NON_NEGATIVE)
    @Builder.Default
    BigDecimal overbooking = BigDecimal.ZERO;

    @NotNull(message = ValidationMessages.START_DATE_REQUIRED)
    LocalDate startDate;

    LocalDate endDate;
}
