package com.airlinereservation.booking.model;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;

@Entity
@Table(name = "flight_route", indexes = {
        @Index(name = "idx_route_cities", columnList = "departure_city, destination_city")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightRoute {

    @Id
    @Column(name = "flight_number")
    Integer flightNumber;

    @Column(name = "departure_city", nullable = false)
    String departureCity;

    @Column(name = "destination_city", nullable = false)
    String destinationCity;

    @Column(name = "departure_time", nullable = false)
    LocalTime departureTime;

    @Column(name = "arrival_time", nullable = false)
    LocalTime arrivalTime;

    @Column(name = "aircraft_id", nullable = false)
    Integer aircraftId;

    @Column(name = "overbooking", nullable = false, precision = 4, scale = 2)
    @Builder.Default
    BigDecimal overbooking = BigDecimal.ZERO;

    @Column(name = "start_date", nullable = false)
    LocalDate startDate;

    @Column(name = "end_date")
    LocalDate endDate;
}
