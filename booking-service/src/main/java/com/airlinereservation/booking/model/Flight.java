package com.airlinereservation.booking.model;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;

/**
 * A dated instance of a {@link FlightRoute}.
 * <p>
 * {@code availableTickets} is only ever changed through the version-gated updates in
 * {@link com.airlinereservation.booking.repository.FlightRepository}.
 */
@Entity
@Table(name = "flight",
        uniqueConstraints = @UniqueConstraint(name = "uk_flight_number_date", columnNames = {"flight_number", "flight_date"}),
        indexes = @Index(name = "idx_flight_date", columnList = "flight_date"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class Flight {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "flight_id")
    Long id;

    @Column(name = "flight_number", nullable = false)
    Integer flightNumber;

    @Column(name = "flight_date", nullable = false)
    LocalDate flightDate;

    @Column(name = "available_tickets", nullable = false)
    Integer availableTickets;

    @Column(name = "version", nullable = false)
    @Builder.Default
    Integer version = 1;
}
