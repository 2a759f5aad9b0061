package com.airlinereservation.booking.model;

import com.airlinereservation.booking.constants.BookingConstants;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;

/**
 * A booking record. The (customer, flight) unique constraint is the authoritative guard
 * against double booking; the service-level lookup is only a fast path.
 */
@Entity
@Table(name = "ticket",
        uniqueConstraints = @UniqueConstraint(name = BookingConstants.TICKET_CUSTOMER_FLIGHT_CONSTRAINT, columnNames = {"customer_id", "flight_id"}),
        indexes = @Index(name = "idx_ticket_customer", columnList = "customer_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class Ticket {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    Long id;

    @Column(name = "customer_id", nullable = false)
    Long customerId;

    @Column(name = "flight_id", nullable = false)
    Long flightId;

    @Column(name = "seat_number")
    Integer seatNumber;

    @Column(name = "flight_date", nullable = false)
    LocalDate flightDate;

    @Column(name = "flight_number", nullable = false)
    Integer flightNumber;
}
