package com.airlinereservation.booking.model;

import com.airlinereservation.booking.enums.SeatStatus;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Entity
@Table(name = "seat_info")
@IdClass(SeatId.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class Seat {

    @Id
    @Column(name = "flight_id")
    Long flightId;

    @Id
    @Column(name = "seat_number")
    Integer seatNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "seat_status", nullable = false, columnDefinition = "VARCHAR(20)")
    @Builder.Default
    SeatStatus status = SeatStatus.AVAILABLE;

    @Column(name = "version", nullable = false)
    @Builder.Default
    Integer version = 0;
}
