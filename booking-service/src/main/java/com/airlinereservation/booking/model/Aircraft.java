package com.airlinereservation.booking.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Entity
@Table(name = "aircraft")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class Aircraft {

    @Id
    @Column(name = "aircraft_id")
    Integer aircraftId;

    @Column(name = "capacity", nullable = false)
    Integer capacity;
}
