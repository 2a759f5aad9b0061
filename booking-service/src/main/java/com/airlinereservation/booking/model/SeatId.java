package com.airlinereservation.booking.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeatId implements Serializable {

    private Long flightId;
    private Integer seatNumber;
}
