package com.airlinereservation.booking.enums;

public enum SeatStatus {
    AVAILABLE,
    BOOKED,
    UNAVAILABLE
}
