package com.airlinereservation.booking.exception;

import java.time.LocalDate;

/**
 * Thrown when no flight exists for a flight number and date.
 */
public class FlightNotFoundException extends BookingException {

    private static final String ERROR_CODE = "FLIGHT_NOT_FOUND";

    public FlightNotFoundException(Integer flightNumber, LocalDate flightDate) {
        super(ERROR_CODE, "Flight " + flightNumber + " does not exist on " + flightDate);
    }

    public FlightNotFoundException(String message) {
        super(ERROR_CODE, message);
    }
}
