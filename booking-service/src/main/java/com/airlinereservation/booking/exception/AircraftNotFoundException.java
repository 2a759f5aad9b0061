package com.airlinereservation.booking.exception;

public class AircraftNotFoundException extends BookingException {

    private static final String ERROR_CODE = "AIRCRAFT_NOT_FOUND";

    public AircraftNotFoundException(Integer aircraftId) {
        super(ERROR_CODE, "Aircraft not found: " + aircraftId);
    }
}
