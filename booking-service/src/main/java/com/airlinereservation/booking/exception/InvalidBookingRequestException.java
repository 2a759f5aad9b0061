package com.airlinereservation.booking.exception;


public class InvalidBookingRequestException extends BookingException {

    private static final String ERROR_CODE = "BAD_REQUEST";

    public InvalidBookingRequestException(String message) {
        super(ERROR_CODE, message);
    }
}
