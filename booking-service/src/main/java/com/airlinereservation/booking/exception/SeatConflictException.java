package com.airlinereservation.booking.exception;

import com.airlinereservation.booking.constants.ValidationMessages;

/**
 * The seat is taken. Transient version mismatches never surface as this exception;
 * only a business rejection or an exhausted retry budget does.
 */
public class SeatConflictException extends BookingException {

    private static final String ERROR_CODE = "SEAT_CONFLICT";

    public SeatConflictException(String message) {
        super(ERROR_CODE, message);
    }

    public SeatConflictException(String message, boolean retryable) {
        super(ERROR_CODE, message, retryable);
    }

    public static SeatConflictException seatUnavailable(Integer seatNumber) {
        return new SeatConflictException(ValidationMessages.SEAT_UNAVAILABLE + ": " + seatNumber);
    }

    public static SeatConflictException retriesExhausted(Integer seatNumber, int attempts) {
        return new SeatConflictException("Seat " + seatNumber + " booking "
                + ValidationMessages.MAX_RETRIES_EXCEEDED + " (" + attempts + ")", true);
    }
}
