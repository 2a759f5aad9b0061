package com.airlinereservation.booking.exception;

import com.airlinereservation.booking.constants.ValidationMessages;

import java.time.LocalDate;

public class BookingValidationException extends BookingException {

    private static final String ERROR_CODE = "VALIDATION_ERROR";

    public BookingValidationException(String message) {
        super(ERROR_CODE, message);
    }

    public BookingValidationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }

    public static BookingValidationException fullyBooked(Integer flightNumber, LocalDate flightDate) {
        return new BookingValidationException(ValidationMessages.FLIGHT_FULLY_BOOKED
                + " (flight " + flightNumber + " on " + flightDate + ")");
    }

    public static BookingValidationException duplicateBooking() {
        return new BookingValidationException(ValidationMessages.DUPLICATE_BOOKING);
    }

    public static BookingValidationException duplicateBooking(Throwable cause) {
        return new BookingValidationException(ValidationMessages.DUPLICATE_BOOKING, cause);
    }

    public static BookingValidationException seatNotFound(Integer seatNumber) {
        return new BookingValidationException(ValidationMessages.SEAT_NOT_FOUND + ": " + seatNumber);
    }

    public static BookingValidationException retriesExhausted(Integer flightNumber, int attempts) {
        return new BookingValidationException("Ticket booking for flight " + flightNumber + " "
                + ValidationMessages.MAX_RETRIES_EXCEEDED + " (" + attempts + ")");
    }

    public static BookingValidationException bookingFailed(Throwable cause) {
        return new BookingValidationException(ValidationMessages.BOOKING_FAILED + ": " + cause.getMessage(), cause);
    }
}
