package com.airlinereservation.booking.exception;

import lombok.Getter;


@Getter
public class BookingException extends RuntimeException {

    private final String errorCode;
    private final boolean retryable;

    public BookingException(String errorCode, String message) {
        this(errorCode, message, false, null);
    }

    public BookingException(String errorCode, String message, boolean retryable) {
        this(errorCode, message, retryable, null);
    }

    public BookingException(String errorCode, String message, Throwable cause) {
        this(errorCode, message, false, cause);
    }

    public BookingException(String errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }
}
