package com.airlinereservation.booking.constants;

public final class BookingConstants {

    private BookingConstants() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Retry Budgets ==========

    public static final int DEFAULT_TICKET_MAX_ATTEMPTS = 10;
    public static final int DEFAULT_SEAT_MAX_ATTEMPTS = 3;
    public static final int DEFAULT_COMPENSATION_MAX_ATTEMPTS = 3;

    // ========== Backoff (milliseconds) ==========

    public static final long DEFAULT_BACKOFF_MIN_MILLIS = 1;
    public static final long DEFAULT_BACKOFF_MAX_MILLIS = 50;

    // ========== Schedule Generation ==========

    public static final int DEFAULT_SCHEDULE_HORIZON_DAYS = 30;
    public static final int INITIAL_FLIGHT_VERSION = 1;
    public static final int INITIAL_SEAT_VERSION = 0;
    public static final int FIRST_SEAT_NUMBER = 1;

    // ========== Request Limits ==========

    public static final int MIN_FLIGHTS_PER_BOOKING = 1;
    public static final int MAX_FLIGHTS_PER_BOOKING = 10;

    // ========== Schema ==========

    public static final String TICKET_CUSTOMER_FLIGHT_CONSTRAINT = "uk_ticket_customer_flight";
    public static final int OVERBOOKING_SCALE = 2;

    // ========== Booking Status ==========

    public static final String STATUS_CONFIRMED = "Confirmed";
    public static final String STATUS_CONFIRMED_SEAT_UNAVAILABLE =
            "Confirmed booking, however the preferred seat is currently unavailable, please try again later.";
    public static final String SEAT_NOT_SELECTED = "Not Selected";
}
