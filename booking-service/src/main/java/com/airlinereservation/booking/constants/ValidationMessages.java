package com.airlinereservation.booking.constants;

public final class ValidationMessages {

    private ValidationMessages() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Booking Request Messages ==========

    public static final String BOOKING_REQUEST_REQUIRED = "Booking request is required";
    public static final String CUSTOMER_ID_REQUIRED = "Customer ID is required";
    public static final String FLIGHTS_REQUIRED = "At least one flight is required";
    public static final String FLIGHTS_MAX = "Maximum 10 flights per booking";
    public static final String FLIGHT_NUMBER_REQUIRED = "Flight number is required";
    public static final String FLIGHT_DATE_REQUIRED = "Flight date is required";
    public static final String SEAT_NUMBER_REQUIRED = "Seat number is required";
    public static final String SEAT_NUMBER_MIN = "Seat number must be at least 1";
    public static final String TICKET_ID_REQUIRED = "Ticket ID is required";

    // ========== Booking Rejections ==========

    public static final String FLIGHT_FULLY_BOOKED = "This flight is fully booked.";
    public static final String DUPLICATE_BOOKING = "Cannot re-book the same flight";
    public static final String SAME_SEAT = "Cannot book the same seat you already have";
    public static final String NO_TICKET_FOR_FLIGHT = "Customer does not have a ticket for this flight";
    public static final String SEAT_NOT_FOUND = "The requested seat is not found";
    public static final String SEAT_UNAVAILABLE = "The requested seat is already booked or unavailable";
    public static final String MAX_RETRIES_EXCEEDED = "failed after maximum retries";
    public static final String BOOKING_FAILED = "Failed to book some of your flights, please try again";

    // ========== Flight Query / Schedule Messages ==========

    public static final String CITY_REQUIRED = "Departure and destination cities are required";
    public static final String DEPARTURE_DATE_REQUIRED = "Departure date is required";
    public static final String END_DATE_BEFORE_START = "End date cannot be before start date";
    public static final String DEPARTURE_TIME_REQUIRED = "Departure time is required";
    public static final String ARRIVAL_TIME_REQUIRED = "Arrival time is required";
    public static final String AIRCRAFT_ID_REQUIRED = "Aircraft ID is required";
    public static final String START_DATE_REQUIRED = "Start date is required";
    public static final String OVERBOOKING_NON_NEGATIVE = "Overbooking must be non-negative";
    public static final String SOURCE_DESTINATION_SAME = "Departure and destination cannot be the same";
}
