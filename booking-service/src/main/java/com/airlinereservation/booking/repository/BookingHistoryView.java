package com.airlinereservation.booking.repository;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Row of the ticket/flight/route join backing a customer's booking history.
 */
public interface BookingHistoryView {

    Integer getFlightNumber();

    Integer getSeatNumber();

    String getDepartureCity();

    String getDestinationCity();

    LocalDate getFlightDate();

    LocalTime getDepartureTime();

    LocalTime getArrivalTime();
}
