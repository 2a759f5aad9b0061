package com.airlinereservation.booking.mapper;

import com.airlinereservation.booking.constants.BookingConstants;
import com.airlinereservation.booking.dto.BookingHistoryEntry;
import com.airlinereservation.booking.dto.FlightBookingEntry;
import com.airlinereservation.booking.dto.TicketHandle;
import com.airlinereservation.booking.repository.BookingHistoryView;
import org.springframework.stereotype.Component;

@Component
public class BookingMapper {

    public FlightBookingEntry toEntry(TicketHandle handle, Integer seatNumber) {
        if (handle == null) {
            return null;
        }

        return FlightBookingEntry.builder()
                .ticketId(handle.getTicketId())
                .flightDetails("Flight " + handle.getFlightNumber() + " on " + handle.getFlightDate())
                .seatNumber(seatNumber)
                .build();
    }

    public BookingHistoryEntry toHistoryEntry(BookingHistoryView view) {
        if (view == null) {
            return null;
        }

        return BookingHistoryEntry.builder()
                .flightNumber(view.getFlightNumber())
                .seatNumber(view.getSeatNumber() != null
                        ? String.valueOf(view.getSeatNumber())
                        : BookingConstants.SEAT_NOT_SELECTED)
                .departureCity(view.getDepartureCity())
                .destinationCity(view.getDestinationCity())
                .flightDate(view.getFlightDate())
                .departureTime(view.getDepartureTime())
                .arrivalTime(view.getArrivalTime())
                .build();
    }
}
