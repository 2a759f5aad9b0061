package com.airlinereservation.booking.service;

import com.airlinereservation.booking.constants.BookingConstants;
import com.airlinereservation.booking.dto.BookingHistoryResponse;
import com.airlinereservation.booking.exception.InvalidBookingRequestException;
import com.airlinereservation.booking.mapper.BookingMapper;
import com.airlinereservation.booking.repository.BookingHistoryView;
import com.airlinereservation.booking.repository.TicketRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("BookingHistoryService Unit Tests")
class BookingHistoryServiceTest {

    @Mock
    private TicketRepository ticketRepository;

    private BookingHistoryService bookingHistoryService;

    @BeforeEach
    void setUp() {
        bookingHistoryService = new BookingHistoryService(ticketRepository, new BookingMapper());
    }

    private BookingHistoryView view(int flightNumber, Integer seatNumber, LocalDate date) {
        BookingHistoryView view = mock(BookingHistoryView.class);
        when(view.getFlightNumber()).thenReturn(flightNumber);
        when(view.getSeatNumber()).thenReturn(seatNumber);
        when(view.getDepartureCity()).thenReturn("Oslo");
        when(view.getDestinationCity()).thenReturn("Rome");
        when(view.getFlightDate()).thenReturn(date);
        when(view.getDepartureTime()).thenReturn(LocalTime.of(7, 30));
        when(view.getArrivalTime()).thenReturn(LocalTime.of(11, 0));
        return view;
    }

    @Test
    @DisplayName("Should list tickets and mark missing seats as not selected")
    void getHistory_MixedSeats_MapsEveryTicket() {
        BookingHistoryView first = view(2, null, LocalDate.of(2024, 5, 2));
        BookingHistoryView second = view(1, 14, LocalDate.of(2024, 5, 1));
        when(ticketRepository.findHistoryByCustomerId(3L)).thenReturn(List.of(first, second));

        BookingHistoryResponse response = bookingHistoryService.getHistory(3L);

        assertThat(response.getFlights()).hasSize(2);
        assertThat(response.getFlights().get(0).getSeatNumber()).isEqualTo(BookingConstants.SEAT_NOT_SELECTED);
        assertThat(response.getFlights().get(1).getSeatNumber()).isEqualTo("14");
        assertThat(response.getFlights().get(1).getDepartureCity()).isEqualTo("Oslo");
    }

    @Test
    @DisplayName("Should return an empty history for a customer without tickets")
    void getHistory_NoTickets_Empty() {
        when(ticketRepository.findHistoryByCustomerId(3L)).thenReturn(List.of());

        assertThat(bookingHistoryService.getHistory(3L).getFlights()).isEmpty();
    }

    @Test
    @DisplayName("Should require a customer")
    void getHistory_NullCustomer_ThrowsBadRequest() {
        assertThatThrownBy(() -> bookingHistoryService.getHistory(null))
                .isInstanceOf(InvalidBookingRequestException.class);
    }
}
