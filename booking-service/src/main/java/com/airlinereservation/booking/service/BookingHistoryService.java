package com.airlinereservation.booking.service;

import com.airlinereservation.booking.constants.ValidationMessages;
import com.airlinereservation.booking.dto.BookingHistoryEntry;
import com.airlinereservation.booking.dto.BookingHistoryResponse;
import com.airlinereservation.booking.exception.InvalidBookingRequestException;
import com.airlinereservation.booking.mapper.BookingMapper;
import com.airlinereservation.booking.repository.TicketRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class BookingHistoryService {

    private final TicketRepository ticketRepository;
    private final BookingMapper bookingMapper;

    /**
     * Lists every ticket the customer holds, most recent flight date first.
     */
    @Transactional(readOnly = true)
    public BookingHistoryResponse getHistory(Long customerId) {
        if (customerId == null) {
            throw new InvalidBookingRequestException(ValidationMessages.CUSTOMER_ID_REQUIRED);
        }

        List<BookingHistoryEntry> flights = ticketRepository.findHistoryByCustomerId(customerId).stream()
                .map(bookingMapper::toHistoryEntry)
                .toList();

        log.debug("Booking history loaded: customerId={}, tickets={}", customerId, flights.size());
        return BookingHistoryResponse.builder()
                .flights(flights)
                .build();
    }
}
