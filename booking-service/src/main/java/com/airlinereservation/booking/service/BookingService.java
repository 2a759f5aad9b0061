package com.airlinereservation.booking.service;

import com.airlinereservation.booking.constants.BookingConstants;
import com.airlinereservation.booking.constants.ValidationMessages;
import com.airlinereservation.booking.dto.BookingEntry;
import com.airlinereservation.booking.dto.BookingRequest;
import com.airlinereservation.booking.dto.FlightBookingEntry;
import com.airlinereservation.booking.dto.FlightBookingRequest;
import com.airlinereservation.booking.dto.SeatBookingRequest;
import com.airlinereservation.booking.dto.TicketHandle;
import com.airlinereservation.booking.exception.BookingException;
import com.airlinereservation.booking.exception.BookingValidationException;
import com.airlinereservation.booking.exception.CompensationFailedException;
import com.airlinereservation.booking.exception.InvalidBookingRequestException;
import com.airlinereservation.booking.exception.TicketNotFoundException;
import com.airlinereservation.booking.mapper.BookingMapper;
import com.airlinereservation.booking.model.Ticket;
import com.airlinereservation.booking.repository.TicketRepository;
import com.airlinereservation.booking.service.retry.JitteredBackoff;
import com.airlinereservation.booking.service.saga.BookingSaga;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Books one or more flights for a customer in a single request.
 * <p>
 * Legs are processed in request order. A ticket is mandatory for every leg while the
 * preferred seat is best effort. If any leg cannot be ticketed, the legs already booked in
 * this request are undone through a {@link BookingSaga} and the request fails as a whole.
 */
@Service
@Slf4j
public class BookingService {

    private final TicketAllocationService ticketAllocationService;
    private final SeatAllocationService seatAllocationService;
    private final TicketRepository ticketRepository;
    private final BookingMapper bookingMapper;
    private final JitteredBackoff backoff;
    private final MeterRegistry meterRegistry;

    private final int compensationMaxAttempts;

    public BookingService(
            TicketAllocationService ticketAllocationService,
            SeatAllocationService seatAllocationService,
            TicketRepository ticketRepository,
            BookingMapper bookingMapper,
            JitteredBackoff backoff,
            MeterRegistry meterRegistry,
            @Value("${booking.compensation.max-attempts:" + BookingConstants.DEFAULT_COMPENSATION_MAX_ATTEMPTS + "}")
            int compensationMaxAttempts) {
        this.ticketAllocationService = ticketAllocationService;
        this.seatAllocationService = seatAllocationService;
        this.ticketRepository = ticketRepository;
        this.bookingMapper = bookingMapper;
        this.backoff = backoff;
        this.meterRegistry = meterRegistry;
        this.compensationMaxAttempts = compensationMaxAttempts;
    }

    public BookingEntry bookTickets(Long customerId, BookingRequest request) {
        validateBookingRequest(customerId, request);

        log.info("Booking tickets: customerId={}, legs={}", customerId, request.getFlights().size());

        BookingSaga saga = new BookingSaga();
        List<FlightBookingEntry> flightBookings = new ArrayList<>();
        boolean preferredSeatMissed = false;

        for (FlightBookingRequest leg : request.getFlights()) {
            TicketHandle handle;
            try {
                handle = ticketAllocationService.acquire(customerId, leg.getFlightNumber(), leg.getFlightDate());
            } catch (RuntimeException e) {
                throw rollback(saga, customerId, leg, e);
            }

            saga.register("release ticket " + handle.getTicketId()
                            + " (flight " + handle.getFlightNumber() + " on " + handle.getFlightDate() + ")",
                    () -> releaseIfPresent(handle.getTicketId()));

            Integer seatNumber = null;
            if (leg.getPreferredSeat() != null) {
                try {
                    seatNumber = assignPreferredSeat(customerId, handle, leg.getPreferredSeat());
                } catch (RuntimeException e) {
                    throw rollback(saga, customerId, leg, e);
                }
                preferredSeatMissed |= seatNumber == null;
            }

            flightBookings.add(bookingMapper.toEntry(handle, seatNumber));
        }

        String status = preferredSeatMissed
                ? BookingConstants.STATUS_CONFIRMED_SEAT_UNAVAILABLE
                : BookingConstants.STATUS_CONFIRMED;

        meterRegistry.counter("booking.requests.total", "result",
                preferredSeatMissed ? "confirmed_without_seat" : "confirmed").increment();
        log.info("Booking confirmed: customerId={}, tickets={}, preferredSeatMissed={}",
                customerId, flightBookings.size(), preferredSeatMissed);

        return BookingEntry.builder()
                .bookingStatus(status)
                .flightBookings(flightBookings)
                .build();
    }

    public boolean bookSeat(Long customerId, SeatBookingRequest request) {
        if (customerId == null) {
            throw new InvalidBookingRequestException(ValidationMessages.CUSTOMER_ID_REQUIRED);
        }
        if (request == null) {
            throw new InvalidBookingRequestException(ValidationMessages.BOOKING_REQUEST_REQUIRED);
        }

        log.info("Booking seat: customerId={}, flightNumber={}, date={}, seat={}",
                customerId, request.getFlightNumber(), request.getFlightDate(), request.getSeatNumber());
        return seatAllocationService.bookSeatForTicket(customerId, request);
    }

    /**
     * Cancels one of the customer's tickets, returning its quota and seat.
     */
    public void cancelTicket(Long customerId, Long ticketId) {
        if (ticketId == null) {
            throw new InvalidBookingRequestException(ValidationMessages.TICKET_ID_REQUIRED);
        }

        Ticket ticket = ticketRepository.findById(ticketId)
                .filter(t -> t.getCustomerId().equals(customerId))
                .orElseThrow(() -> new TicketNotFoundException(ticketId));

        ticketAllocationService.release(ticket.getId());
        log.info("Ticket cancelled: customerId={}, ticketId={}", customerId, ticketId);
    }

    // ============ Private Methods ============

    private Integer assignPreferredSeat(Long customerId, TicketHandle handle, Integer preferredSeat) {
        try {
            seatAllocationService.assign(customerId, handle.getFlightId(), preferredSeat, null);
            return preferredSeat;
        } catch (BookingException e) {
            log.info("Preferred seat not assigned, ticket kept: ticketId={}, seat={}, reason={}",
                    handle.getTicketId(), preferredSeat, e.getMessage());
            return null;
        }
    }

    private RuntimeException rollback(BookingSaga saga, Long customerId, FlightBookingRequest failedLeg,
                                      RuntimeException cause) {
        log.warn("Booking leg failed, compensating {} booked leg(s): customerId={}, flightNumber={}, date={}, error={}",
                saga.size(), customerId, failedLeg.getFlightNumber(), failedLeg.getFlightDate(), cause.getMessage());

        BookingSaga.CompensationResult result = saga.compensate(compensationMaxAttempts, backoff);

        if (!result.isComplete()) {
            meterRegistry.counter("booking.requests.total", "result", "compensation_failed").increment();
            return new CompensationFailedException(cause, result.failedActions(), result.failures());
        }

        meterRegistry.counter("booking.requests.total", "result", "rolled_back").increment();
        if (cause instanceof BookingException) {
            return BookingValidationException.bookingFailed(cause);
        }
        return cause;
    }

    private void releaseIfPresent(Long ticketId) {
        try {
            ticketAllocationService.release(ticketId);
        } catch (TicketNotFoundException e) {
            log.info("Ticket already released, nothing to compensate: ticketId={}", ticketId);
        }
    }

    private void validateBookingRequest(Long customerId, BookingRequest request) {
        if (customerId == null) {
            throw new InvalidBookingRequestException(ValidationMessages.CUSTOMER_ID_REQUIRED);
        }
        if (request == null) {
            throw new InvalidBookingRequestException(ValidationMessages.BOOKING_REQUEST_REQUIRED);
        }
        if (request.getFlights() == null || request.getFlights().isEmpty()) {
            throw new InvalidBookingRequestException(ValidationMessages.FLIGHTS_REQUIRED);
        }
        if (request.getFlights().size() > BookingConstants.MAX_FLIGHTS_PER_BOOKING) {
            throw new InvalidBookingRequestException(ValidationMessages.FLIGHTS_MAX);
        }
        for (FlightBookingRequest leg : request.getFlights()) {
            if (leg == null || leg.getFlightNumber() == null) {
                throw new InvalidBookingRequestException(ValidationMessages.FLIGHT_NUMBER_REQUIRED);
            }
            if (leg.getFlightDate() == null) {
                throw new InvalidBookingRequestException(ValidationMessages.FLIGHT_DATE_REQUIRED);
            }
        }
    }
}
