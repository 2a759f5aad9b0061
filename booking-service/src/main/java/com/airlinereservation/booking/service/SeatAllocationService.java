package com.airlinereservation.booking.service;

import com.airlinereservation.booking.constants.BookingConstants;
import com.airlinereservation.booking.constants.ValidationMessages;
import com.airlinereservation.booking.dto.SeatBookingRequest;
import com.airlinereservation.booking.enums.SeatStatus;
import com.airlinereservation.booking.exception.BookingValidationException;
import com.airlinereservation.booking.exception.FlightNotFoundException;
import com.airlinereservation.booking.exception.InvalidBookingRequestException;
import com.airlinereservation.booking.exception.SeatConflictException;
import com.airlinereservation.booking.model.Flight;
import com.airlinereservation.booking.model.Seat;
import com.airlinereservation.booking.model.Ticket;
import com.airlinereservation.booking.repository.FlightRepository;
import com.airlinereservation.booking.repository.SeatRepository;
import com.airlinereservation.booking.repository.TicketRepository;
import com.airlinereservation.booking.service.retry.JitteredBackoff;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Objects;

/**
 * Seat assignment under optimistic concurrency.
 * <p>
 * Each attempt reads the target seat's status and version and then issues an update gated on
 * both. A lost race rolls the attempt back and retries after a jittered pause, up to a fixed
 * budget. A seat that is not AVAILABLE is a business rejection and is never retried.
 */
@Service
@Slf4j
public class SeatAllocationService {

    private final SeatRepository seatRepository;
    private final TicketRepository ticketRepository;
    private final FlightRepository flightRepository;
    private final TransactionTemplate transactionTemplate;
    private final JitteredBackoff backoff;
    private final MeterRegistry meterRegistry;

    private final int maxAttempts;

    public SeatAllocationService(
            SeatRepository seatRepository,
            TicketRepository ticketRepository,
            FlightRepository flightRepository,
            TransactionTemplate transactionTemplate,
            JitteredBackoff backoff,
            MeterRegistry meterRegistry,
            @Value("${booking.seat.max-attempts:" + BookingConstants.DEFAULT_SEAT_MAX_ATTEMPTS + "}") int maxAttempts) {
        this.seatRepository = seatRepository;
        this.ticketRepository = ticketRepository;
        this.flightRepository = flightRepository;
        this.transactionTemplate = transactionTemplate;
        this.backoff = backoff;
        this.meterRegistry = meterRegistry;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Moves the customer's seat on a flight to {@code newSeat}, freeing {@code oldSeat} if given.
     *
     * @throws InvalidBookingRequestException if {@code newSeat} equals {@code oldSeat} or the customer
     *                                        holds no ticket on the flight
     * @throws BookingValidationException     if {@code newSeat} does not exist on the flight
     * @throws SeatConflictException          if the seat is taken or the retry budget runs out
     */
    public boolean assign(Long customerId, Long flightId, Integer newSeat, Integer oldSeat) {
        if (Objects.equals(newSeat, oldSeat)) {
            throw new InvalidBookingRequestException(ValidationMessages.SAME_SEAT);
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                if (tryAssignOnce(customerId, flightId, newSeat, oldSeat, attempt)) {
                    meterRegistry.counter("booking.seat.assign.total", "result", "success").increment();
                    log.info("Seat assigned: customerId={}, flightId={}, seat={}, previousSeat={}, attempt={}",
                            customerId, flightId, newSeat, oldSeat, attempt);
                    return true;
                }

                meterRegistry.counter("booking.seat.assign.retries").increment();
                if (attempt < maxAttempts && !backoff.pause(attempt)) {
                    break;
                }
            }

            meterRegistry.counter("booking.seat.assign.total", "result", "exhausted").increment();
            log.warn("Seat assignment gave up: customerId={}, flightId={}, seat={}, maxAttempts={}",
                    customerId, flightId, newSeat, maxAttempts);
            throw SeatConflictException.retriesExhausted(newSeat, maxAttempts);
        } finally {
            sample.stop(Timer.builder("booking.seat.assign.duration").register(meterRegistry));
        }
    }

    /**
     * Resolves the customer's ticket on the requested flight and reassigns its seat.
     */
    public boolean bookSeatForTicket(Long customerId, SeatBookingRequest request) {
        Flight flight = flightRepository.findByFlightNumberAndFlightDate(request.getFlightNumber(), request.getFlightDate())
                .orElseThrow(() -> new FlightNotFoundException(request.getFlightNumber(), request.getFlightDate()));

        Ticket ticket = ticketRepository.findByCustomerIdAndFlightId(customerId, flight.getId())
                .orElseThrow(() -> new InvalidBookingRequestException(ValidationMessages.NO_TICKET_FOR_FLIGHT));

        if (Objects.equals(ticket.getSeatNumber(), request.getSeatNumber())) {
            throw new InvalidBookingRequestException(ValidationMessages.SAME_SEAT);
        }

        return assign(customerId, flight.getId(), request.getSeatNumber(), ticket.getSeatNumber());
    }

    /**
     * Returns a seat to AVAILABLE. Joins the caller's transaction.
     */
    @Transactional
    public void releaseSeat(Long flightId, Integer seatNumber) {
        int updated = seatRepository.releaseSeat(flightId, seatNumber);
        if (updated == 0) {
            log.warn("Seat to release not found: flightId={}, seat={}", flightId, seatNumber);
            return;
        }
        log.debug("Seat released: flightId={}, seat={}", flightId, seatNumber);
    }

    private boolean tryAssignOnce(Long customerId, Long flightId, Integer newSeat, Integer oldSeat, int attempt) {
        try {
            Boolean assigned = transactionTemplate.execute(status ->
                    doAssign(status, customerId, flightId, newSeat, oldSeat));
            if (Boolean.TRUE.equals(assigned)) {
                return true;
            }
            log.debug("Seat version conflict: flightId={}, seat={}, attempt={}", flightId, newSeat, attempt);
        } catch (ConcurrencyFailureException e) {
            log.debug("Seat update hit a store concurrency failure: flightId={}, seat={}, attempt={}, error={}",
                    flightId, newSeat, attempt, e.getMessage());
        }
        return false;
    }

    private Boolean doAssign(TransactionStatus status, Long customerId, Long flightId, Integer newSeat, Integer oldSeat) {
        Seat seat = seatRepository.findByFlightIdAndSeatNumber(flightId, newSeat)
                .orElseThrow(() -> BookingValidationException.seatNotFound(newSeat));

        if (seat.getStatus() != SeatStatus.AVAILABLE) {
            meterRegistry.counter("booking.seat.assign.total", "result", "unavailable").increment();
            throw SeatConflictException.seatUnavailable(newSeat);
        }

        int claimed = seatRepository.claimSeat(flightId, newSeat, seat.getVersion());
        if (claimed == 0) {
            status.setRollbackOnly();
            return Boolean.FALSE;
        }

        if (oldSeat != null) {
            seatRepository.releaseSeat(flightId, oldSeat);
        }
        // The seat must never commit as BOOKED without a ticket pointing at it
        if (ticketRepository.updateSeatNumber(customerId, flightId, newSeat) == 0) {
            status.setRollbackOnly();
            throw new InvalidBookingRequestException(ValidationMessages.NO_TICKET_FOR_FLIGHT);
        }
        return Boolean.TRUE;
    }
}
