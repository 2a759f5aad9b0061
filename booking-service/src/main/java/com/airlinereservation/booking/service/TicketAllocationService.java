package com.airlinereservation.booking.service;

import com.airlinereservation.booking.constants.BookingConstants;
import com.airlinereservation.booking.dto.TicketHandle;
import com.airlinereservation.booking.exception.BookingValidationException;
import com.airlinereservation.booking.exception.FlightNotFoundException;
import com.airlinereservation.booking.exception.TicketNotFoundException;
import com.airlinereservation.booking.model.Flight;
import com.airlinereservation.booking.model.Ticket;
import com.airlinereservation.booking.repository.FlightRepository;
import com.airlinereservation.booking.repository.TicketRepository;
import com.airlinereservation.booking.service.retry.JitteredBackoff;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;

/**
 * Ticket quota allocation under optimistic concurrency.
 * <p>
 * Claim protocol, one short transaction per attempt:
 * <ol>
 *   <li>read the flight's {@code available_tickets} and {@code version}</li>
 *   <li>fail if the quota is exhausted</li>
 *   <li>decrement gated on the version read in step 1</li>
 *   <li>on a lost race roll back, pause with jitter and start over</li>
 *   <li>on success insert the ticket in the same transaction</li>
 * </ol>
 * Retries are bounded by {@code booking.ticket.max-attempts}. A caller can only lose a race to
 * another successful claim, so a budget larger than the flight's quota never turns away a
 * caller while tickets remain.
 */
@Service
@Slf4j
public class TicketAllocationService {

    private final FlightRepository flightRepository;
    private final TicketRepository ticketRepository;
    private final SeatAllocationService seatAllocationService;
    private final TransactionTemplate transactionTemplate;
    private final JitteredBackoff backoff;
    private final MeterRegistry meterRegistry;

    private final int maxAttempts;

    public TicketAllocationService(
            FlightRepository flightRepository,
            TicketRepository ticketRepository,
            SeatAllocationService seatAllocationService,
            TransactionTemplate transactionTemplate,
            JitteredBackoff backoff,
            MeterRegistry meterRegistry,
            @Value("${booking.ticket.max-attempts:" + BookingConstants.DEFAULT_TICKET_MAX_ATTEMPTS + "}") int maxAttempts) {
        this.flightRepository = flightRepository;
        this.ticketRepository = ticketRepository;
        this.seatAllocationService = seatAllocationService;
        this.transactionTemplate = transactionTemplate;
        this.backoff = backoff;
        this.meterRegistry = meterRegistry;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Claims one ticket on the flight for the customer.
     *
     * @throws FlightNotFoundException    if the flight does not exist
     * @throws BookingValidationException if the customer already holds a ticket, the flight is
     *                                    fully booked or the retry budget runs out
     */
    public TicketHandle acquire(Long customerId, Integer flightNumber, LocalDate flightDate) {
        Timer.Sample sample = Timer.start(meterRegistry);
        log.info("Acquiring ticket: customerId={}, flightNumber={}, date={}", customerId, flightNumber, flightDate);

        try {
            Flight flight = flightRepository.findByFlightNumberAndFlightDate(flightNumber, flightDate)
                    .orElseThrow(() -> new FlightNotFoundException(flightNumber, flightDate));

            // Fast path only; uk_ticket_customer_flight is what actually prevents the double booking
            if (ticketRepository.existsByCustomerIdAndFlightId(customerId, flight.getId())) {
                meterRegistry.counter("booking.ticket.acquire.total", "result", "duplicate").increment();
                throw BookingValidationException.duplicateBooking();
            }

            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                Optional<TicketHandle> handle = tryAcquireOnce(customerId, flight.getId(), flightNumber, flightDate, attempt);
                if (handle.isPresent()) {
                    meterRegistry.counter("booking.ticket.acquire.total", "result", "success").increment();
                    log.info("Ticket acquired: ticketId={}, customerId={}, flightId={}, attempt={}",
                            handle.get().getTicketId(), customerId, flight.getId(), attempt);
                    return handle.get();
                }

                meterRegistry.counter("booking.ticket.acquire.retries").increment();
                if (attempt < maxAttempts && !backoff.pause(attempt)) {
                    break;
                }
            }

            meterRegistry.counter("booking.ticket.acquire.total", "result", "exhausted").increment();
            log.warn("Ticket acquisition gave up: customerId={}, flightId={}, maxAttempts={}",
                    customerId, flight.getId(), maxAttempts);
            throw BookingValidationException.retriesExhausted(flightNumber, maxAttempts);
        } finally {
            sample.stop(Timer.builder("booking.ticket.acquire.duration").register(meterRegistry));
        }
    }

    /**
     * Returns a ticket's quota unit to its flight, frees its seat and deletes it.
     * <p>
     * The ticket row is locked for the rest of the transaction, so the seat freed is the seat the
     * ticket holds at delete time. The delete is count-checked, so of two releases of the same
     * ticket only one restores quota; the other fails with {@link TicketNotFoundException}.
     */
    @Transactional
    public void release(Long ticketId) {
        Ticket ticket = ticketRepository.findByIdForUpdate(ticketId)
                .orElseThrow(() -> new TicketNotFoundException(ticketId));

        if (ticketRepository.deleteTicketById(ticketId) == 0) {
            throw new TicketNotFoundException(ticketId);
        }

        flightRepository.incrementAvailableTickets(ticket.getFlightId());

        if (ticket.getSeatNumber() != null) {
            seatAllocationService.releaseSeat(ticket.getFlightId(), ticket.getSeatNumber());
        }

        meterRegistry.counter("booking.ticket.release.total").increment();
        log.info("Ticket released: ticketId={}, flightId={}, seat={}",
                ticketId, ticket.getFlightId(), ticket.getSeatNumber());
    }

    private Optional<TicketHandle> tryAcquireOnce(Long customerId, Long flightId, Integer flightNumber,
                                                  LocalDate flightDate, int attempt) {
        try {
            TicketHandle handle = transactionTemplate.execute(status ->
                    doAcquire(status, customerId, flightId, flightNumber, flightDate));
            if (handle == null) {
                log.debug("Flight version conflict: flightId={}, attempt={}", flightId, attempt);
            }
            return Optional.ofNullable(handle);
        } catch (DataIntegrityViolationException e) {
            if (!violates(e, BookingConstants.TICKET_CUSTOMER_FLIGHT_CONSTRAINT)) {
                throw e;
            }
            meterRegistry.counter("booking.ticket.acquire.total", "result", "duplicate").increment();
            log.warn("Concurrent duplicate booking rejected by store: customerId={}, flightId={}", customerId, flightId);
            throw BookingValidationException.duplicateBooking(e);
        } catch (ConcurrencyFailureException e) {
            log.debug("Flight update hit a store concurrency failure: flightId={}, attempt={}, error={}",
                    flightId, attempt, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean violates(DataIntegrityViolationException e, String constraintName) {
        String needle = constraintName.toLowerCase(Locale.ROOT);
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t.getMessage() != null && t.getMessage().toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private TicketHandle doAcquire(TransactionStatus status, Long customerId, Long flightId,
                                   Integer flightNumber, LocalDate flightDate) {
        Flight current = flightRepository.findById(flightId)
                .orElseThrow(() -> new FlightNotFoundException(flightNumber, flightDate));

        if (current.getAvailableTickets() <= 0) {
            meterRegistry.counter("booking.ticket.acquire.total", "result", "sold_out").increment();
            throw BookingValidationException.fullyBooked(flightNumber, flightDate);
        }

        if (flightRepository.decrementAvailableTickets(flightId, current.getVersion()) == 0) {
            status.setRollbackOnly();
            return null;
        }

        Ticket ticket = ticketRepository.saveAndFlush(Ticket.builder()
                .customerId(customerId)
                .flightId(flightId)
                .flightNumber(current.getFlightNumber())
                .flightDate(current.getFlightDate())
                .build());

        return TicketHandle.builder()
                .ticketId(ticket.getId())
                .customerId(customerId)
                .flightId(flightId)
                .flightNumber(current.getFlightNumber())
                .flightDate(current.getFlightDate())
                .build();
    }
}
