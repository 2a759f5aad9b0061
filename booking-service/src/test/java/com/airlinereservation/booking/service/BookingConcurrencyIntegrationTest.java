package com.airlinereservation.booking.service;

import com.airlinereservation.booking.constants.ValidationMessages;
import com.airlinereservation.booking.dto.BookingEntry;
import com.airlinereservation.booking.dto.BookingRequest;
import com.airlinereservation.booking.dto.FlightBookingRequest;
import com.airlinereservation.booking.dto.FlightRouteRequest;
import com.airlinereservation.booking.dto.SeatBookingRequest;
import com.airlinereservation.booking.enums.SeatStatus;
import com.airlinereservation.booking.exception.BookingException;
import com.airlinereservation.booking.exception.BookingValidationException;
import com.airlinereservation.booking.exception.InvalidBookingRequestException;
import com.airlinereservation.booking.exception.SeatConflictException;
import com.airlinereservation.booking.exception.TicketNotFoundException;
import com.airlinereservation.booking.model.Aircraft;
import com.airlinereservation.booking.model.Flight;
import com.airlinereservation.booking.model.SeatId;
import com.airlinereservation.booking.repository.AircraftRepository;
import com.airlinereservation.booking.repository.FlightRepository;
import com.airlinereservation.booking.repository.FlightRouteRepository;
import com.airlinereservation.booking.repository.SeatRepository;
import com.airlinereservation.booking.repository.TicketRepository;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongConsumer;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs concurrent callers against the real store (in-memory H2) to check that the
 * optimistic allocators never oversell tickets or double-assign seats.
 */
@Slf4j
@SpringBootTest
class BookingConcurrencyIntegrationTest {

    private static final LocalDate DATE = LocalDate.of(2030, 1, 15);

    @Autowired
    private BookingService bookingService;

    @Autowired
    private TicketAllocationService ticketAllocationService;

    @Autowired
    private SeatAllocationService seatAllocationService;

    @Autowired
    private FlightScheduleService flightScheduleService;

    @Autowired
    private FlightQueryService flightQueryService;

    @Autowired
    private BookingHistoryService bookingHistoryService;

    @Autowired
    private AircraftRepository aircraftRepository;

    @Autowired
    private FlightRouteRepository flightRouteRepository;

    @Autowired
    private FlightRepository flightRepository;

    @Autowired
    private SeatRepository seatRepository;

    @Autowired
    private TicketRepository ticketRepository;

    @AfterEach
    void tearDown() {
        ticketRepository.deleteAll();
        seatRepository.deleteAll();
        flightRepository.deleteAll();
        flightRouteRepository.deleteAll();
        aircraftRepository.deleteAll();
    }

    private Flight scheduleFlight(int flightNumber, int capacity, String overbooking) {
        aircraftRepository.save(Aircraft.builder().aircraftId(flightNumber).capacity(capacity).build());
        flightScheduleService.scheduleRoute(FlightRouteRequest.builder()
                .flightNumber(flightNumber)
                .departureCity("Vienna")
                .destinationCity("Prague")
                .departureTime(LocalTime.of(8, 0))
                .arrivalTime(LocalTime.of(9, 0))
                .aircraftId(flightNumber)
                .overbooking(new BigDecimal(overbooking))
                .startDate(DATE)
                .endDate(DATE)
                .build());
        return reload(flightNumber);
    }

    private Flight reload(int flightNumber) {
        return flightRepository.findByFlightNumberAndFlightDate(flightNumber, DATE).orElseThrow();
    }

    private BookingRequest request(Integer preferredSeat, int... flightNumbers) {
        List<FlightBookingRequest> legs = Arrays.stream(flightNumbers)
                .mapToObj(n -> FlightBookingRequest.builder()
                        .flightNumber(n)
                        .flightDate(DATE)
                        .preferredSeat(preferredSeat)
                        .build())
                .toList();
        return BookingRequest.builder().flights(legs).build();
    }

    /**
     * Starts one thread per customer id at the same instant and counts how many calls return normally.
     */
    private int runConcurrently(int callers, LongConsumer call, AtomicInteger businessRejections) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(callers);
        AtomicInteger successes = new AtomicInteger();

        for (int i = 1; i <= callers; i++) {
            long customerId = 1_000L + i;
            executor.submit(() -> {
                try {
                    start.await();
                    call.accept(customerId);
                    successes.incrementAndGet();
                } catch (BookingException e) {
                    businessRejections.incrementAndGet();
                } catch (Exception e) {
                    log.error("Unexpected failure: customerId={}", customerId, e);
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertThat(done.await(60, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        return successes.get();
    }

    @Test
    @DisplayName("Ten callers for the last ticket: exactly one wins")
    void lastTicket_TenCallers_OneWins() throws InterruptedException {
        Flight flight = scheduleFlight(501, 1, "0.00");
        int versionBefore = flight.getVersion();
        AtomicInteger rejected = new AtomicInteger();

        int booked = runConcurrently(10,
                customerId -> bookingService.bookTickets(customerId, request(null, 501)), rejected);

        assertThat(booked).isEqualTo(1);
        assertThat(rejected).hasValue(9);
        assertThat(reload(501).getAvailableTickets()).isZero();
        assertThat(reload(501).getVersion()).isEqualTo(versionBefore + 1);
        assertThat(ticketRepository.countByFlightId(flight.getId())).isEqualTo(1);
    }

    @Test
    @DisplayName("Twenty callers for five tickets: exactly five win")
    void fiveTickets_TwentyCallers_FiveWin() throws InterruptedException {
        Flight flight = scheduleFlight(502, 5, "0.00");
        int versionBefore = flight.getVersion();
        AtomicInteger rejected = new AtomicInteger();

        int booked = runConcurrently(20,
                customerId -> bookingService.bookTickets(customerId, request(null, 502)), rejected);

        assertThat(booked).isEqualTo(5);
        assertThat(rejected).hasValue(15);
        assertThat(reload(502).getAvailableTickets()).isZero();
        assertThat(reload(502).getVersion()).isEqualTo(versionBefore + 5);
        assertThat(ticketRepository.countByFlightId(flight.getId())).isEqualTo(5);
    }

    @Test
    @DisplayName("Ten ticket holders race for seat 1: exactly one gets it")
    void seatOne_TenTicketHolders_OneSeated() throws InterruptedException {
        Flight flight = scheduleFlight(503, 10, "0.00");
        for (int i = 1; i <= 10; i++) {
            bookingService.bookTickets(1_000L + i, request(null, 503));
        }
        SeatBookingRequest seatOne = SeatBookingRequest.builder()
                .flightNumber(503)
                .flightDate(DATE)
                .seatNumber(1)
                .build();
        AtomicInteger rejected = new AtomicInteger();

        int seated = runConcurrently(10, customerId -> bookingService.bookSeat(customerId, seatOne), rejected);

        assertThat(seated).isEqualTo(1);
        assertThat(rejected).hasValue(9);
        assertThat(ticketRepository.findByFlightIdAndSeatNumber(flight.getId(), 1)).hasSize(1);
        assertThat(seatRepository.findById(new SeatId(flight.getId(), 1)))
                .hasValueSatisfying(seat -> assertThat(seat.getStatus()).isEqualTo(SeatStatus.BOOKED));
        assertThat(flightQueryService.getAvailableSeats(503, DATE).getAvailableSeats())
                .doesNotContain(1)
                .hasSize(9);
    }

    @Test
    @DisplayName("A two-leg booking whose second leg is full leaves the first leg untouched")
    void twoLegs_SecondFull_FirstLegRestored() {
        Flight first = scheduleFlight(504, 5, "0.00");
        scheduleFlight(505, 1, "0.00");
        bookingService.bookTickets(2L, request(null, 505));

        assertThatThrownBy(() -> bookingService.bookTickets(1L, request(null, 504, 505)))
                .isInstanceOf(BookingValidationException.class)
                .hasMessageStartingWith(ValidationMessages.BOOKING_FAILED)
                .hasMessageContaining(ValidationMessages.FLIGHT_FULLY_BOOKED);

        assertThat(reload(504).getAvailableTickets()).isEqualTo(5);
        assertThat(ticketRepository.existsByCustomerIdAndFlightId(1L, first.getId())).isFalse();
        assertThat(bookingHistoryService.getHistory(1L).getFlights()).isEmpty();
    }

    @Test
    @DisplayName("Compensation also frees the preferred seat of the undone leg")
    void twoLegs_SecondFull_FirstLegSeatFreed() {
        Flight first = scheduleFlight(506, 5, "0.00");
        scheduleFlight(507, 1, "0.00");
        bookingService.bookTickets(2L, request(null, 507));

        assertThatThrownBy(() -> bookingService.bookTickets(1L, request(3, 506, 507)))
                .isInstanceOf(BookingValidationException.class);

        assertThat(seatRepository.findById(new SeatId(first.getId(), 3)))
                .hasValueSatisfying(seat -> assertThat(seat.getStatus()).isEqualTo(SeatStatus.AVAILABLE));
    }

    @Test
    @DisplayName("Releasing a ticket twice restores the quota once")
    void release_Twice_RestoresQuotaOnce() {
        scheduleFlight(508, 3, "0.00");
        BookingEntry entry = bookingService.bookTickets(1L, request(null, 508));
        Long ticketId = entry.getFlightBookings().get(0).getTicketId();
        assertThat(reload(508).getAvailableTickets()).isEqualTo(2);

        ticketAllocationService.release(ticketId);
        assertThatThrownBy(() -> ticketAllocationService.release(ticketId))
                .isInstanceOf(TicketNotFoundException.class);

        assertThat(reload(508).getAvailableTickets()).isEqualTo(3);
    }

    @Test
    @DisplayName("Booking the same flight twice is rejected and consumes nothing")
    void rebook_SameFlight_Rejected() {
        scheduleFlight(509, 3, "0.00");
        bookingService.bookTickets(1L, request(null, 509));

        assertThatThrownBy(() -> bookingService.bookTickets(1L, request(null, 509)))
                .isInstanceOf(BookingValidationException.class)
                .hasMessageContaining(ValidationMessages.DUPLICATE_BOOKING);

        assertThat(reload(509).getAvailableTickets()).isEqualTo(2);
    }

    @Test
    @DisplayName("Overbooked flights sell more tickets than seats")
    void overbooking_MoreTicketsThanSeats() throws InterruptedException {
        Flight flight = scheduleFlight(510, 2, "0.50");
        assertThat(flight.getAvailableTickets()).isEqualTo(3);
        AtomicInteger rejected = new AtomicInteger();

        int booked = runConcurrently(6,
                customerId -> bookingService.bookTickets(customerId, request(null, 510)), rejected);

        assertThat(booked).isEqualTo(3);
        assertThat(bookingHistoryService.getHistory(1_001L).getFlights().size()
                + bookingHistoryService.getHistory(1_002L).getFlights().size()
                + bookingHistoryService.getHistory(1_003L).getFlights().size()
                + bookingHistoryService.getHistory(1_004L).getFlights().size()
                + bookingHistoryService.getHistory(1_005L).getFlights().size()
                + bookingHistoryService.getHistory(1_006L).getFlights().size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Cancelling a seated ticket returns both ticket and seat")
    void cancel_SeatedTicket_ReturnsTicketAndSeat() {
        Flight flight = scheduleFlight(511, 2, "0.00");
        BookingEntry entry = bookingService.bookTickets(1L, request(2, 511));
        assertThat(entry.getFlightBookings().get(0).getSeatNumber()).isEqualTo(2);

        bookingService.cancelTicket(1L, entry.getFlightBookings().get(0).getTicketId());

        assertThat(reload(511).getAvailableTickets()).isEqualTo(2);
        assertThat(seatRepository.findById(new SeatId(flight.getId(), 2)))
                .hasValueSatisfying(seat -> assertThat(seat.getStatus()).isEqualTo(SeatStatus.AVAILABLE));
    }

    @Test
    @DisplayName("Search only returns flights with tickets left")
    void search_SoldOutFlightHidden() {
        scheduleFlight(512, 1, "0.00");
        assertThat(flightQueryService.searchFlights("Vienna", "Prague", DATE, null).getFlights()).hasSize(1);

        bookingService.bookTickets(1L, request(null, 512));

        assertThat(flightQueryService.searchFlights("Vienna", "Prague", DATE, null).getFlights()).isEmpty();
    }

    @Test
    @DisplayName("A taken seat does not block the ticket")
    void preferredSeatTaken_TicketStillIssued() {
        scheduleFlight(513, 3, "0.00");
        bookingService.bookTickets(1L, request(1, 513));

        BookingEntry entry = bookingService.bookTickets(2L, request(1, 513));

        assertThat(entry.getBookingStatus()).startsWith("Confirmed booking, however");
        assertThat(entry.getFlightBookings().get(0).getSeatNumber()).isNull();
        assertThat(reload(513).getAvailableTickets()).isEqualTo(1);
        assertThatThrownBy(() -> bookingService.bookSeat(2L, SeatBookingRequest.builder()
                .flightNumber(513).flightDate(DATE).seatNumber(1).build()))
                .isInstanceOf(SeatConflictException.class);
    }

    @Test
    @DisplayName("A seat claim by a customer without a ticket leaves the seat free")
    void assign_CustomerWithoutTicket_SeatStaysAvailable() {
        Flight flight = scheduleFlight(514, 3, "0.00");

        assertThatThrownBy(() -> seatAllocationService.assign(4242L, flight.getId(), 1, null))
                .isInstanceOf(InvalidBookingRequestException.class)
                .hasMessage(ValidationMessages.NO_TICKET_FOR_FLIGHT);

        assertThat(seatRepository.findById(new SeatId(flight.getId(), 1)))
                .hasValueSatisfying(seat -> assertThat(seat.getStatus()).isEqualTo(SeatStatus.AVAILABLE));
        assertThat(ticketRepository.findByFlightIdAndSeatNumber(flight.getId(), 1)).isEmpty();
    }

    @Test
    @DisplayName("Cancelling after a seat move frees the seat the ticket moved to")
    void cancel_AfterSeatMove_FreesCurrentSeat() {
        Flight flight = scheduleFlight(515, 3, "0.00");
        BookingEntry entry = bookingService.bookTickets(1L, request(1, 515));
        bookingService.bookSeat(1L, SeatBookingRequest.builder()
                .flightNumber(515).flightDate(DATE).seatNumber(2).build());
        bookingService.bookTickets(2L, request(1, 515));

        bookingService.cancelTicket(1L, entry.getFlightBookings().get(0).getTicketId());

        assertThat(seatRepository.findById(new SeatId(flight.getId(), 2)))
                .hasValueSatisfying(seat -> assertThat(seat.getStatus()).isEqualTo(SeatStatus.AVAILABLE));
        assertThat(seatRepository.findById(new SeatId(flight.getId(), 1)))
                .hasValueSatisfying(seat -> assertThat(seat.getStatus()).isEqualTo(SeatStatus.BOOKED));
        assertThat(ticketRepository.findByFlightIdAndSeatNumber(flight.getId(), 1)).hasSize(1);
    }
}
