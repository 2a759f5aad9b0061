package com.airlinereservation.booking.service;

import com.airlinereservation.booking.constants.BookingConstants;
import com.airlinereservation.booking.constants.ValidationMessages;
import com.airlinereservation.booking.dto.FlightRouteRequest;
import com.airlinereservation.booking.dto.FlightScheduleEntry;
import com.airlinereservation.booking.exception.BookingValidationException;
import com.airlinereservation.booking.exception.AircraftNotFoundException;
import com.airlinereservation.booking.exception.InvalidBookingRequestException;
import com.airlinereservation.booking.model.Aircraft;
import com.airlinereservation.booking.model.Flight;
import com.airlinereservation.booking.model.FlightRoute;
import com.airlinereservation.booking.model.Seat;
import com.airlinereservation.booking.repository.AircraftRepository;
import com.airlinereservation.booking.repository.FlightRepository;
import com.airlinereservation.booking.repository.FlightRouteRepository;
import com.airlinereservation.booking.repository.SeatRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Registers a route and materialises its dated flights and seat maps.
 * <p>
 * Each flight gets {@code ceil(capacity * (1 + overbooking))} tickets and one AVAILABLE seat
 * per unit of aircraft capacity, so with overbooking there are more tickets than seats.
 */
@Service
@Slf4j
public class FlightScheduleService {

    private final FlightRouteRepository flightRouteRepository;
    private final FlightRepository flightRepository;
    private final SeatRepository seatRepository;
    private final AircraftRepository aircraftRepository;
    private final MeterRegistry meterRegistry;

    private final int defaultHorizonDays;

    public FlightScheduleService(
            FlightRouteRepository flightRouteRepository,
            FlightRepository flightRepository,
            SeatRepository seatRepository,
            AircraftRepository aircraftRepository,
            MeterRegistry meterRegistry,
            @Value("${booking.schedule.default-horizon-days:" + BookingConstants.DEFAULT_SCHEDULE_HORIZON_DAYS + "}")
            int defaultHorizonDays) {
        this.flightRouteRepository = flightRouteRepository;
        this.flightRepository = flightRepository;
        this.seatRepository = seatRepository;
        this.aircraftRepository = aircraftRepository;
        this.meterRegistry = meterRegistry;
        this.defaultHorizonDays = defaultHorizonDays;
    }

    @Transactional
    public FlightScheduleEntry scheduleRoute(FlightRouteRequest request) {
        validate(request);

        Aircraft aircraft = aircraftRepository.findById(request.getAircraftId())
                .orElseThrow(() -> new AircraftNotFoundException(request.getAircraftId()));

        if (flightRouteRepository.existsById(request.getFlightNumber())
                || flightRepository.existsByFlightNumber(request.getFlightNumber())) {
            throw new BookingValidationException("Flight route already exists: " + request.getFlightNumber());
        }

        // Rounded to the column's scale so the stored route and the flight quotas agree
        BigDecimal overbooking = (request.getOverbooking() != null ? request.getOverbooking() : BigDecimal.ZERO)
                .setScale(BookingConstants.OVERBOOKING_SCALE, RoundingMode.HALF_UP);
        LocalDate endDate = request.getEndDate() != null
                ? request.getEndDate()
                : request.getStartDate().plusDays(defaultHorizonDays - 1L);

        flightRouteRepository.save(FlightRoute.builder()
                .flightNumber(request.getFlightNumber())
                .departureCity(request.getDepartureCity())
                .destinationCity(request.getDestinationCity())
                .departureTime(request.getDepartureTime())
                .arrivalTime(request.getArrivalTime())
                .aircraftId(aircraft.getAircraftId())
                .overbooking(overbooking)
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .build());

        int capacity = aircraft.getCapacity();
        int availableTickets = ticketQuota(capacity, overbooking);

        int flightsCreated = 0;
        for (LocalDate date = request.getStartDate(); !date.isAfter(endDate); date = date.plusDays(1)) {
            Flight flight = flightRepository.save(Flight.builder()
                    .flightNumber(request.getFlightNumber())
                    .flightDate(date)
                    .availableTickets(availableTickets)
                    .version(BookingConstants.INITIAL_FLIGHT_VERSION)
                    .build());
            seatRepository.saveAll(seatMap(flight.getId(), capacity));
            flightsCreated++;
        }

        meterRegistry.counter("booking.schedule.flights.created").increment(flightsCreated);
        log.info("Route scheduled: flightNumber={}, {} -> {}, from={}, to={}, flights={}, seats={}, tickets={}",
                request.getFlightNumber(), request.getDepartureCity(), request.getDestinationCity(),
                request.getStartDate(), endDate, flightsCreated, capacity, availableTickets);

        return FlightScheduleEntry.builder()
                .flightNumber(request.getFlightNumber())
                .startDate(request.getStartDate())
                .endDate(endDate)
                .flightsCreated(flightsCreated)
                .seatsPerFlight(capacity)
                .availableTicketsPerFlight(availableTickets)
                .build();
    }

    static int ticketQuota(int capacity, BigDecimal overbooking) {
        return BigDecimal.valueOf(capacity)
                .multiply(BigDecimal.ONE.add(overbooking))
                .setScale(0, RoundingMode.CEILING)
                .intValueExact();
    }

    private List<Seat> seatMap(Long flightId, int capacity) {
        List<Seat> seats = new ArrayList<>(capacity);
        for (int seatNumber = BookingConstants.FIRST_SEAT_NUMBER; seatNumber <= capacity; seatNumber++) {
            seats.add(Seat.builder()
                    .flightId(flightId)
                    .seatNumber(seatNumber)
                    .version(BookingConstants.INITIAL_SEAT_VERSION)
                    .build());
        }
        return seats;
    }

    private void validate(FlightRouteRequest request) {
        if (request == null) {
            throw new InvalidBookingRequestException(ValidationMessages.BOOKING_REQUEST_REQUIRED);
        }
        if (request.getFlightNumber() == null) {
            throw new InvalidBookingRequestException(ValidationMessages.FLIGHT_NUMBER_REQUIRED);
        }
        if (request.getAircraftId() == null) {
            throw new InvalidBookingRequestException(ValidationMessages.AIRCRAFT_ID_REQUIRED);
        }
        if (request.getStartDate() == null) {
            throw new InvalidBookingRequestException(ValidationMessages.START_DATE_REQUIRED);
        }
        if (request.getEndDate() != null && request.getEndDate().isBefore(request.getStartDate())) {
            throw new InvalidBookingRequestException(ValidationMessages.END_DATE_BEFORE_START);
        }
        if (request.getOverbooking() != null && request.getOverbooking().signum() < 0) {
            throw new InvalidBookingRequestException(ValidationMessages.OVERBOOKING_NON_NEGATIVE);
        }
        if (request.getDepartureCity() != null
                && request.getDepartureCity().equalsIgnoreCase(request.getDestinationCity())) {
            throw new InvalidBookingRequestException(ValidationMessages.SOURCE_DESTINATION_SAME);
        }
    }
}
