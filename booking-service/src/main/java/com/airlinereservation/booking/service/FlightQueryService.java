package com.airlinereservation.booking.service;

import com.airlinereservation.booking.constants.ValidationMessages;
import com.airlinereservation.booking.dto.AvailableSeatsResponse;
import com.airlinereservation.booking.dto.FlightEntry;
import com.airlinereservation.booking.dto.FlightSearchResponse;
import com.airlinereservation.booking.enums.SeatStatus;
import com.airlinereservation.booking.exception.FlightNotFoundException;
import com.airlinereservation.booking.exception.InvalidBookingRequestException;
import com.airlinereservation.booking.model.Flight;
import com.airlinereservation.booking.repository.FlightRepository;
import com.airlinereservation.booking.repository.SeatRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only flight lookups. Results reflect committed state at query time and may be stale
 * by the time a booking is attempted; the allocators re-check everything.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FlightQueryService {

    private final FlightRepository flightRepository;
    private final SeatRepository seatRepository;

    @Transactional(readOnly = true)
    public FlightSearchResponse searchFlights(String departureCity, String destinationCity,
                                              LocalDate departureDate, LocalDate endDate) {
        if (isBlank(departureCity) || isBlank(destinationCity)) {
            throw new InvalidBookingRequestException(ValidationMessages.CITY_REQUIRED);
        }
        if (departureDate == null) {
            throw new InvalidBookingRequestException(ValidationMessages.DEPARTURE_DATE_REQUIRED);
        }

        LocalDate rangeEnd = endDate != null ? endDate : departureDate;
        if (rangeEnd.isBefore(departureDate)) {
            throw new InvalidBookingRequestException(ValidationMessages.END_DATE_BEFORE_START);
        }

        List<FlightEntry> flights = flightRepository.searchAvailableFlights(
                departureCity, destinationCity, departureDate, rangeEnd);

        log.info("Flight search: {} -> {}, from={}, to={}, results={}",
                departureCity, destinationCity, departureDate, rangeEnd, flights.size());
        return FlightSearchResponse.builder()
                .flights(flights)
                .build();
    }

    @Transactional(readOnly = true)
    public AvailableSeatsResponse getAvailableSeats(Integer flightNumber, LocalDate flightDate) {
        Flight flight = flightRepository.findByFlightNumberAndFlightDate(flightNumber, flightDate)
                .orElseThrow(() -> new FlightNotFoundException(flightNumber, flightDate));

        List<Integer> seats = seatRepository.findSeatNumbersByStatus(flight.getId(), SeatStatus.AVAILABLE);

        log.debug("Available seats: flightId={}, count={}", flight.getId(), seats.size());
        return AvailableSeatsResponse.builder()
                .availableSeats(seats)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
